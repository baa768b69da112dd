package com.loanamori.loan.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanSummaryResponse {

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal currentPrincipalBalance;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal totalPrincipalPaid;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal totalInterestPaid;
}
