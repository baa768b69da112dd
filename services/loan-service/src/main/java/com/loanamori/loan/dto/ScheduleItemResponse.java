package com.loanamori.loan.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of a loan's amortization schedule as exposed over HTTP
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleItemResponse {

    private int month;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal remainingBalance;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private BigDecimal monthlyPayment;
}
