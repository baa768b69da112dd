package com.loanamori.loan.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Loan registration request. Amount is a currency value with at most two fraction digits,
 * the rate is an annual percentage (5.5 for 5.5%).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanCreateRequest {

    @NotNull(message = "Owner user id is required")
    private UUID userId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be positive")
    @Digits(integer = 17, fraction = 2, message = "Amount must have at most two decimal places")
    private BigDecimal amount;

    @NotNull(message = "Annual interest rate is required")
    @DecimalMin(value = "0.0", message = "Annual interest rate cannot be negative")
    @Digits(integer = 3, fraction = 4, message = "Annual interest rate must have at most four decimal places")
    private BigDecimal annualInterestRate;

    @NotNull(message = "Loan term is required")
    @Min(value = 1, message = "Loan term must be at least one month")
    private Integer loanTermInMonths;
}
