package com.loanamori.loan.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Loan Registration Limits
 *
 * CONFIGURATION:
 * loan:
 *   max-term-months: 1200
 *   max-principal: 100000000.00
 */
@Data
@Validated
@ConfigurationProperties(prefix = "loan")
public class LoanProperties {

    /**
     * Longest term, in months, accepted when a loan is registered
     */
    @Min(1)
    private int maxTermMonths = 1200;

    /**
     * Largest principal accepted when a loan is registered
     */
    @NotNull
    @DecimalMin(value = "0.01")
    private BigDecimal maxPrincipal = new BigDecimal("100000000.00");
}
