package com.loanamori.loan.amortization;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Position of a loan after a given number of monthly payments.
 */
@Value
@Builder
public class LoanSummary {

    int month;

    BigDecimal currentPrincipalBalance;

    BigDecimal totalPrincipalPaid;

    BigDecimal totalInterestPaid;
}
