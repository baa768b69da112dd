package com.loanamori.loan.amortization;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One month of an amortization schedule. All amounts are in cents scale.
 */
@Value
@Builder
public class ScheduleEntry {

    int month;

    // Balance left after this month's payment
    BigDecimal remainingBalance;

    BigDecimal monthlyPayment;

    BigDecimal principalPaid;

    BigDecimal interestPaid;
}
