package com.loanamori.loan.amortization;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Month-ascending schedule of a loan, one entry per month of the term with no gaps.
 */
@Value
public class AmortizationSchedule {

    LoanParameters parameters;

    /**
     * Nominal payment charged every month except where the final-month correction applies.
     */
    BigDecimal nominalPayment;

    List<ScheduleEntry> entries;

    public AmortizationSchedule(LoanParameters parameters, BigDecimal nominalPayment, List<ScheduleEntry> entries) {
        this.parameters = parameters;
        this.nominalPayment = nominalPayment;
        this.entries = List.copyOf(entries);
    }

    public int getTermMonths() {
        return parameters.getTermMonths();
    }

    /**
     * @param month 1-based month of the term
     */
    public ScheduleEntry getEntry(int month) {
        return entries.get(month - 1);
    }
}
