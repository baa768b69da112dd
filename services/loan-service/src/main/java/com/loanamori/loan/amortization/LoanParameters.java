package com.loanamori.loan.amortization;

import com.loanamori.loan.exception.InvalidLoanParametersException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Immutable inputs of an amortization: principal, annual rate in percent and term in months.
 *
 * Instances can only be obtained through {@link #of(BigDecimal, BigDecimal, int)}, which rejects
 * non-positive principal, negative rate and terms shorter than one month. The principal is
 * rounded to cents once, here, so the payment, the schedule and every summary see the same amount.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class LoanParameters {

    private final BigDecimal principal;
    private final BigDecimal annualRatePercent;
    private final int termMonths;

    private LoanParameters(BigDecimal principal, BigDecimal annualRatePercent, int termMonths) {
        this.principal = principal;
        this.annualRatePercent = annualRatePercent;
        this.termMonths = termMonths;
    }

    public static LoanParameters of(BigDecimal principal, BigDecimal annualRatePercent, int termMonths) {
        if (principal == null) {
            throw new InvalidLoanParametersException("Principal cannot be null");
        }
        if (annualRatePercent == null) {
            throw new InvalidLoanParametersException("Annual interest rate cannot be null");
        }
        BigDecimal principalInCents = AmortizationCalculator.toCents(principal);
        if (principalInCents.signum() <= 0) {
            throw new InvalidLoanParametersException("Principal must be positive: " + principal);
        }
        if (annualRatePercent.signum() < 0) {
            throw new InvalidLoanParametersException("Annual interest rate cannot be negative: " + annualRatePercent);
        }
        if (termMonths < 1) {
            throw new InvalidLoanParametersException("Loan term must be positive: " + termMonths);
        }
        return new LoanParameters(principalInCents, annualRatePercent, termMonths);
    }

    public static LoanParameters of(String principal, String annualRatePercent, int termMonths) {
        return of(new BigDecimal(principal), new BigDecimal(annualRatePercent), termMonths);
    }
}
