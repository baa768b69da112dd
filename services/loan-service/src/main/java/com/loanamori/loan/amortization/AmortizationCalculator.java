package com.loanamori.loan.amortization;

import com.loanamori.loan.exception.InvalidMonthException;
import com.loanamori.loan.exception.LoanServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Amortization Calculator
 *
 * Computes fixed-payment (reducing balance) amortization schedules and point-in-time summaries.
 * Every monetary amount is rounded to cents with HALF_UP before it is carried into the next
 * period, and the final month always clears the remaining balance exactly. The calculator holds
 * no state and is safe to share between threads.
 */
@Component
@Slf4j
public class AmortizationCalculator {

    public static final int CURRENCY_SCALE = 2;
    public static final RoundingMode CURRENCY_ROUNDING = RoundingMode.HALF_UP;

    // Precision for the monthly rate and the annuity factor, which are not rounded to cents
    private static final MathContext RATE_CONTEXT = MathContext.DECIMAL128;

    private static final BigDecimal MONTHS_PER_YEAR_PERCENT = BigDecimal.valueOf(1200);

    /**
     * Round an amount to cents using HALF_UP (0.005 becomes 0.01)
     */
    public static BigDecimal toCents(BigDecimal value) {
        return value.setScale(CURRENCY_SCALE, CURRENCY_ROUNDING);
    }

    /**
     * Convert an annual rate in percent (5.5 for 5.5%) to a fractional monthly rate
     */
    public BigDecimal monthlyRate(BigDecimal annualRatePercent) {
        return annualRatePercent.divide(MONTHS_PER_YEAR_PERCENT, RATE_CONTEXT);
    }

    /**
     * Fixed monthly payment, rounded to cents.
     *
     * Uses P * [r(1+r)^n] / [(1+r)^n - 1], or P / n for an interest-free loan.
     */
    public BigDecimal computeMonthlyPayment(BigDecimal principal, BigDecimal monthlyRate, int termMonths) {
        if (monthlyRate.signum() == 0) {
            return principal.divide(BigDecimal.valueOf(termMonths), CURRENCY_SCALE, CURRENCY_ROUNDING);
        }

        MathContext factorContext = factorContext(monthlyRate);
        BigDecimal onePlusRPowerN = BigDecimal.ONE.add(monthlyRate, factorContext).pow(termMonths, factorContext);
        BigDecimal numerator = principal.multiply(monthlyRate).multiply(onePlusRPowerN);
        BigDecimal denominator = onePlusRPowerN.subtract(BigDecimal.ONE);

        return numerator.divide(denominator, CURRENCY_SCALE, CURRENCY_ROUNDING);
    }

    // 1 + r keeps every significant digit of r, however small r is
    private static MathContext factorContext(BigDecimal monthlyRate) {
        int leadingZeros = Math.max(0, monthlyRate.scale() - monthlyRate.precision());
        return new MathContext(RATE_CONTEXT.getPrecision() + leadingZeros + 1, RATE_CONTEXT.getRoundingMode());
    }

    public AmortizationSchedule buildSchedule(BigDecimal principal, BigDecimal annualRatePercent, int termMonths) {
        return buildSchedule(LoanParameters.of(principal, annualRatePercent, termMonths));
    }

    /**
     * Build the full month-by-month schedule.
     *
     * The last month's principal is forced to the remaining balance and its payment becomes
     * principal plus that month's interest, absorbing the rounding drift of the term.
     */
    public AmortizationSchedule buildSchedule(LoanParameters parameters) {
        int termMonths = parameters.getTermMonths();
        BigDecimal monthlyRate = monthlyRate(parameters.getAnnualRatePercent());
        BigDecimal nominalPayment = computeMonthlyPayment(parameters.getPrincipal(), monthlyRate, termMonths);

        log.debug("Building schedule: principal={}, monthlyRate={}, term={}, nominalPayment={}",
                parameters.getPrincipal(), monthlyRate, termMonths, nominalPayment);

        List<ScheduleEntry> entries = new ArrayList<>(termMonths);
        BigDecimal remaining = toCents(parameters.getPrincipal());

        for (int month = 1; month <= termMonths; month++) {
            BigDecimal interest = monthlyRate.signum() == 0
                    ? BigDecimal.ZERO.setScale(CURRENCY_SCALE)
                    : toCents(remaining.multiply(monthlyRate));
            BigDecimal principalPaid = nominalPayment.subtract(interest);
            BigDecimal payment = nominalPayment;

            if (month == termMonths || principalPaid.compareTo(remaining) > 0) {
                // Pay off exactly what is left; the payment follows the books
                principalPaid = remaining;
                payment = principalPaid.add(interest);
            }

            remaining = remaining.subtract(principalPaid);

            entries.add(ScheduleEntry.builder()
                    .month(month)
                    .remainingBalance(toCents(remaining))
                    .monthlyPayment(toCents(payment))
                    .principalPaid(toCents(principalPaid))
                    .interestPaid(toCents(interest))
                    .build());
        }

        return new AmortizationSchedule(parameters, nominalPayment, entries);
    }

    /**
     * Summarize the loan after {@code month} payments.
     *
     * @throws InvalidMonthException when month is outside {@code [0, termMonths]}
     */
    public LoanSummary summarize(AmortizationSchedule schedule, int month) {
        int termMonths = schedule.getTermMonths();
        if (month < 0 || month > termMonths) {
            throw new InvalidMonthException(month, termMonths);
        }

        BigDecimal principal = toCents(schedule.getParameters().getPrincipal());
        if (month == 0) {
            return LoanSummary.builder()
                    .month(0)
                    .currentPrincipalBalance(principal)
                    .totalPrincipalPaid(toCents(BigDecimal.ZERO))
                    .totalInterestPaid(toCents(BigDecimal.ZERO))
                    .build();
        }

        BigDecimal principalSum = BigDecimal.ZERO;
        BigDecimal interestSum = BigDecimal.ZERO;
        for (ScheduleEntry entry : schedule.getEntries().subList(0, month)) {
            principalSum = principalSum.add(entry.getPrincipalPaid());
            interestSum = interestSum.add(entry.getInterestPaid());
        }

        BigDecimal currentBalance = schedule.getEntry(month).getRemainingBalance();
        BigDecimal totalPrincipalPaid = principal.subtract(currentBalance);

        if (totalPrincipalPaid.compareTo(principalSum) != 0) {
            log.error("CRITICAL: Principal conservation broken at month {}: principal-balance={}, sum={}",
                    month, totalPrincipalPaid, principalSum);
            throw new LoanServiceException(String.format(
                    "Principal conservation broken at month %d: %s != %s", month, totalPrincipalPaid, principalSum));
        }

        return LoanSummary.builder()
                .month(month)
                .currentPrincipalBalance(currentBalance)
                .totalPrincipalPaid(toCents(totalPrincipalPaid))
                .totalInterestPaid(toCents(interestSum))
                .build();
    }
}
