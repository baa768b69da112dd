package com.loanamori.loan.service;

import com.loanamori.loan.amortization.AmortizationCalculator;
import com.loanamori.loan.amortization.AmortizationSchedule;
import com.loanamori.loan.amortization.LoanParameters;
import com.loanamori.loan.amortization.LoanSummary;
import com.loanamori.loan.amortization.ScheduleEntry;
import com.loanamori.loan.exception.InvalidMonthException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Amortization Service
 *
 * Entry point for schedule and summary requests. Nothing is cached: every call recomputes
 * from the given parameters, so results never depend on who owns the loan or when it was read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AmortizationService {

    private final AmortizationCalculator calculator;
    private final MeterRegistry meterRegistry;

    private Counter schedulesCounter;
    private Timer scheduleLatencyTimer;

    /**
     * Full schedule, one entry per month of the term
     */
    public List<ScheduleEntry> getSchedule(LoanParameters parameters) {
        return computeSchedule(parameters).getEntries();
    }

    /**
     * Loan position after {@code month} payments
     *
     * @throws InvalidMonthException when month is outside {@code [0, termMonths]}
     */
    public LoanSummary getSummary(LoanParameters parameters, int month) {
        if (month < 0 || month > parameters.getTermMonths()) {
            log.warn("Rejected summary month {} for term {}", month, parameters.getTermMonths());
            throw new InvalidMonthException(month, parameters.getTermMonths());
        }
        return calculator.summarize(computeSchedule(parameters), month);
    }

    private AmortizationSchedule computeSchedule(LoanParameters parameters) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            AmortizationSchedule schedule = calculator.buildSchedule(parameters);
            getSchedulesCounter().increment();
            log.debug("Computed {}-month schedule with nominal payment {}",
                    schedule.getTermMonths(), schedule.getNominalPayment());
            return schedule;
        } finally {
            sample.stop(getScheduleLatencyTimer());
        }
    }

    // Lazy initialization of metrics
    private Counter getSchedulesCounter() {
        if (schedulesCounter == null) {
            schedulesCounter = Counter.builder("loan_amortization_schedules_total")
                .description("Total number of amortization schedules computed")
                .tag("service", "loan")
                .register(meterRegistry);
        }
        return schedulesCounter;
    }

    private Timer getScheduleLatencyTimer() {
        if (scheduleLatencyTimer == null) {
            scheduleLatencyTimer = Timer.builder("loan_amortization_schedule_latency")
                .description("Latency of amortization schedule computation")
                .tag("service", "loan")
                .register(meterRegistry);
        }
        return scheduleLatencyTimer;
    }
}
