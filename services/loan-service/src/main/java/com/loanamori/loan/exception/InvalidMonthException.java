package com.loanamori.loan.exception;

import lombok.Getter;

/**
 * Thrown when a summary is requested for a month outside {@code [0, termMonths]}
 */
@Getter
public class InvalidMonthException extends LoanServiceException {

    private final int month;
    private final int termMonths;

    public InvalidMonthException(int month, int termMonths) {
        super(String.format("month must be between 0 and %d, got %d", termMonths, month));
        this.month = month;
        this.termMonths = termMonths;
    }
}
