package com.loanamori.loan.exception;

/**
 * Base exception for loan service
 */
public class LoanServiceException extends RuntimeException {

    public LoanServiceException(String message) {
        super(message);
    }

    public LoanServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
