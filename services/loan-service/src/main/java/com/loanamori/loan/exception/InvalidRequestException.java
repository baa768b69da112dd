package com.loanamori.loan.exception;

/**
 * Exception thrown for requests that are well-formed but not acceptable
 */
public class InvalidRequestException extends LoanServiceException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
