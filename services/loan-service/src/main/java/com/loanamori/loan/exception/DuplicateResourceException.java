package com.loanamori.loan.exception;

/**
 * Exception thrown when a unique username, email or share grant already exists
 */
public class DuplicateResourceException extends InvalidRequestException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
