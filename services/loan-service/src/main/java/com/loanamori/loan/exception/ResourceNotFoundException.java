package com.loanamori.loan.exception;

/**
 * Exception thrown when a user or loan does not exist
 */
public class ResourceNotFoundException extends LoanServiceException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException user(Object userId) {
        return new ResourceNotFoundException("User not found: " + userId);
    }

    public static ResourceNotFoundException loan(Object loanId) {
        return new ResourceNotFoundException("Loan not found: " + loanId);
    }
}
