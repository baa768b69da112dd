package com.loanamori.loan.exception;

/**
 * Thrown when principal, annual rate or term cannot be amortized.
 * The engine refuses to compute rather than clamp such values.
 */
public class InvalidLoanParametersException extends LoanServiceException {

    public InvalidLoanParametersException(String message) {
        super(message);
    }
}
