package com.yourname.contentvalidation.exception;

/**
 * Caller misuse of the validation engine, reported before any provider is contacted.
 */
public class ContractViolationException extends IllegalArgumentException {

    public ContractViolationException(String message) {
        super(message);
    }
}
