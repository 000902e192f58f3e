package com.rescontrol.contract;

/**
 * Thrown when a request does not satisfy the usage request contract
 * (missing identity fields, non-positive units, unsupported attribute kinds).
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
