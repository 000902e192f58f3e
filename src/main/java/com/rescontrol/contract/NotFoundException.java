package com.rescontrol.contract;

/**
 * Nothing to act on: no pool matches the event, the tenant has no pools, or a usage ID is
 * unknown to every matching pool.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException usage(String usageId) {
        return new NotFoundException("cannot find usage record with id: " + usageId);
    }
}
