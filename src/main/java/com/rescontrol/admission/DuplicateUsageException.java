package com.rescontrol.admission;

/**
 * Thrown under {@link DuplicateUsagePolicy#REJECT} when a pool already holds a live usage
 * with the requested ID.
 */
public class DuplicateUsageException extends RuntimeException {

    public DuplicateUsageException(String tenant, String usageId) {
        super("duplicate resource usage with id: " + tenant + ":" + usageId);
    }
}
