package com.rescontrol.admission;

/**
 * No matching pool had room for an allocation. Nothing was recorded.
 */
public class ResourceUnavailableException extends RuntimeException {

    public ResourceUnavailableException(String usageId) {
        super("resource unavailable for usage: " + usageId);
    }
}
