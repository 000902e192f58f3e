package com.rescontrol.admission;

/**
 * Dry-run counterpart of {@link ResourceUnavailableException}.
 */
public class ResourceUnauthorizedException extends RuntimeException {

    public ResourceUnauthorizedException(String usageId) {
        super("resource unauthorized for usage: " + usageId);
    }
}
