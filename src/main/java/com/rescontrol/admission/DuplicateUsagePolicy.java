package com.rescontrol.admission;

/**
 * What authorize and allocate do when a pool already holds a live usage with the requested ID.
 */
public enum DuplicateUsagePolicy {
    /** Last writer wins: the existing units are excluded from the capacity check and replaced on success. */
    REPLACE,
    /** Fail with {@link DuplicateUsageException}. */
    REJECT
}
