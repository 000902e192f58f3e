package com.rescontrol.selection;

/**
 * How a {@code Blocker} pool ends the weight-ordered candidate walk.
 */
public enum BlockerPolicy {
    /** A blocker ends the walk whether it matched (kept as the last candidate) or not (dropped). */
    ALWAYS,
    /** Only a matching blocker ends the walk; a non-matching blocker is skipped. */
    MATCHED_ONLY
}
