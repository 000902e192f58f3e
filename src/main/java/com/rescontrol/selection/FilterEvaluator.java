package com.rescontrol.selection;

import com.rescontrol.contract.EventAttributes;

import java.util.List;

/**
 * Decides whether an event satisfies a list of filter references.
 */
public interface FilterEvaluator {

    /**
     * @return true if every filter passes; an empty list always passes
     * @throws FilterEvaluationException if a filter reference cannot be evaluated at all
     */
    boolean matches(String tenant, EventAttributes event, List<String> filterIds);
}
