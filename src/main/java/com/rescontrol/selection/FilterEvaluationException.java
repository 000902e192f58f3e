package com.rescontrol.selection;

public class FilterEvaluationException extends RuntimeException {

    public FilterEvaluationException(String message) {
        super(message);
    }
}
