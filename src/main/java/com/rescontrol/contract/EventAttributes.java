package com.rescontrol.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered bag of event attributes handed opaquely to the filter evaluator.
 *
 * Values are restricted to scalars: string, number, boolean and time ({@link Instant}).
 * Nested objects and arrays are rejected.
 */
public final class EventAttributes {

    private static final EventAttributes EMPTY = new EventAttributes(Map.of());

    private final Map<String, Object> values;

    private EventAttributes(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EventAttributes of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new ContractViolationException("event attribute names must not be blank");
            }
            if (value == null) {
                return;
            }
            if (!isScalar(value)) {
                throw new ContractViolationException(
                    "event attribute " + key + " must be a string, number, boolean or time");
            }
            copy.put(key, value);
        });
        return new EventAttributes(Collections.unmodifiableMap(copy));
    }

    public static EventAttributes empty() {
        return EMPTY;
    }

    private static boolean isScalar(Object value) {
        return value instanceof String
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Instant;
    }

    public Optional<Object> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean has(String field) {
        return values.containsKey(field);
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EventAttributes other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
