package com.rescontrol.selection;

import com.rescontrol.contract.EventAttributes;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.IntPredicate;

/**
 * Evaluates inline filters of the form {@code *<type>:<field>:<value1>;<value2>}.
 *
 * Supported types: {@code *string}, {@code *notstring}, {@code *prefix}, {@code *suffix},
 * {@code *exists}, {@code *notexists}, {@code *gt}, {@code *gte}, {@code *lt}, {@code *lte}.
 * The field may be written with the {@code ~*req.} prefix. A field missing from the event
 * fails the filter rather than the evaluation.
 */
public class InlineFilterEvaluator implements FilterEvaluator {

    private static final String REQ_PREFIX = "~*req.";

    @Override
    public boolean matches(String tenant, EventAttributes event, List<String> filterIds) {
        for (String filterId : filterIds) {
            if (!passes(event, filterId)) {
                return false;
            }
        }
        return true;
    }

    private boolean passes(EventAttributes event, String filterId) {
        if (filterId == null || !filterId.startsWith("*")) {
            throw new FilterEvaluationException("unsupported filter reference: " + filterId);
        }
        String[] parts = filterId.split(":", 3);
        if (parts.length < 2 || parts[1].isBlank()) {
            throw new FilterEvaluationException("malformed inline filter: " + filterId);
        }
        String type = parts[0];
        String field = parts[1].startsWith(REQ_PREFIX) ? parts[1].substring(REQ_PREFIX.length()) : parts[1];
        List<String> values = parts.length == 3 && !parts[2].isEmpty()
            ? Arrays.asList(parts[2].split(";"))
            : List.of();
        Optional<Object> actual = event.get(field);

        return switch (type) {
            case "*exists" -> actual.isPresent();
            case "*notexists" -> actual.isEmpty();
            case "*string" -> actual.map(v -> values.contains(asString(v))).orElse(false);
            case "*notstring" -> actual.map(v -> !values.contains(asString(v))).orElse(true);
            case "*prefix" -> actual.map(v -> values.stream().anyMatch(asString(v)::startsWith)).orElse(false);
            case "*suffix" -> actual.map(v -> values.stream().anyMatch(asString(v)::endsWith)).orElse(false);
            case "*gt" -> compareAll(actual, values, filterId, c -> c > 0);
            case "*gte" -> compareAll(actual, values, filterId, c -> c >= 0);
            case "*lt" -> compareAll(actual, values, filterId, c -> c < 0);
            case "*lte" -> compareAll(actual, values, filterId, c -> c <= 0);
            default -> throw new FilterEvaluationException("unknown filter type " + type + " in " + filterId);
        };
    }

    private boolean compareAll(Optional<Object> actual, List<String> values, String filterId,
                               IntPredicate accept) {
        if (values.isEmpty()) {
            throw new FilterEvaluationException("comparison filter without value: " + filterId);
        }
        if (actual.isEmpty()) {
            return false;
        }
        Object value = actual.get();
        for (String expected : values) {
            Integer cmp = compare(value, expected, filterId);
            if (cmp == null || !accept.test(cmp)) {
                return false;
            }
        }
        return true;
    }

    private Integer compare(Object actual, String expected, String filterId) {
        if (actual instanceof Instant time) {
            try {
                return time.compareTo(Instant.parse(expected));
            } catch (DateTimeParseException ex) {
                throw new FilterEvaluationException("invalid time " + expected + " in " + filterId);
            }
        }
        BigDecimal bound;
        try {
            bound = new BigDecimal(expected);
        } catch (NumberFormatException ex) {
            throw new FilterEvaluationException("invalid number " + expected + " in " + filterId);
        }
        BigDecimal number = toNumber(actual);
        return number == null ? null : number.compareTo(bound);
    }

    private static BigDecimal toNumber(Object value) {
        try {
            return new BigDecimal(value instanceof Number ? value.toString() : String.valueOf(value));
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    static String asString(Object value) {
        if (value instanceof Number) {
            BigDecimal number = toNumber(value);
            return number == null ? value.toString() : number.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }
}
