package com.example.conversations.util;

import jakarta.validation.ConstraintViolation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups Bean Validation violations by property path.
 */
public final class ValidationErrors {

    private ValidationErrors() {
    }

    /**
     * @return property path to its messages, properties and messages sorted for stable output
     */
    public static Map<String, List<String>> byField(Set<? extends ConstraintViolation<?>> violations) {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        violations.stream()
                .sorted(Comparator.comparing((ConstraintViolation<?> v) -> v.getPropertyPath().toString())
                        .thenComparing(ConstraintViolation::getMessage))
                .forEach(v -> errors.computeIfAbsent(v.getPropertyPath().toString(), k -> new ArrayList<>())
                        .add(v.getMessage()));
        return errors;
    }

    /**
     * Strips surrounding whitespace, keeping {@code null} as is.
     */
    public static String trimmed(String value) {
        return value == null ? null : value.strip();
    }
}
