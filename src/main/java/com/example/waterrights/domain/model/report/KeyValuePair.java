package com.example.waterrights.domain.model.report;

import java.util.List;

/**
 * A label and the values printed after it. An empty value list marks a dangling label.
 */
public record KeyValuePair(String key, List<String> values) {

    public KeyValuePair {
        if (key == null) {
            throw new IllegalArgumentException("Key must not be null.");
        }
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static KeyValuePair of(String key, String... values) {
        return new KeyValuePair(key, List.of(values));
    }

    public boolean hasValues() {
        return !values.isEmpty();
    }

    public String firstValue() {
        return values.isEmpty() ? null : values.get(0);
    }
}
