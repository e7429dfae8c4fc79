package com.example.waterrights.application.service.parse;

import com.example.waterrights.domain.exception.FieldFormatException;
import com.example.waterrights.domain.model.report.KeyValuePair;

/**
 * First and second value of a pair after sanitizing; most fields use at most two values.
 *
 * @param key    field key
 * @param first  first value or {@code null}
 * @param second second value or {@code null}
 */
record FieldValues(String key, String first, String second) {

    static FieldValues of(KeyValuePair pair) {
        var values = pair.values();
        return new FieldValues(
                pair.key(),
                sanitize(values.isEmpty() ? null : values.get(0)),
                sanitize(values.size() < 2 ? null : values.get(1)));
    }

    /**
     * Trims the value; blank values and a lone {@code -} mean "not given".
     *
     * @param value raw value
     * @return trimmed value or {@code null}
     */
    static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() || trimmed.equals("-") ? null : trimmed;
    }

    boolean isEmpty() {
        return first == null && second == null;
    }

    String requireFirst() {
        if (first == null) {
            throw new FieldFormatException(key, "a value is required");
        }
        return first;
    }

    FieldFormatException arityMismatch() {
        return new FieldFormatException(key, "unexpected values (" + first + ", " + second + ")");
    }

    long parseLong(String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException ex) {
            throw new FieldFormatException(key, "not an integer: " + text, ex);
        }
    }

    double parseDouble(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException ex) {
            throw new FieldFormatException(key, "not a number: " + text, ex);
        }
    }
}
