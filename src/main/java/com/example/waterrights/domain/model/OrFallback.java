package com.example.waterrights.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;
import java.util.Optional;

/**
 * A typed value or, when the report text does not follow the expected grammar, the original text.
 * Both variants are regular values: real reports contain plenty of free-form entries.
 *
 * @param <T> expected type
 */
public sealed interface OrFallback<T> permits OrFallback.Expected, OrFallback.Fallback {

    /**
     * The text matched its grammar.
     */
    record Expected<T>(@JsonValue T value) implements OrFallback<T> {
        public Expected {
            if (value == null) {
                throw new IllegalArgumentException("Expected value must not be null.");
            }
        }

        @Override
        public String text() {
            return value.toString();
        }
    }

    /**
     * The text did not match; kept verbatim.
     */
    record Fallback<T>(@JsonValue String raw) implements OrFallback<T> {
        public Fallback {
            if (raw == null) {
                throw new IllegalArgumentException("Fallback text must not be null.");
            }
        }

        @Override
        public String text() {
            return raw;
        }
    }

    static <T> OrFallback<T> expected(T value) {
        return new Expected<>(value);
    }

    static <T> OrFallback<T> fallback(String raw) {
        return new Fallback<>(raw);
    }

    /**
     * Wraps a parse attempt, falling back to the raw text when nothing was parsed.
     *
     * @param parsed parse result
     * @param raw    text the parse attempt was made on
     * @param <T>    expected type
     * @return expected variant when {@code parsed} is present, fallback otherwise
     */
    static <T> OrFallback<T> of(Optional<T> parsed, String raw) {
        return parsed.<OrFallback<T>>map(OrFallback::expected).orElseGet(() -> fallback(raw));
    }

    /**
     * Orders expected values before fallbacks; expected values by {@code comparator}, fallbacks by text.
     *
     * @param comparator ordering of the expected values
     * @param <T>        expected type
     * @return total ordering usable for sorted sets
     */
    static <T> Comparator<OrFallback<T>> ordering(Comparator<? super T> comparator) {
        return (left, right) -> {
            if (left instanceof Expected<T> l && right instanceof Expected<T> r) {
                return comparator.compare(l.value(), r.value());
            }
            if (left instanceof Fallback<T> l && right instanceof Fallback<T> r) {
                return l.raw().compareTo(r.raw());
            }
            return left instanceof Expected<T> ? -1 : 1;
        };
    }

    /**
     * @return textual form; the verbatim text for fallbacks
     */
    String text();

    default boolean isExpected() {
        return this instanceof Expected<T>;
    }

    default Optional<T> expectedValue() {
        return this instanceof Expected<T> expected ? Optional.of(expected.value()) : Optional.empty();
    }
}
