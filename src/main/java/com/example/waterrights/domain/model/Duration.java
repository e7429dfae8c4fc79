package com.example.waterrights.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Time base a {@link Rate} refers to, e.g. the {@code 2a} in {@code m³/2a}.
 * Equality and ordering use the rough conversion to seconds, so {@code 60s} equals {@code 1m}.
 */
public record Duration(Unit unit, double factor) implements Comparable<Duration> {

    /**
     * Supported time dimensions with their rough length in seconds.
     * Months count as 30 days and years as 365 days.
     */
    public enum Unit {
        SECONDS(1d, "s"),
        MINUTES(60d, "m"),
        HOURS(60d * 60d, "h"),
        DAYS(24d * 60d * 60d, "d"),
        WEEKS(7d * 24d * 60d * 60d, "w"),
        MONTHS(30d * 24d * 60d * 60d, "mo"),
        YEARS(365d * 24d * 60d * 60d, "a");

        private final double seconds;
        private final String code;

        Unit(double seconds, String code) {
            this.seconds = seconds;
            this.code = code;
        }

        public double seconds() {
            return seconds;
        }

        public String code() {
            return code;
        }

        /**
         * Resolves the time codes used in report units. Case matters: {@code M} is a month, {@code m} a minute.
         *
         * @param code time code such as {@code s}, {@code min}, {@code wo} or {@code y}
         * @return matching unit or empty when the code is unknown
         */
        public static Optional<Unit> fromCode(String code) {
            if (code == null) {
                return Optional.empty();
            }
            return switch (code) {
                case "s" -> Optional.of(SECONDS);
                case "m", "min" -> Optional.of(MINUTES);
                case "h" -> Optional.of(HOURS);
                case "d" -> Optional.of(DAYS);
                case "w", "wo" -> Optional.of(WEEKS);
                case "M", "mo" -> Optional.of(MONTHS);
                case "a", "y" -> Optional.of(YEARS);
                default -> Optional.empty();
            };
        }
    }

    public Duration {
        if (unit == null) {
            throw new IllegalArgumentException("Duration unit is required.");
        }
    }

    public static Duration of(Unit unit, double factor) {
        return new Duration(unit, factor);
    }

    /**
     * Rough conversion to seconds, imprecise for everything larger than weeks.
     *
     * @return length of this duration in seconds
     */
    public double asSeconds() {
        return unit.seconds() * factor;
    }

    @Override
    public int compareTo(Duration other) {
        return Double.compare(asSeconds(), other.asSeconds());
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Duration duration)) {
            return false;
        }
        return Double.compare(asSeconds(), duration.asSeconds()) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(asSeconds());
    }

    /**
     * Compact notation: the bare code for a factor of one, otherwise factor and code ({@code 2a}).
     */
    @JsonValue
    @Override
    public String toString() {
        if (Math.abs(factor - 1d) < 1e-9) {
            return unit.code();
        }
        return Quantity.formatNumber(factor) + unit.code();
    }
}
