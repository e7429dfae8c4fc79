package com.example.waterrights.domain.model;

import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Permitted amount per time base, e.g. {@code 12 m³/2a}.
 * Rates order by their time base converted to seconds, then by value and measurement unit.
 */
public record Rate(double value, String measurementUnit, Duration per) implements Comparable<Rate> {

    static final Pattern NUMBER_PATTERN = Pattern.compile("^[+-]?\\d+(\\.\\d*)?([eE][+-]?\\d+)?$");
    private static final Pattern UNIT_PATTERN =
            Pattern.compile("^(?<measurement>[^/]+)/(?<factor>[\\d.,]*)(?<time>[A-Za-z]+)$");
    // value and unit break ties so sorted sets keep every rate that shares a time base
    private static final Comparator<Rate> ORDER = Comparator.comparing(Rate::per)
            .thenComparingDouble(Rate::value)
            .thenComparing(Rate::measurementUnit);

    /**
     * Parses {@code "<value> <measurement>/[factor]<time-code>"}.
     *
     * @param text rate text as printed in the report
     * @return typed rate or empty when the text does not follow the rate grammar
     */
    public static Optional<Rate> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            return Optional.empty();
        }
        String valueText = trimmed.substring(0, space);
        String unitText = trimmed.substring(space + 1).trim();
        if (!NUMBER_PATTERN.matcher(valueText).matches()) {
            return Optional.empty();
        }
        Matcher matcher = UNIT_PATTERN.matcher(unitText);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Optional<Duration.Unit> unit = Duration.Unit.fromCode(matcher.group("time"));
        if (unit.isEmpty()) {
            return Optional.empty();
        }
        double factor = parseFactor(matcher.group("factor"));
        return Optional.of(new Rate(
                Double.parseDouble(valueText),
                matcher.group("measurement"),
                Duration.of(unit.get(), factor)));
    }

    private static double parseFactor(String factor) {
        if (factor == null || factor.isEmpty()) {
            return 1d;
        }
        try {
            return Double.parseDouble(factor.replace(',', '.'));
        } catch (NumberFormatException ex) {
            return 1d;
        }
    }

    @Override
    public int compareTo(Rate other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return Quantity.formatNumber(value) + " " + measurementUnit + "/" + per;
    }
}
