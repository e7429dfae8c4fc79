package com.example.waterrights.domain.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * "Gemarkung, Flur": register district and field number.
 */
public record LandRecord(String district, long field) {

    private static final Pattern DISTRICT_FIELD_PATTERN = Pattern.compile("^(?<district>\\D+)\\s*(?<field>\\d+)$");

    /**
     * Parses {@code <letters><digits>} after removing all spaces.
     * Anything else yields the fallback variant holding {@code raw} unchanged.
     *
     * @param raw land record text
     * @return typed land record or the verbatim fallback
     */
    public static OrFallback<LandRecord> parse(String raw) {
        return OrFallback.of(tryParse(raw), raw);
    }

    static Optional<LandRecord> tryParse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = DISTRICT_FIELD_PATTERN.matcher(raw.replace(" ", ""));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new LandRecord(matcher.group("district"), Long.parseLong(matcher.group("field"))));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return district + field;
    }
}
