package com.example.waterrights.domain.model;

/**
 * A number with a measurement unit, e.g. a dam target level of {@code 12.5 m}.
 */
public record Quantity(double value, String unit) {

    @Override
    public String toString() {
        return formatNumber(value) + " " + unit;
    }

    /**
     * Prints whole numbers without a trailing {@code .0}.
     *
     * @param number value to print
     * @return compact decimal representation
     */
    static String formatNumber(double number) {
        if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < 1e15) {
            return String.valueOf((long) number);
        }
        return String.valueOf(number);
    }
}
