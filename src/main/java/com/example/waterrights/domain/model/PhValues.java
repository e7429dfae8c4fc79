package com.example.waterrights.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Permitted pH range; either bound may be missing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PhValues(Double min, Double max) {

    public PhValues withMin(double value) {
        return new PhValues(value, max);
    }

    public PhValues withMax(double value) {
        return new PhValues(min, value);
    }
}
