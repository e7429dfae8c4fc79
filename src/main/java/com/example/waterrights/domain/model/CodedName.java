package com.example.waterrights.domain.model;

/**
 * Numeric code printed next to its name, e.g. a municipal area {@code 3151003 Gifhorn}.
 */
public record CodedName(long code, String name) {
}
