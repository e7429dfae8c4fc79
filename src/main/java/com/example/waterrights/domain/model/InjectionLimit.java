package com.example.waterrights.domain.model;

/**
 * Permitted amount of a substance, used by the departments B, C and F.
 */
public record InjectionLimit(String substance, Quantity quantity) {
}
