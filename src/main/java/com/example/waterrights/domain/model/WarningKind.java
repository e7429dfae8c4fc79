package com.example.waterrights.domain.model;

/**
 * Soft anomalies that do not stop a report from being parsed.
 */
public enum WarningKind {
    INVALID_DATE_FORMAT,
    USAGE_LOCATION_NOT_FOUND,
    MISSING_USAGE_LOCATIONS,
    WATER_RIGHT_NO_NOT_FOUND
}
