package com.example.waterrights.application.service.extraction;

/**
 * Structural meaning of a font in a report: reports mark labels and values only by font.
 */
public enum FontRole {
    LABEL,
    VALUE,
    IGNORED
}
