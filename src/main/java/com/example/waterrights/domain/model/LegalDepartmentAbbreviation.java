package com.example.waterrights.domain.model;

import java.util.Optional;

/**
 * The eight legal departments a water right's usage locations are filed under.
 */
public enum LegalDepartmentAbbreviation {
    /** Entnahme von Wasser oder Entnahmen fester Stoffe aus oberirdischen Gewässern */
    A,
    /** Einbringen und Einleiten von Stoffen in oberirdische und Küstengewässer */
    B,
    /** Aufstauen und Absenken oberirdischer Gewässer */
    C,
    /** Andere Einwirkung auf oberirdische Gewässer */
    D,
    /** Entnahme, Zutageförderung, Zutageleiten und Ableiten von Grundwasser */
    E,
    /** Andere Nutzungen und Einwirkungen auf das Grundwasser */
    F,
    /** Zwangsrechte */
    K,
    /** Fischereirechte */
    L;

    /**
     * Resolves an abbreviation exactly as printed in the report.
     *
     * @param text single letter abbreviation
     * @return department or empty for anything outside the closed set
     */
    public static Optional<LegalDepartmentAbbreviation> fromText(String text) {
        if (text == null) {
            return Optional.empty();
        }
        for (LegalDepartmentAbbreviation abbreviation : values()) {
            if (abbreviation.name().equals(text)) {
                return Optional.of(abbreviation);
            }
        }
        return Optional.empty();
    }

    /**
     * @return whether unknown allowance kinds are recorded as injection limits for this department
     */
    public boolean acceptsInjectionLimits() {
        return this == B || this == C || this == F;
    }
}
