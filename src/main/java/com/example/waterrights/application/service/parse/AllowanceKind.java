package com.example.waterrights.application.service.parse;

import java.util.List;
import java.util.Optional;

/**
 * Kinds of allowance values ("Erlaubniswert") with the labels reports print for them.
 */
public enum AllowanceKind {
    WITHDRAWAL("Entnahmemenge"),
    PUMPING("Förderleistung"),
    INJECTION("Einleitungsmenge"),
    DAM_TARGET_DEFAULT("Stauziel, bezogen auf NN"),
    DAM_TARGET_MAX("Stauziel (Höchststau), bezogen auf NN"),
    DAM_TARGET_STEADY("Stauziel (Dauerstau), bezogen auf NN"),
    WASTE_WATER_FLOW(
            "Abwasservolumenstrom, Sekunde",
            "Abwasservolumenstrom, RW, Sekunde",
            "Abwasservolumenstrom, Std.",
            "Abwasservolumenstrom, Tag",
            "Abwasservolumenstrom, Jahr",
            "Abwasservolumenstrom, RW, Jahr"),
    IRRIGATION_AREA("Beregnungsfläche"),
    RAIN_SUPPLEMENT("Zusatzregen"),
    FLUID_DISCHARGE("Ableitungsmenge"),
    PH_MIN("pH-Wert min"),
    PH_MAX("pH-Wert max");

    private final List<String> labels;

    AllowanceKind(String... labels) {
        this.labels = List.of(labels);
    }

    public List<String> labels() {
        return labels;
    }

    /**
     * @param label kind label, optionally followed by a colon
     * @return matching kind or empty for labels outside the known set
     */
    public static Optional<AllowanceKind> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = normalize(label);
        for (AllowanceKind kind : values()) {
            if (kind.labels.contains(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    static String normalize(String label) {
        String trimmed = label.trim();
        return trimmed.endsWith(":") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
    }
}
