package com.example.waterrights.domain.model;

/**
 * "Rechtszweck": purpose code (e.g. {@code A70}) and its description.
 */
public record LegalPurpose(String code, String name) {

    /**
     * Splits {@code "<code> <name>"} on the first space.
     *
     * @param text raw purpose text
     * @return legal purpose or {@code null} when the text has no name part
     */
    public static LegalPurpose parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            return null;
        }
        return new LegalPurpose(trimmed.substring(0, space), trimmed.substring(space + 1));
    }
}
