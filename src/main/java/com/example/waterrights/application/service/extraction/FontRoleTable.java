package com.example.waterrights.application.service.extraction;

import com.example.waterrights.config.ReportParserProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Lookup from font resource name to {@link FontRole}. Fonts that are not listed are ignored.
 */
@Component
public class FontRoleTable {

    private final Map<String, FontRole> roles;

    @Autowired
    public FontRoleTable(ReportParserProperties properties) {
        this(properties.labelFonts(), properties.valueFonts());
    }

    FontRoleTable(Collection<String> labelFonts, Collection<String> valueFonts) {
        Map<String, FontRole> table = new HashMap<>();
        valueFonts.forEach(font -> table.put(font, FontRole.VALUE));
        labelFonts.forEach(font -> {
            FontRole previous = table.put(font, FontRole.LABEL);
            if (previous != null) {
                throw new IllegalArgumentException("Font " + font + " cannot be label and value font at once.");
            }
        });
        this.roles = Map.copyOf(table);
    }

    public static FontRoleTable of(Collection<String> labelFonts, Collection<String> valueFonts) {
        return new FontRoleTable(labelFonts, valueFonts);
    }

    public FontRole roleOf(String fontFamily) {
        if (fontFamily == null) {
            return FontRole.IGNORED;
        }
        return roles.getOrDefault(fontFamily, FontRole.IGNORED);
    }
}
