package com.example.waterrights.application.service.parse;

import com.example.waterrights.domain.exception.FieldFormatException;
import com.example.waterrights.domain.model.LegalDepartment;
import com.example.waterrights.domain.model.LegalDepartmentAbbreviation;
import com.example.waterrights.domain.model.WaterRight;
import com.example.waterrights.domain.model.report.DepartmentSection;
import com.example.waterrights.domain.model.report.KeyValuePair;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns department sections into {@link LegalDepartment}s of a water right.
 * A label reads {@code "<abbreviation> [separator] <description>"}, e.g. {@code "E - Entnahme von Grundwasser"}.
 */
@Component
public class DepartmentSectionParser {

    private static final String DEPARTMENT_KEY = "Abteilung:";
    private static final Pattern SEPARATOR = Pattern.compile("^[-–—:]+$");

    private final UsageLocationParser usageLocationParser;

    public DepartmentSectionParser(UsageLocationParser usageLocationParser) {
        this.usageLocationParser = usageLocationParser;
    }

    /**
     * @param sections   department sections in report order
     * @param waterRight water right receiving the departments
     */
    public void parse(List<DepartmentSection> sections, WaterRight waterRight) {
        for (DepartmentSection section : sections) {
            LegalDepartment department = parseLabel(section.label());
            LegalDepartment target = waterRight.getLegalDepartments()
                    .computeIfAbsent(department.getAbbreviation(), abbreviation -> department);
            for (List<KeyValuePair> usageLocation : section.usageLocations()) {
                target.getUsageLocations().add(usageLocationParser.parse(usageLocation, target.getAbbreviation()));
            }
        }
    }

    static LegalDepartment parseLabel(String label) {
        String[] tokens = label.trim().split("\\s+", 2);
        if (tokens[0].isEmpty()) {
            throw new FieldFormatException(DEPARTMENT_KEY, "department is missing its abbreviation");
        }
        LegalDepartmentAbbreviation abbreviation = LegalDepartmentAbbreviation.fromText(tokens[0])
                .orElseThrow(() -> new FieldFormatException(DEPARTMENT_KEY, "unknown department '" + tokens[0] + "'"));
        String description = tokens.length > 1 ? stripSeparator(tokens[1]) : "";
        if (description.isEmpty()) {
            throw new FieldFormatException(DEPARTMENT_KEY, "department " + abbreviation + " is missing its description");
        }
        return new LegalDepartment(abbreviation, description);
    }

    private static String stripSeparator(String text) {
        String[] tokens = text.trim().split("\\s+", 2);
        if (SEPARATOR.matcher(tokens[0]).matches()) {
            return tokens.length > 1 ? tokens[1].trim() : "";
        }
        return text.trim();
    }
}
