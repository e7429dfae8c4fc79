package com.example.waterrights.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One legal department section of a report and the usage locations listed under it.
 */
public class LegalDepartment {

    private final LegalDepartmentAbbreviation abbreviation;
    private final String description;
    private final List<UsageLocation> usageLocations = new ArrayList<>();

    public LegalDepartment(LegalDepartmentAbbreviation abbreviation, String description) {
        this.abbreviation = abbreviation;
        this.description = description;
    }

    public LegalDepartmentAbbreviation getAbbreviation() {
        return abbreviation;
    }

    public String getDescription() {
        return description;
    }

    public List<UsageLocation> getUsageLocations() {
        return usageLocations;
    }
}
