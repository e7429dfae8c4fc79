package com.example.waterrights.domain.model.report;

import java.util.List;

/**
 * Pairs following one {@code "Abteilung:"} sentinel, split into usage locations.
 *
 * @param label          joined values of the sentinel, e.g. {@code "A Entnahme von Wasser"}
 * @param usageLocations pairs of each usage location in report order
 */
public record DepartmentSection(String label, List<List<KeyValuePair>> usageLocations) {

    public DepartmentSection {
        usageLocations = usageLocations.stream().map(List::copyOf).toList();
    }
}
