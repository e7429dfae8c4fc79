package com.example.waterrights.domain.model.report;

import java.util.List;

/**
 * Segmented key-value stream of one report.
 *
 * @param root        pairs before the first department
 * @param departments department sections in report order
 * @param annotation  trailing labels without values, joined; {@code null} when there are none
 */
public record GroupedRecord(List<KeyValuePair> root, List<DepartmentSection> departments, String annotation) {

    public GroupedRecord {
        root = List.copyOf(root);
        departments = List.copyOf(departments);
    }
}
