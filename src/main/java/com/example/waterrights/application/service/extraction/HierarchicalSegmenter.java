package com.example.waterrights.application.service.extraction;

import com.example.waterrights.config.ReportParserProperties;
import com.example.waterrights.domain.exception.ReportStructureException;
import com.example.waterrights.domain.model.report.DepartmentSection;
import com.example.waterrights.domain.model.report.GroupedRecord;
import com.example.waterrights.domain.model.report.KeyValuePair;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

/**
 * Splits the key-value stream of a report into root fields, department sections with their usage
 * locations and the trailing annotation.
 * <p>
 * Trailing labels without values form the annotation. Everything before the first {@value #DEPARTMENT_KEY}
 * belongs to the root section. Each department runs until the next {@value #DEPARTMENT_KEY} and is split
 * into usage locations at every {@value #USAGE_LOCATION_KEY}.
 */
@Component
public class HierarchicalSegmenter {

    public static final String DEPARTMENT_KEY = "Abteilung:";
    public static final String USAGE_LOCATION_KEY = "Nutzungsort Lfd. Nr.:";

    private final boolean emitEmptyTrailingUsageLocation;

    @Autowired
    public HierarchicalSegmenter(ReportParserProperties properties) {
        this(properties.emitEmptyTrailingUsageLocation());
    }

    /**
     * @param emitEmptyTrailingUsageLocation whether the usage location collected last is kept even if it
     *                                       holds no pairs, which happens for departments without entries
     */
    public HierarchicalSegmenter(boolean emitEmptyTrailingUsageLocation) {
        this.emitEmptyTrailingUsageLocation = emitEmptyTrailingUsageLocation;
    }

    /**
     * @param pairs key-value pairs in reading order
     * @return segmented record
     * @throws ReportStructureException when a department does not start with {@value #DEPARTMENT_KEY}
     */
    public GroupedRecord segment(List<KeyValuePair> pairs) {
        List<KeyValuePair> remaining = new ArrayList<>(pairs);
        String annotation = extractAnnotation(remaining);

        ListIterator<KeyValuePair> iterator = remaining.listIterator();
        List<KeyValuePair> root = new ArrayList<>();
        while (iterator.hasNext()) {
            KeyValuePair next = iterator.next();
            if (DEPARTMENT_KEY.equals(next.key())) {
                iterator.previous();
                break;
            }
            root.add(next);
        }

        List<DepartmentSection> departments = new ArrayList<>();
        while (iterator.hasNext()) {
            KeyValuePair sentinel = iterator.next();
            if (!DEPARTMENT_KEY.equals(sentinel.key())) {
                throw new ReportStructureException(DEPARTMENT_KEY, sentinel.key());
            }
            departments.add(new DepartmentSection(String.join(" ", sentinel.values()), groupUsageLocations(iterator)));
        }

        return new GroupedRecord(root, departments, annotation);
    }

    /**
     * Inverse of {@link #segment(List)}: lays a grouped record out as a flat pair stream again.
     *
     * @param record segmented record
     * @return pairs that segment into an equal record
     */
    public static List<KeyValuePair> flatten(GroupedRecord record) {
        List<KeyValuePair> pairs = new ArrayList<>(record.root());
        for (DepartmentSection department : record.departments()) {
            pairs.add(KeyValuePair.of(DEPARTMENT_KEY, department.label()));
            department.usageLocations().forEach(pairs::addAll);
        }
        if (record.annotation() != null) {
            pairs.add(KeyValuePair.of(record.annotation()));
        }
        return pairs;
    }

    private static String extractAnnotation(List<KeyValuePair> pairs) {
        List<String> labels = new ArrayList<>();
        while (!pairs.isEmpty() && !pairs.get(pairs.size() - 1).hasValues()) {
            labels.add(pairs.remove(pairs.size() - 1).key());
        }
        if (labels.isEmpty()) {
            return null;
        }
        Collections.reverse(labels);
        return String.join(" ", labels);
    }

    private List<List<KeyValuePair>> groupUsageLocations(ListIterator<KeyValuePair> iterator) {
        List<List<KeyValuePair>> usageLocations = new ArrayList<>();
        List<KeyValuePair> current = new ArrayList<>();
        while (iterator.hasNext()) {
            KeyValuePair next = iterator.next();
            if (DEPARTMENT_KEY.equals(next.key())) {
                iterator.previous();
                break;
            }
            if (USAGE_LOCATION_KEY.equals(next.key()) && !current.isEmpty()) {
                usageLocations.add(current);
                current = new ArrayList<>();
            }
            current.add(next);
        }
        if (!current.isEmpty() || emitEmptyTrailingUsageLocation) {
            usageLocations.add(current);
        }
        return usageLocations;
    }
}
