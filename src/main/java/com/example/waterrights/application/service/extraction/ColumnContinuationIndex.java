package com.example.waterrights.application.service.extraction;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers, per truncated {@code x} column, the latest entry printed in that column.
 * Used to attach value fragments that continue on the next page without a label of their own.
 *
 * @param <T> entry type
 */
public class ColumnContinuationIndex<T> {

    private final Map<Integer, T> latestByColumn = new HashMap<>();

    /**
     * Records {@code entry} as the latest one of {@code column}. Blocks without a position are not indexed.
     *
     * @param column truncated {@code x} or {@code null}
     * @param entry  entry printed in that column
     */
    public void register(Integer column, T entry) {
        if (column != null) {
            latestByColumn.put(column, entry);
        }
    }

    /**
     * @param column truncated {@code x} or {@code null}
     * @return latest entry of that column, empty when nothing was printed there yet
     */
    public Optional<T> lookup(Integer column) {
        if (column == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(latestByColumn.get(column));
    }

    public int size() {
        return latestByColumn.size();
    }
}
