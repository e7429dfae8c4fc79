package com.example.waterrights.domain.model;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable spreadsheet rows indexed by water right number. Safe to share between worker threads.
 */
public final class CadenzaTable {

    private static final CadenzaTable EMPTY = new CadenzaTable(List.of());

    private final Map<Long, List<CadenzaRow>> rowsByNo;

    private CadenzaTable(Collection<CadenzaRow> rows) {
        this.rowsByNo = rows.stream()
                .collect(Collectors.collectingAndThen(
                        Collectors.groupingBy(CadenzaRow::no, Collectors.toUnmodifiableList()),
                        Map::copyOf));
    }

    public static CadenzaTable of(Collection<CadenzaRow> rows) {
        return rows == null || rows.isEmpty() ? EMPTY : new CadenzaTable(rows);
    }

    public static CadenzaTable empty() {
        return EMPTY;
    }

    /**
     * @param waterRightNo water right number
     * @return rows of that water right in spreadsheet order, empty when the number is unknown
     */
    public List<CadenzaRow> rowsFor(long waterRightNo) {
        return rowsByNo.getOrDefault(waterRightNo, List.of());
    }

    public int size() {
        return rowsByNo.values().stream().mapToInt(List::size).sum();
    }
}
