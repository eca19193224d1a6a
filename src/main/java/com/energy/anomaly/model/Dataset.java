package com.energy.anomaly.model;

import com.energy.anomaly.exception.DataException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Row-ordered table of named fields, supplied by the loader and read-only for the engine.
 *
 * Numeric cells hold a {@link Number} or null (missing). Timestamp cells hold whatever the
 * loader produced (Instant, LocalDateTime, epoch millis, ISO string); they are parsed lazily.
 */
public final class Dataset {

    private final List<DatasetColumn> columns;
    private final List<Map<String, Object>> rows;

    private Dataset(List<DatasetColumn> columns, List<Map<String, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static Dataset of(List<DatasetColumn> columns, List<Map<String, Object>> rows) {
        if (columns == null || columns.isEmpty()) {
            throw new DataException("Dataset has no columns");
        }
        List<DatasetColumn> cols = List.copyOf(columns);
        List<Map<String, Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (int i = 0; i < rows.size(); i++) {
                Map<String, Object> row = rows.get(i);
                if (row == null) {
                    throw new DataException("Row " + i + " is null");
                }
                // LinkedHashMap tolerates null cells, Map.copyOf does not
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
        }
        return new Dataset(cols, Collections.unmodifiableList(copy));
    }

    public List<DatasetColumn> getColumns() {
        return columns;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public Optional<DatasetColumn> findColumn(String name) {
        return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
    }

    public List<String> columnNames(ColumnType type) {
        return columns.stream()
                .filter(c -> c.getType() == type)
                .map(DatasetColumn::getName)
                .toList();
    }

    public Object value(int row, String column) {
        return rows.get(row).get(column);
    }
}
