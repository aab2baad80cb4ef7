package com.heronix.grader.model.table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.heronix.grader.exception.SchemaException;

/**
 * Immutable, ordered table of student data.
 *
 * Rows are keyed by a string identifier (a student ID once a table has been
 * normalized, the 1-based line number for raw CSV input). Columns are named and
 * ordered. A cell holds a {@link String}, a {@link Number}, or {@code null} which
 * is the absent marker: absent cells are never coerced to zero by the table.
 *
 * All transforming operations return new tables.
 */
public final class GradeTable {

    private final List<String> columns;
    private final Map<String, Map<String, Object>> rows;

    private GradeTable(List<String> columns, Map<String, Map<String, Object>> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableMap(rows);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public List<String> columns() {
        return columns;
    }

    public List<String> rowIds() {
        return List.copyOf(rows.keySet());
    }

    public int size() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public boolean hasRow(String rowId) {
        return rows.containsKey(rowId);
    }

    /**
     * Get a cell value, {@code null} when absent or when the row or column does not exist.
     */
    public Object get(String rowId, String column) {
        Map<String, Object> row = rows.get(rowId);
        return row == null ? null : row.get(column);
    }

    public boolean isAbsent(String rowId, String column) {
        return get(rowId, column) == null;
    }

    /**
     * Cell value rendered as text, {@code null} when absent.
     */
    public String getText(String rowId, String column) {
        Object value = get(rowId, column);
        return value == null ? null : value.toString();
    }

    /**
     * Unmodifiable view of one row, in column order.
     */
    public Map<String, Object> row(String rowId) {
        Map<String, Object> row = rows.get(rowId);
        if (row == null) {
            throw new IllegalArgumentException("No such row: " + rowId);
        }
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String column : columns) {
            ordered.put(column, row.get(column));
        }
        return Collections.unmodifiableMap(ordered);
    }

    public List<Object> column(String column) {
        requireColumns(List.of(column));
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows.values()) {
            values.add(row.get(column));
        }
        return Collections.unmodifiableList(values);
    }

    // ========================================================================
    // TRANSFORMATIONS
    // ========================================================================

    /**
     * Keep only the given columns, in the given order.
     *
     * @throws SchemaException if a column does not exist
     */
    public GradeTable select(List<String> selected) {
        requireColumns(selected);
        Builder builder = builder().columns(selected);
        for (Map.Entry<String, Map<String, Object>> entry : rows.entrySet()) {
            builder.row(entry.getKey());
            for (String column : selected) {
                builder.set(entry.getKey(), column, entry.getValue().get(column));
            }
        }
        return builder.build();
    }

    public GradeTable withoutColumns(Collection<String> dropped) {
        List<String> kept = columns.stream().filter(c -> !dropped.contains(c)).toList();
        return select(kept);
    }

    /**
     * Re-key the table to exactly the given row order. Rows not listed are dropped,
     * listed rows that do not exist appear with every cell absent.
     */
    public GradeTable reindex(List<String> rowIds) {
        Builder builder = builder().columns(columns);
        for (String rowId : rowIds) {
            builder.row(rowId);
            Map<String, Object> row = rows.get(rowId);
            if (row != null) {
                for (String column : columns) {
                    builder.set(rowId, column, row.get(column));
                }
            }
        }
        return builder.build();
    }

    /**
     * Rows sorted on one column. Numbers compare numerically, text lexically,
     * absent cells always sort last.
     */
    public GradeTable sortedBy(String column, boolean descending) {
        requireColumns(List.of(column));
        Comparator<Object> valueOrder = descending ? CELL_ORDER.reversed() : CELL_ORDER;
        List<String> ordered = new ArrayList<>(rows.keySet());
        ordered.sort(Comparator.comparing((String id) -> rows.get(id).get(column),
                Comparator.nullsLast(valueOrder)));
        return reindex(ordered);
    }

    private void requireColumns(Collection<String> required) {
        List<String> missing = required.stream().filter(c -> !columns.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new SchemaException("Unknown columns " + missing + " (available: " + columns + ")");
        }
    }

    private static final Comparator<Object> CELL_ORDER = (a, b) -> {
        Double x = asNumber(a);
        Double y = asNumber(b);
        if (x != null && y != null) {
            return Double.compare(x, y);
        }
        if (x != null) {
            return -1;
        }
        if (y != null) {
            return 1;
        }
        return a.toString().compareTo(b.toString());
    };

    private static Double asNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "GradeTable[" + rows.size() + " rows x " + columns + "]";
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    /**
     * Mutable builder. Column and row insertion order is preserved; adding an
     * existing column or row is a no-op.
     */
    public static final class Builder {

        private final Set<String> columns = new LinkedHashSet<>();
        private final Map<String, Map<String, Object>> rows = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder column(String column) {
            columns.add(column);
            return this;
        }

        public Builder columns(Collection<String> names) {
            columns.addAll(names);
            return this;
        }

        public Builder row(String rowId) {
            rows.computeIfAbsent(rowId, k -> new LinkedHashMap<>());
            return this;
        }

        public Builder set(String rowId, String column, Object value) {
            column(column);
            rows.computeIfAbsent(rowId, k -> new LinkedHashMap<>()).put(column, value);
            return this;
        }

        public boolean hasColumn(String column) {
            return columns.contains(column);
        }

        public boolean hasRow(String rowId) {
            return rows.containsKey(rowId);
        }

        public GradeTable build() {
            Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
            rows.forEach((id, row) -> copy.put(id, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
            return new GradeTable(new ArrayList<>(columns), copy);
        }
    }
}
