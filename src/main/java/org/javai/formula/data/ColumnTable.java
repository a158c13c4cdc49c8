package org.javai.formula.data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A table stored as columns.
 *
 * <pre>{@code
 * Table data = ColumnTable.builder()
 *         .column(Column.of("y", 1.0, 2.0, 3.0))
 *         .column(Column.of("g", "a", "b", "a"))
 *         .build();
 * }</pre>
 */
public final class ColumnTable implements Table {

    private final Map<String, Column> columns;
    private final int rowCount;

    private ColumnTable(Map<String, Column> columns) {
        this.columns = columns;
        this.rowCount = columns.isEmpty() ? 0 : columns.values().iterator().next().size();
        for (Column column : columns.values()) {
            if (column.size() != rowCount) {
                throw new IllegalArgumentException("column " + column.name() + " has " + column.size()
                        + " rows, expected " + rowCount);
            }
        }
    }

    public static ColumnTable of(Column... columns) {
        Builder builder = builder();
        for (Column column : columns) {
            builder.column(column);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    @Override
    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    @Override
    public Column column(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException("no column " + name + "; columns are " + columns.keySet());
        }
        return column;
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public ColumnTable select(int[] rows) {
        Map<String, Column> selected = new LinkedHashMap<>();
        columns.forEach((name, column) -> selected.put(name, column.select(rows)));
        return new ColumnTable(selected);
    }

    @Override
    public String toString() {
        return "ColumnTable" + new ArrayList<>(columns.keySet()) + "[" + rowCount + " rows]";
    }

    public static final class Builder {

        private final Map<String, Column> columns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder column(Column column) {
            Objects.requireNonNull(column, "column must not be null");
            if (columns.putIfAbsent(column.name(), column) != null) {
                throw new IllegalArgumentException("duplicate column " + column.name());
            }
            return this;
        }

        public ColumnTable build() {
            return new ColumnTable(new LinkedHashMap<>(columns));
        }
    }
}
