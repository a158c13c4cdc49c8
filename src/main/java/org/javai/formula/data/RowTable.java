package org.javai.formula.data;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A table stored as rows. Columns are assembled on first access and typed
 * {@code Object}, so their kind is decided by inspecting the values.
 *
 * <p>Every row must have the same column names.
 */
public final class RowTable implements Table {

    private final List<Row> rows;
    private final List<String> columnNames;
    private final Map<String, Column> columns = new ConcurrentHashMap<>();

    public RowTable(List<? extends Row> rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        this.rows = List.copyOf(rows);
        Set<String> names = this.rows.isEmpty() ? Set.of() : new LinkedHashSet<>(this.rows.get(0).names());
        for (int i = 1; i < this.rows.size(); i++) {
            if (!this.rows.get(i).names().equals(names)) {
                throw new IllegalArgumentException("row " + i + " has columns " + this.rows.get(i).names()
                        + ", expected " + names);
            }
        }
        this.columnNames = List.copyOf(names);
    }

    public static RowTable of(Row... rows) {
        return new RowTable(List.of(rows));
    }

    @Override
    public List<String> columnNames() {
        return columnNames;
    }

    @Override
    public Column column(String name) {
        if (!columnNames.contains(name)) {
            throw new IllegalArgumentException("no column " + name + "; columns are " + columnNames);
        }
        return columns.computeIfAbsent(name, n -> {
            List<Object> values = new ArrayList<>(rows.size());
            for (Row row : rows) {
                values.add(row.get(n));
            }
            return new Column(n, Object.class, values);
        });
    }

    @Override
    public int rowCount() {
        return rows.size();
    }

    @Override
    public Row row(int index) {
        return rows.get(index);
    }

    @Override
    public RowTable select(int[] indices) {
        List<Row> selected = new ArrayList<>(indices.length);
        for (int index : indices) {
            selected.add(rows.get(index));
        }
        return new RowTable(selected);
    }
}
