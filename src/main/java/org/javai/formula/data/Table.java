package org.javai.formula.data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only tabular data: equally long named columns.
 *
 * <p>Implementations must be safe for concurrent reads; schema resolution and
 * materialization may read the same column from several threads.
 */
public interface Table {

    List<String> columnNames();

    default boolean hasColumn(String name) {
        return columnNames().contains(name);
    }

    /**
     * @throws IllegalArgumentException if there is no such column
     */
    Column column(String name);

    int rowCount();

    default Row row(int index) {
        if (index < 0 || index >= rowCount()) {
            throw new IndexOutOfBoundsException("row " + index + " of " + rowCount());
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (String name : columnNames()) {
            values.put(name, column(name).get(index));
        }
        return new MapRow(values);
    }

    /**
     * This table restricted to the given rows, in the given order.
     */
    Table select(int[] rows);
}
