package org.javai.formula.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A row backed by a map from column name to value.
 *
 * @param values the values; {@code null} values are missing
 */
public record MapRow(Map<String, Object> values) implements Row {

    public MapRow {
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * A row from alternating names and values: {@code MapRow.of("x", 1.5, "c", "a")}.
     */
    public static MapRow of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected name/value pairs, got " + namesAndValues.length + " arguments");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            values.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return new MapRow(values);
    }

    @Override
    public Set<String> names() {
        return values.keySet();
    }

    @Override
    public boolean has(String name) {
        return values.containsKey(name);
    }

    @Override
    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("row has no column " + name + "; columns are " + values.keySet());
        }
        return values.get(name);
    }
}
