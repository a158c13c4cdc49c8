package org.javai.formula.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, typed column of values. Values may be {@code null} (missing).
 *
 * <p>The element type drives schema resolution: numeric element types resolve to
 * continuous terms, everything else to categorical terms. Columns typed
 * {@code Object} are inspected value by value.
 *
 * @param name the column name
 * @param elementType the declared type of the values
 * @param values the values, one per row
 */
public record Column(String name, Class<?> elementType, List<?> values) {

    public Column {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(elementType, "elementType must not be null");
        Objects.requireNonNull(values, "values must not be null");
        values = Collections.unmodifiableList(new ArrayList<>(values));
        for (Object value : values) {
            if (value != null && !elementType.isInstance(value)) {
                throw new IllegalArgumentException("column " + name + " of " + elementType.getSimpleName()
                        + " contains a " + value.getClass().getSimpleName() + ": " + value);
            }
        }
    }

    public static Column of(String name, double... values) {
        return new Column(name, Double.class, Arrays.stream(values).boxed().toList());
    }

    public static Column of(String name, int... values) {
        return new Column(name, Integer.class, Arrays.stream(values).boxed().toList());
    }

    public static Column of(String name, String... values) {
        return new Column(name, String.class, Arrays.asList(values));
    }

    public static Column of(String name, Boolean... values) {
        return new Column(name, Boolean.class, Arrays.asList(values));
    }

    public static <T> Column of(String name, Class<T> elementType, List<? extends T> values) {
        return new Column(name, elementType, values);
    }

    public int size() {
        return values.size();
    }

    public Object get(int row) {
        return values.get(row);
    }

    /**
     * A value as a double: {@code null} is NaN.
     *
     * @throws IllegalStateException if the value is not a number
     */
    public double getDouble(int row) {
        Object value = values.get(row);
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalStateException("value " + value + " at row " + row + " of column " + name + " is not numeric");
    }

    /**
     * All values as doubles, missing values as NaN.
     */
    public double[] toDoubles() {
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = getDouble(i);
        }
        return result;
    }

    /**
     * Whether the value at a row is missing: {@code null} or a NaN number.
     */
    public boolean isMissing(int row) {
        Object value = values.get(row);
        return value == null || value instanceof Double d && d.isNaN() || value instanceof Float f && f.isNaN();
    }

    /**
     * This column restricted to the given rows, in the given order.
     */
    public Column select(int[] rows) {
        List<Object> selected = new ArrayList<>(rows.length);
        for (int row : rows) {
            selected.add(values.get(row));
        }
        return new Column(name, elementType, selected);
    }
}
