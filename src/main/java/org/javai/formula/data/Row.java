package org.javai.formula.data;

import java.util.Set;

/**
 * A single observation: values by column name.
 */
public interface Row {

    Set<String> names();

    boolean has(String name);

    /**
     * The value of a column, or {@code null} if it is missing.
     *
     * @throws IllegalArgumentException if the row has no such column
     */
    Object get(String name);

    default double getDouble(String name) {
        Object value = get(name);
        if (value == null) {
            return Double.NaN;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalStateException("value " + value + " of " + name + " is not numeric");
    }
}
