package org.javai.formula.schema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Orders the distinct values of a categorical column.
 *
 * <p>Numbers of any class sort by numeric value. Strings, characters, booleans and
 * constants of one enum sort by their natural order when every level has the same
 * type. Any other mix keeps first-occurrence order. {@code null} is never a level.
 * The order fixes which level is the base and which column each level codes, so it
 * is deterministic for a given column.
 */
public final class Levels {

    private Levels() {
    }

    public static List<Object> of(Iterable<?> values) {
        Set<Object> distinct = new LinkedHashSet<>();
        for (Object value : values) {
            if (value != null) {
                distinct.add(value);
            }
        }
        List<Object> levels = new ArrayList<>(distinct);
        if (!levels.isEmpty()) {
            comparator(levels).ifPresent(levels::sort);
        }
        return levels;
    }

    private static Optional<Comparator<Object>> comparator(List<Object> levels) {
        if (all(levels, Number.class)) {
            return Optional.of(Comparator.comparingDouble((Object level) -> ((Number) level).doubleValue()));
        }
        if (all(levels, String.class)) {
            return Optional.of(Comparator.comparing((Object level) -> (String) level));
        }
        if (all(levels, Character.class)) {
            return Optional.of(Comparator.comparing((Object level) -> (Character) level));
        }
        if (all(levels, Boolean.class)) {
            return Optional.of(Comparator.comparing((Object level) -> (Boolean) level));
        }
        if (levels.get(0) instanceof Enum<?> first) {
            Class<?> type = first.getDeclaringClass();
            boolean sameEnum = levels.stream()
                    .allMatch(level -> level instanceof Enum<?> e && e.getDeclaringClass() == type);
            if (sameEnum) {
                return Optional.of(Comparator.comparingInt((Object level) -> ((Enum<?>) level).ordinal()));
            }
        }
        return Optional.empty();
    }

    private static boolean all(List<Object> levels, Class<?> type) {
        return levels.stream().allMatch(type::isInstance);
    }
}
