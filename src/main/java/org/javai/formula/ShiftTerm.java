package org.javai.formula;

import java.util.List;
import java.util.Objects;

/**
 * A term whose columns are shifted by a number of rows: {@code lag(x, n)} takes the
 * value n rows earlier, {@code lead(x, n)} n rows later. Rows with no source row are
 * missing; there is no wraparound. A negative step shifts the other way.
 *
 * <p>This is a structural row offset only. Callers are responsible for sorting the
 * data and spacing observations regularly.
 *
 * @param term the shifted term
 * @param steps number of rows
 * @param direction lag or lead
 */
public record ShiftTerm(Term term, int steps, Direction direction) implements Term {

    public enum Direction {
        LAG("lag"),
        LEAD("lead");

        private final String label;

        Direction(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public ShiftTerm {
        Objects.requireNonNull(term, "term must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        if (steps == Integer.MIN_VALUE) {
            throw new IllegalArgumentException("steps out of range: " + steps);
        }
    }

    public static ShiftTerm lag(Term term, int steps) {
        return new ShiftTerm(term, steps, Direction.LAG);
    }

    public static ShiftTerm lead(Term term, int steps) {
        return new ShiftTerm(term, steps, Direction.LEAD);
    }

    /**
     * Row offset of the source value: output row i reads input row i - offset.
     */
    public int offset() {
        return direction == Direction.LAG ? steps : -steps;
    }

    @Override
    public int width() {
        return term.width();
    }

    /**
     * Shifted continuous columns take a suffix, {@code x_lag2}. Shifted categorical
     * columns keep the level last, {@code lag(c, 2): b}.
     */
    @Override
    public List<String> coefNames() {
        if (term instanceof CategoricalTerm categorical) {
            String prefix = direction.label() + "(" + categorical.name() + ", " + steps + "): ";
            return categorical.contrasts().termNames().stream().map(level -> prefix + level).toList();
        }
        String suffix = "_" + direction.label() + steps;
        return term.coefNames().stream().map(name -> name + suffix).toList();
    }

    @Override
    public boolean isMatrixTerm() {
        return term.isMatrixTerm();
    }

    @Override
    public String toString() {
        return direction.label() + "(" + term + ", " + steps + ")";
    }
}
