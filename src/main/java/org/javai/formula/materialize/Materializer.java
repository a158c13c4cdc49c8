package org.javai.formula.materialize;

import org.javai.formula.CategoricalTerm;
import org.javai.formula.ConstantTerm;
import org.javai.formula.ContinuousTerm;
import org.javai.formula.CustomTerm;
import org.javai.formula.FormulaTerm;
import org.javai.formula.FunctionTerm;
import org.javai.formula.InteractionTerm;
import org.javai.formula.InterceptTerm;
import org.javai.formula.MatrixTerm;
import org.javai.formula.ShiftTerm;
import org.javai.formula.Term;
import org.javai.formula.TermTuple;
import org.javai.formula.VariableTerm;
import org.javai.formula.contrast.ContrastsMatrix;
import org.javai.formula.data.Column;
import org.javai.formula.data.Row;
import org.javai.formula.data.Table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

/**
 * Produces the numeric columns of resolved terms from data.
 *
 * <p>Every term produces exactly {@link Term#width()} columns, in the order of its
 * {@link Term#coefNames()}:
 * <ul>
 *   <li>continuous: the column's values, missing values as {@link Missing#VALUE}</li>
 *   <li>categorical: each row's level coded by the contrasts matrix row</li>
 *   <li>intercept: a column of ones, or nothing</li>
 *   <li>interaction: the row-wise Kronecker product of its subterms' columns, the
 *       last subterm varying fastest</li>
 *   <li>function: the captured transform applied row by row</li>
 *   <li>shift: its term's columns moved down (lag) or up (lead), missing where no
 *       source row exists</li>
 *   <li>matrix term or tuple: its terms' columns side by side</li>
 * </ul>
 *
 * <p>Materializers are stateless and thread-safe.
 */
public final class Materializer {

    private static final Materializer SEQUENTIAL = new Materializer(false);
    private static final Materializer PARALLEL = new Materializer(true);

    private final boolean parallel;

    private Materializer(boolean parallel) {
        this.parallel = parallel;
    }

    public static Materializer create() {
        return SEQUENTIAL;
    }

    /**
     * A materializer that produces a matrix term's children concurrently. Column
     * order is the same as sequential materialization.
     */
    public Materializer parallel() {
        return PARALLEL;
    }

    public NumericMatrix materialize(Term term, Table table) {
        return NumericMatrix.ofColumns(table.rowCount(), columns(term, table));
    }

    /**
     * The values of a term for a single row. Shifts other than by zero rows have no
     * source row and are missing.
     */
    public double[] materialize(Term term, Row row) {
        if (term instanceof ContinuousTerm continuous) {
            return new double[] {row.getDouble(continuous.name())};
        }
        if (term instanceof CategoricalTerm categorical) {
            return code(categorical, row.get(categorical.name()));
        }
        if (term instanceof InterceptTerm intercept) {
            return intercept.present() ? new double[] {1.0} : new double[0];
        }
        if (term instanceof FunctionTerm function) {
            double[] args = new double[function.argNames().size()];
            for (int i = 0; i < args.length; i++) {
                args[i] = row.getDouble(function.argNames().get(i));
            }
            return new double[] {evaluable(function).function().apply(args)};
        }
        if (term instanceof ShiftTerm shift) {
            if (shift.offset() == 0) {
                return materialize(shift.term(), row);
            }
            double[] missing = new double[shift.width()];
            Arrays.fill(missing, Missing.VALUE);
            return missing;
        }
        if (term instanceof InteractionTerm interaction) {
            double[] product = {1.0};
            for (Term t : interaction.terms()) {
                product = kronecker(product, materialize(t, row));
            }
            return product;
        }
        if (term instanceof MatrixTerm || term instanceof TermTuple) {
            List<Term> children = term instanceof MatrixTerm m ? m.terms() : ((TermTuple) term).terms();
            double[] values = new double[term.width()];
            int offset = 0;
            for (Term child : children) {
                double[] childValues = materialize(child, row);
                System.arraycopy(childValues, 0, values, offset, childValues.length);
                offset += childValues.length;
            }
            return values;
        }
        if (term instanceof CustomTerm custom) {
            return generator(custom).row(row, this);
        }
        throw unresolved(term);
    }

    /**
     * The columns of a term for a whole table, one array per column.
     */
    public double[][] columns(Term term, Table table) {
        int n = table.rowCount();
        if (term instanceof ContinuousTerm continuous) {
            return new double[][] {table.column(continuous.name()).toDoubles()};
        }
        if (term instanceof CategoricalTerm categorical) {
            return categoricalColumns(categorical, table.column(categorical.name()));
        }
        if (term instanceof InterceptTerm intercept) {
            if (!intercept.present()) {
                return new double[0][];
            }
            double[] ones = new double[n];
            Arrays.fill(ones, 1.0);
            return new double[][] {ones};
        }
        if (term instanceof FunctionTerm function) {
            return new double[][] {functionColumn(evaluable(function), table)};
        }
        if (term instanceof ShiftTerm shift) {
            double[][] source = columns(shift.term(), table);
            double[][] shifted = new double[source.length][];
            for (int j = 0; j < source.length; j++) {
                shifted[j] = shiftColumn(source[j], shift.offset());
            }
            return shifted;
        }
        if (term instanceof InteractionTerm interaction) {
            return interactionColumns(interaction, table);
        }
        if (term instanceof MatrixTerm matrix) {
            return concatenate(matrix.terms(), table, parallel);
        }
        if (term instanceof TermTuple tuple) {
            return concatenate(tuple.terms(), table, false);
        }
        if (term instanceof CustomTerm custom) {
            double[][] columns = generator(custom).columns(table, this);
            if (columns.length != custom.width()) {
                throw new IllegalStateException(custom + " generated " + columns.length
                        + " columns, expected width " + custom.width());
            }
            return columns;
        }
        throw unresolved(term);
    }

    private double[][] concatenate(List<Term> terms, Table table, boolean concurrently) {
        Stream<Term> stream = concurrently ? terms.parallelStream() : terms.stream();
        List<double[][]> blocks = stream.map(t -> columns(t, table)).toList();
        List<double[]> columns = new ArrayList<>();
        for (double[][] block : blocks) {
            columns.addAll(Arrays.asList(block));
        }
        return columns.toArray(new double[0][]);
    }

    private static double[][] categoricalColumns(CategoricalTerm term, Column column) {
        ContrastsMatrix contrasts = term.contrasts();
        int n = column.size();
        double[][] result = new double[contrasts.columns()][n];
        for (int i = 0; i < n; i++) {
            double[] codes = code(term, column.get(i));
            for (int j = 0; j < codes.length; j++) {
                result[j][i] = codes[j];
            }
        }
        return result;
    }

    private static double[] code(CategoricalTerm term, Object value) {
        if (value == null) {
            double[] missing = new double[term.width()];
            Arrays.fill(missing, Missing.VALUE);
            return missing;
        }
        ContrastsMatrix contrasts = term.contrasts();
        int level = contrasts.indexOf(value);
        double[] codes = new double[contrasts.columns()];
        for (int j = 0; j < codes.length; j++) {
            codes[j] = contrasts.get(level, j);
        }
        return codes;
    }

    private static double[] functionColumn(FunctionTerm function, Table table) {
        int n = table.rowCount();
        List<String> names = function.argNames();
        double[][] args = new double[names.size()][];
        for (int k = 0; k < args.length; k++) {
            args[k] = table.column(names.get(k)).toDoubles();
        }
        double[] values = new double[n];
        double[] rowArgs = new double[args.length];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < args.length; k++) {
                rowArgs[k] = args[k][i];
            }
            values[i] = function.function().apply(rowArgs);
        }
        return values;
    }

    /**
     * Output row i takes input row i - offset; rows without a source are missing.
     */
    static double[] shiftColumn(double[] source, int offset) {
        double[] shifted = new double[source.length];
        for (int i = 0; i < source.length; i++) {
            int from = i - offset;
            shifted[i] = from >= 0 && from < source.length ? source[from] : Missing.VALUE;
        }
        return shifted;
    }

    private double[][] interactionColumns(InteractionTerm interaction, Table table) {
        int n = table.rowCount();
        double[][] product = new double[1][n];
        Arrays.fill(product[0], 1.0);
        for (Term t : interaction.terms()) {
            double[][] factor = columns(t, table);
            double[][] next = new double[product.length * factor.length][];
            int k = 0;
            for (double[] left : product) {
                for (double[] right : factor) {
                    double[] column = new double[n];
                    for (int i = 0; i < n; i++) {
                        column[i] = left[i] * right[i];
                    }
                    next[k++] = column;
                }
            }
            product = next;
        }
        return product;
    }

    private static double[] kronecker(double[] left, double[] right) {
        double[] result = new double[left.length * right.length];
        int k = 0;
        for (double l : left) {
            for (double r : right) {
                result[k++] = l * r;
            }
        }
        return result;
    }

    private static FunctionTerm evaluable(FunctionTerm function) {
        if (!function.function().isEvaluable()) {
            throw new IllegalStateException("function " + function + " cannot be evaluated; apply a schema with a rule for "
                    + function.name());
        }
        return function;
    }

    private static ColumnGenerator generator(CustomTerm custom) {
        if (!(custom instanceof ColumnGenerator generator)) {
            throw new IllegalStateException("custom term " + custom + " does not implement ColumnGenerator");
        }
        return generator;
    }

    private static IllegalStateException unresolved(Term term) {
        if (term instanceof VariableTerm || term instanceof ConstantTerm) {
            return new IllegalStateException("cannot materialize unresolved term " + term
                    + ". Did you forget to apply a schema?");
        }
        if (term instanceof FormulaTerm) {
            return new IllegalStateException("materialize the sides of formula " + term + " separately");
        }
        return new IllegalStateException("cannot materialize " + term);
    }
}
