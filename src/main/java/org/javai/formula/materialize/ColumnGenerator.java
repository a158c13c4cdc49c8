package org.javai.formula.materialize;

import org.javai.formula.data.Row;
import org.javai.formula.data.Table;

/**
 * Implemented by {@link org.javai.formula.CustomTerm custom terms} that produce
 * model-matrix columns.
 *
 * <p>Both methods must produce exactly {@code width()} columns, in the order of the
 * term's coefficient names.
 */
public interface ColumnGenerator {

    /**
     * The term's columns for a whole table: one array per column, each holding one
     * value per row.
     *
     * @param materializer for materializing the term's own subterms
     */
    double[][] columns(Table table, Materializer materializer);

    /**
     * The term's values for one row.
     */
    double[] row(Row row, Materializer materializer);
}
