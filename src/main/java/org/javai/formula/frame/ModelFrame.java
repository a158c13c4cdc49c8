package org.javai.formula.frame;

import org.javai.formula.FormulaTerm;
import org.javai.formula.MatrixTerm;
import org.javai.formula.Term;
import org.javai.formula.TermTuple;
import org.javai.formula.Terms;
import org.javai.formula.apply.ModelContext;
import org.javai.formula.apply.SchemaApplier;
import org.javai.formula.apply.SchemaRules;
import org.javai.formula.data.Column;
import org.javai.formula.data.Table;
import org.javai.formula.materialize.Materializer;
import org.javai.formula.materialize.NumericMatrix;
import org.javai.formula.parse.FormulaParser;
import org.javai.formula.schema.Hints;
import org.javai.formula.schema.Schema;
import org.javai.formula.schema.SchemaResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A formula resolved against a table: the pipeline from formula to the numeric
 * arrays a model fitting routine consumes.
 *
 * <pre>{@code
 * ModelFrame frame = ModelFrame.builder("y ~ 1 + a + c", table)
 *         .context(ModelContext.REGRESSION_MODEL)
 *         .hints(Hints.of("c", Hint.contrasts(new EffectsCoding())))
 *         .build();
 * double[] y = frame.response();
 * ModelMatrix x = frame.modelMatrix();
 * }</pre>
 *
 * <p>By default, rows with a missing value in any variable the formula references
 * are left out before the schema is computed.
 */
public final class ModelFrame {

    private static final Logger logger = LoggerFactory.getLogger(ModelFrame.class);

    private final FormulaTerm formula;
    private final Schema schema;
    private final Table data;
    private final ModelContext context;
    private final Materializer materializer;

    private ModelFrame(FormulaTerm formula, Schema schema, Table data, ModelContext context, Materializer materializer) {
        this.formula = formula;
        this.schema = schema;
        this.data = data;
        this.context = context;
        this.materializer = materializer;
    }

    public static Builder builder(String formula, Table table) {
        return new Builder(FormulaParser.parse(formula), table);
    }

    public static Builder builder(FormulaTerm formula, Table table) {
        return new Builder(formula, table);
    }

    /**
     * The resolved formula.
     */
    public FormulaTerm formula() {
        return formula;
    }

    public Schema schema() {
        return schema;
    }

    public ModelContext context() {
        return context;
    }

    /**
     * The data the frame was built from, after dropping rows with missing values.
     */
    public Table data() {
        return data;
    }

    public int rowCount() {
        return data.rowCount();
    }

    /**
     * The response, for a single response column.
     *
     * @throws IllegalStateException if the response has more than one column
     */
    public double[] response() {
        NumericMatrix response = responseMatrix();
        if (response.columns() != 1) {
            throw new IllegalStateException("response " + formula.lhs() + " has " + response.columns() + " columns");
        }
        return response.column(0);
    }

    public NumericMatrix responseMatrix() {
        return materializer.materialize(formula.lhs(), data);
    }

    public List<String> responseNames() {
        return formula.responseNames();
    }

    /**
     * The predictor matrix.
     */
    public ModelMatrix modelMatrix() {
        return ModelMatrix.of(predictors(), data, materializer);
    }

    /**
     * Names of the predictor matrix columns.
     */
    public List<String> coefNames() {
        return predictors().coefNames();
    }

    /**
     * Resolved right-hand-side terms that contribute no matrix columns.
     */
    public List<Term> nonMatrixTerms() {
        if (formula.rhs() instanceof TermTuple tuple) {
            return tuple.terms().subList(1, tuple.terms().size());
        }
        return List.of();
    }

    private MatrixTerm predictors() {
        Term rhs = formula.rhs();
        return rhs instanceof TermTuple tuple ? (MatrixTerm) tuple.terms().get(0) : (MatrixTerm) rhs;
    }

    @Override
    public String toString() {
        return "ModelFrame[" + formula + ", " + data.rowCount() + " rows, context " + context + "]";
    }

    public static final class Builder {

        private final FormulaTerm formula;
        private final Table table;
        private ModelContext context = ModelContext.STATISTICAL_MODEL;
        private Hints hints = Hints.none();
        private SchemaRules rules = SchemaRules.standard();
        private boolean dropMissing = true;
        private boolean parallel;

        private Builder(FormulaTerm formula, Table table) {
            this.formula = Objects.requireNonNull(formula, "formula must not be null");
            this.table = Objects.requireNonNull(table, "table must not be null");
        }

        public Builder context(ModelContext context) {
            this.context = Objects.requireNonNull(context, "context must not be null");
            return this;
        }

        public Builder hints(Hints hints) {
            this.hints = Objects.requireNonNull(hints, "hints must not be null");
            return this;
        }

        public Builder rules(SchemaRules rules) {
            this.rules = Objects.requireNonNull(rules, "rules must not be null");
            return this;
        }

        public Builder dropMissing(boolean dropMissing) {
            this.dropMissing = dropMissing;
            return this;
        }

        /**
         * Compute the schema and materialize predictors concurrently.
         */
        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        /**
         * @throws org.javai.formula.UnknownVariableException if the formula references
         *         a column the table does not have
         * @throws org.javai.formula.SchemaApplicationException if a term cannot be
         *         resolved under the context
         */
        public ModelFrame build() {
            SchemaResolver resolver = SchemaResolver.create().withHints(hints);
            Materializer materializer = Materializer.create();
            if (parallel) {
                resolver = resolver.parallel();
                materializer = materializer.parallel();
            }
            Set<String> variables = Terms.termVars(formula);
            SchemaResolver.requireColumns(variables, table);
            Table data = dropMissing ? completeRows(table, variables) : table;
            Schema schema = resolver.resolve(variables, data);
            FormulaTerm resolved = new SchemaApplier(rules).apply(formula, schema, context);
            logger.debug("Built model frame for {} with {} of {} rows", resolved, data.rowCount(), table.rowCount());
            return new ModelFrame(resolved, schema, data, context, materializer);
        }

        private static Table completeRows(Table table, Set<String> variables) {
            List<Column> columns = new ArrayList<>();
            for (String name : variables) {
                columns.add(table.column(name));
            }
            List<Integer> keep = new ArrayList<>();
            for (int i = 0; i < table.rowCount(); i++) {
                boolean complete = true;
                for (Column column : columns) {
                    if (column.isMissing(i)) {
                        complete = false;
                        break;
                    }
                }
                if (complete) {
                    keep.add(i);
                }
            }
            if (keep.size() == table.rowCount()) {
                return table;
            }
            logger.debug("Dropping {} rows with missing values", table.rowCount() - keep.size());
            return table.select(keep.stream().mapToInt(Integer::intValue).toArray());
        }
    }
}
