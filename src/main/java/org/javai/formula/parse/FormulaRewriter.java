package org.javai.formula.parse;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.formula.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers formula syntax to normal form by applying rewrite rules until none applies.
 *
 * <p>Only the formula operators ({@code ~ + & *}, and {@code -} when subtracting the
 * literal 1) are rewritten. Any other call is left exactly as written; its arguments
 * are normalized separately when the call is captured as a function term.
 *
 * <p>The rules, tried in order at each node after its arguments are in normal form:
 * <ul>
 *   <li>{@link #STAR}: {@code a*b} becomes {@code a + b + a&b}</li>
 *   <li>{@link #ASSOCIATIVE}: un-nests {@code +}, {@code &} and {@code *}</li>
 *   <li>{@link #DISTRIBUTIVE}: {@code (a + b)&c} becomes {@code a&c + b&c}</li>
 *   <li>{@link #AND_ONE}: removes numbers from interactions, {@code 1&x} becomes {@code &(x)}</li>
 *   <li>{@link #EMPTY_AND}: {@code &(x)} becomes {@code x}</li>
 *   <li>{@link #SUBTRACT_ONE}: {@code x - 1} becomes {@code x + -1}</li>
 * </ul>
 */
public final class FormulaRewriter {

    private static final Logger logger = LogManager.getLogger(FormulaRewriter.class);
    private static final Marker REWRITE_MARKER = MarkerManager.getMarker("REWRITE");

    /**
     * A rewrite of one operator node.
     */
    public interface Rule {

        String name();

        boolean applies(Expr.Call call);

        /**
         * Rewrites a node this rule applies to. The arguments of the result need not be
         * in normal form.
         */
        Expr rewrite(Expr.Call call);
    }

    public static final Rule STAR = new Rule() {
        @Override
        public String name() {
            return "star";
        }

        @Override
        public boolean applies(Expr.Call call) {
            return call.is("*");
        }

        @Override
        public Expr rewrite(Expr.Call call) {
            Expr result = call.args().get(0);
            for (int i = 1; i < call.args().size(); i++) {
                Expr next = call.args().get(i);
                result = Expr.Call.operator("+", List.of(result, next, Expr.Call.operator("&", List.of(result, next))));
            }
            return result;
        }
    };

    public static final Rule ASSOCIATIVE = new Rule() {
        @Override
        public String name() {
            return "associative";
        }

        @Override
        public boolean applies(Expr.Call call) {
            return isAssociative(call) && call.args().stream().anyMatch(arg -> arg instanceof Expr.Call c && c.is(call.name()));
        }

        @Override
        public Expr rewrite(Expr.Call call) {
            List<Expr> args = new ArrayList<>();
            for (Expr arg : call.args()) {
                if (arg instanceof Expr.Call c && c.is(call.name())) {
                    args.addAll(c.args());
                } else {
                    args.add(arg);
                }
            }
            return call.withArgs(args);
        }
    };

    public static final Rule DISTRIBUTIVE = new Rule() {
        @Override
        public String name() {
            return "distributive";
        }

        @Override
        public boolean applies(Expr.Call call) {
            return call.is("&") && indexOfSum(call) >= 0;
        }

        @Override
        public Expr rewrite(Expr.Call call) {
            int index = indexOfSum(call);
            Expr.Call sum = (Expr.Call) call.args().get(index);
            List<Expr> distributed = new ArrayList<>(sum.args().size());
            for (Expr summand : sum.args()) {
                List<Expr> args = new ArrayList<>(call.args());
                args.set(index, summand);
                distributed.add(call.withArgs(args));
            }
            return Expr.Call.operator("+", distributed);
        }

        private int indexOfSum(Expr.Call call) {
            for (int i = 0; i < call.args().size(); i++) {
                if (call.args().get(i) instanceof Expr.Call c && c.is("+")) {
                    return i;
                }
            }
            return -1;
        }
    };

    public static final Rule AND_ONE = new Rule() {
        @Override
        public String name() {
            return "and-one";
        }

        @Override
        public boolean applies(Expr.Call call) {
            return call.is("&") && call.args().stream().anyMatch(arg -> arg instanceof Expr.Literal);
        }

        @Override
        public Expr rewrite(Expr.Call call) {
            List<Expr> args = new ArrayList<>();
            for (Expr arg : call.args()) {
                if (arg instanceof Expr.Literal literal) {
                    if (literal.value() != 1) {
                        logger.warn("Number {} removed from interaction term {}", literal, call);
                    }
                } else {
                    args.add(arg);
                }
            }
            if (args.isEmpty()) {
                throw new FormulaSyntaxException("interaction of numbers only: " + call);
            }
            return call.withArgs(args);
        }
    };

    public static final Rule EMPTY_AND = new Rule() {
        @Override
        public String name() {
            return "empty-and";
        }

        @Override
        public boolean applies(Expr.Call call) {
            return call.is("&") && call.args().size() == 1;
        }

        @Override
        public Expr rewrite(Expr.Call call) {
            return call.args().get(0);
        }
    };

    public static final Rule SUBTRACT_ONE = new Rule() {
        @Override
        public String name() {
            return "subtract-one";
        }

        @Override
        public boolean applies(Expr.Call call) {
            return isSubtractOne(call);
        }

        @Override
        public Expr rewrite(Expr.Call call) {
            return Expr.Call.operator("+", List.of(call.args().get(0), Expr.Literal.of(-1)));
        }
    };

    private static final FormulaRewriter STANDARD =
            new FormulaRewriter(List.of(STAR, ASSOCIATIVE, DISTRIBUTIVE, AND_ONE, EMPTY_AND, SUBTRACT_ONE));

    private final List<Rule> rules;

    public FormulaRewriter(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static FormulaRewriter standard() {
        return STANDARD;
    }

    /**
     * Rewrites an expression to normal form.
     */
    public Expr normalize(Expr expr) {
        if (!(expr instanceof Expr.Call call) || !isFormulaOperator(call)) {
            return expr;
        }
        List<Expr> args = new ArrayList<>(call.args().size());
        for (Expr arg : call.args()) {
            args.add(normalize(arg));
        }
        Expr.Call current = call.withArgs(args);
        for (Rule rule : rules) {
            if (rule.applies(current)) {
                Expr rewritten = rule.rewrite(current);
                logger.atTrace()
                        .withMarker(REWRITE_MARKER)
                        .log("{}: {} -> {}", rule.name(), current, rewritten);
                return normalize(rewritten);
            }
        }
        return current;
    }

    static boolean isFormulaOperator(Expr.Call call) {
        return call.is("~") || isAssociative(call) || isSubtractOne(call);
    }

    private static boolean isAssociative(Expr.Call call) {
        return call.is("+") || call.is("&") || call.is("*");
    }

    private static boolean isSubtractOne(Expr.Call call) {
        return call.is("-") && call.args().size() == 2
                && call.args().get(1) instanceof Expr.Literal literal && literal.value() == 1;
    }
}
