package org.javai.formula.parse;

import org.javai.formula.ElementwiseFunction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Registry of the numeric functions formula text may call, and the compiler that
 * turns a captured call into an {@link ElementwiseFunction}.
 *
 * <p>Registries are immutable; {@link #with(String, DoubleUnaryOperator)} returns an
 * extended copy:
 * <pre>{@code
 * ElementwiseFunctions fns = ElementwiseFunctions.standard().with("logit", p -> Math.log(p / (1 - p)));
 * FormulaTerm f = new FormulaParser(fns).formula("y ~ logit(p)");
 * }</pre>
 */
public final class ElementwiseFunctions {

    private static final Set<String> VARIADIC_OPERATORS = Set.of("+", "*", "&");
    private static final Set<String> BINARY_OPERATORS = Set.of("/", "^");
    private static final ElementwiseFunctions STANDARD = createStandard();

    private final Map<String, DoubleUnaryOperator> unary;
    private final Map<String, DoubleBinaryOperator> binary;

    private ElementwiseFunctions(Map<String, DoubleUnaryOperator> unary, Map<String, DoubleBinaryOperator> binary) {
        this.unary = Map.copyOf(unary);
        this.binary = Map.copyOf(binary);
    }

    public static ElementwiseFunctions standard() {
        return STANDARD;
    }

    public static ElementwiseFunctions empty() {
        return new ElementwiseFunctions(Map.of(), Map.of());
    }

    private static ElementwiseFunctions createStandard() {
        Map<String, DoubleUnaryOperator> unary = new HashMap<>();
        unary.put("log", Math::log);
        unary.put("log2", x -> Math.log(x) / Math.log(2));
        unary.put("log10", Math::log10);
        unary.put("log1p", Math::log1p);
        unary.put("exp", Math::exp);
        unary.put("expm1", Math::expm1);
        unary.put("sqrt", Math::sqrt);
        unary.put("abs", Math::abs);
        unary.put("sin", Math::sin);
        unary.put("cos", Math::cos);
        unary.put("tan", Math::tan);
        unary.put("floor", Math::floor);
        unary.put("ceil", Math::ceil);
        unary.put("round", Math::rint);
        unary.put("sign", Math::signum);
        unary.put("identity", x -> x);
        unary.put("protect", x -> x);

        Map<String, DoubleBinaryOperator> binary = new HashMap<>();
        binary.put("pow", Math::pow);
        binary.put("min", Math::min);
        binary.put("max", Math::max);
        return new ElementwiseFunctions(unary, binary);
    }

    public ElementwiseFunctions with(String name, DoubleUnaryOperator function) {
        Objects.requireNonNull(function, "function must not be null");
        Map<String, DoubleUnaryOperator> extended = new HashMap<>(unary);
        extended.put(name, function);
        return new ElementwiseFunctions(extended, binary);
    }

    public ElementwiseFunctions with(String name, DoubleBinaryOperator function) {
        Objects.requireNonNull(function, "function must not be null");
        Map<String, DoubleBinaryOperator> extended = new HashMap<>(binary);
        extended.put(name, function);
        return new ElementwiseFunctions(unary, extended);
    }

    public boolean contains(String name) {
        return unary.containsKey(name) || binary.containsKey(name);
    }

    /**
     * Compiles an expression into a function of the variables named by
     * {@code argNames}, in that order. Unknown functions, and known ones called
     * with the wrong number of arguments, yield a function that is not evaluable.
     */
    public ElementwiseFunction compile(Expr expr, List<String> argNames) {
        String unknown = firstUnknown(expr);
        if (unknown != null) {
            return ElementwiseFunction.unsupported(unknown);
        }
        Evaluator evaluator = compileNode(expr, argNames);
        return evaluator::evaluate;
    }

    /**
     * Name of the first call in an expression that cannot be compiled, or null.
     */
    private String firstUnknown(Expr expr) {
        if (!(expr instanceof Expr.Call call)) {
            return null;
        }
        int arity = call.args().size();
        boolean known;
        if (call.operator()) {
            known = call.is("-") ? arity == 1 || arity == 2
                    : VARIADIC_OPERATORS.contains(call.name()) ? arity >= 2
                    : BINARY_OPERATORS.contains(call.name()) && arity == 2;
        } else {
            known = arity == 1 && unary.containsKey(call.name()) || arity == 2 && binary.containsKey(call.name());
        }
        if (!known) {
            return call.name();
        }
        for (Expr arg : call.args()) {
            String unknown = firstUnknown(arg);
            if (unknown != null) {
                return unknown;
            }
        }
        return null;
    }

    private Evaluator compileNode(Expr expr, List<String> argNames) {
        if (expr instanceof Expr.Literal literal) {
            double value = literal.value();
            return args -> value;
        }
        if (expr instanceof Expr.Name name) {
            int index = argNames.indexOf(name.name());
            if (index < 0) {
                throw new IllegalArgumentException("variable " + name + " is not among " + argNames);
            }
            return args -> args[index];
        }
        Expr.Call call = (Expr.Call) expr;
        Evaluator[] operands = new Evaluator[call.args().size()];
        for (int i = 0; i < operands.length; i++) {
            operands[i] = compileNode(call.args().get(i), argNames);
        }
        if (call.operator()) {
            return compileOperator(call, operands);
        }
        if (operands.length == 1 && unary.containsKey(call.name())) {
            DoubleUnaryOperator f = unary.get(call.name());
            Evaluator x = operands[0];
            return args -> f.applyAsDouble(x.evaluate(args));
        }
        if (operands.length == 2 && binary.containsKey(call.name())) {
            DoubleBinaryOperator f = binary.get(call.name());
            Evaluator x = operands[0];
            Evaluator y = operands[1];
            return args -> f.applyAsDouble(x.evaluate(args), y.evaluate(args));
        }
        throw new IllegalStateException("cannot compile " + call);
    }

    private static Evaluator compileOperator(Expr.Call call, Evaluator[] operands) {
        switch (call.name()) {
            case "+":
                return args -> {
                    double sum = 0;
                    for (Evaluator operand : operands) {
                        sum += operand.evaluate(args);
                    }
                    return sum;
                };
            case "*":
            case "&":
                return args -> {
                    double product = 1;
                    for (Evaluator operand : operands) {
                        product *= operand.evaluate(args);
                    }
                    return product;
                };
            case "-":
                if (operands.length == 1) {
                    return args -> -operands[0].evaluate(args);
                }
                return args -> operands[0].evaluate(args) - operands[1].evaluate(args);
            case "/":
                return args -> operands[0].evaluate(args) / operands[1].evaluate(args);
            case "^":
                return args -> Math.pow(operands[0].evaluate(args), operands[1].evaluate(args));
            default:
                throw new IllegalStateException("cannot compile operator " + call.name());
        }
    }

    @FunctionalInterface
    private interface Evaluator {
        double evaluate(double[] args);
    }
}
