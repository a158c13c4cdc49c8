package org.javai.formula.parse;

import org.javai.formula.ElementwiseFunction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ElementwiseFunctionsTest {

    private final FormulaParser parser = new FormulaParser(ElementwiseFunctions.standard());

    private ElementwiseFunction compile(ElementwiseFunctions functions, String text, String... argNames) {
        return functions.compile(parser.syntax(text), List.of(argNames));
    }

    private double eval(String text, List<String> argNames, double... values) {
        return ElementwiseFunctions.standard().compile(parser.syntax(text), argNames).apply(values);
    }

    @Test
    void compile_arithmeticOperators() {
        List<String> xy = List.of("x", "y");

        assertThat(eval("x + y", xy, 2, 3)).isEqualTo(5.0);
        assertThat(eval("x - y", xy, 2, 3)).isEqualTo(-1.0);
        assertThat(eval("x * y", xy, 2, 3)).isEqualTo(6.0);
        assertThat(eval("x & y", xy, 2, 3)).isEqualTo(6.0);
        assertThat(eval("x / y", xy, 3, 2)).isEqualTo(1.5);
        assertThat(eval("x ^ y", xy, 2, 3)).isEqualTo(8.0);
        assertThat(eval("-x", xy, 2, 3)).isEqualTo(-2.0);
    }

    @Test
    void compile_standardFunctions() {
        List<String> x = List.of("x");

        assertThat(eval("sqrt(x)", x, 9)).isEqualTo(3.0);
        assertThat(eval("log2(x)", x, 8)).isCloseTo(3.0, within(1e-12));
        assertThat(eval("abs(x)", x, -4)).isEqualTo(4.0);
        assertThat(eval("pow(x, 2)", x, 5)).isEqualTo(25.0);
        assertThat(eval("max(x, 0)", x, -1)).isEqualTo(0.0);
        assertThat(eval("exp(log(x))", x, 7)).isCloseTo(7.0, within(1e-12));
    }

    @Test
    void compile_usesArgumentOrder() {
        assertThat(eval("x - y", List.of("y", "x"), 1, 10)).isEqualTo(9.0);
    }

    @Test
    void compile_missingValue_propagates() {
        assertThat(eval("log(x) + 1", List.of("x"), Double.NaN)).isNaN();
    }

    @Test
    void compile_unknownFunction_isNotEvaluable() {
        ElementwiseFunction poly = compile(ElementwiseFunctions.standard(), "poly(x, 3)", "x");

        assertThat(poly.isEvaluable()).isFalse();
        assertThatThrownBy(() -> poly.apply(new double[] {1}))
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("poly");
    }

    @Test
    void compile_knownFunctionWithWrongArity_isNotEvaluable() {
        assertThat(compile(ElementwiseFunctions.standard(), "log(x, y)", "x", "y").isEvaluable()).isFalse();
        assertThat(compile(ElementwiseFunctions.standard(), "sqrt(poly(x))", "x").isEvaluable()).isFalse();
    }

    @Test
    void with_addsFunctionsWithoutChangingOriginal() {
        ElementwiseFunctions extended = ElementwiseFunctions.empty()
                .with("logit", p -> Math.log(p / (1 - p)))
                .with("hypot", Math::hypot);

        assertThat(extended.contains("logit")).isTrue();
        assertThat(extended.contains("log")).isFalse();
        assertThat(ElementwiseFunctions.empty().contains("logit")).isFalse();
        assertThat(compile(extended, "logit(p)", "p").apply(new double[] {0.5})).isEqualTo(0.0);
        assertThat(compile(extended, "hypot(a, b)", "a", "b").apply(new double[] {3, 4})).isEqualTo(5.0);
    }

    @Test
    void compile_unlistedVariable_fails() {
        assertThatThrownBy(() -> compile(ElementwiseFunctions.standard(), "x + z", "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
