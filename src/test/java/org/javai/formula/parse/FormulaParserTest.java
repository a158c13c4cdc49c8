package org.javai.formula.parse;

import org.javai.formula.ConstantTerm;
import org.javai.formula.FormulaSyntaxException;
import org.javai.formula.FormulaTerm;
import org.javai.formula.FunctionTerm;
import org.javai.formula.InteractionTerm;
import org.javai.formula.Term;
import org.javai.formula.TermTuple;
import org.javai.formula.VariableTerm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.javai.formula.Terms.*;

class FormulaParserTest {

    private static final VariableTerm Y = term("y");
    private static final VariableTerm A = term("a");
    private static final VariableTerm B = term("b");
    private static final VariableTerm C = term("c");

    // === basic structure ===

    @Test
    void parse_singlePredictor_givesVariableTerms() {
        FormulaTerm formula = FormulaParser.parse("y ~ x");

        assertThat(formula.lhs()).isEqualTo(Y);
        assertThat(formula.rhs()).isEqualTo(term("x"));
    }

    @Test
    void parse_sum_givesTupleInOrder() {
        assertThat(FormulaParser.parse("y ~ a + b + c"))
                .isEqualTo(formula(Y, combine(A, B, C)));
    }

    @Test
    void parse_interceptMarkers_becomeConstants() {
        assertThat(FormulaParser.parse("y ~ 1 + a").rhs()).isEqualTo(combine(ConstantTerm.ONE, A));
        assertThat(FormulaParser.parse("y ~ 0 + a").rhs()).isEqualTo(combine(ConstantTerm.ZERO, A));
        assertThat(FormulaParser.parse("y ~ -1 + a").rhs()).isEqualTo(combine(ConstantTerm.MINUS_ONE, A));
    }

    @Test
    void parse_subtractOne_appendsInterceptRemoval() {
        assertThat(FormulaParser.parse("y ~ a - 1").rhs()).isEqualTo(combine(A, ConstantTerm.MINUS_ONE));
        assertThat(FormulaParser.parse("y ~ a - 1").rhs()).isEqualTo(dropIntercept(A));
    }

    @Test
    void parse_multipleResponses_keepsLeftHandTuple() {
        FormulaTerm formula = FormulaParser.parse("y1 + y2 ~ x");

        assertThat(formula.lhs()).isEqualTo(combine(term("y1"), term("y2")));
    }

    @Test
    void parse_quotedName_allowsSpaces() {
        assertThat(FormulaParser.parse("`body mass` ~ x").lhs()).isEqualTo(term("body mass"));
    }

    @Test
    void parse_dottedAndUnderscoredNames_areSingleVariables() {
        assertThat(FormulaParser.parse("y ~ x.1 + x_2").rhs()).isEqualTo(combine(term("x.1"), term("x_2")));
    }

    // === normalization ===

    @Test
    void parse_star_expandsToMainEffectsAndInteraction() {
        Term rhs = FormulaParser.parse("y ~ a * b").rhs();

        assertThat(rhs).isEqualTo(combine(A, B, new InteractionTerm(List.of(A, B))));
    }

    @Test
    void parse_tripleStar_givesSevenTermsInCrossOrder() {
        Term rhs = FormulaParser.parse("y ~ a * b * c").rhs();

        assertThat(rhs).isInstanceOf(TermTuple.class);
        assertThat(((TermTuple) rhs).terms()).hasSize(7);
        assertThat(rhs).isEqualTo(cross(A, B, C));
        assertThat(rhs.toString()).isEqualTo("a + b + a & b + c + a & c + b & c + a & b & c");
    }

    @Test
    void parse_interaction_distributesOverSum() {
        assertThat(FormulaParser.parse("y ~ (a + b) & c").rhs())
                .isEqualTo(combine(interact(A, C), interact(B, C)));
    }

    @Test
    void parse_nestedSums_areAssociative() {
        FormulaTerm left = FormulaParser.parse("y ~ (a + b) + c");
        FormulaTerm right = FormulaParser.parse("y ~ a + (b + c)");

        assertThat(left).isEqualTo(right).isEqualTo(FormulaParser.parse("y ~ a + b + c"));
    }

    @Test
    void parse_nestedInteractions_areAssociative() {
        assertThat(FormulaParser.parse("y ~ (a & b) & c"))
                .isEqualTo(FormulaParser.parse("y ~ a & (b & c)"));
    }

    @Test
    void parse_interactionWithOne_dropsTheOne() {
        assertThat(FormulaParser.parse("y ~ 1 & a").rhs()).isEqualTo(A);
        assertThat(FormulaParser.parse("y ~ a & 1 & b").rhs()).isEqualTo(interact(A, B));
    }

    @Test
    void parse_interactionWithOtherNumber_dropsTheNumber() {
        assertThat(FormulaParser.parse("y ~ a & 2").rhs()).isEqualTo(A);
    }

    @Test
    void parse_duplicates_areKept() {
        assertThat(FormulaParser.parse("y ~ a + a").rhs()).isEqualTo(combine(A, A));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "y ~ a * b * c",
            "y ~ (a + b) & c + log(x)",
            "y ~ 0 + a * b",
            "y ~ a - 1",
            "y ~ lag(x, 2) + x / z",
            "y ~ a & b & c + x.1"
    })
    void parse_printedFormula_parsesToTheSameFormula(String text) {
        FormulaTerm once = FormulaParser.parse(text);
        FormulaTerm twice = FormulaParser.parse(once.toString());

        assertThat(twice).isEqualTo(once);
    }

    // === captured function calls ===

    @Test
    void parse_functionCall_capturesExpressionAndArguments() {
        FunctionTerm log = (FunctionTerm) FormulaParser.parse("y ~ log(x + 1)").rhs();

        assertThat(log.name()).isEqualTo("log");
        assertThat(log.expression()).isEqualTo("log(x + 1)");
        assertThat(log.argNames()).containsExactly("x");
        assertThat(log.args()).containsExactly(combine(term("x"), ConstantTerm.ONE));
        assertThat(log.function().isEvaluable()).isTrue();
        assertThat(log.function().apply(new double[] {Math.E - 1})).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void parse_unknownFunction_isCapturedButNotEvaluable() {
        FunctionTerm lag = (FunctionTerm) FormulaParser.parse("y ~ lag(x, 2)").rhs();

        assertThat(lag.name()).isEqualTo("lag");
        assertThat(lag.args()).containsExactly(term("x"), constant(2));
        assertThat(lag.argNames()).containsExactly("x");
        assertThat(lag.function().isEvaluable()).isFalse();
    }

    @Test
    void parse_nonFormulaOperators_areCaptured() {
        Term rhs = FormulaParser.parse("y ~ x / z + w ^ 2 + -v").rhs();

        List<Term> terms = ((TermTuple) rhs).terms();
        assertThat(terms).allMatch(t -> t instanceof FunctionTerm);
        assertThat(terms).extracting(Object::toString).containsExactly("x / z", "w ^ 2", "-v");
        FunctionTerm ratio = (FunctionTerm) terms.get(0);
        assertThat(ratio.argNames()).containsExactly("x", "z");
        assertThat(ratio.function().apply(new double[] {6, 3})).isEqualTo(2.0);
    }

    @Test
    void parse_starInsideFunction_isNumericProduct() {
        FunctionTerm call = (FunctionTerm) FormulaParser.parse("y ~ exp(a * b)").rhs();

        assertThat(call.expression()).isEqualTo("exp(a * b)");
        assertThat(call.args()).containsExactly(cross(A, B));
        assertThat(call.function().apply(new double[] {0, 5})).isEqualTo(1.0);
    }

    @Test
    void parse_variableNamesInCall_areDistinctInFirstAppearanceOrder() {
        FunctionTerm call = (FunctionTerm) FormulaParser.parse("y ~ max(b, a / b)").rhs();

        assertThat(call.argNames()).containsExactly("b", "a");
    }

    @Test
    void parse_callInResponse_isCaptured() {
        assertThat(FormulaParser.parse("log(y) ~ x").lhs()).isInstanceOf(FunctionTerm.class);
    }

    @Test
    void parser_withCustomFunction_compilesIt() {
        FormulaParser parser = new FormulaParser(ElementwiseFunctions.standard().with("twice", v -> 2 * v));

        FunctionTerm call = (FunctionTerm) parser.formula("y ~ twice(x)").rhs();

        assertThat(call.function().apply(new double[] {4})).isEqualTo(8.0);
        assertThat(((FunctionTerm) FormulaParser.parse("y ~ twice(x)").rhs()).function().isEvaluable()).isFalse();
    }

    // === terms ===

    @Test
    void parseTerms_returnsOneSide() {
        assertThat(FormulaParser.parseTerms("a * b")).isEqualTo(cross(A, B));
    }

    @Test
    void parseTerms_rejectsSeparator() {
        assertThatThrownBy(() -> FormulaParser.parseTerms("y ~ a"))
                .isInstanceOf(FormulaSyntaxException.class);
    }

    // === syntax ===

    @Test
    void syntax_printsWithMinimalParentheses() {
        FormulaParser parser = new FormulaParser(ElementwiseFunctions.standard());

        assertThat(parser.syntax("a + b * c").toString()).isEqualTo("a + b * c");
        assertThat(parser.syntax("(a + b) * c").toString()).isEqualTo("(a + b) * c");
        assertThat(parser.syntax("a - (b - c)").toString()).isEqualTo("a - (b - c)");
        assertThat(parser.syntax("(a - b) - c").toString()).isEqualTo("a - b - c");
        assertThat(parser.syntax("(x ^ 2) ^ 3").toString()).isEqualTo("(x ^ 2) ^ 3");
        assertThat(parser.syntax("-x ^ 2").toString()).isEqualTo("-x ^ 2");
        assertThat(parser.syntax("f(a, b + 1)").toString()).isEqualTo("f(a, b + 1)");
    }

    @Test
    void syntax_isNotRewritten() {
        Expr syntax = new FormulaParser(ElementwiseFunctions.standard()).syntax("y ~ a * b");

        assertThat(syntax).isInstanceOf(Expr.Call.class);
        Expr.Call rhs = (Expr.Call) ((Expr.Call) syntax).args().get(1);
        assertThat(rhs.is("*")).isTrue();
    }

    // === errors ===

    @Test
    void parse_emptyText_fails() {
        assertThatThrownBy(() -> FormulaParser.parse("   "))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("empty formula");
    }

    @Test
    void parse_missingResponse_fails() {
        assertThatThrownBy(() -> FormulaParser.parse("~ x"))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("missing response");
    }

    @Test
    void parse_missingPredictors_fails() {
        assertThatThrownBy(() -> FormulaParser.parse("y ~"))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("missing predictors");
    }

    @Test
    void parse_withoutSeparator_fails() {
        assertThatThrownBy(() -> FormulaParser.parse("y + x"))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("expected formula separator ~");
    }

    @Test
    void parse_repeatedSeparator_reportsPosition() {
        assertThatThrownBy(() -> FormulaParser.parse("y ~ x ~ z"))
                .isInstanceOfSatisfying(FormulaSyntaxException.class, e -> {
                    assertThat(e.getMessage()).contains("may appear only once");
                    assertThat(e.position()).isEqualTo(6);
                    assertThat(e.source()).isEqualTo("y ~ x ~ z");
                });
    }

    @Test
    void parse_nestedSeparator_fails() {
        assertThatThrownBy(() -> FormulaParser.parse("y ~ (a ~ b)"))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("only appear at the top level");
    }

    @Test
    void parse_unbalancedParenthesis_fails() {
        assertThatThrownBy(() -> FormulaParser.parse("y ~ (a + b"))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("expected ')'");
    }

    @Test
    void parse_interpolation_isRejected() {
        assertThatThrownBy(() -> FormulaParser.parse("y ~ $x"))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("interpolation");
    }

    @ParameterizedTest
    @ValueSource(strings = {"y ~ x + 2", "y ~ 3", "y ~ 0.5 + x"})
    void parse_numberOtherThanInterceptMarker_fails(String text) {
        assertThatThrownBy(() -> FormulaParser.parse(text))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("only 0, 1 and -1 may appear as terms");
    }

    @Test
    void parse_interactionOfNumbersOnly_fails() {
        assertThatThrownBy(() -> FormulaParser.parse("y ~ 1 & 2"))
                .isInstanceOf(FormulaSyntaxException.class);
    }

    @Test
    void parse_unexpectedCharacter_fails() {
        assertThatThrownBy(() -> FormulaParser.parse("y ~ a # b"))
                .isInstanceOf(FormulaSyntaxException.class)
                .hasMessageContaining("unexpected character");
    }
}
