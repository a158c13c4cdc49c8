package org.javai.formula.parse;

import org.javai.formula.FormulaSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class FormulaRewriterTest {

    private final FormulaParser parser = new FormulaParser(ElementwiseFunctions.standard());
    private final FormulaRewriter rewriter = FormulaRewriter.standard();

    private String normalize(String text) {
        return rewriter.normalize(parser.syntax(text)).toString();
    }

    // === individual rules ===

    @Test
    void star_expandsPairwise() {
        Expr.Call call = (Expr.Call) parser.syntax("a * b");

        assertThat(FormulaRewriter.STAR.applies(call)).isTrue();
        assertThat(FormulaRewriter.STAR.rewrite(call).toString()).isEqualTo("a + b + a & b");
    }

    @Test
    void associative_flattensOneLevel() {
        Expr.Call call = (Expr.Call) parser.syntax("(a + b) + c");

        assertThat(FormulaRewriter.ASSOCIATIVE.applies(call)).isTrue();
        Expr.Call flat = (Expr.Call) FormulaRewriter.ASSOCIATIVE.rewrite(call);
        assertThat(flat.args()).hasSize(3);
    }

    @Test
    void associative_doesNotApplyToMixedOperators() {
        assertThat(FormulaRewriter.ASSOCIATIVE.applies((Expr.Call) parser.syntax("(a + b) & c"))).isFalse();
    }

    @Test
    void distributive_splitsFirstSum() {
        Expr.Call call = (Expr.Call) parser.syntax("a & (b + c)");

        assertThat(FormulaRewriter.DISTRIBUTIVE.rewrite(call).toString()).isEqualTo("a & b + a & c");
    }

    @Test
    void andOne_removesNumbers() {
        Expr.Call call = (Expr.Call) parser.syntax("1 & a");

        Expr rewritten = FormulaRewriter.AND_ONE.rewrite(call);
        assertThat(rewritten).isInstanceOf(Expr.Call.class);
        assertThat(((Expr.Call) rewritten).args()).containsExactly(new Expr.Name("a"));
    }

    @Test
    void andOne_onlyNumbers_fails() {
        Expr.Call call = (Expr.Call) parser.syntax("1 & 1");

        assertThatThrownBy(() -> FormulaRewriter.AND_ONE.rewrite(call))
                .isInstanceOf(FormulaSyntaxException.class);
    }

    @Test
    void subtractOne_becomesNegativeOneTerm() {
        Expr.Call call = (Expr.Call) parser.syntax("a - 1");

        assertThat(FormulaRewriter.SUBTRACT_ONE.applies(call)).isTrue();
        assertThat(FormulaRewriter.SUBTRACT_ONE.rewrite(call).toString()).isEqualTo("a + -1");
        assertThat(FormulaRewriter.SUBTRACT_ONE.applies((Expr.Call) parser.syntax("a - b"))).isFalse();
    }

    // === normalization ===

    @Test
    void normalize_crossesThreeFactors() {
        assertThat(normalize("a * b * c")).isEqualTo("a + b + a & b + c + a & c + b & c + a & b & c");
    }

    @Test
    void normalize_distributesBothSides() {
        assertThat(normalize("(a + b) & (c + d)")).isEqualTo("a & c + a & d + b & c + b & d");
    }

    @Test
    void normalize_isIdempotent() {
        Expr once = rewriter.normalize(parser.syntax("y ~ (a + b) * c - 1"));

        assertThat(rewriter.normalize(once)).isEqualTo(once);
    }

    @Test
    void normalize_leavesFunctionCallsAlone() {
        assertThat(normalize("log(a * b)")).isEqualTo("log(a * b)");
        assertThat(normalize("x / (a + b)")).isEqualTo("x / (a + b)");
    }

    @Test
    void normalize_rewritesOperatorsAroundFunctionCalls() {
        assertThat(normalize("log(x) * z")).isEqualTo("log(x) + z + log(x) & z");
    }

    @Test
    void rewriter_withoutRules_leavesSyntaxUnchanged() {
        FormulaRewriter none = new FormulaRewriter(List.of());

        assertThat(none.normalize(parser.syntax("a * b")).toString()).isEqualTo("a * b");
    }
}
