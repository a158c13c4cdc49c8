package org.javai.formula;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.javai.formula.Terms.*;

class TermsTest {

    private final Term a = term("a");
    private final Term b = term("b");
    private final Term c = term("c");

    // === combine ===

    @Test
    void combine_flattensNestedTuples() {
        Term left = combine(combine(a, b), c);
        Term right = combine(a, combine(b, c));

        assertThat(left).isEqualTo(right);
        assertThat(left).isEqualTo(new TermTuple(List.of(a, b, c)));
    }

    @Test
    void combine_singleTerm_isThatTerm() {
        assertThat(combine(a)).isSameAs(a);
    }

    @Test
    void combine_keepsDuplicates() {
        assertThat(flatten(combine(a, a))).containsExactly(a, a);
    }

    @Test
    void combine_rejectsNoTerms() {
        assertThatThrownBy(() -> combine(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // === interact ===

    @Test
    void interact_isAssociative() {
        Term left = interact(interact(a, b), c);
        Term right = interact(a, interact(b, c));

        assertThat(left).isEqualTo(right);
        assertThat(left).isEqualTo(new InteractionTerm(List.of(a, b, c)));
    }

    @Test
    void interact_singleTerm_isThatTerm() {
        assertThat(interact(a)).isSameAs(a);
    }

    @Test
    void interact_distributesOverCombination() {
        Term distributed = interact(combine(a, b), c);

        assertThat(distributed).isEqualTo(combine(interact(a, c), interact(b, c)));
    }

    @Test
    void interact_distributesOverBothSides() {
        Term d = term("d");

        assertThat(flatten(interact(combine(a, b), combine(c, d))))
                .containsExactly(interact(a, c), interact(a, d), interact(b, c), interact(b, d));
    }

    // === cross ===

    @Test
    void cross_twoTerms_isMainEffectsAndInteraction() {
        assertThat(cross(a, b)).isEqualTo(combine(a, b, interact(a, b)));
    }

    @Test
    void cross_threeTerms_expandsToSevenTerms() {
        List<Term> expanded = flatten(cross(a, b, c));

        assertThat(expanded).hasSize(7);
        assertThat(expanded).containsExactlyInAnyOrder(
                a, b, c, interact(a, b), interact(a, c), interact(b, c), interact(a, b, c));
    }

    @Test
    void dropIntercept_appendsMinusOne() {
        assertThat(flatten(dropIntercept(combine(a, b)))).containsExactly(a, b, ConstantTerm.MINUS_ONE);
    }

    // === queries ===

    @Test
    void termVars_includesVariablesInsideFunctions() {
        FunctionTerm log = new FunctionTerm("log", List.of(term("x")), "log(x)", List.of("x"), args -> Math.log(args[0]));
        FormulaTerm formula = formula(term("y"), combine(a, interact(b, log)));

        assertThat(termVars(formula)).containsExactly("y", "a", "b", "x");
    }

    @Test
    void hasIntercept_detectsOneAndPresentIntercept() {
        assertThat(hasIntercept(combine(constant(1), a))).isTrue();
        assertThat(hasIntercept(combine(InterceptTerm.PRESENT, a))).isTrue();
        assertThat(hasIntercept(combine(constant(0), a))).isFalse();
        assertThat(hasIntercept(a)).isFalse();
    }

    @Test
    void omitsIntercept_detectsZeroAndMinusOne() {
        assertThat(omitsIntercept(combine(constant(0), a))).isTrue();
        assertThat(omitsIntercept(combine(a, constant(-1)))).isTrue();
        assertThat(omitsIntercept(combine(constant(1), a))).isFalse();
    }

    @Test
    void hasSchema_falseForPlaceholders() {
        assertThat(hasSchema(formula(term("y"), a))).isFalse();
        assertThat(hasSchema(interact(a, new ContinuousTerm("b", 0, 1, -1, 1)))).isFalse();
        assertThat(hasSchema(new ContinuousTerm("b", 0, 1, -1, 1))).isTrue();
    }

    @Test
    void symbols_ofInteraction_isUnionOfVariables() {
        assertThat(symbols(interact(a, b))).containsExactlyInAnyOrder("a", "b");
        assertThat(symbols(InterceptTerm.PRESENT)).containsExactly(INTERCEPT_SYMBOL);
        assertThat(symbols(InterceptTerm.ABSENT)).isEmpty();
    }

    @Test
    void symbols_ofResolvedAndUnresolvedVariable_areEqual() {
        assertThat(symbols(new ContinuousTerm("a", 0, 1, -1, 1))).isEqualTo(symbols(a));
    }

    @Test
    void kroneckerNames_lastFactorVariesFastest() {
        List<String> names = kroneckerNames(List.of(List.of("a1", "a2"), List.of("b1", "b2")));

        assertThat(names).containsExactly("a1 & b1", "a1 & b2", "a2 & b1", "a2 & b2");
    }

    @Test
    void kroneckerNames_singleFactor_isUnchanged() {
        assertThat(kroneckerNames(List.of(List.of("x")))).containsExactly("x");
    }
}
