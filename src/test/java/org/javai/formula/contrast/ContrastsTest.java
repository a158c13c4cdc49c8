package org.javai.formula.contrast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;
import static org.assertj.core.api.Assertions.within;

class ContrastsTest {

    private static final List<Object> LEVELS = List.of("a", "b", "c");

    static Stream<Contrasts> reducedRankCodings() {
        return Stream.of(new DummyCoding(), new EffectsCoding(), new HelmertCoding(), new SeqDiffCoding());
    }

    // === shape and rank ===

    @ParameterizedTest
    @MethodSource("reducedRankCodings")
    void reducedRankCoding_isKByKMinusOneWithFullColumnRank(Contrasts coding) {
        for (int k = 2; k <= 6; k++) {
            List<Object> levels = Stream.iterate(0, i -> i + 1).limit(k).map(i -> (Object) ("l" + i)).toList();
            ContrastsMatrix matrix = ContrastsMatrix.of(coding, levels);

            assertThat(matrix.rows()).isEqualTo(k);
            assertThat(matrix.columns()).isEqualTo(k - 1);
            assertThat(Matrices.rank(matrix.matrix())).isEqualTo(k - 1);
            assertThat(matrix.termNames()).hasSize(k - 1);
        }
    }

    @Test
    void fullDummyCoding_isIdentity() {
        ContrastsMatrix matrix = ContrastsMatrix.of(new FullDummyCoding(), LEVELS);

        assertThat(matrix.matrix()).isDeepEqualTo(Matrices.identity(3));
        assertThat(matrix.termNames()).containsExactly("a", "b", "c");
        assertThat(matrix.isFullRank()).isTrue();
    }

    // === matrices ===

    @Test
    void dummyCoding_indicatesNonBaseLevels() {
        ContrastsMatrix matrix = ContrastsMatrix.of(new DummyCoding(), LEVELS);

        assertThat(matrix.matrix()).isDeepEqualTo(new double[][] {{0, 0}, {1, 0}, {0, 1}});
        assertThat(matrix.termNames()).containsExactly("b", "c");
    }

    @Test
    void dummyCoding_withBase_dropsThatLevel() {
        ContrastsMatrix matrix = ContrastsMatrix.of(DummyCoding.withBase("b"), LEVELS);

        assertThat(matrix.matrix()).isDeepEqualTo(new double[][] {{1, 0}, {0, 0}, {0, 1}});
        assertThat(matrix.termNames()).containsExactly("a", "c");
    }

    @Test
    void effectsCoding_codesBaseAsMinusOne() {
        ContrastsMatrix matrix = ContrastsMatrix.of(new EffectsCoding(), LEVELS);

        assertThat(matrix.matrix()).isDeepEqualTo(new double[][] {{-1, -1}, {1, 0}, {0, 1}});
    }

    @Test
    void helmertCoding_comparesEachLevelWithPreviousMean() {
        ContrastsMatrix matrix = ContrastsMatrix.of(new HelmertCoding(), LEVELS);

        assertThat(matrix.matrix()).isDeepEqualTo(new double[][] {{-1, -1}, {1, -1}, {0, 2}});
    }

    @Test
    void seqDiffCoding_matchesSuccessiveDifferenceContrasts() {
        double[][] matrix = ContrastsMatrix.of(new SeqDiffCoding(), LEVELS).matrix();

        double[][] expected = {{-2.0 / 3, -1.0 / 3}, {1.0 / 3, -1.0 / 3}, {1.0 / 3, 2.0 / 3}};
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 2; j++) {
                assertThat(matrix[i][j]).isCloseTo(expected[i][j], within(1e-12));
            }
        }
    }

    @Test
    void hypothesisCoding_ofSuccessiveDifferences_equalsSeqDiffCoding() {
        Map<String, double[]> hypotheses = new LinkedHashMap<>();
        hypotheses.put("b-a", new double[] {-1, 1, 0});
        hypotheses.put("c-b", new double[] {0, -1, 1});
        ContrastsMatrix hypothesis = ContrastsMatrix.of(HypothesisCoding.of(hypotheses, null), LEVELS);
        ContrastsMatrix seqDiff = ContrastsMatrix.of(new SeqDiffCoding(), LEVELS);

        assertThat(hypothesis.termNames()).containsExactly("b-a", "c-b");
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 2; j++) {
                assertThat(hypothesis.get(i, j)).isCloseTo(seqDiff.get(i, j), within(1e-9));
            }
        }
    }

    @Test
    void contrastsCoding_usesMatrixAsGiven() {
        double[][] custom = {{-1, 0.5}, {0, -1}, {1, 0.5}};
        ContrastsMatrix matrix = ContrastsMatrix.of(new ContrastsCoding(custom), LEVELS);

        assertThat(matrix.matrix()).isDeepEqualTo(custom);
    }

    @Test
    void contrastsCoding_rejectsWrongSize() {
        assertThatThrownBy(() -> new ContrastsCoding(new double[][] {{1, 0}, {0, 1}}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("wrong size");
    }

    @Test
    void contrastsCoding_forFewerLevelsThanData_fails() {
        ContrastsCoding twoLevels = new ContrastsCoding(new double[][] {{0}, {1}});

        assertThatThrownBy(() -> ContrastsMatrix.of(twoLevels, LEVELS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("wrong size for 3 levels");
    }

    @Test
    void hypothesisMatrix_ofDummyCoding_recoversCellMeanContrasts() {
        double[][] hypothesis = ContrastsMatrix.of(new DummyCoding(), LEVELS).hypothesisMatrix();

        double[][] expected = {{1, 0, 0}, {-1, 1, 0}, {-1, 0, 1}};
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                assertThat(hypothesis[i][j]).isCloseTo(expected[i][j], within(1e-9));
            }
        }
    }

    // === levels ===

    @Test
    void explicitLevels_mustMatchDataLevels() {
        DummyCoding coding = new DummyCoding(null, List.of("a", "b", "d"));

        assertThatThrownBy(() -> ContrastsMatrix.of(coding, LEVELS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found in data or vice-versa");
    }

    @Test
    void explicitLevels_fixTheOrder() {
        ContrastsMatrix matrix = ContrastsMatrix.of(new DummyCoding(null, List.of("c", "b", "a")), LEVELS);

        assertThat(matrix.levels()).containsExactly("c", "b", "a");
        assertThat(matrix.termNames()).containsExactly("b", "a");
        assertThat(matrix.row("c")).containsExactly(0, 0);
    }

    @Test
    void unknownBase_isRejected() {
        assertThatThrownBy(() -> ContrastsMatrix.of(DummyCoding.withBase("x"), LEVELS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("base level x not found");
    }

    @Test
    void singleLevel_isRejectedForReducedRank() {
        assertThatThrownBy(() -> ContrastsMatrix.of(new DummyCoding(), List.of("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("only one level");
        assertThat(ContrastsMatrix.of(new FullDummyCoding(), List.of("a")).columns()).isEqualTo(1);
    }

    @Test
    void indexOf_unknownLevel_listsKnownLevels() {
        ContrastsMatrix matrix = ContrastsMatrix.of(new DummyCoding(), LEVELS);

        assertThatThrownBy(() -> matrix.indexOf("q"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[a, b, c]");
    }

    @Test
    void requireLevels_acceptsSubsetOfLevels() {
        ContrastsMatrix matrix = ContrastsMatrix.of(new DummyCoding(), LEVELS);

        assertThat(matrix.requireLevels(List.of("c", "a"))).isSameAs(matrix);
        assertThatThrownBy(() -> matrix.requireLevels(List.of("a", "e")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[e]");
    }

    @Test
    void fullRank_keepsLevels() {
        ContrastsMatrix matrix = ContrastsMatrix.of(new EffectsCoding(), LEVELS).fullRank();

        assertThat(matrix.contrasts()).isInstanceOf(FullDummyCoding.class);
        assertThat(matrix.levels()).isEqualTo(LEVELS);
        assertThat(matrix.fullRank()).isSameAs(matrix);
    }

    @Test
    void equalCodings_produceEqualMatrices() {
        assertThat(ContrastsMatrix.of(new DummyCoding(), LEVELS))
                .isEqualTo(ContrastsMatrix.of(new DummyCoding(), LEVELS))
                .isNotEqualTo(ContrastsMatrix.of(new EffectsCoding(), LEVELS));
    }
}
