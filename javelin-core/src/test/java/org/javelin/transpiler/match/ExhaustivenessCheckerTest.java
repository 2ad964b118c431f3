package org.javelin.transpiler.match;

import java.util.ArrayList;
import java.util.List;

import org.javelin.LimitExceededException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExhaustivenessCheckerTest {

    private static final List<String> RESULT = List.of("Ok", "Err");
    private static final List<String> OPTION = List.of("Some", "None");

    private final ExhaustivenessChecker checker = new ExhaustivenessChecker(6, 1024);

    private static TupleMatchSpec spec(int arity, PatternRow... rows) {
        return new TupleMatchSpec(arity, List.of(rows));
    }

    @Test
    void allFourCombinations_areExhaustive() {
        ExhaustivenessResult result = checker.check(
                spec(2, PatternRow.of("Ok", "Some"), PatternRow.of("Ok", "None"),
                        PatternRow.of("Err", "Some"), PatternRow.of("Err", "None")),
                ExhaustivenessRequirement.of(RESULT, OPTION));

        assertThat(result.exhaustive()).isTrue();
        assertThat(result.missing()).isEmpty();
    }

    @Test
    void singleWildcardRow_isExhaustive() {
        ExhaustivenessResult result = checker.check(spec(2, PatternRow.of("_", "_")),
                                                    ExhaustivenessRequirement.of(RESULT, OPTION));

        assertThat(result.exhaustive()).isTrue();
        assertThat(result).isEqualTo(ExhaustivenessResult.covered());
    }

    @Test
    void results_exposeCoverageAndTheMissingTuple() {
        ExhaustivenessResult missing = ExhaustivenessResult.missing(List.of("Err", "None"));

        assertThat(ExhaustivenessResult.covered().exhaustive()).isTrue();
        assertThat(ExhaustivenessResult.covered().missing()).isEmpty();
        assertThat(missing.exhaustive()).isFalse();
        assertThat(missing.missing()).containsExactly("Err", "None");
    }

    @Test
    void threeOfFour_reportsTheMissingTuple() {
        ExhaustivenessResult result = checker.check(
                spec(2, PatternRow.of("Ok", "Some"), PatternRow.of("Ok", "None"), PatternRow.of("Err", "Some")),
                ExhaustivenessRequirement.of(RESULT, OPTION));

        assertThat(result.exhaustive()).isFalse();
        assertThat(result.missing()).containsExactly("Err", "None");
    }

    @Test
    void firstMissing_followsDeclarationOrder() {
        ExhaustivenessResult result = checker.check(spec(2, PatternRow.of("Err", "None")),
                                                    ExhaustivenessRequirement.of(RESULT, OPTION));

        assertThat(result.missing()).containsExactly("Ok", "Some");
    }

    @Test
    void guardedRows_neverCount() {
        ExhaustivenessResult result = checker.check(
                spec(1, PatternRow.of(true, "Ok"), PatternRow.of("Err")),
                ExhaustivenessRequirement.of(RESULT));

        assertThat(result.missing()).containsExactly("Ok");
    }

    @Test
    void nonUnionColumn_isCoveredOnlyByWildcards() {
        ExhaustivenessRequirement requirement = ExhaustivenessRequirement.of(OPTION, List.of());

        assertThat(checker.check(spec(2, PatternRow.of("Some", "_")), requirement).missing())
            .containsExactly("None", "_");
        assertThat(checker.check(spec(2, PatternRow.of("Some", "_"), PatternRow.of("None", "_")), requirement).exhaustive())
            .isTrue();
    }

    @Test
    void unknownTag_isRejected() {
        assertThatThrownBy(() -> checker.check(spec(1, PatternRow.of("Maybe")), ExhaustivenessRequirement.of(OPTION)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unknown variant 'Maybe'");
    }

    @Test
    void tagOnNonUnionColumn_isRejected() {
        assertThatThrownBy(() -> checker.check(spec(1, PatternRow.of("Some")), ExhaustivenessRequirement.of(List.of())))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a union value");
    }

    @Test
    void requirementArity_mustMatch() {
        assertThatThrownBy(() -> checker.check(spec(2, PatternRow.of("_", "_")), ExhaustivenessRequirement.of(OPTION)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void arityAboveMaximum_exceedsLimit() {
        ExhaustivenessChecker narrow = new ExhaustivenessChecker(2, 1024);

        assertThatThrownBy(() -> narrow.check(spec(3, PatternRow.of("_", "_", "_")),
                                              ExhaustivenessRequirement.of(OPTION, OPTION, OPTION)))
            .isInstanceOf(LimitExceededException.class)
            .satisfies(e -> assertThat(((LimitExceededException) e).getLimit()).isEqualTo("maxTupleArity"));
    }

    @Test
    void tooManyCombinations_exceedsLimit() {
        List<String> four = List.of("A", "B", "C", "D");
        List<PatternRow> rows = new ArrayList<>();
        for (String first : four) {
            for (String second : four) {
                rows.add(PatternRow.of(first, second));
            }
        }
        ExhaustivenessChecker small = new ExhaustivenessChecker(6, 10);

        assertThatThrownBy(() -> small.check(new TupleMatchSpec(2, rows), ExhaustivenessRequirement.of(four, four)))
            .isInstanceOf(LimitExceededException.class)
            .hasMessage("too many required combinations — add a wildcard row");
    }

    @Test
    void sparseRowsBeyondCeiling_exceedLimitInsteadOfReportingMissing() {
        List<String> three = List.of("Red", "Amber", "Green");
        ExhaustivenessChecker small = new ExhaustivenessChecker(6, 2);

        assertThatThrownBy(() -> small.check(spec(2, PatternRow.of("Red", "Red"), PatternRow.of("Red", "Amber")),
                                             ExhaustivenessRequirement.of(three, three)))
            .isInstanceOf(LimitExceededException.class)
            .hasMessage("too many required combinations — add a wildcard row");
    }

    @Test
    void missingCombinationWithinCeiling_isReported() {
        ExhaustivenessChecker small = new ExhaustivenessChecker(6, 4);

        ExhaustivenessResult result = small.check(spec(2, PatternRow.of("Ok", "Some"), PatternRow.of("Ok", "None"), PatternRow.of("Err", "Some")),
                                                  ExhaustivenessRequirement.of(RESULT, OPTION));

        assertThat(result.missing()).containsExactly("Err", "None");
    }

    @Test
    void trailingWildcardRow_staysUnderATinyCombinationLimit() {
        List<String> four = List.of("A", "B", "C", "D");
        ExhaustivenessChecker tiny = new ExhaustivenessChecker(6, 1);

        ExhaustivenessResult result = tiny.check(
                spec(6, PatternRow.of("A", "_", "_", "_", "_", "_"), PatternRow.of("_", "_", "_", "_", "_", "_")),
                ExhaustivenessRequirement.of(four, four, four, four, four, four));

        assertThat(result.exhaustive()).isTrue();
    }
}
