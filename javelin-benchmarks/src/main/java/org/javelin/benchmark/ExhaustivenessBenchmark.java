package org.javelin.benchmark;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.javelin.JavelinConfig;
import org.javelin.transpiler.match.ExhaustivenessChecker;
import org.javelin.transpiler.match.ExhaustivenessRequirement;
import org.javelin.transpiler.match.ExhaustivenessResult;
import org.javelin.transpiler.match.PatternRow;
import org.javelin.transpiler.match.TupleMatchSpec;
import org.openjdk.jmh.annotations.*;

/**
 * Cost of checking tuple matches that enumerate every combination, the worst case for
 * the checker, against one that ends in a wildcard row.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class ExhaustivenessBenchmark {

    @State(Scope.Thread)
    public static class MatchState {

        @Param({"2", "3", "4"})
        int arity;

        final ExhaustivenessChecker checker = new ExhaustivenessChecker(
                JavelinConfig.DEFAULT_MAX_TUPLE_ARITY, JavelinConfig.DEFAULT_MAX_COMBINATIONS);

        ExhaustivenessRequirement requirement;
        TupleMatchSpec enumerated;
        TupleMatchSpec wildcard;

        @Setup(Level.Trial)
        public void init() {
            List<String> tags = List.of("Red", "Amber", "Green", "Off");
            List<List<String>> columns = new ArrayList<>();
            for (int i = 0; i < arity; i++) {
                columns.add(tags);
            }
            requirement = new ExhaustivenessRequirement(columns);

            List<PatternRow> rows = new ArrayList<>();
            enumerate(tags, new String[arity], 0, rows);
            enumerated = new TupleMatchSpec(arity, rows);

            String[] first = new String[arity];
            String[] rest = new String[arity];
            for (int i = 0; i < arity; i++) {
                first[i] = "Red";
                rest[i] = ExhaustivenessChecker.WILDCARD;
            }
            wildcard = new TupleMatchSpec(arity, List.of(PatternRow.of(first), PatternRow.of(true, first), PatternRow.of(rest)));
        }

        private static void enumerate(List<String> tags, String[] row, int column, List<PatternRow> rows) {
            if (column == row.length) {
                rows.add(PatternRow.of(row.clone()));
                return;
            }
            for (String tag : tags) {
                row[column] = tag;
                enumerate(tags, row, column + 1, rows);
            }
        }
    }

    @Benchmark
    public ExhaustivenessResult everyCombinationListed(MatchState state) {
        return state.checker.check(state.enumerated, state.requirement);
    }

    @Benchmark
    public ExhaustivenessResult wildcardRow(MatchState state) {
        return state.checker.check(state.wildcard, state.requirement);
    }
}
