package org.javelin.transpiler.match;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.javelin.LimitExceededException;

/**
 * Decides whether the unguarded rows of a tuple match cover every combination of variant
 * tags, and if not, names the first uncovered combination in declaration order.
 * <p>
 * The search descends column by column. A branch stops as soon as every row still alive
 * is a wildcard for all remaining columns, so a trailing {@code _} row costs one step
 * instead of the full product of the remaining variant counts. Guarded rows never count
 * as coverage.
 */
public class ExhaustivenessChecker {

    public static final String WILDCARD = "_";

    private final int maxTupleArity;
    private final int maxCombinations;

    public ExhaustivenessChecker(int maxTupleArity, int maxCombinations) {
        this.maxTupleArity = maxTupleArity;
        this.maxCombinations = maxCombinations;
    }

    /**
     * @throws LimitExceededException   if the arity or the number of visited combinations
     *                                  exceeds its ceiling
     * @throws IllegalArgumentException if a row names a tag its column does not declare
     */
    public ExhaustivenessResult check(TupleMatchSpec spec, ExhaustivenessRequirement requirement) {
        if (spec.arity() != requirement.arity()) {
            throw new IllegalArgumentException("match has " + spec.arity() + " columns but " + requirement.arity() + " requirements");
        }
        if (spec.arity() > maxTupleArity) {
            throw new LimitExceededException("maxTupleArity", spec.arity(), maxTupleArity,
                    "match over " + spec.arity() + " values exceeds the maximum tuple arity of " + maxTupleArity);
        }
        validateTags(spec, requirement);

        List<PatternRow> unguarded = new ArrayList<>();
        for (PatternRow row : spec.rows()) {
            if (!row.guarded()) {
                unguarded.add(row);
            }
        }
        Search search = new Search(requirement, spec.arity());
        List<String> missing = search.visit(unguarded, 0, new ArrayList<>());
        return missing == null ? ExhaustivenessResult.covered() : ExhaustivenessResult.missing(missing);
    }

    private static void validateTags(TupleMatchSpec spec, ExhaustivenessRequirement requirement) {
        for (int column = 0; column < spec.arity(); column++) {
            Set<String> legal = new HashSet<>(requirement.tags(column));
            for (PatternRow row : spec.rows()) {
                ColumnPattern pattern = row.column(column);
                if (!pattern.isWildcard() && !legal.contains(pattern.tag())) {
                    throw new IllegalArgumentException(legal.isEmpty() ?
                            "variant '" + pattern.tag() + "' used in column " + (column + 1) + ", which is not a union value" :
                            "unknown variant '" + pattern.tag() + "' in column " + (column + 1) + ", expected one of " + requirement.tags(column));
                }
            }
        }
    }

    private final class Search {
        private final ExhaustivenessRequirement requirement;
        private final int arity;
        private long leaves;

        private Search(ExhaustivenessRequirement requirement, int arity) {
            this.requirement = requirement;
            this.arity = arity;
        }

        /**
         * Returns null when covered, otherwise the missing combination.
         */
        private List<String> visit(List<PatternRow> rows, int column, List<String> prefix) {
            if (rows.isEmpty()) {
                countLeaf();
                return complete(prefix, column);
            }
            if (column == arity) {
                countLeaf();
                return null;
            }
            if (allWildcardFrom(rows, column)) {
                return null;
            }

            List<String> tags = requirement.tags(column);
            if (tags.isEmpty()) {
                return descend(rows, column, prefix, WILDCARD, null);
            }
            for (String tag : tags) {
                List<String> missing = descend(rows, column, prefix, tag, tag);
                if (missing != null) {
                    return missing;
                }
            }
            return null;
        }

        // uncovered leaves count too, so a sparse match still hits the ceiling
        private void countLeaf() {
            if (++leaves > maxCombinations) {
                throw new LimitExceededException("maxCombinations", leaves, maxCombinations,
                        "too many required combinations — add a wildcard row");
            }
        }

        private List<String> descend(List<PatternRow> rows, int column, List<String> prefix, String label, String tag) {
            List<PatternRow> alive = new ArrayList<>();
            for (PatternRow row : rows) {
                ColumnPattern pattern = row.column(column);
                if (tag == null ? pattern.isWildcard() : pattern.covers(tag)) {
                    alive.add(row);
                }
            }
            prefix.add(label);
            List<String> missing = visit(alive, column + 1, prefix);
            prefix.remove(prefix.size() - 1);
            return missing;
        }

        private List<String> complete(List<String> prefix, int column) {
            List<String> missing = new ArrayList<>(prefix);
            for (int i = column; i < arity; i++) {
                List<String> tags = requirement.tags(i);
                missing.add(tags.isEmpty() ? WILDCARD : tags.get(0));
            }
            return missing;
        }

        private boolean allWildcardFrom(List<PatternRow> rows, int column) {
            for (PatternRow row : rows) {
                if (!row.isWildcardFrom(column)) {
                    return false;
                }
            }
            return true;
        }
    }
}
