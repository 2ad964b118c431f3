package org.javelin.transpiler.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.javelin.transpiler.types.UnionInfo;

/**
 * What Discovery learned about one match, keyed by {@link MatchChain#key()}.
 *
 * @param unions        per column, the union matched on, or null for a plain value column
 * @param typeArguments per column, the scrutinee's type arguments as source text
 *                      (e.g. {@code <Integer, String>}), or null when unknown or not generic
 * @param arms          parsed patterns per arm, in source order
 * @param reachable     number of arms that can ever be selected: every arm up to and
 *                      including the first unguarded catch-all
 * @param line          line of the match in the original source
 */
public record MatchInfo(int arity, List<UnionInfo> unions, List<String> typeArguments, List<List<Pattern>> arms,
                        int reachable, int line) {

    public MatchInfo {
        unions = unmodifiable(unions);
        typeArguments = unmodifiable(typeArguments);
        List<List<Pattern>> copy = new ArrayList<>(arms.size());
        for (List<Pattern> arm : arms) {
            copy.add(List.copyOf(arm));
        }
        arms = List.copyOf(copy);
    }

    // List.copyOf rejects the null entries used for "none"
    private static <T> List<T> unmodifiable(List<T> list) {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    /**
     * True if the arm's patterns accept every combination of values.
     */
    public boolean isCatchAll(int arm) {
        for (Pattern pattern : arms.get(arm)) {
            if (!pattern.isIrrefutable()) {
                return false;
            }
        }
        return true;
    }
}
