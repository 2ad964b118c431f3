package org.javelin.transpiler.match;

import java.util.List;

public record ExhaustivenessResult(boolean exhaustive, List<String> missing) {

    private static final ExhaustivenessResult COVERED = new ExhaustivenessResult(true, List.of());

    public ExhaustivenessResult {
        missing = List.copyOf(missing);
    }

    public static ExhaustivenessResult covered() {
        return COVERED;
    }

    public static ExhaustivenessResult missing(List<String> combination) {
        return new ExhaustivenessResult(false, combination);
    }
}
