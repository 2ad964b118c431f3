package org.javelin.transpiler.types;

import com.github.javaparser.ast.CompilationUnit;

/**
 * Optional full type checking. {@link #analyze(CompilationUnit)} runs once per file and
 * never aborts the pipeline: an oracle that cannot work returns {@link TypeFacts#NONE}.
 */
public interface TypeOracle {

    TypeFacts analyze(CompilationUnit compilationUnit);

    static TypeOracle unavailable() {
        return compilationUnit -> TypeFacts.NONE;
    }
}
