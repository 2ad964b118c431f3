package org.javelin.transpiler.types;

import java.util.Optional;

import com.github.javaparser.ast.expr.Expression;

/**
 * Answers from a type checker for one compilation unit.
 */
@FunctionalInterface
public interface TypeFacts {

    TypeFacts NONE = expression -> Optional.empty();

    /**
     * Type of {@code expression} as Java source text, or empty when the checker cannot tell.
     * Must not throw.
     */
    Optional<String> typeOf(Expression expression);
}
