package org.javelin.transpiler.types;

import java.util.Optional;
import java.util.function.Supplier;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.resolution.TypeSolver;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TypeOracle} backed by the JavaParser symbol solver. Each file gets its own type
 * solver, so one oracle can serve concurrent transpilations.
 */
public class SymbolSolverTypeOracle implements TypeOracle {

    private static final Logger log = LoggerFactory.getLogger(SymbolSolverTypeOracle.class);

    private final Supplier<TypeSolver> typeSolvers;

    public SymbolSolverTypeOracle() {
        this(ReflectionTypeSolver::new);
    }

    public SymbolSolverTypeOracle(Supplier<TypeSolver> typeSolvers) {
        this.typeSolvers = typeSolvers;
    }

    @Override
    public TypeFacts analyze(CompilationUnit compilationUnit) {
        try {
            new JavaSymbolSolver(typeSolvers.get()).inject(compilationUnit);
        } catch (RuntimeException e) {
            log.warn("symbol solver unavailable, falling back to structural typing: {}", e.toString());
            return TypeFacts.NONE;
        }
        return SymbolSolverTypeOracle::resolve;
    }

    private static Optional<String> resolve(Expression expression) {
        try {
            return Optional.of(expression.calculateResolvedType().describe());
        } catch (RuntimeException e) {
            // unsolved symbols are expected while Javelin constructs are still in the tree
            log.debug("cannot resolve type of '{}': {}", expression, e.getMessage());
            return Optional.empty();
        }
    }
}
