package org.javelin.transpiler.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.javelin.mapping.Position;
import org.javelin.rewrite.MatchRewriter;

/**
 * Structural view of a rewritten match: {@code $match(s...).arm(...).guarded(...).end()}.
 * Built afresh from the tree whenever it is needed; only {@link #key()} outlives a phase.
 */
public final class MatchChain {

    static final String ARM = "arm";
    static final String GUARDED = "guarded";
    static final String END = "end";

    /**
     * One arm. {@code guard} is null for unguarded arms; {@code body} is an
     * {@link ExpressionStmt} for an expression body, a block otherwise.
     */
    public record Arm(StringLiteralExpr pattern, Expression guard, Statement body, MethodCallExpr call) {

        public boolean isGuarded() {
            return guard != null;
        }

        public String patternText() {
            return pattern.asString();
        }

        public LambdaExpr bodyLambda() {
            return (LambdaExpr) call.getArguments().getLast().orElseThrow();
        }
    }

    private final MethodCallExpr start;
    private final MethodCallExpr end;
    private final List<Arm> arms;

    private MatchChain(MethodCallExpr start, MethodCallExpr end, List<Arm> arms) {
        this.start = start;
        this.end = end;
        this.arms = arms;
    }

    /**
     * The chain ending in {@code end}, if {@code end} is the final {@code .end()} call of a
     * well formed chain.
     */
    public static Optional<MatchChain> of(Node node) {
        if (!(node instanceof MethodCallExpr)) {
            return Optional.empty();
        }
        MethodCallExpr end = (MethodCallExpr) node;
        if (!end.getNameAsString().equals(END) || end.getArguments().isNonEmpty() || end.getScope().isEmpty()) {
            return Optional.empty();
        }
        List<Arm> arms = new ArrayList<>();
        Expression current = end.getScope().get();
        while (current instanceof MethodCallExpr) {
            MethodCallExpr call = (MethodCallExpr) current;
            String name = call.getNameAsString();
            if (name.equals(MatchRewriter.CHAIN_START) && call.getScope().isEmpty()) {
                if (call.getArguments().isEmpty()) {
                    return Optional.empty();
                }
                Collections.reverse(arms);
                return Optional.of(new MatchChain(call, end, List.copyOf(arms)));
            }
            Optional<Arm> arm = arm(call);
            if (arm.isEmpty() || call.getScope().isEmpty()) {
                return Optional.empty();
            }
            arms.add(arm.get());
            current = call.getScope().get();
        }
        return Optional.empty();
    }

    private static Optional<Arm> arm(MethodCallExpr call) {
        int expected = call.getNameAsString().equals(ARM) ? 2 : call.getNameAsString().equals(GUARDED) ? 3 : -1;
        if (expected < 0 || call.getArguments().size() != expected || !call.getArgument(0).isStringLiteralExpr()) {
            return Optional.empty();
        }
        for (int i = 1; i < expected; i++) {
            Expression argument = call.getArgument(i);
            if (!argument.isLambdaExpr() || argument.asLambdaExpr().getParameters().isNonEmpty()) {
                return Optional.empty();
            }
        }
        Expression guard = null;
        if (expected == 3) {
            Statement guardBody = call.getArgument(1).asLambdaExpr().getBody();
            if (!guardBody.isExpressionStmt()) {
                return Optional.empty();
            }
            guard = guardBody.asExpressionStmt().getExpression();
        }
        Statement body = call.getArgument(expected - 1).asLambdaExpr().getBody();
        return Optional.of(new Arm(call.getArgument(0).asStringLiteralExpr(), guard, body, call));
    }

    /**
     * True for the {@code $match(...)} call that starts a chain.
     */
    public static boolean isStart(Node node) {
        return node instanceof MethodCallExpr &&
               ((MethodCallExpr) node).getNameAsString().equals(MatchRewriter.CHAIN_START) &&
               ((MethodCallExpr) node).getScope().isEmpty();
    }

    /**
     * True for the pattern string of an {@code .arm} or {@code .guarded} call.
     */
    public static boolean isArmPattern(StringLiteralExpr literal) {
        Node parent = literal.getParentNode().orElse(null);
        if (!(parent instanceof MethodCallExpr)) {
            return false;
        }
        MethodCallExpr call = (MethodCallExpr) parent;
        String name = call.getNameAsString();
        return (name.equals(ARM) || name.equals(GUARDED)) && call.getArguments().getFirst().orElse(null) == literal;
    }

    /**
     * Climbs from a {@code $match(...)} call to the end of its chain.
     */
    public static Optional<MatchChain> fromStart(MethodCallExpr start) {
        Node current = start;
        while (current.getParentNode().isPresent() && current.getParentNode().get() instanceof MethodCallExpr &&
               ((MethodCallExpr) current.getParentNode().get()).getScope().orElse(null) == current) {
            current = current.getParentNode().get();
        }
        return of(current).filter(chain -> chain.start == start);
    }

    /**
     * The chain whose arm body lambda directly holds this chain as its expression, if any.
     */
    public Optional<MatchChain> enclosingAsBody() {
        return enclosingArm().filter(found -> found.arm.bodyLambda() == lambdaOf(end)).map(found -> found.chain);
    }

    /**
     * True if this chain is the whole expression of some other chain's guard.
     */
    public boolean isGuardOfAnother() {
        return enclosingArm().filter(found -> found.arm.isGuarded() &&
                                              found.arm.call().getArgument(1) == lambdaOf(end)).isPresent();
    }

    private record Enclosing(MatchChain chain, Arm arm) {
    }

    private Optional<Enclosing> enclosingArm() {
        LambdaExpr lambda = lambdaOf(end);
        if (lambda == null || lambda.getParentNode().isEmpty() || !(lambda.getParentNode().get() instanceof MethodCallExpr)) {
            return Optional.empty();
        }
        MethodCallExpr call = (MethodCallExpr) lambda.getParentNode().get();
        Node top = call;
        while (top.getParentNode().isPresent() && top.getParentNode().get() instanceof MethodCallExpr &&
               ((MethodCallExpr) top.getParentNode().get()).getScope().orElse(null) == top) {
            top = top.getParentNode().get();
        }
        Optional<MatchChain> outer = of(top);
        if (outer.isEmpty()) {
            return Optional.empty();
        }
        for (Arm arm : outer.get().arms) {
            if (arm.call() == call) {
                return Optional.of(new Enclosing(outer.get(), arm));
            }
        }
        return Optional.empty();
    }

    private static LambdaExpr lambdaOf(MethodCallExpr end) {
        Node parent = end.getParentNode().orElse(null);
        if (!(parent instanceof ExpressionStmt) || parent.getParentNode().isEmpty()) {
            return null;
        }
        Node grandParent = parent.getParentNode().get();
        return grandParent instanceof LambdaExpr ? (LambdaExpr) grandParent : null;
    }

    public MethodCallExpr start() {
        return start;
    }

    public MethodCallExpr end() {
        return end;
    }

    public List<Expression> scrutinees() {
        return start.getArguments();
    }

    public int arity() {
        return start.getArguments().size();
    }

    public List<Arm> arms() {
        return arms;
    }

    /**
     * Where the chain begins in the rewritten source. Stable across phases because the
     * chain's calls are never replaced before the match itself is lowered.
     */
    public Position key() {
        return start.getBegin().map(p -> new Position(p.line, p.column)).orElse(Position.UNKNOWN);
    }
}
