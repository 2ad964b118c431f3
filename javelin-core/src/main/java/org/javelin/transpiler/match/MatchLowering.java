package org.javelin.transpiler.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import org.javelin.mapping.Position;
import org.javelin.parser.util.AstUtils;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.address.AddressabilityResolver;
import org.javelin.transpiler.types.UnionInfo;
import org.javelin.transpiler.types.VariantInfo;

/**
 * Turns a match chain into a labeled block of {@code instanceof} tests:
 * <pre>
 * __match0: {
 *     final Shape __m1 = shape;
 *     if (__m1 instanceof Shape.Circle __v2) {
 *         final var r = __v2.radius();
 *         area = Math.PI * r * r;
 *         break __match0;
 *     }
 *     ...
 *     throw new IllegalStateException("non-exhaustive match at line 12");
 * }
 * </pre>
 * The final {@code throw} is left out when the last arm is an unguarded catch-all, which is
 * then emitted without a {@code break}. A {@code break} is also left out after an arm body
 * that cannot complete normally. A match that is itself the body of an arm is lowered in
 * place, with the same action as its parent.
 */
public class MatchLowering {

    static final String LABEL_PREFIX = "__match";
    static final String SCRUTINEE_PREFIX = "__m";
    static final String VARIANT_PREFIX = "__v";

    private static final String SCRUTINEE = "$scrut";
    private static final String GUARD = "$guard";
    private static final String BODY = "$body";

    /**
     * What an arm does with the value of its body.
     */
    public static final class Action {
        private enum Kind { STATEMENT, RETURN, ASSIGN }

        private final Kind kind;
        private final String target;

        private Action(Kind kind, String target) {
            this.kind = kind;
            this.target = target;
        }

        public static Action statement() {
            return new Action(Kind.STATEMENT, null);
        }

        public static Action returning() {
            return new Action(Kind.RETURN, null);
        }

        public static Action assign(String variable) {
            return new Action(Kind.ASSIGN, variable);
        }
    }

    private final PipelineContext ctx;
    private final Map<Position, MatchInfo> facts;

    public MatchLowering(PipelineContext ctx, Map<Position, MatchInfo> facts) {
        this.ctx = ctx;
        this.facts = facts;
    }

    public LabeledStmt lower(MatchChain chain, Action action) {
        MatchInfo info = facts.get(chain.key());
        if (info == null) {
            throw ctx.transformError("match was not analysed during discovery", chain.start(), null);
        }
        String label = ctx.freshName(LABEL_PREFIX);
        StringBuilder text = new StringBuilder(label).append(": {\n");

        List<String> references = new ArrayList<>();
        for (int column = 0; column < info.arity(); column++) {
            Expression scrutinee = chain.scrutinees().get(column);
            UnionInfo union = info.unions().get(column);
            if (union == null && AddressabilityResolver.isAddressable(scrutinee)) {
                references.add(SCRUTINEE + column + "()");
                continue;
            }
            String temp = ctx.freshName(SCRUTINEE_PREFIX);
            String type = union == null ? "var" : union.name() + typeArguments(info, column);
            text.append("final ").append(type).append(' ').append(temp)
                .append(" = ").append(SCRUTINEE).append(column).append("();\n");
            references.add(temp);
        }

        List<Statement> actions = new ArrayList<>();
        boolean catchAll = false;
        for (int index = 0; index < info.reachable(); index++) {
            MatchChain.Arm arm = chain.arms().get(index);
            Statement body = action(arm, action);
            actions.add(body);

            List<String> tests = new ArrayList<>();
            StringBuilder bindings = new StringBuilder();
            List<Pattern> patterns = info.arms().get(index);
            for (int column = 0; column < info.arity(); column++) {
                Pattern pattern = patterns.get(column);
                String reference = references.get(column);
                if (pattern instanceof Pattern.Binding) {
                    bindings.append("final var ").append(((Pattern.Binding) pattern).name())
                            .append(" = ").append(reference).append(";\n");
                } else if (pattern instanceof Pattern.Variant) {
                    Pattern.Variant variantPattern = (Pattern.Variant) pattern;
                    UnionInfo union = info.unions().get(column);
                    VariantInfo variant = union.variant(variantPattern.tag()).orElseThrow();
                    String bound = ctx.freshName(VARIANT_PREFIX);
                    tests.add(reference + " instanceof " + variant.qualifiedName() + typeArguments(info, column) + " " + bound);
                    for (int field = 0; field < variantPattern.fields().size(); field++) {
                        Pattern fieldPattern = variantPattern.fields().get(field);
                        if (fieldPattern instanceof Pattern.Binding) {
                            bindings.append("final var ").append(((Pattern.Binding) fieldPattern).name())
                                    .append(" = ").append(bound).append('.')
                                    .append(variant.fields().get(field).name()).append("();\n");
                        }
                    }
                }
            }

            boolean last = tests.isEmpty() && !arm.isGuarded();
            catchAll |= last;
            String inner = BODY + index + "();\n" + (completesNormally(body) && !last ? "break " + label + ";\n" : "");
            if (arm.isGuarded()) {
                inner = "if (" + GUARD + index + "()) {\n" + inner + "}\n";
            }
            if (!tests.isEmpty()) {
                text.append("if (").append(String.join(" && ", tests)).append(") ");
            }
            text.append("{\n").append(bindings).append(inner).append("}\n");
        }
        if (!catchAll) {
            text.append("throw new IllegalStateException(\"non-exhaustive match at line ").append(info.line()).append("\");\n");
        }
        text.append("}");

        LabeledStmt lowered = (LabeledStmt) AstUtils.parseStatement(text.toString());
        for (int column = 0; column < info.arity(); column++) {
            AstUtils.substitute(lowered, SCRUTINEE + column, chain.scrutinees().get(column));
        }
        for (int index = 0; index < info.reachable(); index++) {
            MatchChain.Arm arm = chain.arms().get(index);
            if (arm.isGuarded()) {
                AstUtils.substitute(lowered, GUARD + index, arm.guard());
            }
        }
        // bodies last, so their code is never searched for placeholders
        for (int index = 0; index < actions.size(); index++) {
            String placeholder = BODY + index;
            ExpressionStmt slot = lowered.findFirst(ExpressionStmt.class, s -> isPlaceholder(s, placeholder)).orElseThrow();
            slot.replace(actions.get(index));
        }
        return lowered;
    }

    private static String typeArguments(MatchInfo info, int column) {
        UnionInfo union = info.unions().get(column);
        String arguments = info.typeArguments().get(column);
        return union != null && union.isGeneric() && arguments != null ? arguments : "";
    }

    private static boolean isPlaceholder(ExpressionStmt statement, String name) {
        Expression expression = statement.getExpression();
        return expression instanceof MethodCallExpr && ((MethodCallExpr) expression).getScope().isEmpty() &&
               ((MethodCallExpr) expression).getNameAsString().equals(name);
    }

    private Statement action(MatchChain.Arm arm, Action action) {
        Statement body = arm.body();
        if (body.isExpressionStmt()) {
            Expression value = body.asExpressionStmt().getExpression();
            Optional<MatchChain> nested = MatchChain.of(value);
            if (nested.isPresent()) {
                return lower(nested.get(), action);
            }
            switch (action.kind) {
                case STATEMENT:
                    if (!AstUtils.isStatementExpression(value)) {
                        throw ctx.transformError("arm body '" + value + "' is not a statement, as a match statement requires", value, null);
                    }
                    return new ExpressionStmt(value.clone());
                case RETURN:
                    return new ReturnStmt(value.clone());
                default:
                    return new ExpressionStmt(new AssignExpr(new NameExpr(action.target), value.clone(), AssignExpr.Operator.ASSIGN));
            }
        }
        if (action.kind == Action.Kind.ASSIGN) {
            throw ctx.transformError("block arm bodies are not allowed in a match that initializes a variable", body, null);
        }
        return body.clone();
    }

    /**
     * Conservative version of the Java rule: false only when the statement certainly ends
     * abruptly.
     */
    static boolean completesNormally(Statement statement) {
        if (statement instanceof ReturnStmt || statement instanceof ThrowStmt ||
            statement instanceof BreakStmt || statement instanceof ContinueStmt) {
            return false;
        }
        if (statement instanceof BlockStmt) {
            NodeList<Statement> statements = ((BlockStmt) statement).getStatements();
            return statements.isEmpty() || completesNormally(statements.get(statements.size() - 1));
        }
        if (statement instanceof LabeledStmt) {
            LabeledStmt labeled = (LabeledStmt) statement;
            String label = labeled.getLabel().asString();
            boolean brokenOutOf = !labeled.findAll(BreakStmt.class,
                                                   b -> b.getLabel().map(l -> l.asString().equals(label)).orElse(false)).isEmpty();
            return brokenOutOf || completesNormally(labeled.getStatement());
        }
        if (statement instanceof IfStmt) {
            IfStmt ifStmt = (IfStmt) statement;
            return ifStmt.getElseStmt().isEmpty() ||
                   completesNormally(ifStmt.getThenStmt()) ||
                   completesNormally(ifStmt.getElseStmt().get());
        }
        return true;
    }
}
