package org.javelin.transpiler.plugins;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import org.javelin.parser.util.AstUtils;
import org.javelin.rewrite.SafeNavigationRewriter;
import org.javelin.transpiler.Capability;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.Plugin;
import org.javelin.transpiler.PluginDescriptor;
import org.javelin.transpiler.address.AddressabilityResolver;
import org.javelin.transpiler.types.SyntheticTypeRegistry;

/**
 * Lowers {@code $nav(receiver, $it.step, ...)} chains onto {@link java.util.Optional}:
 * <pre>
 * Optional.ofNullable(user).map(__tmp0 -&gt; __tmp0.address().city).map(__tmp1 -&gt; __tmp1.name()).orElse(null)
 * </pre>
 * The receiver is evaluated once and every step only runs while the value so far is not
 * null. Used as a statement, the last step runs through {@code ifPresent}, so it may be a
 * void call.
 * <p>
 * Steps become lambda bodies: the locals they read must be effectively final.
 */
public class SafeNavigationPlugin implements Plugin {

    public static final String NAME = "safe-navigation";

    private static final String OPTIONAL = "java.util.Optional";
    private static final String STEP = "$step";

    private static final PluginDescriptor DESCRIPTOR = PluginDescriptor.of(
            NAME, "safe navigation chains", List.of(UnionDeclarationPlugin.NAME, BuiltinUnionPlugin.NAME),
            Capability.TRANSFORM);

    @Override
    public PluginDescriptor descriptor() {
        return DESCRIPTOR;
    }

    static boolean isMarker(Node node, String marker) {
        if (!(node instanceof MethodCallExpr)) {
            return false;
        }
        MethodCallExpr call = (MethodCallExpr) node;
        return call.getScope().isEmpty() && call.getNameAsString().equals(marker);
    }

    @Override
    public Node transform(Node node, PipelineContext ctx) {
        if (!isMarker(node, SafeNavigationRewriter.MARKER)) {
            return node;
        }
        MethodCallExpr call = (MethodCallExpr) node;
        if (call.getArguments().size() < 2) {
            throw ctx.transformError("malformed safe navigation chain", call, null);
        }
        Expression receiver = call.getArgument(0);
        Optional<String> type = ctx.types().resolveType(receiver);
        if (type.isPresent()) {
            if (AstUtils.isPrimitive(type.get())) {
                throw ctx.transformError("'?.' on '" + receiver + "' of primitive type " + type.get() + ", which is never null", call, null);
            }
            String simple = SyntheticTypeRegistry.simpleName(type.get());
            if (ctx.types().registry().isUnion(simple)) {
                throw ctx.transformError("'?.' needs a nullable reference but '" + receiver + "' is a " + simple +
                                         " value, use match or '??' instead", call, null);
            }
        }

        boolean statement = call.getParentNode().filter(p -> p instanceof ExpressionStmt).isPresent();
        StringBuilder template = new StringBuilder(ctx.requireImport(OPTIONAL))
                .append(".ofNullable(").append(AddressabilityResolver.ARGUMENT).append(")");
        List<Expression> steps = new ArrayList<>();
        int last = call.getArguments().size() - 1;
        for (int index = 1; index <= last; index++) {
            Expression step = call.getArgument(index).clone();
            String parameter = ctx.freshName(AddressabilityResolver.TEMP_PREFIX);
            if (AstUtils.substitute(step, SafeNavigationRewriter.STEP_RECEIVER, new NameExpr(parameter)) == 0) {
                throw ctx.transformError("malformed safe navigation step '" + step + "'", call, null);
            }
            steps.add(step);
            template.append(index == last && statement ? ".ifPresent(" : ".map(")
                    .append(parameter).append(" -> ").append(STEP).append(index).append(")");
        }
        if (!statement) {
            template.append(".orElse(null)");
        }

        Expression result = AstUtils.parseExpression(template.toString());
        AstUtils.substitute(result, AddressabilityResolver.ARGUMENT, receiver);
        for (int index = 1; index <= last; index++) {
            AstUtils.substitute(result, STEP + index, steps.get(index - 1));
        }
        return result;
    }
}
