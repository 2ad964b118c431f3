package org.javelin.transpiler.plugins;

import java.util.List;
import java.util.Optional;

import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import org.javelin.parser.util.AstUtils;
import org.javelin.rewrite.NullCoalescingRewriter;
import org.javelin.transpiler.Capability;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.Plugin;
import org.javelin.transpiler.PluginDescriptor;
import org.javelin.transpiler.address.AddressabilityResolver;
import org.javelin.transpiler.types.SyntheticTypeRegistry;

/**
 * Lowers {@code $coalesce(left, right)}. The left operand is evaluated once; the right one
 * only when it is needed.
 * <ul>
 *     <li>an {@code Option} on the left unwraps: {@code (opt.isSome() ? opt.unwrap() : right)}</li>
 *     <li>an addressable reference: {@code (name != null ? name : right)}</li>
 *     <li>any other reference: {@code Optional.ofNullable(left).orElseGet(() -> right)}</li>
 * </ul>
 * A computed {@code Option} goes through a temporary, see {@link AddressabilityResolver}.
 */
public class NullCoalescingPlugin implements Plugin {

    public static final String NAME = "null-coalescing";

    static final String ALTERNATIVE = "$alt";

    static final String OPTION_TEMPLATE =
            AddressabilityResolver.ARGUMENT + ".isSome() ? " + AddressabilityResolver.ARGUMENT + ".unwrap() : " + ALTERNATIVE;
    static final String NULL_TEMPLATE =
            AddressabilityResolver.ARGUMENT + " != null ? " + AddressabilityResolver.ARGUMENT + " : " + ALTERNATIVE;

    private static final String OPTIONAL = "java.util.Optional";

    private static final PluginDescriptor DESCRIPTOR = PluginDescriptor.of(
            NAME, "null coalescing operator", List.of(BuiltinUnionPlugin.NAME),
            Capability.TRANSFORM);

    @Override
    public PluginDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Node transform(Node node, PipelineContext ctx) {
        if (!SafeNavigationPlugin.isMarker(node, NullCoalescingRewriter.MARKER)) {
            return node;
        }
        MethodCallExpr call = (MethodCallExpr) node;
        if (call.getArguments().size() != 2) {
            throw ctx.transformError("malformed null coalescing expression", call, null);
        }
        Expression left = call.getArgument(0);
        Expression right = call.getArgument(1);
        Optional<String> type = ctx.types().resolveType(left);

        if (type.isPresent() && AstUtils.isPrimitive(type.get())) {
            throw ctx.transformError("left operand of '??' has primitive type " + type.get() + " and is never null", call, null);
        }
        if (type.isPresent() && isOption(type.get(), ctx)) {
            Expression result = AddressabilityResolver.bind(left, OPTION_TEMPLATE, optionValueType(type.get()), ctx);
            AstUtils.substitute(result, ALTERNATIVE, right);
            return result;
        }
        if (AddressabilityResolver.isAddressable(left)) {
            Expression result;
            if (type.isPresent()) {
                result = AddressabilityResolver.bind(left, NULL_TEMPLATE, type.get(), ctx);
            } else {
                result = AstUtils.parseExpression("(" + NULL_TEMPLATE + ")");
                AstUtils.substitute(result, AddressabilityResolver.ARGUMENT, left);
            }
            AstUtils.substitute(result, ALTERNATIVE, right);
            return result;
        }
        Expression result = AstUtils.parseExpression(
                ctx.requireImport(OPTIONAL) + ".ofNullable(" + AddressabilityResolver.ARGUMENT + ").orElseGet(() -> " + ALTERNATIVE + ")");
        AstUtils.substitute(result, AddressabilityResolver.ARGUMENT, left);
        AstUtils.substitute(result, ALTERNATIVE, right);
        type.ifPresent(t -> ctx.types().recordSynthetic(result, t));
        return result;
    }

    private static boolean isOption(String type, PipelineContext ctx) {
        String simple = SyntheticTypeRegistry.simpleName(type);
        return simple.equals(BuiltinUnionPlugin.OPTION) && ctx.types().registry().isSynthetic(simple);
    }

    // Option<String> unwraps to String; a raw Option to Object
    private static String optionValueType(String type) {
        ParseResult<ClassOrInterfaceType> parsed = AstUtils.parser().parseClassOrInterfaceType(type);
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            return "Object";
        }
        Optional<NodeList<Type>> arguments = parsed.getResult().get().getTypeArguments();
        if (arguments.isEmpty() || arguments.get().size() != 1) {
            return "Object";
        }
        return AstUtils.boxed(arguments.get().get(0).asString());
    }
}
