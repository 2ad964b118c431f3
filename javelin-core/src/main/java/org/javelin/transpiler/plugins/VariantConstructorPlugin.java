package org.javelin.transpiler.plugins;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import org.javelin.parser.util.AstUtils;
import org.javelin.transpiler.Capability;
import org.javelin.transpiler.FactKey;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.Plugin;
import org.javelin.transpiler.PluginDescriptor;
import org.javelin.transpiler.address.AddressabilityResolver;
import org.javelin.transpiler.types.SyntheticTypeRegistry;
import org.javelin.transpiler.types.UnionInfo;
import org.javelin.transpiler.types.VariantInfo;

/**
 * Rewrites variant constructor calls into record creation: {@code Circle(2.0)} and
 * {@code Shape.Circle(2.0)} both become {@code new Shape.Circle(2.0)}, with a diamond for
 * generic unions.
 * <p>
 * The builtin {@code Some(x)} lifts null: a reference argument that is null yields
 * {@code None}. The argument is evaluated exactly once, through a temporary when it is not
 * addressable.
 */
public class VariantConstructorPlugin implements Plugin {

    public static final String NAME = "variant-constructors";

    private static final FactKey<LocalMethods> LOCAL_METHODS =
            FactKey.of(NAME, LocalMethods.class, LocalMethods::new);

    static final String NULL_LIFTING_TEMPLATE =
            AddressabilityResolver.ARGUMENT + " != null ? new Option.Some<>(" + AddressabilityResolver.ARGUMENT + ") : new Option.None<>()";

    private static final PluginDescriptor DESCRIPTOR = PluginDescriptor.of(
            NAME, "variant constructor calls", List.of(UnionDeclarationPlugin.NAME, BuiltinUnionPlugin.NAME),
            Capability.DISCOVER, Capability.TRANSFORM);

    @Override
    public PluginDescriptor descriptor() {
        return DESCRIPTOR;
    }

    /**
     * Collects the methods declared in the file: a call to one of them is a method call,
     * never a variant constructor.
     */
    @Override
    public void discover(CompilationUnit unit, PipelineContext ctx) {
        Set<String> methods = localMethods(ctx);
        for (MethodDeclaration method : unit.findAll(MethodDeclaration.class)) {
            boolean variant = method.getParentNode()
                                    .map(UnionDeclarationPlugin::isUnionDeclaration)
                                    .orElse(false);
            if (!variant) {
                methods.add(method.getNameAsString());
            }
        }
    }

    private static Set<String> localMethods(PipelineContext ctx) {
        return ctx.facts(LOCAL_METHODS).names;
    }

    private static final class LocalMethods {
        final Set<String> names = new HashSet<>();
    }

    @Override
    public Node transform(Node node, PipelineContext ctx) {
        if (!(node instanceof MethodCallExpr)) {
            return node;
        }
        MethodCallExpr call = (MethodCallExpr) node;
        Optional<VariantInfo> target = resolve(call, ctx);
        if (target.isEmpty()) {
            return node;
        }
        VariantInfo variant = target.get();
        SyntheticTypeRegistry registry = ctx.types().registry();
        UnionInfo union = registry.union(variant.union()).orElseThrow();
        if (call.getArguments().size() != variant.arity()) {
            throw ctx.transformError("variant " + variant.qualifiedName() + " takes " + variant.arity() +
                                     " argument(s) but " + call.getArguments().size() + " were given", call, null);
        }

        if (union.synthetic() && union.name().equals(BuiltinUnionPlugin.OPTION) && variant.tag().equals("Some")) {
            return liftSome(call.getArgument(0), ctx);
        }

        ClassOrInterfaceType type = new ClassOrInterfaceType(new ClassOrInterfaceType(null, union.name()), variant.tag());
        if (union.isGeneric()) {
            type.setTypeArguments(new NodeList<>());
        }
        NodeList<Expression> arguments = new NodeList<>();
        for (Expression argument : call.getArguments()) {
            arguments.add(argument.clone());
        }
        ObjectCreationExpr creation = new ObjectCreationExpr(null, type, arguments);
        if (!union.isGeneric()) {
            ctx.types().recordSynthetic(creation, union.name());
        }
        return creation;
    }

    private Optional<VariantInfo> resolve(MethodCallExpr call, PipelineContext ctx) {
        SyntheticTypeRegistry registry = ctx.types().registry();
        String tag = call.getNameAsString();
        if (tag.isEmpty() || !Character.isUpperCase(tag.charAt(0))) {
            return Optional.empty();
        }
        if (call.getScope().isEmpty()) {
            if (localMethods(ctx).contains(tag)) {
                return Optional.empty();
            }
            List<VariantInfo> variants = registry.variantsNamed(tag);
            // user unions shadow the builtin ones
            if (variants.stream().anyMatch(v -> !registry.isSynthetic(v.union()))) {
                variants.removeIf(v -> registry.isSynthetic(v.union()));
            }
            if (variants.size() > 1) {
                StringBuilder candidates = new StringBuilder();
                for (VariantInfo variant : variants) {
                    candidates.append(candidates.length() == 0 ? "" : ", ").append(variant.qualifiedName());
                }
                throw ctx.transformError("ambiguous variant '" + tag + "', qualify it as one of " + candidates, call, null);
            }
            return variants.isEmpty() ? Optional.empty() : Optional.of(variants.get(0));
        }
        Expression scope = call.getScope().get();
        if (!(scope instanceof NameExpr || scope instanceof FieldAccessExpr)) {
            return Optional.empty();
        }
        String qualifier = scope.toString();
        Optional<UnionInfo> union = registry.union(qualifier);
        if (union.isEmpty() || !SyntheticTypeRegistry.simpleName(qualifier).equals(union.get().name())) {
            return Optional.empty();
        }
        return union.get().variant(tag);
    }

    private Expression liftSome(Expression argument, PipelineContext ctx) {
        Optional<String> type = ctx.types().resolveType(argument);
        if (type.isPresent() && AstUtils.isPrimitive(type.get())) {
            // a primitive is never null
            ClassOrInterfaceType some = new ClassOrInterfaceType(new ClassOrInterfaceType(null, BuiltinUnionPlugin.OPTION), "Some");
            some.setTypeArguments(new NodeList<>());
            return new ObjectCreationExpr(null, some, new NodeList<>(argument.clone()));
        }
        String resultType = type.map(t -> BuiltinUnionPlugin.OPTION + "<" + AstUtils.boxed(t) + ">").orElse(BuiltinUnionPlugin.OPTION);
        return AddressabilityResolver.bind(argument, NULL_LIFTING_TEMPLATE, resultType, ctx);
    }
}
