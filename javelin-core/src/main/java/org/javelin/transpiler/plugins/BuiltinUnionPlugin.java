package org.javelin.transpiler.plugins;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import org.javelin.InjectException;
import org.javelin.parser.util.AstUtils;
import org.javelin.transpiler.Capability;
import org.javelin.transpiler.FactKey;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.Plugin;
import org.javelin.transpiler.PluginDescriptor;
import org.javelin.transpiler.match.MatchChain;
import org.javelin.transpiler.types.SyntheticTypeRegistry;
import org.javelin.transpiler.types.UnionInfo;
import org.javelin.transpiler.types.VariantField;
import org.javelin.transpiler.types.VariantInfo;

/**
 * Provides {@code Option<T>} and {@code Result<T, E>} to files that use them without
 * declaring or importing a type of the same name. The declarations are appended to the
 * file that uses them, once per file.
 */
public class BuiltinUnionPlugin implements Plugin {

    public static final String NAME = "builtin-unions";

    private static final FactKey<Used> USED = FactKey.of(NAME, Used.class, Used::new);

    public static final String OPTION = "Option";
    public static final String RESULT = "Result";

    private static final PluginDescriptor DESCRIPTOR = PluginDescriptor.of(
            NAME, "builtin Option and Result unions", List.of(),
            Capability.SHARED_CONTEXT, Capability.DISCOVER, Capability.DECLARATIONS);

    private static final UnionInfo OPTION_UNION = new UnionInfo(OPTION, List.of("T"), List.of(
            new VariantInfo(OPTION, "Some", List.of(new VariantField("value", "T"))),
            new VariantInfo(OPTION, "None", List.of())), true);

    private static final UnionInfo RESULT_UNION = new UnionInfo(RESULT, List.of("T", "E"), List.of(
            new VariantInfo(RESULT, "Ok", List.of(new VariantField("value", "T"))),
            new VariantInfo(RESULT, "Err", List.of(new VariantField("error", "E")))), true);

    private static final String OPTION_DECLARATION =
            "sealed interface Option<T> {\n" +
            "    record Some<T>(T value) implements Option<T> {}\n" +
            "    record None<T>() implements Option<T> {}\n" +
            "    default boolean isSome() { return this instanceof Some<?>; }\n" +
            "    default boolean isNone() { return this instanceof None<?>; }\n" +
            "    default T unwrap() {\n" +
            "        if (this instanceof Some<T> some) { return some.value(); }\n" +
            "        throw new IllegalStateException(\"called unwrap() on None\");\n" +
            "    }\n" +
            "    default T unwrapOr(T fallback) {\n" +
            "        if (this instanceof Some<T> some) { return some.value(); }\n" +
            "        return fallback;\n" +
            "    }\n" +
            "}";

    private static final String RESULT_DECLARATION =
            "sealed interface Result<T, E> {\n" +
            "    record Ok<T, E>(T value) implements Result<T, E> {}\n" +
            "    record Err<T, E>(E error) implements Result<T, E> {}\n" +
            "    default boolean isOk() { return this instanceof Ok<?, ?>; }\n" +
            "    default boolean isErr() { return this instanceof Err<?, ?>; }\n" +
            "    default T unwrap() {\n" +
            "        if (this instanceof Ok<T, E> ok) { return ok.value(); }\n" +
            "        throw new IllegalStateException(\"called unwrap() on Err: \" + ((Err<T, E>) this).error());\n" +
            "    }\n" +
            "    default T unwrapOr(T fallback) {\n" +
            "        if (this instanceof Ok<T, E> ok) { return ok.value(); }\n" +
            "        return fallback;\n" +
            "    }\n" +
            "    default E unwrapErr() {\n" +
            "        if (this instanceof Err<T, E> err) { return err.error(); }\n" +
            "        throw new IllegalStateException(\"called unwrapErr() on Ok\");\n" +
            "    }\n" +
            "    @SuppressWarnings(\"unchecked\")\n" +
            "    default <U> Result<U, E> propagate() { return (Result<U, E>) (Result<?, E>) this; }\n" +
            "}";

    private static final Map<String, String> DECLARATIONS = Map.of(OPTION, OPTION_DECLARATION, RESULT, RESULT_DECLARATION);

    @Override
    public PluginDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public void receiveContext(PipelineContext ctx) {
        CompilationUnit unit = ctx.unit();
        for (UnionInfo union : List.of(OPTION_UNION, RESULT_UNION)) {
            if (!isShadowed(unit, union.name())) {
                ctx.types().registry().register(union);
            }
        }
    }

    private static boolean isShadowed(CompilationUnit unit, String name) {
        for (ImportDeclaration declaration : unit.getImports()) {
            if (!declaration.isAsterisk() && declaration.getName().getIdentifier().equals(name)) {
                return true;
            }
        }
        return unit.findFirst(TypeDeclaration.class, t -> t.getNameAsString().equals(name)).isPresent();
    }

    @Override
    public void discover(CompilationUnit unit, PipelineContext ctx) {
        SyntheticTypeRegistry registry = ctx.types().registry();
        Set<String> used = used(ctx);
        for (String name : List.of(OPTION, RESULT)) {
            if (!registry.isSynthetic(name)) {
                continue;
            }
            UnionInfo union = registry.union(name).orElseThrow();
            boolean mentioned = unit.findFirst(ClassOrInterfaceType.class, t -> t.getNameAsString().equals(name)).isPresent() ||
                                unit.findFirst(NameExpr.class, n -> n.getNameAsString().equals(name)).isPresent() ||
                                unit.findFirst(MethodCallExpr.class, call -> isVariantCall(call, union, registry)).isPresent() ||
                                unit.findFirst(StringLiteralExpr.class,
                                               s -> MatchChain.isArmPattern(s) && mentionsVariant(s.asString(), union)).isPresent();
            if (mentioned) {
                used.add(name);
            }
        }
    }

    private static boolean isVariantCall(MethodCallExpr call, UnionInfo union, SyntheticTypeRegistry registry) {
        String tag = call.getNameAsString();
        if (union.variant(tag).isEmpty()) {
            return false;
        }
        if (call.getScope().isEmpty()) {
            // an unqualified tag a user union also declares belongs to the user union
            return registry.variantsNamed(tag).stream().allMatch(v -> registry.isSynthetic(v.union()));
        }
        return call.getScope().get() instanceof NameExpr && ((NameExpr) call.getScope().get()).getNameAsString().equals(union.name());
    }

    // match arms name variants only inside their pattern strings
    private static boolean mentionsVariant(String pattern, UnionInfo union) {
        for (String tag : union.tags()) {
            if (Pattern.compile("\\b" + tag + "\\b").matcher(pattern).find()) {
                return true;
            }
        }
        return false;
    }

    private Set<String> used(PipelineContext ctx) {
        return ctx.facts(USED).names;
    }

    private static final class Used {
        final Set<String> names = new LinkedHashSet<>();
    }

    @Override
    public List<TypeDeclaration<?>> declarations(PipelineContext ctx) {
        List<TypeDeclaration<?>> declarations = new ArrayList<>();
        for (String name : used(ctx)) {
            // a user union of the same name may have replaced the builtin after discovery
            if (!ctx.types().registry().isSynthetic(name)) {
                continue;
            }
            try {
                declarations.add(AstUtils.parseTypeDeclaration(DECLARATIONS.get(name)));
            } catch (RuntimeException e) {
                throw new InjectException(NAME, name, e);
            }
        }
        return declarations;
    }
}
