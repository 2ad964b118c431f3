package org.javelin.transpiler.plugins;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import org.javelin.ExhaustivenessException;
import org.javelin.TypeUnavailableException;
import org.javelin.mapping.Position;
import org.javelin.parser.util.AstUtils;
import org.javelin.transpiler.Capability;
import org.javelin.transpiler.FactKey;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.Plugin;
import org.javelin.transpiler.PluginDescriptor;
import org.javelin.transpiler.match.ColumnPattern;
import org.javelin.transpiler.match.ExhaustivenessChecker;
import org.javelin.transpiler.match.ExhaustivenessRequirement;
import org.javelin.transpiler.match.ExhaustivenessResult;
import org.javelin.transpiler.match.MatchChain;
import org.javelin.transpiler.match.MatchInfo;
import org.javelin.transpiler.match.MatchLowering;
import org.javelin.transpiler.match.Pattern;
import org.javelin.transpiler.match.PatternParser;
import org.javelin.transpiler.match.PatternRow;
import org.javelin.transpiler.match.TupleMatchSpec;
import org.javelin.transpiler.types.SyntheticTypeRegistry;
import org.javelin.transpiler.types.UnionInfo;
import org.javelin.transpiler.types.VariantInfo;

/**
 * Match expressions. Discovery parses every arm, works out which union each column
 * matches on and rejects non-exhaustive matches; Transform lowers each match where it
 * stands: as a statement, as a returned value or as a local variable initializer.
 */
public class PatternMatchPlugin implements Plugin {

    public static final String NAME = "pattern-match";

    private static final FactKey<Matches> MATCHES = FactKey.of(NAME, Matches.class, Matches::new);

    private static final PluginDescriptor DESCRIPTOR = PluginDescriptor.of(
            NAME, "match expressions",
            List.of(UnionDeclarationPlugin.NAME, BuiltinUnionPlugin.NAME, VariantConstructorPlugin.NAME),
            Capability.DISCOVER, Capability.TRANSFORM);

    @Override
    public PluginDescriptor descriptor() {
        return DESCRIPTOR;
    }

    private static Map<Position, MatchInfo> matches(PipelineContext ctx) {
        return ctx.facts(MATCHES).byPosition;
    }

    private static final class Matches {
        final Map<Position, MatchInfo> byPosition = new HashMap<>();
    }

    @Override
    public void discover(CompilationUnit unit, PipelineContext ctx) {
        Map<Position, MatchInfo> matches = matches(ctx);
        for (MethodCallExpr start : unit.findAll(MethodCallExpr.class, MatchChain::isStart)) {
            MatchChain chain = MatchChain.fromStart(start)
                                         .orElseThrow(() -> ctx.discoveryError("malformed match expression", start, null));
            if (chain.isGuardOfAnother()) {
                throw ctx.discoveryError("a match cannot be used as a guard", start, null);
            }
            matches.put(chain.key(), analyse(chain, ctx));
        }
    }

    private MatchInfo analyse(MatchChain chain, PipelineContext ctx) {
        int arity = chain.arity();
        List<List<Pattern>> arms = new ArrayList<>();
        for (MatchChain.Arm arm : chain.arms()) {
            List<Pattern> patterns;
            try {
                patterns = PatternParser.parseArm(arm.patternText(), arity);
            } catch (IllegalArgumentException e) {
                throw ctx.discoveryError(e.getMessage(), arm.pattern(), e);
            }
            if (arity > 1 && patterns.get(0) instanceof Pattern.Binding && !arm.patternText().trim().startsWith("(")) {
                throw ctx.discoveryError("binding '" + patterns.get(0) + "' cannot stand for " + arity +
                                         " values, use _ or a tuple pattern", arm.pattern(), null);
            }
            checkBindings(patterns, arm, ctx);
            arms.add(patterns);
        }

        List<UnionInfo> unions = new ArrayList<>();
        List<String> typeArguments = new ArrayList<>();
        for (int column = 0; column < arity; column++) {
            Expression scrutinee = chain.scrutinees().get(column);
            List<Pattern.Variant> variants = new ArrayList<>();
            for (List<Pattern> arm : arms) {
                if (arm.get(column) instanceof Pattern.Variant) {
                    variants.add((Pattern.Variant) arm.get(column));
                }
            }
            Optional<String> scrutineeType = ctx.types().resolveType(scrutinee);
            UnionInfo union = columnUnion(scrutineeType, variants, chain, ctx);
            if (union != null) {
                validate(union, variants, chain, ctx);
            }
            String arguments = union == null ? null : typeArguments(union, scrutineeType);
            if (union != null && union.isGeneric() && arguments == null && !variants.isEmpty()) {
                ctx.warn("cannot tell the type arguments of '" + scrutinee + "', matching on raw " + union.name(), scrutinee);
            }
            unions.add(union);
            typeArguments.add(arguments);
        }

        checkExhaustive(chain, arms, unions, ctx);

        int reachable = arms.size();
        for (int index = 0; index < arms.size(); index++) {
            if (!chain.arms().get(index).isGuarded() && isCatchAll(arms.get(index))) {
                reachable = index + 1;
                break;
            }
        }
        for (int index = reachable; index < arms.size(); index++) {
            MatchChain.Arm arm = chain.arms().get(index);
            ctx.warn("unreachable arm '" + arm.patternText() + "' follows a catch-all arm", arm.pattern());
        }
        return new MatchInfo(arity, unions, typeArguments, arms, reachable, ctx.originalPosition(chain.start()).line());
    }

    private static boolean isCatchAll(List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            if (!pattern.isIrrefutable()) {
                return false;
            }
        }
        return true;
    }

    private static void checkBindings(List<Pattern> patterns, MatchChain.Arm arm, PipelineContext ctx) {
        Set<String> names = new HashSet<>();
        for (Pattern pattern : patterns) {
            List<Pattern> bound = pattern instanceof Pattern.Variant ? ((Pattern.Variant) pattern).fields() : List.of(pattern);
            for (Pattern candidate : bound) {
                if (candidate instanceof Pattern.Binding && !names.add(((Pattern.Binding) candidate).name())) {
                    throw ctx.discoveryError("binding '" + candidate + "' is used twice in pattern '" + arm.patternText() + "'",
                                             arm.pattern(), null);
                }
            }
        }
    }

    private static UnionInfo columnUnion(Optional<String> scrutineeType, List<Pattern.Variant> variants,
                                         MatchChain chain, PipelineContext ctx) {
        SyntheticTypeRegistry registry = ctx.types().registry();
        if (scrutineeType.isPresent()) {
            Optional<UnionInfo> declared = registry.union(scrutineeType.get());
            if (declared.isPresent()) {
                return declared.get();
            }
        }
        if (variants.isEmpty()) {
            return null;
        }
        for (Pattern.Variant variant : variants) {
            if (variant.qualifier() != null) {
                return registry.union(variant.qualifier())
                               .orElseThrow(() -> ctx.discoveryError("unknown union '" + variant.qualifier() + "'", chain.start(), null));
            }
        }
        Set<String> candidates = null;
        for (Pattern.Variant variant : variants) {
            Set<String> owners = new LinkedHashSet<>();
            for (VariantInfo info : registry.variantsNamed(variant.tag())) {
                owners.add(info.union());
            }
            if (owners.isEmpty()) {
                throw ctx.discoveryError("unknown variant '" + variant.tag() + "'", chain.start(), null);
            }
            if (candidates == null) {
                candidates = owners;
            } else {
                candidates.retainAll(owners);
            }
        }
        if (candidates.size() > 1 && candidates.stream().anyMatch(name -> !registry.isSynthetic(name))) {
            candidates.removeIf(registry::isSynthetic);
        }
        if (candidates.isEmpty()) {
            String tags = variants.stream().map(Pattern.Variant::tag).distinct().collect(Collectors.joining(", "));
            throw ctx.discoveryError("no union declares all of the variants " + tags, chain.start(), null);
        }
        if (candidates.size() > 1) {
            throw ctx.discoveryError("ambiguous variants, qualify them with one of the unions " + candidates, chain.start(), null);
        }
        return registry.union(candidates.iterator().next()).orElseThrow();
    }

    private static void validate(UnionInfo union, List<Pattern.Variant> variants, MatchChain chain, PipelineContext ctx) {
        for (Pattern.Variant pattern : variants) {
            if (pattern.qualifier() != null && !SyntheticTypeRegistry.simpleName(pattern.qualifier()).equals(union.name())) {
                throw ctx.discoveryError("pattern '" + pattern + "' does not match a value of union " + union.name(), chain.start(), null);
            }
            Optional<VariantInfo> variant = union.variant(pattern.tag());
            if (variant.isEmpty()) {
                throw ctx.discoveryError("union " + union.name() + " has no variant '" + pattern.tag() + "', expected one of " +
                                         union.tags(), chain.start(), null);
            }
            if (pattern.hasFieldList() && pattern.fields().size() != variant.get().arity()) {
                throw ctx.discoveryError("variant " + variant.get().qualifiedName() + " has " + variant.get().arity() +
                                         " field(s) but pattern '" + pattern + "' lists " + pattern.fields().size(),
                                         chain.start(), null);
            }
        }
    }

    /**
     * The written type arguments of the scrutinee, such as {@code <Integer, String>}, when
     * they fit the union's type parameters.
     */
    private static String typeArguments(UnionInfo union, Optional<String> scrutineeType) {
        if (!union.isGeneric() || scrutineeType.isEmpty()) {
            return null;
        }
        ParseResult<ClassOrInterfaceType> parsed = AstUtils.parser().parseClassOrInterfaceType(scrutineeType.get());
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            return null;
        }
        Optional<NodeList<Type>> arguments = parsed.getResult().get().getTypeArguments();
        if (arguments.isEmpty() || arguments.get().size() != union.typeParameters().size()) {
            return null;
        }
        return arguments.get().stream().map(Type::asString).collect(Collectors.joining(", ", "<", ">"));
    }

    private static void checkExhaustive(MatchChain chain, List<List<Pattern>> arms, List<UnionInfo> unions, PipelineContext ctx) {
        List<PatternRow> rows = new ArrayList<>();
        for (int index = 0; index < arms.size(); index++) {
            List<ColumnPattern> columns = new ArrayList<>();
            for (Pattern pattern : arms.get(index)) {
                columns.add(ColumnPattern.of(pattern));
            }
            rows.add(new PatternRow(columns, chain.arms().get(index).isGuarded()));
        }
        List<List<String>> requirement = new ArrayList<>();
        for (UnionInfo union : unions) {
            requirement.add(union == null ? List.of() : union.tags());
        }

        ExhaustivenessChecker checker = new ExhaustivenessChecker(ctx.config().getMaxTupleArity(), ctx.config().getMaxCombinations());
        ExhaustivenessResult result;
        try {
            result = checker.check(new TupleMatchSpec(chain.arity(), rows), new ExhaustivenessRequirement(requirement));
        } catch (IllegalArgumentException e) {
            throw ctx.discoveryError(e.getMessage(), chain.start(), e);
        }
        if (!result.exhaustive()) {
            ExhaustivenessException missing = new ExhaustivenessException(result.missing(), ctx.originalPosition(chain.start()));
            String combination = result.missing().size() == 1 ? result.missing().get(0) : "(" + String.join(", ", result.missing()) + ")";
            throw ctx.discoveryError("non-exhaustive match, missing " + combination, chain.start(), missing);
        }
    }

    /**
     * Lowers the match ending in {@code node}. The enclosing statement is replaced through
     * the context, so the call itself is returned unchanged.
     */
    @Override
    public Node transform(Node node, PipelineContext ctx) {
        Optional<MatchChain> found = MatchChain.of(node);
        if (found.isEmpty()) {
            return node;
        }
        MatchChain chain = found.get();
        if (chain.enclosingAsBody().isPresent()) {
            // lowered together with the match whose arm it is
            return node;
        }
        MatchLowering lowering = new MatchLowering(ctx, matches(ctx));
        Node parent = chain.end().getParentNode().orElseThrow();

        if (parent instanceof ExpressionStmt) {
            if (parent.getParentNode().orElse(null) instanceof LambdaExpr) {
                throw ctx.transformError("match as a lambda expression body is not supported, use a block body", chain.start(), null);
            }
            ctx.replace(parent, lowering.lower(chain, MatchLowering.Action.statement()));
            return node;
        }
        if (parent instanceof ReturnStmt) {
            ctx.replace(parent, lowering.lower(chain, MatchLowering.Action.returning()));
            return node;
        }
        if (parent instanceof VariableDeclarator) {
            lowerDeclaration((VariableDeclarator) parent, chain, lowering, ctx);
            return node;
        }
        throw ctx.transformError("match is only supported as a statement, a return value or a variable initializer",
                                 chain.start(), null);
    }

    private void lowerDeclaration(VariableDeclarator declarator, MatchChain chain, MatchLowering lowering, PipelineContext ctx) {
        Node holder = declarator.getParentNode().orElse(null);
        if (!(holder instanceof VariableDeclarationExpr) || !(holder.getParentNode().orElse(null) instanceof ExpressionStmt)) {
            throw ctx.transformError("match is only supported as a statement, a return value or a variable initializer",
                                     chain.start(), null);
        }
        VariableDeclarationExpr declaration = (VariableDeclarationExpr) holder;
        if (declaration.getVariables().size() != 1) {
            throw ctx.transformError("a match must initialize the only variable of its declaration", declarator, null);
        }
        ExpressionStmt statement = (ExpressionStmt) declaration.getParentNode().get();
        String name = declarator.getNameAsString();

        Type type;
        if (declarator.getType().isVarType()) {
            String inferred = inferType(chain, ctx)
                    .orElseThrow(() -> new TypeUnavailableException(name, "declaring the variable a match initializes"));
            type = AstUtils.parseType(inferred);
        } else {
            type = declarator.getType().clone();
        }
        VariableDeclarationExpr uninitialized = new VariableDeclarationExpr(type, name);
        NodeList<Modifier> modifiers = new NodeList<>();
        for (Modifier modifier : declaration.getModifiers()) {
            modifiers.add(modifier.clone());
        }
        uninitialized.setModifiers(modifiers);
        for (AnnotationExpr annotation : declaration.getAnnotations()) {
            uninitialized.addAnnotation(annotation.clone());
        }

        LabeledStmt lowered = lowering.lower(chain, MatchLowering.Action.assign(name));
        ctx.replace(statement, lowered);
        ctx.insertBefore(lowered, new ExpressionStmt(uninitialized));
    }

    /**
     * The type of the first arm body whose type is known.
     */
    private static Optional<String> inferType(MatchChain chain, PipelineContext ctx) {
        for (MatchChain.Arm arm : chain.arms()) {
            if (!arm.body().isExpressionStmt()) {
                continue;
            }
            Expression value = arm.body().asExpressionStmt().getExpression();
            Optional<MatchChain> nested = MatchChain.of(value);
            Optional<String> type = nested.isPresent() ? inferType(nested.get(), ctx) : ctx.types().resolveType(value);
            if (type.isPresent() && !type.get().equals("void")) {
                return type;
            }
        }
        return Optional.empty();
    }
}
