package org.javelin.transpiler.types;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import org.javelin.TypeUnavailableException;

/**
 * Memoized, best-effort expression typing for one file.
 * <p>
 * {@link #typeOf(Expression)} asks only the type oracle. {@link #resolveType(Expression)}
 * falls back to what the syntax alone tells: literal shapes, object creation, variant
 * constructor calls, declared locals, parameters and fields, return types of methods in
 * the same file, and types recorded for generated nodes. Results are cached per node
 * identity, so a node replaced during Transform is looked up afresh.
 */
public class TypeFactCache {

    private static final int MAX_DEPTH = 16;

    private final TypeFacts facts;
    private final SyntheticTypeRegistry registry;
    private final Map<Node, Optional<String>> oracleCache = new IdentityHashMap<>();
    private final Map<Node, Optional<String>> resolvedCache = new IdentityHashMap<>();
    private final Map<Node, String> synthetic = new IdentityHashMap<>();

    public TypeFactCache(TypeFacts facts, SyntheticTypeRegistry registry) {
        this.facts = facts;
        this.registry = registry;
    }

    public SyntheticTypeRegistry registry() {
        return registry;
    }

    public Optional<String> typeOf(Expression expression) {
        return oracleCache.computeIfAbsent(expression, e -> facts.typeOf((Expression) e));
    }

    public Optional<String> resolveType(Expression expression) {
        return resolve(expression, 0);
    }

    /**
     * @throws TypeUnavailableException when neither the oracle nor the heuristics know
     */
    public String requireType(Expression expression, String purpose) {
        return resolveType(expression).orElseThrow(() -> new TypeUnavailableException(expression.toString(), purpose));
    }

    /**
     * Records the type of a node that did not exist in the source, so later lookups do
     * not depend on the oracle understanding generated code.
     */
    public void recordSynthetic(Node node, String type) {
        synthetic.put(node, type);
        resolvedCache.remove(node);
    }

    private Optional<String> resolve(Expression expression, int depth) {
        Optional<String> cached = resolvedCache.get(expression);
        if (cached != null) {
            return cached;
        }
        Optional<String> result;
        if (synthetic.containsKey(expression)) {
            result = Optional.of(synthetic.get(expression));
        } else {
            result = typeOf(expression);
            if (result.isEmpty() && depth < MAX_DEPTH) {
                result = structural(expression, depth);
            }
        }
        resolvedCache.put(expression, result);
        return result;
    }

    private Optional<String> structural(Expression e, int depth) {
        if (e instanceof IntegerLiteralExpr) {
            return Optional.of("int");
        }
        if (e instanceof LongLiteralExpr) {
            return Optional.of("long");
        }
        if (e instanceof DoubleLiteralExpr) {
            String value = ((DoubleLiteralExpr) e).getValue();
            return Optional.of(value.endsWith("f") || value.endsWith("F") ? "float" : "double");
        }
        if (e instanceof BooleanLiteralExpr || e instanceof InstanceOfExpr) {
            return Optional.of("boolean");
        }
        if (e instanceof CharLiteralExpr) {
            return Optional.of("char");
        }
        if (e instanceof StringLiteralExpr || e instanceof TextBlockLiteralExpr) {
            return Optional.of("String");
        }
        if (e instanceof EnclosedExpr) {
            return resolve(((EnclosedExpr) e).getInner(), depth + 1);
        }
        if (e instanceof CastExpr) {
            return Optional.of(((CastExpr) e).getType().asString());
        }
        if (e instanceof ObjectCreationExpr) {
            return creationType(((ObjectCreationExpr) e).getType());
        }
        if (e instanceof MethodCallExpr) {
            return callType((MethodCallExpr) e);
        }
        if (e instanceof NameExpr) {
            return declaredType(e, ((NameExpr) e).getNameAsString(), depth);
        }
        if (e instanceof FieldAccessExpr) {
            FieldAccessExpr access = (FieldAccessExpr) e;
            if (access.getScope() instanceof ThisExpr) {
                return fieldType(e, access.getNameAsString(), depth);
            }
            return Optional.empty();
        }
        if (e instanceof ThisExpr) {
            return e.findAncestor(TypeDeclaration.class).map(t -> ((TypeDeclaration<?>) t).getNameAsString());
        }
        if (e instanceof ArrayAccessExpr) {
            return resolve(((ArrayAccessExpr) e).getName(), depth + 1)
                    .filter(t -> t.endsWith("[]"))
                    .map(t -> t.substring(0, t.length() - 2));
        }
        if (e instanceof AssignExpr) {
            return resolve(((AssignExpr) e).getTarget(), depth + 1);
        }
        if (e instanceof ConditionalExpr) {
            ConditionalExpr conditional = (ConditionalExpr) e;
            Optional<String> then = resolve(conditional.getThenExpr(), depth + 1);
            return then.isPresent() ? then : resolve(conditional.getElseExpr(), depth + 1);
        }
        if (e instanceof UnaryExpr) {
            UnaryExpr unary = (UnaryExpr) e;
            return unary.getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT ?
                    Optional.of("boolean") :
                    resolve(unary.getExpression(), depth + 1);
        }
        if (e instanceof BinaryExpr) {
            return binaryType((BinaryExpr) e, depth);
        }
        return Optional.empty();
    }

    private Optional<String> creationType(ClassOrInterfaceType type) {
        Optional<NodeList<Type>> arguments = type.getTypeArguments();
        if (arguments.isPresent() && arguments.get().isEmpty()) {
            // diamond: the arguments come from the target, which is what we are asked for
            String raw = type.getNameWithScope();
            return registry.isUnion(unionOf(raw)) ? Optional.of(unionOf(raw)) : Optional.of(raw);
        }
        String written = type.asString();
        String raw = type.getNameWithScope();
        if (!raw.equals(unionOf(raw)) && registry.isUnion(unionOf(raw))) {
            // new Shape.Circle(...) has the union as its useful static type
            UnionInfo union = registry.union(unionOf(raw)).orElseThrow();
            if (!union.isGeneric()) {
                return Optional.of(union.name());
            }
        }
        return Optional.of(written);
    }

    private static String unionOf(String qualifiedVariant) {
        int dot = qualifiedVariant.lastIndexOf('.');
        return dot < 0 ? qualifiedVariant : qualifiedVariant.substring(0, dot);
    }

    private Optional<String> callType(MethodCallExpr call) {
        String name = call.getNameAsString();
        if (call.getScope().isEmpty() || call.getScope().get() instanceof NameExpr) {
            List<VariantInfo> variants = registry.variantsNamed(name);
            if (call.getScope().isPresent()) {
                String qualifier = call.getScope().get().toString();
                variants.removeIf(v -> !v.union().equals(qualifier));
            }
            if (variants.size() == 1) {
                UnionInfo union = registry.union(variants.get(0).union()).orElseThrow();
                if (!union.isGeneric()) {
                    return Optional.of(union.name());
                }
            }
        }
        if (call.getScope().isEmpty() || call.getScope().get() instanceof ThisExpr) {
            Optional<CompilationUnit> unit = call.findCompilationUnit();
            if (unit.isPresent()) {
                for (MethodDeclaration method : unit.get().findAll(MethodDeclaration.class)) {
                    if (method.getNameAsString().equals(name) &&
                        method.getParameters().size() == call.getArguments().size() &&
                        method.getTypeParameters().isEmpty()) {
                        return Optional.of(method.getType().asString());
                    }
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> declaredType(Expression use, String name, int depth) {
        Node scope = use.getParentNode().orElse(null);
        while (scope != null) {
            if (scope instanceof CallableDeclaration || scope instanceof LambdaExpr) {
                Optional<String> local = localType(scope, use, name, depth);
                if (local.isPresent()) {
                    return local;
                }
                NodeList<Parameter> parameters = scope instanceof LambdaExpr ?
                        ((LambdaExpr) scope).getParameters() :
                        ((CallableDeclaration<?>) scope).getParameters();
                for (Parameter parameter : parameters) {
                    if (parameter.getNameAsString().equals(name)) {
                        return parameter.getType().isUnknownType() ? Optional.empty() : Optional.of(parameter.getType().asString());
                    }
                }
            }
            if (scope instanceof TypeDeclaration) {
                return fieldType(use, name, depth);
            }
            scope = scope.getParentNode().orElse(null);
        }
        return Optional.empty();
    }

    private Optional<String> localType(Node callable, Expression use, String name, int depth) {
        VariableDeclarator best = null;
        for (VariableDeclarator declarator : callable.findAll(VariableDeclarator.class, v -> v.getNameAsString().equals(name))) {
            if (isBefore(declarator, use)) {
                best = declarator;
            }
        }
        return best == null ? Optional.empty() : variableType(best, depth);
    }

    private Optional<String> variableType(VariableDeclarator declarator, int depth) {
        Type type = declarator.getType();
        if (!type.isVarType()) {
            return Optional.of(type.asString());
        }
        return declarator.getInitializer().flatMap(init -> resolve(init, depth + 1));
    }

    private Optional<String> fieldType(Expression use, String name, int depth) {
        Optional<TypeDeclaration> owner = use.findAncestor(TypeDeclaration.class);
        if (owner.isEmpty()) {
            return Optional.empty();
        }
        TypeDeclaration<?> type = owner.get();
        for (FieldDeclaration field : type.getFields()) {
            for (VariableDeclarator declarator : field.getVariables()) {
                if (declarator.getNameAsString().equals(name)) {
                    return variableType(declarator, depth);
                }
            }
        }
        if (type instanceof RecordDeclaration) {
            for (Parameter component : ((RecordDeclaration) type).getParameters()) {
                if (component.getNameAsString().equals(name)) {
                    return Optional.of(component.getType().asString());
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isBefore(Node declaration, Node use) {
        if (declaration.getBegin().isEmpty() || use.getBegin().isEmpty()) {
            return true;
        }
        return declaration.getBegin().get().isBefore(use.getBegin().get());
    }

    private Optional<String> binaryType(BinaryExpr binary, int depth) {
        switch (binary.getOperator()) {
            case EQUALS:
            case NOT_EQUALS:
            case LESS:
            case GREATER:
            case LESS_EQUALS:
            case GREATER_EQUALS:
            case AND:
            case OR:
                return Optional.of("boolean");
            default:
                break;
        }
        Optional<String> left = resolve(binary.getLeft(), depth + 1);
        Optional<String> right = resolve(binary.getRight(), depth + 1);
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        if (binary.getOperator() == BinaryExpr.Operator.PLUS && (isString(left.get()) || isString(right.get()))) {
            return Optional.of("String");
        }
        return Optional.ofNullable(NumericPromotion.promote(left.get(), right.get()));
    }

    private static boolean isString(String type) {
        return type.equals("String") || type.equals("java.lang.String");
    }

    /**
     * Binary numeric promotion over primitive and boxed names.
     */
    static final class NumericPromotion {
        private static final List<String> ORDER = List.of("int", "long", "float", "double");

        private NumericPromotion() {
        }

        static String promote(String left, String right) {
            int l = rank(left);
            int r = rank(right);
            if (l < 0 || r < 0) {
                return left.equals(right) ? left : null;
            }
            return ORDER.get(Math.max(l, r));
        }

        private static int rank(String type) {
            switch (type) {
                case "byte":
                case "short":
                case "char":
                case "int":
                case "Integer":
                case "java.lang.Integer":
                    return 0;
                case "long":
                case "Long":
                case "java.lang.Long":
                    return 1;
                case "float":
                case "Float":
                case "java.lang.Float":
                    return 2;
                case "double":
                case "Double":
                case "java.lang.Double":
                    return 3;
                default:
                    return -1;
            }
        }
    }
}
