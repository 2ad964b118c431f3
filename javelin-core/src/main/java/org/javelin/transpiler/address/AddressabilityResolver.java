package org.javelin.transpiler.address;

import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import org.javelin.parser.util.AstUtils;
import org.javelin.transpiler.PipelineContext;

/**
 * Decides whether an expression denotes storage that can be read again without evaluating
 * anything, and otherwise binds it to a fresh temporary through an immediately applied
 * lambda:
 * <pre>
 * ((Function&lt;Integer, Option&lt;Integer&gt;&gt;) __tmp0 -&gt; __tmp0 != null ? ... : ...).apply(compute())
 * </pre>
 * The argument is evaluated exactly once, at the position it had in the source.
 */
public class AddressabilityResolver {

    public static final String ARGUMENT = "$arg";
    public static final String TEMP_PREFIX = "__tmp";

    private static final String FUNCTION = "java.util.function.Function";

    private AddressabilityResolver() {
    }

    public static boolean isAddressable(Expression expression) {
        if (expression instanceof NameExpr || expression instanceof ThisExpr) {
            return true;
        }
        if (expression instanceof FieldAccessExpr) {
            return isAddressable(((FieldAccessExpr) expression).getScope());
        }
        if (expression instanceof ArrayAccessExpr) {
            ArrayAccessExpr access = (ArrayAccessExpr) expression;
            Expression index = access.getIndex();
            return isAddressable(access.getName()) && (AstUtils.isLiteral(index) || isAddressable(index));
        }
        if (expression instanceof EnclosedExpr) {
            return isAddressable(((EnclosedExpr) expression).getInner());
        }
        return false;
    }

    private static boolean isPrimary(Expression expression) {
        return expression instanceof MethodCallExpr || expression instanceof ObjectCreationExpr ||
               expression instanceof LiteralExpr || expression instanceof EnclosedExpr || isAddressable(expression);
    }

    /**
     * Builds {@code template} with every {@value #ARGUMENT} standing for {@code argument}.
     * Addressable arguments are substituted directly; anything else is evaluated once into a
     * temporary first. The result is recorded in the type cache as {@code resultType}.
     *
     * @throws org.javelin.TypeUnavailableException if the argument must be bound but its
     *                                              type cannot be determined
     */
    public static Expression bind(Expression argument, String template, String resultType, PipelineContext ctx) {
        Expression result;
        if (isAddressable(argument)) {
            result = AstUtils.parseExpression(template);
            AstUtils.substitute(result, ARGUMENT, argument);
            if (!isPrimary(result)) {
                // it takes the place of a call, e.g. as the scope of .isSome()
                result = new EnclosedExpr(result);
            }
        } else {
            String argumentType = AstUtils.boxed(ctx.types().requireType(argument, "binding a temporary"));
            String temp = ctx.freshName(TEMP_PREFIX);
            String function = ctx.requireImport(FUNCTION);
            String body = template.replace(ARGUMENT, temp);
            result = AstUtils.parseExpression(
                    "((" + function + "<" + argumentType + ", " + resultType + ">) " + temp + " -> " + body + ").apply(" + ARGUMENT + ")");
            AstUtils.substitute(result, ARGUMENT, argument);
        }
        ctx.types().recordSynthetic(result, resultType);
        return result;
    }
}
