/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 *
 */

package org.javelin.parser.util;

import java.util.List;
import java.util.Map;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.Type;
import org.javelin.parser.JavaParserStructuralParser;

public class AstUtils {

    private static final Map<String, String> BOXED = Map.ofEntries(
            Map.entry("boolean", "Boolean"),
            Map.entry("byte", "Byte"),
            Map.entry("short", "Short"),
            Map.entry("char", "Character"),
            Map.entry("int", "Integer"),
            Map.entry("long", "Long"),
            Map.entry("float", "Float"),
            Map.entry("double", "Double"),
            Map.entry("void", "Void")
    );

    private AstUtils() {
    }

    /**
     * Expressions Java accepts as a statement on their own.
     */
    public static boolean isStatementExpression(Expression expr) {
        if (expr instanceof UnaryExpr) {
            UnaryExpr.Operator operator = ((UnaryExpr) expr).getOperator();
            return operator == UnaryExpr.Operator.PREFIX_INCREMENT || operator == UnaryExpr.Operator.PREFIX_DECREMENT ||
                   operator == UnaryExpr.Operator.POSTFIX_INCREMENT || operator == UnaryExpr.Operator.POSTFIX_DECREMENT;
        }
        return expr instanceof MethodCallExpr || expr instanceof AssignExpr || expr instanceof ObjectCreationExpr;
    }

    public static boolean isLiteral(Expression expr) {
        return expr instanceof LiteralExpr;
    }

    public static String boxed(String typeName) {
        return BOXED.getOrDefault(typeName, typeName);
    }

    public static boolean isPrimitive(String typeName) {
        return !typeName.equals("void") && BOXED.containsKey(typeName);
    }

    public static JavaParser parser() {
        return new JavaParser(JavaParserStructuralParser.configuration());
    }

    public static Expression parseExpression(String text) {
        return unwrap(parser().parseExpression(text), text);
    }

    public static Statement parseStatement(String text) {
        return unwrap(parser().parseStatement(text), text);
    }

    public static Type parseType(String text) {
        return unwrap(parser().parseType(text), text);
    }

    /**
     * Parses a single top level type and detaches it from the compilation unit it was
     * parsed in.
     */
    public static TypeDeclaration<?> parseTypeDeclaration(String text) {
        CompilationUnit unit = unwrap(parser().parse(text), text);
        List<TypeDeclaration<?>> types = unit.getTypes();
        if (types.size() != 1) {
            throw new IllegalArgumentException("expected exactly one type declaration, found " + types.size());
        }
        TypeDeclaration<?> type = types.get(0);
        type.remove();
        return type;
    }

    private static <T extends Node> T unwrap(ParseResult<T> result, String text) {
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new IllegalArgumentException("generated code does not parse: " + text + " " + result.getProblems());
        }
        T node = result.getResult().get();
        // positions in a template mean nothing in the file it ends up in
        node.walk(n -> n.setTokenRange(null));
        return node;
    }

    /**
     * Replaces every {@code NameExpr} or {@code MethodCallExpr} named {@code placeholder}
     * under {@code root} with a clone of {@code replacement}. Returns the number replaced.
     */
    public static int substitute(Node root, String placeholder, Node replacement) {
        int count = 0;
        for (NameExpr name : root.findAll(NameExpr.class, n -> n.getNameAsString().equals(placeholder))) {
            name.replace(replacement.clone());
            count++;
        }
        for (MethodCallExpr call : root.findAll(MethodCallExpr.class,
                                                c -> c.getScope().isEmpty() && c.getNameAsString().equals(placeholder))) {
            call.replace(replacement.clone());
            count++;
        }
        return count;
    }
}
