package org.javelin.transpiler.plugins;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.type.TypeParameter;
import org.javelin.parser.util.AstUtils;
import org.javelin.rewrite.UnionRewriter;
import org.javelin.transpiler.Capability;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.Plugin;
import org.javelin.transpiler.PluginDescriptor;
import org.javelin.transpiler.types.UnionInfo;
import org.javelin.transpiler.types.VariantField;
import org.javelin.transpiler.types.VariantInfo;

/**
 * Registers every {@code @JavelinUnion} interface left by the union rewriter and turns it
 * into a sealed interface with one nested record per variant:
 * <pre>
 * sealed interface Shape {
 *     record Circle(double radius) implements Shape {}
 *     record Empty() implements Shape {}
 * }
 * </pre>
 */
public class UnionDeclarationPlugin implements Plugin {

    public static final String NAME = "sum-types";

    private static final PluginDescriptor DESCRIPTOR = PluginDescriptor.of(
            NAME, "tagged union declarations", List.of(), Capability.DISCOVER, Capability.TRANSFORM);

    @Override
    public PluginDescriptor descriptor() {
        return DESCRIPTOR;
    }

    static boolean isUnionDeclaration(Node node) {
        if (!(node instanceof ClassOrInterfaceDeclaration)) {
            return false;
        }
        ClassOrInterfaceDeclaration declaration = (ClassOrInterfaceDeclaration) node;
        return declaration.isInterface() && declaration.getAnnotationByName(UnionRewriter.MARKER_ANNOTATION).isPresent();
    }

    @Override
    public void discover(CompilationUnit unit, PipelineContext ctx) {
        for (ClassOrInterfaceDeclaration declaration : unit.findAll(ClassOrInterfaceDeclaration.class, UnionDeclarationPlugin::isUnionDeclaration)) {
            UnionInfo union = describe(declaration, ctx);
            try {
                ctx.types().registry().register(union);
            } catch (IllegalArgumentException e) {
                throw ctx.discoveryError(e.getMessage(), declaration, e);
            }
        }
    }

    private static UnionInfo describe(ClassOrInterfaceDeclaration declaration, PipelineContext ctx) {
        String name = declaration.getNameAsString();
        List<String> typeParameters = new ArrayList<>();
        for (TypeParameter parameter : declaration.getTypeParameters()) {
            typeParameters.add(parameter.getNameAsString());
        }
        List<VariantInfo> variants = new ArrayList<>();
        Set<String> tags = new HashSet<>();
        for (BodyDeclaration<?> member : declaration.getMembers()) {
            if (!member.isMethodDeclaration()) {
                throw ctx.discoveryError("union '" + name + "' may only declare variants", member, null);
            }
            MethodDeclaration method = member.asMethodDeclaration();
            String tag = method.getNameAsString();
            if (!method.getType().isVoidType() || method.getBody().isPresent() || method.getTypeParameters().isNonEmpty()) {
                throw ctx.discoveryError("malformed variant '" + tag + "' in union '" + name + "'", method, null);
            }
            if (!Character.isUpperCase(tag.charAt(0))) {
                throw ctx.discoveryError("variant '" + tag + "' of union '" + name + "' must start with an upper case letter", method, null);
            }
            if (!tags.add(tag)) {
                throw ctx.discoveryError("variant '" + tag + "' is declared twice in union '" + name + "'", method, null);
            }
            List<VariantField> fields = new ArrayList<>();
            for (Parameter parameter : method.getParameters()) {
                fields.add(new VariantField(parameter.getNameAsString(), parameter.getType().asString()));
            }
            variants.add(new VariantInfo(name, tag, fields));
        }
        if (variants.isEmpty()) {
            throw ctx.discoveryError("union '" + name + "' declares no variants", declaration, null);
        }
        return new UnionInfo(name, typeParameters, variants, false);
    }

    @Override
    public Node transform(Node node, PipelineContext ctx) {
        if (!isUnionDeclaration(node)) {
            return node;
        }
        ClassOrInterfaceDeclaration declaration = (ClassOrInterfaceDeclaration) node;
        String name = declaration.getNameAsString();
        String typeParameters = declaration.getTypeParameters().isEmpty() ? "" :
                declaration.getTypeParameters().stream().map(Node::toString).collect(Collectors.joining(", ", "<", ">"));
        String typeArguments = declaration.getTypeParameters().isEmpty() ? "" :
                declaration.getTypeParameters().stream().map(TypeParameter::getNameAsString).collect(Collectors.joining(", ", "<", ">"));

        StringBuilder text = new StringBuilder();
        for (AnnotationExpr annotation : declaration.getAnnotations()) {
            if (!annotation.getNameAsString().equals(UnionRewriter.MARKER_ANNOTATION)) {
                text.append(annotation).append('\n');
            }
        }
        for (Modifier modifier : declaration.getModifiers()) {
            text.append(modifier.getKeyword().asString()).append(' ');
        }
        text.append("sealed interface ").append(name).append(typeParameters).append(" {\n");
        for (BodyDeclaration<?> member : declaration.getMembers()) {
            MethodDeclaration variant = member.asMethodDeclaration();
            String components = variant.getParameters().stream()
                                       .map(p -> p.getType() + (p.isVarArgs() ? "... " : " ") + p.getNameAsString())
                                       .collect(Collectors.joining(", "));
            text.append("record ").append(variant.getNameAsString()).append(typeParameters)
                .append('(').append(components).append(") implements ")
                .append(name).append(typeArguments).append(" {}\n");
        }
        text.append('}');
        return AstUtils.parseTypeDeclaration(text.toString());
    }
}
