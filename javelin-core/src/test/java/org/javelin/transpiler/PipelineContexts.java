package org.javelin.transpiler;

import java.util.List;

import com.github.javaparser.ast.CompilationUnit;
import org.javelin.JavelinConfig;
import org.javelin.mapping.MappingStore;
import org.javelin.parser.JavaParserStructuralParser;
import org.javelin.transpiler.types.SyntheticTypeRegistry;
import org.javelin.transpiler.types.TypeFactCache;
import org.javelin.transpiler.types.TypeFacts;

/**
 * Contexts over plain Java text, as if the rewrite stage had left it unchanged.
 */
public final class PipelineContexts {

    private PipelineContexts() {
    }

    public static PipelineContext of(String source) {
        return of(source, JavelinConfig.defaults());
    }

    public static PipelineContext of(String source, JavelinConfig config) {
        CompilationUnit unit = new JavaParserStructuralParser().parse(source).getResult().orElseThrow();
        TypeFactCache types = new TypeFactCache(TypeFacts.NONE, new SyntheticTypeRegistry());
        return new PipelineContext("Test.java", source, unit, new MappingStore(List.of()), types, config);
    }
}
