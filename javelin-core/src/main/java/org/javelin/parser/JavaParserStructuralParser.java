package org.javelin.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;

/**
 * {@link StructuralParser} over JavaParser at language level Java 17. A fresh
 * {@link JavaParser} is created per call since it keeps per-parse state.
 */
public class JavaParserStructuralParser implements StructuralParser {

    public static ParserConfiguration configuration() {
        return new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(true);
    }

    @Override
    public ParseResult<CompilationUnit> parse(String source) {
        return new JavaParser(configuration()).parse(source);
    }
}
