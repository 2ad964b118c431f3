package org.javelin.parser;

import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;

/**
 * Parses rewritten, grammatically valid Java text into a tree. Implementations must be
 * safe to call from several threads, or create their parser per call.
 */
public interface StructuralParser {

    ParseResult<CompilationUnit> parse(String source);
}
