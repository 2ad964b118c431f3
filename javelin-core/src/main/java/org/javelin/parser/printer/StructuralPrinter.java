package org.javelin.parser.printer;

import com.github.javaparser.ast.Node;

/**
 * Deterministic pretty printer for generated subtrees.
 */
public interface StructuralPrinter {

    String print(Node node);
}
