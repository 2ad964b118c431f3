package org.javelin.parser.printer;

import com.github.javaparser.ast.Node;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;

public class JavelinPrinter implements StructuralPrinter {

    @Override
    public String print(Node node) {
        // the printer keeps state while printing, one per call
        return new DefaultPrettyPrinter(JavelinPrintVisitor::new, new DefaultPrinterConfiguration()).print(node);
    }
}
