package org.javelin.transpiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.javelin.mapping.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DiagnosticSink {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticSink.class);

    private final String fileName;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public DiagnosticSink(String fileName) {
        this.fileName = fileName;
    }

    public void warn(String plugin, String message, Position position) {
        report(new Diagnostic(Diagnostic.Severity.WARNING, plugin, message, position));
    }

    public void info(String plugin, String message, Position position) {
        report(new Diagnostic(Diagnostic.Severity.INFO, plugin, message, position));
    }

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (diagnostic.severity() == Diagnostic.Severity.WARNING) {
            log.warn("{}: {}", fileName, diagnostic);
        } else {
            log.debug("{}: {}", fileName, diagnostic);
        }
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
