package org.javelin.transpiler;

import java.util.List;

import org.javelin.mapping.MappingStore;

/**
 * Output of transpiling one file.
 *
 * @param generatedSource Java 17 source text
 * @param mappings        positions of the generated text back to the Javelin source
 * @param diagnostics     non-fatal findings
 * @param declarations    names of the top level types appended to the file
 */
public record TranspiledResult(String generatedSource, MappingStore mappings, List<Diagnostic> diagnostics,
                               List<String> declarations) {

    public TranspiledResult {
        diagnostics = List.copyOf(diagnostics);
        declarations = List.copyOf(declarations);
    }
}
