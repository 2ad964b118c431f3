package org.javelin.rewrite;

import java.util.List;

import org.javelin.mapping.Mapping;

/**
 * Output of one rewriter, or of the whole rewrite pipeline.
 */
public record RewriteResult(String source, List<Mapping> mappings) {

    public RewriteResult {
        mappings = List.copyOf(mappings);
    }

    public static RewriteResult unchanged(String source, List<Mapping> mappings) {
        return new RewriteResult(source, mappings);
    }
}
