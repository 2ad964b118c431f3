package org.javelin.rewrite;

import java.util.List;

import org.javelin.mapping.Mapping;

/**
 * A text-level rewrite step. Implementations hold no per-call state and can be shared
 * between threads.
 */
public interface Rewriter {

    String name();

    /**
     * @param source   text produced by the previous rewriter
     * @param mappings mappings accumulated so far, in terms of {@code source}
     * @throws org.javelin.SyntaxRewriteException if the construct cannot be rewritten
     * @throws org.javelin.LimitExceededException if a configured ceiling is exceeded
     */
    RewriteResult rewrite(String source, List<Mapping> mappings);
}
