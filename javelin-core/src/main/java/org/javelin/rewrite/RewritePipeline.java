package org.javelin.rewrite;

import java.util.ArrayList;
import java.util.List;

import org.javelin.JavelinConfig;
import org.javelin.mapping.Mapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs rewriters strictly in registration order as a fold over {@code (text, mappings)}.
 * The pipeline is immutable once built.
 */
public class RewritePipeline {

    private static final Logger log = LoggerFactory.getLogger(RewritePipeline.class);

    private final List<Rewriter> rewriters;

    public RewritePipeline(List<Rewriter> rewriters) {
        this.rewriters = List.copyOf(rewriters);
    }

    /**
     * union, match, safe navigation, null coalescing, error propagation, then keywords.
     * Safe navigation runs before null coalescing so that {@code a?.b ?? c} sees a complete
     * left operand. The keyword pass runs last because the error propagation rewriter
     * introduces {@code let} temporaries.
     */
    public static RewritePipeline standard(JavelinConfig config) {
        List<Rewriter> rewriters = new ArrayList<>();
        rewriters.add(new UnionRewriter());
        rewriters.add(new MatchRewriter(config.getMaxTupleArity()));
        rewriters.add(new SafeNavigationRewriter());
        rewriters.add(new NullCoalescingRewriter());
        rewriters.add(new ErrorPropagationRewriter());
        rewriters.add(new KeywordRewriter());
        return new RewritePipeline(rewriters);
    }

    public List<Rewriter> rewriters() {
        return rewriters;
    }

    public RewriteResult run(String source) {
        return run(source, List.of());
    }

    public RewriteResult run(String source, List<Mapping> mappings) {
        RewriteResult current = RewriteResult.unchanged(source, mappings);
        for (Rewriter rewriter : rewriters) {
            int before = current.mappings().size();
            current = rewriter.rewrite(current.source(), current.mappings());
            if (log.isDebugEnabled()) {
                log.debug("rewriter '{}' done, {} mappings added", rewriter.name(), current.mappings().size() - before);
            }
        }
        return current;
    }
}
