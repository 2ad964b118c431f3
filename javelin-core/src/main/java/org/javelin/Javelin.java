package org.javelin;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.javelin.mapping.MappingStore;
import org.javelin.mapping.Position;
import org.javelin.parser.JavaParserStructuralParser;
import org.javelin.parser.StructuralParser;
import org.javelin.parser.printer.JavelinPrinter;
import org.javelin.parser.printer.StructuralPrinter;
import org.javelin.rewrite.RewritePipeline;
import org.javelin.rewrite.RewriteResult;
import org.javelin.transpiler.PipelineContext;
import org.javelin.transpiler.Plugin;
import org.javelin.transpiler.PluginRegistry;
import org.javelin.transpiler.SplicingPrinter;
import org.javelin.transpiler.TranspiledResult;
import org.javelin.transpiler.TreePipeline;
import org.javelin.transpiler.plugins.BuiltinUnionPlugin;
import org.javelin.transpiler.plugins.NullCoalescingPlugin;
import org.javelin.transpiler.plugins.PatternMatchPlugin;
import org.javelin.transpiler.plugins.SafeNavigationPlugin;
import org.javelin.transpiler.plugins.UnionDeclarationPlugin;
import org.javelin.transpiler.plugins.VariantConstructorPlugin;
import org.javelin.transpiler.types.SymbolSolverTypeOracle;
import org.javelin.transpiler.types.SyntheticTypeRegistry;
import org.javelin.transpiler.types.TypeFactCache;
import org.javelin.transpiler.types.TypeFacts;
import org.javelin.transpiler.types.TypeOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: transpiles Javelin source to Java 17.
 * <pre>
 * Javelin javelin = new Javelin();
 * TranspiledResult result = javelin.transpile("Shapes.jvl", source);
 * </pre>
 * Instances are immutable and may be shared between threads; every call builds its own
 * mapping store, context and type cache.
 */
public class Javelin {

    private static final Logger log = LoggerFactory.getLogger(Javelin.class);

    private static final String DEFAULT_FILE_NAME = "<source>";

    private final JavelinConfig config;
    private final RewritePipeline rewrites;
    private final List<Plugin> plugins;
    private final StructuralParser parser;
    private final StructuralPrinter printer;
    private final TypeOracle oracle;

    public Javelin() {
        this(JavelinConfig.defaults());
    }

    public Javelin(JavelinConfig config) {
        this(builder().config(config));
    }

    private Javelin(Builder builder) {
        this.config = builder.config;
        this.rewrites = RewritePipeline.standard(config);
        this.parser = builder.parser;
        this.printer = builder.printer;
        this.oracle = builder.oracle;

        PluginRegistry registry = new PluginRegistry();
        registry.register(new UnionDeclarationPlugin());
        registry.register(new BuiltinUnionPlugin());
        registry.register(new VariantConstructorPlugin());
        registry.register(new PatternMatchPlugin());
        registry.register(new SafeNavigationPlugin());
        registry.register(new NullCoalescingPlugin());
        for (Plugin plugin : builder.extraPlugins) {
            registry.register(plugin);
        }
        this.plugins = registry.resolveOrder(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public JavelinConfig getConfig() {
        return config;
    }

    public TranspiledResult transpile(String source) {
        return transpile(DEFAULT_FILE_NAME, source);
    }

    /**
     * @throws SyntaxRewriteException    if a Javelin construct is malformed
     * @throws LimitExceededException    if a match is too large to check
     * @throws SourceParseException      if the rewritten text is not valid Java
     * @throws TransformPhaseException   if a plugin fails; no output is produced
     * @throws ExhaustivenessException   (as the cause of a {@link DiscoveryException}) for a
     *                                   match that misses a combination
     */
    public TranspiledResult transpile(String fileName, String source) {
        log.debug("Transpiling {}", fileName);
        RewriteResult rewritten = rewrites.run(source);
        MappingStore mappings = new MappingStore(rewritten.mappings());

        ParseResult<CompilationUnit> parsed = parser.parse(rewritten.source());
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            throw parseFailure(parsed.getProblems(), mappings);
        }
        CompilationUnit unit = parsed.getResult().get();

        TypeFacts facts = TypeFacts.NONE;
        boolean typesDegraded = false;
        if (config.isTypeCheckEnabled()) {
            try {
                facts = oracle.analyze(unit);
            } catch (RuntimeException e) {
                log.warn("{}: type oracle failed, using structural typing only: {}", fileName, e.toString());
                typesDegraded = true;
            }
        }

        TypeFactCache types = new TypeFactCache(facts, new SyntheticTypeRegistry());
        PipelineContext ctx = new PipelineContext(fileName, rewritten.source(), unit, mappings, types, config);
        if (typesDegraded) {
            ctx.diagnostics().warn("types", "type checking unavailable, types inferred from syntax only", Position.UNKNOWN);
        }

        List<TypeDeclaration<?>> injected = new TreePipeline(plugins).run(ctx);
        String generated = new SplicingPrinter(printer).print(ctx, injected);

        List<String> declarations = new ArrayList<>();
        for (TypeDeclaration<?> declaration : injected) {
            declarations.add(declaration.getNameAsString());
        }
        log.debug("Transpiled {}: {} mappings, {} diagnostics", fileName, mappings.size(), ctx.diagnostics().diagnostics().size());
        return new TranspiledResult(generated, mappings, ctx.diagnostics().diagnostics(), declarations);
    }

    private static SourceParseException parseFailure(List<Problem> problems, MappingStore mappings) {
        Position position = Position.UNKNOWN;
        if (!problems.isEmpty()) {
            position = problems.get(0).getLocation()
                                .flatMap(location -> location.getBegin().getRange())
                                .map(range -> mappings.mapToOriginal(range.begin.line, range.begin.column))
                                .orElse(Position.UNKNOWN);
        }
        String details = problems.stream().map(Problem::getVerboseMessage).collect(Collectors.joining("; "));
        return new SourceParseException("rewritten source is not valid Java", position, details);
    }

    public static final class Builder {
        private JavelinConfig config = JavelinConfig.defaults();
        private StructuralParser parser = new JavaParserStructuralParser();
        private StructuralPrinter printer = new JavelinPrinter();
        private TypeOracle oracle = new SymbolSolverTypeOracle();
        private final List<Plugin> extraPlugins = new ArrayList<>();

        private Builder() {
        }

        public Builder config(JavelinConfig config) {
            this.config = config;
            return this;
        }

        public Builder parser(StructuralParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder printer(StructuralPrinter printer) {
            this.printer = printer;
            return this;
        }

        public Builder typeOracle(TypeOracle oracle) {
            this.oracle = oracle;
            return this;
        }

        /**
         * Adds a plugin after the standard ones; its dependencies may name them.
         */
        public Builder plugin(Plugin plugin) {
            this.extraPlugins.add(plugin);
            return this;
        }

        public Javelin build() {
            return new Javelin(this);
        }
    }
}
