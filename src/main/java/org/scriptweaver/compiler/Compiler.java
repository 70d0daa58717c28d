package org.scriptweaver.compiler;

import org.scriptweaver.compiler.api.CompilationException;
import org.scriptweaver.compiler.api.CompiledSystem;
import org.scriptweaver.compiler.api.ICompiler;
import org.scriptweaver.compiler.catalog.NodeCatalog;
import org.scriptweaver.compiler.deps.DependencyExtractor;
import org.scriptweaver.compiler.diagnostics.CompilerLogger;
import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.NodeCompilerRegistry;
import org.scriptweaver.compiler.graph.ConnectionIndex;
import org.scriptweaver.compiler.graph.Node;
import org.scriptweaver.compiler.graph.ScriptGraph;
import org.scriptweaver.compiler.graph.VisualScript;
import org.scriptweaver.compiler.order.EventScopePlanner;
import org.scriptweaver.compiler.order.NestingAnalysis;
import org.scriptweaver.compiler.order.ScheduledNode;
import org.scriptweaver.compiler.order.TopologicalSorter;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from a visual script
 * to a {@link CompiledSystem}.
 * <p>
 * The instance only holds configuration; all per-compilation state, including the logger and its
 * verbosity, lives in a fresh {@link EmitContext}, so one compiler may be shared between threads.
 */
public class Compiler implements ICompiler {

    private final CompilerOptions options;
    private final NodeCatalog catalog;
    private final NodeCompilerRegistry registry;
    private final DependencyExtractor dependencyExtractor;
    private volatile int verbosity = -1;

    /**
     * Creates a compiler with the bundled default options and the built-in node types.
     */
    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * @param options The compiler options.
     */
    public Compiler(CompilerOptions options) {
        this(options, NodeCatalog.standard(), NodeCompilerRegistry.initializeWithDefaults());
    }

    /**
     * @param options  The compiler options.
     * @param catalog  The node catalog used for port types, body handles and capabilities.
     * @param registry The node compilers.
     */
    public Compiler(CompilerOptions options, NodeCatalog catalog, NodeCompilerRegistry registry) {
        this.options = options;
        this.catalog = catalog;
        this.registry = registry;
        this.dependencyExtractor = new DependencyExtractor(catalog);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public CompiledSystem compile(VisualScript script) throws CompilationException {
        CompilerLogger log = new CompilerLogger(verbosity >= 0 ? verbosity : options.verbosity());

        // Phase 1: Validation (graph model and connection index)
        ScriptGraph graph = ScriptGraph.of(script);
        ConnectionIndex index = ConnectionIndex.of(graph);

        // Phase 2: Ordering of top-level nodes
        NestingAnalysis nesting = NestingAnalysis.analyze(graph, catalog);
        List<Node> order = TopologicalSorter.sort(nesting.topLevelNodes(), nesting.orderingEdges());
        List<ScheduledNode> schedule = EventScopePlanner.plan(order, nesting.orderingEdges(),
                node -> catalog.opensEventScope(node.type()));

        // Phase 3: Emission
        EmitContext ctx = new EmitContext(graph, index, nesting, catalog, registry, options, log);
        for (ScheduledNode step : schedule) {
            ctx.compileNode(step.node());
            for (int i = 0; i < step.closingScopes(); i++) {
                ctx.closeEventScope();
            }
        }
        String code = ctx.finish();

        // Phase 4: Dependencies
        List<String> dependencies = dependencyExtractor.extract(graph);

        log.debug("Compiler: " + graph.name() + " nodes:" + graph.allNodes().size()
                + " topLevel:" + order.size() + " dependencies:" + dependencies
                + " diagnostics:" + ctx.diagnostics().getDiagnostics().size());
        return new CompiledSystem(graph.name(), code, dependencies, ctx.diagnostics().getDiagnostics());
    }

    /**
     * {@inheritDoc}
     * <p>
     * A negative level restores the configured verbosity.
     */
    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
