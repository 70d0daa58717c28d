package org.scriptweaver.compiler.emit;

import org.scriptweaver.compiler.CompilerOptions;
import org.scriptweaver.compiler.api.CompilationException;
import org.scriptweaver.compiler.api.CompilerErrorCode;
import org.scriptweaver.compiler.api.CycleDetectedException;
import org.scriptweaver.compiler.catalog.NodeCatalog;
import org.scriptweaver.compiler.catalog.PortType;
import org.scriptweaver.compiler.diagnostics.CompilerLogger;
import org.scriptweaver.compiler.diagnostics.DiagnosticsEngine;
import org.scriptweaver.compiler.graph.Connection;
import org.scriptweaver.compiler.graph.ConnectionIndex;
import org.scriptweaver.compiler.graph.Node;
import org.scriptweaver.compiler.graph.ScriptGraph;
import org.scriptweaver.compiler.order.NestingAnalysis;
import org.scriptweaver.compiler.order.OrderingEdge;
import org.scriptweaver.compiler.order.TopologicalSorter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of a single compilation: the code emitter, the symbol table and the
 * diagnostics. A fresh context is created for every compile call and never shared.
 * <p>
 * Node compilers use it to resolve inputs, bind outputs, emit lines and recurse into the
 * nested bodies of branch and loop nodes.
 */
public final class EmitContext {

    private final ScriptGraph graph;
    private final ConnectionIndex index;
    private final NestingAnalysis nesting;
    private final NodeCatalog catalog;
    private final NodeCompilerRegistry registry;
    private final CompilerOptions options;
    private final CodeEmitter emitter;
    private final SymbolTable symbols = new SymbolTable();
    private final CompilerLogger log;
    private final DiagnosticsEngine diagnostics;
    private final Deque<String> activeContainers = new ArrayDeque<>();
    // open event scopes per body level, innermost level first
    private final Deque<Integer> eventScopes = new ArrayDeque<>();

    /**
     * Constructs a new emission context.
     * @param graph The validated graph being compiled.
     * @param index The connection index of the graph.
     * @param nesting The nesting analysis of the graph.
     * @param catalog The node catalog.
     * @param registry The registry for resolving node compilers.
     * @param options The compiler options.
     * @param log The logger of this compilation.
     */
    public EmitContext(ScriptGraph graph, ConnectionIndex index, NestingAnalysis nesting,
                       NodeCatalog catalog, NodeCompilerRegistry registry, CompilerOptions options,
                       CompilerLogger log) {
        this.graph = graph;
        this.index = index;
        this.nesting = nesting;
        this.catalog = catalog;
        this.registry = registry;
        this.options = options;
        this.log = log;
        this.diagnostics = new DiagnosticsEngine(log);
        this.emitter = new CodeEmitter(options.indent());
        this.eventScopes.push(0);
    }

    /**
     * Compiles a node by resolving and invoking the compiler registered for its type.
     * @param node The node to compile.
     * @throws CompilationException if a nested body cannot be compiled.
     */
    public void compileNode(Node node) throws CompilationException {
        log.trace("Compiling node '" + node.id() + "' (" + node.type() + ")");
        emitter.emit("// Node: " + node.displayName());
        registry.resolve(node.type()).compile(node, this);
        emitter.blank();
    }

    /**
     * @param container The branch or loop node.
     * @param handle The body handle, e.g. {@code else}.
     * @return {@code true} if at least one node is connected to the handle.
     */
    public boolean hasBody(Node container, String handle) {
        return !index.outgoing(container.id(), handle).isEmpty();
    }

    /**
     * Compiles every node connected to a body handle of the container at the current
     * indentation. Event scopes opened inside the body are closed at its end.
     *
     * @param container The branch or loop node.
     * @param handle The body handle, e.g. {@code then}.
     * @throws CompilationException if the body nodes cannot be ordered or contain the container itself.
     */
    public void compileBody(Node container, String handle) throws CompilationException {
        List<Node> members = bodyMembers(container, handle);
        for (Node member : members) {
            if (member.id().equals(container.id()) || activeContainers.contains(member.id())) {
                List<String> chain = new ArrayList<>(activeContainers);
                chain.add(0, container.id());
                throw new CycleDetectedException(CompilerErrorCode.NESTING_CYCLE, chain,
                        "Node '" + member.id() + "' is nested inside its own body");
            }
        }

        activeContainers.push(container.id());
        eventScopes.push(0);
        try {
            for (Node member : orderBody(members)) {
                compileNode(member);
            }
            while (eventScopes.peek() > 0) {
                closeEventScope();
            }
        } finally {
            eventScopes.pop();
            activeContainers.pop();
        }
    }

    /**
     * Resolves the expression for an input port. If the port is not connected, or its producer
     * has no bound symbol yet, the default literal of the port type is returned and an
     * unresolved-input warning is recorded.
     *
     * @param node The consuming node.
     * @param port The input port.
     * @return The expression to use in emitted code.
     */
    public String resolveInput(Node node, String port) {
        Optional<String> symbol = index.incoming(node.id(), port)
                .flatMap(c -> symbols.lookup(c.source(), c.sourceHandle()));
        if (symbol.isPresent()) {
            return symbol.get();
        }
        PortType type = catalog.inputType(node.type(), port);
        String literal = type.defaultLiteral(node.id(), port);
        diagnostics.reportUnresolvedInput(node.id(), port, literal);
        return literal;
    }

    /**
     * Emits the header of an event scope and indents. The scope stays open until the
     * compiler closes it after the event's dependents, or until the enclosing body ends.
     * @param header The opening line, ending with an opening brace.
     */
    public void openEventScope(String header) {
        emitter.emit(header);
        emitter.indent();
        eventScopes.push(eventScopes.pop() + 1);
    }

    /**
     * Closes the innermost open event scope of the current body level.
     * @throws IllegalStateException if no event scope is open at this level.
     */
    public void closeEventScope() {
        int open = eventScopes.pop();
        if (open == 0) {
            eventScopes.push(0);
            throw new IllegalStateException("No open event scope to close");
        }
        eventScopes.push(open - 1);
        emitter.dedent();
        emitter.emit("}");
    }

    /**
     * Closes any event scope still open at top level and returns the emitted body.
     * @return The emitted code.
     * @throws IllegalStateException if the emitted indentation is unbalanced.
     */
    public String finish() {
        while (eventScopes.peek() > 0) {
            closeEventScope();
        }
        return emitter.finish();
    }

    /**
     * Emits a line at the current indentation.
     * @param line The line.
     */
    public void emit(String line) {
        emitter.emit(line);
    }

    public void indent() {
        emitter.indent();
    }

    public void dedent() {
        emitter.dedent();
    }

    /**
     * Binds the plain output of a node.
     * @param nodeId The producer.
     * @param symbol The identifier.
     */
    public void bind(String nodeId, String symbol) {
        symbols.bind(nodeId, symbol);
    }

    /**
     * Binds a named output of a node.
     * @param nodeId The producer.
     * @param handle The output handle.
     * @param symbol The identifier.
     */
    public void bind(String nodeId, String handle, String symbol) {
        symbols.bind(nodeId, handle, symbol);
    }

    /**
     * @return The diagnostics engine.
     */
    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    private List<Node> bodyMembers(Node container, String handle) {
        Map<String, Node> members = new LinkedHashMap<>();
        for (Connection c : index.outgoing(container.id(), handle)) {
            members.putIfAbsent(c.target(), graph.requireNode(c.target()));
        }
        return new ArrayList<>(members.values());
    }

    private List<Node> orderBody(List<Node> members) throws CycleDetectedException {
        if (options.subgraphOrder() == CompilerOptions.SubgraphOrder.DECLARATION || members.size() < 2) {
            return members;
        }
        List<OrderingEdge> edges = new ArrayList<>();
        for (Connection c : graph.allConnections()) {
            if (!nesting.isBodyConnection(c)) {
                edges.add(new OrderingEdge(c.source(), c.target()));
            }
        }
        return TopologicalSorter.sort(members, edges);
    }
}
