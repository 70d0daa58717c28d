package org.scriptweaver.compiler.emit;

import org.scriptweaver.compiler.api.CompilationException;
import org.scriptweaver.compiler.graph.Node;

/**
 * Emits the code for one node kind.
 * <p>
 * Implementations should be stateless. All output is written and all symbols are bound via the
 * provided {@link EmitContext}; every {@code indent()} must be matched by a {@code dedent()} before
 * returning, except for scopes opened through {@link EmitContext#openEventScope(String)}.
 */
public interface INodeCompiler {

    /**
     * Compiles the given node.
     *
     * @param node The node to compile.
     * @param ctx  The context of the running compilation.
     * @throws CompilationException if a nested body cannot be compiled.
     */
    void compile(Node node, EmitContext ctx) throws CompilationException;
}
