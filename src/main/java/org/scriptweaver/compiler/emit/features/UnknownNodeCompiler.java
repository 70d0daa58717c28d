package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.graph.Node;

/**
 * Fallback for node types without a registered compiler. Leaves a placeholder comment naming the
 * type in the output and records a notice, so newer graphs still compile with older compilers.
 */
public final class UnknownNodeCompiler implements INodeCompiler {

	static final String PLACEHOLDER_PREFIX = "// Unsupported node type: ";

	@Override
	public void compile(Node node, EmitContext ctx) {
		ctx.emit(PLACEHOLDER_PREFIX + node.type() + " (node " + node.id() + ")");
		ctx.diagnostics().reportUnknownNodeType(node.id(), node.type());
	}
}
