package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.api.CompilationException;
import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles {@code flow/if} into a conditional block.
 */
public final class IfCompiler implements INodeCompiler {

	static final String THEN = "then";
	static final String ELSE = "else";

	/**
	 * {@inheritDoc}
	 * <p>
	 * The nodes connected to the {@code then} handle form the block; an {@code else} block is
	 * only emitted when something is connected to the {@code else} handle. An unconnected
	 * condition is {@code false}.
	 *
	 * @param node The node to compile.
	 * @param ctx  The emission context.
	 */
	@Override
	public void compile(Node node, EmitContext ctx) throws CompilationException {
		String condition = ctx.resolveInput(node, "condition");

		ctx.emit("if " + condition + " {");
		ctx.indent();
		try {
			ctx.compileBody(node, THEN);
		} finally {
			ctx.dedent();
		}

		if (ctx.hasBody(node, ELSE)) {
			ctx.emit("} else {");
			ctx.indent();
			try {
				ctx.compileBody(node, ELSE);
			} finally {
				ctx.dedent();
			}
		}
		ctx.emit("}");
	}
}
