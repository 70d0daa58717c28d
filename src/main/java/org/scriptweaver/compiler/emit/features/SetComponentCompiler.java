package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles {@code component/set}. Produces no output binding.
 */
public final class SetComponentCompiler implements INodeCompiler {

	@Override
	public void compile(Node node, EmitContext ctx) {
		String entity = ctx.resolveInput(node, "entity");
		String component = ctx.resolveInput(node, "component");
		ctx.emit("world.set_component(" + entity + ", " + component + ");");
	}
}
