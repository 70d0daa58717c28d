package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.emit.SymbolNames;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles {@code physics/raycast} into a physics query bound to the {@code hit} output.
 */
public final class RaycastCompiler implements INodeCompiler {

	@Override
	public void compile(Node node, EmitContext ctx) {
		String origin = ctx.resolveInput(node, "origin");
		String direction = ctx.resolveInput(node, "direction");
		String maxDistance = ctx.resolveInput(node, "max_distance");
		String hitVar = SymbolNames.of(SymbolNames.HIT, node.id());

		ctx.emit("let " + hitVar + " = physics.raycast(" + origin + ", " + direction + ", " + maxDistance + ");");
		ctx.bind(node.id(), hitVar);
	}
}
