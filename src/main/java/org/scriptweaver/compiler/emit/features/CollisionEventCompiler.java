package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.emit.SymbolNames;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles {@code event/collision} into an iteration over the collision pairs of the frame.
 * <p>
 * The loop is left open; it is closed once every node depending on the event has been compiled.
 * Each side of the pair is bound to its own handle, {@code a} and {@code b}.
 */
public final class CollisionEventCompiler implements INodeCompiler {

	@Override
	public void compile(Node node, EmitContext ctx) {
		String entityA = SymbolNames.of(SymbolNames.ENTITY_A, node.id());
		String entityB = SymbolNames.of(SymbolNames.ENTITY_B, node.id());
		ctx.openEventScope("for (" + entityA + ", " + entityB + ") in physics.get_collision_pairs() {");
		ctx.bind(node.id(), "a", entityA);
		ctx.bind(node.id(), "b", entityB);
	}
}
