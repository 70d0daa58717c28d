package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles {@code event/update}. The update event is the entry point of every frame and emits no
 * statements; it only exposes the frame delta {@code dt}.
 */
public final class UpdateEventCompiler implements INodeCompiler {

	static final String FRAME_DELTA = "dt";

	@Override
	public void compile(Node node, EmitContext ctx) {
		ctx.bind(node.id(), FRAME_DELTA);
		ctx.bind(node.id(), "dt", FRAME_DELTA);
	}
}
