package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles {@code audio/play}.
 */
public final class PlayAudioCompiler implements INodeCompiler {

	@Override
	public void compile(Node node, EmitContext ctx) {
		ctx.emit("audio.play(" + ctx.resolveInput(node, "clip") + ");");
	}
}
