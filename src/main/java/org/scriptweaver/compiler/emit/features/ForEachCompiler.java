package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.api.CompilationException;
import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.emit.SymbolNames;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles {@code flow/foreach} into a loop over its {@code array} input. The current element is
 * bound to the {@code item} handle and the nodes connected to {@code body} form the loop body.
 */
public final class ForEachCompiler implements INodeCompiler {

	static final String BODY = "body";

	@Override
	public void compile(Node node, EmitContext ctx) throws CompilationException {
		String array = ctx.resolveInput(node, "array");
		String itemVar = SymbolNames.of(SymbolNames.ITEM, node.id());

		ctx.emit("for " + itemVar + " in " + array + ".iter() {");
		ctx.indent();
		ctx.bind(node.id(), "item", itemVar);
		try {
			ctx.compileBody(node, BODY);
		} finally {
			ctx.dedent();
		}
		ctx.emit("}");
	}
}
