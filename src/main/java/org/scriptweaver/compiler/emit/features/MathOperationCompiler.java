package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.emit.SymbolNames;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles binary arithmetic nodes ({@code math/add}, {@code math/multiply}, ...) into a single
 * binding of {@code a <operator> b}. Unconnected operands become {@code 0.0}.
 */
public final class MathOperationCompiler implements INodeCompiler {

	private final String operator;

	/**
	 * @param operator The operator symbol placed between the operands.
	 */
	public MathOperationCompiler(String operator) {
		this.operator = operator;
	}

	@Override
	public void compile(Node node, EmitContext ctx) {
		String left = ctx.resolveInput(node, "a");
		String right = ctx.resolveInput(node, "b");
		String outputVar = SymbolNames.of(SymbolNames.RESULT, node.id());

		ctx.emit("let " + outputVar + " = " + left + " " + operator + " " + right + ";");
		ctx.bind(node.id(), outputVar);
	}
}
