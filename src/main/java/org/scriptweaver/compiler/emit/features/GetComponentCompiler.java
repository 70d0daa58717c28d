package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.emit.SymbolNames;
import org.scriptweaver.compiler.graph.Node;

/**
 * Compiles {@code component/get} into a fetch that returns early when the entity lacks the component.
 */
public final class GetComponentCompiler implements INodeCompiler {

	static final String DEFAULT_COMPONENT_TYPE = "Transform";

	@Override
	public void compile(Node node, EmitContext ctx) {
		String entity = ctx.resolveInput(node, "entity");
		String componentType = node.stringData("componentType").orElse(DEFAULT_COMPONENT_TYPE);
		String outputVar = SymbolNames.of(SymbolNames.COMPONENT, node.id());

		ctx.emit("let " + outputVar + " = world.get_component::<" + componentType + ">(" + entity + ")?;");
		ctx.bind(node.id(), outputVar);
	}
}
