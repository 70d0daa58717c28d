package org.scriptweaver.compiler.emit.features;

import org.scriptweaver.compiler.emit.EmitContext;
import org.scriptweaver.compiler.emit.INodeCompiler;
import org.scriptweaver.compiler.emit.SymbolNames;
import org.scriptweaver.compiler.graph.Node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Compiles {@code query/get_entities} into a world query over the component kinds listed in
 * {@code data.components}.
 */
public final class GetEntitiesCompiler implements INodeCompiler {

	static final List<String> DEFAULT_COMPONENTS = List.of("Transform");

	/**
	 * {@inheritDoc}
	 * <p>
	 * An absent or empty component list queries {@code Transform}.
	 */
	@Override
	public void compile(Node node, EmitContext ctx) {
		List<String> components = node.stringListData("components")
				.filter(list -> !list.isEmpty())
				.orElse(DEFAULT_COMPONENTS);
		String queryVar = SymbolNames.of(SymbolNames.QUERY, node.id());
		String componentTypes = components.stream().map(c -> "&" + c).collect(Collectors.joining(", "));

		ctx.emit("let " + queryVar + " = world.query::<(" + componentTypes + ")>();");
		ctx.bind(node.id(), queryVar);
	}
}
