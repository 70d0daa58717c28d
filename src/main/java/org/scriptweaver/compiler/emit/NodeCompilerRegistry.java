package org.scriptweaver.compiler.emit;

import org.scriptweaver.compiler.catalog.NodeCatalog;
import org.scriptweaver.compiler.emit.features.CollisionEventCompiler;
import org.scriptweaver.compiler.emit.features.ForEachCompiler;
import org.scriptweaver.compiler.emit.features.GetComponentCompiler;
import org.scriptweaver.compiler.emit.features.GetEntitiesCompiler;
import org.scriptweaver.compiler.emit.features.IfCompiler;
import org.scriptweaver.compiler.emit.features.MathOperationCompiler;
import org.scriptweaver.compiler.emit.features.PlayAudioCompiler;
import org.scriptweaver.compiler.emit.features.RaycastCompiler;
import org.scriptweaver.compiler.emit.features.SetComponentCompiler;
import org.scriptweaver.compiler.emit.features.UnknownNodeCompiler;
import org.scriptweaver.compiler.emit.features.UpdateEventCompiler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping node types to compiler instances.
 * <p>
 * Provides explicit registration and a default compiler fallback for types nobody registered.
 */
public final class NodeCompilerRegistry {

	private final Map<String, INodeCompiler> byType = new HashMap<>();
	private final INodeCompiler defaultCompiler;

	private NodeCompilerRegistry(INodeCompiler defaultCompiler) {
		this.defaultCompiler = defaultCompiler;
	}

	/**
	 * Registers a compiler for the given node type.
	 *
	 * @param nodeType The node type, e.g. {@code math/add}.
	 * @param compiler The compiler instance handling that type.
	 */
	public void register(String nodeType, INodeCompiler compiler) {
		byType.put(nodeType, compiler);
	}

	/**
	 * Retrieves the compiler strictly registered for the given type.
	 *
	 * @param nodeType The node type to look up.
	 * @return Optional compiler if present.
	 */
	public Optional<INodeCompiler> get(String nodeType) {
		return Optional.ofNullable(byType.get(nodeType));
	}

	/**
	 * Resolves a compiler for the given node type, falling back to the default compiler.
	 *
	 * @param nodeType The node type.
	 * @return A non-null compiler.
	 */
	public INodeCompiler resolve(String nodeType) {
		return byType.getOrDefault(nodeType, defaultCompiler);
	}

	/**
	 * @return The default/fallback compiler used when no specific compiler is registered.
	 */
	public INodeCompiler defaultCompiler() {
		return defaultCompiler;
	}

	/**
	 * Creates an empty registry with the given default compiler.
	 *
	 * @param defaultCompiler The fallback compiler used for unknown node types.
	 * @return A new registry instance.
	 */
	public static NodeCompilerRegistry initialize(INodeCompiler defaultCompiler) {
		return new NodeCompilerRegistry(defaultCompiler);
	}

	/**
	 * Initializes a registry with the placeholder fallback and all built-in compilers.
	 *
	 * @return A registry pre-populated with the standard compilers.
	 */
	public static NodeCompilerRegistry initializeWithDefaults() {
		NodeCompilerRegistry reg = initialize(new UnknownNodeCompiler());
		reg.register(NodeCatalog.EVENT_UPDATE, new UpdateEventCompiler());
		reg.register(NodeCatalog.EVENT_COLLISION, new CollisionEventCompiler());
		reg.register(NodeCatalog.QUERY_GET_ENTITIES, new GetEntitiesCompiler());
		reg.register(NodeCatalog.COMPONENT_GET, new GetComponentCompiler());
		reg.register(NodeCatalog.COMPONENT_SET, new SetComponentCompiler());
		reg.register(NodeCatalog.MATH_ADD, new MathOperationCompiler("+"));
		reg.register(NodeCatalog.MATH_SUBTRACT, new MathOperationCompiler("-"));
		reg.register(NodeCatalog.MATH_MULTIPLY, new MathOperationCompiler("*"));
		reg.register(NodeCatalog.MATH_DIVIDE, new MathOperationCompiler("/"));
		reg.register(NodeCatalog.FLOW_IF, new IfCompiler());
		reg.register(NodeCatalog.FLOW_FOREACH, new ForEachCompiler());
		reg.register(NodeCatalog.PHYSICS_RAYCAST, new RaycastCompiler());
		reg.register(NodeCatalog.AUDIO_PLAY, new PlayAudioCompiler());
		return reg;
	}
}
