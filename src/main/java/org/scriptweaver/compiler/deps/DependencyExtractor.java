package org.scriptweaver.compiler.deps;

import org.scriptweaver.compiler.catalog.NodeCatalog;
import org.scriptweaver.compiler.catalog.NodeDefinition;
import org.scriptweaver.compiler.graph.Node;
import org.scriptweaver.compiler.graph.ScriptGraph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the external component kinds and capabilities a graph needs.
 * <p>
 * Per node, in authoring order: the {@code componentType} of the node data, every entry of its
 * {@code components} list, then the capability of the node type. Names are de-duplicated and
 * keep the order in which they were first seen.
 */
public final class DependencyExtractor {

    private final NodeCatalog catalog;

    /**
     * @param catalog The catalog providing node capabilities.
     */
    public DependencyExtractor(NodeCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @param graph The graph to scan.
     * @return The dependencies in first-seen order.
     */
    public List<String> extract(ScriptGraph graph) {
        Set<String> found = new LinkedHashSet<>();
        for (Node node : graph.allNodes()) {
            node.stringData("componentType").ifPresent(found::add);
            node.stringListData("components").ifPresent(list -> list.stream()
                    .filter(s -> !s.isBlank())
                    .forEach(found::add));
            catalog.find(node.type())
                    .flatMap(NodeDefinition::capabilityName)
                    .ifPresent(found::add);
        }
        return new ArrayList<>(found);
    }
}
