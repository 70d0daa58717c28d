package org.scriptweaver.compiler.order;

import org.scriptweaver.compiler.graph.Node;

/**
 * A top-level node in emission order.
 *
 * @param node          The node to compile.
 * @param closingScopes How many event scopes end right after this node.
 */
public record ScheduledNode(Node node, int closingScopes) {

    ScheduledNode closingOneMore() {
        return new ScheduledNode(node, closingScopes + 1);
    }
}
