package org.scriptweaver.compiler.catalog;

/**
 * A named port of a node type.
 *
 * @param name The port name used as connection handle.
 * @param type The advisory value type.
 */
public record PortDefinition(String name, PortType type) {
}
