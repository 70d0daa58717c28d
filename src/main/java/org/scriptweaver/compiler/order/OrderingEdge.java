package org.scriptweaver.compiler.order;

/**
 * States that node {@code from} must be emitted before node {@code to}.
 *
 * @param from The prerequisite node id.
 * @param to   The dependent node id.
 */
public record OrderingEdge(String from, String to) {
}
