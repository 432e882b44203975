package com.tpanalyzer.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Label-level control-flow graph of one program.
 *
 * @param program program name
 * @param nodes label regions keyed by label number
 * @param edges control transfers in source order
 * @param undefinedTargets labels jumped to but never defined
 */
public record ControlFlowGraph(
    String program,
    SortedMap<Integer, FlowNode> nodes,
    List<FlowEdge> edges,
    SortedSet<Integer> undefinedTargets
) {
    /**
     * Pseudo label used as the source of edges from statements before the first label.
     * Negative, so it never collides with a defined {@code LBL[n]}.
     */
    public static final int ENTRY = -1;

    /**
     * Compact constructor with validation.
     */
    public ControlFlowGraph {
        Objects.requireNonNull(program, "program must not be null");
        nodes = Collections.unmodifiableSortedMap(nodes == null ? new TreeMap<>() : new TreeMap<>(nodes));
        edges = edges == null ? List.of() : List.copyOf(edges);
        undefinedTargets = Collections.unmodifiableSortedSet(
            undefinedTargets == null ? new TreeSet<>() : new TreeSet<>(undefinedTargets));
    }

    /**
     * Returns the edges leaving a label region.
     *
     * @param label source label, or {@link #ENTRY}
     * @return outgoing edges in source order
     */
    public List<FlowEdge> outgoing(int label) {
        return edges.stream().filter(edge -> edge.from() == label).toList();
    }

    /**
     * Returns the edges entering a label region, excluding call-return self edges.
     *
     * @param label target label
     * @return incoming edges in source order
     */
    public List<FlowEdge> incoming(int label) {
        return edges.stream()
            .filter(edge -> edge.to() == label && edge.kind() != FlowEdgeKind.CALL_RETURN)
            .toList();
    }

    /**
     * Returns the regions with a given classification in label order.
     *
     * @param classification label class
     * @return matching nodes
     */
    public List<FlowNode> nodesOf(LabelClass classification) {
        return nodes.values().stream()
            .filter(node -> node.classification() == classification)
            .toList();
    }
}
