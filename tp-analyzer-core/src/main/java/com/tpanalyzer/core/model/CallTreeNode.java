package com.tpanalyzer.core.model;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Node of a per-program call tree.
 *
 * <p>The children list is a read-only view; the tree builder fills the backing list while
 * it walks the graph.
 *
 * @param program program name
 * @param state whether the node was expanded, is external, closes a cycle or repeats an earlier subtree
 * @param depth distance from the tree root
 * @param children called programs in name order
 */
public record CallTreeNode(
    String program,
    CallTreeNodeState state,
    int depth,
    List<CallTreeNode> children
) {
    /**
     * Compact constructor with validation.
     */
    public CallTreeNode {
        Objects.requireNonNull(program, "program must not be null");
        Objects.requireNonNull(state, "state must not be null");
        children = children == null ? List.of() : Collections.unmodifiableList(children);
    }

    public boolean isBackEdge() {
        return state == CallTreeNodeState.BACK_EDGE;
    }

    /**
     * Counts the nodes of this subtree, including this node.
     *
     * @return subtree size
     */
    public int size() {
        int size = 0;
        Deque<CallTreeNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            CallTreeNode node = pending.pop();
            size++;
            node.children().forEach(pending::push);
        }
        return size;
    }
}
