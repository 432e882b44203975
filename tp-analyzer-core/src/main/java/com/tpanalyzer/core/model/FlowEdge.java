package com.tpanalyzer.core.model;

import java.util.Objects;

/**
 * Control transfer between two label regions.
 *
 * @param from source label, or {@link ControlFlowGraph#ENTRY} for statements before the first label
 * @param to target label; equals {@code from} for {@link FlowEdgeKind#CALL_RETURN}
 * @param kind transfer kind
 * @param condition guard condition for conditional jumps, otherwise null
 * @param callTarget called program for {@link FlowEdgeKind#CALL_RETURN}, otherwise null
 * @param lineNumber source line of the transferring statement, or 0 for fallthrough
 */
public record FlowEdge(
    int from,
    int to,
    FlowEdgeKind kind,
    String condition,
    String callTarget,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public FlowEdge {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public String describe() {
        return switch (kind) {
            case FALLTHROUGH -> "fallthrough -> LBL[" + to + "]";
            case JUMP -> "jump -> LBL[" + to + "]";
            case CONDITIONAL_JUMP -> "if " + condition + " -> LBL[" + to + "]";
            case CALL_RETURN -> "call " + callTarget + " -> return";
        };
    }
}
