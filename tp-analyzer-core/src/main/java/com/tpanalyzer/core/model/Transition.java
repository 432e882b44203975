package com.tpanalyzer.core.model;

import java.util.Objects;

/**
 * Labeled transition of a state diagram.
 *
 * @param kind underlying flow edge kind
 * @param target target state label; equals the source label for call-return transitions
 * @param label text shown on the transition
 * @param lineNumber source line of the transferring statement, or 0
 */
public record Transition(
    FlowEdgeKind kind,
    int target,
    String label,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public Transition {
        Objects.requireNonNull(kind, "kind must not be null");
        label = label == null ? "" : label;
    }
}
