package com.tpanalyzer.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One state of a state diagram together with its outgoing transitions.
 *
 * @param label label number the state stands for
 * @param stateName display name of the state
 * @param classification role from the label-range convention
 * @param firstLine source line of the label definition
 * @param actions first significant statements of the region
 * @param transitions outgoing transitions in source order
 */
public record StateEntry(
    int label,
    String stateName,
    LabelClass classification,
    int firstLine,
    List<String> actions,
    List<Transition> transitions
) {
    /**
     * Compact constructor with validation.
     */
    public StateEntry {
        Objects.requireNonNull(stateName, "stateName must not be null");
        actions = actions == null ? List.of() : List.copyOf(actions);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }
}
