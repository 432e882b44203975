package com.tpanalyzer.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An error-handling label region and the recovery actions found in it.
 *
 * @param program owning program name
 * @param label label number
 * @param name inline label name (empty if none)
 * @param firstLine source line of the label definition
 * @param actions recognised recovery actions in source order, without duplicates
 * @param callers labels that jump into this handler
 */
public record ErrorHandler(
    String program,
    int label,
    String name,
    int firstLine,
    List<String> actions,
    List<Integer> callers
) {
    /**
     * Compact constructor with validation.
     */
    public ErrorHandler {
        Objects.requireNonNull(program, "program must not be null");
        name = name == null ? "" : name;
        actions = actions == null ? List.of() : List.copyOf(actions);
        callers = callers == null ? List.of() : List.copyOf(callers);
    }
}
