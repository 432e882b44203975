package com.tpanalyzer.core.model;

import java.util.Objects;

/**
 * One call site from a caller program to a callee program.
 *
 * <p>Edges between the same pair of programs are kept once per call site.
 *
 * @param caller calling program name
 * @param callee called program name
 * @param lineNumber 1-based source line of the call in the caller
 * @param argument argument text, or null
 * @param resolved false if the callee is not part of the analyzed set
 */
public record CallEdge(
    String caller,
    String callee,
    int lineNumber,
    String argument,
    boolean resolved
) {
    /**
     * Compact constructor with validation.
     */
    public CallEdge {
        Objects.requireNonNull(caller, "caller must not be null");
        Objects.requireNonNull(callee, "callee must not be null");
    }
}
