package com.tpanalyzer.core.model;

/**
 * Kinds of control transfer between label regions.
 */
public enum FlowEdgeKind {
    /** Execution runs past the end of a region into the next defined label */
    FALLTHROUGH,

    /** {@code JMP LBL[n]} without a guard */
    JUMP,

    /** Guarded jump, including {@code WAIT ... TIMEOUT,LBL[n]} */
    CONDITIONAL_JUMP,

    /** {@code CALL} leaving the program and returning to the next statement */
    CALL_RETURN
}
