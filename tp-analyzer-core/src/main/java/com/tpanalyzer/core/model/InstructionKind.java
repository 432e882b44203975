package com.tpanalyzer.core.model;

/**
 * Closed set of statement shapes recognised in the instruction block.
 *
 * <p>Each kind has exactly one payload record in {@link Instruction}.
 */
public enum InstructionKind {
    /** {@code LBL[n:name]} */
    LABEL,

    /** {@code JMP LBL[n]}, optionally guarded by a condition */
    JUMP,

    /** {@code CALL PROGRAM(args)}, optionally guarded by a condition */
    CALL,

    /** {@code R[n:name]=expression} */
    REGISTER_ASSIGN,

    /** {@code DO[n:name]=ON} and the other digital, grouped and analog signals */
    IO_ASSIGN,

    /** {@code WAIT condition} */
    WAIT,

    /** {@code J P[n] 100% FINE} and other motion statements */
    MOTION,

    /** {@code !comment} */
    COMMENT,

    /** Anything else, preserved verbatim */
    OTHER
}
