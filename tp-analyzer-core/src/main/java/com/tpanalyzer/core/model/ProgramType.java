package com.tpanalyzer.core.model;

/**
 * Classification of a program by its role on the production line.
 */
public enum ProgramType {
    /** Top-level production program started by the cell controller */
    MAIN,

    /** Station-specific subroutine (turning unit, printing, placement, buffer, film handling) */
    SUBPROGRAM,

    /** Shared helper such as homing, message display or rest position */
    UTILITY,

    /** Error, interface or logging program */
    SYSTEM,

    /** Name did not match any known convention */
    UNKNOWN
}
