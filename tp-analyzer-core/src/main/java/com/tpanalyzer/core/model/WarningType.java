package com.tpanalyzer.core.model;

/**
 * Kinds of recoverable problems recorded while parsing and analyzing programs.
 *
 * <p>None of these abort the analysis run. They are attached to the program or graph
 * they belong to so that reports can surface every one of them.
 */
public enum WarningType {
    /** Missing section, missing terminator or unterminated block */
    MALFORMED_PROGRAM(Severity.WARNING),

    /** Attribute value that could not be converted, raw text retained */
    UNPARSED_ATTRIBUTE(Severity.WARNING),

    /** Position value that could not be converted, raw text retained */
    UNPARSED_POSITION(Severity.WARNING),

    /** Statement matched no known shape and was kept verbatim */
    UNRECOGNIZED_INSTRUCTION(Severity.INFO),

    /** Call target not present in the analyzed set */
    DANGLING_CALL(Severity.WARNING),

    /** Call chain revisits a program already on the current path */
    RECURSIVE_CALL(Severity.INFO),

    /** Label number defined more than once in one program */
    DUPLICATE_LABEL(Severity.WARNING),

    /** Position identifier defined more than once in one program */
    DUPLICATE_POSITION(Severity.WARNING),

    /** Jump to a label that the program never defines */
    UNDEFINED_LABEL(Severity.WARNING);

    private final Severity severity;

    WarningType(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }
}
