package com.tpanalyzer.core.model;

import java.util.Objects;

/**
 * A recoverable problem attached to a program.
 *
 * @param type warning category
 * @param message human-readable description
 * @param lineNumber 1-based source line the warning refers to, or 0 when not line-specific
 */
public record ProgramWarning(
    WarningType type,
    String message,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public ProgramWarning {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (lineNumber < 0) {
            lineNumber = 0;
        }
    }

    /**
     * Creates a warning that is not tied to a source line.
     *
     * @param type warning category
     * @param message description
     * @return warning
     */
    public static ProgramWarning of(WarningType type, String message) {
        return new ProgramWarning(type, message, 0);
    }

    public Severity severity() {
        return type.severity();
    }

    @Override
    public String toString() {
        String location = lineNumber > 0 ? " (line " + lineNumber + ")" : "";
        return type + ": " + message + location;
    }
}
