package com.tpanalyzer.core.model;

/**
 * Severity of a {@link WarningType}.
 */
public enum Severity {
    /** Informational, no data was lost */
    INFO,

    /** Recoverable, some data may be incomplete */
    WARNING,

    /** The affected file could not be analyzed */
    ERROR
}
