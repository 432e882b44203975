package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.ProgramWarning;

import java.util.List;
import java.util.Objects;

/**
 * Result of parsing one segment: the parsed value plus the warnings raised on the way.
 *
 * @param value parsed value
 * @param warnings recoverable problems, empty if the segment parsed cleanly
 * @param <T> parsed value type
 */
public record ParseOutcome<T>(
    T value,
    List<ProgramWarning> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public ParseOutcome {
        Objects.requireNonNull(value, "value must not be null");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static <T> ParseOutcome<T> clean(T value) {
        return new ParseOutcome<>(value, List.of());
    }
}
