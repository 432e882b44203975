package com.tpanalyzer.core.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed metadata from the attribute block.
 *
 * <p>Typed fields are null when the attribute is absent or could not be converted. The raw
 * text of every attribute is always kept in {@link #raw()}.
 *
 * @param owner owning editor, e.g. {@code MNEDITOR}
 * @param comment program comment
 * @param programSize {@code PROG_SIZE} in bytes
 * @param lineCount declared {@code LINE_COUNT}
 * @param memorySize {@code MEMORY_SIZE} in bytes
 * @param protection {@code PROTECT} setting
 * @param created creation timestamp
 * @param modified last modification timestamp
 * @param raw every attribute as written, in source order
 */
public record ProgramAttributes(
    String owner,
    String comment,
    Integer programSize,
    Integer lineCount,
    Integer memorySize,
    String protection,
    LocalDateTime created,
    LocalDateTime modified,
    Map<String, String> raw
) {
    /**
     * Compact constructor with validation.
     */
    public ProgramAttributes {
        owner = owner == null ? "" : owner;
        comment = comment == null ? "" : comment;
        protection = protection == null ? "" : protection;
        raw = raw == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    /**
     * Returns attributes with nothing set.
     *
     * @return empty attributes
     */
    public static ProgramAttributes empty() {
        return new ProgramAttributes(null, null, null, null, null, null, null, null, Map.of());
    }
}
