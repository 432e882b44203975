package com.tpanalyzer.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A stored position from the position block.
 *
 * @param id identifier as referenced by motion statements, e.g. {@code P[1]}
 * @param index numeric part of the identifier, -1 if it does not fit an int
 * @param comment optional comment, e.g. {@code rust positie}
 * @param kind cartesian or joint representation
 * @param frame frame fields such as {@code UF}, {@code UT} and {@code CONFIG}
 * @param values axis values in source order
 * @param lineNumber 1-based source line of the identifier
 */
public record Position(
    String id,
    int index,
    String comment,
    PositionKind kind,
    Map<String, String> frame,
    List<PositionValue> values,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public Position {
        Objects.requireNonNull(id, "id must not be null");
        comment = comment == null ? "" : comment;
        if (kind == null) {
            kind = PositionKind.UNKNOWN;
        }
        frame = frame == null ? Map.of() : Map.copyOf(frame);
        values = values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Returns true if any axis value could not be parsed as a number.
     *
     * @return whether this position carries a parse warning
     */
    public boolean hasParseWarning() {
        return values.stream().anyMatch(value -> !value.parsed());
    }
}
