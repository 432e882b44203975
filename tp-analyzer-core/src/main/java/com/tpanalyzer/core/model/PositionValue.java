package com.tpanalyzer.core.model;

import java.util.Objects;

/**
 * One axis value of a stored position.
 *
 * @param group motion group, e.g. {@code GP1}
 * @param axis axis name, e.g. {@code X} or {@code J3}
 * @param value numeric value, or null if the raw text is not a number
 * @param raw value as written
 * @param unit unit as written ({@code mm}, {@code deg}) or empty
 */
public record PositionValue(
    String group,
    String axis,
    Double value,
    String raw,
    String unit
) {
    /**
     * Compact constructor with validation.
     */
    public PositionValue {
        Objects.requireNonNull(axis, "axis must not be null");
        group = group == null ? "" : group;
        raw = raw == null ? "" : raw;
        unit = unit == null ? "" : unit;
    }

    public boolean parsed() {
        return value != null;
    }
}
