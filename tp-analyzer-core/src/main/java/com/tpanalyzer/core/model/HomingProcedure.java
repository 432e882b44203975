package com.tpanalyzer.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Homing region of one program.
 *
 * @param program owning program name
 * @param label homing label number
 * @param name inline label name (empty if none)
 * @param checks statements in the region that test a register or input
 * @param zones zone keywords named in the region's checks and comments
 */
public record HomingProcedure(
    String program,
    int label,
    String name,
    List<String> checks,
    SortedSet<String> zones
) {
    /**
     * Compact constructor with validation.
     */
    public HomingProcedure {
        Objects.requireNonNull(program, "program must not be null");
        name = name == null ? "" : name;
        checks = checks == null ? List.of() : List.copyOf(checks);
        zones = Collections.unmodifiableSortedSet(zones == null ? new TreeSet<>() : new TreeSet<>(zones));
    }
}
