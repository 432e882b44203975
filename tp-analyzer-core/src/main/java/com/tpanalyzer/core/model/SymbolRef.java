package com.tpanalyzer.core.model;

import java.util.Objects;

/**
 * A single reference to a register or I/O signal inside one statement.
 *
 * @param kind symbol kind
 * @param index numeric index
 * @param name inline comment name (empty if none)
 * @param assigned true if the statement writes this symbol
 */
public record SymbolRef(
    SymbolKind kind,
    int index,
    String name,
    boolean assigned
) {
    /**
     * Compact constructor with validation.
     */
    public SymbolRef {
        Objects.requireNonNull(kind, "kind must not be null");
        name = name == null ? "" : name.trim();
    }
}
