package com.tpanalyzer.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Indexed storage cells and signals tracked across the corpus.
 */
public enum SymbolKind {
    REGISTER("R", false),
    POSITION_REGISTER("PR", false),
    DI("DI", true),
    DO("DO", true),
    RI("RI", true),
    RO("RO", true),
    GI("GI", true),
    GO("GO", true),
    AI("AI", true),
    AO("AO", true),
    UI("UI", true),
    UO("UO", true),
    SI("SI", true),
    SO("SO", true),
    F("F", true),
    M("M", true);

    private final String prefix;
    private final boolean io;

    SymbolKind(String prefix, boolean io) {
        this.prefix = prefix;
        this.io = io;
    }

    /**
     * Returns the mnemonic used in source text, e.g. {@code DI} for {@code DI[5]}.
     *
     * @return source prefix
     */
    public String prefix() {
        return prefix;
    }

    /**
     * Returns true for I/O signals, false for registers.
     *
     * @return whether this kind is an I/O signal
     */
    public boolean isIo() {
        return io;
    }

    /**
     * Looks up a kind by its source prefix (case-insensitive).
     *
     * @param prefix source prefix such as {@code R} or {@code DO}
     * @return matching kind, or empty if the prefix is unknown
     */
    public static Optional<SymbolKind> fromPrefix(String prefix) {
        if (prefix == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(kind -> kind.prefix.equalsIgnoreCase(prefix))
            .findFirst();
    }

    /**
     * Formats a reference in source notation, e.g. {@code DO[12]}.
     *
     * @param index symbol index
     * @return formatted reference
     */
    public String format(int index) {
        return prefix + "[" + index + "]";
    }
}
