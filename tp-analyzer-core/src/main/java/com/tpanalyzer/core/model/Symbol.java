package com.tpanalyzer.core.model;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Corpus-wide aggregate for one register or I/O signal.
 *
 * @param kind symbol kind
 * @param index numeric index
 * @param names every non-empty name observed for this index, sorted
 * @param usageCount number of statements assigning this symbol
 * @param readCount number of other statements referencing this symbol
 * @param programs names of all programs referencing this symbol, sorted
 * @param firstProgram first program in name order that referenced this symbol
 */
public record Symbol(
    SymbolKind kind,
    int index,
    SortedSet<String> names,
    int usageCount,
    int readCount,
    SortedSet<String> programs,
    String firstProgram
) {
    /**
     * Compact constructor with validation.
     */
    public Symbol {
        Objects.requireNonNull(kind, "kind must not be null");
        names = Collections.unmodifiableSortedSet(names == null ? new TreeSet<>() : new TreeSet<>(names));
        programs = Collections.unmodifiableSortedSet(programs == null ? new TreeSet<>() : new TreeSet<>(programs));
    }

    /**
     * Returns true if the same index was seen with more than one name.
     *
     * @return whether naming drifted across programs
     */
    public boolean hasNameVariants() {
        return names.size() > 1;
    }

    /**
     * Returns the first name in sort order, or an empty string.
     *
     * @return primary name
     */
    public String primaryName() {
        return names.isEmpty() ? "" : names.first();
    }

    public String reference() {
        return kind.format(index);
    }
}
