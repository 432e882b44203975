package com.tpanalyzer.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Corpus-wide register and I/O symbol tables.
 *
 * @param registers numeric registers keyed by index
 * @param positionRegisters position registers keyed by index
 * @param ioSignals I/O signals grouped by kind, each keyed by index
 */
public record SymbolTables(
    SortedMap<Integer, Symbol> registers,
    SortedMap<Integer, Symbol> positionRegisters,
    Map<SymbolKind, SortedMap<Integer, Symbol>> ioSignals
) {
    /**
     * Compact constructor with validation.
     */
    public SymbolTables {
        registers = freeze(registers);
        positionRegisters = freeze(positionRegisters);
        EnumMap<SymbolKind, SortedMap<Integer, Symbol>> io = new EnumMap<>(SymbolKind.class);
        if (ioSignals != null) {
            ioSignals.forEach((kind, table) -> io.put(kind, freeze(table)));
        }
        ioSignals = Collections.unmodifiableMap(io);
    }

    /**
     * Returns empty tables.
     *
     * @return empty tables
     */
    public static SymbolTables empty() {
        return new SymbolTables(null, null, null);
    }

    /**
     * Looks up one symbol.
     *
     * @param kind symbol kind
     * @param index symbol index
     * @return symbol, or empty if never referenced
     */
    public Optional<Symbol> find(SymbolKind kind, int index) {
        return Optional.ofNullable(table(kind).get(index));
    }

    /**
     * Returns the table for one kind.
     *
     * @param kind symbol kind
     * @return table keyed by index (empty if the kind was never referenced)
     */
    public SortedMap<Integer, Symbol> table(SymbolKind kind) {
        return switch (kind) {
            case REGISTER -> registers;
            case POSITION_REGISTER -> positionRegisters;
            default -> ioSignals.getOrDefault(kind, Collections.emptySortedMap());
        };
    }

    /**
     * Returns every symbol that was seen with more than one name.
     *
     * @return symbols with naming drift, registers first then I/O in kind order
     */
    public List<Symbol> nameVariants() {
        return Stream.concat(
                Stream.of(registers, positionRegisters),
                ioSignals.values().stream())
            .flatMap(table -> table.values().stream())
            .filter(Symbol::hasNameVariants)
            .toList();
    }

    private static SortedMap<Integer, Symbol> freeze(SortedMap<Integer, Symbol> table) {
        return Collections.unmodifiableSortedMap(table == null ? new TreeMap<>() : new TreeMap<>(table));
    }
}
