package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.Symbol;
import com.tpanalyzer.core.model.SymbolKind;
import com.tpanalyzer.core.model.SymbolRef;
import com.tpanalyzer.core.model.SymbolTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the corpus-wide register and I/O symbol tables.
 *
 * <p>A single-threaded pass over every instruction of every program, in program-name
 * order. A reference that is the target of an assignment ({@code R[90]=1},
 * {@code DO[3]=ON}, {@code PR[1]=LPOS}) increments the usage count of its index; every
 * other reference increments the read count. Non-empty names are collected per index so
 * that informal renames across programs show up as name variants.
 *
 * <p>Counts and sets are commutative, so the result does not depend on the order of the
 * input collection. The sort only fixes {@link Symbol#firstProgram()}.
 */
public class SymbolAggregator {

    private static final Logger log = LoggerFactory.getLogger(SymbolAggregator.class);

    /**
     * Aggregates the symbol tables of a corpus.
     *
     * @param programs assembled programs, in any order
     * @return register, position register and I/O tables
     */
    public SymbolTables aggregate(Collection<Program> programs) {
        Map<SymbolKind, SortedMap<Integer, Accumulator>> accumulators = new EnumMap<>(SymbolKind.class);

        List<Program> ordered = programs.stream()
            .sorted(Comparator.comparing(Program::name))
            .toList();

        for (Program program : ordered) {
            for (Instruction instruction : program.instructions()) {
                for (SymbolRef ref : instruction.symbolRefs()) {
                    accumulators
                        .computeIfAbsent(ref.kind(), kind -> new TreeMap<>())
                        .computeIfAbsent(ref.index(), index -> new Accumulator(program.name()))
                        .record(ref, program.name());
                }
            }
        }

        SortedMap<Integer, Symbol> registers = new TreeMap<>();
        SortedMap<Integer, Symbol> positionRegisters = new TreeMap<>();
        Map<SymbolKind, SortedMap<Integer, Symbol>> ioSignals = new EnumMap<>(SymbolKind.class);

        accumulators.forEach((kind, table) -> {
            SortedMap<Integer, Symbol> target = switch (kind) {
                case REGISTER -> registers;
                case POSITION_REGISTER -> positionRegisters;
                default -> ioSignals.computeIfAbsent(kind, k -> new TreeMap<>());
            };
            table.forEach((index, accumulator) -> target.put(index, accumulator.toSymbol(kind, index)));
        });

        SymbolTables tables = new SymbolTables(registers, positionRegisters, ioSignals);
        log.debug("Aggregated {} registers, {} position registers, {} I/O signal tables over {} programs",
            registers.size(), positionRegisters.size(), ioSignals.size(), ordered.size());
        if (log.isDebugEnabled()) {
            tables.nameVariants().forEach(symbol ->
                log.debug("{} has name variants {}", symbol.reference(), symbol.names()));
        }
        return tables;
    }

    /**
     * Mutable per-index state, confined to one aggregation pass.
     */
    private static final class Accumulator {
        private final SortedSet<String> names = new TreeSet<>();
        private final SortedSet<String> programs = new TreeSet<>();
        private final String firstProgram;
        private int usageCount;
        private int readCount;

        private Accumulator(String firstProgram) {
            this.firstProgram = firstProgram;
        }

        private void record(SymbolRef ref, String program) {
            if (ref.assigned()) {
                usageCount++;
            } else {
                readCount++;
            }
            if (!ref.name().isEmpty()) {
                names.add(ref.name());
            }
            programs.add(program);
        }

        private Symbol toSymbol(SymbolKind kind, int index) {
            return new Symbol(kind, index, names, usageCount, readCount, programs, firstProgram);
        }
    }
}
