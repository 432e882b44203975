package com.tpanalyzer.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything one analysis run produces, with no formatting applied.
 *
 * <p>This is the hand-off structure between the analysis engine and report generators.
 *
 * @param programs analyzed programs sorted by name
 * @param rejectedFiles files that produced no program, keyed by file name with the reason
 * @param symbols corpus-wide register and I/O tables
 * @param callGraph corpus call graph with call trees per MAIN program
 * @param flowGraphs control-flow graph per program name
 * @param stateDiagrams state diagram per program name
 * @param errorHandlers error-handling inventory across the corpus
 * @param homingProcedures homing regions across the corpus
 */
public record AnalysisResult(
    List<Program> programs,
    SortedMap<String, String> rejectedFiles,
    SymbolTables symbols,
    CallGraph callGraph,
    SortedMap<String, ControlFlowGraph> flowGraphs,
    SortedMap<String, StateDiagram> stateDiagrams,
    List<ErrorHandler> errorHandlers,
    List<HomingProcedure> homingProcedures
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        programs = programs == null ? List.of() : List.copyOf(programs);
        rejectedFiles = frozen(rejectedFiles);
        if (symbols == null) {
            symbols = SymbolTables.empty();
        }
        if (callGraph == null) {
            callGraph = new CallGraph(null, null, null, null, null);
        }
        flowGraphs = frozen(flowGraphs);
        stateDiagrams = frozen(stateDiagrams);
        errorHandlers = errorHandlers == null ? List.of() : List.copyOf(errorHandlers);
        homingProcedures = homingProcedures == null ? List.of() : List.copyOf(homingProcedures);
    }

    /**
     * Finds a program by name.
     *
     * @param name program name
     * @return program, or empty if not analyzed
     */
    public Optional<Program> program(String name) {
        return programs.stream().filter(program -> program.name().equals(name)).findFirst();
    }

    /**
     * Returns programs grouped by type, each group in name order.
     *
     * @return programs keyed by type
     */
    public Map<ProgramType, List<Program>> programsByType() {
        Map<ProgramType, List<Program>> grouped = new EnumMap<>(ProgramType.class);
        for (Program program : programs) {
            grouped.computeIfAbsent(program.type(), k -> new ArrayList<>()).add(program);
        }
        return grouped;
    }

    /**
     * Returns the total number of warnings attached to programs.
     *
     * @return warning count
     */
    public int warningCount() {
        return programs.stream().mapToInt(program -> program.warnings().size()).sum();
    }

    private static <V> SortedMap<String, V> frozen(SortedMap<String, V> map) {
        return Collections.unmodifiableSortedMap(map == null ? new TreeMap<>() : new TreeMap<>(map));
    }
}
