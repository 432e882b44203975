package com.tpanalyzer.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed call graph over the corpus.
 *
 * @param programs names of the analyzed programs, sorted
 * @param externalPrograms call targets not present in the analyzed set, sorted
 * @param edges every call site, sorted by caller, line and callee
 * @param callTrees call tree per MAIN program, keyed by program name
 * @param diagnostics dangling and recursive call notes, attached to the graph rather than thrown
 */
public record CallGraph(
    SortedSet<String> programs,
    SortedSet<String> externalPrograms,
    List<CallEdge> edges,
    SortedMap<String, CallTreeNode> callTrees,
    List<ProgramWarning> diagnostics
) {
    /**
     * Compact constructor with validation.
     */
    public CallGraph {
        programs = Collections.unmodifiableSortedSet(programs == null ? new TreeSet<>() : new TreeSet<>(programs));
        externalPrograms = Collections.unmodifiableSortedSet(
            externalPrograms == null ? new TreeSet<>() : new TreeSet<>(externalPrograms));
        edges = edges == null ? List.of() : List.copyOf(edges);
        callTrees = Collections.unmodifiableSortedMap(callTrees == null ? new TreeMap<>() : new TreeMap<>(callTrees));
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Returns the distinct programs called by a program.
     *
     * @param caller calling program name
     * @return callee names, sorted
     */
    public SortedSet<String> callees(String caller) {
        SortedSet<String> callees = new TreeSet<>();
        for (CallEdge edge : edges) {
            if (edge.caller().equals(caller)) {
                callees.add(edge.callee());
            }
        }
        return Collections.unmodifiableSortedSet(callees);
    }

    /**
     * Returns the distinct programs calling a program.
     *
     * @param callee called program name
     * @return caller names, sorted
     */
    public SortedSet<String> callers(String callee) {
        SortedSet<String> callers = new TreeSet<>();
        for (CallEdge edge : edges) {
            if (edge.callee().equals(callee)) {
                callers.add(edge.caller());
            }
        }
        return Collections.unmodifiableSortedSet(callers);
    }

    /**
     * Returns the call sites whose target is not part of the analyzed set.
     *
     * @return unresolved call edges
     */
    public List<CallEdge> danglingCalls() {
        return edges.stream().filter(edge -> !edge.resolved()).toList();
    }

    /**
     * Returns analyzed programs that no other program calls.
     *
     * @return root program names, sorted
     */
    public SortedSet<String> roots() {
        SortedSet<String> roots = new TreeSet<>(programs);
        edges.stream()
            .filter(edge -> !edge.caller().equals(edge.callee()))
            .forEach(edge -> roots.remove(edge.callee()));
        return Collections.unmodifiableSortedSet(roots);
    }

    public boolean isExternal(String program) {
        return externalPrograms.contains(program);
    }

    /**
     * Returns call edges grouped by caller.
     *
     * @return edges keyed by caller name
     */
    public Map<String, List<CallEdge>> edgesByCaller() {
        Map<String, List<CallEdge>> grouped = new TreeMap<>();
        for (CallEdge edge : edges) {
            grouped.computeIfAbsent(edge.caller(), k -> new ArrayList<>()).add(edge);
        }
        return grouped;
    }
}
