package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.model.CallEdge;
import com.tpanalyzer.core.model.CallGraph;
import com.tpanalyzer.core.model.CallTreeNode;
import com.tpanalyzer.core.model.CallTreeNodeState;
import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.ProgramType;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the program call graph and the call tree of every MAIN program.
 *
 * <p>Call targets are resolved against the names of the analyzed programs. Targets that
 * are not part of the corpus become external nodes and {@link WarningType#DANGLING_CALL}
 * diagnostics; the corpus is usually a subset of the controller's file system.
 *
 * <p>Call trees are built with an explicit stack that mirrors the path from the root. A
 * callee already on the path becomes a {@link CallTreeNodeState#BACK_EDGE} leaf, so the
 * walk terminates on recursive and mutually recursive calls. A program reached again on
 * another path is not expanded twice.
 */
public class CallGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(CallGraphBuilder.class);

    private static final Comparator<CallEdge> EDGE_ORDER = Comparator
        .comparing(CallEdge::caller)
        .thenComparingInt(CallEdge::lineNumber)
        .thenComparing(CallEdge::callee);

    /**
     * Builds the call graph.
     *
     * @param programs assembled programs, in any order
     * @return graph with edges, external targets, call trees and diagnostics
     */
    public CallGraph build(Collection<Program> programs) {
        SortedSet<String> known = new TreeSet<>();
        programs.forEach(program -> known.add(program.name()));

        List<CallEdge> edges = new ArrayList<>();
        SortedSet<String> external = new TreeSet<>();
        List<ProgramWarning> diagnostics = new ArrayList<>();

        for (Program program : programs) {
            for (Instruction instruction : program.calls()) {
                Instruction.Call call = instruction.payload(Instruction.Call.class);
                boolean resolved = known.contains(call.target());
                edges.add(new CallEdge(program.name(), call.target(), instruction.lineNumber(),
                    call.argument(), resolved));
                if (!resolved) {
                    external.add(call.target());
                }
            }
        }
        edges.sort(EDGE_ORDER);

        for (CallEdge edge : edges) {
            if (!edge.resolved()) {
                diagnostics.add(new ProgramWarning(WarningType.DANGLING_CALL,
                    edge.caller() + " calls " + edge.callee() + ", which is not in the analyzed set",
                    edge.lineNumber()));
            }
        }

        Map<String, Set<String>> adjacency = adjacency(edges);
        Set<String> reportedCycles = new LinkedHashSet<>();
        SortedMap<String, CallTreeNode> callTrees = new TreeMap<>();
        programs.stream()
            .filter(program -> program.type() == ProgramType.MAIN)
            .map(Program::name)
            .sorted()
            .forEach(root -> callTrees.put(root, callTree(root, adjacency, external, reportedCycles)));

        reportedCycles.forEach(cycle -> diagnostics.add(ProgramWarning.of(WarningType.RECURSIVE_CALL,
            "Recursive call " + cycle)));

        CallGraph graph = new CallGraph(known, external, edges, callTrees, diagnostics);
        log.debug("Call graph: {} programs, {} edges, {} external targets, {} call trees",
            known.size(), edges.size(), external.size(), callTrees.size());
        return graph;
    }

    /**
     * Builds the call tree rooted at one program.
     *
     * <p>Programs are expanded once per tree, at their first position in pre-order. Later
     * calls to a program that has callees of its own become {@link CallTreeNodeState#SHARED}
     * leaves, so the tree stays linear in the size of the graph.
     *
     * @param root root program name
     * @param adjacency distinct callees per caller, in call order
     * @param external names of programs outside the corpus
     * @param reportedCycles receives {@code "A -> B"} for each back edge found
     * @return root node of the tree
     */
    CallTreeNode callTree(String root, Map<String, Set<String>> adjacency, Set<String> external,
                          Set<String> reportedCycles) {
        List<CallTreeNode> rootChildren = new ArrayList<>();
        CallTreeNode rootNode = new CallTreeNode(root, CallTreeNodeState.RESOLVED, 0, rootChildren);

        Set<String> path = new HashSet<>();
        Set<String> expanded = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();
        path.add(root);
        expanded.add(root);
        stack.push(new Frame(root, 0, rootChildren, callees(root, adjacency)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.callees().hasNext()) {
                stack.pop();
                path.remove(frame.program());
                continue;
            }

            String callee = frame.callees().next();
            int depth = frame.depth() + 1;
            if (external.contains(callee)) {
                frame.children().add(new CallTreeNode(callee, CallTreeNodeState.EXTERNAL, depth, null));
            } else if (path.contains(callee)) {
                frame.children().add(new CallTreeNode(callee, CallTreeNodeState.BACK_EDGE, depth, null));
                reportedCycles.add(frame.program() + " -> " + callee);
            } else if (expanded.contains(callee) && !adjacency.getOrDefault(callee, Set.of()).isEmpty()) {
                frame.children().add(new CallTreeNode(callee, CallTreeNodeState.SHARED, depth, null));
            } else {
                List<CallTreeNode> children = new ArrayList<>();
                frame.children().add(new CallTreeNode(callee, CallTreeNodeState.RESOLVED, depth, children));
                path.add(callee);
                expanded.add(callee);
                stack.push(new Frame(callee, depth, children, callees(callee, adjacency)));
            }
        }
        return rootNode;
    }

    private static Iterator<String> callees(String program, Map<String, Set<String>> adjacency) {
        return adjacency.getOrDefault(program, Set.of()).iterator();
    }

    private static Map<String, Set<String>> adjacency(List<CallEdge> edges) {
        Map<String, Set<String>> adjacency = new HashMap<>();
        for (CallEdge edge : edges) {
            adjacency.computeIfAbsent(edge.caller(), k -> new LinkedHashSet<>()).add(edge.callee());
        }
        return adjacency;
    }

    /**
     * Resolved call tree node whose callees are still being visited.
     */
    private record Frame(String program, int depth, List<CallTreeNode> children, Iterator<String> callees) {
    }
}
