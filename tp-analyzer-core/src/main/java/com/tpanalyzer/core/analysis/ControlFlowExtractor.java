package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.ControlFlowGraph;
import com.tpanalyzer.core.model.FlowEdge;
import com.tpanalyzer.core.model.FlowEdgeKind;
import com.tpanalyzer.core.model.FlowNode;
import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.InstructionKind;
import com.tpanalyzer.core.model.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Extracts the label-level control-flow graph of one program.
 *
 * <p>Every label definition in the label table becomes a {@link FlowNode} whose region runs
 * up to the next label definition or the end of the instructions. Statements before the
 * first label belong to {@link ControlFlowGraph#ENTRY}, which has outgoing edges but is
 * not a node.
 *
 * <p>Edges per region:
 * <ul>
 *   <li>FALLTHROUGH to the next label in source order, unless the region's last statement
 *       is an unconditional jump, {@code END} or {@code ABORT}</li>
 *   <li>JUMP or CONDITIONAL_JUMP for every {@code JMP LBL[n]}, and CONDITIONAL_JUMP for a
 *       {@code WAIT ... TIMEOUT,LBL[n]}</li>
 *   <li>CALL_RETURN, a self edge, for every {@code CALL}</li>
 * </ul>
 * Jumps to labels that are never defined keep their edge and are listed in
 * {@link ControlFlowGraph#undefinedTargets()}.
 */
public class ControlFlowExtractor {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowExtractor.class);

    private static final Set<String> TERMINAL_KEYWORDS = Set.of("END", "ABORT");

    private final AnalyzerConfig config;

    public ControlFlowExtractor(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null").withDefaults();
    }

    /**
     * Extracts the control-flow graph of a program.
     *
     * @param program assembled program
     * @return graph over the program's labels
     */
    public ControlFlowGraph extract(Program program) {
        List<Instruction> instructions = program.instructions();
        List<Map.Entry<Integer, Integer>> definitions = program.labelTable().entrySet().stream()
            .sorted(Map.Entry.comparingByValue())
            .toList();

        SortedMap<Integer, FlowNode> nodes = new TreeMap<>();
        List<FlowEdge> edges = new ArrayList<>();
        SortedSet<Integer> undefinedTargets = new TreeSet<>();

        int entryEnd = definitions.isEmpty() ? instructions.size() : definitions.get(0).getValue();
        Integer firstLabel = definitions.isEmpty() ? null : definitions.get(0).getKey();
        addRegionEdges(program, ControlFlowGraph.ENTRY, 0, entryEnd, firstLabel, edges, undefinedTargets);

        for (int i = 0; i < definitions.size(); i++) {
            int label = definitions.get(i).getKey();
            int start = definitions.get(i).getValue();
            int end = i + 1 < definitions.size() ? definitions.get(i + 1).getValue() : instructions.size();
            Integer next = i + 1 < definitions.size() ? definitions.get(i + 1).getKey() : null;

            Instruction definition = instructions.get(start);
            nodes.put(label, new FlowNode(
                label,
                definition.payload(Instruction.LabelDef.class).name(),
                config.classifyLabel(label),
                start,
                end,
                definition.lineNumber(),
                instructions.get(end - 1).lineNumber()
            ));
            addRegionEdges(program, label, start + 1, end, next, edges, undefinedTargets);
        }

        edges.sort(Comparator.comparingInt(FlowEdge::from).thenComparingInt(FlowEdge::lineNumber));
        log.debug("{}: {} flow nodes, {} edges, {} undefined targets",
            program.name(), nodes.size(), edges.size(), undefinedTargets.size());
        return new ControlFlowGraph(program.name(), nodes, edges, undefinedTargets);
    }

    private void addRegionEdges(Program program, int from, int start, int end, Integer next,
                                List<FlowEdge> edges, Set<Integer> undefinedTargets) {
        List<Instruction> instructions = program.instructions();
        Instruction last = null;

        for (int i = start; i < end; i++) {
            Instruction instruction = instructions.get(i);
            switch (instruction.kind()) {
                case JUMP -> {
                    Instruction.Jump jump = instruction.payload(Instruction.Jump.class);
                    edges.add(new FlowEdge(from, jump.targetLabel(),
                        jump.conditional() ? FlowEdgeKind.CONDITIONAL_JUMP : FlowEdgeKind.JUMP,
                        jump.condition(), null, instruction.lineNumber()));
                    checkTarget(program, jump.targetLabel(), undefinedTargets);
                }
                case WAIT -> {
                    Instruction.Wait wait = instruction.payload(Instruction.Wait.class);
                    if (wait.timeoutLabel() != null) {
                        edges.add(new FlowEdge(from, wait.timeoutLabel(), FlowEdgeKind.CONDITIONAL_JUMP,
                            "TIMEOUT " + wait.condition(), null, instruction.lineNumber()));
                        checkTarget(program, wait.timeoutLabel(), undefinedTargets);
                    }
                }
                case CALL -> edges.add(new FlowEdge(from, from, FlowEdgeKind.CALL_RETURN,
                    instruction.payload(Instruction.Call.class).condition(),
                    instruction.payload(Instruction.Call.class).target(), instruction.lineNumber()));
                default -> {
                    // no control transfer
                }
            }
            if (isSignificant(instruction)) {
                last = instruction;
            }
        }

        if (next != null && !isTerminal(last)) {
            // the next region starts with the target label definition
            edges.add(new FlowEdge(from, next, FlowEdgeKind.FALLTHROUGH, null, null,
                instructions.get(end).lineNumber()));
        }
    }

    private static void checkTarget(Program program, int target, Set<Integer> undefinedTargets) {
        if (!program.labelTable().containsKey(target)) {
            undefinedTargets.add(target);
        }
    }

    private static boolean isSignificant(Instruction instruction) {
        return !instruction.is(InstructionKind.COMMENT) && !instruction.text().isEmpty();
    }

    private static boolean isTerminal(Instruction instruction) {
        if (instruction == null) {
            return false;
        }
        return switch (instruction.kind()) {
            case JUMP -> !instruction.payload(Instruction.Jump.class).conditional();
            case OTHER -> TERMINAL_KEYWORDS.contains(instruction.payload(Instruction.Other.class).keyword());
            default -> false;
        };
    }
}
