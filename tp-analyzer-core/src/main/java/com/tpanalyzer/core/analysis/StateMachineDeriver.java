package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.ControlFlowGraph;
import com.tpanalyzer.core.model.FlowEdge;
import com.tpanalyzer.core.model.FlowEdgeKind;
import com.tpanalyzer.core.model.FlowNode;
import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.InstructionKind;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.StateDiagram;
import com.tpanalyzer.core.model.StateEntry;
import com.tpanalyzer.core.model.Transition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Projects a control-flow graph onto a state diagram.
 *
 * <p>Every label stays a distinct state, chains of fallthrough-only states are not merged,
 * so each state still points at its source lines. The returned diagram builds its entries
 * on demand in label order.
 */
public class StateMachineDeriver {

    static final int MAX_ACTIONS = 3;
    static final int MAX_ACTION_LENGTH = 70;

    private final AnalyzerConfig config;

    public StateMachineDeriver(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null").withDefaults();
    }

    /**
     * Derives the state diagram of a program.
     *
     * @param program program the graph was extracted from
     * @param graph control-flow graph of the program
     * @return lazy, restartable state diagram
     */
    public StateDiagram derive(Program program, ControlFlowGraph graph) {
        List<Transition> initial = graph.outgoing(ControlFlowGraph.ENTRY).stream()
            .filter(edge -> edge.kind() != FlowEdgeKind.CALL_RETURN)
            .map(StateMachineDeriver::transition)
            .toList();

        return new StateDiagram(
            program.name(),
            new ArrayList<>(graph.nodes().keySet()),
            initial,
            label -> entry(program, graph, graph.nodes().get(label))
        );
    }

    private StateEntry entry(Program program, ControlFlowGraph graph, FlowNode node) {
        List<Transition> transitions = graph.outgoing(node.label()).stream()
            .map(StateMachineDeriver::transition)
            .toList();
        return new StateEntry(node.label(), stateName(node), node.classification(), node.firstLine(),
            actions(program, node), transitions);
    }

    private String stateName(FlowNode node) {
        String configured = config.stateNames().get(node.label());
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return node.name().isEmpty() ? "LBL[" + node.label() + "]" : node.name();
    }

    private static List<String> actions(Program program, FlowNode node) {
        List<String> actions = new ArrayList<>();
        List<Instruction> instructions = program.instructions();
        for (int i = node.startIndex() + 1; i < node.endIndex() && actions.size() < MAX_ACTIONS; i++) {
            Instruction instruction = instructions.get(i);
            if (instruction.is(InstructionKind.COMMENT) || instruction.text().isEmpty()) {
                continue;
            }
            String text = instruction.text();
            actions.add(text.length() > MAX_ACTION_LENGTH ? text.substring(0, MAX_ACTION_LENGTH) : text);
        }
        return actions;
    }

    private static Transition transition(FlowEdge edge) {
        String label = switch (edge.kind()) {
            case CONDITIONAL_JUMP -> edge.condition();
            case CALL_RETURN -> edge.callTarget();
            case JUMP, FALLTHROUGH -> "";
        };
        return new Transition(edge.kind(), edge.to(), label, edge.lineNumber());
    }
}
