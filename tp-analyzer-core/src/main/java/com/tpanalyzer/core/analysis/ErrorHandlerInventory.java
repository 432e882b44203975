package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.ControlFlowGraph;
import com.tpanalyzer.core.model.ErrorHandler;
import com.tpanalyzer.core.model.FlowEdge;
import com.tpanalyzer.core.model.FlowEdgeKind;
import com.tpanalyzer.core.model.FlowNode;
import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.LabelClass;
import com.tpanalyzer.core.model.Program;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Lists the error handlers of a program and the recovery actions each one performs.
 *
 * <p>Each statement of an ERROR_HANDLER region is checked against the configured action
 * rules in order; the first matching rule names the action for that statement.
 */
public class ErrorHandlerInventory {

    private final List<CompiledAction> rules;

    /**
     * Creates an inventory using the configured action rules.
     *
     * @param config analyzer configuration
     * @throws java.util.regex.PatternSyntaxException if a configured action pattern is invalid
     */
    public ErrorHandlerInventory(AnalyzerConfig config) {
        this.rules = Objects.requireNonNull(config, "config must not be null").withDefaults()
            .errorActions().stream()
            .map(rule -> new CompiledAction(Pattern.compile(rule.pattern()), rule.action()))
            .toList();
    }

    /**
     * Lists the error handlers of one program.
     *
     * @param program assembled program
     * @param graph control-flow graph of the program
     * @return one entry per ERROR_HANDLER node, in label order
     */
    public List<ErrorHandler> inventory(Program program, ControlFlowGraph graph) {
        List<ErrorHandler> handlers = new ArrayList<>();
        for (FlowNode node : graph.nodesOf(LabelClass.ERROR_HANDLER)) {
            handlers.add(new ErrorHandler(
                program.name(),
                node.label(),
                node.name(),
                node.firstLine(),
                actions(program, node),
                callers(graph, node.label())
            ));
        }
        return handlers;
    }

    private List<String> actions(Program program, FlowNode node) {
        List<String> actions = new ArrayList<>();
        for (int i = node.startIndex() + 1; i < node.endIndex(); i++) {
            Instruction instruction = program.instructions().get(i);
            rules.stream()
                .filter(rule -> rule.pattern().matcher(instruction.text()).find())
                .findFirst()
                .ifPresent(rule -> actions.add(rule.action()));
        }
        return actions;
    }

    private static List<Integer> callers(ControlFlowGraph graph, int label) {
        return graph.incoming(label).stream()
            .filter(edge -> edge.kind() == FlowEdgeKind.JUMP || edge.kind() == FlowEdgeKind.CONDITIONAL_JUMP)
            .map(FlowEdge::from)
            .filter(from -> from != label)
            .distinct()
            .sorted()
            .toList();
    }

    private record CompiledAction(Pattern pattern, String action) {
    }
}
