package com.tpanalyzer.core.generator.impl;

import com.tpanalyzer.core.generator.GeneratedReport;
import com.tpanalyzer.core.generator.ReportGenerator;
import com.tpanalyzer.core.generator.ReportType;
import com.tpanalyzer.core.model.AnalysisResult;
import com.tpanalyzer.core.model.CallEdge;
import com.tpanalyzer.core.model.CallGraph;
import com.tpanalyzer.core.model.ControlFlowGraph;
import com.tpanalyzer.core.model.FlowEdge;
import com.tpanalyzer.core.model.FlowNode;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.ProgramType;
import com.tpanalyzer.core.model.StateDiagram;
import com.tpanalyzer.core.model.StateEntry;
import com.tpanalyzer.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Generates Mermaid diagram definitions embedded in Markdown.
 *
 * <h2>Supported Report Types</h2>
 * <ul>
 *   <li><b>Call Graph:</b> flowchart of programs, external targets drawn dashed</li>
 *   <li><b>Flow Diagram:</b> per-program flowchart of labels, styled by label class</li>
 *   <li><b>State Diagram:</b> per-program {@code stateDiagram-v2}</li>
 * </ul>
 *
 * <p>Output is Markdown (*.md files) with embedded {@code ```mermaid} code blocks.
 *
 * @see <a href="https://mermaid.js.org/">Mermaid Documentation</a>
 */
public class MermaidGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Diagram Generator";
    private static final String FILE_EXTENSION = "md";

    // Markdown formatting
    private static final String MARKDOWN_HEADER_PREFIX = "# ";
    private static final String MARKDOWN_NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    // Mermaid diagram types
    private static final String GRAPH_LR = "graph LR\n";
    private static final String GRAPH_TD = "graph TD\n";
    private static final String STATE_DIAGRAM = "stateDiagram-v2\n";

    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";
    private static final String NO_PROGRAMS_NODE = "  A[No programs found]\n";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<ReportType> getSupportedReportTypes() {
        return Set.of(ReportType.CALL_GRAPH, ReportType.FLOW_DIAGRAM, ReportType.STATE_DIAGRAM);
    }

    @Override
    public List<GeneratedReport> generate(AnalysisResult result, ReportType type) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(type, "type must not be null");

        if (!getSupportedReportTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }

        log.debug("Generating Mermaid diagrams for type: {}", type);

        List<GeneratedReport> reports = new ArrayList<>();
        switch (type) {
            case CALL_GRAPH -> reports.add(new GeneratedReport("call_graph", generateCallGraph(result.callGraph(), result),
                FILE_EXTENSION));
            case FLOW_DIAGRAM -> {
                for (Program program : result.programs()) {
                    ControlFlowGraph graph = result.flowGraphs().get(program.name());
                    if (graph != null && !graph.nodes().isEmpty()) {
                        reports.add(new GeneratedReport("flow/" + program.name() + "_flow",
                            generateFlowDiagram(graph), FILE_EXTENSION));
                    }
                }
            }
            case STATE_DIAGRAM -> {
                for (Program program : result.programs()) {
                    StateDiagram diagram = result.stateDiagrams().get(program.name());
                    if (diagram != null && diagram.size() > 0) {
                        reports.add(new GeneratedReport("state/" + program.name() + "_states",
                            generateStateDiagram(diagram), FILE_EXTENSION));
                    }
                }
            }
            default -> throw new IllegalArgumentException("Unsupported report type: " + type);
        }

        log.info("Generated {} Mermaid {} diagram(s)", reports.size(), type.name().toLowerCase(Locale.ROOT));
        return reports;
    }

    /**
     * Generates the program call graph.
     *
     * <p>MAIN programs are drawn as stadiums, other analyzed programs as boxes and
     * programs outside the analyzed set with a dashed border.
     */
    private String generateCallGraph(CallGraph graph, AnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Call Graph", GRAPH_LR);

        if (graph.programs().isEmpty()) {
            sb.append(NO_PROGRAMS_NODE);
        } else {
            for (String name : graph.programs()) {
                boolean main = result.program(name).map(p -> p.type() == ProgramType.MAIN).orElse(false);
                sb.append("  ").append(sanitizeId(name))
                    .append(main ? "([\"" : "[\"").append(escape(name)).append(main ? "\"])" : "\"]")
                    .append(MARKDOWN_NEWLINE);
            }
            for (String name : graph.externalPrograms()) {
                sb.append("  ").append(sanitizeId(name)).append("[\"").append(escape(name)).append("\"]")
                    .append(MARKDOWN_NEWLINE);
                sb.append("  style ").append(sanitizeId(name)).append(" stroke-dasharray: 5 5").append(MARKDOWN_NEWLINE);
            }

            Set<String> drawn = new LinkedHashSet<>();
            for (CallEdge edge : graph.edges()) {
                String arrow = "  " + sanitizeId(edge.caller()) + (edge.resolved() ? " --> " : " -.-> ")
                    + sanitizeId(edge.callee());
                if (drawn.add(arrow)) {
                    sb.append(arrow).append(MARKDOWN_NEWLINE);
                }
            }
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    /**
     * Generates the label flowchart of one program.
     */
    private String generateFlowDiagram(ControlFlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "Control Flow: " + graph.program(), GRAPH_TD);

        sb.append("  classDef cycle fill:#e3f2fd,stroke:#1565c0\n");
        sb.append("  classDef error fill:#ffebee,stroke:#c62828\n");
        sb.append("  classDef homing fill:#e8f5e9,stroke:#2e7d32\n");
        sb.append("  start((start))\n");

        for (FlowNode node : graph.nodes().values()) {
            sb.append("  ").append(nodeId(node.label())).append("[\"").append(escape(node.display())).append("\"]");
            String styleClass = switch (node.classification()) {
                case CYCLE_STEP -> "cycle";
                case ERROR_HANDLER -> "error";
                case HOMING -> "homing";
                case UNCLASSIFIED -> null;
            };
            if (styleClass != null) {
                sb.append(":::").append(styleClass);
            }
            sb.append(MARKDOWN_NEWLINE);
        }
        for (Integer undefined : graph.undefinedTargets()) {
            sb.append("  ").append(nodeId(undefined)).append("[\"LBL[").append(undefined).append("] undefined\"]")
                .append(MARKDOWN_NEWLINE);
        }

        for (FlowEdge edge : graph.edges()) {
            String from = edge.from() == ControlFlowGraph.ENTRY ? "start" : nodeId(edge.from());
            switch (edge.kind()) {
                case FALLTHROUGH -> sb.append("  ").append(from).append(" --> ").append(nodeId(edge.to()));
                case JUMP -> sb.append("  ").append(from).append(" ==> ").append(nodeId(edge.to()));
                case CONDITIONAL_JUMP -> sb.append("  ").append(from).append(" -- \"")
                    .append(escape(edge.condition())).append("\" --> ").append(nodeId(edge.to()));
                case CALL_RETURN -> sb.append("  ").append(from).append(" -. \"CALL ")
                    .append(escape(edge.callTarget())).append("\" .-> ").append(from);
            }
            sb.append(MARKDOWN_NEWLINE);
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    /**
     * Generates the state diagram of one program.
     */
    private String generateStateDiagram(StateDiagram diagram) {
        StringBuilder sb = new StringBuilder();
        appendDiagramHeader(sb, "State Diagram: " + diagram.program(), STATE_DIAGRAM);

        for (Transition transition : diagram.initialTransitions()) {
            sb.append("  [*] --> ").append(nodeId(transition.target())).append(MARKDOWN_NEWLINE);
        }
        for (StateEntry entry : diagram) {
            sb.append("  state \"").append(escape(entry.stateName())).append("\" as ").append(nodeId(entry.label()))
                .append(MARKDOWN_NEWLINE);
            for (Transition transition : entry.transitions()) {
                sb.append("  ").append(nodeId(entry.label())).append(" --> ").append(nodeId(transition.target()));
                String label = switch (transition.kind()) {
                    case CONDITIONAL_JUMP -> transition.label();
                    case CALL_RETURN -> "CALL " + transition.label();
                    case JUMP -> "JMP";
                    case FALLTHROUGH -> "";
                };
                if (!label.isEmpty()) {
                    sb.append(" : ").append(escape(label));
                }
                sb.append(MARKDOWN_NEWLINE);
            }
        }

        appendDiagramFooter(sb);
        return sb.toString();
    }

    private void appendDiagramHeader(StringBuilder sb, String title, String diagramType) {
        sb.append(MARKDOWN_HEADER_PREFIX).append(title).append(MARKDOWN_NEWLINE.repeat(2));
        sb.append(CODE_BLOCK_START);
        sb.append(diagramType);
    }

    private void appendDiagramFooter(StringBuilder sb) {
        sb.append(CODE_BLOCK_END);
    }

    private String nodeId(int label) {
        return "L" + label;
    }

    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Makes text safe inside Mermaid labels: quotes become single quotes, line breaks and
     * semicolons become spaces and commas.
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\n", " ").replace(";", ",");
    }
}
