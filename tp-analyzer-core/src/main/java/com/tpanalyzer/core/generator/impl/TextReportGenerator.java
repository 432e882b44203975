package com.tpanalyzer.core.generator.impl;

import com.tpanalyzer.core.generator.GeneratedReport;
import com.tpanalyzer.core.generator.ReportGenerator;
import com.tpanalyzer.core.generator.ReportType;
import com.tpanalyzer.core.model.AnalysisResult;
import com.tpanalyzer.core.model.CallEdge;
import com.tpanalyzer.core.model.CallGraph;
import com.tpanalyzer.core.model.CallTreeNode;
import com.tpanalyzer.core.model.ControlFlowGraph;
import com.tpanalyzer.core.model.ErrorHandler;
import com.tpanalyzer.core.model.FlowEdge;
import com.tpanalyzer.core.model.FlowNode;
import com.tpanalyzer.core.model.HomingProcedure;
import com.tpanalyzer.core.model.LabelClass;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.ProgramAttributes;
import com.tpanalyzer.core.model.ProgramStatistics;
import com.tpanalyzer.core.model.ProgramType;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.StateDiagram;
import com.tpanalyzer.core.model.StateEntry;
import com.tpanalyzer.core.model.Symbol;
import com.tpanalyzer.core.model.SymbolKind;
import com.tpanalyzer.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Generates plain-text reports.
 *
 * <p>The corpus report contains, in order: executive summary, program classification,
 * call graph, register map, position register map, I/O map, error handling, homing,
 * warnings and per-program details. Flow and state reports are written per program that
 * defines at least one label.
 */
public class TextReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(TextReportGenerator.class);

    private static final String GENERATOR_ID = "text";
    private static final String GENERATOR_DISPLAY_NAME = "Plain Text Report Generator";
    private static final String FILE_EXTENSION = "txt";

    private static final String HEAVY_RULE = "=".repeat(80) + "\n";
    private static final String LIGHT_RULE = "-".repeat(40) + "\n";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final int MAX_LABELS_LISTED = 20;
    private static final int MAX_POSITIONS_LISTED = 10;

    private final Clock clock;

    public TextReportGenerator() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Creates a generator with a fixed clock for the report timestamp.
     *
     * @param clock clock used for the "Generated" line
     */
    public TextReportGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

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
        return Set.of(ReportType.ANALYSIS_REPORT, ReportType.CALL_GRAPH,
            ReportType.FLOW_DIAGRAM, ReportType.STATE_DIAGRAM);
    }

    @Override
    public List<GeneratedReport> generate(AnalysisResult result, ReportType type) {
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(type, "type must not be null");

        if (!getSupportedReportTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported report type: " + type);
        }

        List<GeneratedReport> reports = switch (type) {
            case ANALYSIS_REPORT -> List.of(report("analysis_report", analysisReport(result)));
            case CALL_GRAPH -> List.of(report("call_graph", callGraphReport(result)));
            case FLOW_DIAGRAM -> perProgram(result, "flow/", "_flow", this::flowReport);
            case STATE_DIAGRAM -> perProgram(result, "state/", "_states", this::stateReport);
        };
        log.debug("Generated {} {} report(s)", reports.size(), type);
        return reports;
    }

    // ==================== Corpus report ====================

    private String analysisReport(AnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(HEAVY_RULE).append("TEACH PENDANT PROGRAM ANALYSIS REPORT\n").append(HEAVY_RULE).append('\n');
        sb.append("Generated: ").append(LocalDateTime.now(clock).format(TIMESTAMP)).append('\n');
        sb.append("Total Programs: ").append(result.programs().size()).append("\n\n");

        writeSummary(sb, result);
        writeClassification(sb, result);
        writeCallGraph(sb, result.callGraph());
        writeSymbolTable(sb, "REGISTER MAP (R[n])", result.symbols().registers());
        writeSymbolTable(sb, "POSITION REGISTER MAP (PR[n])", result.symbols().positionRegisters());
        writeIoMap(sb, result);
        writeErrorHandling(sb, result.errorHandlers());
        writeHoming(sb, result.homingProcedures());
        writeWarnings(sb, result);
        writeProgramDetails(sb, result);
        return sb.toString();
    }

    private void writeSummary(StringBuilder sb, AnalysisResult result) {
        section(sb, "EXECUTIVE SUMMARY");

        sb.append("Program Distribution:\n");
        Map<ProgramType, List<Program>> byType = result.programsByType();
        if (byType.isEmpty()) {
            sb.append("  No programs found\n");
        }
        byType.forEach((type, programs) ->
            sb.append("  ").append(capitalize(type.name())).append(": ").append(programs.size()).append('\n'));
        sb.append('\n');

        int statements = result.programs().stream().mapToInt(p -> p.statistics().statements()).sum();
        sb.append("Total Statements: ").append(statements).append("\n\n");

        List<LocalDateTime> dates = new ArrayList<>();
        for (Program program : result.programs()) {
            Optional.ofNullable(program.attributes().created()).ifPresent(dates::add);
            Optional.ofNullable(program.attributes().modified()).ifPresent(dates::add);
        }
        if (!dates.isEmpty()) {
            sb.append("Oldest Date: ").append(dates.stream().min(LocalDateTime::compareTo).orElseThrow().format(TIMESTAMP)).append('\n');
            sb.append("Newest Date: ").append(dates.stream().max(LocalDateTime::compareTo).orElseThrow().format(TIMESTAMP)).append("\n\n");
        }

        Set<String> products = result.programs().stream()
            .map(Program::productCode)
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(TreeSet::new));
        if (!products.isEmpty()) {
            sb.append("Products Supported: ").append(String.join(", ", products)).append("\n\n");
        }

        long iml = result.programs().stream().filter(Program::iml).count();
        sb.append("Programs with IML: ").append(iml).append('\n');
        sb.append("Rejected Files: ").append(result.rejectedFiles().size()).append('\n');
        sb.append("Warnings: ").append(result.warningCount() + result.callGraph().diagnostics().size()).append("\n\n");
    }

    private void writeClassification(StringBuilder sb, AnalysisResult result) {
        section(sb, "PROGRAM CLASSIFICATION");

        result.programsByType().forEach((type, programs) -> {
            sb.append(type.name()).append(" PROGRAMS (").append(programs.size()).append("):\n");
            sb.append(LIGHT_RULE);
            for (Program program : programs) {
                ProgramAttributes attributes = program.attributes();
                sb.append(String.format("  %-20s Size: %6s  Lines: %4s  %s%n",
                    program.name(),
                    orNa(attributes.programSize()),
                    orNa(attributes.lineCount()),
                    attributes.comment()));
                if (program.iml()) {
                    sb.append("    - Has IML (In-Mold Labeling)\n");
                }
                program.productCodeIfPresent().ifPresent(code ->
                    sb.append("    - Product: ").append(code).append('\n'));
            }
            sb.append('\n');
        });
    }

    private void writeCallGraph(StringBuilder sb, CallGraph graph) {
        section(sb, "CALL GRAPH ANALYSIS");

        if (graph.callTrees().isEmpty()) {
            sb.append("No main programs found\n\n");
        }
        graph.callTrees().values().forEach(tree -> {
            writeCallTree(sb, tree);
            sb.append('\n');
        });

        List<CallEdge> dangling = graph.danglingCalls();
        if (!dangling.isEmpty()) {
            sb.append("Calls to programs outside the analyzed set:\n");
            for (CallEdge edge : dangling) {
                sb.append(String.format("  %-20s -> %-20s (line %d)%n", edge.caller(), edge.callee(), edge.lineNumber()));
            }
            sb.append('\n');
        }
    }

    private void writeCallTree(StringBuilder sb, CallTreeNode root) {
        sb.append(root.program()).append('\n');
        Deque<CallTreeNode> pending = new ArrayDeque<>();
        List<CallTreeNode> children = root.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
        while (!pending.isEmpty()) {
            CallTreeNode node = pending.pop();
            sb.append("  ".repeat(node.depth())).append("├── ").append(node.program());
            switch (node.state()) {
                case EXTERNAL -> sb.append(" [not analyzed]");
                case BACK_EDGE -> sb.append(" [recursive]");
                case SHARED -> sb.append(" [see above]");
                case RESOLVED -> {
                    // plain entry
                }
            }
            sb.append('\n');
            for (int i = node.children().size() - 1; i >= 0; i--) {
                pending.push(node.children().get(i));
            }
        }
    }

    private void writeSymbolTable(StringBuilder sb, String title, SortedMap<Integer, Symbol> table) {
        section(sb, title);

        if (table.isEmpty()) {
            sb.append("  None found\n\n");
            return;
        }
        sb.append(String.format("%-10s %-40s %6s %6s  %s%n", "Ref", "Name", "Writes", "Reads", "Programs"));
        sb.append("-".repeat(80)).append('\n');
        for (Symbol symbol : table.values()) {
            sb.append(String.format("%-10s %-40s %6d %6d  %d%n",
                symbol.reference(), displayName(symbol), symbol.usageCount(), symbol.readCount(),
                symbol.programs().size()));
        }
        sb.append('\n');
    }

    private void writeIoMap(StringBuilder sb, AnalysisResult result) {
        section(sb, "IO MAPPING");

        Map<SymbolKind, SortedMap<Integer, Symbol>> io = result.symbols().ioSignals();
        if (io.isEmpty()) {
            sb.append("  None found\n\n");
            return;
        }
        io.forEach((kind, table) -> {
            sb.append(kind.prefix()).append(":\n").append("-".repeat(60)).append('\n');
            for (Symbol symbol : table.values()) {
                sb.append(String.format("%-10s %-50s%n", symbol.reference(), displayName(symbol)));
            }
            sb.append('\n');
        });
    }

    private void writeErrorHandling(StringBuilder sb, List<ErrorHandler> handlers) {
        section(sb, "ERROR HANDLING ANALYSIS");

        if (handlers.isEmpty()) {
            sb.append("No error labels found\n\n");
            return;
        }
        sb.append(String.format("%-12s %-40s %s%n", "Label", "Description", "Program"));
        sb.append("-".repeat(80)).append('\n');
        for (ErrorHandler handler : handlers) {
            sb.append(String.format("%-12s %-40s %s%n", "LBL[" + handler.label() + "]", handler.name(), handler.program()));
            handler.actions().forEach(action -> sb.append("    - ").append(action).append('\n'));
        }
        sb.append('\n');
    }

    private void writeHoming(StringBuilder sb, List<HomingProcedure> procedures) {
        section(sb, "HOMING PROCEDURES");

        if (procedures.isEmpty()) {
            sb.append("No homing procedure found\n\n");
            return;
        }
        for (HomingProcedure procedure : procedures) {
            sb.append("  ").append(procedure.program()).append(" LBL[").append(procedure.label()).append("]");
            if (!procedure.name().isEmpty()) {
                sb.append(": ").append(procedure.name());
            }
            sb.append('\n');
            if (!procedure.zones().isEmpty()) {
                sb.append("    Zones checked: ").append(String.join(", ", procedure.zones())).append('\n');
            }
            sb.append("    Total checks: ").append(procedure.checks().size()).append('\n');
        }
        sb.append('\n');
    }

    private void writeWarnings(StringBuilder sb, AnalysisResult result) {
        section(sb, "WARNINGS");

        boolean any = false;
        for (Map.Entry<String, String> rejected : result.rejectedFiles().entrySet()) {
            sb.append("  ").append(rejected.getKey()).append(": rejected, ").append(rejected.getValue()).append('\n');
            any = true;
        }
        for (ProgramWarning diagnostic : result.callGraph().diagnostics()) {
            sb.append("  [").append(diagnostic.severity()).append("] ").append(diagnostic).append('\n');
            any = true;
        }
        for (Program program : result.programs()) {
            for (ProgramWarning warning : program.warnings()) {
                sb.append("  [").append(warning.severity()).append("] ").append(program.name())
                    .append(": ").append(warning).append('\n');
                any = true;
            }
        }
        if (!any) {
            sb.append("  None\n");
        }
        sb.append('\n');
    }

    private void writeProgramDetails(StringBuilder sb, AnalysisResult result) {
        section(sb, "DETAILED PROGRAM ANALYSIS");

        for (Program program : result.programs()) {
            sb.append("Program: ").append(program.name()).append(" (").append(program.fileName()).append(")\n");
            sb.append(LIGHT_RULE);

            if (!program.attributes().raw().isEmpty()) {
                sb.append("Attributes:\n");
                program.attributes().raw().forEach((key, value) ->
                    sb.append("  ").append(key).append(": ").append(value).append('\n'));
            }

            ProgramStatistics stats = program.statistics();
            sb.append("\nStatistics:\n")
                .append("  statements: ").append(stats.statements()).append('\n')
                .append("  labels: ").append(stats.labels()).append('\n')
                .append("  calls: ").append(stats.calls()).append('\n')
                .append("  jumps: ").append(stats.jumps()).append('\n')
                .append("  positions: ").append(stats.positions()).append('\n')
                .append("  registers: ").append(stats.registers()).append('\n')
                .append("  io signals: ").append(stats.ioSignals()).append('\n')
                .append("  error labels: ").append(stats.errorLabels()).append('\n')
                .append("  unrecognized: ").append(stats.unrecognized()).append('\n');

            if (!program.labelTable().isEmpty()) {
                sb.append("\nLabels (").append(program.labelTable().size()).append("):\n");
                program.labelTable().keySet().stream().limit(MAX_LABELS_LISTED).forEach(label ->
                    sb.append("  LBL[").append(label).append("]: ").append(program.labelName(label)).append('\n'));
                more(sb, program.labelTable().size(), MAX_LABELS_LISTED);
            }

            Set<String> callees = result.callGraph().callees(program.name());
            if (!callees.isEmpty()) {
                sb.append("\nCalls (").append(callees.size()).append("):\n");
                callees.forEach(callee -> sb.append("  CALL ").append(callee).append('\n'));
            }

            if (!program.positions().isEmpty()) {
                sb.append("\nPositions (").append(program.positions().size()).append("):\n");
                program.positions().values().stream().limit(MAX_POSITIONS_LISTED).forEach(position ->
                    sb.append("  ").append(position.id()).append(": ").append(position.comment())
                        .append(" [").append(position.kind()).append("]").append('\n'));
                more(sb, program.positions().size(), MAX_POSITIONS_LISTED);
            }

            sb.append('\n').append(HEAVY_RULE).append('\n');
        }
    }

    // ==================== Call graph report ====================

    private String callGraphReport(AnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        CallGraph graph = result.callGraph();
        section(sb, "CALL GRAPH");

        sb.append("Programs: ").append(graph.programs().size()).append('\n');
        sb.append("Call sites: ").append(graph.edges().size()).append('\n');
        sb.append("Programs not analyzed: ").append(graph.externalPrograms().size()).append("\n\n");

        sb.append("Edges:\n").append(LIGHT_RULE);
        if (graph.edges().isEmpty()) {
            sb.append("  No calls found\n");
        }
        graph.edgesByCaller().forEach((caller, edges) -> {
            sb.append("  ").append(caller).append('\n');
            for (CallEdge edge : edges) {
                sb.append("    -> ").append(edge.callee());
                if (edge.argument() != null) {
                    sb.append('(').append(edge.argument()).append(')');
                }
                sb.append(" (line ").append(edge.lineNumber()).append(')');
                if (!edge.resolved()) {
                    sb.append(" [not analyzed]");
                }
                sb.append('\n');
            }
        });

        sb.append("\nNever called:\n").append(LIGHT_RULE);
        graph.roots().forEach(root -> sb.append("  ").append(root).append('\n'));

        sb.append("\nCall trees:\n").append(LIGHT_RULE);
        graph.callTrees().values().forEach(tree -> writeCallTree(sb, tree));
        return sb.toString();
    }

    // ==================== Per-program reports ====================

    private String flowReport(AnalysisResult result, Program program) {
        StringBuilder sb = new StringBuilder();
        ControlFlowGraph graph = result.flowGraphs().get(program.name());
        StateDiagram diagram = result.stateDiagrams().get(program.name());
        sb.append(HEAVY_RULE).append("FLOW ANALYSIS: ").append(program.name()).append('\n').append(HEAVY_RULE).append('\n');

        sb.append("MAIN PRODUCTION CYCLE:\n").append(LIGHT_RULE);
        int step = 1;
        for (StateEntry entry : diagram) {
            if (entry.classification() != LabelClass.CYCLE_STEP) {
                continue;
            }
            sb.append(String.format("  %d. LBL[%d]: %s%n", step++, entry.label(), entry.stateName()));
            List<String> targets = jumpTargets(entry.transitions());
            if (!targets.isEmpty()) {
                sb.append("     -> Jumps to: ").append(String.join(", ", targets)).append('\n');
            }
        }
        sb.append('\n');

        sb.append("ERROR HANDLING PROCEDURES:\n").append(LIGHT_RULE);
        result.errorHandlers().stream()
            .filter(handler -> handler.program().equals(program.name()))
            .forEach(handler -> {
                sb.append("  LBL[").append(handler.label()).append("]: ").append(handler.name()).append('\n');
                handler.actions().forEach(action -> sb.append("    - ").append(action).append('\n'));
                if (!handler.callers().isEmpty()) {
                    sb.append("    Entered from: ").append(handler.callers().stream()
                        .map(label -> label == ControlFlowGraph.ENTRY ? "start" : "LBL[" + label + "]")
                        .collect(Collectors.joining(", "))).append('\n');
                }
                sb.append('\n');
            });

        sb.append("HOMING PROCEDURE:\n").append(LIGHT_RULE);
        List<HomingProcedure> homing = result.homingProcedures().stream()
            .filter(procedure -> procedure.program().equals(program.name()))
            .toList();
        if (homing.isEmpty()) {
            sb.append("  No homing procedure found\n");
        }
        for (HomingProcedure procedure : homing) {
            sb.append("  Label: LBL[").append(procedure.label()).append("]\n");
            if (!procedure.zones().isEmpty()) {
                sb.append("  Zones checked: ").append(String.join(", ", procedure.zones())).append('\n');
            }
            sb.append("  Total checks: ").append(procedure.checks().size()).append('\n');
        }
        sb.append('\n');

        sb.append("CONTROL FLOW GRAPH:\n").append(LIGHT_RULE);
        for (FlowNode node : graph.nodes().values()) {
            sb.append("  ").append(node.display()).append(" [").append(node.classification()).append("]")
                .append(" lines ").append(node.firstLine()).append('-').append(node.lastLine()).append('\n');
            for (FlowEdge edge : graph.outgoing(node.label())) {
                sb.append("    ").append(edge.describe()).append('\n');
            }
        }
        if (!graph.undefinedTargets().isEmpty()) {
            sb.append("\n  Jumps to undefined labels: ").append(graph.undefinedTargets().stream()
                .map(label -> "LBL[" + label + "]")
                .collect(Collectors.joining(", "))).append('\n');
        }
        return sb.toString();
    }

    private String stateReport(AnalysisResult result, Program program) {
        StringBuilder sb = new StringBuilder();
        StateDiagram diagram = result.stateDiagrams().get(program.name());
        sb.append(HEAVY_RULE).append("STATE MACHINE DIAGRAM: ").append(program.name()).append('\n')
            .append(HEAVY_RULE).append('\n');

        sb.append("Initial: ").append(diagram.initialTransitions().stream()
            .map(t -> "LBL[" + t.target() + "]")
            .collect(Collectors.joining(", "))).append("\n\n");

        sb.append("STATE TRANSITIONS:\n").append(LIGHT_RULE).append('\n');
        for (StateEntry entry : diagram) {
            sb.append("State: ").append(entry.stateName()).append('\n');
            sb.append("  Label: LBL[").append(entry.label()).append("] (").append(entry.classification())
                .append(", line ").append(entry.firstLine()).append(")\n");
            if (!entry.actions().isEmpty()) {
                sb.append("  Actions:\n");
                entry.actions().forEach(action -> sb.append("    - ").append(action).append('\n'));
            }
            for (Transition transition : entry.transitions()) {
                sb.append("  Exit: ").append(transition.kind()).append(" -> ");
                sb.append(switch (transition.kind()) {
                    case CALL_RETURN -> "CALL " + transition.label();
                    case CONDITIONAL_JUMP -> "LBL[" + transition.target() + "] if " + transition.label();
                    case JUMP, FALLTHROUGH -> "LBL[" + transition.target() + "]";
                });
                sb.append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    // ==================== Helpers ====================

    private List<GeneratedReport> perProgram(AnalysisResult result, String directory, String suffix,
                                             ProgramFormatter formatter) {
        List<GeneratedReport> reports = new ArrayList<>();
        for (Program program : result.programs()) {
            ControlFlowGraph graph = result.flowGraphs().get(program.name());
            if (graph == null || graph.nodes().isEmpty()) {
                continue;
            }
            reports.add(report(directory + program.name() + suffix, formatter.format(result, program)));
        }
        return reports;
    }

    private static List<String> jumpTargets(List<Transition> transitions) {
        return transitions.stream()
            .filter(t -> switch (t.kind()) {
                case JUMP, CONDITIONAL_JUMP -> true;
                case FALLTHROUGH, CALL_RETURN -> false;
            })
            .map(t -> "LBL[" + t.target() + "]")
            .distinct()
            .toList();
    }

    private GeneratedReport report(String name, String content) {
        return new GeneratedReport(name, content, FILE_EXTENSION);
    }

    private static void section(StringBuilder sb, String title) {
        sb.append(HEAVY_RULE).append(title).append('\n').append(HEAVY_RULE).append('\n');
    }

    private static void more(StringBuilder sb, int total, int shown) {
        if (total > shown) {
            sb.append("  ... and ").append(total - shown).append(" more\n");
        }
    }

    private static String displayName(Symbol symbol) {
        if (symbol.names().isEmpty()) {
            return "";
        }
        if (!symbol.hasNameVariants()) {
            return symbol.primaryName();
        }
        return symbol.primaryName() + " (+" + (symbol.names().size() - 1) + " variants)";
    }

    private static String orNa(Integer value) {
        return value == null ? "N/A" : value.toString();
    }

    private static String capitalize(String text) {
        return text.charAt(0) + text.substring(1).toLowerCase(Locale.ROOT);
    }

    @FunctionalInterface
    private interface ProgramFormatter {
        String format(AnalysisResult result, Program program);
    }
}
