package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.ControlFlowGraph;
import com.tpanalyzer.core.model.FlowNode;
import com.tpanalyzer.core.model.HomingProcedure;
import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.InstructionKind;
import com.tpanalyzer.core.model.LabelClass;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.SymbolKind;
import com.tpanalyzer.core.model.SymbolRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Describes the homing procedures of a program.
 *
 * <p>A homing region is a HOMING node, or any node whose label name mentions {@code HOME}.
 * Its checks are the conditional statements that read a register or an input; its zones
 * are the configured zone keywords found in those checks and in the region's comments.
 */
public class HomingAnalyzer {

    private final List<String> zones;

    public HomingAnalyzer(AnalyzerConfig config) {
        this.zones = Objects.requireNonNull(config, "config must not be null").withDefaults()
            .homingZones().stream()
            .map(zone -> zone.toLowerCase(Locale.ROOT))
            .toList();
    }

    /**
     * Describes the homing procedures of one program.
     *
     * @param program assembled program
     * @param graph control-flow graph of the program
     * @return one entry per homing region, in label order
     */
    public List<HomingProcedure> analyze(Program program, ControlFlowGraph graph) {
        List<HomingProcedure> procedures = new ArrayList<>();
        for (FlowNode node : graph.nodes().values()) {
            if (!isHoming(node)) {
                continue;
            }

            List<String> checks = new ArrayList<>();
            SortedSet<String> found = new TreeSet<>();
            for (int i = node.startIndex() + 1; i < node.endIndex(); i++) {
                Instruction instruction = program.instructions().get(i);
                boolean check = isCheck(instruction);
                if (check) {
                    checks.add(instruction.text());
                }
                if (check || instruction.is(InstructionKind.COMMENT)) {
                    String text = instruction.text().toLowerCase(Locale.ROOT);
                    zones.stream().filter(text::contains).forEach(found::add);
                }
            }
            procedures.add(new HomingProcedure(program.name(), node.label(), node.name(), checks, found));
        }
        return procedures;
    }

    private static boolean isHoming(FlowNode node) {
        return node.classification() == LabelClass.HOMING
            || node.name().toUpperCase(Locale.ROOT).contains("HOME");
    }

    private static boolean isCheck(Instruction instruction) {
        boolean conditional = switch (instruction.kind()) {
            case JUMP -> instruction.payload(Instruction.Jump.class).conditional();
            case CALL -> instruction.payload(Instruction.Call.class).condition() != null;
            case WAIT -> true;
            case OTHER -> {
                String keyword = instruction.payload(Instruction.Other.class).keyword();
                yield "IF".equals(keyword) || "SELECT".equals(keyword);
            }
            default -> false;
        };
        return conditional && instruction.symbolRefs().stream().anyMatch(HomingAnalyzer::isTestable);
    }

    private static boolean isTestable(SymbolRef ref) {
        return !ref.assigned() && (ref.kind() == SymbolKind.REGISTER || ref.kind().isIo());
    }
}
