package com.tpanalyzer.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One analyzed program file.
 *
 * <p>Created once per file by the program assembler and never modified afterwards.
 * A program with a non-empty warning list is still complete enough to analyze; warnings
 * only record which parts were missing or could not be converted.
 *
 * @param name program name from the {@code /PROG} header, unique within a corpus
 * @param fileName file the program was read from
 * @param type classification derived from the name
 * @param attributes metadata from the attribute block
 * @param iml true if the program handles in-mold labeling
 * @param productCode product code embedded in the name, or null
 * @param instructions statements in source order
 * @param positions stored positions keyed by identifier, in source order
 * @param labelTable label number to index in {@link #instructions()}, sorted by label number
 * @param statistics derived counts
 * @param warnings recoverable problems found while parsing
 */
public record Program(
    String name,
    String fileName,
    ProgramType type,
    ProgramAttributes attributes,
    boolean iml,
    String productCode,
    List<Instruction> instructions,
    Map<String, Position> positions,
    Map<Integer, Integer> labelTable,
    ProgramStatistics statistics,
    List<ProgramWarning> warnings
) {
    /**
     * Compact constructor with validation.
     */
    public Program {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        fileName = fileName == null ? name : fileName;
        if (attributes == null) {
            attributes = ProgramAttributes.empty();
        }
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
        positions = positions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        labelTable = labelTable == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(labelTable));
        if (statistics == null) {
            statistics = new ProgramStatistics(instructions.size(), labelTable.size(), 0, 0,
                positions.size(), 0, 0, 0, 0);
        }
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public Optional<String> productCodeIfPresent() {
        return Optional.ofNullable(productCode);
    }

    /**
     * Returns true if any warning of type {@link WarningType#MALFORMED_PROGRAM} was recorded.
     *
     * @return whether the program is malformed
     */
    public boolean isMalformed() {
        return warnings.stream().anyMatch(w -> w.type() == WarningType.MALFORMED_PROGRAM);
    }

    /**
     * Returns the call statements in source order.
     *
     * @return call instructions
     */
    public List<Instruction> calls() {
        return instructions.stream()
            .filter(instruction -> instruction.is(InstructionKind.CALL))
            .toList();
    }

    /**
     * Returns the label definition statement for a label number.
     *
     * @param label label number
     * @return label instruction, or empty if the label is not defined
     */
    public Optional<Instruction> labelDefinition(int label) {
        Integer index = labelTable.get(label);
        return index == null ? Optional.empty() : Optional.of(instructions.get(index));
    }

    /**
     * Returns the inline name of a label, or an empty string.
     *
     * @param label label number
     * @return label name
     */
    public String labelName(int label) {
        return labelDefinition(label)
            .map(instruction -> instruction.payload(Instruction.LabelDef.class).name())
            .orElse("");
    }
}
