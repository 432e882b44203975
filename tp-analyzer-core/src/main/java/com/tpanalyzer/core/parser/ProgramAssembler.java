package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.InstructionKind;
import com.tpanalyzer.core.model.LabelClass;
import com.tpanalyzer.core.model.Position;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.ProgramAttributes;
import com.tpanalyzer.core.model.ProgramStatistics;
import com.tpanalyzer.core.model.ProgramType;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.SymbolKind;
import com.tpanalyzer.core.model.SymbolRef;
import com.tpanalyzer.core.model.WarningType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the text of one program file into a {@link Program}.
 *
 * <p>Runs the section splitter and the three segment parsers, then derives the program
 * name, type, product code and IML flag and validates the label table. Every problem
 * short of an empty file is recorded as a {@link ProgramWarning}; the assembler only
 * throws {@link EmptyFileException}.
 *
 * <p>Instances are immutable and safe to share between worker threads.
 */
public class ProgramAssembler {

    private static final Logger log = LoggerFactory.getLogger(ProgramAssembler.class);

    private final AnalyzerConfig config;
    private final List<CompiledRule> namingRules;
    private final Pattern productCodePattern;
    private final SectionSplitter splitter = new SectionSplitter();
    private final AttributeParser attributeParser = new AttributeParser();
    private final InstructionParser instructionParser;
    private final PositionParser positionParser = new PositionParser();

    public ProgramAssembler(AnalyzerConfig config) {
        this(config, new InstructionParser());
    }

    /**
     * Creates an assembler.
     *
     * @param config analyzer configuration, completed with defaults where sections are missing
     * @param instructionParser parser for the instruction segment
     * @throws java.util.regex.PatternSyntaxException if a configured naming or product-code
     *     pattern is not a valid regex
     */
    public ProgramAssembler(AnalyzerConfig config, InstructionParser instructionParser) {
        this.config = Objects.requireNonNull(config, "config must not be null").withDefaults();
        this.instructionParser = Objects.requireNonNull(instructionParser, "instructionParser must not be null");
        this.namingRules = this.config.namingRules().stream()
            .map(rule -> new CompiledRule(rule.type(), Pattern.compile(rule.pattern())))
            .toList();
        this.productCodePattern = Pattern.compile(this.config.productCodePattern());
    }

    /**
     * Assembles one program.
     *
     * @param fileName file name, used in messages and as fallback program name
     * @param text full file text
     * @return assembled program, possibly with warnings
     * @throws EmptyFileException if the text is empty or whitespace only
     */
    public Program assemble(String fileName, String text) {
        ProgramSections sections = splitter.split(fileName, text);
        List<ProgramWarning> warnings = new ArrayList<>();

        String name = sections.declaredName();
        if (name == null) {
            name = fileStem(fileName);
            warnings.add(ProgramWarning.of(WarningType.MALFORMED_PROGRAM,
                "Missing /PROG header, using file name '" + name + "'"));
        }
        checkStructure(sections, warnings);

        ProgramAttributes attributes = ProgramAttributes.empty();
        if (sections.attributes() != null) {
            ParseOutcome<ProgramAttributes> outcome = attributeParser.parse(
                sections.attributes().body(), sections.attributes().bodyStartLine());
            attributes = outcome.value();
            warnings.addAll(outcome.warnings());
        }

        List<Instruction> instructions = List.of();
        if (sections.instructions() != null) {
            ParseOutcome<List<Instruction>> outcome = instructionParser.parse(
                sections.instructions().body(), sections.instructions().bodyStartLine());
            instructions = outcome.value();
            warnings.addAll(outcome.warnings());
        }

        Map<String, Position> positions = new LinkedHashMap<>();
        if (sections.positions() != null) {
            ParseOutcome<Map<String, Position>> outcome = positionParser.parse(
                sections.positions().body(), sections.positions().bodyStartLine());
            positions = outcome.value();
            warnings.addAll(outcome.warnings());
        }

        Map<Integer, Integer> labelTable = buildLabelTable(instructions, warnings);
        checkLabelTargets(instructions, labelTable, warnings);

        ProgramType type = classify(name);
        Program program = new Program(
            name,
            fileName,
            type,
            attributes,
            isIml(name, type, instructions),
            productCode(name),
            instructions,
            positions,
            labelTable,
            statistics(instructions, positions, labelTable),
            warnings
        );

        if (program.isMalformed()) {
            log.warn("{}: program {} is malformed ({} warnings)", fileName, name, warnings.size());
        } else {
            log.debug("{}: assembled {} {} with {} instructions", fileName, type, name, instructions.size());
        }
        return program;
    }

    /**
     * Classifies a program name with the configured naming rules.
     *
     * @param name program name
     * @return type of the first rule matching the whole name, UNKNOWN otherwise
     */
    public ProgramType classify(String name) {
        return namingRules.stream()
            .filter(rule -> rule.pattern().matcher(name).matches())
            .map(CompiledRule::type)
            .findFirst()
            .orElse(ProgramType.UNKNOWN);
    }

    private void checkStructure(ProgramSections sections, List<ProgramWarning> warnings) {
        if (sections.preamble() != null && !sections.preamble().text().isBlank()) {
            warnings.add(new ProgramWarning(WarningType.MALFORMED_PROGRAM,
                "Unexpected content before /PROG", sections.preamble().startLine()));
        }
        missing(sections.attributes(), "/ATTR", warnings);
        missing(sections.instructions(), "/MN", warnings);
        missing(sections.positions(), "/POS", warnings);
        if (sections.terminator() == null) {
            warnings.add(ProgramWarning.of(WarningType.MALFORMED_PROGRAM, "Missing /END terminator"));
        }
        if (sections.trailing() != null && !sections.trailing().text().isBlank()) {
            warnings.add(new ProgramWarning(WarningType.MALFORMED_PROGRAM,
                "Unexpected content after /END", sections.trailing().startLine()));
        }
    }

    private static void missing(ProgramSections.Segment segment, String marker, List<ProgramWarning> warnings) {
        if (segment == null) {
            warnings.add(ProgramWarning.of(WarningType.MALFORMED_PROGRAM, "Missing " + marker + " section"));
        }
    }

    private Map<Integer, Integer> buildLabelTable(List<Instruction> instructions, List<ProgramWarning> warnings) {
        Map<Integer, Integer> labelTable = new TreeMap<>();
        for (int i = 0; i < instructions.size(); i++) {
            Instruction instruction = instructions.get(i);
            if (!instruction.is(InstructionKind.LABEL)) {
                continue;
            }
            int number = instruction.payload(Instruction.LabelDef.class).number();
            if (labelTable.putIfAbsent(number, i) != null) {
                warnings.add(new ProgramWarning(WarningType.DUPLICATE_LABEL,
                    "LBL[" + number + "] is defined more than once, keeping the first definition",
                    instruction.lineNumber()));
            }
        }
        return labelTable;
    }

    private void checkLabelTargets(List<Instruction> instructions, Map<Integer, Integer> labelTable,
                                   List<ProgramWarning> warnings) {
        for (Instruction instruction : instructions) {
            Integer target = switch (instruction.kind()) {
                case JUMP -> instruction.payload(Instruction.Jump.class).targetLabel();
                case WAIT -> instruction.payload(Instruction.Wait.class).timeoutLabel();
                default -> null;
            };
            if (target != null && !labelTable.containsKey(target)) {
                warnings.add(new ProgramWarning(WarningType.UNDEFINED_LABEL,
                    "Jump to undefined LBL[" + target + "]", instruction.lineNumber()));
            }
        }
    }

    private String productCode(String name) {
        Matcher matcher = productCodePattern.matcher(name);
        if (!matcher.find()) {
            return null;
        }
        return matcher.groupCount() >= 1 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
    }

    private boolean isIml(String name, ProgramType type, List<Instruction> instructions) {
        List<String> keywords = config.imlKeywords().stream()
            .map(keyword -> keyword.toUpperCase(Locale.ROOT))
            .toList();
        String upperName = name.toUpperCase(Locale.ROOT);
        if (keywords.stream().anyMatch(upperName::contains)) {
            return true;
        }
        if (type != ProgramType.MAIN) {
            return false;
        }
        return instructions.stream()
            .map(instruction -> instruction.text().toUpperCase(Locale.ROOT))
            .anyMatch(text -> keywords.stream().anyMatch(text::contains));
    }

    private ProgramStatistics statistics(List<Instruction> instructions, Map<String, Position> positions,
                                         Map<Integer, Integer> labelTable) {
        int calls = 0;
        int jumps = 0;
        int unrecognized = 0;
        Set<Integer> registers = new HashSet<>();
        Set<String> ioSignals = new HashSet<>();

        for (Instruction instruction : instructions) {
            switch (instruction.kind()) {
                case CALL -> calls++;
                case JUMP -> jumps++;
                case OTHER -> {
                    if (!instruction.text().isEmpty()) {
                        unrecognized++;
                    }
                }
                default -> {
                    // counted through symbol references below
                }
            }
            for (SymbolRef ref : instruction.symbolRefs()) {
                if (ref.kind() == SymbolKind.REGISTER) {
                    registers.add(ref.index());
                } else if (ref.kind().isIo()) {
                    ioSignals.add(ref.kind().format(ref.index()));
                }
            }
        }

        int errorLabels = (int) labelTable.keySet().stream()
            .filter(label -> config.classifyLabel(label) == LabelClass.ERROR_HANDLER)
            .count();

        return new ProgramStatistics(instructions.size(), labelTable.size(), calls, jumps,
            positions.size(), registers.size(), ioSignals.size(), errorLabels, unrecognized);
    }

    private static String fileStem(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "UNNAMED";
        }
        String base = fileName.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }

    private record CompiledRule(ProgramType type, Pattern pattern) {
    }
}
