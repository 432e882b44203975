package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.InstructionKind;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.SymbolKind;
import com.tpanalyzer.core.model.WarningType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the instruction segment ({@code /MN}) into typed {@link Instruction}s.
 *
 * <p>Physical lines are first joined into logical statements (see
 * {@link AbstractLineParser#statements(String, int)}). Each statement loses its pendant
 * prefix {@code "N:"} and is offered to an ordered list of {@link LineMatcher}s:
 * <ol>
 *   <li>comment ({@code !text}, {@code //text}, {@code --eg:text})</li>
 *   <li>label definition ({@code LBL[n:name]})</li>
 *   <li>jump ({@code JMP LBL[n]}, optionally guarded by {@code IF cond,} or a SELECT case)</li>
 *   <li>call ({@code CALL NAME(args)}, optionally guarded)</li>
 *   <li>register assignment ({@code R[n:name]=expr})</li>
 *   <li>I/O assignment ({@code DO[n:name]=ON}, {@code GO[n]=R[3]}, ...)</li>
 *   <li>wait ({@code WAIT cond TIMEOUT,LBL[n]})</li>
 *   <li>motion ({@code J P[1] 100% FINE})</li>
 * </ol>
 * The first matcher that accepts a statement wins. Anything else becomes
 * {@link Instruction.Other} with its text preserved, so the number of instructions always
 * equals the number of statements.
 */
public class InstructionParser extends AbstractLineParser {

    private static final Pattern COMMENT = Pattern.compile("^(?:!|//|--eg:)(?<text>.*)$");
    private static final Pattern LABEL = Pattern.compile("^LBL\\[(?<number>\\d+)(?::(?<name>[^\\]]*))?\\]$");
    private static final Pattern JUMP = Pattern.compile(
        "^(?:(?:IF|SELECT)\\s+)?(?:(?<cond>.+?)\\s*,\\s*)?JMP\\s+LBL\\[(?<label>\\d+)(?::[^\\]]*)?\\]$");
    private static final Pattern CALL = Pattern.compile(
        "^(?:(?:IF|SELECT)\\s+)?(?:(?<cond>.+?)\\s*,\\s*)?CALL\\s+(?<target>[A-Za-z_]\\w*)\\s*(?:\\((?<arg>.*)\\))?$");
    private static final Pattern REGISTER_ASSIGN = Pattern.compile(
        "^R\\[(?<index>\\d+)(?::(?<name>[^\\]]*))?\\]\\s*=(?!=)\\s*(?<expr>.+)$");
    private static final Pattern IO_ASSIGN = Pattern.compile(
        "^(?<signal>DO|RO|DI|RI|GO|GI|AO|AI|UO|UI|SO|SI|F|M)\\[(?<index>\\d+)(?::(?<name>[^\\]]*))?\\]\\s*=(?!=)\\s*(?<value>.+)$");
    private static final Pattern WAIT = Pattern.compile(
        "^WAIT\\s+(?<cond>.+?)(?:\\s*TIMEOUT\\s*,\\s*LBL\\[(?<timeout>\\d+)(?::[^\\]]*)?\\])?$");
    private static final Pattern MOTION = Pattern.compile(
        "^(?<type>[JLCA])\\s+(?<reg>PR|P)\\[(?<index>\\d+)(?::[^\\]]*)?\\]"
            + "(?:\\s+(?:PR|P)\\[[^\\]]*\\])?"
            + "\\s+(?<speed>\\S+)\\s+(?<term>FINE|CNT\\s*\\S+|CR\\s*\\S+)(?<options>.*)$");
    private static final Pattern SPEED_PERCENT = Pattern.compile("^(\\d+)%$");
    private static final Pattern KEYWORD = Pattern.compile("^([A-Za-z_][A-Za-z_0-9]*)");

    private final List<LineMatcher> matchers;

    /**
     * Creates a parser with the default statement shapes.
     */
    public InstructionParser() {
        this(defaultMatchers());
    }

    /**
     * Creates a parser with a custom ordered matcher list.
     *
     * @param matchers matchers tried in order, first match wins
     */
    public InstructionParser(List<LineMatcher> matchers) {
        this.matchers = List.copyOf(Objects.requireNonNull(matchers, "matchers must not be null"));
    }

    /**
     * Returns the default ordered matcher list.
     *
     * @return comment, label, jump, call, register, I/O, wait and motion matchers
     */
    public static List<LineMatcher> defaultMatchers() {
        return List.of(
            regex(COMMENT, m -> new Instruction.Comment(m.group("text").trim())),
            regex(LABEL, m -> new Instruction.LabelDef(Integer.parseInt(m.group("number")), m.group("name"))),
            regex(JUMP, m -> new Instruction.Jump(Integer.parseInt(m.group("label")), condition(m))),
            regex(CALL, m -> new Instruction.Call(m.group("target"), trimToNull(m.group("arg")), condition(m))),
            regex(REGISTER_ASSIGN, m -> new Instruction.RegisterAssign(
                Integer.parseInt(m.group("index")), m.group("name"), m.group("expr").trim())),
            regex(IO_ASSIGN, m -> new Instruction.IoAssign(
                SymbolKind.fromPrefix(m.group("signal")).orElseThrow(),
                Integer.parseInt(m.group("index")), m.group("name"), m.group("value").trim())),
            regex(WAIT, m -> new Instruction.Wait(
                m.group("cond").trim(),
                m.group("timeout") == null ? null : Integer.valueOf(m.group("timeout")))),
            regex(MOTION, InstructionParser::motion)
        );
    }

    /**
     * Parses an instruction segment body.
     *
     * @param body text after the {@code /MN} marker line, may be null
     * @param firstLine file line number of the first body line
     * @return one instruction per statement, with warnings for unterminated statements and
     *     a summary note on statements kept verbatim
     */
    public ParseOutcome<List<Instruction>> parse(String body, int firstLine) {
        List<Instruction> instructions = new ArrayList<>();
        List<ProgramWarning> warnings = new ArrayList<>();
        Set<String> unrecognizedKeywords = new TreeSet<>();
        int unrecognized = 0;

        for (Statement statement : statements(body, firstLine)) {
            Instruction instruction = parseStatement(statement.lineNumber(), statement.text());
            instructions.add(instruction);

            if (!statement.terminated()) {
                warnings.add(new ProgramWarning(WarningType.MALFORMED_PROGRAM,
                    "Statement is not terminated with ';'", statement.lineNumber()));
            }
            if (instruction.is(InstructionKind.OTHER) && !instruction.text().isEmpty()) {
                unrecognized++;
                unrecognizedKeywords.add(instruction.payload(Instruction.Other.class).keyword());
            }
        }

        if (unrecognized > 0) {
            warnings.add(ProgramWarning.of(WarningType.UNRECOGNIZED_INSTRUCTION,
                unrecognized + " statement(s) kept verbatim, keywords " + unrecognizedKeywords));
        }

        log.debug("Parsed {} instructions ({} kept verbatim)", instructions.size(), unrecognized);
        return new ParseOutcome<>(instructions, warnings);
    }

    /**
     * Parses a single statement.
     *
     * @param lineNumber file line the statement starts on
     * @param rawText statement text, optionally with pendant prefix and semicolon
     * @return typed instruction, {@link InstructionKind#OTHER} if no matcher accepts it
     */
    public Instruction parseStatement(int lineNumber, String rawText) {
        String text = rawText == null ? "" : rawText.trim();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1).trim();
        }

        int statementNumber = 0;
        Matcher prefix = TpPatterns.STATEMENT_PREFIX.matcher(text);
        if (prefix.find()) {
            Integer number = parseInteger(prefix.group(1));
            statementNumber = number == null ? 0 : number;
            text = text.substring(prefix.end()).trim();
        }

        Instruction.Payload payload = null;
        for (LineMatcher matcher : matchers) {
            payload = matcher.match(text);
            if (payload != null) {
                break;
            }
        }
        if (payload == null) {
            payload = new Instruction.Other(keyword(text));
        }

        // comment text may look like a register reference, it is never one
        return new Instruction(lineNumber, statementNumber, payload.kind(), text, payload,
            payload.kind() == InstructionKind.COMMENT ? List.of() : TpPatterns.extractSymbolRefs(text));
    }

    private static LineMatcher regex(Pattern pattern, Function<Matcher, Instruction.Payload> factory) {
        return statement -> {
            Matcher matcher = pattern.matcher(statement);
            if (!matcher.matches()) {
                return null;
            }
            try {
                return factory.apply(matcher);
            } catch (NumberFormatException e) {
                // index too large for an int: the statement falls through to OTHER and is reported
                return null;
            }
        };
    }

    private static Instruction.Payload motion(Matcher m) {
        String register = m.group("reg");
        String speed = m.group("speed");
        Matcher percent = SPEED_PERCENT.matcher(speed);
        String termination = m.group("term").replaceAll("\\s+", "");
        return new Instruction.Motion(
            m.group("type").charAt(0),
            register + "[" + m.group("index") + "]",
            "PR".equals(register),
            speed,
            percent.matches() ? Integer.valueOf(percent.group(1)) : null,
            termination,
            m.group("options").trim());
    }

    private static String condition(Matcher m) {
        return trimToNull(m.group("cond"));
    }

    private static String trimToNull(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String keyword(String text) {
        Matcher matcher = KEYWORD.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return text.isEmpty() ? "" : text.substring(0, 1);
    }
}
