package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.Position;
import com.tpanalyzer.core.model.PositionKind;
import com.tpanalyzer.core.model.PositionValue;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.WarningType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the position segment ({@code /POS}) into {@link Position} records.
 *
 * <p>Block shape:
 * <pre>
 * P[1:"rest position"]{
 *    GP1:
 *     UF : 0, UT : 1,     CONFIG : 'N U T, 0, 0, 0',
 *     X =   100.000  mm,  Y =   200.000  mm,  Z =   300.000  mm,
 *     W =   180.000 deg,  P =     0.000 deg,  R =     0.000 deg
 * };
 * </pre>
 * Frame fields of the first motion group are keyed {@code UF}, {@code UT}, {@code CONFIG};
 * those of further groups are prefixed with the group name ({@code GP2.UF}).
 */
public class PositionParser extends AbstractLineParser {

    private static final Pattern BLOCK_HEADER = Pattern.compile(
        "^\\s*P\\[(?<index>\\d+)(?::\\s*\"?(?<comment>[^\"\\]]*)\"?)?\\]\\s*\\{(?<rest>.*)$");
    private static final Pattern BLOCK_END = Pattern.compile("};");
    private static final Pattern TOKEN = Pattern.compile(
        "(?<group>GP\\d+)\\s*:"
            + "|(?<frame>UF|UT|CONFIG)\\s*:\\s*(?<frameValue>'[^']*'|[^,\\s]+)"
            + "|(?<axis>[A-Za-z]\\w*)\\s*=\\s*(?<value>[^,\\s]+)(?:\\s*(?<unit>mm|deg))?");
    private static final Pattern JOINT_AXIS = Pattern.compile("J\\d+");
    private static final String FIRST_GROUP = "GP1";

    /**
     * Parses a position segment body.
     *
     * @param body text after the {@code /POS} marker line, may be null
     * @param firstLine file line number of the first body line
     * @return positions keyed by id ({@code P[n]}) in order of appearance
     */
    public ParseOutcome<Map<String, Position>> parse(String body, int firstLine) {
        Map<String, Position> positions = new LinkedHashMap<>();
        List<ProgramWarning> warnings = new ArrayList<>();

        BlockBuilder current = null;
        for (SourceLine line : lines(body, firstLine)) {
            Matcher header = BLOCK_HEADER.matcher(line.text());
            if (header.matches()) {
                if (current != null) {
                    warnings.add(new ProgramWarning(WarningType.MALFORMED_PROGRAM,
                        current.id() + " is not closed with '};'", current.lineNumber));
                    store(current.build(warnings), positions, warnings);
                }
                current = new BlockBuilder(header.group("index"), header.group("comment"), line.number());
                if (current.index < 0) {
                    warnings.add(new ProgramWarning(WarningType.UNPARSED_POSITION,
                        current.id() + " has an index outside the integer range", line.number()));
                }
                if (current.append(header.group("rest"))) {
                    store(current.build(warnings), positions, warnings);
                    current = null;
                }
                continue;
            }

            if (current != null) {
                if (current.append(line.text())) {
                    store(current.build(warnings), positions, warnings);
                    current = null;
                }
            } else if (!line.text().isBlank()) {
                warnings.add(new ProgramWarning(WarningType.UNPARSED_POSITION,
                    "Text outside a position block: '" + line.text().trim() + "'", line.number()));
            }
        }

        if (current != null) {
            warnings.add(new ProgramWarning(WarningType.MALFORMED_PROGRAM,
                current.id() + " is not closed with '};'", current.lineNumber));
            store(current.build(warnings), positions, warnings);
        }

        log.debug("Parsed {} positions with {} warnings", positions.size(), warnings.size());
        return new ParseOutcome<>(positions, warnings);
    }

    private void store(Position position, Map<String, Position> positions, List<ProgramWarning> warnings) {
        if (positions.containsKey(position.id())) {
            warnings.add(new ProgramWarning(WarningType.DUPLICATE_POSITION,
                position.id() + " is defined more than once, keeping the first definition", position.lineNumber()));
            return;
        }
        positions.put(position.id(), position);
    }

    /**
     * Accumulates the lines of one position block.
     */
    private final class BlockBuilder {
        private final String rawIndex;
        private final int index;
        private final String comment;
        private final int lineNumber;
        private final StringBuilder content = new StringBuilder();

        // index is -1 when the digits do not fit an int; the id keeps them verbatim
        private BlockBuilder(String rawIndex, String comment, int lineNumber) {
            Integer parsed = parseInteger(rawIndex);
            this.rawIndex = parsed == null ? rawIndex : parsed.toString();
            this.index = parsed == null ? -1 : parsed;
            this.comment = comment;
            this.lineNumber = lineNumber;
        }

        private String id() {
            return "P[" + rawIndex + "]";
        }

        /**
         * Appends a line and reports whether the block is now closed.
         */
        private boolean append(String text) {
            Matcher end = BLOCK_END.matcher(text);
            if (end.find()) {
                content.append(text, 0, end.start()).append('\n');
                return true;
            }
            content.append(text).append('\n');
            return false;
        }

        private Position build(List<ProgramWarning> warnings) {
            Map<String, String> frame = new LinkedHashMap<>();
            List<PositionValue> values = new ArrayList<>();
            String group = "";

            Matcher token = TOKEN.matcher(content);
            while (token.find()) {
                if (token.group("group") != null) {
                    group = token.group("group");
                } else if (token.group("frame") != null) {
                    String key = group.isEmpty() || FIRST_GROUP.equals(group)
                        ? token.group("frame")
                        : group + "." + token.group("frame");
                    frame.putIfAbsent(key, cleanQuotes(token.group("frameValue")));
                } else {
                    String raw = token.group("value");
                    Double value = parseDecimal(raw);
                    if (value == null) {
                        warnings.add(new ProgramWarning(WarningType.UNPARSED_POSITION,
                            id() + " " + token.group("axis") + " has non-numeric value '" + raw + "'", lineNumber));
                    }
                    values.add(new PositionValue(group, token.group("axis"), value, raw, token.group("unit")));
                }
            }

            return new Position(id(), index, comment, kindOf(values), frame, values, lineNumber);
        }

        private PositionKind kindOf(List<PositionValue> values) {
            String firstGroup = values.isEmpty() ? "" : values.get(0).group();
            List<String> axes = values.stream()
                .filter(value -> value.group().equals(firstGroup))
                .map(PositionValue::axis)
                .toList();
            if (axes.isEmpty()) {
                return PositionKind.UNKNOWN;
            }
            if (axes.stream().allMatch(axis -> JOINT_AXIS.matcher(axis).matches())) {
                return PositionKind.JOINT;
            }
            if (axes.contains("X") && axes.contains("Y") && axes.contains("Z")) {
                return PositionKind.CARTESIAN;
            }
            return PositionKind.UNKNOWN;
        }
    }
}
