package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.ProgramAttributes;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.WarningType;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the attribute segment of a program into {@link ProgramAttributes}.
 *
 * <p>Recognized statement shapes:
 * <ul>
 *   <li>{@code KEY = value;}</li>
 *   <li>{@code KEY: SUB = value, SUB = value;} stored as {@code KEY.SUB}</li>
 *   <li>{@code KEY;} stored with an empty value</li>
 * </ul>
 * Statements following an application marker such as {@code /APPL} are stored with the
 * marker name as key prefix ({@code APPL.KEY}).
 *
 * <p>Nothing in this parser aborts. Values that cannot be converted are kept raw and
 * reported as {@link WarningType#UNPARSED_ATTRIBUTE}.
 */
public class AttributeParser extends AbstractLineParser {

    private static final Pattern SUB_MARKER = Pattern.compile("^/(\\w+)[^\\n]*\\n?", Pattern.MULTILINE);
    private static final Pattern KEY_VALUE = Pattern.compile("^(?<key>[A-Za-z_]\\w*)\\s*=\\s*(?<value>.*)$", Pattern.DOTALL);
    private static final Pattern KEY_BLOCK = Pattern.compile("^(?<key>[A-Za-z_]\\w*)\\s*:\\s*(?<rest>.*)$", Pattern.DOTALL);
    private static final Pattern KEY_ONLY = Pattern.compile("^(?<key>[A-Za-z_]\\w*)$");
    private static final Pattern TIMESTAMP = Pattern.compile(
        "DATE\\s+(?<date>\\d{2}-\\d{2}-\\d{2})\\s+TIME\\s+(?<time>\\d{1,2}:\\d{2}:\\d{2})");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yy-MM-dd H:mm:ss");

    /**
     * Parses an attribute segment body.
     *
     * @param body text after the {@code /ATTR} marker line, may be null
     * @param firstLine file line number of the first body line
     * @return attributes with the warnings raised while converting values
     */
    public ParseOutcome<ProgramAttributes> parse(String body, int firstLine) {
        if (body == null || body.isBlank()) {
            return ParseOutcome.clean(ProgramAttributes.empty());
        }

        Map<String, String> raw = new LinkedHashMap<>();
        List<ProgramWarning> warnings = new ArrayList<>();

        Matcher marker = SUB_MARKER.matcher(body);
        int cursor = 0;
        String prefix = "";
        while (marker.find()) {
            readStatements(body.substring(cursor, marker.start()), lineAt(body, cursor, firstLine), prefix, raw, warnings);
            prefix = marker.group(1) + ".";
            cursor = marker.end();
        }
        readStatements(body.substring(cursor), lineAt(body, cursor, firstLine), prefix, raw, warnings);

        ProgramAttributes attributes = new ProgramAttributes(
            raw.get("OWNER"),
            raw.containsKey("COMMENT") ? cleanQuotes(raw.get("COMMENT")) : null,
            integerAttribute(raw, "PROG_SIZE", warnings),
            integerAttribute(raw, "LINE_COUNT", warnings),
            integerAttribute(raw, "MEMORY_SIZE", warnings),
            raw.get("PROTECT"),
            timestampAttribute(raw, "CREATE", warnings),
            timestampAttribute(raw, "MODIFIED", warnings),
            raw
        );

        log.debug("Parsed {} attributes with {} warnings", raw.size(), warnings.size());
        return new ParseOutcome<>(attributes, warnings);
    }

    private void readStatements(String text, int firstLine, String prefix,
                                Map<String, String> raw, List<ProgramWarning> warnings) {
        for (Statement statement : statements(text, firstLine)) {
            String content = statement.text();
            if (content.isEmpty()) {
                continue;
            }

            Matcher keyValue = KEY_VALUE.matcher(content);
            if (keyValue.matches()) {
                raw.putIfAbsent(prefix + keyValue.group("key"), keyValue.group("value").trim());
                continue;
            }

            Matcher block = KEY_BLOCK.matcher(content);
            if (block.matches()) {
                readBlock(prefix + block.group("key"), block.group("rest").trim(), raw);
                continue;
            }

            Matcher keyOnly = KEY_ONLY.matcher(content);
            if (keyOnly.matches()) {
                raw.putIfAbsent(prefix + keyOnly.group("key"), "");
                continue;
            }

            warnings.add(new ProgramWarning(WarningType.UNPARSED_ATTRIBUTE,
                "Unrecognized attribute statement '" + content + "'", statement.lineNumber()));
        }
    }

    private void readBlock(String key, String rest, Map<String, String> raw) {
        if (!rest.contains("=")) {
            raw.putIfAbsent(key, rest);
            return;
        }
        for (String entry : rest.split(",")) {
            int equals = entry.indexOf('=');
            if (equals < 0) {
                continue;
            }
            String subKey = entry.substring(0, equals).trim();
            if (!subKey.isEmpty()) {
                raw.putIfAbsent(key + "." + subKey, entry.substring(equals + 1).trim());
            }
        }
    }

    private Integer integerAttribute(Map<String, String> raw, String key, List<ProgramWarning> warnings) {
        String value = raw.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        Integer parsed = parseInteger(value);
        if (parsed == null) {
            warnings.add(ProgramWarning.of(WarningType.UNPARSED_ATTRIBUTE,
                key + " is not a number: '" + value + "'"));
        }
        return parsed;
    }

    private LocalDateTime timestampAttribute(Map<String, String> raw, String key, List<ProgramWarning> warnings) {
        String value = raw.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        Matcher matcher = TIMESTAMP.matcher(value);
        if (matcher.find()) {
            try {
                return LocalDateTime.parse(matcher.group("date") + " " + matcher.group("time"), TIMESTAMP_FORMAT);
            } catch (DateTimeParseException e) {
                log.debug("Invalid {} timestamp '{}': {}", key, value, e.getMessage());
            }
        }
        warnings.add(ProgramWarning.of(WarningType.UNPARSED_ATTRIBUTE,
            key + " is not a DATE/TIME value: '" + value + "'"));
        return null;
    }

    private static int lineAt(String text, int offset, int firstLine) {
        int line = firstLine;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
