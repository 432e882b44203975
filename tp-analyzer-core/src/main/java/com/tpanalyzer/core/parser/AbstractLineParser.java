package com.tpanalyzer.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for the segment parsers, providing line splitting and regex helpers.
 *
 * <p>Program segments are line oriented but statements may span several physical lines.
 * {@link #statements(String, int)} joins physical lines into logical statements that end
 * with a semicolon and keeps the line number where each statement starts.
 *
 * @see AttributeParser
 * @see InstructionParser
 * @see PositionParser
 */
public abstract class AbstractLineParser {

    /**
     * Logger instance for this parser, named after the concrete class.
     */
    protected final Logger log;

    protected AbstractLineParser() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Line Splitting ====================

    /**
     * Splits a segment body into physical lines.
     *
     * @param body segment body
     * @param firstLine 1-based file line of the first body line
     * @return lines with their file line numbers, line breaks removed
     */
    protected List<SourceLine> lines(String body, int firstLine) {
        List<SourceLine> lines = new ArrayList<>();
        if (body == null || body.isEmpty()) {
            return lines;
        }
        String[] parts = body.split("\n", -1);
        int count = body.endsWith("\n") ? parts.length - 1 : parts.length;
        for (int i = 0; i < count; i++) {
            String text = parts[i].endsWith("\r") ? parts[i].substring(0, parts[i].length() - 1) : parts[i];
            lines.add(new SourceLine(firstLine + i, text));
        }
        return lines;
    }

    /**
     * Joins physical lines into semicolon-terminated statements.
     *
     * <p>A line whose trimmed text does not end with {@code ;} continues on the next line.
     * Continuation lines lose their leading whitespace and a leading {@code :} marker.
     * Blank lines never start a statement. A statement still open at the end of the body is
     * returned with {@code terminated == false}.
     *
     * @param body segment body
     * @param firstLine 1-based file line of the first body line
     * @return statements in source order
     */
    protected List<Statement> statements(String body, int firstLine) {
        List<Statement> statements = new ArrayList<>();
        StringBuilder pending = null;
        int pendingLine = 0;

        for (SourceLine line : lines(body, firstLine)) {
            String trimmed = line.text().trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (pending == null) {
                pending = new StringBuilder(trimmed);
                pendingLine = line.number();
            } else {
                String continuation = trimmed.startsWith(":") ? trimmed.substring(1).trim() : trimmed;
                if (!continuation.isEmpty()) {
                    pending.append(' ').append(continuation);
                }
            }
            if (trimmed.endsWith(";")) {
                statements.add(new Statement(pendingLine, stripTerminator(pending.toString()), true));
                pending = null;
            }
        }

        if (pending != null) {
            statements.add(new Statement(pendingLine, pending.toString().trim(), false));
        }
        return statements;
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Finds the first match of a pattern in the text.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return matcher if found, null otherwise
     */
    protected Matcher findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher : null;
    }

    /**
     * Extracts a named group from a matcher.
     *
     * @param matcher matcher with results
     * @param groupName name of the capture group
     * @return captured text, or null if the group did not participate
     */
    protected String extractGroup(Matcher matcher, String groupName) {
        try {
            return matcher.group(groupName);
        } catch (IllegalArgumentException | IllegalStateException e) {
            return null;
        }
    }

    // ==================== Value Conversion ====================

    /**
     * Parses an integer, tolerating surrounding whitespace.
     *
     * @param text text to parse
     * @return parsed value, or null if the text is not an integer
     */
    protected Integer parseInteger(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Integer.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses a decimal number, tolerating surrounding whitespace.
     *
     * @param text text to parse
     * @return parsed value, or null if the text is not a number
     */
    protected Double parseDecimal(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Trims whitespace and removes surrounding quotes from a string.
     *
     * @param text text to clean
     * @return cleaned text
     */
    protected String cleanQuotes(String text) {
        if (text == null) {
            return "";
        }

        String trimmed = text.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    private static String stripTerminator(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1).trim() : trimmed;
    }

    /**
     * One physical line.
     *
     * @param number 1-based file line number
     * @param text line text without the line break
     */
    protected record SourceLine(int number, String text) {
    }

    /**
     * One logical statement.
     *
     * @param lineNumber file line the statement starts on
     * @param text joined statement text without the terminating semicolon
     * @param terminated false if the body ended before the semicolon
     */
    protected record Statement(int lineNumber, String text, boolean terminated) {
    }
}
