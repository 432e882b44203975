package com.tpanalyzer.core.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the text of one program file into its marked segments.
 *
 * <p>The five markers {@code /PROG}, {@code /ATTR}, {@code /MN}, {@code /POS} and
 * {@code /END} are searched at line starts, in that order. A missing marker leaves its
 * segment absent; the file is still split as far as possible and the assembler decides
 * what to report. Nothing is discarded: text before the first marker becomes the preamble
 * and text after the {@code /END} line becomes trailing content.
 *
 * @see ProgramSections
 */
public class SectionSplitter {

    private static final Logger log = LoggerFactory.getLogger(SectionSplitter.class);

    private static final Pattern PROG_MARKER = marker("PROG");
    private static final Pattern ATTR_MARKER = marker("ATTR");
    private static final Pattern MN_MARKER = marker("MN");
    private static final Pattern POS_MARKER = marker("POS");
    private static final Pattern END_MARKER = marker("END");

    /**
     * Splits program text into segments.
     *
     * @param fileName file name, used for diagnostics
     * @param text complete file text
     * @return split segments
     * @throws EmptyFileException if the text is empty or blank
     */
    public ProgramSections split(String fileName, String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyFileException(fileName);
        }

        Pattern[] markers = {PROG_MARKER, ATTR_MARKER, MN_MARKER, POS_MARKER, END_MARKER};
        int[] starts = new int[markers.length];
        int cursor = 0;
        for (int i = 0; i < markers.length; i++) {
            Matcher matcher = markers[i].matcher(text);
            if (matcher.find(cursor)) {
                starts[i] = matcher.start();
                cursor = matcher.start() + 1;
            } else {
                starts[i] = -1;
            }
        }

        int firstMarker = firstPresent(starts, 0);
        ProgramSections.Segment preamble = firstMarker > 0
            ? segment(text, 0, firstMarker)
            : firstMarker < 0 ? segment(text, 0, text.length()) : null;

        ProgramSections.Segment header = between(text, starts, 0);
        ProgramSections.Segment attributes = between(text, starts, 1);
        ProgramSections.Segment instructions = between(text, starts, 2);
        ProgramSections.Segment positions = between(text, starts, 3);

        ProgramSections.Segment terminator = null;
        ProgramSections.Segment trailing = null;
        int endStart = starts[4];
        if (endStart >= 0) {
            int lineEnd = text.indexOf('\n', endStart);
            int terminatorEnd = lineEnd < 0 ? text.length() : lineEnd + 1;
            terminator = segment(text, endStart, terminatorEnd);
            if (terminatorEnd < text.length()) {
                trailing = segment(text, terminatorEnd, text.length());
            }
        }

        log.debug("Split {}: header={}, attributes={}, instructions={}, positions={}, terminator={}",
            fileName, header != null, attributes != null, instructions != null,
            positions != null, terminator != null);

        return new ProgramSections(preamble, header, attributes, instructions, positions, terminator, trailing);
    }

    private ProgramSections.Segment between(String text, int[] starts, int index) {
        int start = starts[index];
        if (start < 0) {
            return null;
        }
        int next = firstPresent(starts, index + 1);
        return segment(text, start, next < 0 ? text.length() : next);
    }

    private static int firstPresent(int[] starts, int from) {
        for (int i = from; i < starts.length; i++) {
            if (starts[i] >= 0) {
                return starts[i];
            }
        }
        return -1;
    }

    private static ProgramSections.Segment segment(String text, int start, int end) {
        return new ProgramSections.Segment(text.substring(start, end), lineOf(text, start));
    }

    private static int lineOf(String text, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private static Pattern marker(String name) {
        return Pattern.compile("^/" + name + "(?![A-Za-z0-9_])", Pattern.MULTILINE);
    }
}
