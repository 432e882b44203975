package com.tpanalyzer.core.parser;

import java.util.Objects;
import java.util.stream.Stream;

/**
 * A program file split into its marked segments.
 *
 * <p>Each segment keeps its marker line, and text outside the markers is kept as preamble
 * and trailing content, so {@link #rejoin()} reproduces the original text exactly.
 * Absent segments are null.
 *
 * @param preamble text before the {@code /PROG} marker
 * @param header {@code /PROG} line
 * @param attributes {@code /ATTR} segment, including any {@code /APPL} block
 * @param instructions {@code /MN} segment
 * @param positions {@code /POS} segment
 * @param terminator {@code /END} line
 * @param trailing text after the {@code /END} line
 */
public record ProgramSections(
    Segment preamble,
    Segment header,
    Segment attributes,
    Segment instructions,
    Segment positions,
    Segment terminator,
    Segment trailing
) {
    /**
     * Reassembles the original text.
     *
     * @return concatenation of every present segment in file order
     */
    public String rejoin() {
        StringBuilder text = new StringBuilder();
        Stream.of(preamble, header, attributes, instructions, positions, terminator, trailing)
            .filter(Objects::nonNull)
            .forEach(segment -> text.append(segment.text()));
        return text.toString();
    }

    /**
     * Returns the program name declared on the {@code /PROG} line.
     *
     * @return program name, or null if the header is missing or names nothing
     */
    public String declaredName() {
        if (header == null) {
            return null;
        }
        String[] tokens = header.firstLine().trim().split("\\s+");
        return tokens.length > 1 ? tokens[1] : null;
    }

    /**
     * Contiguous piece of the file.
     *
     * @param text segment text as written, including line breaks
     * @param startLine 1-based file line the segment starts on
     */
    public record Segment(String text, int startLine) {

        public Segment {
            Objects.requireNonNull(text, "text must not be null");
        }

        /**
         * Returns the first line without its line break.
         *
         * @return first line
         */
        public String firstLine() {
            int end = text.indexOf('\n');
            String line = end < 0 ? text : text.substring(0, end);
            return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
        }

        /**
         * Returns the text after the marker line.
         *
         * @return segment body, possibly empty
         */
        public String body() {
            int end = text.indexOf('\n');
            return end < 0 ? "" : text.substring(end + 1);
        }

        public int bodyStartLine() {
            return startLine + 1;
        }
    }
}
