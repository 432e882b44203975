package com.tpanalyzer.core.renderer;

import com.tpanalyzer.core.generator.GeneratedReport;

import java.util.Objects;

/**
 * One file to be written by a renderer.
 *
 * @param relativePath path relative to the output directory, using {@code /} separators
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Wraps a generated report.
     *
     * @param report generated report
     * @return file named after the report, typed by its extension
     */
    public static GeneratedFile of(GeneratedReport report) {
        String contentType = switch (report.fileExtension()) {
            case "md" -> "text/markdown";
            case "txt" -> "text/plain";
            default -> "application/octet-stream";
        };
        return new GeneratedFile(report.fileName(), report.content(), contentType);
    }
}
