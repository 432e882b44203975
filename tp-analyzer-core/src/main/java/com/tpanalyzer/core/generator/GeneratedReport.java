package com.tpanalyzer.core.generator;

import java.util.Objects;

/**
 * One generated report document.
 *
 * @param name report path without extension, relative to the output directory
 *     (e.g. {@code "analysis_report"} or {@code "flow/A_1PA005_flow"})
 * @param content report content
 * @param fileExtension file extension without leading dot
 */
public record GeneratedReport(
    String name,
    String content,
    String fileExtension
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedReport {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(fileExtension, "fileExtension must not be null");
    }

    /**
     * Returns the relative file path of this report.
     *
     * @return name plus extension
     */
    public String fileName() {
        return name + "." + fileExtension;
    }
}
