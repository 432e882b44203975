package com.tpanalyzer.core.generator;

import com.tpanalyzer.core.model.AnalysisResult;

import java.util.List;
import java.util.Set;

/**
 * Turns an {@link AnalysisResult} into report documents.
 *
 * <p>Generators only format; they never change the analysis. Corpus-wide report types
 * produce one document, per-program types ({@link ReportType#FLOW_DIAGRAM},
 * {@link ReportType#STATE_DIAGRAM}) produce one document per program.
 *
 * <p>Implementations are discovered via Java Service Provider Interface (SPI). Register
 * them in {@code META-INF/services/com.tpanalyzer.core.generator.ReportGenerator}.
 *
 * @see ReportType
 * @see GeneratedReport
 */
public interface ReportGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * <p>Matches the CLI {@code --format} value, lowercase (e.g. "text", "mermaid").
     *
     * @return unique generator identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this generator.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for generated reports.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Returns set of report types this generator can produce.
     *
     * @return supported report types
     */
    Set<ReportType> getSupportedReportTypes();

    /**
     * Generates the documents of one report type.
     *
     * <p>An empty result (no programs, no MAIN programs) still produces a document with a
     * placeholder line for corpus-wide types.
     *
     * @param result analysis result to format
     * @param type report type to generate
     * @return generated documents, possibly empty for per-program types
     * @throws IllegalArgumentException if the report type is not supported
     */
    List<GeneratedReport> generate(AnalysisResult result, ReportType type);
}
