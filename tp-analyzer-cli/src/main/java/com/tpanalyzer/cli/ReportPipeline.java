package com.tpanalyzer.cli;

import com.tpanalyzer.core.generator.GeneratedReport;
import com.tpanalyzer.core.generator.ReportGenerator;
import com.tpanalyzer.core.generator.ReportType;
import com.tpanalyzer.core.model.AnalysisResult;
import com.tpanalyzer.core.renderer.GeneratedOutput;
import com.tpanalyzer.core.renderer.OutputRenderer;
import com.tpanalyzer.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Generator and renderer discovery shared by the subcommands.
 */
final class ReportPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReportPipeline.class);

    static final String FORMAT_ALL = "all";

    private ReportPipeline() {
    }

    /**
     * Discovers report generators via SPI, keeping those matching the requested format.
     *
     * @param format generator id, or {@code all}
     * @return matching generators sorted by id
     * @throws IllegalArgumentException if no generator matches the format
     */
    static List<ReportGenerator> discoverGenerators(String format) {
        String wanted = format == null ? FORMAT_ALL : format.toLowerCase(Locale.ROOT);
        List<ReportGenerator> generators = new ArrayList<>();
        List<String> available = new ArrayList<>();
        for (ReportGenerator generator : ServiceLoader.load(ReportGenerator.class)) {
            available.add(generator.getId());
            if (FORMAT_ALL.equals(wanted) || generator.getId().equals(wanted)) {
                generators.add(generator);
            }
        }
        generators.sort(Comparator.comparing(ReportGenerator::getId));
        log.debug("Discovered generators {} (requested: {})", available, wanted);

        if (generators.isEmpty()) {
            throw new IllegalArgumentException(
                "Unknown format '" + format + "'. Available: " + available + " or " + FORMAT_ALL);
        }
        return generators;
    }

    /**
     * Runs every generator for the requested report types it supports.
     *
     * @param generators generators to run
     * @param result analysis result
     * @param types report types to produce
     * @return generated reports in generator then type order
     */
    static List<GeneratedReport> generate(List<ReportGenerator> generators, AnalysisResult result,
                                          Collection<ReportType> types) {
        List<GeneratedReport> reports = new ArrayList<>();
        for (ReportGenerator generator : generators) {
            for (ReportType type : types) {
                if (!generator.getSupportedReportTypes().contains(type)) {
                    log.debug("Generator {} does not support {}", generator.getId(), type);
                    continue;
                }
                List<GeneratedReport> generated = generator.generate(result, type);
                log.debug("Generator {} produced {} {} report(s)", generator.getId(), generated.size(), type);
                reports.addAll(generated);
            }
        }
        return reports;
    }

    /**
     * Finds a renderer by id via SPI.
     *
     * @param id renderer id
     * @return renderer
     * @throws IllegalStateException if no renderer has the id
     */
    static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("Renderer not found: " + id);
    }

    /**
     * Renders reports into an output directory.
     *
     * @param reports reports to write
     * @param outputDirectory destination directory
     * @param rendererId renderer id
     * @return rendered output
     */
    static GeneratedOutput render(List<GeneratedReport> reports, Path outputDirectory, String rendererId) {
        GeneratedOutput output = GeneratedOutput.of(reports);
        RenderContext context = new RenderContext(outputDirectory.toString(), Map.of());
        findRenderer(rendererId).render(output, context);
        return output;
    }
}
