package com.tpanalyzer.cli;

import com.tpanalyzer.core.analysis.CorpusAnalyzer;
import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.config.ConfigLoader;
import com.tpanalyzer.core.generator.GeneratedReport;
import com.tpanalyzer.core.generator.ReportGenerator;
import com.tpanalyzer.core.generator.ReportType;
import com.tpanalyzer.core.model.AnalysisResult;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.ProgramType;
import com.tpanalyzer.core.renderer.GeneratedOutput;
import com.tpanalyzer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.Callable;

/**
 * Analyzes a directory of teach pendant programs and writes the reports.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load {@code tp-analyzer.yaml} (defaults when absent)</li>
 *   <li>Read every {@code *.LS} file below the directory</li>
 *   <li>Parse and analyze the corpus</li>
 *   <li>Generate reports with the selected generators</li>
 *   <li>Write them to the output directory</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tp-analyzer analyze backup/
 * tp-analyzer analyze backup/ -o reports/ --format mermaid
 * tp-analyzer analyze backup/ --dry-run
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a directory of teach pendant programs and generate reports",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    static final String DEFAULT_OUTPUT_DIRECTORY = "analysis";

    @Parameters(
        index = "0",
        description = "Directory containing .LS programs (default: current directory)",
        defaultValue = "."
    )
    private Path programDirectory;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: tp-analyzer.yaml in the program directory)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: <directory>/analysis)"
    )
    private Path outputDir;

    @Option(
        names = {"-f", "--format"},
        description = "Report format: text, mermaid or all (default: ${DEFAULT-VALUE})",
        defaultValue = "text"
    )
    private String format;

    @Option(
        names = {"--dry-run"},
        description = "Analyze and print the summary without writing reports"
    )
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            if (!Files.isDirectory(programDirectory)) {
                System.err.println("✗ Not a directory: " + programDirectory.toAbsolutePath());
                return 1;
            }

            log.info("Starting analysis of: {}", programDirectory.toAbsolutePath());
            System.out.println("Analyzing programs in: " + programDirectory.toAbsolutePath());
            System.out.println();

            AnalyzerConfig config = loadConfiguration();

            // Resolve generators up front so a bad --format fails before any parsing work
            List<ReportGenerator> generators = dryRun ? List.of() : ReportPipeline.discoverGenerators(format);

            SortedMap<String, String> corpus = FileUtils.readCorpus(programDirectory);
            if (corpus.isEmpty()) {
                System.err.println("✗ No .LS files found in " + programDirectory.toAbsolutePath());
                return 1;
            }
            System.out.println("✓ Found " + corpus.size() + " program files");

            AnalysisResult result = new CorpusAnalyzer(config).analyze(corpus);
            printSummary(result);

            if (dryRun) {
                System.out.println();
                System.out.println("Dry-run mode: Skipping report generation");
                return 0;
            }

            List<GeneratedReport> reports = ReportPipeline.generate(
                generators, result, EnumSet.allOf(ReportType.class));
            System.out.println("✓ Generated " + reports.size() + " reports");

            Path outputDirectory = getOutputDirectory();
            GeneratedOutput output = ReportPipeline.render(reports, outputDirectory, "filesystem");
            System.out.println("✓ Wrote " + output.files().size() + " files to: " + outputDirectory.toAbsolutePath());

            System.out.println();
            System.out.println("✓ Analysis complete");
            return 0;

        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private AnalyzerConfig loadConfiguration() {
        Path absoluteConfigPath = configPath.isAbsolute()
            ? configPath
            : programDirectory.resolve(configPath);

        log.debug("Loading configuration from: {}", absoluteConfigPath);
        return ConfigLoader.load(absoluteConfigPath);
    }

    private Path getOutputDirectory() {
        return outputDir != null ? outputDir : programDirectory.resolve(DEFAULT_OUTPUT_DIRECTORY);
    }

    private void printSummary(AnalysisResult result) {
        System.out.println("✓ Analyzed " + result.programs().size() + " programs");
        Map<ProgramType, List<Program>> byType = result.programsByType();
        for (ProgramType type : ProgramType.values()) {
            List<Program> programs = byType.get(type);
            if (programs != null) {
                System.out.println("  - " + type + ": " + programs.size());
            }
        }

        if (!result.rejectedFiles().isEmpty()) {
            System.out.println("⚠ Rejected " + result.rejectedFiles().size() + " files");
            result.rejectedFiles().forEach((file, reason) ->
                System.out.println("  - " + file + ": " + reason));
        }

        System.out.println("  Registers used: " + result.symbols().registers().size());
        System.out.println("  Position registers used: " + result.symbols().positionRegisters().size());
        System.out.println("  Call edges: " + result.callGraph().edges().size());
        System.out.println("  Warnings: " + result.warningCount());
    }
}
