package com.tpanalyzer.cli;

import com.tpanalyzer.core.analysis.CorpusAnalyzer;
import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.config.ConfigLoader;
import com.tpanalyzer.core.generator.GeneratedReport;
import com.tpanalyzer.core.generator.ReportGenerator;
import com.tpanalyzer.core.generator.ReportType;
import com.tpanalyzer.core.model.AnalysisResult;
import com.tpanalyzer.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Flow and state analysis of one program.
 *
 * <p>Prints the flow and state diagrams to the console, or writes them to
 * {@code --output} when given.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * tp-analyzer flow A_1PA005.LS
 * tp-analyzer flow A_1PA005.LS --format mermaid -o diagrams/
 * }</pre>
 */
@Command(
    name = "flow",
    description = "Control flow and state machine analysis of a single program",
    mixinStandardHelpOptions = true
)
public class FlowCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FlowCommand.class);

    private static final List<ReportType> REPORT_TYPES =
        List.of(ReportType.FLOW_DIAGRAM, ReportType.STATE_DIAGRAM);

    @Parameters(index = "0", description = "Program file (.LS)")
    private Path programFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: tp-analyzer.yaml next to the program)"
    )
    private Path configPath;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: print to console)"
    )
    private Path outputDir;

    @Option(
        names = {"-f", "--format"},
        description = "Report format: text, mermaid or all (default: ${DEFAULT-VALUE})",
        defaultValue = "text"
    )
    private String format;

    @Override
    public Integer call() {
        try {
            if (!Files.isRegularFile(programFile)) {
                System.err.println("✗ File not found: " + programFile);
                return 1;
            }

            log.info("Analyzing flow of: {}", programFile);
            List<ReportGenerator> generators = ReportPipeline.discoverGenerators(format);

            AnalyzerConfig config = ConfigLoader.load(resolveConfigPath());
            String fileName = programFile.getFileName().toString();
            AnalysisResult result = new CorpusAnalyzer(config).analyzeSingle(fileName, FileUtils.readProgram(programFile));

            if (result.programs().isEmpty()) {
                String reason = result.rejectedFiles().getOrDefault(fileName, "no program found");
                System.err.println("✗ Cannot analyze " + fileName + ": " + reason);
                return 1;
            }

            List<GeneratedReport> reports = ReportPipeline.generate(generators, result, REPORT_TYPES);
            if (reports.isEmpty()) {
                System.out.println("No labels found in " + fileName + ", nothing to report");
                return 0;
            }

            if (outputDir == null) {
                ReportPipeline.render(reports, Path.of("."), "console");
            } else {
                ReportPipeline.render(reports, outputDir, "filesystem");
                System.out.println("✓ Wrote " + reports.size() + " files to: " + outputDir.toAbsolutePath());
            }
            return 0;

        } catch (Exception e) {
            log.error("Flow analysis failed", e);
            System.err.println("✗ Flow analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private Path resolveConfigPath() {
        if (configPath != null) {
            return configPath;
        }
        Path parent = programFile.toAbsolutePath().getParent();
        return parent == null ? null : parent.resolve(ConfigLoader.DEFAULT_FILE_NAME);
    }
}
