package com.tpanalyzer.cli;

import com.tpanalyzer.TpAnalyzerCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AnalyzeCommand}.
 */
class AnalyzeCommandTest {

    @TempDir
    Path tempDir;

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private int execute(String... args) {
        return TpAnalyzerCLI.commandLine().execute(args);
    }

    @Test
    void analyze_validDirectory_writesTextReports() throws IOException {
        // Given
        Path programs = CliTestPrograms.writeCorpus(tempDir);

        // When
        int exitCode = execute("analyze", programs.toString());

        // Then
        Path analysis = programs.resolve("analysis");
        assertThat(exitCode).isZero();
        assertThat(analysis.resolve("analysis_report.txt")).exists();
        assertThat(analysis.resolve("call_graph.txt")).exists();
        assertThat(analysis.resolve("flow/A_1PA001_flow.txt")).exists();
        assertThat(analysis.resolve("state/A_1PA001_states.txt")).exists();
        assertThat(Files.readString(analysis.resolve("analysis_report.txt"))).contains("Total Programs: 3");
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("✓ Found 3 program files")
            .contains("✓ Analyzed 3 programs")
            .contains("  - MAIN: 1")
            .endsWith("✓ Analysis complete" + System.lineSeparator());
    }

    @Test
    void analyze_mermaidFormat_skipsCorpusReport() throws IOException {
        Path programs = CliTestPrograms.writeCorpus(tempDir);
        Path reports = tempDir.resolve("reports");

        int exitCode = execute("analyze", programs.toString(), "-o", reports.toString(), "--format", "mermaid");

        assertThat(exitCode).isZero();
        assertThat(reports.resolve("call_graph.md")).exists();
        assertThat(reports.resolve("flow/A_1PA001_flow.md")).exists();
        assertThat(reports.resolve("analysis_report.md")).doesNotExist();
        assertThat(reports.resolve("analysis_report.txt")).doesNotExist();
    }

    @Test
    void analyze_allFormats_writesBothFlavours() throws IOException {
        Path programs = CliTestPrograms.writeCorpus(tempDir);
        Path reports = tempDir.resolve("reports");

        int exitCode = execute("analyze", programs.toString(), "-o", reports.toString(), "-f", "all");

        assertThat(exitCode).isZero();
        assertThat(reports.resolve("call_graph.md")).exists();
        assertThat(reports.resolve("call_graph.txt")).exists();
    }

    @Test
    void analyze_dryRun_writesNothing() throws IOException {
        Path programs = CliTestPrograms.writeCorpus(tempDir);

        int exitCode = execute("analyze", programs.toString(), "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(programs.resolve("analysis")).doesNotExist();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Dry-run mode: Skipping report generation");
    }

    @Test
    void analyze_configFile_overridesStateNames() throws IOException {
        Path programs = CliTestPrograms.writeCorpus(tempDir);
        Files.writeString(programs.resolve("tp-analyzer.yaml"), "stateNames:\n  10: WACHT_OP_MATRIJS\n");

        int exitCode = execute("analyze", programs.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(programs.resolve("analysis/state/A_1PA001_states.txt")))
            .contains("State: WACHT_OP_MATRIJS");
    }

    @Test
    void analyze_rejectedFile_reportedInSummary() throws IOException {
        Path programs = CliTestPrograms.writeCorpus(tempDir);
        Files.writeString(programs.resolve("LEEG.LS"), "");

        int exitCode = execute("analyze", programs.toString(), "--dry-run");

        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8))
            .contains("⚠ Rejected 1 files")
            .contains("LEEG.LS: empty file");
    }

    @Test
    void analyze_unknownFormat_failsBeforeParsing() throws IOException {
        Path programs = CliTestPrograms.writeCorpus(tempDir);

        int exitCode = execute("analyze", programs.toString(), "--format", "pdf");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Unknown format 'pdf'");
        assertThat(out.toString(StandardCharsets.UTF_8)).doesNotContain("✓ Found");
    }

    @Test
    void analyze_missingDirectory_returnsError() {
        int exitCode = execute("analyze", tempDir.resolve("missing").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("✗ Not a directory");
    }

    @Test
    void analyze_directoryWithoutPrograms_returnsError() throws IOException {
        Files.writeString(tempDir.resolve("notes.txt"), "no programs here");

        int exitCode = execute("analyze", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("✗ No .LS files found");
    }
}
