package com.tpanalyzer.core.config;

import com.tpanalyzer.core.model.LabelClass;
import com.tpanalyzer.core.model.ProgramType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            labelRanges:
              - { classification: CYCLE_STEP, from: 1, to: 99 }
              - { classification: ERROR_HANDLER, from: 100, to: 199 }

            namingRules:
              - { type: MAIN, pattern: "PNS\\\\d{4}" }
              - { type: UTILITY, pattern: "HOME.*" }

            productCodePattern: "_(\\\\d{3})$"
            imlKeywords: [LABEL]
            stateNames:
              10: WAIT_PART
              20: PICK
            errorActions:
              - { pattern: "RESET", action: "Reset alarms" }
            homingZones: [conveyor]
            parallelism: 2
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);

        assertThat(config.labelRanges()).hasSize(2);
        assertThat(config.classifyLabel(150)).isEqualTo(LabelClass.ERROR_HANDLER);
        assertThat(config.classifyLabel(1000)).isEqualTo(LabelClass.UNCLASSIFIED);
        assertThat(config.namingRules()).extracting(AnalyzerConfig.NamingRule::type)
            .containsExactly(ProgramType.MAIN, ProgramType.UTILITY);
        assertThat(config.namingRules().get(0).pattern()).isEqualTo("PNS\\d{4}");
        assertThat(config.productCodePattern()).isEqualTo("_(\\d{3})$");
        assertThat(config.imlKeywords()).containsExactly("LABEL");
        assertThat(config.stateNames()).containsEntry(10, "WAIT_PART").containsEntry(20, "PICK");
        assertThat(config.errorActions()).extracting(AnalyzerConfig.ErrorActionRule::action)
            .containsExactly("Reset alarms");
        assertThat(config.homingZones()).containsExactly("conveyor");
        assertThat(config.effectiveParallelism()).isEqualTo(2);
    }

    @Test
    void load_partialYaml_fillsMissingSectionsWithDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            homingZones: [vorm, tafel]
            someFutureSetting: true
            """);

        AnalyzerConfig config = ConfigLoader.load(configFile);
        AnalyzerConfig defaults = AnalyzerConfig.defaults();

        assertThat(config.homingZones()).containsExactly("vorm", "tafel");
        assertThat(config.labelRanges()).isEqualTo(defaults.labelRanges());
        assertThat(config.namingRules()).isEqualTo(defaults.namingRules());
        assertThat(config.stateNames()).isEqualTo(defaults.stateNames());
        assertThat(config.parallelism()).isZero();
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        AnalyzerConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_nullPath_returnsDefaults() {
        assertThat(ConfigLoader.load(null)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            labelRanges:
              - { classification: CYCLE_STEP, from: 1
            invalid: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_emptyRange_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            labelRanges:
              - { classification: HOMING, from: 200, to: 100 }
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(AnalyzerConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(AnalyzerConfig.defaults());
    }
}
