package com.tpanalyzer.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tpanalyzer.core.model.LabelClass;
import com.tpanalyzer.core.model.ProgramType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Installation-specific conventions consumed by the analysis engine.
 *
 * <p>Loaded from {@code tp-analyzer.yaml} by {@link ConfigLoader}. Every section that is left
 * out of the file falls back to {@link #defaults()}, so a file only needs to list what differs
 * from the conventions of the reference installation.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * labelRanges:
 *   - { classification: CYCLE_STEP, from: 1, to: 499 }
 *   - { classification: ERROR_HANDLER, from: 500, to: 799 }
 *   - { classification: HOMING, from: 1000, to: 1099 }
 *
 * namingRules:
 *   - { type: MAIN, pattern: "A_1PA\\d{3}.*" }
 *   - { type: UTILITY, pattern: "HOMING|TEKST" }
 *
 * productCodePattern: "_(384|096|1536CC)"
 * parallelism: 4
 * }</pre>
 *
 * @param labelRanges label-number ranges and the role they stand for, first match wins
 * @param namingRules program-name patterns and the type they imply, first match wins
 * @param productCodePattern regex whose first group extracts a product code from a program name
 * @param imlKeywords keywords marking in-mold labeling programs
 * @param stateNames display names for state-diagram states, keyed by label number
 * @param errorActions recovery actions recognised inside error handlers
 * @param homingZones zone keywords recognised in homing checks
 * @param parallelism parser worker count, 0 for one worker per available processor
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("labelRanges") List<LabelRange> labelRanges,
    @JsonProperty("namingRules") List<NamingRule> namingRules,
    @JsonProperty("productCodePattern") String productCodePattern,
    @JsonProperty("imlKeywords") List<String> imlKeywords,
    @JsonProperty("stateNames") Map<Integer, String> stateNames,
    @JsonProperty("errorActions") List<ErrorActionRule> errorActions,
    @JsonProperty("homingZones") List<String> homingZones,
    @JsonProperty("parallelism") Integer parallelism
) {
    /**
     * Creates the configuration of the reference installation.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        Map<Integer, String> stateNames = new LinkedHashMap<>();
        stateNames.put(10, "IDLE / WAIT_MOLD_CLOSED");
        stateNames.put(20, "CYCLE_START");
        stateNames.put(30, "TAKE_PRODUCT");
        stateNames.put(35, "CHECK_PRODUCT");
        stateNames.put(40, "CHECK_GRIP");
        stateNames.put(130, "TURN_1");
        stateNames.put(140, "TURN_2");
        stateNames.put(150, "PRINT");
        stateNames.put(160, "PLACE");
        stateNames.put(170, "GET_FILM");
        stateNames.put(200, "RETURN");

        return new AnalyzerConfig(
            List.of(
                new LabelRange(LabelClass.CYCLE_STEP, 1, 499),
                new LabelRange(LabelClass.ERROR_HANDLER, 500, 799),
                new LabelRange(LabelClass.HOMING, 1000, 1099)
            ),
            List.of(
                new NamingRule(ProgramType.MAIN, "A_1PA\\d{3}.*"),
                new NamingRule(ProgramType.SUBPROGRAM, ".*(KER1_|KER2_|AFLG_|PRINTEN|BUF_|FOLIE_).*"),
                new NamingRule(ProgramType.UTILITY, "HOMING|HOMEN\\d*|TEKST|FOLIE|DUMPEN|RUST"),
                new NamingRule(ProgramType.SYSTEM, "ERR\\w*|LOGBOOK|PMC|\\w*INTERFACE\\w*")
            ),
            "_(384|096|1536CC|005|017|140|180)",
            List.of("IML", "FOLIE"),
            stateNames,
            List.of(
                new ErrorActionRule("CALL\\s+TEKST", "Display error message"),
                new ErrorActionRule("(?i)open\\s+hand", "Open gripper"),
                new ErrorActionRule("(?i)rust\\s*positie", "Move to safe position"),
                new ErrorActionRule("WAIT.*USER", "Wait for operator confirmation"),
                new ErrorActionRule("\\bABORT\\b", "Abort program")
            ),
            List.of("vorm", "keerunit", "printer", "buffer", "tafel"),
            0
        );
    }

    /**
     * Returns a copy in which every missing section is taken from {@link #defaults()}.
     *
     * @return complete configuration
     */
    public AnalyzerConfig withDefaults() {
        AnalyzerConfig defaults = defaults();
        return new AnalyzerConfig(
            labelRanges != null ? labelRanges : defaults.labelRanges(),
            namingRules != null ? namingRules : defaults.namingRules(),
            productCodePattern != null ? productCodePattern : defaults.productCodePattern(),
            imlKeywords != null ? imlKeywords : defaults.imlKeywords(),
            stateNames != null ? stateNames : defaults.stateNames(),
            errorActions != null ? errorActions : defaults.errorActions(),
            homingZones != null ? homingZones : defaults.homingZones(),
            parallelism != null ? parallelism : defaults.parallelism()
        );
    }

    /**
     * Classifies a label number using the configured ranges.
     *
     * @param label label number
     * @return role of the first matching range, or {@link LabelClass#UNCLASSIFIED}
     */
    public LabelClass classifyLabel(int label) {
        if (labelRanges == null) {
            return LabelClass.UNCLASSIFIED;
        }
        return labelRanges.stream()
            .filter(range -> range.contains(label))
            .map(LabelRange::classification)
            .findFirst()
            .orElse(LabelClass.UNCLASSIFIED);
    }

    /**
     * Returns the worker count to use for parsing.
     *
     * @return positive worker count
     */
    public int effectiveParallelism() {
        if (parallelism == null || parallelism <= 0) {
            return Math.max(1, Runtime.getRuntime().availableProcessors());
        }
        return parallelism;
    }

    /**
     * Inclusive label-number range.
     *
     * @param classification role of labels in this range
     * @param from lowest label number
     * @param to highest label number
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LabelRange(
        @JsonProperty("classification") LabelClass classification,
        @JsonProperty("from") int from,
        @JsonProperty("to") int to
    ) {
        public LabelRange {
            Objects.requireNonNull(classification, "classification must not be null");
            if (to < from) {
                throw new IllegalArgumentException("Label range " + from + ".." + to + " is empty");
            }
        }

        public boolean contains(int label) {
            return label >= from && label <= to;
        }
    }

    /**
     * Program-name convention.
     *
     * @param type type assigned to matching programs
     * @param pattern regex that must match the whole program name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NamingRule(
        @JsonProperty("type") ProgramType type,
        @JsonProperty("pattern") String pattern
    ) {
        public NamingRule {
            Objects.requireNonNull(type, "type must not be null");
            Objects.requireNonNull(pattern, "pattern must not be null");
        }
    }

    /**
     * Recovery action recognised in an error handler.
     *
     * @param pattern regex searched in each statement of the handler
     * @param action description reported when the pattern is found
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorActionRule(
        @JsonProperty("pattern") String pattern,
        @JsonProperty("action") String action
    ) {
        public ErrorActionRule {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Objects.requireNonNull(action, "action must not be null");
        }
    }
}
