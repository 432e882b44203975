package com.tpanalyzer.core.generator;

/**
 * Kinds of reports that can be generated from an analysis result.
 */
public enum ReportType {
    /** Corpus-wide analysis report: classification, call graph, symbol maps, warnings */
    ANALYSIS_REPORT,

    /** Program call graph */
    CALL_GRAPH,

    /** Per-program control flow: cycle, error handlers, homing, label graph */
    FLOW_DIAGRAM,

    /** Per-program state diagram */
    STATE_DIAGRAM
}
