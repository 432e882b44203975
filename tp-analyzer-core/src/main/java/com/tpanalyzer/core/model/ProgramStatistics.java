package com.tpanalyzer.core.model;

/**
 * Counts derived from one program, used by the summary sections of reports.
 *
 * @param statements number of parsed statements
 * @param labels number of label definitions
 * @param calls number of call statements
 * @param jumps number of jump statements
 * @param positions number of stored positions
 * @param registers distinct registers referenced
 * @param ioSignals distinct I/O signals referenced
 * @param errorLabels labels classified as error handlers
 * @param unrecognized statements kept verbatim
 */
public record ProgramStatistics(
    int statements,
    int labels,
    int calls,
    int jumps,
    int positions,
    int registers,
    int ioSignals,
    int errorLabels,
    int unrecognized
) {
}
