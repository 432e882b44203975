package com.tpanalyzer.core.model;

/**
 * Role of a label region, assigned from the configured label-range convention.
 */
public enum LabelClass {
    /** Step of the repeating production cycle */
    CYCLE_STEP,

    /** Fault handling and recovery */
    ERROR_HANDLER,

    /** Reference-finding and safe start */
    HOMING,

    /** Outside every configured range */
    UNCLASSIFIED
}
