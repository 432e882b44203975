package com.tpanalyzer.core.model;

/**
 * State of a node in a rendered call tree.
 */
public enum CallTreeNodeState {
    /** Program present in the corpus, children expanded */
    RESOLVED,

    /** Call target not present in the analyzed set */
    EXTERNAL,

    /** Program already on the current path; not expanded again */
    BACK_EDGE,

    /** Program expanded earlier in the same tree on another path */
    SHARED
}
