package com.tpanalyzer.core.model;

/**
 * Representation of a stored position.
 */
public enum PositionKind {
    /** X, Y, Z, W, P, R in a user frame */
    CARTESIAN,

    /** J1..Jn joint angles */
    JOINT,

    /** No axis values recognised */
    UNKNOWN
}
