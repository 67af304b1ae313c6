package com.wagerdesk.orchestrator.model;

/**
 * How much work an evaluation spends. QUICK skips scenario analysis; DEEP also runs the
 * main simulation in skew-normal mode.
 */
public enum Depth {
    QUICK,
    STANDARD,
    DEEP
}
