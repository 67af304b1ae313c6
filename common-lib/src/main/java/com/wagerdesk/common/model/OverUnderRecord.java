package com.wagerdesk.common.model;

/**
 * How often a side's games finished under lines close to the current one.
 */
public record OverUnderRecord(int games, double underRate) {}
