package com.wagerdesk.common.model;

/**
 * Inputs the prop simulator needs beyond the point estimate.
 */
public record PropDistribution(String stat, double mean, double stdDev, double minutesMean, double minutesStd) {}
