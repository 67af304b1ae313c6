package com.wagerdesk.common.model;

/**
 * Average combined game totals for a side, split by venue.
 */
public record VenueSplit(double homeAvgTotal, double awayAvgTotal, double overallAvgTotal) {

    public double avgTotalAt(boolean home) {
        return home ? homeAvgTotal : awayAvgTotal;
    }

    public boolean isComplete() {
        return homeAvgTotal > 0 && awayAvgTotal > 0 && overallAvgTotal > 0;
    }
}
