package com.wagerdesk.ledger.dto;

import java.util.List;

/**
 * @param accuracy wins over decided wagers across all buckets; {@code null} before any decided wager
 * @param roi      total profit per settled wager at unit stake
 */
public record CalibrationReport(List<BucketRow> buckets, int settledBets, Double accuracy, double totalProfit,
                                double roi) {

    public CalibrationReport {
        buckets = buckets == null ? List.of() : List.copyOf(buckets);
    }

    public record BucketRow(int bucket, double expectedWinRate, Double actualWinRate, Double calibrationError,
                            int totalBets, int wins, int losses, int pushes) {}
}
