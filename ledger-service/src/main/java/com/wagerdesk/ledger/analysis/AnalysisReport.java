package com.wagerdesk.ledger.analysis;

import java.util.List;

/**
 * @param created conditions of the rules appended by this pass, e.g. {@code EDGE_ABOVE 0.05}
 */
public record AnalysisReport(String thresholdVersion, int settledExamined, int candidates, List<String> created,
                             boolean skipped) {

    public AnalysisReport {
        created = created == null ? List.of() : List.copyOf(created);
    }

    public static AnalysisReport skipped(String thresholdVersion) {
        return new AnalysisReport(thresholdVersion, 0, 0, List.of(), true);
    }
}
