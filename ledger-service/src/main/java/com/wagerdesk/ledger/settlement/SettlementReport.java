package com.wagerdesk.ledger.settlement;

import java.util.List;

public record SettlementReport(int examined, int settled, int alreadySettled, int unresolvable, int failed) {

    public static SettlementReport of(List<SettlementStatus> statuses) {
        int settled = 0, already = 0, unresolvable = 0, failed = 0;
        for (SettlementStatus status : statuses) {
            switch (status) {
                case SETTLED -> settled++;
                case ALREADY_SETTLED -> already++;
                case UNRESOLVABLE -> unresolvable++;
                case FAILED -> failed++;
            }
        }
        return new SettlementReport(statuses.size(), settled, already, unresolvable, failed);
    }

    public static SettlementReport skipped() {
        return new SettlementReport(0, 0, 0, 0, 0);
    }
}
