package com.wagerdesk.ledger;

import com.wagerdesk.common.model.GameResult;
import com.wagerdesk.ledger.model.Wager;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Wager and result builders shared by ledger tests.
 */
public final class LedgerFixtures {

    public static final String EVENT_ID = "evt-1";

    private LedgerFixtures() {}

    public static Wager wager(long id, String betType, String direction, double line, double confidence) {
        Wager w = new Wager();
        w.setId(id);
        w.setEventId(EVENT_ID);
        w.setTraceId("trace-" + id);
        w.setBetType(betType);
        w.setDirection(direction);
        w.setSelection(direction + " " + line);
        w.setEntityId("t-bos");
        w.setLine(line);
        w.setOdds(1.91);
        w.setConfidence(confidence);
        w.setPredictedEdge(0.04);
        w.setStake(0.01);
        w.setDepth("standard");
        w.setDebateWinner("NEUTRAL");
        w.setCreatedAt(LocalDateTime.of(2025, 1, 15, 19, 0));
        return w;
    }

    public static Wager total(long id, String direction, double line, double confidence) {
        return wager(id, "TOTAL", direction, line, confidence);
    }

    public static Wager settled(long id, String outcome, double predictedEdge, String debateWinner) {
        Wager w = total(id, "OVER", 220.5, 0.7);
        w.setPredictedEdge(predictedEdge);
        w.setDebateWinner(debateWinner);
        w.setOutcome(outcome);
        w.setProfit("WIN".equals(outcome) ? 0.91 : "LOSS".equals(outcome) ? -1.0 : 0.0);
        return w;
    }

    /** Boston (side A, {@code t-bos}) against Denver. */
    public static GameResult finalScore(double bostonScore, double denverScore) {
        return new GameResult(EVENT_ID, true, "t-bos", bostonScore, "t-den", denverScore, Map.of());
    }
}
