package com.wagerdesk.ledger.analysis;

import com.wagerdesk.ledger.model.LossAnalysis;
import com.wagerdesk.ledger.model.LossCategory;
import com.wagerdesk.ledger.model.Outcome;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.settlement.Settlement;

import java.util.Locale;
import java.util.Optional;

/**
 * Heuristic root-cause categorization of high-confidence losses.
 *
 * <p>Categories that need data the ledger does not hold (injuries, referees, line movement,
 * public money) are never assigned here; operators can still record them by hand.
 */
public class LossAnalyzer {

    static final double BAD_BEAT_POINTS = 3.0;
    static final double BIG_MISS_POINTS = 6.0;
    static final double MODEL_ERROR_POINTS = 10.0;

    private final double minConfidence;

    public LossAnalyzer(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    /**
     * @return an analysis record for losses at or above the confidence threshold; empty otherwise
     */
    public Optional<LossAnalysis> analyze(Wager wager, Settlement settlement) {
        if (settlement.outcome() != Outcome.LOSS || wager.getConfidence() < minConfidence) {
            return Optional.empty();
        }
        double miss = settlement.distanceFromLine();

        LossAnalysis analysis = new LossAnalysis();
        analysis.setWagerId(wager.getId());
        if (wager.isRestFactor() && miss >= BIG_MISS_POINTS) {
            analysis.setCategory(LossCategory.B2B_FACTOR.name());
            analysis.setPrimaryFactor("rest and schedule adjustment");
            analysis.setLesson("Rest adjustments overstated the edge; weigh fatigue less on similar spots.");
        } else if (miss <= BAD_BEAT_POINTS) {
            analysis.setCategory(LossCategory.BAD_BEAT.name());
            analysis.setPrimaryFactor("variance");
            analysis.setLesson("Lost within " + format(miss) + " of the line; the read was sound.");
        } else if (miss >= MODEL_ERROR_POINTS) {
            analysis.setCategory(LossCategory.MODEL_ERROR.name());
            analysis.setPrimaryFactor("projection");
            analysis.setLesson("Missed by " + format(miss) + "; review the projection inputs for "
                + wager.getSelection() + ".");
        } else {
            analysis.setCategory(LossCategory.OTHER.name());
            analysis.setPrimaryFactor("unclassified");
            analysis.setLesson("No dominant factor identified.");
        }
        analysis.setSeverity(severity(wager.getConfidence(), miss));
        return Optional.of(analysis);
    }

    /** Grows with stated confidence and with the miss, saturating at a 20-point miss. */
    static double severity(double confidence, double miss) {
        double value = 0.5 * confidence + 0.5 * Math.min(1.0, miss / 20.0);
        return Math.round(Math.max(0.0, Math.min(1.0, value)) * 100.0) / 100.0;
    }

    private static String format(double points) {
        return String.format(Locale.ROOT, "%.1f points", points);
    }
}
