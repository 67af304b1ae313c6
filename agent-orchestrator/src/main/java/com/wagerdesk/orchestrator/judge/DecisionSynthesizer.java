package com.wagerdesk.orchestrator.judge;

import com.wagerdesk.common.debate.DebateInput;
import com.wagerdesk.common.debate.DebateResult;
import com.wagerdesk.common.debate.DebateWinner;
import com.wagerdesk.common.ledger.RuleAdjustment;
import com.wagerdesk.common.ledger.RuleCondition;
import com.wagerdesk.common.model.DataQuality;
import com.wagerdesk.orchestrator.model.Action;
import com.wagerdesk.orchestrator.pipeline.PipelineRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds edge, debate verdict and data quality into a final action and confidence.
 *
 * <h3>Confidence</h3>
 * <pre>
 *   0.50
 *   + 0.15 FRESH | + 0.05 PARTIAL
 *   + 0.15 edge ≥ 0.05 | + 0.10 edge ≥ 0.02 | − 0.10 edge ≤ −0.02
 *   + 0.05 p(selection) ≥ 0.65 | − 0.05 p(selection) ≤ 0.40
 *   + 0.05 supporting wins | − 0.10 opposing wins
 *   − 0.03 per missing input − 0.02 per error
 *   clamp [0.10, 0.85], then matching learning rules, clamp again
 * </pre>
 *
 * <h3>Action</h3>
 * <ol>
 *   <li>no usable context or no projection → NO_RECOMMENDATION</li>
 *   <li>no line → NEED_LINE</li>
 *   <li>opposing side won and edge below 0.05 → NO_BET</li>
 *   <li>edge ≥ 0.03: BET when confidence ≥ 0.60 and supporting side won, LEAN_BET when confidence
 *       ≥ 0.60 otherwise, NO_BET below 0.60</li>
 *   <li>edge ≥ 0.01 → LEAN_BET</li>
 *   <li>edge ≤ −0.03 → FADE</li>
 *   <li>otherwise NO_BET</li>
 * </ol>
 */
@Component
public class DecisionSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(DecisionSynthesizer.class);

    static final double BASE_CONFIDENCE = 0.5;
    static final double MIN_CONFIDENCE  = 0.10;
    static final double MAX_CONFIDENCE  = 0.85;
    static final double BET_CONFIDENCE  = 0.60;

    public Verdict synthesize(PipelineRun run, DataQuality quality, List<RuleAdjustment> rules) {
        if (quality == DataQuality.UNAVAILABLE || run.projection() == null || run.simulation() == null) {
            double confidence = clamp(BASE_CONFIDENCE - 0.03 * run.missing().size() - 0.02 * run.errors().size());
            return new Verdict(Action.NO_RECOMMENDATION, round2(confidence),
                               "Insufficient data to make a recommendation", List.of());
        }

        DebateInput input = new DebateInput(run.context(), run.projection(), run.simulation(),
                                            run.edge(), run.scenarios(), run.selection());
        DebateResult debate = run.debate();
        DebateWinner winner = debate != null ? debate.winner() : DebateWinner.NEUTRAL;
        boolean priced = run.edge() != null;
        double edge = input.selectionEdge();
        double cover = input.selectionProbability();

        double confidence = BASE_CONFIDENCE;
        if (quality == DataQuality.FRESH) confidence += 0.15;
        else if (quality == DataQuality.PARTIAL) confidence += 0.05;

        if (priced) {
            if (edge >= 0.05) confidence += 0.15;
            else if (edge >= 0.02) confidence += 0.10;
            else if (edge <= -0.02) confidence -= 0.10;
        }

        if (cover >= 0.65) confidence += 0.05;
        else if (cover <= 0.40) confidence -= 0.05;

        if (winner == DebateWinner.SUPPORTING) confidence += 0.05;
        else if (winner == DebateWinner.OPPOSING) confidence -= 0.10;

        confidence -= 0.03 * run.missing().size();
        confidence -= 0.02 * run.errors().size();
        confidence = clamp(confidence);

        List<Long> applied = new ArrayList<>();
        for (RuleAdjustment rule : rules) {
            Optional<RuleCondition> condition = RuleCondition.parse(rule.conditionType());
            if (condition.isEmpty()) {
                log.debug("[Judge] Skipping rule with unknown condition type. ruleId={} type={}",
                          rule.ruleId(), rule.conditionType());
                continue;
            }
            if (condition.get().matches(rule.condition(), input, debate, confidence)) {
                confidence += rule.adjustment();
                if (rule.ruleId() != null) applied.add(rule.ruleId());
            }
        }
        confidence = round2(clamp(confidence));

        Action action;
        String reasoning;
        String pct = String.format("%.1f%%", edge * 100);
        if (!priced) {
            action = Action.NEED_LINE;
            reasoning = "Provide a line for edge calculation";
        } else if (winner == DebateWinner.OPPOSING && edge < 0.05) {
            action = Action.NO_BET;
            reasoning = String.format("Opposing case prevailed (%.2f vs %.2f), edge %s insufficient",
                                      debate.opposingStrength(), debate.supportingStrength(), pct);
        } else if (edge >= 0.03) {
            if (confidence < BET_CONFIDENCE) {
                action = Action.NO_BET;
                reasoning = "Edge " + pct + " but confidence " + confidence + " below threshold";
            } else if (winner == DebateWinner.SUPPORTING) {
                action = Action.BET;
                reasoning = String.format("Edge %s and supporting case won (%.2f vs %.2f)",
                                          pct, debate.supportingStrength(), debate.opposingStrength());
            } else {
                action = Action.LEAN_BET;
                reasoning = "Positive edge " + pct + " but debate was " + winner.name().toLowerCase();
            }
        } else if (edge >= 0.01) {
            action = Action.LEAN_BET;
            reasoning = "Marginal edge of " + pct + ", debate " + winner.name().toLowerCase();
        } else if (edge <= -0.03) {
            action = Action.FADE;
            reasoning = "Negative edge of " + pct + ", consider the opposite side";
        } else {
            action = Action.NO_BET;
            reasoning = "Edge " + pct + " below threshold";
        }

        return new Verdict(action, confidence, reasoning, applied);
    }

    static double clamp(double confidence) {
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
