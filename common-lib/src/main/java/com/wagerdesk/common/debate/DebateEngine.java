package com.wagerdesk.common.debate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs both argument catalogs over the same input and scores the result.
 *
 * <pre>
 *   side strength = mean strength of the side's K strongest arguments
 *   net           = supporting − opposing
 *   winner        = SUPPORTING if net &gt; threshold, OPPOSING if net &lt; −threshold, else NEUTRAL
 * </pre>
 * An empty side scores 0. The opposing catalog contains structural rules, so it never is.
 */
public final class DebateEngine {

    private DebateEngine() {}

    public static DebateResult debate(DebateInput input, DebateParameters params) {
        List<Argument> supporting = new ArrayList<>();
        for (SupportingRule rule : SupportingRule.values()) {
            rule.evaluate(input).ifPresent(supporting::add);
        }
        List<Argument> opposing = new ArrayList<>();
        for (OpposingRule rule : OpposingRule.values()) {
            rule.evaluate(input).ifPresent(opposing::add);
        }
        return score(supporting, opposing, params);
    }

    static DebateResult score(List<Argument> supporting, List<Argument> opposing, DebateParameters params) {
        List<Argument> rankedSupporting = ranked(supporting);
        List<Argument> rankedOpposing   = ranked(opposing);
        double s = mean(rankedSupporting, params.topK());
        double o = mean(rankedOpposing, params.topK());
        double net = s - o;
        DebateWinner winner = net > params.winnerThreshold()  ? DebateWinner.SUPPORTING
                            : net < -params.winnerThreshold() ? DebateWinner.OPPOSING
                            : DebateWinner.NEUTRAL;
        return new DebateResult(s, o, net, winner, params.topK(), rankedSupporting, rankedOpposing);
    }

    /** Strongest first; ties keep catalog order. */
    private static List<Argument> ranked(List<Argument> arguments) {
        return arguments.stream()
            .sorted(Comparator.comparingDouble(Argument::strength).reversed())
            .toList();
    }

    private static double mean(List<Argument> ranked, int k) {
        return ranked.stream().limit(k).mapToDouble(Argument::strength).average().orElse(0.0);
    }
}
