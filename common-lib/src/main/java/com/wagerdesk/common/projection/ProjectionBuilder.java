package com.wagerdesk.common.projection;

import com.wagerdesk.common.model.Adjustment;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Context;
import com.wagerdesk.common.model.HeadToHead;
import com.wagerdesk.common.model.PlayerStatLine;
import com.wagerdesk.common.model.Projection;
import com.wagerdesk.common.model.PropDistribution;
import com.wagerdesk.common.model.RestProfile;
import com.wagerdesk.common.model.SideContext;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link Context} into a {@link Projection} for the request's market.
 *
 * <p>Totals, layered in this order:
 * <pre>
 *   matchupPace = (paceA + paceB) / 2
 *   expectedA   = (ORtgA + DRtgB) / 2 · matchupPace / 100
 *   expectedB   = (ORtgB + DRtgA) / 2 · matchupPace / 100
 *   total       = expectedA + expectedB
 *               + opponent strength + rest + fatigue + venue + head-to-head + O/U trend
 *               + bias correction
 * </pre>
 * Ratings and pace are blended over the windows present with the team weights.
 *
 * <p>Spreads project side A's margin as half the net-points differential, shifted by home
 * court, rest differential and a head-to-head pull. Player props blend the stat over L5/L10/season
 * and scale it by the opponent's defensive factor.
 *
 * <p>Every layer is recorded as an {@link Adjustment}, including layers that contributed zero
 * because their input was missing.
 */
public final class ProjectionBuilder {

    static final double DEFAULT_RATING = 110.0;
    static final double DEFAULT_PACE   = 100.0;
    static final double PROP_STD_SHARE = 0.25;

    private ProjectionBuilder() {}

    public static Projection build(Context ctx, Double line, ProjectionParameters p) {
        return switch (ctx.betType()) {
            case TOTAL -> total(ctx, line, p);
            case SPREAD, MONEYLINE -> spread(ctx, line, p);
            case PLAYER_PROP -> prop(ctx, line, p);
        };
    }

    // ── Totals ───────────────────────────────────────────────────────────────

    static Projection total(Context ctx, Double line, ProjectionParameters p) {
        SideContext a = requireWindows(ctx.sideA());
        SideContext b = requireWindows(ctx.sideB());
        List<String> inputs = new ArrayList<>();
        inputs.add("multi_timeframe");

        Expected exp = expectedScores(a, b, p);
        inputs.add("efficiency_based");

        List<Adjustment> adj = new ArrayList<>();
        adj.add(opponentStrength(a, b, inputs));
        adj.add(rest(a, b, p, inputs));
        adj.add(fatigue(a, b, p, inputs));
        adj.add(venue(a, b, inputs));
        adj.add(headToHeadTotal(ctx.headToHead(), line, p, inputs));
        adj.add(overUnderTrend(a, b, line, p, inputs));
        adj.add(Adjustment.of("bias_correction", p.biasCorrection(),
            "Backtested systematic under-projection of combined scores"));

        double adjustments = adj.stream().mapToDouble(Adjustment::value).sum();
        double total = exp.a + exp.b + adjustments;

        Spread sd = deviations(a, b, p, inputs);
        return new Projection(BetType.TOTAL, total,
            exp.a + adjustments / 2, exp.b + adjustments / 2,
            sd.a, sd.b, line, adj, inputs, null, sd.insufficient);
    }

    // ── Spreads ──────────────────────────────────────────────────────────────

    static Projection spread(Context ctx, Double line, ProjectionParameters p) {
        SideContext a = requireWindows(ctx.sideA());
        SideContext b = requireWindows(ctx.sideB());
        List<String> inputs = new ArrayList<>();
        inputs.add("multi_timeframe");

        Expected exp = expectedScores(a, b, p);
        double netA = TimeframeBlend.blend(a.windows(), p.teamWeights(), w -> w.pointsFor() - w.pointsAgainst());
        double netB = TimeframeBlend.blend(b.windows(), p.teamWeights(), w -> w.pointsFor() - w.pointsAgainst());
        double base = (netA - netB) / 2;

        List<Adjustment> adj = new ArrayList<>();
        double home = a.home() ? p.homeCourtAdvantage() : b.home() ? -p.homeCourtAdvantage() : 0.0;
        adj.add(Adjustment.of("home_court", home,
            a.home() ? a.name() + " at home" : b.home() ? b.name() + " at home" : "Neutral site"));

        double restDiff = 0.0;
        String restWhy = "Rest data unavailable";
        if (a.rest() != null && b.rest() != null) {
            restDiff = (restPenalty(b.rest(), p) - restPenalty(a.rest(), p)) / 2;
            restWhy = "Rest penalty differential";
            inputs.add("rest_days");
        }
        adj.add(Adjustment.of("rest_differential", restDiff, restWhy));

        HeadToHead h2h = ctx.headToHead();
        double h2hAdj = 0.0;
        String h2hWhy = "Fewer than " + p.headToHeadMinGames() + " meetings";
        if (h2h != null && h2h.games() >= p.headToHeadMinGames()) {
            h2hAdj = p.headToHeadWeight() * (h2h.avgMarginA() - base);
            h2hWhy = "Pull toward average margin " + round1(h2h.avgMarginA()) + " over " + h2h.games() + " meetings";
            inputs.add("h2h_history");
        }
        adj.add(Adjustment.of("head_to_head", h2hAdj, h2hWhy));

        double margin = base + adj.stream().mapToDouble(Adjustment::value).sum();
        double mid = (exp.a + exp.b) / 2;
        Spread sd = deviations(a, b, p, inputs);
        return new Projection(ctx.betType(), margin, mid + margin / 2, mid - margin / 2,
            sd.a, sd.b, line, adj, inputs, null, sd.insufficient);
    }

    // ── Player props ─────────────────────────────────────────────────────────

    static Projection prop(Context ctx, Double line, ProjectionParameters p) {
        PlayerStatLine stat = ctx.prop();
        if (stat == null || stat.averages().isEmpty()) {
            throw new IllegalArgumentException("Player prop context has no stat averages");
        }
        List<String> inputs = new ArrayList<>();
        for (Window w : Window.values()) {
            if (stat.averages().containsKey(w) && p.propWeights().containsKey(w)) {
                inputs.add(w.name().toLowerCase());
            }
        }
        double base = TimeframeBlend.blendValues(stat.averages(), p.propWeights());

        List<Adjustment> adj = new ArrayList<>();
        double factor = stat.opponentDefFactor() > 0 ? stat.opponentDefFactor() : 1.0;
        adj.add(Adjustment.of("opponent_defense", base * (factor - 1.0),
            "Opponent defensive factor " + round2(factor)));

        double projection = base * factor;
        double std = stat.stdDev() > 0 ? stat.stdDev() : projection * PROP_STD_SHARE;
        boolean insufficient = stat.games() < p.sampleThreshold();
        if (insufficient) {
            std += (p.sampleThreshold() - stat.games()) * p.uncertaintyPerGame();
            inputs.add("insufficient_sample");
        }
        double minutesStd = stat.minutesStd() > 0 ? stat.minutesStd() : p.defaultMinutesStd();
        PropDistribution dist = new PropDistribution(stat.stat(), projection, std, stat.minutesMean(), minutesStd);
        return new Projection(BetType.PLAYER_PROP, projection, projection, 0.0, std, 0.0,
            line, adj, inputs, dist, insufficient);
    }

    // ── Layers ───────────────────────────────────────────────────────────────

    private record Expected(double a, double b) {}

    private record Spread(double a, double b, boolean insufficient) {}

    private static Expected expectedScores(SideContext a, SideContext b, ProjectionParameters p) {
        double ortgA = TimeframeBlend.blend(a.windows(), p.teamWeights(), w -> orDefault(w.offensiveRating(), DEFAULT_RATING));
        double drtgA = TimeframeBlend.blend(a.windows(), p.teamWeights(), w -> orDefault(w.defensiveRating(), DEFAULT_RATING));
        double paceA = TimeframeBlend.blend(a.windows(), p.teamWeights(), w -> orDefault(w.pace(), DEFAULT_PACE));
        double ortgB = TimeframeBlend.blend(b.windows(), p.teamWeights(), w -> orDefault(w.offensiveRating(), DEFAULT_RATING));
        double drtgB = TimeframeBlend.blend(b.windows(), p.teamWeights(), w -> orDefault(w.defensiveRating(), DEFAULT_RATING));
        double paceB = TimeframeBlend.blend(b.windows(), p.teamWeights(), w -> orDefault(w.pace(), DEFAULT_PACE));
        double pace = (paceA + paceB) / 2;
        return new Expected((ortgA + drtgB) / 2 * pace / 100, (ortgB + drtgA) / 2 * pace / 100);
    }

    static Adjustment opponentStrength(SideContext a, SideContext b, List<String> inputs) {
        if (a.strength() == null || b.strength() == null) {
            return Adjustment.of("opponent_strength", 0.0, "Schedule strength unavailable");
        }
        double deltaA = (a.strength().adjustedPointsFor() - a.strength().rawPointsFor())
                      + (a.strength().adjustedPointsAgainst() - a.strength().rawPointsAgainst());
        double deltaB = (b.strength().adjustedPointsFor() - b.strength().rawPointsFor())
                      + (b.strength().adjustedPointsAgainst() - b.strength().rawPointsAgainst());
        inputs.add("opponent_adjusted");
        return Adjustment.of("opponent_strength", (deltaA + deltaB) / 2,
            "Scoring normalized to league-average opposition");
    }

    static Adjustment rest(SideContext a, SideContext b, ProjectionParameters p, List<String> inputs) {
        RestProfile ra = a.rest();
        RestProfile rb = b.rest();
        if (ra == null || rb == null || ra.restDays() == null || rb.restDays() == null) {
            return Adjustment.of("rest", 0.0, "Rest days unavailable");
        }
        inputs.add("rest_days");
        double value = -restPenalty(ra, p) - restPenalty(rb, p);
        String why = "Back-to-back/short rest penalties";
        if (ra.restDays() >= p.wellRestedDays() && rb.restDays() >= p.wellRestedDays()) {
            value += p.wellRestedBonus();
            why = "Both sides well rested";
        }
        return Adjustment.of("rest", value, why);
    }

    static double restPenalty(RestProfile rest, ProjectionParameters p) {
        double penalty = 0.0;
        if (rest.backToBack()) penalty += p.backToBackPenalty();
        if (rest.restDays() != null && rest.restDays() == 1) penalty += p.oneDayRestPenalty();
        return penalty;
    }

    static Adjustment fatigue(SideContext a, SideContext b, ProjectionParameters p, List<String> inputs) {
        if (a.rest() == null || b.rest() == null) {
            return Adjustment.of("fatigue", 0.0, "Schedule density unavailable");
        }
        inputs.add("schedule_density");
        int points = a.rest().fatigueScore() + b.rest().fatigueScore();
        return Adjustment.of("fatigue", -points * p.fatiguePointValue(),
            points + " fatigue points across both sides");
    }

    static Adjustment venue(SideContext a, SideContext b, List<String> inputs) {
        if (a.venue() == null || b.venue() == null || !a.venue().isComplete() || !b.venue().isComplete()) {
            return Adjustment.of("venue", 0.0, "Venue splits unavailable");
        }
        inputs.add("venue_splits");
        double deltaA = a.venue().avgTotalAt(a.home()) - a.venue().overallAvgTotal();
        double deltaB = b.venue().avgTotalAt(b.home()) - b.venue().overallAvgTotal();
        return Adjustment.of("venue", (deltaA + deltaB) / 2, "Venue-specific totals vs overall");
    }

    static Adjustment headToHeadTotal(HeadToHead h2h, Double line, ProjectionParameters p, List<String> inputs) {
        if (h2h == null || h2h.games() < p.headToHeadMinGames() || h2h.avgTotal() <= 0 || line == null) {
            return Adjustment.of("head_to_head", 0.0, "Fewer than " + p.headToHeadMinGames() + " meetings or no line");
        }
        inputs.add("h2h_history");
        return Adjustment.of("head_to_head", (h2h.avgTotal() - line) * p.headToHeadWeight(),
            "Meetings averaged " + round1(h2h.avgTotal()) + " over " + h2h.games() + " games");
    }

    static Adjustment overUnderTrend(SideContext a, SideContext b, Double line, ProjectionParameters p,
                                     List<String> inputs) {
        if (line == null || a.overUnder() == null || b.overUnder() == null) {
            return Adjustment.of("ou_trend", 0.0, "No O/U record at this line");
        }
        inputs.add("ou_record_at_line");
        double under = (a.overUnder().underRate() + b.overUnder().underRate()) / 2;
        double nudge = 0.0;
        if (under > p.strongTrendRate()) nudge = -p.strongTrendNudge();
        else if (under > p.mildTrendRate()) nudge = -p.mildTrendNudge();
        else if (under < 1.0 - p.strongTrendRate()) nudge = p.strongTrendNudge();
        else if (under < 1.0 - p.mildTrendRate()) nudge = p.mildTrendNudge();
        return Adjustment.of("ou_trend", nudge, "Combined under rate " + round2(under));
    }

    private static Spread deviations(SideContext a, SideContext b, ProjectionParameters p, List<String> inputs) {
        double sa = observedStd(a);
        double sb = observedStd(b);
        if (sa > 0 && sb > 0) {
            inputs.add("actual_variance");
        } else {
            sa = p.defaultStdDev();
            sb = p.defaultStdDev();
        }
        int games = Math.min(a.sampleGames(), b.sampleGames());
        boolean insufficient = games < p.sampleThreshold();
        if (insufficient) {
            double penalty = (p.sampleThreshold() - games) * p.uncertaintyPerGame();
            sa += penalty;
            sb += penalty;
            inputs.add("insufficient_sample");
        }
        return new Spread(sa, sb, insufficient);
    }

    private static double observedStd(SideContext side) {
        for (Window w : Window.values()) {
            WindowAggregate agg = side.windows().get(w);
            if (agg != null && agg.stdDev() > 0) return agg.stdDev();
        }
        return 0.0;
    }

    private static SideContext requireWindows(SideContext side) {
        if (side == null || !side.hasWindows()) {
            throw new IllegalArgumentException("Side has no performance windows: "
                + (side == null ? "null" : side.name()));
        }
        return side;
    }

    private static double orDefault(double value, double fallback) {
        return value > 0 ? value : fallback;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
