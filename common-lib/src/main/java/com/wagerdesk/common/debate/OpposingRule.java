package com.wagerdesk.common.debate;

import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.PlayerStatLine;
import com.wagerdesk.common.model.SideContext;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;
import com.wagerdesk.common.simulation.ScenarioReport;

import java.util.Optional;

/**
 * Catalog of arguments against the selection. Structural rules fire on every input, so the
 * opposing side is never empty.
 */
public enum OpposingRule {

    SAMPLE_SIZE(ArgumentCategory.METHODOLOGY, true) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            return argue(0.7, "Recent-window samples are small; variance dominates",
                "Ten games is a thin basis for a projection");
        }
    },

    REGRESSION_TO_MEAN(ArgumentCategory.METHODOLOGY, true) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            return argue(0.6, "Recent performance tends to regress toward season means",
                "Hot and cold stretches rarely persist");
        }
    },

    MARKET_EFFICIENCY(ArgumentCategory.MARKET_EFFICIENCY, true) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            double edge = in.selectionEdge();
            if (in.edge() != null && edge >= 0.05) return Optional.empty();
            return argue(0.8,
                in.edge() == null ? "No priced market to measure an edge against"
                                  : String.format("Edge of %.1f%% is within market noise", edge * 100),
                "Sharp markets price most public information");
        }
    },

    DATA_GAPS(ArgumentCategory.METHODOLOGY, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            int gaps = in.context().missing().size();
            if (gaps == 0) return Optional.empty();
            return argue(Math.min(0.5 + 0.1 * gaps, 0.9),
                gaps + " inputs were unavailable for this evaluation",
                "Missing: " + String.join(", ", in.context().missing().subList(0, Math.min(2, gaps))));
        }
    },

    THIN_PROBABILITY(ArgumentCategory.STATISTICAL, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            double p = in.selectionProbability();
            if (p >= 0.6) return Optional.empty();
            return argue(0.7, String.format("Win probability of %.0f%% is barely above a coin flip", p * 100),
                "Simulated outcome distribution");
        }
    },

    THIN_MARGIN(ArgumentCategory.VARIANCE, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            if (in.betType() != BetType.TOTAL || !in.projection().hasLine()) return Optional.empty();
            double margin = Math.abs(in.projection().marginFromLine());
            if (margin >= 5) return Optional.empty();
            return argue(0.8, String.format("Projection margin of only %.1f is inside normal variance", margin),
                "Totals routinely miss by more than five points");
        }
    },

    TOTALS_VOLATILITY(ArgumentCategory.VARIANCE, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            if (in.betType() != BetType.TOTAL) return Optional.empty();
            return argue(0.75, "Game totals carry more variance than spreads",
                String.format("Simulated standard deviation %.1f", in.simulation().stdDev()));
        }
    },

    GAME_SCRIPT(ArgumentCategory.SITUATIONAL, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            if (in.betType() != BetType.TOTAL && in.betType() != BetType.PLAYER_PROP) return Optional.empty();
            if (in.isOver()) {
                return argue(0.55, "Blowouts slow the fourth quarter and bench starters",
                    "Garbage time suppresses scoring");
            }
            return argue(0.55, "Close games invite late fouling and overtime",
                "Late-game dynamics inflate totals");
        }
    },

    OPPONENT_FORM(ArgumentCategory.STATISTICAL, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            if (in.betType() != BetType.SPREAD && in.betType() != BetType.MONEYLINE) return Optional.empty();
            SideContext opponent = in.opposingSide();
            WindowAggregate recent = DebateInput.recent(opponent);
            if (recent == null) return Optional.empty();
            double margin = recent.pointsFor() - recent.pointsAgainst();
            if (margin <= 0) return Optional.empty();
            return argue(Math.min(margin / 10, 0.8),
                String.format("%s has a +%.1f average margin recently", opponent.name(), margin),
                "Opponent is playing well");
        }
    },

    FATIGUE(ArgumentCategory.SITUATIONAL, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            SideContext side = in.selectedSide();
            if (in.betType() == BetType.TOTAL) {
                boolean tired = backToBack(in.context().sideA()) || backToBack(in.context().sideB());
                if (!in.isOver() || !tired) return Optional.empty();
                return argue(0.7, "A side on a back-to-back drags scoring down", "Fatigue costs about three points");
            }
            if (!backToBack(side)) return Optional.empty();
            return argue(0.85, side.name() + " is on a back-to-back", "Fatigue typically costs three or more points");
        }
    },

    MINUTES_VARIANCE(ArgumentCategory.VARIANCE, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            if (in.betType() != BetType.PLAYER_PROP) return Optional.empty();
            return argue(0.75, "Minutes variance is the main prop risk",
                String.format("DNP or blowout in %.1f%% of simulated games", in.simulation().extremeEventRate() * 100));
        }
    },

    FORM_REGRESSION(ArgumentCategory.STATISTICAL, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            PlayerStatLine stat = in.context().prop();
            if (in.betType() != BetType.PLAYER_PROP || stat == null) return Optional.empty();
            Double l5 = stat.averages().get(Window.L5);
            Double season = stat.averages().get(Window.SEASON);
            if (l5 == null || season == null || season <= 0) return Optional.empty();
            if (in.isOver() && l5 > season * 1.05) {
                return argue(0.7, String.format("L5 %.1f above season %.1f, regression likely", l5, season),
                    "Short hot streaks fade");
            }
            if (!in.isOver() && l5 < season * 0.95) {
                return argue(0.7, String.format("L5 %.1f below season %.1f, bounce back possible", l5, season),
                    "Short slumps fade");
            }
            return Optional.empty();
        }
    },

    TOUGH_MATCHUP(ArgumentCategory.SITUATIONAL, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            PlayerStatLine stat = in.context().prop();
            if (in.betType() != BetType.PLAYER_PROP || stat == null || stat.opponentDefFactor() <= 0) {
                return Optional.empty();
            }
            double f = stat.opponentDefFactor();
            if (in.isOver() && f < 0.97) {
                return argue(Math.min((1.0 - f) * 5, 0.8),
                    String.format("Opponent allows %.0f%% fewer %s than average", (1 - f) * 100, stat.stat()),
                    "Tough positional defense");
            }
            if (!in.isOver() && f > 1.03) {
                return argue(Math.min((f - 1.0) * 5, 0.8),
                    String.format("Opponent allows %.0f%% more %s than average", (f - 1) * 100, stat.stat()),
                    "Upside against a weak defense");
            }
            return Optional.empty();
        }
    },

    SCENARIO_INSTABILITY(ArgumentCategory.VARIANCE, false) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            ScenarioReport s = in.scenarios();
            if (s == null || s.stability() != ScenarioReport.Stability.HIGH_VARIANCE) return Optional.empty();
            return argue(0.7, String.format("Under probability swings %.0f points across scenarios", s.pUnderSpread() * 100),
                "Sensitive to pace, variance and correlation assumptions");
        }
    };

    private final ArgumentCategory category;
    private final boolean structural;

    OpposingRule(ArgumentCategory category, boolean structural) {
        this.category = category;
        this.structural = structural;
    }

    public ArgumentCategory category() {
        return category;
    }

    /** True for rules that argue on every input regardless of the matchup. */
    public boolean structural() {
        return structural;
    }

    abstract Optional<Argument> evaluate(DebateInput in);

    Optional<Argument> argue(double strength, String claim, String rationale) {
        return Optional.of(new Argument(name(), DebateSide.OPPOSING, category, strength, claim, rationale));
    }

    private static boolean backToBack(SideContext side) {
        return side != null && side.rest() != null && side.rest().backToBack();
    }
}
