package com.wagerdesk.common.debate;

import com.wagerdesk.common.edge.SideEdge;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.HeadToHead;
import com.wagerdesk.common.model.PlayerStatLine;
import com.wagerdesk.common.model.SideContext;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;

import java.util.Optional;

/**
 * Catalog of arguments in favour of the selection. Each rule emits at most one argument.
 */
public enum SupportingRule {

    MODEL_EDGE(ArgumentCategory.STATISTICAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            double edge = in.selectionEdge();
            if (in.edge() == null || edge <= 0) return Optional.empty();
            return argue(edge * 10,
                String.format("Model edge of %.1f%% over the implied price", edge * 100),
                "Simulated probability exceeds the market's implied probability");
        }
    },

    SIMULATED_PROBABILITY(ArgumentCategory.STATISTICAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            double p = in.selectionProbability();
            if (p <= 0.55) return Optional.empty();
            return argue((p - 0.5) * 2,
                String.format("Simulation gives %.0f%% for %s", p * 100, in.selection()),
                in.simulation().draws() + " correlated draws");
        }
    },

    PROJECTION_MARGIN(ArgumentCategory.STATISTICAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            if (!in.projection().hasLine()) return Optional.empty();
            double margin = in.marginForSelection();
            if (margin <= 0) return Optional.empty();
            double scale = in.betType() == BetType.TOTAL ? 10.0 : 5.0;
            return argue(margin / scale,
                String.format("Projection %.1f sits %.1f from the line %.1f on the %s side",
                    in.projection().pointEstimate(), margin, in.projection().line(), in.selection()),
                "Blended timeframe efficiency with situational adjustments");
        }
    },

    KELLY_SIZE(ArgumentCategory.MARKET_EFFICIENCY) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            SideEdge side = in.selectionSide();
            if (side == null || side.kellyStake() <= 0) return Optional.empty();
            return argue(side.kellyStake() * 10,
                String.format("Fractional Kelly suggests %.1f%% of bankroll", side.kellyStake() * 100),
                "Positive expected value at the quoted price");
        }
    },

    HOME_COURT(ArgumentCategory.SITUATIONAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            SideContext side = in.selectedSide();
            if (side == null || !side.home()) return Optional.empty();
            if (in.betType() == BetType.PLAYER_PROP) {
                if (!in.isOver()) return Optional.empty();
                return argue(0.55, side.name() + " plays at home", "Home players produce slightly more");
            }
            if (in.betType() == BetType.TOTAL) return Optional.empty();
            return argue(0.6, side.name() + " has home court", "Home court is worth about three points");
        }
    },

    REST_EDGE(ArgumentCategory.SITUATIONAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            double favour = switch (in.betType()) {
                case TOTAL -> in.isOver() ? in.adjustment("rest") : -in.adjustment("rest");
                case SPREAD, MONEYLINE -> in.selection() == Direction.SIDE_A
                    ? in.adjustment("rest_differential") : -in.adjustment("rest_differential");
                case PLAYER_PROP -> 0.0;
            };
            if (favour < 1.0) return Optional.empty();
            return argue(Math.min(favour / 5, 0.9),
                String.format("Rest situation moves the projection %.1f toward %s", favour, in.selection()),
                "Back-to-back and short-rest penalties");
        }
    },

    SCORING_ENVIRONMENT(ArgumentCategory.STATISTICAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            if (in.betType() != BetType.TOTAL) return Optional.empty();
            WindowAggregate a = DebateInput.recent(in.context().sideA());
            WindowAggregate b = DebateInput.recent(in.context().sideB());
            if (a == null || b == null || a.pointsFor() <= 0 || b.pointsFor() <= 0) return Optional.empty();
            double combined = a.pointsFor() + b.pointsFor();
            if (in.isOver() && combined > 230) {
                return argue(Math.min((combined - 220) / 20, 0.9),
                    String.format("Both sides score heavily: combined %.1f per game", combined), "Recent scoring averages");
            }
            if (!in.isOver() && combined < 220) {
                return argue(Math.min((220 - combined) / 20, 0.9),
                    String.format("Both sides score lightly: combined %.1f per game", combined), "Recent scoring averages");
            }
            return Optional.empty();
        }
    },

    DEFENSIVE_MATCHUP(ArgumentCategory.STATISTICAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            if (in.betType() != BetType.TOTAL) return Optional.empty();
            WindowAggregate a = DebateInput.recent(in.context().sideA());
            WindowAggregate b = DebateInput.recent(in.context().sideB());
            if (a == null || b == null || a.pointsAgainst() <= 0 || b.pointsAgainst() <= 0) return Optional.empty();
            double allowed = (a.pointsAgainst() + b.pointsAgainst()) / 2;
            if (in.isOver() && allowed > 115) {
                return argue(0.7, String.format("Weak defenses allowing %.1f per game", allowed),
                    "Poor defenses correlate with high totals");
            }
            if (!in.isOver() && allowed < 108) {
                return argue(0.7, String.format("Strong defenses allowing only %.1f per game", allowed),
                    "Strong defenses correlate with low totals");
            }
            return Optional.empty();
        }
    },

    HEAD_TO_HEAD(ArgumentCategory.STATISTICAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            HeadToHead h2h = in.context().headToHead();
            if (h2h == null || h2h.games() < 3) return Optional.empty();
            if (in.betType() == BetType.SPREAD || in.betType() == BetType.MONEYLINE) {
                double margin = in.selection() == Direction.SIDE_A ? h2h.avgMarginA() : -h2h.avgMarginA();
                if (margin <= 0) return Optional.empty();
                return argue(margin / 10,
                    String.format("Selection won recent meetings by %.1f on average", margin),
                    h2h.games() + " head-to-head games");
            }
            if (in.betType() == BetType.TOTAL && in.projection().hasLine()) {
                double diff = h2h.avgTotal() - in.projection().line();
                double favour = in.isOver() ? diff : -diff;
                if (favour <= 3) return Optional.empty();
                return argue(favour / 10,
                    String.format("Meetings averaged %.1f against a line of %.1f", h2h.avgTotal(), in.projection().line()),
                    h2h.games() + " head-to-head games");
            }
            return Optional.empty();
        }
    },

    RECENT_FORM(ArgumentCategory.STATISTICAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            PlayerStatLine stat = in.context().prop();
            if (in.betType() != BetType.PLAYER_PROP || stat == null) return Optional.empty();
            Double l5 = stat.averages().get(Window.L5);
            Double season = stat.averages().get(Window.SEASON);
            if (l5 == null || season == null || season <= 0) return Optional.empty();
            if (in.isOver() && l5 > season * 1.1) {
                return argue(Math.min((l5 - season) / season * 2, 0.9),
                    String.format("Hot: L5 %.1f vs season %.1f", l5, season), "Recent production trending up");
            }
            if (!in.isOver() && l5 < season * 0.9) {
                return argue(Math.min((season - l5) / season * 2, 0.9),
                    String.format("Cold: L5 %.1f vs season %.1f", l5, season), "Recent production trending down");
            }
            return Optional.empty();
        }
    },

    DEFENSIVE_FACTOR(ArgumentCategory.SITUATIONAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            PlayerStatLine stat = in.context().prop();
            if (in.betType() != BetType.PLAYER_PROP || stat == null) return Optional.empty();
            double f = stat.opponentDefFactor();
            if (in.isOver() && f > 1.05) {
                return argue(Math.min((f - 1.0) * 5, 0.85),
                    String.format("Opponent allows %.0f%% more %s than average", (f - 1) * 100, stat.stat()),
                    "Positional defensive weakness");
            }
            if (!in.isOver() && f > 0 && f < 0.95) {
                return argue(Math.min((1.0 - f) * 5, 0.85),
                    String.format("Opponent allows %.0f%% fewer %s than average", (1 - f) * 100, stat.stat()),
                    "Positional defensive strength");
            }
            return Optional.empty();
        }
    },

    MINUTES_SECURE(ArgumentCategory.SITUATIONAL) {
        @Override
        Optional<Argument> evaluate(DebateInput in) {
            PlayerStatLine stat = in.context().prop();
            if (in.betType() != BetType.PLAYER_PROP || stat == null || stat.minutesMean() < 32) {
                return Optional.empty();
            }
            return argue(0.65, String.format("Averaging %.1f minutes, a secure rotation role", stat.minutesMean()),
                "More minutes, more opportunity");
        }
    };

    private final ArgumentCategory category;

    SupportingRule(ArgumentCategory category) {
        this.category = category;
    }

    public ArgumentCategory category() {
        return category;
    }

    abstract Optional<Argument> evaluate(DebateInput in);

    Optional<Argument> argue(double strength, String claim, String rationale) {
        return Optional.of(new Argument(name(), DebateSide.SUPPORTING, category, strength, claim, rationale));
    }
}
