package com.wagerdesk.common.ledger;

import com.wagerdesk.common.debate.DebateInput;
import com.wagerdesk.common.debate.DebateResult;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.RestProfile;
import com.wagerdesk.common.model.SideContext;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of conditions a learning rule can be stated over. The ledger stores the constant
 * name as the rule's condition type and a single parameter as its condition value.
 */
public enum RuleCondition {

    /** Value: edge threshold, e.g. {@code 0.05}. */
    EDGE_ABOVE {
        @Override
        public boolean matches(String value, DebateInput in, DebateResult debate, double confidence) {
            return in.edge() != null && in.selectionEdge() > number(value, 0.05);
        }
    },

    /** Value: a {@code DebateWinner} name. */
    DEBATE_WINNER {
        @Override
        public boolean matches(String value, DebateInput in, DebateResult debate, double confidence) {
            return debate != null && value != null && debate.winner().name().equalsIgnoreCase(value.trim());
        }
    },

    /** Value: confidence floor, e.g. {@code 0.70}. */
    CONFIDENCE_AT_LEAST {
        @Override
        public boolean matches(String value, DebateInput in, DebateResult debate, double confidence) {
            return confidence >= number(value, 0.70);
        }
    },

    /** Totals match when either side is on a back-to-back, other markets when the selected side is. */
    BACK_TO_BACK {
        @Override
        public boolean matches(String value, DebateInput in, DebateResult debate, double confidence) {
            if (in.betType() == BetType.TOTAL) {
                return backToBack(in.context().sideA()) || backToBack(in.context().sideB());
            }
            return backToBack(in.selectedSide());
        }
    },

    /** Selected side hosts the game and gives points. */
    HOME_FAVORITE {
        @Override
        public boolean matches(String value, DebateInput in, DebateResult debate, double confidence) {
            if (in.betType() != BetType.SPREAD || !in.projection().hasLine()) return false;
            SideContext side = in.selectedSide();
            if (side == null || !side.home()) return false;
            double handicap = in.selection() == Direction.SIDE_B ? -in.projection().line() : in.projection().line();
            return handicap < 0;
        }
    },

    /** Value: comma-separated entity ids of high-altitude venues; matches when the host is one of them. */
    ALTITUDE {
        @Override
        public boolean matches(String value, DebateInput in, DebateResult debate, double confidence) {
            if (value == null || value.isBlank()) return false;
            SideContext host = host(in);
            return host != null && Arrays.stream(value.split(","))
                .map(String::trim)
                .anyMatch(id -> id.equals(host.entityId()));
        }
    },

    /** Value: minimum season games, e.g. {@code 15}. */
    EARLY_SEASON {
        @Override
        public boolean matches(String value, DebateInput in, DebateResult debate, double confidence) {
            int threshold = (int) number(value, 15);
            if (in.betType() == BetType.PLAYER_PROP) {
                return in.context().prop() != null && in.context().prop().games() < threshold;
            }
            return seasonGames(in.context().sideA()) < threshold || seasonGames(in.context().sideB()) < threshold;
        }
    };

    public abstract boolean matches(String value, DebateInput in, DebateResult debate, double confidence);

    public static Optional<RuleCondition> parse(String type) {
        if (type == null) return Optional.empty();
        try {
            return Optional.of(valueOf(type.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    static double number(String value, double fallback) {
        if (value == null || value.isBlank()) return fallback;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static boolean backToBack(SideContext side) {
        if (side == null) return false;
        RestProfile rest = side.rest();
        return rest != null && rest.backToBack();
    }

    private static SideContext host(DebateInput in) {
        SideContext a = in.context().sideA();
        SideContext b = in.context().sideB();
        if (a != null && a.home()) return a;
        if (b != null && b.home()) return b;
        return null;
    }

    /** Season games played, or {@link Integer#MAX_VALUE} when the side or its season window is unknown. */
    private static int seasonGames(SideContext side) {
        if (side == null) return Integer.MAX_VALUE;
        WindowAggregate season = side.windows().get(Window.SEASON);
        return season == null ? Integer.MAX_VALUE : season.games();
    }
}
