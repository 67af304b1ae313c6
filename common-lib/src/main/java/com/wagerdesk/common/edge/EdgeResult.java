package com.wagerdesk.common.edge;

import com.wagerdesk.common.model.Direction;

/**
 * Both sides of a market plus the side worth taking, if any.
 *
 * @param recommended side with the higher positive EV; {@code null} when neither side has one
 */
public record EdgeResult(SideEdge first, SideEdge second, Direction recommended, RecommendationTier tier) {

    public SideEdge side(Direction direction) {
        if (first.direction() == direction) return first;
        if (second.direction() == direction) return second;
        throw new IllegalArgumentException("No edge computed for " + direction);
    }

    public SideEdge recommendedSide() {
        return recommended == null ? null : side(recommended);
    }
}
