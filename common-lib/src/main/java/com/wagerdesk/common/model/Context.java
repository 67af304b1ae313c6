package com.wagerdesk.common.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Immutable snapshot assembled for one evaluation request.
 *
 * <p>{@code sideB} is {@code null} only for player props whose opponent could not be
 * resolved. {@code headToHead}, {@code market} and {@code prop} are {@code null} when the
 * corresponding lookup came back empty; {@code missing} names every such gap.
 */
public record Context(
    String eventId,
    BetType betType,
    LocalDate gameDate,
    SideContext sideA,
    SideContext sideB,
    HeadToHead headToHead,
    MarketLine market,
    PlayerStatLine prop,
    DataQuality quality,
    List<String> missing
) {
    public Context {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public boolean hasMarket() {
        return market != null;
    }
}
