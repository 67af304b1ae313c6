package com.wagerdesk.warehouse;

import com.wagerdesk.common.edge.OddsConverter;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.MarketLine;

/**
 * Odds as served by the feed, in either price format.
 */
public record OddsQuote(BetType market, Double line, double firstPrice, double secondPrice, PriceFormat format) {

    public enum PriceFormat {
        DECIMAL,
        AMERICAN
    }

    public MarketLine toMarketLine() {
        if (format == PriceFormat.AMERICAN) {
            return new MarketLine(market, line,
                OddsConverter.americanToDecimal(firstPrice),
                OddsConverter.americanToDecimal(secondPrice));
        }
        return new MarketLine(market, line, requireDecimal(firstPrice), requireDecimal(secondPrice));
    }

    // a missing price field binds as 0.0
    private static double requireDecimal(double price) {
        if (!(price > 1.0)) {
            throw new IllegalArgumentException("Decimal odds must exceed 1.0: " + price);
        }
        return price;
    }
}
