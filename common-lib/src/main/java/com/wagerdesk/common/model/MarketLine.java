package com.wagerdesk.common.model;

/**
 * Current market for one bet type, in decimal odds.
 *
 * <p>For totals and props {@code firstPrice}/{@code secondPrice} price OVER/UNDER; for spreads
 * and moneylines they price side A/side B. The spread {@code line} is side A's handicap.
 *
 * @param line        total, handicap or prop line; {@code null} for moneylines or when not posted
 */
public record MarketLine(BetType market, Double line, double firstPrice, double secondPrice) {

    public double priceFor(Direction direction) {
        return (direction == Direction.OVER || direction == Direction.SIDE_A) ? firstPrice : secondPrice;
    }
}
