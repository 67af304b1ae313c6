package com.wagerdesk.common.edge;

/**
 * Conversions between American and decimal prices.
 *
 * <pre>
 *   −110 → 100/110 + 1 = 1.909
 *   +150 → 150/100 + 1 = 2.50
 * </pre>
 */
public final class OddsConverter {

    private OddsConverter() {}

    public static double americanToDecimal(double american) {
        if (american == 0 || (american > -100 && american < 100)) {
            throw new IllegalArgumentException("Not an American price: " + american);
        }
        return american < 0 ? 100.0 / Math.abs(american) + 1.0 : american / 100.0 + 1.0;
    }

    public static double decimalToAmerican(double decimal) {
        if (decimal <= 1.0) {
            throw new IllegalArgumentException("Decimal odds must exceed 1.0: " + decimal);
        }
        return decimal >= 2.0 ? (decimal - 1.0) * 100.0 : -100.0 / (decimal - 1.0);
    }

    public static double impliedProbability(double decimal) {
        if (decimal <= 1.0) {
            throw new IllegalArgumentException("Decimal odds must exceed 1.0: " + decimal);
        }
        return 1.0 / decimal;
    }
}
