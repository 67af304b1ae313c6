package com.wagerdesk.common.edge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OddsConverterTest {

    @Test
    @DisplayName("negative favourite: 100/|odds| + 1")
    void favourite() {
        assertEquals(1.9090909, OddsConverter.americanToDecimal(-110), 1e-6);
        assertEquals(1.5, OddsConverter.americanToDecimal(-200), 1e-12);
    }

    @Test
    @DisplayName("positive underdog: odds/100 + 1")
    void underdog() {
        assertEquals(2.5, OddsConverter.americanToDecimal(150), 1e-12);
        assertEquals(2.0, OddsConverter.americanToDecimal(100), 1e-12);
    }

    @Test
    @DisplayName("decimal back to American")
    void decimalToAmerican() {
        assertEquals(150, OddsConverter.decimalToAmerican(2.5), 1e-9);
        assertEquals(-200, OddsConverter.decimalToAmerican(1.5), 1e-9);
    }

    @Test
    @DisplayName("prices inside (-100, 100) are not American odds")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> OddsConverter.americanToDecimal(50));
        assertThrows(IllegalArgumentException.class, () -> OddsConverter.impliedProbability(1.0));
    }
}
