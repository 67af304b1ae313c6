package com.wagerdesk.ledger.analysis;

import com.wagerdesk.ledger.LedgerFixtures;
import com.wagerdesk.ledger.model.LossAnalysis;
import com.wagerdesk.ledger.model.Outcome;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.settlement.Settlement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LossAnalyzerTest {

    private final LossAnalyzer analyzer = new LossAnalyzer(0.70);

    private static Settlement lossBy(double miss) {
        return new Settlement(Outcome.LOSS, 220.5 - miss, miss, -1.0);
    }

    private static Wager confident(boolean restFactor) {
        Wager w = LedgerFixtures.total(3, "OVER", 220.5, 0.74);
        w.setRestFactor(restFactor);
        return w;
    }

    @Test
    @DisplayName("rest-driven pick missing big → B2B_FACTOR")
    void restFactor() {
        LossAnalysis a = analyzer.analyze(confident(true), lossBy(7.0)).orElseThrow();

        assertThat(a.getCategory()).isEqualTo("B2B_FACTOR");
        assertThat(a.getWagerId()).isEqualTo(3L);
    }

    @Test
    @DisplayName("rest-driven pick losing narrowly is still a bad beat")
    void restFactorNarrowMiss() {
        assertThat(analyzer.analyze(confident(true), lossBy(2.0)).orElseThrow().getCategory())
            .isEqualTo("BAD_BEAT");
    }

    @Test
    @DisplayName("within three points → BAD_BEAT")
    void badBeat() {
        assertThat(analyzer.analyze(confident(false), lossBy(3.0)).orElseThrow().getCategory())
            .isEqualTo("BAD_BEAT");
    }

    @Test
    @DisplayName("ten or more points → MODEL_ERROR")
    void modelError() {
        LossAnalysis a = analyzer.analyze(confident(false), lossBy(12.5)).orElseThrow();

        assertThat(a.getCategory()).isEqualTo("MODEL_ERROR");
        assertThat(a.getLesson()).contains("12.5 points");
    }

    @Test
    @DisplayName("anything in between → OTHER")
    void other() {
        assertThat(analyzer.analyze(confident(false), lossBy(5.0)).orElseThrow().getCategory())
            .isEqualTo("OTHER");
    }

    @Test
    @DisplayName("losses below the confidence threshold and wins are not analysed")
    void onlyConfidentLosses() {
        Wager hesitant = LedgerFixtures.total(4, "OVER", 220.5, 0.65);

        assertThat(analyzer.analyze(hesitant, lossBy(15.0))).isEmpty();
        assertThat(analyzer.analyze(confident(false), new Settlement(Outcome.WIN, 230, 9.5, 0.91))).isEmpty();
    }

    @Test
    @DisplayName("severity grows with the miss and stays within [0, 1]")
    void severity() {
        double small = LossAnalyzer.severity(0.74, 1.0);
        double large = LossAnalyzer.severity(0.74, 40.0);

        assertThat(small).isLessThan(large);
        assertThat(large).isLessThanOrEqualTo(1.0);
        assertThat(LossAnalyzer.severity(1.0, 100.0)).isEqualTo(1.0);
    }
}
