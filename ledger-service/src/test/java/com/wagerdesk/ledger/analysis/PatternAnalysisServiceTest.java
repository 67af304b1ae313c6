package com.wagerdesk.ledger.analysis;

import com.wagerdesk.ledger.LedgerFixtures;
import com.wagerdesk.ledger.model.CalibrationBucket;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.repository.CalibrationBucketRepository;
import com.wagerdesk.ledger.repository.LearningRuleRepository;
import com.wagerdesk.ledger.repository.WagerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PatternAnalysisServiceTest {

    @Mock
    private WagerRepository wagerRepository;

    @Mock
    private CalibrationBucketRepository calibrationRepository;

    @Mock
    private LearningRuleRepository ruleRepository;

    @Mock
    private TransactionalOperator transactionalOperator;

    private PatternAnalysisService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        lenient().when(transactionalOperator.transactional(any(Mono.class)))
            .thenAnswer(inv -> inv.getArgument(0));
        service = new PatternAnalysisService(wagerRepository, calibrationRepository, ruleRepository,
                                             transactionalOperator, ThresholdTable.v1());
    }

    private static List<Wager> wagers(int wins, int losses, double edge, String winner) {
        List<Wager> out = new ArrayList<>();
        long id = 100;
        for (int i = 0; i < wins; i++) out.add(LedgerFixtures.settled(id++, "WIN", edge, winner));
        for (int i = 0; i < losses; i++) out.add(LedgerFixtures.settled(id++, "LOSS", edge, winner));
        return out;
    }

    private static CalibrationBucket bucket(int bucket, int wins, int losses) {
        CalibrationBucket b = new CalibrationBucket();
        b.setBucket(bucket);
        b.setWins(wins);
        b.setLosses(losses);
        b.setTotalBets(wins + losses);
        double rate = (double) wins / (wins + losses);
        b.setActualWinRate(rate);
        b.setCalibrationError(Math.abs(bucket / 100.0 - rate));
        return b;
    }

    @Nested
    @DisplayName("Threshold table v1")
    class Candidates {

        @Test
        @DisplayName("high-edge wagers losing 4 of 6 → EDGE_ABOVE rule")
        void highEdge() {
            List<RuleCandidate> found = service.candidates(wagers(2, 4, 0.07, "NEUTRAL"), List.of());

            assertThat(found).singleElement().satisfies(c -> {
                assertThat(c.conditionType()).isEqualTo("EDGE_ABOVE");
                assertThat(c.condition()).isEqualTo("0.05");
                assertThat(c.adjustment()).isEqualTo(-0.02);
                assertThat(c.sampleSize()).isEqualTo(6);
                assertThat(c.evidence()).startsWith("4 of 6");
            });
        }

        @Test
        @DisplayName("fewer than five decided samples → no rule")
        void tooFewSamples() {
            assertThat(service.candidates(wagers(0, 4, 0.07, "NEUTRAL"), List.of())).isEmpty();
        }

        @Test
        @DisplayName("pushes do not count as samples")
        void pushesIgnored() {
            List<Wager> settled = wagers(1, 3, 0.07, "NEUTRAL");
            settled.add(LedgerFixtures.settled(200, "PUSH", 0.07, "NEUTRAL"));

            assertThat(service.candidates(settled, List.of())).isEmpty();
        }

        @Test
        @DisplayName("losing rate at the limit is not enough")
        void limitIsExclusive() {
            // 0.50 loss rate against a 0.50 limit for the debate pattern
            assertThat(service.candidates(wagers(3, 3, 0.01, "SUPPORTING"), List.of())).isEmpty();
        }

        @Test
        @DisplayName("supporting-side winners losing 3 of 5 → DEBATE_WINNER rule")
        void supportingWinner() {
            List<RuleCandidate> found = service.candidates(wagers(2, 3, 0.01, "SUPPORTING"), List.of());

            assertThat(found).extracting(RuleCandidate::conditionType, RuleCandidate::condition)
                .containsExactly(tuple("DEBATE_WINNER", "SUPPORTING"));
        }

        @Test
        @DisplayName("overconfident bucket at 70 or above → CONFIDENCE_AT_LEAST rule")
        void overconfidentBucket() {
            List<CalibrationBucket> buckets = List.of(
                bucket(60, 3, 9),     // below the bucket floor
                bucket(70, 6, 6),     // 0.50 vs 0.70
                bucket(80, 12, 0));   // underconfident

            List<RuleCandidate> found = service.candidates(List.of(), buckets);

            assertThat(found).singleElement().satisfies(c -> {
                assertThat(c.conditionType()).isEqualTo("CONFIDENCE_AT_LEAST");
                assertThat(c.condition()).isEqualTo("0.70");
                assertThat(c.adjustment()).isEqualTo(-0.05);
            });
        }

        @Test
        @DisplayName("bucket with fewer than ten bets → no rule")
        void smallBucket() {
            assertThat(service.candidates(List.of(), List.of(bucket(70, 2, 6)))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Analysis pass")
    class Pass {

        @Test
        @DisplayName("rules are appended only where no active rule exists, wagers are never written")
        void appendsOnlyNewRules() {
            List<Wager> settled = new ArrayList<>(wagers(2, 4, 0.07, "NEUTRAL"));
            settled.addAll(wagers(2, 3, 0.01, "SUPPORTING"));
            when(wagerRepository.findSettled()).thenReturn(Flux.fromIterable(settled));
            when(calibrationRepository.findAllOrdered()).thenReturn(Flux.empty());
            when(ruleRepository.existsActive("EDGE_ABOVE", "0.05")).thenReturn(Mono.just(true));
            when(ruleRepository.existsActive("DEBATE_WINNER", "SUPPORTING")).thenReturn(Mono.just(false));
            when(ruleRepository.append(eq("SUPPORTING"), eq("DEBATE_WINNER"), eq(-0.03), anyString(),
                                       eq("SUPPORTING_WINNER"), eq("v1"), eq(5), anyDouble()))
                .thenReturn(Mono.just(1));

            AnalysisReport report = service.analyze().block();

            assertThat(report.thresholdVersion()).isEqualTo("v1");
            assertThat(report.settledExamined()).isEqualTo(11);
            assertThat(report.candidates()).isEqualTo(2);
            assertThat(report.created()).containsExactly("DEBATE_WINNER SUPPORTING");
            verify(ruleRepository, never()).append(eq("0.05"), eq("EDGE_ABOVE"), anyDouble(), anyString(),
                                                   anyString(), anyString(), anyInt(), anyDouble());
            verify(wagerRepository, never()).save(any(Wager.class));
            verify(wagerRepository, never()).settle(anyLong(), anyString(), anyDouble(), anyDouble());
        }

        @Test
        @DisplayName("an append rejected by the version constraint creates nothing")
        void duplicateVersionIsNoop() {
            when(wagerRepository.findSettled()).thenReturn(Flux.fromIterable(wagers(2, 4, 0.07, "NEUTRAL")));
            when(calibrationRepository.findAllOrdered()).thenReturn(Flux.empty());
            when(ruleRepository.existsActive("EDGE_ABOVE", "0.05")).thenReturn(Mono.just(false));
            when(ruleRepository.append(anyString(), anyString(), anyDouble(), anyString(), anyString(), anyString(),
                                       anyInt(), anyDouble()))
                .thenReturn(Mono.just(0));

            AnalysisReport report = service.analyze().block();

            assertThat(report.created()).isEmpty();
            assertThat(report.skipped()).isFalse();
        }

        @Test
        @DisplayName("a failed append is logged and the pass still completes")
        void appendFailureIsNonFatal() {
            when(wagerRepository.findSettled()).thenReturn(Flux.fromIterable(wagers(2, 4, 0.07, "NEUTRAL")));
            when(calibrationRepository.findAllOrdered()).thenReturn(Flux.empty());
            when(ruleRepository.existsActive("EDGE_ABOVE", "0.05"))
                .thenReturn(Mono.error(new IllegalStateException("db down")));

            AnalysisReport report = service.analyze().block();

            assertThat(report.candidates()).isEqualTo(1);
            assertThat(report.created()).isEmpty();
        }
    }
}
