package com.wagerdesk.ledger.settlement;

import com.wagerdesk.common.data.DataAccess;
import com.wagerdesk.common.data.Lookup;
import com.wagerdesk.common.exception.DataUnavailableException;
import com.wagerdesk.common.exception.WagerDeskException;
import com.wagerdesk.common.model.GameResult;
import com.wagerdesk.ledger.LedgerFixtures;
import com.wagerdesk.ledger.analysis.LossAnalyzer;
import com.wagerdesk.ledger.config.LedgerProperties;
import com.wagerdesk.ledger.dto.ManualSettlementRequest;
import com.wagerdesk.ledger.dto.SettlementResult;
import com.wagerdesk.ledger.model.LossAnalysis;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.repository.CalibrationBucketRepository;
import com.wagerdesk.ledger.repository.LossAnalysisRepository;
import com.wagerdesk.ledger.repository.WagerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static com.wagerdesk.ledger.LedgerFixtures.finalScore;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SettlementServiceTest {

    @Mock
    private WagerRepository wagerRepository;

    @Mock
    private CalibrationBucketRepository calibrationRepository;

    @Mock
    private LossAnalysisRepository lossRepository;

    @Mock
    private DataAccess dataAccess;

    @Mock
    private TransactionalOperator transactionalOperator;

    private SettlementService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        lenient().when(transactionalOperator.transactional(any(Mono.class)))
            .thenAnswer(inv -> inv.getArgument(0));
        service = new SettlementService(wagerRepository, calibrationRepository, lossRepository, dataAccess,
                                        new LossAnalyzer(0.70), transactionalOperator,
                                        new LedgerProperties(null, null, null));
    }

    private void resultFor(String eventId, GameResult result) {
        when(dataAccess.fetchResult(eventId)).thenReturn(Mono.just(Lookup.found(result)));
    }

    @Nested
    @DisplayName("Settlement pass")
    class Pass {

        @Test
        @DisplayName("winning OVER → wager settled once and its bucket incremented")
        void settlesWinner() {
            Wager over = LedgerFixtures.total(1, "OVER", 220.5, 0.62);
            when(wagerRepository.findPending(200)).thenReturn(Flux.just(over));
            resultFor("evt-1", finalScore(115, 110));
            when(wagerRepository.settle(1L, "WIN", 225.0, 0.91)).thenReturn(Mono.just(1));
            when(calibrationRepository.recordSettlement(60, 1, 0, 0)).thenReturn(Mono.empty());

            SettlementReport report = service.settlePending().block();

            assertThat(report.examined()).isEqualTo(1);
            assertThat(report.settled()).isEqualTo(1);
            verify(calibrationRepository).recordSettlement(60, 1, 0, 0);
            verifyNoInteractions(lossRepository);
        }

        @Test
        @DisplayName("wager settled by another pass first → bucket left untouched")
        void alreadySettledDoesNotDoubleCount() {
            Wager over = LedgerFixtures.total(1, "OVER", 220.5, 0.62);
            when(wagerRepository.findPending(200)).thenReturn(Flux.just(over));
            resultFor("evt-1", finalScore(115, 110));
            when(wagerRepository.settle(anyLong(), anyString(), anyDouble(), anyDouble())).thenReturn(Mono.just(0));

            SettlementReport report = service.settlePending().block();

            assertThat(report.alreadySettled()).isEqualTo(1);
            assertThat(report.settled()).isZero();
            verify(calibrationRepository, never()).recordSettlement(anyInt(), anyInt(), anyInt(), anyInt());
        }

        @Test
        @DisplayName("one failing wager does not block the rest of the batch")
        void failuresAreIsolated() {
            Wager broken = LedgerFixtures.total(1, "OVER", 220.5, 0.62);
            broken.setEventId("evt-broken");
            Wager fine = LedgerFixtures.total(2, "UNDER", 230.5, 0.55);
            when(wagerRepository.findPending(200)).thenReturn(Flux.just(broken, fine));
            when(dataAccess.fetchResult("evt-broken")).thenReturn(Mono.error(new IllegalStateException("boom")));
            resultFor("evt-1", finalScore(115, 110));
            when(wagerRepository.settle(2L, "WIN", 225.0, 0.91)).thenReturn(Mono.just(1));
            when(calibrationRepository.recordSettlement(60, 1, 0, 0)).thenReturn(Mono.empty());

            SettlementReport report = service.settlePending().block();

            assertThat(report.failed()).isEqualTo(1);
            assertThat(report.settled()).isEqualTo(1);
            verify(wagerRepository, never()).settle(eq(1L), anyString(), anyDouble(), anyDouble());
        }

        @Test
        @DisplayName("game not completed or result missing → stays pending")
        void unresolvableStaysPending() {
            Wager first = LedgerFixtures.total(1, "OVER", 220.5, 0.62);
            Wager second = LedgerFixtures.total(2, "OVER", 220.5, 0.62);
            second.setEventId("evt-2");
            when(wagerRepository.findPending(200)).thenReturn(Flux.just(first, second));
            resultFor("evt-1", new GameResult("evt-1", false, "t-bos", 60, "t-den", 58, null));
            when(dataAccess.fetchResult("evt-2"))
                .thenReturn(Mono.just(Lookup.<GameResult>notFound("fetchResult 404 key=evt-2")));

            SettlementReport report = service.settlePending().block();

            assertThat(report.unresolvable()).isEqualTo(2);
            verify(wagerRepository, never()).settle(anyLong(), anyString(), anyDouble(), anyDouble());
        }

        @Test
        @DisplayName("high-confidence loss far from the line → loss analysis recorded in the same transaction")
        void highConfidenceLossIsAnalysed() {
            Wager over = LedgerFixtures.total(1, "OVER", 220.5, 0.78);
            when(wagerRepository.findPending(200)).thenReturn(Flux.just(over));
            resultFor("evt-1", finalScore(100, 105));
            when(wagerRepository.settle(1L, "LOSS", 205.0, -1.0)).thenReturn(Mono.just(1));
            when(calibrationRepository.recordSettlement(80, 0, 1, 0)).thenReturn(Mono.empty());
            when(lossRepository.save(any(LossAnalysis.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            service.settlePending().block();

            ArgumentCaptor<LossAnalysis> analysis = ArgumentCaptor.forClass(LossAnalysis.class);
            verify(lossRepository).save(analysis.capture());
            assertThat(analysis.getValue().getWagerId()).isEqualTo(1L);
            assertThat(analysis.getValue().getCategory()).isEqualTo("MODEL_ERROR");
            verify(transactionalOperator).transactional(any(Mono.class));
        }

        @Test
        @DisplayName("a pass requested while one is running is skipped")
        void passesDoNotOverlap() {
            when(wagerRepository.findPending(200)).thenReturn(Flux.never());
            Disposable first = service.settlePending().subscribe();
            try {
                SettlementReport second = service.settlePending().block();

                assertThat(second.examined()).isZero();
                verify(wagerRepository, times(1)).findPending(200);
            } finally {
                first.dispose();
            }
        }

        @Test
        @DisplayName("guard is released after a pass completes")
        void guardReleased() {
            when(wagerRepository.findPending(200)).thenReturn(Flux.empty());

            service.settlePending().block();
            service.settlePending().block();

            verify(wagerRepository, times(2)).findPending(200);
        }
    }

    @Nested
    @DisplayName("Manual settlement")
    class Manual {

        @Test
        @DisplayName("spread settled from operator scores")
        void settlesSpread() {
            Wager spread = LedgerFixtures.wager(5, "SPREAD", "SIDE_A", -4.5, 0.66);
            when(wagerRepository.findById(5L)).thenReturn(Mono.just(spread));
            when(wagerRepository.settle(5L, "WIN", 8.0, 0.91)).thenReturn(Mono.just(1));
            when(calibrationRepository.recordSettlement(70, 1, 0, 0)).thenReturn(Mono.empty());

            SettlementResult result = service.settleManually(5L, new ManualSettlementRequest(112.0, 104.0, null)).block();

            assertThat(result.status()).isEqualTo(SettlementStatus.SETTLED);
            assertThat(result.outcome()).isEqualTo("WIN");
            assertThat(result.actualValue()).isEqualTo(8.0);
        }

        @Test
        @DisplayName("already settled wager → stored outcome returned, nothing written")
        void alreadySettled() {
            Wager done = LedgerFixtures.total(6, "OVER", 220.5, 0.7);
            done.setOutcome("LOSS");
            done.setActualValue(210.0);
            done.setProfit(-1.0);
            when(wagerRepository.findById(6L)).thenReturn(Mono.just(done));

            SettlementResult result = service.settleManually(6L, new ManualSettlementRequest(120.0, 120.0, null)).block();

            assertThat(result.status()).isEqualTo(SettlementStatus.ALREADY_SETTLED);
            assertThat(result.outcome()).isEqualTo("LOSS");
            verify(wagerRepository, never()).settle(anyLong(), anyString(), anyDouble(), anyDouble());
        }

        @Test
        @DisplayName("unknown wager → WagerDeskException")
        void unknownWager() {
            when(wagerRepository.findById(9L)).thenReturn(Mono.empty());

            assertThatThrownBy(() -> service.settleManually(9L, new ManualSettlementRequest(1.0, 2.0, null)).block())
                .isInstanceOf(WagerDeskException.class)
                .hasMessageContaining("wagerId=9");
        }

        @Test
        @DisplayName("prop without a stat value → SETTLEMENT_UNRESOLVABLE")
        void propNeedsStat() {
            Wager prop = LedgerFixtures.wager(7, "PLAYER_PROP", "OVER", 27.5, 0.7);
            prop.setEntityId("p-7");
            prop.setStat("points");
            when(wagerRepository.findById(7L)).thenReturn(Mono.just(prop));

            assertThatThrownBy(() -> service.settleManually(7L, new ManualSettlementRequest(110.0, 100.0, null)).block())
                .isInstanceOf(DataUnavailableException.class);
        }
    }
}
