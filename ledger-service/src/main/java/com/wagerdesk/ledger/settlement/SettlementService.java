package com.wagerdesk.ledger.settlement;

import com.wagerdesk.common.data.DataAccess;
import com.wagerdesk.common.exception.DataUnavailableException;
import com.wagerdesk.common.exception.ErrorKind;
import com.wagerdesk.common.exception.WagerDeskException;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.GameResult;
import com.wagerdesk.ledger.analysis.LossAnalyzer;
import com.wagerdesk.ledger.config.LedgerProperties;
import com.wagerdesk.ledger.dto.ManualSettlementRequest;
import com.wagerdesk.ledger.dto.SettlementResult;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.repository.CalibrationBucketRepository;
import com.wagerdesk.ledger.repository.LossAnalysisRepository;
import com.wagerdesk.ledger.repository.WagerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Settles pending wagers against realized results.
 *
 * <p>Each wager settles in its own transaction: a guarded update that only matches an unsettled
 * row, then, if and only if that update hit a row, the calibration bucket upsert and (for
 * high-confidence losses) the loss analysis record. A failure on one wager leaves it pending and
 * never stops the pass.
 */
@Service
public class SettlementService {

    private static final Logger log = LoggerFactory.getLogger(SettlementService.class);

    private static final String COMPONENT = "Settlement";
    private static final String MANUAL_OPPONENT = "manual-opponent";

    private final WagerRepository wagerRepository;
    private final CalibrationBucketRepository calibrationRepository;
    private final LossAnalysisRepository lossRepository;
    private final DataAccess dataAccess;
    private final LossAnalyzer lossAnalyzer;
    private final TransactionalOperator transactionalOperator;
    private final int batchSize;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SettlementService(WagerRepository wagerRepository,
                             CalibrationBucketRepository calibrationRepository,
                             LossAnalysisRepository lossRepository,
                             DataAccess dataAccess,
                             LossAnalyzer lossAnalyzer,
                             TransactionalOperator transactionalOperator,
                             LedgerProperties props) {
        this.wagerRepository       = wagerRepository;
        this.calibrationRepository = calibrationRepository;
        this.lossRepository        = lossRepository;
        this.dataAccess            = dataAccess;
        this.lossAnalyzer          = lossAnalyzer;
        this.transactionalOperator = transactionalOperator;
        this.batchSize             = props.settlement().batchSize();
    }

    /**
     * Settles up to one batch of pending wagers, oldest first. A pass requested while another is
     * running returns an empty report without reading anything.
     */
    public Mono<SettlementReport> settlePending() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                log.info("[Settlement] Pass already running, skipped.");
                return Mono.just(SettlementReport.skipped());
            }
            return wagerRepository.findPending(batchSize)
                .concatMap(this::settleFromWarehouse)
                .collectList()
                .map(SettlementReport::of)
                .doOnSuccess(r -> log.info("[Settlement] Pass complete. examined={} settled={} alreadySettled={} "
                                           + "unresolvable={} failed={}",
                                           r.examined(), r.settled(), r.alreadySettled(), r.unresolvable(), r.failed()))
                .doFinally(signal -> running.set(false));
        });
    }

    /**
     * Settles one wager from operator-supplied values.
     *
     * @throws WagerDeskException (as an error signal) when the wager does not exist
     * @throws DataUnavailableException (as an error signal) when the values cannot settle this wager
     */
    public Mono<SettlementResult> settleManually(long wagerId, ManualSettlementRequest request) {
        return wagerRepository.findById(wagerId)
            .switchIfEmpty(Mono.error(new WagerDeskException(COMPONENT, "wager not found. wagerId=" + wagerId)))
            .flatMap(wager -> {
                if (wager.isSettled()) {
                    log.info("[Settlement] Manual settlement ignored, already settled. wagerId={} outcome={}",
                             wagerId, wager.getOutcome());
                    return Mono.just(stored(wager, SettlementStatus.ALREADY_SETTLED));
                }
                Optional<Settlement> settlement = manualResult(wager, request)
                    .flatMap(result -> OutcomeResolver.resolve(wager, result));
                if (settlement.isEmpty()) {
                    return Mono.error(new DataUnavailableException(COMPONENT, ErrorKind.SETTLEMENT_UNRESOLVABLE,
                        "values do not settle wager. wagerId=" + wagerId + " betType=" + wager.getBetType()));
                }
                Settlement s = settlement.get();
                return apply(wager, s)
                    .map(status -> new SettlementResult(wagerId, status, s.outcome().name(), s.actualValue(), s.profit()));
            });
    }

    private Mono<SettlementStatus> settleFromWarehouse(Wager wager) {
        return dataAccess.fetchResult(wager.getEventId())
            .flatMap(lookup -> {
                if (!lookup.isFound()) {
                    return unresolvable(wager, lookup.reason());
                }
                GameResult result = lookup.value();
                if (!result.completed()) {
                    return unresolvable(wager, "event not completed");
                }
                return OutcomeResolver.resolve(wager, result)
                    .map(settlement -> apply(wager, settlement))
                    .orElseGet(() -> unresolvable(wager, "result does not cover selection"));
            })
            .switchIfEmpty(Mono.defer(() -> unresolvable(wager, "no result returned")))
            .onErrorResume(e -> {
                log.warn("[Settlement] Wager settlement failed (non-fatal), left pending. wagerId={} eventId={} reason={}",
                         wager.getId(), wager.getEventId(), e.getMessage());
                return Mono.just(SettlementStatus.FAILED);
            });
    }

    Mono<SettlementStatus> apply(Wager wager, Settlement settlement) {
        Mono<SettlementStatus> write = wagerRepository
            .settle(wager.getId(), settlement.outcome().name(), settlement.actualValue(), settlement.profit())
            .flatMap(rows -> {
                if (rows == 0) {
                    log.info("[Settlement] Already settled, bucket untouched. wagerId={}", wager.getId());
                    return Mono.just(SettlementStatus.ALREADY_SETTLED);
                }
                int bucket = OutcomeResolver.bucketFor(wager.getConfidence());
                return calibrationRepository.recordSettlement(bucket,
                        settlement.outcome().winCount(), settlement.outcome().lossCount(), settlement.outcome().pushCount())
                    .then(recordLoss(wager, settlement))
                    .thenReturn(SettlementStatus.SETTLED)
                    .doOnSuccess(s -> log.info("[Settlement] Settled. wagerId={} selection={} outcome={} actual={} "
                                               + "profit={} bucket={}",
                                               wager.getId(), wager.getSelection(), settlement.outcome(),
                                               settlement.actualValue(), settlement.profit(), bucket));
            });
        return transactionalOperator.transactional(write);
    }

    private Mono<Void> recordLoss(Wager wager, Settlement settlement) {
        return lossAnalyzer.analyze(wager, settlement)
            .map(analysis -> lossRepository.save(analysis)
                .doOnSuccess(a -> log.info("[Settlement] Loss analysed. wagerId={} category={} severity={}",
                                           wager.getId(), a.getCategory(), a.getSeverity()))
                .then())
            .orElse(Mono.empty());
    }

    private Mono<SettlementStatus> unresolvable(Wager wager, String reason) {
        log.info("[Settlement] {} wagerId={} eventId={} reason={}",
                 ErrorKind.SETTLEMENT_UNRESOLVABLE, wager.getId(), wager.getEventId(), reason);
        return Mono.just(SettlementStatus.UNRESOLVABLE);
    }

    /** A one-off result shaped like the warehouse's, with the wager's entity as side A. */
    private static Optional<GameResult> manualResult(Wager wager, ManualSettlementRequest request) {
        if (request == null) return Optional.empty();
        if (BetType.PLAYER_PROP.name().equals(wager.getBetType())) {
            if (request.statValue() == null || wager.getEntityId() == null || wager.getStat() == null) {
                return Optional.empty();
            }
            return Optional.of(new GameResult(wager.getEventId(), true, null, 0, null, 0,
                Map.of(wager.getEntityId(), Map.of(wager.getStat(), request.statValue()))));
        }
        if (request.entityScore() == null || request.opponentScore() == null) return Optional.empty();
        return Optional.of(new GameResult(wager.getEventId(), true,
            wager.getEntityId(), request.entityScore(), MANUAL_OPPONENT, request.opponentScore(), Map.of()));
    }

    private static SettlementResult stored(Wager wager, SettlementStatus status) {
        return new SettlementResult(wager.getId(), status, wager.getOutcome(), wager.getActualValue(), wager.getProfit());
    }
}
