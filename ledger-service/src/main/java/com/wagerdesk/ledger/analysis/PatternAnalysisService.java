package com.wagerdesk.ledger.analysis;

import com.wagerdesk.common.debate.DebateWinner;
import com.wagerdesk.common.ledger.RuleCondition;
import com.wagerdesk.ledger.model.CalibrationBucket;
import com.wagerdesk.ledger.model.Outcome;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.repository.CalibrationBucketRepository;
import com.wagerdesk.ledger.repository.LearningRuleRepository;
import com.wagerdesk.ledger.repository.WagerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Induces learning rules from settled wagers and calibration buckets.
 *
 * <p>Reads only. Past wagers are never touched; the only writes are rule appends, each in its own
 * transaction, and only when no active rule already carries the same condition.
 */
@Service
public class PatternAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(PatternAnalysisService.class);

    private final WagerRepository wagerRepository;
    private final CalibrationBucketRepository calibrationRepository;
    private final LearningRuleRepository ruleRepository;
    private final TransactionalOperator transactionalOperator;
    private final ThresholdTable thresholds;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PatternAnalysisService(WagerRepository wagerRepository,
                                  CalibrationBucketRepository calibrationRepository,
                                  LearningRuleRepository ruleRepository,
                                  TransactionalOperator transactionalOperator,
                                  ThresholdTable thresholds) {
        this.wagerRepository       = wagerRepository;
        this.calibrationRepository = calibrationRepository;
        this.ruleRepository        = ruleRepository;
        this.transactionalOperator = transactionalOperator;
        this.thresholds            = thresholds;
    }

    /**
     * Runs one analysis pass. A pass requested while another is running returns a skipped report.
     */
    public Mono<AnalysisReport> analyze() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                log.info("[Analysis] Pass already running, skipped.");
                return Mono.just(AnalysisReport.skipped(thresholds.version()));
            }
            return runPass().doFinally(signal -> running.set(false));
        });
    }

    private Mono<AnalysisReport> runPass() {
        Mono<List<Wager>> settled = wagerRepository.findSettled().collectList();
        Mono<List<CalibrationBucket>> buckets = calibrationRepository.findAllOrdered().collectList();

        return Mono.zip(settled, buckets)
            .flatMap(tuple -> {
                List<RuleCandidate> candidates = candidates(tuple.getT1(), tuple.getT2());
                return Flux.fromIterable(candidates)
                    .concatMap(this::appendIfNew)
                    .collectList()
                    .map(created -> new AnalysisReport(thresholds.version(), tuple.getT1().size(),
                                                       candidates.size(), created, false));
            })
            .doOnSuccess(r -> log.info("[Analysis] Pass complete. version={} settled={} candidates={} created={}",
                                       r.thresholdVersion(), r.settledExamined(), r.candidates(), r.created()));
    }

    List<RuleCandidate> candidates(List<Wager> settled, List<CalibrationBucket> buckets) {
        List<RuleCandidate> out = new ArrayList<>();

        ThresholdTable.Threshold edge = thresholds.highEdge();
        lossRateRule(settled, w -> w.getPredictedEdge() > edge.parameter(), edge,
                     RuleCondition.EDGE_ABOVE, decimal(edge.parameter()),
                     "predicted edge > " + decimal(edge.parameter()))
            .ifPresent(out::add);

        ThresholdTable.Threshold winner = thresholds.supportingWinner();
        lossRateRule(settled, w -> DebateWinner.SUPPORTING.name().equals(w.getDebateWinner()), winner,
                     RuleCondition.DEBATE_WINNER, DebateWinner.SUPPORTING.name(),
                     "supporting side won the debate")
            .ifPresent(out::add);

        ThresholdTable.Threshold bucketRule = thresholds.overconfidentBucket();
        for (CalibrationBucket bucket : buckets) {
            if (bucket.getBucket() < bucketRule.parameter()
                || bucket.getTotalBets() < bucketRule.minSamples()
                || bucket.getActualWinRate() == null
                || bucket.getCalibrationError() == null
                || bucket.getCalibrationError() <= bucketRule.limit()
                || bucket.getActualWinRate() >= bucket.expectedWinRate()) {
                continue;
            }
            out.add(new RuleCandidate(
                bucketRule.pattern(), RuleCondition.CONFIDENCE_AT_LEAST.name(), decimal(bucket.expectedWinRate()),
                bucketRule.adjustment(),
                String.format(Locale.ROOT, "Bucket %d%% won %.1f%% over %d bets (calibration error %.3f)",
                              bucket.getBucket(), bucket.getActualWinRate() * 100, bucket.getTotalBets(),
                              bucket.getCalibrationError()),
                bucket.getTotalBets(), bucket.getActualWinRate()));
        }
        return out;
    }

    private Optional<RuleCandidate> lossRateRule(List<Wager> settled, Predicate<Wager> matches,
                                                 ThresholdTable.Threshold threshold,
                                                 RuleCondition condition, String value, String description) {
        int wins = 0;
        int losses = 0;
        for (Wager w : settled) {
            if (!matches.test(w)) continue;
            if (Outcome.WIN.name().equals(w.getOutcome())) wins++;
            else if (Outcome.LOSS.name().equals(w.getOutcome())) losses++;
        }
        int decided = wins + losses;
        if (decided < threshold.minSamples()) return Optional.empty();

        double lossRate = (double) losses / decided;
        if (lossRate <= threshold.limit()) return Optional.empty();

        String evidence = String.format(Locale.ROOT, "%d of %d decided wagers where %s lost (%.1f%%)",
                                        losses, decided, description, lossRate * 100);
        return Optional.of(new RuleCandidate(threshold.pattern(), condition.name(), value,
                                             threshold.adjustment(), evidence, decided, 1.0 - lossRate));
    }

    /**
     * @return the candidate's condition when a rule was appended; empty when an active rule already
     *         covers it or the append failed
     */
    private Mono<String> appendIfNew(RuleCandidate candidate) {
        String label = candidate.conditionType() + " " + candidate.condition();
        Mono<String> append = ruleRepository.existsActive(candidate.conditionType(), candidate.condition())
            .flatMap(exists -> {
                if (Boolean.TRUE.equals(exists)) {
                    log.debug("[Analysis] Active rule exists, not appending. condition={}", label);
                    return Mono.<String>empty();
                }
                return ruleRepository.append(candidate.condition(), candidate.conditionType(),
                                             candidate.adjustment(), candidate.evidence(), candidate.pattern(),
                                             thresholds.version(), candidate.sampleSize(), candidate.winRateBefore())
                    .filter(rows -> rows > 0)
                    .map(rows -> label);
            });

        return transactionalOperator.transactional(append)
            .doOnNext(created -> log.info("[Analysis] Rule appended. condition={} adjustment={} evidence=\"{}\"",
                                          created, candidate.adjustment(), candidate.evidence()))
            .onErrorResume(e -> {
                log.warn("[Analysis] Rule append failed (non-fatal). condition={} reason={}", label, e.getMessage());
                return Mono.empty();
            });
    }

    static String decimal(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
