package com.wagerdesk.ledger.scheduler;

import com.wagerdesk.ledger.analysis.PatternAnalysisService;
import com.wagerdesk.ledger.config.LedgerProperties;
import com.wagerdesk.ledger.settlement.SettlementService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Periodic settlement and pattern-analysis loops.
 *
 * <p>Each loop is {@code delay → pass → reschedule}: the next cycle is scheduled only after the
 * previous pass terminates, so a loop never overlaps itself. Errors are logged and the loop
 * reschedules with its normal interval. Manual runs from the REST API share the services'
 * running guards and are skipped while a loop pass is in flight.
 */
@Component
public class LedgerJobs {

    private static final Logger log = LoggerFactory.getLogger(LedgerJobs.class);

    private final SettlementService settlementService;
    private final PatternAnalysisService analysisService;
    private final LedgerProperties props;

    private volatile boolean stopped;

    public LedgerJobs(SettlementService settlementService, PatternAnalysisService analysisService,
                      LedgerProperties props) {
        this.settlementService = settlementService;
        this.analysisService   = analysisService;
        this.props             = props;
    }

    @PostConstruct
    public void start() {
        LedgerProperties.Settlement settlement = props.settlement();
        if (settlement.enabled()) {
            log.info("[Jobs] Settlement loop started. initialDelay={} interval={} batchSize={}",
                     settlement.initialDelay(), settlement.interval(), settlement.batchSize());
            scheduleNext("settlement", settlement.initialDelay(), settlement.interval(),
                         () -> settlementService.settlePending().then());
        } else {
            log.info("[Jobs] Settlement loop disabled.");
        }

        LedgerProperties.Analysis analysis = props.analysis();
        if (analysis.enabled()) {
            log.info("[Jobs] Analysis loop started. initialDelay={} interval={}",
                     analysis.initialDelay(), analysis.interval());
            scheduleNext("analysis", analysis.initialDelay(), analysis.interval(),
                         () -> analysisService.analyze().then());
        } else {
            log.info("[Jobs] Analysis loop disabled.");
        }
    }

    @PreDestroy
    public void stop() {
        stopped = true;
    }

    Disposable scheduleNext(String job, Duration delay, Duration interval, Supplier<Mono<Void>> pass) {
        return Mono.delay(delay)
            .then(Mono.defer(pass))
            .subscribe(
                ignored -> { },
                err -> {
                    log.error("[Jobs] {} pass failed, rescheduling. nextInSeconds={}", job, interval.toSeconds(), err);
                    reschedule(job, interval, pass);
                },
                () -> reschedule(job, interval, pass));
    }

    private void reschedule(String job, Duration interval, Supplier<Mono<Void>> pass) {
        if (stopped) {
            log.info("[Jobs] {} loop stopped.", job);
            return;
        }
        scheduleNext(job, interval, interval, pass);
    }
}
