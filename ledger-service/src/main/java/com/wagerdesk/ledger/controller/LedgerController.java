package com.wagerdesk.ledger.controller;

import com.wagerdesk.common.exception.DataUnavailableException;
import com.wagerdesk.common.exception.WagerDeskException;
import com.wagerdesk.common.ledger.RuleAdjustment;
import com.wagerdesk.common.ledger.WagerTicket;
import com.wagerdesk.ledger.analysis.AnalysisReport;
import com.wagerdesk.ledger.analysis.PatternAnalysisService;
import com.wagerdesk.ledger.dto.CalibrationReport;
import com.wagerdesk.ledger.dto.ManualSettlementRequest;
import com.wagerdesk.ledger.dto.PerformanceSummary;
import com.wagerdesk.ledger.dto.SettlementResult;
import com.wagerdesk.ledger.dto.WagerReceipt;
import com.wagerdesk.ledger.model.LossAnalysis;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.service.CalibrationService;
import com.wagerdesk.ledger.service.RuleService;
import com.wagerdesk.ledger.service.WagerService;
import com.wagerdesk.ledger.settlement.OutcomeResolver;
import com.wagerdesk.ledger.settlement.SettlementReport;
import com.wagerdesk.ledger.settlement.SettlementService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Locale;

@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    private static final Logger log = LoggerFactory.getLogger(LedgerController.class);

    private final WagerService wagerService;
    private final SettlementService settlementService;
    private final PatternAnalysisService analysisService;
    private final CalibrationService calibrationService;
    private final RuleService ruleService;

    public LedgerController(WagerService wagerService,
                            SettlementService settlementService,
                            PatternAnalysisService analysisService,
                            CalibrationService calibrationService,
                            RuleService ruleService) {
        this.wagerService       = wagerService;
        this.settlementService  = settlementService;
        this.analysisService    = analysisService;
        this.calibrationService = calibrationService;
        this.ruleService        = ruleService;
    }

    // ── wagers ───────────────────────────────────────────────────────────────

    @PostMapping("/wagers")
    public Mono<ResponseEntity<WagerReceipt>> record(@RequestBody WagerTicket ticket) {
        log.info("Wager received. eventId={} selection={} traceId={}",
                 ticket.eventId(), ticket.selection(), ticket.traceId());
        return wagerService.record(ticket)
            .map(w -> ResponseEntity.status(HttpStatus.CREATED).body(receipt(w)))
            .onErrorResume(WagerDeskException.class, e -> Mono.just(ResponseEntity.badRequest().<WagerReceipt>build()))
            .doOnError(e -> log.error("Record endpoint error. traceId={}", ticket.traceId(), e));
    }

    @GetMapping("/wagers")
    public Flux<Wager> wagers(@RequestParam(defaultValue = "PENDING") String status,
                              @RequestParam(defaultValue = "500") int limit) {
        log.info("Wager query received. status={}", status);
        return "SETTLED".equals(status.toUpperCase(Locale.ROOT))
            ? wagerService.settled().take(limit)
            : wagerService.pending(limit);
    }

    @GetMapping("/wagers/similar")
    public Flux<Wager> similar(@RequestParam String betType,
                               @RequestParam(required = false) String pattern,
                               @RequestParam(defaultValue = "0.0") double minConfidence) {
        log.info("Similar wager query received. betType={} pattern={} minConfidence={}", betType, pattern, minConfidence);
        return wagerService.similar(betType.toUpperCase(Locale.ROOT), pattern, minConfidence);
    }

    @GetMapping("/performance")
    public Mono<ResponseEntity<PerformanceSummary>> performance(@RequestParam String pattern) {
        log.info("Performance query received. pattern={}", pattern);
        return wagerService.performance(pattern)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Performance endpoint error. pattern={}", pattern, e));
    }

    // ── settlement and analysis ──────────────────────────────────────────────

    @PostMapping("/wagers/{id}/settle")
    public Mono<ResponseEntity<SettlementResult>> settle(@PathVariable long id,
                                                         @RequestBody ManualSettlementRequest request) {
        log.info("Manual settlement received. wagerId={}", id);
        return settlementService.settleManually(id, request)
            .map(ResponseEntity::ok)
            .onErrorResume(DataUnavailableException.class,
                           e -> Mono.just(ResponseEntity.unprocessableEntity().<SettlementResult>build()))
            .onErrorResume(WagerDeskException.class,
                           e -> Mono.just(ResponseEntity.notFound().<SettlementResult>build()))
            .doOnError(e -> log.error("Manual settlement endpoint error. wagerId={}", id, e));
    }

    @PostMapping("/settlement/run")
    public Mono<ResponseEntity<SettlementReport>> runSettlement() {
        log.info("Settlement run requested");
        return settlementService.settlePending().map(ResponseEntity::ok);
    }

    @PostMapping("/analysis/run")
    public Mono<ResponseEntity<AnalysisReport>> runAnalysis() {
        log.info("Analysis run requested");
        return analysisService.analyze().map(ResponseEntity::ok);
    }

    @GetMapping("/calibration")
    public Mono<ResponseEntity<CalibrationReport>> calibration() {
        log.info("Calibration query received");
        return calibrationService.report()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Calibration endpoint error", e));
    }

    @GetMapping("/losses")
    public Flux<LossAnalysis> losses(@RequestParam(defaultValue = "50") int limit) {
        log.info("Loss analysis query received. limit={}", limit);
        return calibrationService.recentLosses(limit);
    }

    // ── rules ────────────────────────────────────────────────────────────────

    @GetMapping("/rules")
    public Flux<RuleAdjustment> rules(@RequestParam(required = false) String betType) {
        log.debug("Active rules query received. betType={}", betType);
        return ruleService.activeRules(betType);
    }

    @PostMapping("/rules/{id}/deactivate")
    public Mono<ResponseEntity<Void>> deactivate(@PathVariable long id) {
        log.info("Rule deactivation received. ruleId={}", id);
        return ruleService.deactivate(id).map(LedgerController::okOrNotFound);
    }

    @PostMapping("/rules/{id}/trigger")
    public Mono<ResponseEntity<Void>> trigger(@PathVariable long id) {
        return ruleService.recordTrigger(id).map(LedgerController::okOrNotFound);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static ResponseEntity<Void> okOrNotFound(boolean found) {
        return found ? ResponseEntity.ok().build() : ResponseEntity.notFound().build();
    }

    private static WagerReceipt receipt(Wager w) {
        return new WagerReceipt(w.getId(), w.getEventId(), w.getSelection(), w.getConfidence(),
                                OutcomeResolver.bucketFor(w.getConfidence()), w.getCreatedAt());
    }
}
