package com.wagerdesk.orchestrator.client;

import com.wagerdesk.common.ledger.RuleAdjustment;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Reads active learning rules from ledger-service and reports which ones were applied.
 *
 * <p>All errors are absorbed: an unreachable ledger yields no rules, so evaluations proceed on
 * the unadjusted confidence.
 */
@Component
public class LedgerRuleClient {

    private static final Logger log = LoggerFactory.getLogger(LedgerRuleClient.class);

    private final WebClient ledgerClient;
    private final Duration timeout;

    public LedgerRuleClient(@Qualifier("ledgerWebClient") WebClient ledgerClient, OrchestratorProperties props) {
        this.ledgerClient = ledgerClient;
        this.timeout = props.ledger().timeout();
    }

    /**
     * @return active rules for the bet type (including rules not tied to any bet type);
     *         an empty list on any error
     */
    public Mono<List<RuleAdjustment>> activeRules(BetType betType) {
        return ledgerClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/ledger/rules")
                .queryParam("betType", betType.name())
                .build())
            .retrieve()
            .bodyToFlux(RuleAdjustment.class)
            .collectList()
            .timeout(timeout)
            .onErrorResume(e -> {
                log.warn("[Ledger] Rule fetch failed (non-fatal), using no rules. betType={} reason={}",
                         betType, e.getMessage());
                return Mono.just(List.of());
            });
    }

    /** Stamps each applied rule's trigger counter; failures are logged and dropped. */
    public Mono<Void> markTriggered(List<Long> ruleIds) {
        return Flux.fromIterable(ruleIds)
            .flatMap(id -> ledgerClient.post()
                .uri("/api/v1/ledger/rules/{id}/trigger", id)
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .onErrorResume(e -> {
                    log.warn("[Ledger] Rule trigger failed (non-fatal). ruleId={} reason={}", id, e.getMessage());
                    return Mono.empty();
                }))
            .then();
    }
}
