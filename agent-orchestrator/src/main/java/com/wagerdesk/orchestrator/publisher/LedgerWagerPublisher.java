package com.wagerdesk.orchestrator.publisher;

import com.fasterxml.jackson.databind.JsonNode;
import com.wagerdesk.common.ledger.WagerTicket;
import com.wagerdesk.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Records actionable recommendations in ledger-service over HTTP.
 *
 * <p>Publishing is part of the evaluation chain so the result can carry the wager id, but a
 * ledger outage never fails an evaluation: the Mono completes empty and the failure is logged.
 */
@Component
public class LedgerWagerPublisher {

    private static final Logger log = LoggerFactory.getLogger(LedgerWagerPublisher.class);

    private final WebClient ledgerClient;
    private final Duration timeout;

    public LedgerWagerPublisher(@Qualifier("ledgerWebClient") WebClient ledgerClient, OrchestratorProperties props) {
        this.ledgerClient = ledgerClient;
        this.timeout = props.ledger().timeout();
    }

    /**
     * @return the ledger's wager id; empty when the ledger could not be reached
     */
    public Mono<Long> publish(WagerTicket ticket) {
        return ledgerClient.post()
            .uri("/api/v1/ledger/wagers")
            .header("X-Trace-Id", ticket.traceId())
            .bodyValue(ticket)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .flatMap(body -> body.hasNonNull("id") ? Mono.just(body.get("id").asLong()) : Mono.<Long>empty())
            .doOnNext(id -> log.info("[Ledger] Wager recorded. wagerId={} eventId={} selection={} traceId={}",
                                     id, ticket.eventId(), ticket.selection(), ticket.traceId()))
            .onErrorResume(e -> {
                log.warn("[Ledger] Wager publish failed (non-fatal). eventId={} traceId={} reason={}",
                         ticket.eventId(), ticket.traceId(), e.getMessage());
                return Mono.empty();
            });
    }
}
