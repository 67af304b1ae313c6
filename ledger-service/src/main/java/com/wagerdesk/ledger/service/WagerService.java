package com.wagerdesk.ledger.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wagerdesk.common.debate.DebateResult;
import com.wagerdesk.common.exception.WagerDeskException;
import com.wagerdesk.common.ledger.WagerTicket;
import com.wagerdesk.common.model.Adjustment;
import com.wagerdesk.common.model.Projection;
import com.wagerdesk.ledger.dto.PerformanceSummary;
import com.wagerdesk.ledger.model.Outcome;
import com.wagerdesk.ledger.model.Wager;
import com.wagerdesk.ledger.repository.WagerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Appends wagers and answers read queries over them. Never updates a wager; settlement owns that.
 */
@Service
public class WagerService {

    private static final Logger log = LoggerFactory.getLogger(WagerService.class);

    /** Projection adjustments that count as rest or schedule reasoning. */
    static final Set<String> REST_LABELS = Set.of("rest", "rest_differential", "fatigue");
    static final double REST_FACTOR_POINTS = 1.0;
    static final int SIMILAR_LIMIT = 50;

    private final WagerRepository repository;
    private final ObjectMapper objectMapper;

    public WagerService(WagerRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    public Mono<Wager> record(WagerTicket ticket) {
        return Mono.fromCallable(() -> toEntity(ticket))
            .flatMap(repository::save)
            .doOnSuccess(w -> log.info("[Ledger] Wager recorded. wagerId={} eventId={} selection={} confidence={} traceId={}",
                                       w.getId(), w.getEventId(), w.getSelection(), w.getConfidence(), w.getTraceId()))
            .doOnError(e -> log.error("[Ledger] Failed to record wager. eventId={} traceId={}",
                                      ticket.eventId(), ticket.traceId(), e));
    }

    public Flux<Wager> pending(int limit) {
        return repository.findPending(limit);
    }

    public Flux<Wager> settled() {
        return repository.findSettled();
    }

    /**
     * Wagers of a bet type whose selection contains {@code pattern} (case-insensitive) and whose
     * confidence is at least {@code minConfidence}.
     */
    public Flux<Wager> similar(String betType, String pattern, double minConfidence) {
        return repository.findSimilar(betType, containsPattern(pattern), minConfidence, SIMILAR_LIMIT);
    }

    public Mono<PerformanceSummary> performance(String pattern) {
        return repository.findSettledBySelection(containsPattern(pattern))
            .collectList()
            .map(wagers -> summarize(pattern, wagers));
    }

    static PerformanceSummary summarize(String pattern, List<Wager> settled) {
        int wins = 0, losses = 0, pushes = 0;
        double profit = 0.0;
        for (Wager w : settled) {
            if (Outcome.WIN.name().equals(w.getOutcome())) wins++;
            else if (Outcome.LOSS.name().equals(w.getOutcome())) losses++;
            else if (Outcome.PUSH.name().equals(w.getOutcome())) pushes++;
            if (w.getProfit() != null) profit += w.getProfit();
        }
        int decided = wins + losses;
        Double winRate = decided == 0 ? null : (double) wins / decided;
        double roi = settled.isEmpty() ? 0.0 : profit / settled.size();
        return new PerformanceSummary(pattern, settled.size(), wins, losses, pushes, winRate, round(profit), round(roi));
    }

    Wager toEntity(WagerTicket ticket) {
        if (ticket.eventId() == null || ticket.betType() == null || ticket.direction() == null) {
            throw new WagerDeskException("Ledger", "ticket needs eventId, betType and direction");
        }
        DebateResult debate = ticket.debate();

        Wager w = new Wager();
        w.setEventId(ticket.eventId());
        w.setTraceId(ticket.traceId());
        w.setBetType(ticket.betType().name());
        w.setDirection(ticket.direction().name());
        w.setSelection(ticket.selection() != null ? ticket.selection() : ticket.direction().name());
        w.setEntityId(ticket.entityId());
        w.setStat(ticket.stat());
        w.setLine(ticket.line());
        w.setOdds(ticket.odds());
        w.setConfidence(ticket.confidence());
        w.setPredictedEdge(ticket.predictedEdge());
        w.setStake(ticket.stake());
        w.setDepth(ticket.depth() != null ? ticket.depth() : "standard");
        w.setDebateWinner(debate != null && debate.winner() != null ? debate.winner().name() : null);
        w.setRestFactor(restFactor(ticket.projection()));
        w.setReasoningTrace(toJson(reasoningTrace(ticket)));
        w.setSupportingArguments(toJson(debate != null ? debate.supporting() : List.of()));
        w.setOpposingArguments(toJson(debate != null ? debate.opposing() : List.of()));
        w.setAppliedRules(toJson(ticket.appliedRules()));
        w.setCreatedAt(LocalDateTime.now());
        return w;
    }

    static boolean restFactor(Projection projection) {
        if (projection == null) return false;
        for (Adjustment a : projection.adjustments()) {
            if (REST_LABELS.contains(a.label()) && Math.abs(a.value()) >= REST_FACTOR_POINTS) return true;
        }
        return false;
    }

    private static Map<String, Object> reasoningTrace(WagerTicket ticket) {
        Map<String, Object> trace = new LinkedHashMap<>();
        trace.put("projection", ticket.projection());
        trace.put("simulation", ticket.simulation());
        DebateResult debate = ticket.debate();
        if (debate != null) {
            Map<String, Object> scores = new LinkedHashMap<>();
            scores.put("supportingStrength", debate.supportingStrength());
            scores.put("opposingStrength", debate.opposingStrength());
            scores.put("net", debate.net());
            scores.put("winner", debate.winner());
            trace.put("debate", scores);
        }
        return trace;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new WagerDeskException("Ledger", "wager JSON column could not be written", e);
        }
    }

    /** Escapes LIKE wildcards in user input and wraps it for a substring match. */
    static String containsPattern(String pattern) {
        if (pattern == null || pattern.isBlank()) return "%";
        String escaped = pattern.trim().replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
