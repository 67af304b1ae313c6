package com.wagerdesk.orchestrator.context;

import com.wagerdesk.common.data.DataAccess;
import com.wagerdesk.common.data.EntityRef;
import com.wagerdesk.common.data.Lookup;
import com.wagerdesk.common.data.SideProfile;
import com.wagerdesk.common.model.HeadToHead;
import com.wagerdesk.common.model.MarketLine;
import com.wagerdesk.common.model.PlayerStatLine;
import com.wagerdesk.common.model.RestProfile;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;
import com.wagerdesk.orchestrator.context.ContextAssembly.SideAssembly;
import com.wagerdesk.orchestrator.model.EvaluationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Pulls the context for one request through {@link DataAccess}.
 *
 * <p>Both sides are fetched concurrently. Parts already present in the previous assembly are
 * reused as-is, so a retry only asks for what is still missing. Any error signal from a
 * DataAccess call is converted into a not-found lookup at the call site.
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final DataAccess dataAccess;

    public ContextAssembler(DataAccess dataAccess) {
        this.dataAccess = dataAccess;
    }

    public Mono<ContextAssembly> assemble(EvaluationRequest request, ContextAssembly previous) {
        ContextAssembly prev = previous != null ? previous : ContextAssembly.empty();

        Mono<Lookup<EntityRef>> entityA = reuse(prev.sideA().entity(),
            () -> dataAccess.resolveEntity(request.sideA()));
        Mono<Lookup<EntityRef>> entityB = blank(request.sideB())
            ? Mono.just(Lookup.notFound("no opponent named"))
            : reuse(prev.sideB().entity(), () -> dataAccess.resolveEntity(request.sideB()));

        return Mono.zip(entityA, entityB)
            .flatMap(t -> fetchDetails(request, prev, t.getT1(), t.getT2()));
    }

    private Mono<ContextAssembly> fetchDetails(EvaluationRequest request, ContextAssembly prev,
                                               Lookup<EntityRef> entityA, Lookup<EntityRef> entityB) {
        LocalDate date = request.gameDate() != null ? request.gameDate() : LocalDate.now();
        boolean prop = request.isProp();

        Mono<SideFetch> sideA = !entityA.isFound()
            ? Mono.just(SideFetch.unresolved(entityA.reason()))
            : prop
                ? playerSide(entityA.value(), prev.sideA(), date)
                : teamSide(entityA.value(), prev.sideA(), date, request.line());
        Mono<SideFetch> sideB = !entityB.isFound()
            ? Mono.just(SideFetch.unresolved(entityB.reason()))
            : teamSide(entityB.value(), prev.sideB(), date, prop ? null : request.line());

        Mono<Lookup<HeadToHead>> h2h = (!prop && entityA.isFound() && entityB.isFound())
            ? reuse(prev.headToHead(), () -> dataAccess.fetchHeadToHead(
                  entityA.value().entityId(), entityB.value().entityId(), 0))
            : Mono.just(Lookup.notFound("not applicable"));
        Mono<Lookup<MarketLine>> market = blank(request.eventId())
            ? Mono.just(Lookup.notFound("no event id"))
            : reuse(prev.market(), () -> dataAccess.fetchMarketOdds(request.eventId(), request.betType()));
        Mono<Lookup<PlayerStatLine>> stat = (prop && entityA.isFound())
            ? reuse(prev.prop(), () -> dataAccess.fetchPlayerStats(entityA.value().entityId(), request.stat()))
            : Mono.just(Lookup.notFound(prop ? "player unresolved" : "not applicable"));

        return Mono.zip(sideA, sideB, h2h, market, stat)
            .map(t -> collect(request, t.getT1(), t.getT2(), t.getT3(), t.getT4(), t.getT5()));
    }

    private ContextAssembly collect(EvaluationRequest request, SideFetch a, SideFetch b,
                                    Lookup<HeadToHead> h2h, Lookup<MarketLine> market,
                                    Lookup<PlayerStatLine> stat) {
        List<String> missing = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        boolean prop = request.isProp();

        if (a.side().entity() == null) {
            errors.add("sideA.entity: " + a.reason());
        } else {
            a.report("sideA", missing, errors, !prop);
        }

        if (b.side().entity() == null) {
            if (prop) {
                if (!blank(request.sideB())) missing.add("sideB.entity");
            } else {
                errors.add("sideB.entity: " + b.reason());
            }
        } else {
            b.report("sideB", missing, errors, !prop);
        }

        if (!prop && a.side().entity() != null && b.side().entity() != null && !h2h.isFound()) {
            missing.add("headToHead");
        }
        if (!blank(request.eventId()) && !market.isFound()) missing.add("market");
        if (prop && a.side().entity() != null && !stat.isFound()) errors.add("prop: " + stat.reason());

        ContextAssembly assembly = new ContextAssembly(a.side(), b.side(),
            h2h.orElse(null), market.orElse(null), stat.orElse(null), missing, errors);
        log.debug("[Context] Assembled. betType={} usable={} missing={} errors={}",
                  request.betType(), assembly.isUsable(request), missing.size(), errors.size());
        return assembly;
    }

    private Mono<SideFetch> teamSide(EntityRef entity, SideAssembly prev, LocalDate date, Double line) {
        SideAssembly reusable = sameEntity(prev, entity) ? prev : SideAssembly.EMPTY;
        Mono<Map<Window, WindowAggregate>> windows = Flux.fromArray(Window.values())
            .flatMap(w -> reuse(reusable.windows().get(w), () -> dataAccess.fetchAggregates(entity.entityId(), w))
                .map(l -> new WindowLookup(w, l)))
            .collectList()
            .map(ContextAssembler::toWindowMap);
        Mono<Lookup<RestProfile>> rest = reuse(reusable.rest(),
            () -> dataAccess.fetchRestAndDensity(entity.entityId(), date));
        Mono<Lookup<SideProfile>> profile = reuse(reusable.profile(),
            () -> dataAccess.fetchProfile(entity.entityId(), line));

        return Mono.zip(windows, rest, profile)
            .map(t -> new SideFetch(
                new SideAssembly(entity, t.getT1(), t.getT2().orElse(null), t.getT3().orElse(null)),
                null, true));
    }

    /** A player's side only carries rest, taken from the player's team schedule. */
    private Mono<SideFetch> playerSide(EntityRef player, SideAssembly prev, LocalDate date) {
        SideAssembly reusable = sameEntity(prev, player) ? prev : SideAssembly.EMPTY;
        String scheduleId = player.teamId() != null ? player.teamId() : player.entityId();
        return reuse(reusable.rest(), () -> dataAccess.fetchRestAndDensity(scheduleId, date))
            .map(rest -> new SideFetch(new SideAssembly(player, Map.of(), rest.orElse(null), null), null, false));
    }

    private <T> Mono<Lookup<T>> reuse(T existing, Supplier<Mono<Lookup<T>>> fetch) {
        if (existing != null) return Mono.just(Lookup.found(existing));
        return Mono.defer(fetch)
            .defaultIfEmpty(Lookup.notFound("empty response"))
            .onErrorResume(e -> {
                log.warn("[Context] DataAccess call failed (non-fatal). reason={}", e.getMessage());
                return Mono.just(Lookup.notFound(e.getMessage()));
            });
    }

    private static boolean sameEntity(SideAssembly prev, EntityRef entity) {
        return prev.entity() != null && prev.entity().entityId().equals(entity.entityId());
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    private static Map<Window, WindowAggregate> toWindowMap(List<WindowLookup> lookups) {
        Map<Window, WindowAggregate> map = new EnumMap<>(Window.class);
        for (WindowLookup wl : lookups) {
            if (wl.lookup().isFound()) map.put(wl.window(), wl.lookup().value());
        }
        return map;
    }

    private record WindowLookup(Window window, Lookup<WindowAggregate> lookup) {}

    private record SideFetch(SideAssembly side, String reason, boolean team) {

        static SideFetch unresolved(String reason) {
            return new SideFetch(SideAssembly.EMPTY, reason, false);
        }

        /**
         * @param windowsRequired  a side with no aggregates at all is an error rather than a gap
         */
        void report(String prefix, List<String> missing, List<String> errors, boolean windowsRequired) {
            if (team) {
                if (side.windows().isEmpty()) {
                    if (windowsRequired) errors.add(prefix + ".windows: no aggregates");
                    else missing.add(prefix + ".windows");
                } else {
                    for (Window w : Window.values()) {
                        if (!side.windows().containsKey(w)) missing.add(prefix + ".window." + w);
                    }
                }
                if (side.profile() == null) missing.add(prefix + ".profile");
            }
            if (side.rest() == null) missing.add(prefix + ".rest");
        }
    }
}
