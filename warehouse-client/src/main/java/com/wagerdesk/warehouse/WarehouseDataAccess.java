package com.wagerdesk.warehouse;

import com.wagerdesk.common.data.DataAccess;
import com.wagerdesk.common.data.EntityRef;
import com.wagerdesk.common.data.Lookup;
import com.wagerdesk.common.data.SideProfile;
import com.wagerdesk.common.exception.DataUnavailableException;
import com.wagerdesk.common.exception.ErrorKind;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.GameResult;
import com.wagerdesk.common.model.HeadToHead;
import com.wagerdesk.common.model.MarketLine;
import com.wagerdesk.common.model.PlayerStatLine;
import com.wagerdesk.common.model.RestProfile;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.function.Function;

/**
 * {@link DataAccess} over the warehouse REST API.
 *
 * <p>Each call maps a 404 or an empty body to {@link Lookup#notFound}. Any other failure
 * (5xx, timeout, connection refused, malformed JSON) is logged and also mapped to not-found,
 * so no error signal ever reaches the caller.
 *
 * <p>Market odds may arrive in American format ({@code "format": "AMERICAN"}) and are
 * converted to decimal before they leave this class.
 */
public class WarehouseDataAccess implements DataAccess {

    private static final Logger log = LoggerFactory.getLogger(WarehouseDataAccess.class);

    private final WebClient webClient;
    private final int headToHeadLimit;
    private final Duration timeout;

    public WarehouseDataAccess(WebClient webClient, int headToHeadLimit, Duration timeout) {
        this.webClient = webClient;
        this.headToHeadLimit = headToHeadLimit;
        this.timeout = timeout;
    }

    @Override
    public Mono<Lookup<EntityRef>> resolveEntity(String name) {
        return get("resolveEntity", name,
            b -> b.path("/api/v1/entities/resolve").queryParam("name", name).build(),
            EntityRef.class);
    }

    @Override
    public Mono<Lookup<WindowAggregate>> fetchAggregates(String entityId, Window window) {
        return get("fetchAggregates", entityId + "/" + window,
            b -> b.path("/api/v1/aggregates/{entityId}").queryParam("window", window.name()).build(entityId),
            WindowAggregate.class);
    }

    @Override
    public Mono<Lookup<PlayerStatLine>> fetchPlayerStats(String entityId, String stat) {
        return get("fetchPlayerStats", entityId + "/" + stat,
            b -> b.path("/api/v1/player-stats/{entityId}").queryParam("stat", stat).build(entityId),
            PlayerStatLine.class);
    }

    @Override
    public Mono<Lookup<HeadToHead>> fetchHeadToHead(String entityA, String entityB, int limit) {
        int effective = limit > 0 ? limit : headToHeadLimit;
        return get("fetchHeadToHead", entityA + "/" + entityB,
            b -> b.path("/api/v1/head-to-head").queryParam("a", entityA).queryParam("b", entityB)
                  .queryParam("limit", effective).build(),
            HeadToHead.class);
    }

    @Override
    public Mono<Lookup<RestProfile>> fetchRestAndDensity(String entityId, LocalDate date) {
        return get("fetchRestAndDensity", entityId + "@" + date,
            b -> b.path("/api/v1/rest/{entityId}").queryParam("date", date).build(entityId),
            RestProfile.class);
    }

    @Override
    public Mono<Lookup<SideProfile>> fetchProfile(String entityId, Double line) {
        return get("fetchProfile", entityId,
            b -> {
                UriBuilder ub = b.path("/api/v1/profile/{entityId}");
                if (line != null) ub.queryParam("line", line);
                return ub.build(entityId);
            },
            SideProfile.class);
    }

    @Override
    public Mono<Lookup<MarketLine>> fetchMarketOdds(String eventId, BetType market) {
        return get("fetchMarketOdds", eventId + "/" + market,
            b -> b.path("/api/v1/odds/{eventId}").queryParam("market", market.name()).build(eventId),
            OddsQuote.class)
            .map(lookup -> lookup.map(OddsQuote::toMarketLine))
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("[Warehouse] Unusable odds quote (non-fatal). eventId={} market={} error={}",
                    eventId, market, e.getMessage());
                return Mono.just(Lookup.notFound("fetchMarketOdds invalid price: " + e.getMessage()));
            });
    }

    @Override
    public Mono<Lookup<GameResult>> fetchResult(String eventId) {
        return get("fetchResult", eventId,
            b -> b.path("/api/v1/results/{eventId}").build(eventId),
            GameResult.class);
    }

    private <T> Mono<Lookup<T>> get(String call, String key, Function<UriBuilder, URI> uri, Class<T> type) {
        return webClient.get()
            .uri(uri)
            .exchangeToMono(response -> {
                if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                    return response.releaseBody().then(Mono.just(Lookup.<T>notFound(call + " 404 key=" + key)));
                }
                if (response.statusCode().isError()) {
                    return response.releaseBody().then(Mono.error(new DataUnavailableException(
                        "Warehouse", ErrorKind.DATA_UNAVAILABLE,
                        call + " returned " + response.statusCode().value() + " key=" + key)));
                }
                return response.bodyToMono(type)
                    .map(Lookup::found)
                    .defaultIfEmpty(Lookup.notFound(call + " empty body key=" + key));
            })
            .timeout(timeout)
            .onErrorResume(e -> {
                log.warn("[Warehouse] {} failed (non-fatal), treating as missing. key={} error={}",
                    call, key, e.getMessage());
                return Mono.just(Lookup.notFound(call + " failed: " + e.getMessage()));
            });
    }
}
