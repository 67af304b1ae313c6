package com.wagerdesk.common.data;

import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.GameResult;
import com.wagerdesk.common.model.HeadToHead;
import com.wagerdesk.common.model.MarketLine;
import com.wagerdesk.common.model.PlayerStatLine;
import com.wagerdesk.common.model.RestProfile;
import com.wagerdesk.common.model.Window;
import com.wagerdesk.common.model.WindowAggregate;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Read-only view of the statistics warehouse and odds feed.
 *
 * <p>Every call is idempotent. Implementations MUST NOT emit an error signal: transport
 * failures, timeouts and empty responses all complete with {@link Lookup#notFound(String)},
 * so callers can treat any gap as a missing artifact and carry on with partial data.
 */
public interface DataAccess {

    Mono<Lookup<EntityRef>> resolveEntity(String name);

    Mono<Lookup<WindowAggregate>> fetchAggregates(String entityId, Window window);

    Mono<Lookup<PlayerStatLine>> fetchPlayerStats(String entityId, String stat);

    Mono<Lookup<HeadToHead>> fetchHeadToHead(String entityA, String entityB, int limit);

    Mono<Lookup<RestProfile>> fetchRestAndDensity(String entityId, LocalDate date);

    /**
     * Venue splits, schedule strength and O/U record near {@code line}.
     *
     * @param line  total line to match the O/U record against; may be {@code null}
     */
    Mono<Lookup<SideProfile>> fetchProfile(String entityId, Double line);

    Mono<Lookup<MarketLine>> fetchMarketOdds(String eventId, BetType market);

    Mono<Lookup<GameResult>> fetchResult(String eventId);
}
