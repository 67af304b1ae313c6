package com.wagerdesk.ledger.repository;

import com.wagerdesk.ledger.model.Wager;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface WagerRepository extends ReactiveCrudRepository<Wager, Long> {

    /** Oldest unsettled wagers first, so a backlog drains in creation order. */
    @Query("SELECT * FROM wagers WHERE outcome IS NULL ORDER BY created_at ASC LIMIT :limit")
    Flux<Wager> findPending(int limit);

    @Query("SELECT * FROM wagers WHERE outcome IS NOT NULL ORDER BY settled_at DESC")
    Flux<Wager> findSettled();

    /**
     * Sets the outcome of a wager exactly once.
     *
     * @return rows updated: 1 on first settlement, 0 when the wager was already settled or does not exist
     */
    @Modifying
    @Query("""
        UPDATE wagers SET
            outcome      = :outcome,
            actual_value = :actualValue,
            profit       = :profit,
            settled_at   = NOW()
        WHERE id = :id
          AND outcome IS NULL
        """)
    Mono<Integer> settle(long id, String outcome, double actualValue, double profit);

    /**
     * Wagers of one bet type whose selection matches a SQL {@code LIKE} pattern, newest first.
     */
    @Query("""
        SELECT * FROM wagers
        WHERE bet_type = :betType
          AND selection ILIKE :pattern
          AND confidence >= :minConfidence
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<Wager> findSimilar(String betType, String pattern, double minConfidence, int limit);

    @Query("""
        SELECT * FROM wagers
        WHERE outcome IS NOT NULL
          AND selection ILIKE :pattern
        ORDER BY settled_at DESC
        """)
    Flux<Wager> findSettledBySelection(String pattern);
}
