package com.wagerdesk.ledger.repository;

import com.wagerdesk.ledger.model.LearningRule;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface LearningRuleRepository extends ReactiveCrudRepository<LearningRule, Long> {

    /** Active rules for a bet type, including rules with no bet type. */
    @Query("""
        SELECT * FROM learning_rules
        WHERE active = TRUE
          AND (bet_type IS NULL OR bet_type = :betType)
        ORDER BY id ASC
        """)
    Flux<LearningRule> findActive(String betType);

    @Query("SELECT * FROM learning_rules WHERE active = TRUE ORDER BY id ASC")
    Flux<LearningRule> findAllActive();

    @Query("""
        SELECT COUNT(*) > 0 FROM learning_rules
        WHERE active = TRUE
          AND condition_type = :conditionType
          AND condition      = :condition
        """)
    Mono<Boolean> existsActive(String conditionType, String condition);

    /**
     * Appends a rule produced by pattern analysis.
     *
     * @return 1 when inserted, 0 when this pattern already produced the same rule under this threshold version
     */
    @Modifying
    @Query("""
        INSERT INTO learning_rules
            (condition, condition_type, bet_type, adjustment, evidence, pattern,
             threshold_version, sample_size, win_rate_before, active, created_at)
        VALUES
            (:condition, :conditionType, NULL, :adjustment, :evidence, :pattern,
             :thresholdVersion, :sampleSize, :winRateBefore, TRUE, NOW())
        ON CONFLICT (pattern, condition_type, condition, threshold_version) DO NOTHING
        """)
    Mono<Integer> append(String condition, String conditionType, double adjustment, String evidence,
                         String pattern, String thresholdVersion, int sampleSize, double winRateBefore);

    @Modifying
    @Query("UPDATE learning_rules SET active = FALSE WHERE id = :id AND active = TRUE")
    Mono<Integer> deactivate(long id);

    @Modifying
    @Query("""
        UPDATE learning_rules SET
            trigger_count   = trigger_count + 1,
            last_applied_at = NOW()
        WHERE id = :id
        """)
    Mono<Integer> recordTrigger(long id);
}
