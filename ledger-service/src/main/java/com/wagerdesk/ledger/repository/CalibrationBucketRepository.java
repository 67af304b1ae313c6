package com.wagerdesk.ledger.repository;

import com.wagerdesk.ledger.model.CalibrationBucket;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CalibrationBucketRepository extends ReactiveCrudRepository<CalibrationBucket, Long> {

    @Query("SELECT * FROM calibration_buckets ORDER BY bucket ASC")
    Flux<CalibrationBucket> findAllOrdered();

    /**
     * Atomic UPSERT: adds one settled wager to a bucket and recomputes its win rate and
     * calibration error inline. Pushes count toward {@code total_bets} but not the win rate;
     * the rate stays {@code NULL} until the bucket has a decided wager.
     *
     * @param bucket confidence bucket in percent (40..80)
     * @param win    1 for a WIN, else 0
     * @param loss   1 for a LOSS, else 0
     * @param push   1 for a PUSH, else 0
     */
    @Modifying
    @Query("""
        INSERT INTO calibration_buckets
            (bucket, total_bets, wins, losses, pushes, actual_win_rate, calibration_error, updated_at)
        VALUES
            (:bucket, 1, :win, :loss, :push,
             CASE WHEN :win + :loss > 0
                  THEN CAST(:win AS DOUBLE PRECISION) / (:win + :loss) END,
             CASE WHEN :win + :loss > 0
                  THEN ABS(:bucket / 100.0 - CAST(:win AS DOUBLE PRECISION) / (:win + :loss)) END,
             NOW())
        ON CONFLICT (bucket) DO UPDATE SET
            total_bets        = calibration_buckets.total_bets + 1,
            wins              = calibration_buckets.wins   + :win,
            losses            = calibration_buckets.losses + :loss,
            pushes            = calibration_buckets.pushes + :push,
            actual_win_rate   = CASE WHEN calibration_buckets.wins + :win + calibration_buckets.losses + :loss > 0
                                     THEN CAST(calibration_buckets.wins + :win AS DOUBLE PRECISION)
                                          / (calibration_buckets.wins + :win + calibration_buckets.losses + :loss)
                                END,
            calibration_error = CASE WHEN calibration_buckets.wins + :win + calibration_buckets.losses + :loss > 0
                                     THEN ABS(:bucket / 100.0
                                          - CAST(calibration_buckets.wins + :win AS DOUBLE PRECISION)
                                          / (calibration_buckets.wins + :win + calibration_buckets.losses + :loss))
                                END,
            updated_at        = NOW()
        """)
    Mono<Void> recordSettlement(int bucket, int win, int loss, int push);
}
