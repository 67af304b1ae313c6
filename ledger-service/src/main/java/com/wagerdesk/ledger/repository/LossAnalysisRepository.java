package com.wagerdesk.ledger.repository;

import com.wagerdesk.ledger.model.LossAnalysis;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface LossAnalysisRepository extends ReactiveCrudRepository<LossAnalysis, Long> {

    @Query("SELECT * FROM loss_analysis ORDER BY created_at DESC LIMIT :limit")
    Flux<LossAnalysis> findRecent(int limit);
}
