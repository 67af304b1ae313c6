package com.wagerdesk.ledger.service;

import com.wagerdesk.common.ledger.RuleAdjustment;
import com.wagerdesk.ledger.model.LearningRule;
import com.wagerdesk.ledger.repository.LearningRuleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final LearningRuleRepository repository;

    public RuleService(LearningRuleRepository repository) {
        this.repository = repository;
    }

    /**
     * Active rules as the orchestrator applies them. A {@code null} bet type returns every active rule.
     */
    public Flux<RuleAdjustment> activeRules(String betType) {
        Flux<LearningRule> rules = betType == null || betType.isBlank()
            ? repository.findAllActive()
            : repository.findActive(betType);
        return rules.map(RuleService::toAdjustment);
    }

    /**
     * @return false when no active rule has this id
     */
    public Mono<Boolean> deactivate(long ruleId) {
        return repository.deactivate(ruleId)
            .map(rows -> rows > 0)
            .doOnNext(done -> {
                if (done) log.info("[Rules] Rule deactivated. ruleId={}", ruleId);
                else log.info("[Rules] Deactivate ignored, no active rule. ruleId={}", ruleId);
            });
    }

    /**
     * @return false when no rule has this id
     */
    public Mono<Boolean> recordTrigger(long ruleId) {
        return repository.recordTrigger(ruleId)
            .map(rows -> rows > 0)
            .doOnNext(done -> log.debug("[Rules] Trigger recorded. ruleId={} found={}", ruleId, done));
    }

    static RuleAdjustment toAdjustment(LearningRule rule) {
        return new RuleAdjustment(rule.getId(), rule.getCondition(), rule.getConditionType(),
                                  rule.getBetType(), rule.getAdjustment());
    }
}
