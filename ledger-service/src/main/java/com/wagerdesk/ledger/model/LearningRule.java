package com.wagerdesk.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A confidence adjustment applied by the orchestrator when its condition holds.
 *
 * <p>{@code conditionType} names a {@link com.wagerdesk.common.ledger.RuleCondition};
 * {@code condition} is that condition's parameter. Rules are deactivated, never deleted.
 */
@Data
@NoArgsConstructor
@Table("learning_rules")
public class LearningRule {

    @Id
    private Long id;

    private String condition;
    private String conditionType;

    /** {@code null} applies to every bet type. */
    private String betType;

    private double adjustment;
    private String evidence;

    /** Threshold-table pattern (or seed name) that produced the rule. */
    private String pattern;
    private String thresholdVersion;

    private int sampleSize;
    private Double winRateBefore;
    private int triggerCount;
    private boolean active;

    private LocalDateTime createdAt;
    private LocalDateTime lastAppliedAt;
}
