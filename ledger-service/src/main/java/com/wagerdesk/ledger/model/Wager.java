package com.wagerdesk.ledger.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One recorded recommendation. Created with {@code outcome = null}; settlement sets
 * outcome, actualValue, profit and settledAt exactly once. Rows are never deleted.
 *
 * <p>actualValue is the realized metric the line was compared to: the combined score for
 * totals, side A's margin for spreads and moneylines, the stat value for props.
 */
@Data
@NoArgsConstructor
@Table("wagers")
public class Wager {

    @Id
    private Long id;

    private String eventId;
    private String traceId;
    private String betType;
    private String direction;
    private String selection;

    /** Team whose margin settles a spread, or player whose stat settles a prop. */
    private String entityId;
    private String stat;

    private double line;
    private double odds;
    private double confidence;
    private double predictedEdge;
    private double stake;
    private String depth;

    /** Debate verdict at decision time, kept as a column so pattern analysis never parses JSON. */
    private String debateWinner;

    /** True when rest or schedule density moved the projection by a point or more. */
    private boolean restFactor;

    /** JSON: projection, simulation and debate scores. */
    private String reasoningTrace;
    /** JSON array of supporting arguments. */
    private String supportingArguments;
    /** JSON array of opposing arguments. */
    private String opposingArguments;
    /** JSON array of learning rule ids applied to the confidence. */
    private String appliedRules;

    private String outcome;
    private Double actualValue;
    private Double profit;

    private LocalDateTime createdAt;
    private LocalDateTime settledAt;

    public boolean isSettled() {
        return outcome != null;
    }
}
