package com.wagerdesk.common.ledger;

import com.wagerdesk.common.debate.DebateResult;
import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.Projection;
import com.wagerdesk.common.simulation.SimulationResult;

import java.util.List;

/**
 * A recommendation handed to the ledger for persistence.
 *
 * @param entityId     team whose margin settles a spread, or player whose stat settles a prop
 * @param selection    human-readable selection, e.g. {@code "OVER 220.5"}
 * @param confidence   judge confidence in [0, 1] at decision time
 * @param predictedEdge edge of the selection after penalties
 * @param appliedRules ids of learning rules that moved the confidence
 */
public record WagerTicket(
    String eventId,
    String traceId,
    BetType betType,
    Direction direction,
    String selection,
    String entityId,
    String stat,
    double line,
    double odds,
    double confidence,
    double predictedEdge,
    double stake,
    String depth,
    Projection projection,
    SimulationResult simulation,
    DebateResult debate,
    List<Long> appliedRules
) {
    public WagerTicket {
        appliedRules = appliedRules == null ? List.of() : List.copyOf(appliedRules);
    }
}
