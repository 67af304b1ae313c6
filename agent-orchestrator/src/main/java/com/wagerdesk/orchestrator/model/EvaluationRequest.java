package com.wagerdesk.orchestrator.model;

import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Direction;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One wager to evaluate.
 *
 * <p>For team markets {@code sideA} and {@code sideB} name the two teams. For player props
 * {@code sideA} names the player, {@code stat} the statistic and {@code sideB} (optional) the
 * opposing team.
 *
 * @param sideAHome  true when side A hosts the game; defaults to false (side B at home)
 * @param line       explicit line; overrides the quoted market line when present
 * @param direction  selection the caller is asking about; {@code null} lets the model pick
 * @param eventId    warehouse event id, needed for odds lookup and later settlement
 * @param seed       fixes the simulation seed for reproducible answers
 */
public record EvaluationRequest(
    @NotNull BetType betType,
    @NotBlank String sideA,
    String sideB,
    Boolean sideAHome,
    String stat,
    Double line,
    Direction direction,
    String eventId,
    LocalDate gameDate,
    Depth depth,
    Long seed
) {
    public EvaluationRequest {
        if (sideAHome == null) sideAHome = false;
        if (depth == null) depth = Depth.STANDARD;
    }

    public boolean isProp() {
        return betType == BetType.PLAYER_PROP;
    }

    /** Shape problems that make the request impossible to evaluate; empty when valid. */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (betType == null) problems.add("betType is required");
        if (sideA == null || sideA.isBlank()) problems.add("sideA is required");
        if (isProp() && (stat == null || stat.isBlank())) problems.add("stat is required for player props");
        if (betType != null && !isProp() && (sideB == null || sideB.isBlank())) {
            problems.add("sideB is required for " + betType);
        }
        if (direction != null && betType != null) {
            boolean totalLike = betType == BetType.TOTAL || isProp();
            if (totalLike != direction.isTotalSide()) {
                problems.add("direction " + direction + " does not apply to " + betType);
            }
        }
        return problems;
    }
}
