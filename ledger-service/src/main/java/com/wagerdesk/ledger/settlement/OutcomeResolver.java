package com.wagerdesk.ledger.settlement;

import com.wagerdesk.common.model.BetType;
import com.wagerdesk.common.model.Direction;
import com.wagerdesk.common.model.GameResult;
import com.wagerdesk.ledger.model.Outcome;
import com.wagerdesk.ledger.model.Wager;

import java.util.Optional;

/**
 * Decides WIN/LOSS/PUSH by comparing the realized value against the recorded line and
 * direction. Never consults the original projection.
 *
 * <ul>
 *   <li>Totals: combined score vs. line.</li>
 *   <li>Spreads and moneylines: side A's margin plus side A's handicap; a positive value means
 *       side A covered. {@code SIDE_B} takes the other side.</li>
 *   <li>Player props: the player's stat vs. line.</li>
 * </ul>
 * An exact tie with the line is a push.
 */
public final class OutcomeResolver {

    public static final int MIN_BUCKET = 40;
    public static final int MAX_BUCKET = 80;

    private OutcomeResolver() {}

    /**
     * @return empty when the result does not carry what this wager needs (team absent from the
     *         event, stat not recorded) or the wager's bet type or direction cannot be read
     */
    public static Optional<Settlement> resolve(Wager wager, GameResult result) {
        Optional<BetType> betType = parse(BetType.class, wager.getBetType());
        Optional<Direction> direction = parse(Direction.class, wager.getDirection());
        if (betType.isEmpty() || direction.isEmpty()) return Optional.empty();

        switch (betType.get()) {
            case TOTAL:
                return overUnder(wager, direction.get(), result.total());
            case PLAYER_PROP: {
                Double stat = result.statFor(wager.getEntityId(), wager.getStat());
                return stat == null ? Optional.empty() : overUnder(wager, direction.get(), stat);
            }
            case SPREAD:
            case MONEYLINE: {
                Double margin = result.marginFor(wager.getEntityId());
                return margin == null ? Optional.empty() : cover(wager, direction.get(), margin);
            }
            default:
                return Optional.empty();
        }
    }

    private static Optional<Settlement> overUnder(Wager wager, Direction direction, double actual) {
        if (!direction.isTotalSide()) return Optional.empty();
        double diff = actual - wager.getLine();
        Outcome outcome = diff == 0.0 ? Outcome.PUSH
            : (diff > 0) == (direction == Direction.OVER) ? Outcome.WIN : Outcome.LOSS;
        return Optional.of(new Settlement(outcome, actual, Math.abs(diff), profit(outcome, wager.getOdds())));
    }

    private static Optional<Settlement> cover(Wager wager, Direction direction, double marginA) {
        if (direction.isTotalSide()) return Optional.empty();
        double coverA = marginA + wager.getLine();
        Outcome outcome = coverA == 0.0 ? Outcome.PUSH
            : (coverA > 0) == (direction == Direction.SIDE_A) ? Outcome.WIN : Outcome.LOSS;
        return Optional.of(new Settlement(outcome, marginA, Math.abs(coverA), profit(outcome, wager.getOdds())));
    }

    static double profit(Outcome outcome, double odds) {
        double raw = switch (outcome) {
            case WIN  -> odds - 1.0;
            case LOSS -> -1.0;
            case PUSH -> 0.0;
        };
        return Math.round(raw * 10_000.0) / 10_000.0;
    }

    /**
     * Calibration bucket for a confidence: nearest ten percent, clamped to 40..80.
     * Halves round up, so 0.65 lands in 70.
     */
    public static int bucketFor(double confidence) {
        int bucket = (int) Math.round(confidence * 10.0) * 10;
        return Math.max(MIN_BUCKET, Math.min(MAX_BUCKET, bucket));
    }

    private static <E extends Enum<E>> Optional<E> parse(Class<E> type, String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(Enum.valueOf(type, name));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
