package com.wagerdesk.ledger.settlement;

/**
 * What one settlement attempt did to a wager.
 */
public enum SettlementStatus {
    /** Outcome written and calibration bucket updated. */
    SETTLED,
    /** Another pass settled the wager first; nothing was written. */
    ALREADY_SETTLED,
    /** Result missing, incomplete or ambiguous; the wager stays pending. */
    UNRESOLVABLE,
    /** Unexpected error; the wager stays pending. */
    FAILED
}
