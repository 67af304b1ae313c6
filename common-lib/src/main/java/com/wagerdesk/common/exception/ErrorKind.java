package com.wagerdesk.common.exception;

/**
 * Non-fatal error classes surfaced on evaluation and settlement results.
 */
public enum ErrorKind {
    /** No usable context after the retry budget. Terminal for the request. */
    DATA_UNAVAILABLE,
    /** Fewer games than the sample threshold. Lowers confidence only. */
    INSUFFICIENT_SAMPLE,
    /** No line in the request or the market. Recommendation becomes NEED_LINE. */
    NO_LINE_PROVIDED,
    /** Realized result missing or ambiguous. The wager stays pending for the next pass. */
    SETTLEMENT_UNRESOLVABLE
}
