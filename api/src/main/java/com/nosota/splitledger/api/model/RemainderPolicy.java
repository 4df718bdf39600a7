package com.nosota.splitledger.api.model;

/**
 * Chooses the single participant who absorbs the rounding remainder.
 *
 * <p>The remainder is never split: exactly one participant's rounded amount is adjusted.
 */
public enum RemainderPolicy {
    /**
     * Participant with the largest raw (pre-rounding) amount.
     * Ties resolve to the participant listed first.
     */
    LARGEST_SHARE,

    /**
     * The expense payer. The payer must be one of the participants.
     */
    PAYER,

    /**
     * First participant in iteration order.
     */
    FIRST_LISTED,

    /**
     * Pseudorandom pick from a seeded generator, reproducible for a given seed.
     */
    DETERMINISTIC
}
