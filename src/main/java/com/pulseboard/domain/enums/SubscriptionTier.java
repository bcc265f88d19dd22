package com.pulseboard.domain.enums;

/**
 * Update-frequency tier of a live subscription.
 *
 * <p>FAST keys receive every update immediately; SLOW keys receive throttled updates.
 * A key is held by at most one tier at a time.
 */
public enum SubscriptionTier {
    /** Immediate, high-frequency updates for rows on screen (plus a small margin). */
    FAST,

    /** Throttled background updates for rendered rows. */
    SLOW
}
