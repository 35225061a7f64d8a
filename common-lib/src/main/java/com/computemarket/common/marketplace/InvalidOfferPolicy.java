package com.computemarket.common.marketplace;

/**
 * What resolution does with offers whose price or declared performance is unusable.
 *
 * <ul>
 *   <li>{@link #EXCLUDE}   — dropped from the ranking (default).</li>
 *   <li>{@link #RANK_LAST} — kept after every valid offer, in submission order.</li>
 * </ul>
 */
public enum InvalidOfferPolicy {
    EXCLUDE,
    RANK_LAST
}
