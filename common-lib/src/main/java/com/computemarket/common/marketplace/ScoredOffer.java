package com.computemarket.common.marketplace;

import com.computemarket.common.model.Offer;

/**
 * An offer paired with the effective price it was ranked by.
 *
 * <p>{@code usageFactor} is the provider's factor at the moment of resolution.
 * Invalid offers kept under {@link InvalidOfferPolicy#RANK_LAST} carry
 * {@link Double#POSITIVE_INFINITY} as their effective price.
 */
public record ScoredOffer(
    Offer  offer,
    double usageFactor,
    double effectivePrice
) {
    public boolean valid() {
        return Double.isFinite(effectivePrice);
    }
}
