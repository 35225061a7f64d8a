package com.computemarket.requestor.collector;

import com.computemarket.common.marketplace.ScoredOffer;
import com.computemarket.common.model.Offer;

import java.time.Instant;
import java.util.List;

/**
 * A non-empty ranking published by {@link OfferCollector}, best offer first.
 * The ranking is a snapshot; later usage reports do not revise it.
 */
public record ResolvedTaskOffers(
    String taskId,
    ResolutionTrigger trigger,
    List<ScoredOffer> ranking,
    Instant resolvedAt
) {
    public List<Offer> offers() {
        return ranking.stream().map(ScoredOffer::offer).toList();
    }

    public Offer best() {
        return ranking.get(0).offer();
    }
}
