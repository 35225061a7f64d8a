package com.computemarket.common.marketplace;

import com.computemarket.common.model.MarketStrategyType;
import com.computemarket.common.model.Offer;
import com.computemarket.common.model.UsageObservation;
import com.computemarket.common.model.UsageReport;

import java.util.List;

/**
 * Requestor-side market contract used by task dispatch to pool, rank and select offers.
 *
 * <p>Per task the pool moves {@code absent → Open → Resolved → absent}: offers open it,
 * {@link #resolveTaskOffers(String)} ranks and drains it, and a later offer reopens it.
 *
 * <p>Implementations must be safe for concurrent callers: offers and usage reports arrive
 * from network threads while dispatch resolves. None of the operations perform I/O.
 *
 * <p>Current implementations:
 * <ul>
 *   <li>{@link PoolingMarketStrategy}     — submission order, no usage feedback</li>
 *   <li>{@link UsageFactorMarketStrategy} — effective-price ranking with usage feedback</li>
 * </ul>
 * Selected per task through {@link MarketStrategyRegistry}.
 */
public interface RequestorMarketStrategy {

    MarketStrategyType type();

    /** Pools {@code offer} for {@code taskId}. Never rejects; validity is judged at resolution. */
    void add(String taskId, Offer offer);

    /** Pooled-offer count; {@code 0} for an unknown task. */
    int getTaskOfferCount(String taskId);

    /**
     * Ranks the task's pooled offers, best first, and clears the pool in the same step.
     * An unknown or already resolved task yields an empty list.
     */
    List<Offer> resolveTaskOffers(String taskId);

    /** Like {@link #resolveTaskOffers(String)} but keeps the scores used for the ranking. */
    List<ScoredOffer> resolveScoredTaskOffers(String taskId);

    /** Drops the task's pooled offers without ranking them. */
    void clearOffersForTask(String taskId);

    /**
     * Feeds observed subtask usage back into provider trust. Affects only rankings computed
     * after this call. Degenerate and duplicate observations are counted, never thrown.
     */
    UsageReport reportSubtaskUsages(String taskId, List<UsageObservation> usages);

    /** The requestor's reference usage benchmark. */
    double getMyUsageBenchmark();

    /**
     * Current trust factor of {@code providerId}; {@code 1.0} when it has no history.
     *
     * <p>The factor is dimensionless, so it does not scale with {@code usageBenchmark};
     * the argument identifies the benchmark the caller prices against and must be positive.
     *
     * @throws IllegalArgumentException if {@code usageBenchmark} is not strictly positive
     */
    double getUsageFactor(String providerId, double usageBenchmark);

    /** Clears all pooled offers and trust state. Full reinitialization only. */
    void reset();
}
