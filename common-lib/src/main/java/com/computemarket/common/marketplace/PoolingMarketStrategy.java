package com.computemarket.common.marketplace;

import com.computemarket.common.model.MarketStrategyType;
import com.computemarket.common.model.Offer;
import com.computemarket.common.model.UsageObservation;
import com.computemarket.common.model.UsageReport;
import com.computemarket.common.trace.MarketContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pooling-only strategy: offers are returned in submission order and usage reports do not
 * influence later resolutions. Every provider keeps the neutral factor.
 */
public class PoolingMarketStrategy implements RequestorMarketStrategy {

    private static final Logger log = LoggerFactory.getLogger(PoolingMarketStrategy.class);

    private final OfferPool pool;
    private final double usageBenchmark;
    private final InvalidOfferPolicy invalidOfferPolicy;

    public PoolingMarketStrategy(OfferPool pool, double usageBenchmark, InvalidOfferPolicy invalidOfferPolicy) {
        if (!PerformanceModel.isPositiveFinite(usageBenchmark)) {
            throw new IllegalArgumentException("usageBenchmark must be positive: " + usageBenchmark);
        }
        this.pool               = Objects.requireNonNull(pool, "pool");
        this.usageBenchmark     = usageBenchmark;
        this.invalidOfferPolicy = Objects.requireNonNull(invalidOfferPolicy, "invalidOfferPolicy");
    }

    @Override
    public MarketStrategyType type() {
        return MarketStrategyType.POOLING;
    }

    @Override
    public void add(String taskId, Offer offer) {
        pool.add(taskId, offer);
        log.debug("Offer accepted & added to pool. taskId={} providerId={} price={}",
                  taskId, offer.providerId(), offer.price());
    }

    @Override
    public int getTaskOfferCount(String taskId) {
        return pool.count(taskId);
    }

    @Override
    public List<Offer> resolveTaskOffers(String taskId) {
        return resolveScoredTaskOffers(taskId).stream().map(ScoredOffer::offer).toList();
    }

    @Override
    public List<ScoredOffer> resolveScoredTaskOffers(String taskId) {
        List<Offer> offers = pool.drain(taskId);
        List<ScoredOffer> valid   = new ArrayList<>(offers.size());
        List<ScoredOffer> invalid = new ArrayList<>();
        for (Offer offer : offers) {
            if (PerformanceModel.isValid(offer)) {
                valid.add(new ScoredOffer(offer, UsageLedger.NEUTRAL_FACTOR,
                    PerformanceModel.effectivePrice(offer, UsageLedger.NEUTRAL_FACTOR, usageBenchmark)));
            } else {
                MarketContextUtil.withMdc(taskId, () ->
                    log.warn("INVALID_OFFER taskId={} providerId={} price={} declaredPerformance={} policy={}",
                             taskId, offer.providerId(), offer.price(), offer.declaredPerformance(),
                             invalidOfferPolicy));
                if (invalidOfferPolicy == InvalidOfferPolicy.RANK_LAST) {
                    invalid.add(new ScoredOffer(offer, UsageLedger.NEUTRAL_FACTOR, Double.POSITIVE_INFINITY));
                }
            }
        }
        valid.addAll(invalid);
        MarketContextUtil.withMdc(taskId, () ->
            log.info("OFFERS_RESOLVED taskId={} strategy={} pooled={} ranked={}",
                     taskId, type().id(), offers.size(), valid.size()));
        return List.copyOf(valid);
    }

    @Override
    public void clearOffersForTask(String taskId) {
        pool.clear(taskId);
    }

    @Override
    public UsageReport reportSubtaskUsages(String taskId, List<UsageObservation> usages) {
        log.debug("Usage report ignored by pooling strategy. taskId={} observations={}",
                  taskId, usages.size());
        return UsageReport.empty(taskId);
    }

    @Override
    public double getMyUsageBenchmark() {
        return usageBenchmark;
    }

    @Override
    public double getUsageFactor(String providerId, double usageBenchmark) {
        Objects.requireNonNull(providerId, "providerId");
        if (!PerformanceModel.isPositiveFinite(usageBenchmark)) {
            throw new IllegalArgumentException("usageBenchmark must be positive: " + usageBenchmark);
        }
        return UsageLedger.NEUTRAL_FACTOR;
    }

    @Override
    public void reset() {
        pool.reset();
    }
}
