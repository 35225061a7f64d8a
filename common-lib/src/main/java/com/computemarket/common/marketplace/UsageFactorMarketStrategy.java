package com.computemarket.common.marketplace;

import com.computemarket.common.model.MarketStrategyType;
import com.computemarket.common.model.Offer;
import com.computemarket.common.model.UsageObservation;
import com.computemarket.common.model.UsageReport;
import com.computemarket.common.trace.MarketContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Usage-factor adjusted strategy: ranks offers by {@link PerformanceModel#effectivePrice}
 * using each provider's current factor from the {@link UsageLedger}, and feeds observed
 * subtask usage back into that ledger.
 *
 * <h3>Resolution</h3>
 * <ol>
 *   <li>Drain the task's pool atomically (later offers start a new generation).</li>
 *   <li>Score every valid offer with the factor current at this moment.</li>
 *   <li>Stable sort ascending by effective price; ties keep submission order.</li>
 *   <li>Append or drop invalid offers according to {@link InvalidOfferPolicy}.</li>
 * </ol>
 *
 * <h3>Feedback</h3>
 * Each observation replaces its provider's factor with
 * {@code observedUsage / getMyUsageBenchmark()}, at most once per subtask. Rankings already
 * returned are snapshots and are not revised.
 */
public class UsageFactorMarketStrategy implements RequestorMarketStrategy {

    private static final Logger log = LoggerFactory.getLogger(UsageFactorMarketStrategy.class);

    private static final Comparator<ScoredOffer> BY_EFFECTIVE_PRICE =
        Comparator.comparingDouble(ScoredOffer::effectivePrice);

    private final OfferPool pool;
    private final UsageLedger ledger;
    private final double usageBenchmark;
    private final InvalidOfferPolicy invalidOfferPolicy;

    public UsageFactorMarketStrategy(OfferPool pool, UsageLedger ledger,
                                     double usageBenchmark, InvalidOfferPolicy invalidOfferPolicy) {
        if (!PerformanceModel.isPositiveFinite(usageBenchmark)) {
            throw new IllegalArgumentException("usageBenchmark must be positive: " + usageBenchmark);
        }
        this.pool               = Objects.requireNonNull(pool, "pool");
        this.ledger             = Objects.requireNonNull(ledger, "ledger");
        this.usageBenchmark     = usageBenchmark;
        this.invalidOfferPolicy = Objects.requireNonNull(invalidOfferPolicy, "invalidOfferPolicy");
    }

    @Override
    public MarketStrategyType type() {
        return MarketStrategyType.USAGE_FACTOR;
    }

    @Override
    public void add(String taskId, Offer offer) {
        pool.add(taskId, offer);
        log.debug("Offer accepted & added to pool. taskId={} providerId={} price={} declaredPerformance={}",
                  taskId, offer.providerId(), offer.price(), offer.declaredPerformance());
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
        if (offers.isEmpty()) {
            return List.of();
        }

        List<ScoredOffer> ranked  = new ArrayList<>(offers.size());
        List<ScoredOffer> invalid = new ArrayList<>();
        for (Offer offer : offers) {
            double factor = ledger.getFactor(offer.providerId());
            if (PerformanceModel.isValid(offer)) {
                ranked.add(new ScoredOffer(offer, factor,
                    PerformanceModel.effectivePrice(offer, factor, usageBenchmark)));
                continue;
            }
            MarketContextUtil.withMdc(taskId, () ->
                log.warn("INVALID_OFFER taskId={} providerId={} price={} declaredPerformance={} policy={}",
                         taskId, offer.providerId(), offer.price(), offer.declaredPerformance(),
                         invalidOfferPolicy));
            if (invalidOfferPolicy == InvalidOfferPolicy.RANK_LAST) {
                invalid.add(new ScoredOffer(offer, factor, Double.POSITIVE_INFINITY));
            }
        }

        // List.sort is stable, so equal prices keep submission order
        ranked.sort(BY_EFFECTIVE_PRICE);
        ranked.addAll(invalid);

        ScoredOffer best = ranked.isEmpty() ? null : ranked.get(0);
        MarketContextUtil.withMdc(taskId, () ->
            log.info("OFFERS_RESOLVED taskId={} strategy={} pooled={} ranked={} bestProvider={} bestEffectivePrice={}",
                     taskId, type().id(), offers.size(), ranked.size(),
                     best != null ? best.offer().providerId() : "N/A",
                     best != null ? best.effectivePrice() : "N/A"));
        return List.copyOf(ranked);
    }

    @Override
    public void clearOffersForTask(String taskId) {
        pool.clear(taskId);
    }

    @Override
    public UsageReport reportSubtaskUsages(String taskId, List<UsageObservation> usages) {
        Objects.requireNonNull(taskId, "taskId");
        int applied = 0;
        int duplicates = 0;
        int rejected = 0;
        for (UsageObservation usage : usages) {
            UsageUpdate update = ledger.recordSubtaskUsage(
                taskId, usage.subtaskId(), usage.providerId(), usage.observedUsage(), usageBenchmark);
            switch (update) {
                case APPLIED   -> applied++;
                case DUPLICATE -> duplicates++;
                case REJECTED  -> rejected++;
            }
        }
        UsageReport report = new UsageReport(taskId, applied, duplicates, rejected);
        MarketContextUtil.withMdc(taskId, () ->
            log.info("USAGE_REPORTED taskId={} applied={} duplicates={} rejected={}",
                     taskId, report.applied(), report.duplicates(), report.rejected()));
        return report;
    }

    @Override
    public double getMyUsageBenchmark() {
        return usageBenchmark;
    }

    @Override
    public double getUsageFactor(String providerId, double usageBenchmark) {
        if (!PerformanceModel.isPositiveFinite(usageBenchmark)) {
            throw new IllegalArgumentException("usageBenchmark must be positive: " + usageBenchmark);
        }
        return ledger.getFactor(providerId);
    }

    /** The ledger backing this strategy; shared with callers that need a factor snapshot. */
    public UsageLedger ledger() {
        return ledger;
    }

    @Override
    public void reset() {
        pool.reset();
        ledger.reset();
    }
}
