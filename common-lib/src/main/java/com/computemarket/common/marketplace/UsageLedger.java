package com.computemarket.common.marketplace;

import com.computemarket.common.trace.MarketContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider usage factors derived from observed resource consumption.
 *
 * <p><b>Update rule</b> (replace, never average):
 * <pre>
 *   factor' = observedUsage / referenceUsage
 * </pre>
 * The most recent observation is taken as the best estimate of current provider behaviour.
 * Observations where either value is non-positive or non-finite are rejected and the prior
 * factor is kept, so a stored factor is always finite and strictly positive.
 *
 * <p>Providers without history report {@value #NEUTRAL_FACTOR}.
 *
 * <p>Reads are lock-free lookups on a {@link ConcurrentHashMap}. Writes, including the
 * per-subtask idempotence check, are serialized on a single ledger lock.
 */
public class UsageLedger {

    private static final Logger log = LoggerFactory.getLogger(UsageLedger.class);

    public static final double NEUTRAL_FACTOR = 1.0;

    private final ConcurrentHashMap<String, Double> factors = new ConcurrentHashMap<>();

    /** taskId → subtask ids whose usage has already been applied. */
    private final ConcurrentHashMap<String, Set<String>> reportedSubtasks = new ConcurrentHashMap<>();

    private final Object writeLock = new Object();

    /** Current factor for the provider, or {@value #NEUTRAL_FACTOR} if never observed. */
    public double getFactor(String providerId) {
        Double factor = factors.get(Objects.requireNonNull(providerId, "providerId"));
        return factor == null ? NEUTRAL_FACTOR : factor;
    }

    public boolean hasHistory(String providerId) {
        return factors.containsKey(Objects.requireNonNull(providerId, "providerId"));
    }

    /**
     * Replaces the provider's factor with {@code observedUsage / referenceUsage}.
     *
     * @return {@code true} if the factor was replaced; {@code false} if the observation was rejected
     */
    public boolean recordUsage(String providerId, double observedUsage, double referenceUsage) {
        Objects.requireNonNull(providerId, "providerId");
        double factor = ratio(observedUsage, referenceUsage);
        if (Double.isNaN(factor)) {
            log.warn("USAGE_REJECTED providerId={} observedUsage={} referenceUsage={}",
                     providerId, observedUsage, referenceUsage);
            return false;
        }
        synchronized (writeLock) {
            store(providerId, factor);
        }
        return true;
    }

    /**
     * Applies the usage of one subtask at most once.
     *
     * <p>A rejected observation does not mark the subtask as reported, so a corrected
     * observation for the same subtask can still be applied later.
     */
    public UsageUpdate recordSubtaskUsage(String taskId, String subtaskId, String providerId,
                                          double observedUsage, double referenceUsage) {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(subtaskId, "subtaskId");
        Objects.requireNonNull(providerId, "providerId");

        double factor = ratio(observedUsage, referenceUsage);
        synchronized (writeLock) {
            Set<String> reported = reportedSubtasks.get(taskId);
            if (reported != null && reported.contains(subtaskId)) {
                MarketContextUtil.withMdc(taskId, () ->
                    log.debug("USAGE_DUPLICATE taskId={} subtaskId={} providerId={}",
                              taskId, subtaskId, providerId));
                return UsageUpdate.DUPLICATE;
            }
            if (Double.isNaN(factor)) {
                MarketContextUtil.withMdc(taskId, () ->
                    log.warn("USAGE_REJECTED taskId={} subtaskId={} providerId={} observedUsage={} referenceUsage={}",
                             taskId, subtaskId, providerId, observedUsage, referenceUsage));
                return UsageUpdate.REJECTED;
            }
            reportedSubtasks.computeIfAbsent(taskId, id -> ConcurrentHashMap.newKeySet()).add(subtaskId);
            store(providerId, factor);
            return UsageUpdate.APPLIED;
        }
    }

    /** Releases the idempotence keys held for a finished task. */
    public void forgetTask(String taskId) {
        synchronized (writeLock) {
            reportedSubtasks.remove(Objects.requireNonNull(taskId, "taskId"));
        }
    }

    /** Immutable copy of all recorded factors keyed by provider id. */
    public Map<String, Double> snapshot() {
        return Map.copyOf(factors);
    }

    /** Clears all factors and idempotence keys. Process reinitialization only. */
    public void reset() {
        synchronized (writeLock) {
            factors.clear();
            reportedSubtasks.clear();
        }
    }

    // ── internals ───────────────────────────────────────────────────────────

    private void store(String providerId, double factor) {
        Double previous = factors.put(providerId, factor);
        log.info("USAGE_FACTOR_UPDATED providerId={} previous={} factor={}",
                 providerId, previous != null ? previous : NEUTRAL_FACTOR, factor);
    }

    /** Returns NaN for any observation that cannot yield a finite, positive factor. */
    private static double ratio(double observedUsage, double referenceUsage) {
        if (!(observedUsage > 0.0) || !(referenceUsage > 0.0)
                || Double.isInfinite(observedUsage) || Double.isInfinite(referenceUsage)) {
            return Double.NaN;
        }
        double factor = observedUsage / referenceUsage;
        return (factor > 0.0 && Double.isFinite(factor)) ? factor : Double.NaN;
    }
}
