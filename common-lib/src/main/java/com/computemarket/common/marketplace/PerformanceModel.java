package com.computemarket.common.marketplace;

import com.computemarket.common.model.Offer;

/**
 * Stateless calculator that turns an offer's self-reported price and throughput into a
 * single comparable cost figure.
 *
 * <p><b>Formula</b>:
 * <pre>
 *   trustedPerformance = declaredPerformance / usageFactor
 *   effectivePrice     = price / trustedPerformance × requestorBenchmark
 * </pre>
 * Lower is better. A provider whose factor shows it consumes more than its declared
 * benchmark implied becomes proportionally more expensive, whatever it claims.
 * With the default requestor benchmark of {@code 1.0} the last term is neutral.
 *
 * <p>An offer is usable only when price and declared performance are finite and strictly
 * positive. Callers must check {@link #isValid(Offer)} before ranking.
 */
public final class PerformanceModel {

    private PerformanceModel() {}

    /**
     * @return {@code true} when the offer's price and declared performance can be ranked
     */
    public static boolean isValid(Offer offer) {
        return isPositiveFinite(offer.price()) && isPositiveFinite(offer.declaredPerformance());
    }

    /**
     * Computes the effective price of {@code offer}.
     *
     * @param offer              a valid offer, see {@link #isValid(Offer)}
     * @param usageFactor        the provider's current usage factor (strictly positive)
     * @param requestorBenchmark the requestor's reference usage benchmark (strictly positive)
     * @return effective price per unit of trusted throughput
     * @throws IllegalArgumentException on any non-positive or non-finite input
     */
    public static double effectivePrice(Offer offer, double usageFactor, double requestorBenchmark) {
        if (!isValid(offer)) {
            throw new IllegalArgumentException("Offer is not rankable: provider=" + offer.providerId()
                + " price=" + offer.price() + " declaredPerformance=" + offer.declaredPerformance());
        }
        if (!isPositiveFinite(usageFactor)) {
            throw new IllegalArgumentException("usageFactor must be positive: " + usageFactor);
        }
        if (!isPositiveFinite(requestorBenchmark)) {
            throw new IllegalArgumentException("requestorBenchmark must be positive: " + requestorBenchmark);
        }
        double trustedPerformance = offer.declaredPerformance() / usageFactor;
        return offer.price() / trustedPerformance * requestorBenchmark;
    }

    static boolean isPositiveFinite(double value) {
        return value > 0.0 && Double.isFinite(value);
    }
}
