package com.computemarket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A single provider's bid for a task.
 *
 * <ul>
 *   <li>{@code providerId}  – stable identifier of the computing node.</li>
 *   <li>{@code price}       – requested payment per unit of the node's declared benchmark.</li>
 *   <li>{@code performance} – declared throughput, see {@link ProviderPerformance}.</li>
 *   <li>{@code quality}     – auxiliary trust-ranking scores; empty when not supplied.</li>
 *   <li>{@code reputation}  – auxiliary reputation score; {@code 0.0} when not supplied.</li>
 * </ul>
 *
 * <p>Structurally malformed offers (no provider, no performance) are refused here, at the
 * deserialization boundary. Numeric validity of price and performance is judged later by
 * {@link com.computemarket.common.marketplace.PerformanceModel#isValid(Offer)}.
 */
public record Offer(
    @JsonProperty("providerId")  String providerId,
    @JsonProperty("price")       double price,
    @JsonProperty("performance") ProviderPerformance performance,
    @JsonProperty("quality")     List<Double> quality,
    @JsonProperty("reputation")  double reputation
) {
    public Offer {
        Objects.requireNonNull(performance, "performance");
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("providerId must not be blank");
        }
        quality = quality == null ? List.of() : List.copyOf(quality);
    }

    public static Offer of(String providerId, double price, double usageBenchmark) {
        return new Offer(providerId, price, new ProviderPerformance(usageBenchmark), List.of(), 0.0);
    }

    /** Shortcut for {@code performance().usageBenchmark()}. */
    public double declaredPerformance() {
        return performance.usageBenchmark();
    }
}
