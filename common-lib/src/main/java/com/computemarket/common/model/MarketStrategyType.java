package com.computemarket.common.model;

import java.util.Locale;
import java.util.Map;

/**
 * Market strategy a task declares at creation time.
 * Resolved to an implementation by
 * {@link com.computemarket.common.marketplace.MarketStrategyRegistry}.
 */
public enum MarketStrategyType {
    POOLING("pooling"),
    USAGE_FACTOR("usage-factor");

    private static final Map<String, MarketStrategyType> BY_ID = Map.of(
        "pooling",      POOLING,
        "usage-factor", USAGE_FACTOR
    );

    private final String id;

    MarketStrategyType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a declared strategy identifier.
     * Returns null for unrecognized identifiers.
     */
    public static MarketStrategyType fromId(String id) {
        return id == null ? null : BY_ID.get(id.trim().toLowerCase(Locale.ROOT));
    }
}
