package com.computemarket.common.marketplace;

import com.computemarket.common.exception.MarketplaceException;
import com.computemarket.common.model.MarketStrategyType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a task's declared {@link MarketStrategyType} to the strategy instance that serves it.
 *
 * <p>Pure dispatch. The registry is built once at node start-up and is immutable afterwards,
 * so lookups need no synchronization.
 */
public final class MarketStrategyRegistry {

    private final Map<MarketStrategyType, RequestorMarketStrategy> strategies;
    private final MarketStrategyType defaultType;

    public MarketStrategyRegistry(List<RequestorMarketStrategy> strategies, MarketStrategyType defaultType) {
        Objects.requireNonNull(defaultType, "defaultType");
        Map<MarketStrategyType, RequestorMarketStrategy> byType = new EnumMap<>(MarketStrategyType.class);
        for (RequestorMarketStrategy strategy : strategies) {
            if (byType.putIfAbsent(strategy.type(), strategy) != null) {
                throw MarketplaceException.strategy(strategy.type().id(), "Duplicate market strategy registration");
            }
        }
        if (!byType.containsKey(defaultType)) {
            throw MarketplaceException.strategy(defaultType.id(), "Default market strategy is not registered");
        }
        this.strategies  = Collections.unmodifiableMap(byType);
        this.defaultType = defaultType;
    }

    /**
     * @throws MarketplaceException if no strategy is registered for {@code type}
     */
    public RequestorMarketStrategy get(MarketStrategyType type) {
        RequestorMarketStrategy strategy = strategies.get(Objects.requireNonNull(type, "type"));
        if (strategy == null) {
            throw MarketplaceException.strategy(type.id(), "No market strategy registered");
        }
        return strategy;
    }

    /**
     * Resolves a declared strategy identifier such as {@code "usage-factor"}.
     *
     * @throws MarketplaceException for an unknown or unregistered identifier
     */
    public RequestorMarketStrategy get(String strategyId) {
        MarketStrategyType type = MarketStrategyType.fromId(strategyId);
        if (type == null) {
            throw MarketplaceException.strategy(String.valueOf(strategyId), "Unknown market strategy");
        }
        return get(type);
    }

    public RequestorMarketStrategy defaultStrategy() {
        return strategies.get(defaultType);
    }

    public MarketStrategyType defaultType() {
        return defaultType;
    }

    public Collection<RequestorMarketStrategy> all() {
        return strategies.values();
    }

    /** Resets every registered strategy. Full reinitialization only. */
    public void resetAll() {
        strategies.values().forEach(RequestorMarketStrategy::reset);
    }
}
