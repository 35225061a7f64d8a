package com.computemarket.requestor.config;

import com.computemarket.common.exception.MarketplaceException;
import com.computemarket.common.marketplace.InvalidOfferPolicy;
import com.computemarket.common.marketplace.MarketStrategyRegistry;
import com.computemarket.common.marketplace.OfferPool;
import com.computemarket.common.marketplace.PoolingMarketStrategy;
import com.computemarket.common.marketplace.RequestorMarketStrategy;
import com.computemarket.common.marketplace.UsageFactorMarketStrategy;
import com.computemarket.common.marketplace.UsageLedger;
import com.computemarket.common.model.MarketStrategyType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class MarketplaceConfig {

    @Value("${marketplace.usage-benchmark:1.0}")
    private double usageBenchmark;

    @Value("${marketplace.default-strategy:usage-factor}")
    private String defaultStrategy;

    @Value("${marketplace.invalid-offer-policy:EXCLUDE}")
    private InvalidOfferPolicy invalidOfferPolicy;

    @Bean
    public UsageLedger usageLedger() {
        return new UsageLedger();
    }

    @Bean
    public PoolingMarketStrategy poolingMarketStrategy() {
        return new PoolingMarketStrategy(new OfferPool(), checkedUsageBenchmark(), invalidOfferPolicy);
    }

    @Bean
    public UsageFactorMarketStrategy usageFactorMarketStrategy(UsageLedger usageLedger) {
        return new UsageFactorMarketStrategy(new OfferPool(), usageLedger, checkedUsageBenchmark(), invalidOfferPolicy);
    }

    @Bean
    public MarketStrategyRegistry marketStrategyRegistry(List<RequestorMarketStrategy> strategies) {
        MarketStrategyType type = MarketStrategyType.fromId(defaultStrategy);
        if (type == null) {
            throw MarketplaceException.configuration("marketplace.default-strategy",
                "Unknown market strategy: " + defaultStrategy);
        }
        return new MarketStrategyRegistry(strategies, type);
    }

    private double checkedUsageBenchmark() {
        if (!(usageBenchmark > 0.0) || Double.isInfinite(usageBenchmark)) {
            throw MarketplaceException.configuration("marketplace.usage-benchmark",
                "Usage benchmark must be a positive number: " + usageBenchmark);
        }
        return usageBenchmark;
    }
}
