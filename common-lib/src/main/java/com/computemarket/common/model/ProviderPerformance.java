package com.computemarket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Self-reported throughput of a computing node.
 *
 * <p>{@code usageBenchmark} is expressed in benchmark units completed per unit of the
 * requestor's reference usage benchmark. It is supplied by the provider and is not trusted
 * until observed usage has been reported for that provider.
 */
public record ProviderPerformance(
    @JsonProperty("usageBenchmark") double usageBenchmark
) {}
