package com.computemarket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource consumption measured by the execution layer for one completed subtask
 * (e.g. elapsed compute time), attributed to the provider that computed it.
 */
public record UsageObservation(
    @JsonProperty("providerId")    String providerId,
    @JsonProperty("subtaskId")     String subtaskId,
    @JsonProperty("observedUsage") double observedUsage
) {
    public static UsageObservation of(String providerId, String subtaskId, double observedUsage) {
        return new UsageObservation(providerId, subtaskId, observedUsage);
    }
}
