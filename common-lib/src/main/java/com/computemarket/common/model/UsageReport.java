package com.computemarket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one usage report batch for a task.
 *
 * <ul>
 *   <li>{@code applied}    – observations that replaced a provider's usage factor.</li>
 *   <li>{@code duplicates} – observations for subtasks already reported; ignored.</li>
 *   <li>{@code rejected}   – degenerate observations; prior factor retained.</li>
 * </ul>
 */
public record UsageReport(
    @JsonProperty("taskId")     String taskId,
    @JsonProperty("applied")    int applied,
    @JsonProperty("duplicates") int duplicates,
    @JsonProperty("rejected")   int rejected
) {
    public static UsageReport empty(String taskId) {
        return new UsageReport(taskId, 0, 0, 0);
    }

    public int total() {
        return applied + duplicates + rejected;
    }
}
