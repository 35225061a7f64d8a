package com.computemarket.requestor.session;

import com.computemarket.common.model.MarketStrategyType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Requestor-side bookkeeping for one task's market: which strategy it declared at creation
 * time and where its offer pool is in the {@link TaskMarketState} lifecycle.
 *
 * <p>Mutated only inside {@code RequestorMarketService}'s per-task critical section;
 * callers receive copies.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskMarketSession {

    private String taskId;

    private MarketStrategyType strategyType;

    private TaskMarketState state;

    private long offersReceived;

    private long resolutions;

    private Instant openedAt;

    private Instant lastResolvedAt;

    public static TaskMarketSession open(String taskId, MarketStrategyType strategyType) {
        return new TaskMarketSession(taskId, strategyType, TaskMarketState.OPEN, 0L, 0L, Instant.now(), null);
    }

    public TaskMarketSession copy() {
        return new TaskMarketSession(taskId, strategyType, state, offersReceived, resolutions,
                                     openedAt, lastResolvedAt);
    }
}
