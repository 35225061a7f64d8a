package com.computemarket.requestor.session;

/**
 * Lifecycle of a task's offer pool.
 *
 * <ul>
 *   <li>{@link #OPEN}     — accepting offers; the pool may hold offers.</li>
 *   <li>{@link #RESOLVED} — the last pool generation was ranked and drained.
 *       The next offer reopens the task.</li>
 * </ul>
 */
public enum TaskMarketState {
    OPEN,
    RESOLVED
}
