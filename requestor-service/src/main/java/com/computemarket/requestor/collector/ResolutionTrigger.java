package com.computemarket.requestor.collector;

/**
 * Why a task's pool was resolved.
 *
 * <ul>
 *   <li>{@link #QUOTA}    — the pool reached the configured offer quota.</li>
 *   <li>{@link #WINDOW}   — the collection window elapsed after the generation's first offer.</li>
 *   <li>{@link #DISPATCH} — task dispatch asked for a ranking directly.</li>
 * </ul>
 */
public enum ResolutionTrigger {
    QUOTA,
    WINDOW,
    DISPATCH
}
