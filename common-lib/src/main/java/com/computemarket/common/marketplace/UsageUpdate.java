package com.computemarket.common.marketplace;

/**
 * Outcome of applying one usage observation to the {@link UsageLedger}.
 *
 * <ul>
 *   <li>{@link #APPLIED}   — the provider's factor was replaced by the observed ratio.</li>
 *   <li>{@link #DUPLICATE} — the subtask was already reported; nothing changed.</li>
 *   <li>{@link #REJECTED}  — degenerate observation; the prior factor was retained.</li>
 * </ul>
 */
public enum UsageUpdate {
    APPLIED,
    DUPLICATE,
    REJECTED
}
