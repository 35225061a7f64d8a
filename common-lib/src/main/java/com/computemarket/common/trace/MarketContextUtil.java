package com.computemarket.common.trace;

import org.slf4j.MDC;

/**
 * Bridges the task id into the SLF4J MDC for the duration of a single log statement.
 *
 * <p>Marketplace operations run on whatever thread the network or dispatch layer calls them
 * from, so the MDC is never used as a persistent ThreadLocal store. It is populated around
 * the log call and removed again.
 *
 * <pre>
 *     MarketContextUtil.withMdc(taskId, () -> log.info("OFFERS_RESOLVED ..."));
 * </pre>
 */
public final class MarketContextUtil {

    public static final String TASK_ID_KEY = "taskId";

    private static final String UNKNOWN = "unknown";

    private MarketContextUtil() {}

    /**
     * Temporarily bridges {@code taskId} into the MDC while {@code logAction} runs,
     * then removes the entry.
     *
     * @param taskId    the task the log statement relates to; {@code null} logs as {@code "unknown"}
     * @param logAction the log statement to execute with MDC populated
     */
    public static void withMdc(String taskId, Runnable logAction) {
        MDC.put(TASK_ID_KEY, taskId != null ? taskId : UNKNOWN);
        try {
            logAction.run();
        } finally {
            MDC.remove(TASK_ID_KEY);
        }
    }
}
