package com.computemarket.requestor.logger;

import com.computemarket.common.marketplace.ScoredOffer;
import com.computemarket.common.model.MarketStrategyType;
import com.computemarket.common.model.UsageReport;
import com.computemarket.common.trace.MarketContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Observability component for a task's market lifecycle.
 *
 * <p>Logs each stage without introducing business logic. All methods are pure side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #TASK_REGISTERED}      — the task declared its market strategy</li>
 *   <li>{@link #OFFER_RECEIVED}       — an offer was pooled for the task</li>
 *   <li>{@link #RESOLUTION_TRIGGERED} — quota, collection window or dispatch asked for a ranking</li>
 *   <li>{@link #OFFERS_RESOLVED}      — the pool was ranked and drained</li>
 *   <li>{@link #USAGE_REPORTED}       — observed subtask usage was fed back</li>
 *   <li>{@link #TASK_CLOSED}          — the task's market state was released</li>
 * </ol>
 */
@Component
public class MarketFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(MarketFlowLogger.class);

    public static final String TASK_REGISTERED      = "TASK_REGISTERED";
    public static final String OFFER_RECEIVED       = "OFFER_RECEIVED";
    public static final String RESOLUTION_TRIGGERED = "RESOLUTION_TRIGGERED";
    public static final String OFFERS_RESOLVED      = "OFFERS_RESOLVED";
    public static final String USAGE_REPORTED       = "USAGE_REPORTED";
    public static final String TASK_CLOSED          = "TASK_CLOSED";

    /**
     * Logs a lifecycle stage with a free-form detail (trigger name, offer count, ...).
     *
     * @param stageName one of the stage constants defined in this class
     */
    public void stage(String stageName, String taskId, Object detail) {
        MarketContextUtil.withMdc(taskId, () ->
            log.info("[MarketFlow] stage={} taskId={} detail={}", stageName, taskId, detail)
        );
    }

    /** Offers arrive at network rate, so this stage logs at DEBUG. */
    public void offerReceived(String taskId, String providerId, int pooled) {
        MarketContextUtil.withMdc(taskId, () ->
            log.debug("[MarketFlow] stage={} taskId={} providerId={} pooled={}",
                      OFFER_RECEIVED, taskId, providerId, pooled)
        );
    }

    /**
     * Logs a compact summary of a resolution: strategy, ranked count and the winning offer.
     */
    public void offersResolved(String taskId, MarketStrategyType strategyType, List<ScoredOffer> ranking) {
        ScoredOffer best = ranking.isEmpty() ? null : ranking.get(0);
        MarketContextUtil.withMdc(taskId, () ->
            log.info("[MarketFlow] stage={} taskId={} strategy={} ranked={} bestProvider={} bestPrice={}",
                     OFFERS_RESOLVED, taskId, strategyType.id(), ranking.size(),
                     best != null ? best.offer().providerId() : "N/A",
                     best != null ? best.offer().price() : "N/A")
        );
    }

    public void usageReported(UsageReport report) {
        MarketContextUtil.withMdc(report.taskId(), () ->
            log.info("[MarketFlow] stage={} taskId={} applied={} duplicates={} rejected={}",
                     USAGE_REPORTED, report.taskId(), report.applied(), report.duplicates(), report.rejected())
        );
    }
}
