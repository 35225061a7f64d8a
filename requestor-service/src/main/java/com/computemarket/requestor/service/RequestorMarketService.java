package com.computemarket.requestor.service;

import com.computemarket.common.marketplace.MarketStrategyRegistry;
import com.computemarket.common.marketplace.RequestorMarketStrategy;
import com.computemarket.common.marketplace.ScoredOffer;
import com.computemarket.common.marketplace.UsageLedger;
import com.computemarket.common.model.MarketStrategyType;
import com.computemarket.common.model.Offer;
import com.computemarket.common.model.UsageObservation;
import com.computemarket.common.model.UsageReport;
import com.computemarket.requestor.logger.MarketFlowLogger;
import com.computemarket.requestor.session.TaskMarketSession;
import com.computemarket.requestor.session.TaskMarketState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Node-wide requestor marketplace consumed in-process by task dispatch and by the
 * offer-reception layer.
 *
 * <p>Each task is bound to the {@link MarketStrategyType} it declared at creation time
 * ({@link #registerTask}); tasks that were never registered use the registry's default.
 * Offer submission and resolution of one task run inside the same per-task critical section
 * ({@link ConcurrentHashMap#compute}), so the {@link TaskMarketSession} state always agrees
 * with the strategy's pool. Different tasks never contend.
 *
 * <p>Usage reports bypass the per-task section: the ledger serializes its own writes.
 */
@Service
public class RequestorMarketService {

    private static final Logger log = LoggerFactory.getLogger(RequestorMarketService.class);

    private final MarketStrategyRegistry registry;
    private final UsageLedger usageLedger;
    private final MarketFlowLogger flowLogger;
    private final ConcurrentHashMap<String, TaskMarketSession> sessions = new ConcurrentHashMap<>();

    public RequestorMarketService(MarketStrategyRegistry registry,
                                  UsageLedger usageLedger,
                                  MarketFlowLogger flowLogger) {
        this.registry    = registry;
        this.usageLedger = usageLedger;
        this.flowLogger  = flowLogger;
    }

    /**
     * Binds {@code taskId} to a market strategy. Re-registering an open task with another
     * strategy drops the offers pooled under the previous one.
     *
     * @return a copy of the task's session
     */
    public TaskMarketSession registerTask(String taskId, MarketStrategyType strategyType) {
        Objects.requireNonNull(taskId, "taskId");
        RequestorMarketStrategy strategy = registry.get(strategyType);
        TaskMarketSession session = sessions.compute(taskId, (id, current) -> {
            if (current != null && current.getStrategyType() != strategyType) {
                registry.get(current.getStrategyType()).clearOffersForTask(id);
                log.warn("Task strategy changed; pooled offers dropped. taskId={} from={} to={}",
                         id, current.getStrategyType().id(), strategyType.id());
            }
            if (current == null || current.getStrategyType() != strategyType) {
                return TaskMarketSession.open(id, strategy.type());
            }
            return current;
        }).copy();
        flowLogger.stage(MarketFlowLogger.TASK_REGISTERED, taskId, strategyType.id());
        return session;
    }

    /**
     * Pools {@code offer} for the task, reopening it if it was resolved.
     *
     * @return the number of offers pooled for the task after this one
     */
    public int submitOffer(String taskId, Offer offer) {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(offer, "offer");
        AtomicInteger pooled = new AtomicInteger();
        sessions.compute(taskId, (id, current) -> {
            TaskMarketSession session = current != null
                ? current
                : TaskMarketSession.open(id, registry.defaultType());
            RequestorMarketStrategy strategy = registry.get(session.getStrategyType());
            strategy.add(id, offer);
            session.setState(TaskMarketState.OPEN);
            session.setOffersReceived(session.getOffersReceived() + 1);
            pooled.set(strategy.getTaskOfferCount(id));
            return session;
        });
        flowLogger.offerReceived(taskId, offer.providerId(), pooled.get());
        return pooled.get();
    }

    public int offerCount(String taskId) {
        return strategyFor(taskId).getTaskOfferCount(taskId);
    }

    /** Ranked offers, best first. Drains the task's pool; unknown tasks yield an empty list. */
    public List<Offer> resolve(String taskId) {
        return resolveScored(taskId).stream().map(ScoredOffer::offer).toList();
    }

    /** Like {@link #resolve(String)} but keeps the scores the ranking was computed from. */
    public List<ScoredOffer> resolveScored(String taskId) {
        Objects.requireNonNull(taskId, "taskId");
        AtomicReference<List<ScoredOffer>> ranking = new AtomicReference<>(List.of());
        TaskMarketSession resolved = sessions.computeIfPresent(taskId, (id, session) -> {
            ranking.set(registry.get(session.getStrategyType()).resolveScoredTaskOffers(id));
            session.setState(TaskMarketState.RESOLVED);
            session.setResolutions(session.getResolutions() + 1);
            session.setLastResolvedAt(Instant.now());
            return session;
        });
        if (resolved == null) {
            log.debug("Resolution requested for unknown task. taskId={}", taskId);
            return List.of();
        }
        flowLogger.offersResolved(taskId, resolved.getStrategyType(), ranking.get());
        return ranking.get();
    }

    /**
     * Feeds observed subtask usage back into provider trust through the task's strategy.
     * Already returned rankings are not affected.
     */
    public UsageReport reportUsages(String taskId, List<UsageObservation> observations) {
        Objects.requireNonNull(observations, "observations");
        UsageReport report = strategyFor(taskId).reportSubtaskUsages(taskId, observations);
        flowLogger.usageReported(report);
        return report;
    }

    public double usageBenchmark() {
        return registry.defaultStrategy().getMyUsageBenchmark();
    }

    /**
     * Current trust factor of a provider, read from the shared ledger whatever the default
     * strategy is. {@code 1.0} for a provider without recorded usage.
     */
    public double usageFactor(String providerId, double usageBenchmark) {
        if (!(usageBenchmark > 0) || !Double.isFinite(usageBenchmark)) {
            throw new IllegalArgumentException("usageBenchmark must be positive: " + usageBenchmark);
        }
        return usageLedger.getFactor(providerId);
    }

    /** Every recorded usage factor, keyed by provider id. */
    public Map<String, Double> usageFactors() {
        return usageLedger.snapshot();
    }

    public Optional<TaskMarketSession> session(String taskId) {
        return Optional.ofNullable(sessions.get(taskId)).map(TaskMarketSession::copy);
    }

    /**
     * Releases everything held for a finished task: pooled offers, its session and the
     * idempotence keys of its reported subtasks.
     */
    public void closeTask(String taskId) {
        Objects.requireNonNull(taskId, "taskId");
        AtomicReference<TaskMarketSession> removed = new AtomicReference<>();
        sessions.computeIfPresent(taskId, (id, session) -> {
            registry.get(session.getStrategyType()).clearOffersForTask(id);
            removed.set(session);
            return null;
        });
        usageLedger.forgetTask(taskId);
        flowLogger.stage(MarketFlowLogger.TASK_CLOSED, taskId,
                         removed.get() != null ? removed.get().getState() : "unknown");
    }

    /** Full reinitialization: sessions, pools and usage factors. Never called mid-flight. */
    public void reset() {
        sessions.clear();
        registry.resetAll();
        log.info("Requestor marketplace reset.");
    }

    private RequestorMarketStrategy strategyFor(String taskId) {
        TaskMarketSession session = sessions.get(Objects.requireNonNull(taskId, "taskId"));
        return session != null ? registry.get(session.getStrategyType()) : registry.defaultStrategy();
    }
}
