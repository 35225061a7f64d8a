package com.computemarket.requestor.collector;

import com.computemarket.common.exception.MarketplaceException;
import com.computemarket.common.marketplace.ScoredOffer;
import com.computemarket.common.model.Offer;
import com.computemarket.requestor.logger.MarketFlowLogger;
import com.computemarket.requestor.service.RequestorMarketService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collects offers arriving from the network layer and decides when a task's pool is resolved.
 *
 * <p>A pool generation is resolved by whichever comes first:
 * <pre>
 *   pooled offers ≥ offerQuota                     → resolve immediately   (QUOTA)
 *   offerWindow elapsed since the first offer      → resolve on timer      (WINDOW)
 *   dispatch calls {@link #resolveNow(String)}     → resolve immediately   (DISPATCH)
 * </pre>
 * The window timer is a {@link Mono#delay} on Reactor's parallel scheduler, so no thread
 * waits for offers. Each non-empty ranking is published on {@link #resolutions()}.
 *
 * <p>A timer that fires after the pool was already resolved finds it empty and publishes
 * nothing.
 */
@Component
public class OfferCollector {

    private static final Logger log = LoggerFactory.getLogger(OfferCollector.class);

    private final RequestorMarketService marketService;
    private final MarketFlowLogger flowLogger;
    private final Duration offerWindow;
    private final int offerQuota;

    private final ConcurrentHashMap<String, Disposable> pendingWindows = new ConcurrentHashMap<>();
    // autoCancel off: the stream outlives its subscribers and accepts late ones
    private final Sinks.Many<ResolvedTaskOffers> resolutionSink =
        Sinks.many().multicast().onBackpressureBuffer(256, false);

    public OfferCollector(RequestorMarketService marketService,
                          MarketFlowLogger flowLogger,
                          @Value("${marketplace.offer-window:PT10S}") Duration offerWindow,
                          @Value("${marketplace.offer-quota:10}") int offerQuota) {
        if (offerQuota < 1) {
            throw MarketplaceException.configuration("marketplace.offer-quota", "Offer quota must be at least 1: " + offerQuota);
        }
        if (offerWindow.isNegative() || offerWindow.isZero()) {
            throw MarketplaceException.configuration("marketplace.offer-window", "Offer window must be positive: " + offerWindow);
        }
        this.marketService = marketService;
        this.flowLogger    = flowLogger;
        this.offerWindow   = offerWindow;
        this.offerQuota    = offerQuota;
    }

    /** Stream of non-empty rankings, one per resolved pool generation. */
    public Flux<ResolvedTaskOffers> resolutions() {
        return resolutionSink.asFlux();
    }

    /**
     * Entry point for the offer-reception layer: pools the offer and resolves or arms the
     * collection window as needed.
     */
    public void offerReceived(String taskId, Offer offer) {
        int pooled = marketService.submitOffer(taskId, offer);
        if (pooled >= offerQuota) {
            resolve(taskId, ResolutionTrigger.QUOTA);
            return;
        }
        pendingWindows.computeIfAbsent(taskId, this::armWindow);
    }

    /** Resolves the task now on behalf of task dispatch, cancelling its pending window. */
    public List<ScoredOffer> resolveNow(String taskId) {
        return resolve(taskId, ResolutionTrigger.DISPATCH);
    }

    /** Cancels the task's window and releases its market state. */
    public void taskClosed(String taskId) {
        cancelWindow(taskId);
        marketService.closeTask(taskId);
    }

    public int pendingWindowCount() {
        return pendingWindows.size();
    }

    @PreDestroy
    public void shutdown() {
        pendingWindows.keySet().forEach(this::cancelWindow);
        resolutionSink.tryEmitComplete();
        log.info("Offer collector stopped.");
    }

    // ── resolution ──────────────────────────────────────────────────────────

    private Disposable armWindow(String taskId) {
        log.debug("Offer window armed. taskId={} windowMs={}", taskId, offerWindow.toMillis());
        Disposable.Swap window = Disposables.swap();
        window.update(Mono.delay(offerWindow)
            .doOnNext(tick -> pendingWindows.remove(taskId, window))
            .map(tick -> resolve(taskId, ResolutionTrigger.WINDOW))
            .subscribe(
                ranking -> log.debug("Offer window closed. taskId={} ranked={}", taskId, ranking.size()),
                err -> log.error("Offer window resolution failed. taskId={}", taskId, err)
            ));
        return window;
    }

    private List<ScoredOffer> resolve(String taskId, ResolutionTrigger trigger) {
        // an elapsed window has already unregistered itself
        if (trigger != ResolutionTrigger.WINDOW) {
            cancelWindow(taskId);
        }
        flowLogger.stage(MarketFlowLogger.RESOLUTION_TRIGGERED, taskId, trigger);
        List<ScoredOffer> ranking = marketService.resolveScored(taskId);
        if (!ranking.isEmpty()) {
            publish(new ResolvedTaskOffers(taskId, trigger, ranking, Instant.now()));
        }
        return ranking;
    }

    private void cancelWindow(String taskId) {
        Disposable pending = pendingWindows.remove(taskId);
        if (pending != null) {
            pending.dispose();
        }
    }

    private void publish(ResolvedTaskOffers event) {
        Sinks.EmitResult result;
        synchronized (resolutionSink) {
            result = resolutionSink.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.warn("Resolution not published. taskId={} trigger={} result={}",
                     event.taskId(), event.trigger(), result);
        }
    }
}
