package com.computemarket.common.marketplace;

import com.computemarket.common.model.MarketStrategyType;
import com.computemarket.common.model.Offer;
import com.computemarket.common.model.ProviderPerformance;
import com.computemarket.common.model.UsageObservation;
import com.computemarket.common.model.UsageReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of {@link UsageFactorMarketStrategy}: ranking, pool draining and the usage
 * feedback loop.
 */
class UsageFactorMarketStrategyTest {

    private static final String TASK_1     = "task_1";
    private static final String TASK_2     = "task_2";
    private static final String PROVIDER_1 = "P1";
    private static final String PROVIDER_2 = "P2";
    private static final String SUBTASK_1  = "subtask_1";
    private static final String SUBTASK_2  = "subtask_2";

    private UsageFactorMarketStrategy strategy;
    private Offer offer1;
    private Offer offer2;

    @BeforeEach
    void setUp() {
        strategy = new UsageFactorMarketStrategy(new OfferPool(), new UsageLedger(), 1.0, InvalidOfferPolicy.EXCLUDE);
        offer1 = new Offer(PROVIDER_1, 5.0, new ProviderPerformance(1000 / 1.25),
                           List.of(0.0, 0.0, 0.0, 0.0), 0.0);
        offer2 = new Offer(PROVIDER_2, 6.0, new ProviderPerformance(1000 / 0.8),
                           List.of(0.0, 0.0, 0.0, 0.0), 0.0);
    }

    // ── benchmarks and factors ──────────────────────────────────────────────

    @Test
    @DisplayName("default usage benchmark and neutral factor are 1.0")
    void usageBenchmarkAndNeutralFactor() {
        assertEquals(MarketStrategyType.USAGE_FACTOR, strategy.type());
        assertEquals(1.0, strategy.getMyUsageBenchmark());
        assertEquals(1.0, strategy.getUsageFactor(PROVIDER_1, 1.0));
        assertEquals(1.0, strategy.getUsageFactor(PROVIDER_1, 250.0));
    }

    @Test
    @DisplayName("non-positive benchmark passed to getUsageFactor is refused")
    void usageFactorRejectsBadBenchmark() {
        assertThrows(IllegalArgumentException.class, () -> strategy.getUsageFactor(PROVIDER_1, 0.0));
    }

    @Test
    @DisplayName("non-positive requestor benchmark is refused at construction")
    void constructorRejectsBadBenchmark() {
        assertThrows(IllegalArgumentException.class, () ->
            new UsageFactorMarketStrategy(new OfferPool(), new UsageLedger(), 0.0, InvalidOfferPolicy.EXCLUDE));
    }

    // ── resolution ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("resolveTaskOffers()")
    class Resolution {

        @Test
        @DisplayName("returns every pooled offer")
        void resolutionLengthCorrect() {
            strategy.add(TASK_1, offer1);
            strategy.add(TASK_1, offer2);
            assertEquals(2, strategy.getTaskOfferCount(TASK_1));

            assertEquals(2, strategy.resolveTaskOffers(TASK_1).size());
        }

        @Test
        @DisplayName("cheaper price per declared throughput wins: 0.0048 < 0.00625")
        void adjustedPrices() {
            strategy.add(TASK_1, offer1);
            strategy.add(TASK_1, offer2);

            List<ScoredOffer> result = strategy.resolveScoredTaskOffers(TASK_1);

            assertEquals(PROVIDER_2, result.get(0).offer().providerId());
            assertEquals(0.0048,  result.get(0).effectivePrice(), 1e-12);
            assertEquals(0.00625, result.get(1).effectivePrice(), 1e-12);
        }

        @Test
        @DisplayName("pool is drained; second resolution is empty")
        void poolDraining() {
            strategy.add(TASK_1, offer1);
            strategy.resolveTaskOffers(TASK_1);

            assertEquals(0, strategy.getTaskOfferCount(TASK_1));
            assertTrue(strategy.resolveTaskOffers(TASK_1).isEmpty());
        }

        @Test
        @DisplayName("unknown task → zero count and empty ranking")
        void unknownTask() {
            assertEquals(0, strategy.getTaskOfferCount("nonexistent"));
            assertEquals(List.of(), strategy.resolveTaskOffers("nonexistent"));
        }

        @Test
        @DisplayName("equal effective prices keep submission order")
        void tiesKeepSubmissionOrder() {
            Offer a = Offer.of("A", 2.0, 100.0);
            Offer b = Offer.of("B", 4.0, 200.0);
            Offer c = Offer.of("C", 1.0, 50.0);
            strategy.add(TASK_1, a);
            strategy.add(TASK_1, b);
            strategy.add(TASK_1, c);

            assertEquals(List.of(a, b, c), strategy.resolveTaskOffers(TASK_1));
        }

        @Test
        @DisplayName("deterministic — identical inputs give identical order")
        void deterministic() {
            List<Offer> offers = List.of(
                Offer.of("A", 3.0, 100.0), Offer.of("B", 1.0, 100.0),
                Offer.of("C", 3.0, 100.0), Offer.of("D", 2.0, 50.0));

            offers.forEach(o -> strategy.add(TASK_1, o));
            List<Offer> first = strategy.resolveTaskOffers(TASK_1);
            offers.forEach(o -> strategy.add(TASK_1, o));
            List<Offer> second = strategy.resolveTaskOffers(TASK_1);

            assertEquals(first, second);
            assertEquals(List.of("B", "A", "C", "D"),
                first.stream().map(Offer::providerId).toList());
        }

        @Test
        @DisplayName("a provider may compete with several offers on one task")
        void multipleOffersPerProvider() {
            strategy.add(TASK_1, Offer.of(PROVIDER_1, 5.0, 100.0));
            strategy.add(TASK_1, Offer.of(PROVIDER_1, 1.0, 100.0));

            List<Offer> result = strategy.resolveTaskOffers(TASK_1);
            assertEquals(2, result.size());
            assertEquals(1.0, result.get(0).price());
        }

        @Test
        @DisplayName("invalid offers are excluded, the rest still resolves")
        void invalidOffersExcluded() {
            Offer negativePrice = Offer.of("BAD1", -1.0, 1000.0);
            Offer zeroPerf      = Offer.of("BAD2", 1.0, 0.0);
            Offer nanPrice      = Offer.of("BAD3", Double.NaN, 1000.0);
            strategy.add(TASK_1, negativePrice);
            strategy.add(TASK_1, offer1);
            strategy.add(TASK_1, zeroPerf);
            strategy.add(TASK_1, nanPrice);

            assertEquals(List.of(offer1), strategy.resolveTaskOffers(TASK_1));
        }

        @Test
        @DisplayName("RANK_LAST keeps invalid offers after valid ones in submission order")
        void invalidOffersRankedLast() {
            UsageFactorMarketStrategy rankLast = new UsageFactorMarketStrategy(
                new OfferPool(), new UsageLedger(), 1.0, InvalidOfferPolicy.RANK_LAST);
            Offer bad1 = Offer.of("BAD1", -1.0, 1000.0);
            Offer bad2 = Offer.of("BAD2", 1.0, -5.0);
            rankLast.add(TASK_1, bad1);
            rankLast.add(TASK_1, offer1);
            rankLast.add(TASK_1, bad2);
            rankLast.add(TASK_1, offer2);

            List<ScoredOffer> result = rankLast.resolveScoredTaskOffers(TASK_1);

            assertEquals(List.of(offer2, offer1, bad1, bad2),
                result.stream().map(ScoredOffer::offer).toList());
            assertFalse(result.get(2).valid());
            assertEquals(Double.POSITIVE_INFINITY, result.get(3).effectivePrice());
        }

        @Test
        @DisplayName("clearOffersForTask drops offers without ranking them")
        void clearOffers() {
            strategy.add(TASK_1, offer1);
            strategy.clearOffersForTask(TASK_1);
            strategy.clearOffersForTask(TASK_1);

            assertEquals(0, strategy.getTaskOfferCount(TASK_1));
            assertTrue(strategy.resolveTaskOffers(TASK_1).isEmpty());
        }
    }

    // ── feedback loop ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("reportSubtaskUsages()")
    class Feedback {

        @Test
        @DisplayName("observed usage inverts the ranking of the next resolution only")
        void usageAdjustment() {
            strategy.add(TASK_1, offer1);
            strategy.add(TASK_1, offer2);
            List<Offer> first = strategy.resolveTaskOffers(TASK_1);

            UsageReport report = strategy.reportSubtaskUsages(TASK_1, List.of(
                UsageObservation.of(PROVIDER_1, SUBTASK_1, 5.0),
                UsageObservation.of(PROVIDER_2, SUBTASK_2, 8.0)));

            assertEquals(2, report.applied());
            assertEquals(2, first.size());
            assertEquals(PROVIDER_2, first.get(0).providerId());

            strategy.add(TASK_2, offer1);
            strategy.add(TASK_2, offer2);
            assertEquals(2, strategy.getTaskOfferCount(TASK_2));
            List<ScoredOffer> second = strategy.resolveScoredTaskOffers(TASK_2);

            assertEquals(2, second.size());
            assertEquals(PROVIDER_1, second.get(0).offer().providerId());
            assertEquals(0.03125, second.get(0).effectivePrice(), 1e-12);
            assertEquals(0.0384,  second.get(1).effectivePrice(), 1e-12);
        }

        @Test
        @DisplayName("factors are keyed by provider and visible through getUsageFactor")
        void factorExposed() {
            strategy.reportSubtaskUsages(TASK_1, List.of(UsageObservation.of(PROVIDER_1, SUBTASK_1, 2.5)));

            assertEquals(2.5, strategy.getUsageFactor(PROVIDER_1, 1.0));
            assertEquals(1.0, strategy.getUsageFactor(PROVIDER_2, 1.0));
        }

        @Test
        @DisplayName("reporting the same subtask twice does not count twice")
        void duplicateSubtaskIgnored() {
            strategy.reportSubtaskUsages(TASK_1, List.of(UsageObservation.of(PROVIDER_1, SUBTASK_1, 2.0)));
            UsageReport again = strategy.reportSubtaskUsages(TASK_1,
                List.of(UsageObservation.of(PROVIDER_1, SUBTASK_1, 9.0)));

            assertEquals(new UsageReport(TASK_1, 0, 1, 0), again);
            assertEquals(2.0, strategy.getUsageFactor(PROVIDER_1, 1.0));
        }

        @Test
        @DisplayName("degenerate observations are rejected without aborting the batch")
        void degenerateObservationRejected() {
            strategy.reportSubtaskUsages(TASK_1, List.of(UsageObservation.of(PROVIDER_1, SUBTASK_1, 3.0)));

            UsageReport report = strategy.reportSubtaskUsages(TASK_1, List.of(
                UsageObservation.of(PROVIDER_1, "s-zero", 0.0),
                UsageObservation.of(PROVIDER_1, "s-negative", -4.0),
                UsageObservation.of(PROVIDER_2, SUBTASK_2, 0.5)));

            assertEquals(new UsageReport(TASK_1, 1, 0, 2), report);
            assertEquals(3.0, strategy.getUsageFactor(PROVIDER_1, 1.0));
            assertEquals(0.5, strategy.getUsageFactor(PROVIDER_2, 1.0));
        }

        @Test
        @DisplayName("latest observation replaces the previous factor")
        void latestObservationWins() {
            strategy.reportSubtaskUsages(TASK_1, List.of(UsageObservation.of(PROVIDER_1, SUBTASK_1, 4.0)));
            strategy.reportSubtaskUsages(TASK_1, List.of(UsageObservation.of(PROVIDER_1, SUBTASK_2, 0.5)));

            assertEquals(0.5, strategy.getUsageFactor(PROVIDER_1, 1.0));
        }
    }

    // ── reset ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("reset twice equals reset once: empty pools, neutral factors")
    void resetIsIdempotent() {
        strategy.add(TASK_1, offer1);
        strategy.reportSubtaskUsages(TASK_1, List.of(UsageObservation.of(PROVIDER_1, SUBTASK_1, 5.0)));

        strategy.reset();
        strategy.reset();

        assertEquals(0, strategy.getTaskOfferCount(TASK_1));
        assertEquals(1.0, strategy.getUsageFactor(PROVIDER_1, 1.0));
        assertTrue(strategy.ledger().snapshot().isEmpty());
    }

    // ── concurrency ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("offers added while resolving are either ranked or still pooled, never lost")
    void concurrentAddAndResolveLoseNothing() throws Exception {
        int producers = 4;
        int offersPerProducer = 500;
        ExecutorService executor = Executors.newFixedThreadPool(producers + 1);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch producersDone = new CountDownLatch(producers);
        AtomicInteger resolved = new AtomicInteger();

        try {
            for (int p = 0; p < producers; p++) {
                String providerId = "P" + p;
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < offersPerProducer; i++) {
                        strategy.add(TASK_1, Offer.of(providerId, 1.0 + i, 100.0));
                    }
                    producersDone.countDown();
                    return null;
                });
            }
            executor.submit(() -> {
                start.await();
                while (producersDone.getCount() > 0) {
                    resolved.addAndGet(strategy.resolveTaskOffers(TASK_1).size());
                }
                return null;
            });

            start.countDown();
            assertTrue(producersDone.await(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        }

        int remaining = strategy.getTaskOfferCount(TASK_1);
        assertEquals(producers * offersPerProducer, resolved.get() + remaining);
    }
}
