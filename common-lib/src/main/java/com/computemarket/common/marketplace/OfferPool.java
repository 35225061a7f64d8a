package com.computemarket.common.marketplace;

import com.computemarket.common.model.Offer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Per-task ordered collection of received offers.
 *
 * <p>Each task maps to a mutable list that is only touched inside
 * {@link ConcurrentHashMap#compute} for its key, so every access to one task id is serialized
 * while different task ids proceed independently. Appends are amortized constant time; the
 * list leaves the pool read-only.
 *
 * <p>{@link #drain(String)} removes the task's sequence in one atomic step. An offer added
 * concurrently either lands in the drained sequence or starts the next pool generation;
 * it is never dropped.
 *
 * <p>Invariant: a task id present in the pool maps to a non-empty sequence.
 */
public class OfferPool {

    private final ConcurrentHashMap<String, List<Offer>> pools = new ConcurrentHashMap<>();

    /**
     * Appends {@code offer} to the task's sequence, creating it if absent.
     * Offers are not deduplicated by provider.
     */
    public void add(String taskId, Offer offer) {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(offer, "offer");
        pools.compute(taskId, (id, current) -> {
            List<Offer> offers = current == null ? new ArrayList<>() : current;
            offers.add(offer);
            return offers;
        });
    }

    /** Current pooled-offer count; {@code 0} for an unknown task. */
    public int count(String taskId) {
        return read(taskId, List::size, 0);
    }

    /** Copy of the task's offers in submission order; empty for an unknown task. */
    public List<Offer> peek(String taskId) {
        return read(taskId, List::copyOf, List.of());
    }

    /**
     * Atomically removes and returns the task's offers in submission order.
     * Returns an empty list for an unknown task.
     */
    public List<Offer> drain(String taskId) {
        Objects.requireNonNull(taskId, "taskId");
        List<Offer> drained = pools.remove(taskId);
        return drained == null ? List.of() : Collections.unmodifiableList(drained);
    }

    /** Removes the task's sequence if present; no-op otherwise. */
    public void clear(String taskId) {
        Objects.requireNonNull(taskId, "taskId");
        pools.remove(taskId);
    }

    /** Number of tasks currently holding offers. */
    public int taskCount() {
        return pools.size();
    }

    /** Drops every task's sequence. Process reinitialization only. */
    public void reset() {
        pools.clear();
    }

    private <T> T read(String taskId, Function<List<Offer>, T> reader, T absent) {
        AtomicReference<T> result = new AtomicReference<>(absent);
        pools.computeIfPresent(taskId, (id, offers) -> {
            result.set(reader.apply(offers));
            return offers;
        });
        return result.get();
    }
}
