package io.strata.core.observability;

import io.strata.core.memory.MemoryTier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bounded in-memory log of tier accesses with measured latencies.
 */
public final class MemoryMetrics {
    private static final int MAX_EVENTS = 20_000;

    private final Clock clock;
    private final Deque<AccessEvent> events = new ArrayDeque<>();

    public MemoryMetrics(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static long start() {
        return System.nanoTime();
    }

    public synchronized void record(String ownerId, MemoryTier tier, AccessType type, long startedNanos) {
        double latencyMs = (System.nanoTime() - startedNanos) / 1_000_000.0;
        events.addLast(new AccessEvent(ownerId, tier, type, Math.max(0.0, latencyMs), clock.instant()));
        while (events.size() > MAX_EVENTS) {
            events.removeFirst();
        }
    }

    public synchronized List<AccessEvent> recent(int limit) {
        int safe = Math.max(1, limit);
        List<AccessEvent> newestFirst = new ArrayList<>(safe);
        var iterator = events.descendingIterator();
        while (iterator.hasNext() && newestFirst.size() < safe) {
            newestFirst.add(iterator.next());
        }
        return newestFirst;
    }

    public synchronized Map<MemoryTier, TierLatency> summary(String ownerId, Duration window) {
        Instant since = clock.instant().minus(window);
        Map<MemoryTier, TierLatency> summary = new EnumMap<>(MemoryTier.class);
        for (MemoryTier tier : MemoryTier.values()) {
            List<AccessEvent> matching = events.stream()
                .filter(e -> e.tier() == tier)
                .filter(e -> ownerId == null || ownerId.equals(e.ownerId()))
                .filter(e -> !e.timestamp().isBefore(since))
                .toList();
            List<Double> latencies = matching.stream()
                .map(AccessEvent::latencyMs)
                .sorted()
                .toList();
            double mean = latencies.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            summary.put(tier, new TierLatency(
                tier,
                count(matching, AccessType.HIT),
                count(matching, AccessType.MISS),
                count(matching, AccessType.WRITE),
                count(matching, AccessType.EVICTION),
                round2(mean),
                round2(percentile(latencies, 50)),
                round2(percentile(latencies, 95))
            ));
        }
        return summary;
    }

    private int count(List<AccessEvent> events, AccessType type) {
        return (int) events.stream().filter(e -> e.type() == type).count();
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int safe = Math.max(0, Math.min(100, percentile));
        if (safe == 0) {
            return sorted.get(0);
        }
        int index = (int) Math.ceil((safe / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
