package io.strata.core.observability;

import static org.assertj.core.api.Assertions.assertThat;

import io.strata.core.MutableClock;
import io.strata.core.memory.MemoryTier;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MemoryMetricsTest {

    @Test
    void shouldCountAccessesPerTierAndOwner() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        MemoryMetrics metrics = new MemoryMetrics(clock);

        metrics.record("alice", MemoryTier.HOT, AccessType.HIT, MemoryMetrics.start());
        metrics.record("alice", MemoryTier.HOT, AccessType.HIT, MemoryMetrics.start());
        metrics.record("alice", MemoryTier.WARM, AccessType.MISS, MemoryMetrics.start());
        metrics.record("alice", MemoryTier.COLD, AccessType.WRITE, MemoryMetrics.start());
        metrics.record("bob", MemoryTier.HOT, AccessType.EVICTION, MemoryMetrics.start());

        Map<MemoryTier, TierLatency> summary = metrics.summary("alice", Duration.ofHours(1));

        assertThat(summary.get(MemoryTier.HOT).hits()).isEqualTo(2);
        assertThat(summary.get(MemoryTier.HOT).evictions()).isZero();
        assertThat(summary.get(MemoryTier.WARM).misses()).isEqualTo(1);
        assertThat(summary.get(MemoryTier.COLD).writes()).isEqualTo(1);
        assertThat(summary.get(MemoryTier.HOT).p95LatencyMs()).isGreaterThanOrEqualTo(summary.get(MemoryTier.HOT).p50LatencyMs());
        assertThat(metrics.summary(null, Duration.ofHours(1)).get(MemoryTier.HOT).evictions()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreEventsOutsideTheWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        MemoryMetrics metrics = new MemoryMetrics(clock);
        metrics.record("alice", MemoryTier.HOT, AccessType.HIT, MemoryMetrics.start());

        clock.advance(Duration.ofHours(2));
        metrics.record("alice", MemoryTier.HOT, AccessType.MISS, MemoryMetrics.start());

        TierLatency hot = metrics.summary("alice", Duration.ofHours(1)).get(MemoryTier.HOT);
        assertThat(hot.hits()).isZero();
        assertThat(hot.misses()).isEqualTo(1);
        assertThat(metrics.recent(10)).hasSize(2);
        assertThat(metrics.recent(10).get(0).type()).isEqualTo(AccessType.MISS);
    }
}
