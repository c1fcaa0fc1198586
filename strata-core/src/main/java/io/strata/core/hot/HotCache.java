package io.strata.core.hot;

import io.strata.core.memory.MemoryItem;
import io.strata.core.memory.MemoryTier;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Count-bounded cache of the most recent items per owner. Insertion order decides eviction; reads
 * never reorder entries.
 *
 * <p>Each owner's entries are loaded from the {@link HotRepository} on first access. A mutation
 * works on a copy that is saved before it replaces the published entries, so a failed save leaves
 * the cache as it was.
 */
public final class HotCache {
    private final int capacity;
    private final Duration ttl;
    private final double hotFloor;
    private final HotRepository repository;
    private final Clock clock;
    private final Map<String, List<MemoryItem>> published = new ConcurrentHashMap<>();
    private final Map<String, Object> writeLocks = new ConcurrentHashMap<>();

    public HotCache(int capacity, Duration ttl, double hotFloor, Clock clock) {
        this(capacity, ttl, hotFloor, new InMemoryHotRepository(), clock);
    }

    public HotCache(int capacity, Duration ttl, double hotFloor, HotRepository repository, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.hotFloor = hotFloor;
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Inserts the item and drops the oldest entries while the owner is over capacity.
     *
     * @return the dropped entries, oldest first
     */
    public List<HotEviction> put(MemoryItem item) throws IOException {
        Objects.requireNonNull(item, "item must not be null");
        return mutate(item.ownerId(), entries -> {
            entries.put(item.id(), item.inTier(MemoryTier.HOT));
            List<HotEviction> evicted = new ArrayList<>();
            Iterator<MemoryItem> oldestFirst = entries.values().iterator();
            while (entries.size() > capacity && oldestFirst.hasNext()) {
                MemoryItem oldest = oldestFirst.next();
                oldestFirst.remove();
                evicted.add(eviction(oldest, HotEviction.Reason.OVERFLOW));
            }
            return evicted;
        });
    }

    /**
     * The oldest entries that have to leave before one more item fits. Nothing is removed.
     */
    public List<HotEviction> overflow(String ownerId) throws IOException {
        List<MemoryItem> entries = current(ownerId);
        int excess = entries.size() - capacity + 1;
        List<HotEviction> overflow = new ArrayList<>();
        for (int i = 0; i < excess; i++) {
            overflow.add(eviction(entries.get(i), HotEviction.Reason.OVERFLOW));
        }
        return overflow;
    }

    /**
     * Entries created longer than the TTL ago, oldest first. Nothing is removed.
     */
    public List<HotEviction> expired(String ownerId) throws IOException {
        Instant cutoff = clock.instant().minus(ttl);
        List<HotEviction> expired = new ArrayList<>();
        for (MemoryItem item : current(ownerId)) {
            if (item.createdAt().isBefore(cutoff)) {
                expired.add(eviction(item, HotEviction.Reason.EXPIRED));
            }
        }
        return expired;
    }

    public List<MemoryItem> getRecent(String ownerId, int limit) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        return mutate(ownerId, entries -> {
            List<MemoryItem> newestFirst = new ArrayList<>(entries.values());
            Collections.reverse(newestFirst);
            List<MemoryItem> result = new ArrayList<>(Math.min(limit, newestFirst.size()));
            for (MemoryItem item : newestFirst) {
                if (result.size() >= limit) {
                    break;
                }
                MemoryItem touched = item.touched(now);
                entries.put(touched.id(), touched);
                result.add(touched);
            }
            return List.copyOf(result);
        });
    }

    /**
     * Newest-first view of an owner's entries that does not count as a reference.
     */
    public List<MemoryItem> peek(String ownerId) throws IOException {
        List<MemoryItem> newestFirst = new ArrayList<>(current(ownerId));
        Collections.reverse(newestFirst);
        return List.copyOf(newestFirst);
    }

    public Optional<MemoryItem> touch(String ownerId, String itemId) throws IOException {
        Instant now = clock.instant();
        return mutate(ownerId, entries -> {
            MemoryItem item = entries.get(itemId);
            if (item == null) {
                return Optional.empty();
            }
            MemoryItem touched = item.touched(now);
            entries.put(itemId, touched);
            return Optional.of(touched);
        });
    }

    public Optional<MemoryItem> remove(String ownerId, String itemId) throws IOException {
        return mutate(ownerId, entries -> Optional.ofNullable(entries.remove(itemId)));
    }

    public Optional<MemoryItem> find(String ownerId, String itemId) throws IOException {
        return current(ownerId).stream().filter(item -> item.id().equals(itemId)).findFirst();
    }

    public boolean contains(String ownerId, String itemId) throws IOException {
        return find(ownerId, itemId).isPresent();
    }

    public int size(String ownerId) throws IOException {
        return current(ownerId).size();
    }

    public List<String> owners() throws IOException {
        List<String> owners = new ArrayList<>(repository.owners());
        published.forEach((owner, entries) -> {
            if (!entries.isEmpty() && !owners.contains(owner)) {
                owners.add(owner);
            }
        });
        return owners;
    }

    private <T> T mutate(String ownerId, Function<LinkedHashMap<String, MemoryItem>, T> mutation) throws IOException {
        synchronized (writeLockFor(ownerId)) {
            List<MemoryItem> before = current(ownerId);
            LinkedHashMap<String, MemoryItem> working = new LinkedHashMap<>();
            before.forEach(item -> working.put(item.id(), item));
            T result = mutation.apply(working);
            List<MemoryItem> after = List.copyOf(working.values());
            if (!after.equals(before)) {
                repository.save(new HotSnapshot(ownerId, after));
                published.put(ownerId, after);
            }
            return result;
        }
    }

    private List<MemoryItem> current(String ownerId) throws IOException {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        List<MemoryItem> entries = published.get(ownerId);
        if (entries != null) {
            return entries;
        }
        synchronized (writeLockFor(ownerId)) {
            entries = published.get(ownerId);
            if (entries == null) {
                entries = repository.load(ownerId).map(HotSnapshot::items).orElse(List.of());
                published.put(ownerId, entries);
            }
            return entries;
        }
    }

    private HotEviction eviction(MemoryItem item, HotEviction.Reason reason) {
        return new HotEviction(item, reason, item.importance() > hotFloor);
    }

    private Object writeLockFor(String ownerId) {
        return writeLocks.computeIfAbsent(ownerId, ignored -> new Object());
    }
}
