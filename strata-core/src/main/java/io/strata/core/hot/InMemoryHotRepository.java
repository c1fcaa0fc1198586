package io.strata.core.hot;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryHotRepository implements HotRepository {
    private final Map<String, HotSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<HotSnapshot> load(String ownerId) {
        return Optional.ofNullable(snapshots.get(ownerId));
    }

    @Override
    public void save(HotSnapshot snapshot) {
        snapshots.put(snapshot.ownerId(), snapshot);
    }

    @Override
    public List<String> owners() {
        return List.copyOf(snapshots.keySet());
    }
}
