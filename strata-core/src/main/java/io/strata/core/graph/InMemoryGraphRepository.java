package io.strata.core.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryGraphRepository implements GraphRepository {
    private final Map<String, WarmSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<WarmSnapshot> load(String ownerId) {
        return Optional.ofNullable(snapshots.get(ownerId));
    }

    @Override
    public void save(WarmSnapshot snapshot) {
        snapshots.put(snapshot.ownerId(), snapshot);
    }

    @Override
    public List<String> owners() {
        return List.copyOf(snapshots.keySet());
    }
}
