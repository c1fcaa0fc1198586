package io.strata.core.hot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.strata.core.memory.MemoryItem;
import java.util.List;

/**
 * Persisted form of one owner's hot tier, oldest insert first.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HotSnapshot(String ownerId, List<MemoryItem> items) {
    public HotSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
