package io.strata.core.memory;

import java.time.Instant;
import java.util.Objects;

public record MemoryItem(
    String id,
    String ownerId,
    String sessionId,
    TurnContent content,
    double importance,
    Instant createdAt,
    Instant lastReferencedAt,
    MemoryTier tier,
    int accessCount
) {
    public MemoryItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        sessionId = sessionId == null ? "" : sessionId;
        content = content == null ? new TurnContent("", null, null, null) : content;
        if (importance < 0 || Double.isNaN(importance)) {
            throw new IllegalArgumentException("importance must be a non-negative number");
        }
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        lastReferencedAt = lastReferencedAt == null ? createdAt : lastReferencedAt;
        Objects.requireNonNull(tier, "tier must not be null");
        accessCount = Math.max(0, accessCount);
    }

    public MemoryItem touched(Instant now) {
        return new MemoryItem(id, ownerId, sessionId, content, importance, createdAt, now, tier, accessCount + 1);
    }

    public MemoryItem inTier(MemoryTier target) {
        return new MemoryItem(id, ownerId, sessionId, content, importance, createdAt, lastReferencedAt, target, accessCount);
    }
}
