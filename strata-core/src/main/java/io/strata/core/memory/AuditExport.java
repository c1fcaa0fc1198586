package io.strata.core.memory;

import io.strata.core.archive.ArchiveStats;
import io.strata.core.archive.ArchivedPayload;
import io.strata.core.archive.ChainReport;
import java.time.Instant;
import java.util.List;

/**
 * Verified copy of an owner's cold chain for external review. Redacted entries carry their
 * redacted body.
 */
public record AuditExport(
    String ownerId,
    Instant exportedAt,
    ChainReport verification,
    List<ArchivedPayload> entries,
    ArchiveStats stats
) {
}
