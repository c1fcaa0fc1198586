package io.strata.core.archive;

/**
 * Produces the redacted form of an archived payload. The form is committed into each chunk's
 * content hash at append time, so it must be deterministic and idempotent.
 */
@FunctionalInterface
public interface PayloadRedaction {
    String redact(String payload);
}
