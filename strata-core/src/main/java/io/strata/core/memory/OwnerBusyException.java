package io.strata.core.memory;

/**
 * Thrown in fail-fast mode when a mutation is attempted while another mutation for the same owner
 * is in flight.
 */
public final class OwnerBusyException extends IllegalStateException {

    public OwnerBusyException(String ownerId) {
        super("Another mutation is in flight for owner " + ownerId);
    }
}
