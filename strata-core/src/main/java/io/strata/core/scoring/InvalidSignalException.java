package io.strata.core.scoring;

public final class InvalidSignalException extends IllegalArgumentException {

    public InvalidSignalException(String message) {
        super(message);
    }
}
