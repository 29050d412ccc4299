package io.eventwatch;

/**
 * Unchecked exception thrown by a {@link io.eventwatch.spi.RecordFetcher} when a record
 * cannot be read because of a store failure, as opposed to a record that is simply not there.
 */
public final class RecordFetchException extends RuntimeException {
    public RecordFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
