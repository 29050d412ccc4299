package io.eventwatch.spi;

import io.eventwatch.EventRecord;

import java.util.Optional;

/**
 * Reads a single event record from the log store by position.
 *
 * <p>Must be safe to call concurrently with log writers. The watcher calls it at most once per
 * notification, from its worker thread.
 */
public interface RecordFetcher {

    /**
     * Fetches the record stored at {@code position} for {@code streamId}.
     *
     * <p>An empty result means the record is not visible (yet, or any more). For a position that
     * was just notified this is a fetch/commit race and is not treated as an error.
     *
     * @param streamId the stream the record was appended to
     * @param position the store-assigned position
     * @return the record, or empty if it is not found
     * @throws io.eventwatch.RecordFetchException if the store cannot be read
     */
    Optional<EventRecord> fetch(String streamId, long position);
}
