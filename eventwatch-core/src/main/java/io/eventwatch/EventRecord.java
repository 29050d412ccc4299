package io.eventwatch;

import java.util.Objects;

/**
 * A materialized entry of the event log, fetched on demand for a notified position.
 *
 * <p>The watcher only inspects {@link #streamId()} and {@link #position()}; the event body is
 * carried through to callbacks untouched.
 *
 * @param streamId  the stream (run id) the record was appended to
 * @param position  store-assigned position of the record
 * @param eventJson serialized event body, may be {@code null} if the store holds none
 */
public record EventRecord(String streamId, long position, String eventJson) {

    public EventRecord {
        Objects.requireNonNull(streamId, "streamId");
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0, got: " + position);
        }
    }
}
