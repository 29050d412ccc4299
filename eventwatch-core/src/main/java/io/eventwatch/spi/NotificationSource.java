package io.eventwatch.spi;

import io.eventwatch.watch.CancellationSignal;

/**
 * Wraps a store's native publish/subscribe primitive.
 *
 * <p>Each call to {@link #subscribe} produces an independent, lazy {@link NotificationStream}:
 * no transport resource is acquired until the stream is first advanced. Streams are not
 * restarted in place; a consumer that wants to resume after a transport failure subscribes again.
 *
 * @see NotificationStream
 */
public interface NotificationSource {

    /**
     * Subscribes to {@code channel}.
     *
     * @param channel the channel name to listen on
     * @param signal  cooperative cancellation signal; the stream ends at the next timeout boundary
     *                after it is set
     * @return an unbounded stream of payloads and timeout markers
     */
    NotificationStream subscribe(String channel, CancellationSignal signal);
}
