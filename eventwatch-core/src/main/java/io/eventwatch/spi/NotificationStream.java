package io.eventwatch.spi;

import io.eventwatch.notify.NotificationEvent;

import java.util.Iterator;

/**
 * Lazy, unbounded sequence of notification events produced by a {@link NotificationSource}.
 *
 * <p>{@link #hasNext()} blocks for at most one poll interval and yields either a
 * {@link NotificationEvent.Payload} or the {@link NotificationEvent#TIMEOUT} marker. It never
 * throws for an empty interval. It returns {@code false} once the cancellation signal is observed
 * or the underlying transport has failed irrecoverably; the stream does not reconnect.
 *
 * <p>Not thread-safe: a stream is consumed by a single thread. {@link #close()} releases the
 * transport and is idempotent.
 */
public interface NotificationStream extends Iterator<NotificationEvent>, AutoCloseable {

    /**
     * Returns whether the stream ended because its transport failed, as opposed to
     * cancellation or an explicit close.
     *
     * @return {@code true} if the stream is exhausted due to a transport failure
     */
    boolean failed();

    @Override
    void close();
}
