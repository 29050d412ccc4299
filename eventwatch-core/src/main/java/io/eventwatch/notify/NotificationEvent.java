package io.eventwatch.notify;

import java.util.Objects;

/**
 * Item yielded by a {@link io.eventwatch.spi.NotificationStream}.
 *
 * <ul>
 *   <li>{@link Payload}: a raw payload string delivered on the channel.</li>
 *   <li>{@link Timeout}: nothing arrived within one poll interval. Consumers use it as the
 *       point at which to check for cancellation.</li>
 * </ul>
 */
public sealed interface NotificationEvent permits NotificationEvent.Payload, NotificationEvent.Timeout {

    /**
     * Singleton marker for an empty poll interval.
     */
    Timeout TIMEOUT = new Timeout();

    /**
     * Creates a payload event.
     *
     * @param payload the raw payload, as published
     * @return the event
     */
    static Payload payload(String payload) {
        return new Payload(payload);
    }

    /**
     * A raw notification payload.
     *
     * @param payload the payload string (never null)
     */
    record Payload(String payload) implements NotificationEvent {
        public Payload {
            Objects.requireNonNull(payload, "payload");
        }
    }

    /**
     * No notification arrived within the poll interval.
     */
    record Timeout() implements NotificationEvent {
    }
}
