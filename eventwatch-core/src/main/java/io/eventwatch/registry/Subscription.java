package io.eventwatch.registry;

import io.eventwatch.WatchCallback;

import java.util.Objects;

/**
 * A callback registered on one stream together with its starting cursor.
 *
 * @param cursor   lowest position delivered to {@code callback}
 * @param callback the callback
 */
public record Subscription(long cursor, WatchCallback callback) {

    public Subscription {
        Objects.requireNonNull(callback, "callback");
    }

    /**
     * Returns whether a record at {@code position} should be delivered to this subscription.
     *
     * @param position the record position
     * @return {@code true} if {@code position >= cursor}
     */
    public boolean admits(long position) {
        return position >= cursor;
    }
}
