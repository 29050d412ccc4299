package io.eventwatch.registry;

import io.eventwatch.WatchCallback;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe mapping from stream id to the subscriptions registered on it.
 *
 * <p>Subscriptions are kept in registration order. A stream id is present exactly while it has
 * at least one subscription.
 *
 * <h2>Thread Safety</h2>
 * <p>Every operation runs under a single {@link ReentrantLock} that guards both the map and the
 * per-stream lists, so a reader never observes a partially applied update. The lock is held for
 * in-memory work only. {@link #snapshot(String)} returns a copy, which the watch loop then uses
 * outside the lock for fetching and callback invocation.
 *
 * <p>The lock is exposed through {@link #lock()} so that the owning
 * {@link io.eventwatch.EventWatcher} can guard its lifecycle transitions with the same
 * mutual-exclusion primitive.
 */
public final class SubscriberRegistry {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<Subscription>> subscriptions = new HashMap<>();

    /**
     * Appends a subscription for {@code streamId}, creating the stream entry if absent.
     *
     * @param streamId the stream id
     * @param cursor   lowest position to deliver
     * @param callback the callback
     */
    public void add(String streamId, long cursor, WatchCallback callback) {
        Objects.requireNonNull(streamId, "streamId");
        Subscription subscription = new Subscription(cursor, callback);
        lock.lock();
        try {
            subscriptions.computeIfAbsent(streamId, ignored -> new ArrayList<>()).add(subscription);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every subscription of {@code callback} (by identity) under {@code streamId}. The
     * stream entry is dropped when its last subscription goes. Unknown streams or callbacks are
     * ignored.
     *
     * @param streamId the stream id
     * @param callback the callback passed to {@link #add}
     * @return the number of subscriptions removed
     */
    public int remove(String streamId, WatchCallback callback) {
        lock.lock();
        try {
            List<Subscription> list = subscriptions.get(streamId);
            if (list == null) {
                return 0;
            }
            int before = list.size();
            list.removeIf(s -> s.callback() == callback);
            if (list.isEmpty()) {
                subscriptions.remove(streamId);
            }
            return before - list.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether any subscription exists for {@code streamId}.
     *
     * @param streamId the stream id
     * @return {@code true} if the stream is watched
     */
    public boolean has(String streamId) {
        lock.lock();
        try {
            return subscriptions.containsKey(streamId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an immutable copy of the subscriptions for {@code streamId}, in registration order.
     *
     * @param streamId the stream id
     * @return the subscriptions, empty if the stream is not watched
     */
    public List<Subscription> snapshot(String streamId) {
        lock.lock();
        try {
            List<Subscription> list = subscriptions.get(streamId);
            return list == null ? List.of() : List.copyOf(list);
        } finally {
            lock.unlock();
        }
    }

    public int streamCount() {
        lock.lock();
        try {
            return subscriptions.size();
        } finally {
            lock.unlock();
        }
    }

    public int subscriptionCount() {
        lock.lock();
        try {
            int count = 0;
            for (List<Subscription> list : subscriptions.values()) {
                count += list.size();
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the lock guarding this registry.
     *
     * @return the registry lock
     */
    public ReentrantLock lock() {
        return lock;
    }
}
