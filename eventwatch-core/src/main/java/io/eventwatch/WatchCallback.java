package io.eventwatch;

/**
 * Receives records appended to a watched stream.
 *
 * <h2>Execution Model</h2>
 * <p>Callbacks run <b>synchronously</b> on the watcher's single worker thread, one record at a
 * time. A slow callback delays delivery to every other subscription of the same watcher.
 * Hand work off to an executor if it may block.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown by a callback is logged and counted; delivery continues with the next
 * subscription and the worker keeps running. The record is not redelivered.
 *
 * <h2>Identity</h2>
 * <p>{@link EventWatcher#unwatch(String, WatchCallback)} removes subscriptions by callback
 * identity, so keep a reference to the instance passed to
 * {@link EventWatcher#watch(String, long, WatchCallback)}.
 *
 * @see EventWatcher
 */
@FunctionalInterface
public interface WatchCallback {

    /**
     * Handles a record whose position is at or after the subscription's cursor.
     *
     * @param record the fetched record
     * @throws Exception if handling fails; logged by the watcher and otherwise ignored
     */
    void onRecord(EventRecord record) throws Exception;
}
