package io.eventwatch;

/**
 * Lifecycle of an {@link EventWatcher}.
 *
 * <p>Transitions only move forward: {@code IDLE -> RUNNING -> CLOSING -> STOPPED}, or
 * {@code IDLE -> STOPPED} when a watcher is closed before its first subscription.
 */
public enum WatcherState {
    /** No worker thread has been started. */
    IDLE,
    /** The worker thread was started by the first {@code watch} call. */
    RUNNING,
    /** Cancellation has been signalled; waiting for the worker to exit. */
    CLOSING,
    /** The worker has been joined (or was never started) and the watcher is closed. */
    STOPPED
}
