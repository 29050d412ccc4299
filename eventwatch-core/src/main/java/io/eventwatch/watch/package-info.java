/**
 * The background watch loop and its cancellation and reconnect primitives.
 *
 * <p>{@link io.eventwatch.watch.WatchLoop} runs on exactly one worker thread per
 * {@link io.eventwatch.EventWatcher}. Shutdown is cooperative: the
 * {@link io.eventwatch.watch.CancellationSignal} is checked at every poll timeout, so a close
 * completes within one poll interval of the signal (plus any callback in flight).
 */
package io.eventwatch.watch;
