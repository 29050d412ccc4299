package io.eventwatch.watch;

/**
 * Strategy for re-subscribing to the notification source after a transport failure.
 *
 * <p>Without a policy the watch loop is fail-stop: it exits on the first transport failure.
 *
 * @see ExponentialBackoffReconnectPolicy
 */
public interface ReconnectPolicy {

    /**
     * Computes the delay before the next reconnect attempt.
     *
     * @param attempt consecutive failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);

    /**
     * Maximum number of consecutive failures tolerated before the loop gives up.
     *
     * @return the attempt limit, &ge; 1
     */
    int maxAttempts();
}
