package io.eventwatch.watch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Reconnect policy using exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay},
 * with random jitter in the range [0.5, 1.5).
 */
public final class ExponentialBackoffReconnectPolicy implements ReconnectPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final int maxAttempts;

  /**
   * @param baseDelayMs base delay for the first reconnect (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param maxAttempts consecutive failures tolerated before giving up
   */
  public ExponentialBackoffReconnectPolicy(long baseDelayMs, long maxDelayMs, int maxAttempts) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.maxAttempts = maxAttempts;
  }

  @Override
  public long computeDelayMs(int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempt >= 31) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempt - 1);
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }

  @Override
  public int maxAttempts() {
    return maxAttempts;
  }
}
