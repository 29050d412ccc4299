package io.eventwatch.watch;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cooperative cancellation flag.
 *
 * <p>Once {@link #set()}, the signal stays set. Waiters in {@link #await(long)} wake up
 * immediately when it is set.
 */
public final class CancellationSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void set() {
        latch.countDown();
    }

    public boolean isSet() {
        return latch.getCount() == 0;
    }

    /**
     * Waits until the signal is set or the timeout elapses.
     *
     * @param timeoutMs maximum time to wait in milliseconds
     * @return {@code true} if the signal was set
     * @throws InterruptedException if the calling thread is interrupted
     */
    public boolean await(long timeoutMs) throws InterruptedException {
        return latch.await(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
