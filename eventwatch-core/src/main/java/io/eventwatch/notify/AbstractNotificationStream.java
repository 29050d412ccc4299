package io.eventwatch.notify;

import io.eventwatch.spi.NotificationStream;
import io.eventwatch.watch.CancellationSignal;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for transports that deliver payloads in batches from a blocking poll.
 *
 * <p>Subclasses implement {@link #open()}, {@link #poll(long)} and {@link #release()}. This class
 * handles laziness (the transport is opened on the first {@link #hasNext()}), buffering of
 * multi-payload batches, timeout markers, cooperative cancellation and fail-stop: any exception
 * from the transport ends the stream and is logged, never rethrown to the consumer.
 */
public abstract class AbstractNotificationStream implements NotificationStream {
    private static final Logger logger = Logger.getLogger(AbstractNotificationStream.class.getName());

    private final String channel;
    private final CancellationSignal signal;
    private final long pollIntervalMs;
    private final Deque<String> buffered = new ArrayDeque<>();

    private NotificationEvent next;
    private boolean opened;
    private boolean ended;
    private boolean failed;
    private boolean released;

    protected AbstractNotificationStream(String channel, CancellationSignal signal, long pollIntervalMs) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.signal = Objects.requireNonNull(signal, "signal");
        if (pollIntervalMs <= 0L) {
            throw new IllegalArgumentException("pollIntervalMs must be > 0");
        }
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Acquires the transport and starts listening on the channel.
     *
     * @throws Exception if the transport cannot be opened; ends the stream as failed
     */
    protected abstract void open() throws Exception;

    /**
     * Waits up to {@code timeoutMs} for payloads.
     *
     * @param timeoutMs maximum time to block
     * @return the payloads received, empty on timeout
     * @throws Exception if the transport failed; ends the stream as failed
     */
    protected abstract List<String> poll(long timeoutMs) throws Exception;

    /**
     * Releases the transport. Called at most once, and only after a successful {@link #open()}.
     *
     * @throws Exception if releasing fails; logged and ignored
     */
    protected abstract void release() throws Exception;

    protected final String channel() {
        return channel;
    }

    @Override
    public final boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (ended) {
            return false;
        }
        if (!buffered.isEmpty()) {
            next = NotificationEvent.payload(buffered.poll());
            return true;
        }
        if (signal.isSet()) {
            end(false);
            return false;
        }
        try {
            if (!opened) {
                opened = true;
                open();
            }
            List<String> payloads = poll(pollIntervalMs);
            if (payloads == null || payloads.isEmpty()) {
                next = NotificationEvent.TIMEOUT;
            } else {
                buffered.addAll(payloads);
                next = NotificationEvent.payload(buffered.poll());
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            end(false);
            return false;
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Notification transport failed on channel " + channel
                    + "; stream ended", e);
            end(true);
            return false;
        }
    }

    @Override
    public final NotificationEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Notification stream on " + channel + " has ended");
        }
        NotificationEvent event = next;
        next = null;
        return event;
    }

    @Override
    public final boolean failed() {
        return failed;
    }

    @Override
    public final void close() {
        ended = true;
        next = null;
        buffered.clear();
        releaseOnce();
    }

    private void end(boolean failure) {
        ended = true;
        failed = failure;
        releaseOnce();
    }

    private void releaseOnce() {
        if (!opened || released) {
            return;
        }
        released = true;
        try {
            release();
        } catch (Exception e) {
            logger.log(Level.WARNING, "Failed to release notification transport on channel " + channel, e);
        }
    }
}
