package io.eventwatch.notify;

import io.eventwatch.spi.NotificationSource;
import io.eventwatch.spi.NotificationStream;
import io.eventwatch.watch.CancellationSignal;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process {@link NotificationSource} with publish/subscribe semantics.
 *
 * <p>A payload published on a channel is delivered to every stream listening on that channel at
 * the time of the call, in publish order. Payloads published while nobody listens are dropped,
 * just like {@code NOTIFY} without a {@code LISTEN}. {@link #fail(String)} simulates a transport
 * loss for the streams currently listening.
 *
 * <p>This class is thread-safe.
 */
public final class QueueNotificationSource implements NotificationSource {
    private final long pollIntervalMs;
    private final Map<String, CopyOnWriteArrayList<QueueStream>> listeners = new ConcurrentHashMap<>();

    /**
     * Creates a source with the given poll interval.
     *
     * @param pollInterval how long a stream blocks before yielding a timeout marker
     */
    public QueueNotificationSource(Duration pollInterval) {
        Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollIntervalMs = pollInterval.toMillis();
    }

    @Override
    public NotificationStream subscribe(String channel, CancellationSignal signal) {
        return new QueueStream(channel, signal, pollIntervalMs);
    }

    /**
     * Publishes a payload to every stream currently listening on {@code channel}.
     *
     * @param channel the channel name
     * @param payload the raw payload
     * @return the number of streams the payload was delivered to
     */
    public int publish(String channel, String payload) {
        Objects.requireNonNull(payload, "payload");
        List<QueueStream> streams = listeners.get(channel);
        if (streams == null) {
            return 0;
        }
        int delivered = 0;
        for (QueueStream stream : streams) {
            if (stream.queue.offer(payload)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Breaks every stream currently listening on {@code channel}; their next poll fails.
     *
     * @param channel the channel name
     */
    public void fail(String channel) {
        List<QueueStream> streams = listeners.get(channel);
        if (streams != null) {
            for (QueueStream stream : new ArrayList<>(streams)) {
                stream.broken = true;
            }
        }
    }

    /**
     * Returns the number of streams currently listening on {@code channel}.
     *
     * @param channel the channel name
     * @return the listener count
     */
    public int listenerCount(String channel) {
        List<QueueStream> streams = listeners.get(channel);
        return streams == null ? 0 : streams.size();
    }

    private final class QueueStream extends AbstractNotificationStream {
        private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
        private volatile boolean broken;

        QueueStream(String channel, CancellationSignal signal, long pollIntervalMs) {
            super(channel, signal, pollIntervalMs);
        }

        @Override
        protected void open() {
            listeners.computeIfAbsent(channel(), ignored -> new CopyOnWriteArrayList<>()).add(this);
        }

        @Override
        protected List<String> poll(long timeoutMs) throws InterruptedException {
            checkBroken();
            String first = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            checkBroken();
            if (first == null) {
                return List.of();
            }
            List<String> batch = new ArrayList<>();
            batch.add(first);
            queue.drainTo(batch);
            return batch;
        }

        @Override
        protected void release() {
            List<QueueStream> streams = listeners.get(channel());
            if (streams != null) {
                streams.remove(this);
            }
        }

        private void checkBroken() {
            if (broken) {
                throw new IllegalStateException("Connection to channel " + channel() + " lost");
            }
        }
    }
}
