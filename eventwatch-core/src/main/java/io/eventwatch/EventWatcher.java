package io.eventwatch;

import io.eventwatch.registry.SubscriberRegistry;
import io.eventwatch.spi.MetricsExporter;
import io.eventwatch.spi.NotificationSource;
import io.eventwatch.spi.RecordFetcher;
import io.eventwatch.util.DaemonThreadFactory;
import io.eventwatch.watch.CancellationSignal;
import io.eventwatch.watch.ReconnectPolicy;
import io.eventwatch.watch.WatchLoop;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Watches an append-only event log for new records and delivers them to per-stream callbacks.
 *
 * <p>The first {@link #watch} call starts exactly one background {@link WatchLoop} thread, which
 * listens on the notification channel until {@link #close()}. Removing every subscription does
 * not stop the loop.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <h2>Delivery</h2>
 * <p>Delivery is at-least-once from the point a subscription is registered, and bounded by what
 * the notification channel delivers: notifications published before the loop started listening,
 * or while its connection was down, are not replayed. A subscriber only receives records whose
 * position is at or after its cursor. For a single stream, every subscriber sees positions in
 * notification order; there is no ordering across streams.
 *
 * <h2>Thread Safety</h2>
 * <p>This class is thread-safe. {@link #watch}, {@link #unwatch} and {@link #close()} may be
 * called from any thread. Lifecycle transitions and subscription changes share the registry's
 * lock, so concurrent first calls to {@code watch} start a single worker.
 *
 * <h2>Liveness</h2>
 * <p>Without a {@link ReconnectPolicy}, a transport failure ends the worker and no further
 * records are delivered. {@link #isRunning()} reports this; callers that hold long-lived watches
 * should check it and re-subscribe through a new watcher.
 *
 * @see WatchCallback
 * @see EventWatcher.Builder
 */
public final class EventWatcher implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(EventWatcher.class.getName());

    /** Channel the log store notifies on by default. */
    public static final String DEFAULT_CHANNEL = "run_events";

    private final NotificationSource notificationSource;
    private final RecordFetcher recordFetcher;
    private final String channel;
    private final MetricsExporter metrics;
    private final ReconnectPolicy reconnectPolicy;
    private final DaemonThreadFactory threadFactory;
    private final SubscriberRegistry registry = new SubscriberRegistry();
    private final ReentrantLock lock = registry.lock();

    private volatile WatcherState state = WatcherState.IDLE;
    private volatile WatchLoop loop;
    private volatile Thread worker;
    private CancellationSignal signal;

    private EventWatcher(Builder builder) {
        this.notificationSource = Objects.requireNonNull(builder.notificationSource, "notificationSource");
        this.recordFetcher = Objects.requireNonNull(builder.recordFetcher, "recordFetcher");
        this.channel = Objects.requireNonNull(builder.channel, "channel");
        if (channel.isEmpty()) {
            throw new IllegalArgumentException("channel must not be empty");
        }
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.reconnectPolicy = builder.reconnectPolicy;
        this.threadFactory = new DaemonThreadFactory(
                Objects.requireNonNull(builder.threadNamePrefix, "threadNamePrefix"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Subscribes {@code callback} to records of {@code streamId} at positions &ge; {@code cursor}.
     * Starts the worker thread on first use.
     *
     * <p>The same callback may be registered several times; each registration is delivered to
     * independently until {@link #unwatch} removes them all.
     *
     * @param streamId the stream to watch
     * @param cursor   lowest position to deliver
     * @param callback receives matching records on the worker thread
     * @throws IllegalArgumentException if {@code streamId} is empty
     * @throws IllegalStateException    if the watcher has been closed
     */
    public void watch(String streamId, long cursor, WatchCallback callback) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(callback, "callback");
        if (streamId.isEmpty()) {
            throw new IllegalArgumentException("streamId must not be empty");
        }
        lock.lock();
        try {
            if (state == WatcherState.CLOSING || state == WatcherState.STOPPED) {
                throw new IllegalStateException("EventWatcher has been closed");
            }
            if (state == WatcherState.IDLE) {
                startLoop();
            }
            registry.add(streamId, cursor, callback);
            metrics.recordActiveStreams(registry.streamCount());
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void startLoop() {
        signal = new CancellationSignal();
        WatchLoop newLoop = new WatchLoop(notificationSource, channel, registry, recordFetcher,
                metrics, signal, reconnectPolicy);
        Thread thread = threadFactory.newThread(() -> {
            try {
                newLoop.run();
            } finally {
                workerExited();
            }
        });
        thread.start();
        loop = newLoop;
        worker = thread;
        state = WatcherState.RUNNING;
        logger.fine(() -> "Started watcher thread " + thread.getName() + " on channel " + channel);
    }

    private void workerExited() {
        lock.lock();
        try {
            if (state == WatcherState.CLOSING) {
                state = WatcherState.STOPPED;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every subscription of {@code callback} under {@code streamId}. Unknown streams and
     * callbacks are ignored. The worker thread keeps running.
     *
     * @param streamId the stream id passed to {@link #watch}
     * @param callback the callback passed to {@link #watch}
     */
    public void unwatch(String streamId, WatchCallback callback) {
        if (streamId == null || callback == null) {
            return;
        }
        lock.lock();
        try {
            registry.remove(streamId, callback);
            metrics.recordActiveStreams(registry.streamCount());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether {@code streamId} has at least one subscription.
     *
     * @param streamId the stream id
     * @return {@code true} if watched
     */
    public boolean hasStream(String streamId) {
        return registry.has(streamId);
    }

    /**
     * Returns the number of active subscriptions across all streams.
     *
     * @return the subscription count
     */
    public int subscriptionCount() {
        return registry.subscriptionCount();
    }

    public WatcherState state() {
        return state;
    }

    public String channel() {
        return channel;
    }

    /**
     * Returns whether the worker thread is alive. This turns {@code false} after {@link #close()}
     * and also when the loop has stopped on its own after a transport failure.
     *
     * @return {@code true} if notifications are still being consumed
     */
    public boolean isRunning() {
        Thread thread = worker;
        return thread != null && thread.isAlive();
    }

    /**
     * Waits until the worker has opened its notification stream. Notifications published before
     * that point are not seen by this watcher.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of {@code timeout}
     * @return {@code true} if the worker is listening, {@code false} on timeout or if never started
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitListening(long timeout, TimeUnit unit) throws InterruptedException {
        WatchLoop current = loop;
        return current != null && current.awaitListening(timeout, unit);
    }

    /**
     * Signals the worker to stop and waits for it to exit. The worker observes the signal at its
     * next poll timeout, so this returns within about one poll interval, plus the time of a
     * callback already in progress. Idempotent; a no-op if no watch was ever started.
     *
     * <p>Called from a callback, or interrupted while waiting, this returns with the watcher still
     * {@link WatcherState#CLOSING}; the state becomes {@link WatcherState#STOPPED} when the worker
     * thread exits.
     */
    @Override
    public void close() {
        Thread toJoin;
        lock.lock();
        try {
            if (state == WatcherState.CLOSING || state == WatcherState.STOPPED) {
                return;
            }
            if (state == WatcherState.IDLE) {
                state = WatcherState.STOPPED;
                return;
            }
            state = WatcherState.CLOSING;
            signal.set();
            toJoin = worker;
        } finally {
            lock.unlock();
        }

        // Called from a callback: the worker moves to STOPPED itself once the callback returns.
        if (toJoin == Thread.currentThread()) {
            return;
        }
        try {
            toJoin.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Interrupted while waiting for " + toJoin.getName() + " to exit", e);
            return;
        }

        lock.lock();
        try {
            state = WatcherState.STOPPED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builder for {@link EventWatcher}.
     */
    public static final class Builder {
        private NotificationSource notificationSource;
        private RecordFetcher recordFetcher;
        private String channel = DEFAULT_CHANNEL;
        private MetricsExporter metrics;
        private ReconnectPolicy reconnectPolicy;
        private String threadNamePrefix = "eventwatch-";

        private Builder() {
        }

        /**
         * Sets the source of raw notifications.
         *
         * <p><b>Required.</b>
         *
         * @param notificationSource the notification transport
         * @return this builder
         */
        public Builder notificationSource(NotificationSource notificationSource) {
            this.notificationSource = notificationSource;
            return this;
        }

        /**
         * Sets the fetcher used to load each notified record.
         *
         * <p><b>Required.</b>
         *
         * @param recordFetcher the record fetcher
         * @return this builder
         */
        public Builder recordFetcher(RecordFetcher recordFetcher) {
            this.recordFetcher = recordFetcher;
            return this;
        }

        /**
         * Sets the channel to listen on.
         *
         * <p>Optional. Defaults to {@value EventWatcher#DEFAULT_CHANNEL}.
         *
         * @param channel the channel name
         * @return this builder
         */
        public Builder channel(String channel) {
            this.channel = channel;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Enables re-subscribing after a transport failure.
         *
         * <p>Optional. By default the worker stops on the first transport failure.
         *
         * @param reconnectPolicy the reconnect policy, or {@code null} for fail-stop
         * @return this builder
         */
        public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        /**
         * Sets the worker thread name prefix.
         *
         * <p>Optional. Defaults to {@code "eventwatch-"}.
         *
         * @param threadNamePrefix the prefix
         * @return this builder
         */
        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
            return this;
        }

        /**
         * Builds the watcher. No thread is started until the first {@link EventWatcher#watch}.
         *
         * @return a new {@link EventWatcher}
         * @throws NullPointerException     if {@code notificationSource} or {@code recordFetcher} is null
         * @throws IllegalArgumentException if {@code channel} is empty
         */
        public EventWatcher build() {
            return new EventWatcher(this);
        }
    }
}
