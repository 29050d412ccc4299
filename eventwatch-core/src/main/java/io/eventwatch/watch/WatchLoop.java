package io.eventwatch.watch;

import io.eventwatch.EventRecord;
import io.eventwatch.notify.NotificationEvent;
import io.eventwatch.notify.NotificationPayloads;
import io.eventwatch.notify.StreamNotification;
import io.eventwatch.registry.Subscription;
import io.eventwatch.registry.SubscriberRegistry;
import io.eventwatch.spi.MetricsExporter;
import io.eventwatch.spi.NotificationSource;
import io.eventwatch.spi.NotificationStream;
import io.eventwatch.spi.RecordFetcher;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single consumer of a {@link NotificationSource}: decodes payloads, looks up subscribers,
 * fetches each notified record once and fans it out.
 *
 * <p>Per notification:
 * <ol>
 *   <li>Malformed payloads are discarded.</li>
 *   <li>Notifications for streams with no subscription are discarded.</li>
 *   <li>The subscription list is snapshotted and the record is fetched exactly once, whether or
 *       not any cursor admits its position. A missing record (fetch/commit race) is skipped.</li>
 *   <li>Every subscription whose cursor admits the position gets its callback run synchronously,
 *       in registration order. A throwing callback is logged and does not affect the others.</li>
 * </ol>
 *
 * <p>The loop ends when the cancellation signal is observed at a timeout boundary, or when the
 * source stream fails and no {@link ReconnectPolicy} is configured (or the policy is exhausted).
 * Pending subscriptions are not notified when the loop ends.
 */
public final class WatchLoop implements Runnable {
    private static final Logger logger = Logger.getLogger(WatchLoop.class.getName());

    private final NotificationSource source;
    private final String channel;
    private final SubscriberRegistry registry;
    private final RecordFetcher fetcher;
    private final MetricsExporter metrics;
    private final CancellationSignal signal;
    private final ReconnectPolicy reconnectPolicy;
    private final CountDownLatch firstListen = new CountDownLatch(1);

    private volatile boolean listening;

    public WatchLoop(NotificationSource source,
                     String channel,
                     SubscriberRegistry registry,
                     RecordFetcher fetcher,
                     MetricsExporter metrics,
                     CancellationSignal signal,
                     ReconnectPolicy reconnectPolicy) {
        this.source = Objects.requireNonNull(source, "source");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
        this.signal = Objects.requireNonNull(signal, "signal");
        this.reconnectPolicy = reconnectPolicy;
    }

    @Override
    public void run() {
        int failures = 0;
        while (!signal.isSet()) {
            boolean failed;
            boolean connected;
            try (NotificationStream stream = source.subscribe(channel, signal)) {
                failed = consume(stream);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Notification source failed on channel " + channel, e);
                failed = true;
            } finally {
                connected = listening;
                listening = false;
            }
            if (!failed || signal.isSet()) {
                break;
            }
            if (reconnectPolicy == null) {
                logger.warning("Notification stream on channel " + channel
                        + " failed; watcher stops receiving notifications");
                break;
            }
            failures = connected ? 1 : failures + 1;
            if (failures > reconnectPolicy.maxAttempts()) {
                logger.severe("Giving up on channel " + channel + " after " + reconnectPolicy.maxAttempts()
                        + " consecutive reconnect attempts");
                break;
            }
            long delayMs = reconnectPolicy.computeDelayMs(failures);
            logger.warning("Reconnecting to channel " + channel + " in " + delayMs + " ms (attempt "
                    + failures + ")");
            try {
                if (signal.await(delayMs)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            metrics.incrementReconnects();
        }
    }

    /**
     * Drains {@code stream} until cancellation or failure.
     *
     * @return {@code true} if the stream ended because its transport failed
     */
    private boolean consume(NotificationStream stream) {
        while (stream.hasNext()) {
            if (!listening) {
                listening = true;
                firstListen.countDown();
            }
            NotificationEvent event = stream.next();
            if (event instanceof NotificationEvent.Payload payload) {
                handle(payload.payload());
            } else if (signal.isSet()) {
                return false;
            }
        }
        return stream.failed();
    }

    /**
     * Processes one raw payload. Package-private so tests can drive dispatch without a thread.
     */
    void handle(String payload) {
        metrics.incrementNotificationsReceived();
        Optional<StreamNotification> parsed = NotificationPayloads.parse(payload);
        if (parsed.isEmpty()) {
            metrics.incrementNotificationsMalformed();
            logger.fine(() -> "Discarding malformed notification payload: " + payload);
            return;
        }
        String streamId = parsed.get().streamId();
        long position = parsed.get().position();
        if (!registry.has(streamId)) {
            metrics.incrementNotificationsIgnored();
            return;
        }
        List<Subscription> subscriptions = registry.snapshot(streamId);

        Optional<EventRecord> record;
        try {
            record = fetcher.fetch(streamId, position);
        } catch (RuntimeException e) {
            metrics.incrementFetchFailures();
            logger.log(Level.SEVERE, "Failed to fetch record " + position + " of stream " + streamId, e);
            return;
        }
        if (record.isEmpty()) {
            metrics.incrementFetchMisses();
            logger.fine(() -> "No record at position " + position + " for stream " + streamId);
            return;
        }

        for (Subscription subscription : subscriptions) {
            if (!subscription.admits(position)) {
                continue;
            }
            try {
                subscription.callback().onRecord(record.get());
                metrics.incrementRecordsDelivered();
            } catch (Exception e) {
                metrics.incrementCallbackFailures();
                logger.log(Level.WARNING, "Callback failed for record " + position + " of stream " + streamId, e);
            }
        }
    }

    /**
     * Returns whether the loop currently holds an open, listening stream.
     *
     * @return {@code true} while listening
     */
    public boolean isListening() {
        return listening;
    }

    /**
     * Waits until the loop has started listening for the first time.
     *
     * @param timeout maximum time to wait
     * @param unit    unit of {@code timeout}
     * @return {@code true} if the loop has listened
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitListening(long timeout, TimeUnit unit) throws InterruptedException {
        return firstListen.await(timeout, unit);
    }
}
