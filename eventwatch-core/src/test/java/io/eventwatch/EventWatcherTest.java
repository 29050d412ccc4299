package io.eventwatch;

import io.eventwatch.notify.NotificationPayloads;
import io.eventwatch.notify.QueueNotificationSource;
import io.eventwatch.watch.ExponentialBackoffReconnectPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventWatcherTest {
    private static final String CHANNEL = "run_events";

    private QueueNotificationSource source;
    private InMemoryRecordFetcher fetcher;
    private CountingMetrics metrics;
    private String threadPrefix;
    private EventWatcher watcher;

    @BeforeEach
    void setUp() {
        source = new QueueNotificationSource(Duration.ofMillis(20));
        fetcher = new InMemoryRecordFetcher();
        metrics = new CountingMetrics();
        threadPrefix = "watcher-test-" + UUID.randomUUID() + "-";
        watcher = newWatcher(null);
    }

    @AfterEach
    void tearDown() {
        watcher.close();
    }

    @Test
    void deliversOnlyPositionsAtOrAfterCursor() throws Exception {
        List<Long> seen = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        watcher.watch("run-1", 5, record -> {
            seen.add(record.position());
            latch.countDown();
        });
        awaitListening();

        append("run-1", 3);
        append("run-1", 5);
        append("run-1", 7);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(5L, 7L), seen);
    }

    @Test
    void subscribersWithDifferentCursors() throws Exception {
        List<Long> low = new CopyOnWriteArrayList<>();
        List<Long> high = new CopyOnWriteArrayList<>();
        CountDownLatch lowLatch = new CountDownLatch(2);
        watcher.watch("run-1", 0, record -> {
            low.add(record.position());
            lowLatch.countDown();
        });
        watcher.watch("run-1", 10, record -> high.add(record.position()));
        awaitListening();

        append("run-1", 10);
        append("run-1", 9);

        assertTrue(lowLatch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(10L, 9L), low);
        assertEquals(List.of(10L), high);
    }

    @Test
    void malformedPayloadDoesNotDisruptDelivery() throws Exception {
        List<Long> seen = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(2);
        watcher.watch("run-1", 0, record -> {
            seen.add(record.position());
            latch.countDown();
        });
        awaitListening();

        append("run-1", 1);
        source.publish(CHANNEL, "bad_payload_xyz");
        append("run-1", 2);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(1L, 2L), seen);
        assertEquals(1, metrics.malformed.get());
        assertTrue(watcher.isRunning());
    }

    @Test
    void notificationForOtherStreamIsNotDelivered() throws Exception {
        List<EventRecord> seen = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(1);
        watcher.watch("run-1", 0, record -> {
            seen.add(record);
            latch.countDown();
        });
        awaitListening();

        append("run-2", 1);
        append("run-1", 2);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(1, seen.size());
        assertEquals("run-1", seen.get(0).streamId());
        assertEquals(List.of(2L), fetcher.fetched());
    }

    @Test
    void oneFetchPerNotificationRegardlessOfSubscriberCount() throws Exception {
        CountDownLatch latch = new CountDownLatch(4);
        for (int i = 0; i < 4; i++) {
            watcher.watch("run-1", 0, record -> latch.countDown());
        }
        awaitListening();

        append("run-1", 1);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(1L), fetcher.fetched());
    }

    @Test
    void unwatchStopsDeliveryButKeepsLoopRunning() throws Exception {
        List<Long> removed = new CopyOnWriteArrayList<>();
        WatchCallback callback = record -> removed.add(record.position());
        watcher.watch("run-1", 0, callback);
        awaitListening();

        watcher.unwatch("run-1", callback);
        watcher.unwatch("run-1", callback);
        assertFalse(watcher.hasStream("run-1"));
        assertEquals(0, metrics.activeStreams.get());

        append("run-1", 1);
        CountDownLatch latch = new CountDownLatch(1);
        watcher.watch("run-2", 0, record -> latch.countDown());
        append("run-2", 2);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertTrue(removed.isEmpty());
        assertTrue(watcher.isRunning());
        assertEquals(WatcherState.RUNNING, watcher.state());
    }

    @Test
    void callbackFailureDoesNotKillLoop() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        watcher.watch("run-1", 0, record -> {
            throw new IllegalStateException("client disconnected");
        });
        watcher.watch("run-1", 0, record -> latch.countDown());
        awaitListening();

        append("run-1", 1);
        append("run-1", 2);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(2, metrics.callbackFailures.get());
        assertTrue(watcher.isRunning());
    }

    @Test
    void closeWithoutWatchReturnsImmediately() {
        long start = System.nanoTime();

        assertDoesNotThrow(() -> watcher.close());

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 100);
        assertEquals(WatcherState.STOPPED, watcher.state());
        assertEquals(0, liveWorkerThreads());
    }

    @Test
    void closeIsIdempotentAndJoinsWorker() throws Exception {
        watcher.watch("run-1", 0, record -> {});
        awaitListening();
        assertEquals(WatcherState.RUNNING, watcher.state());

        watcher.close();
        watcher.close();

        assertEquals(WatcherState.STOPPED, watcher.state());
        assertFalse(watcher.isRunning());
        assertEquals(0, liveWorkerThreads());
        assertEquals(0, source.listenerCount(CHANNEL));
    }

    @Test
    void closeReturnsWithinAboutOnePollInterval() throws Exception {
        QueueNotificationSource slowSource = new QueueNotificationSource(Duration.ofMillis(250));
        try (EventWatcher slow = EventWatcher.builder()
                .notificationSource(slowSource)
                .recordFetcher(fetcher)
                .threadNamePrefix(threadPrefix)
                .build()) {
            slow.watch("run-1", 0, record -> {});
            assertTrue(slow.awaitListening(5, TimeUnit.SECONDS));

            long start = System.nanoTime();
            slow.close();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(elapsedMs < 1_000, "close took " + elapsedMs + " ms");
            assertFalse(slow.isRunning());
        }
    }

    @Test
    void watchAfterCloseThrows() {
        watcher.close();

        assertThrows(IllegalStateException.class, () -> watcher.watch("run-1", 0, record -> {}));
    }

    @Test
    void watchRejectsEmptyStreamId() {
        assertThrows(IllegalArgumentException.class, () -> watcher.watch("", 0, record -> {}));

        assertEquals(WatcherState.IDLE, watcher.state());
        assertEquals(0, watcher.subscriptionCount());
        assertEquals(0, liveWorkerThreads());
    }

    @Test
    void closeFromCallbackStopsOnceWorkerExits() throws Exception {
        List<WatcherState> statesInCallback = new CopyOnWriteArrayList<>();
        List<Boolean> runningInCallback = new CopyOnWriteArrayList<>();
        CountDownLatch closed = new CountDownLatch(1);
        watcher.watch("run-1", 0, record -> {
            watcher.close();
            statesInCallback.add(watcher.state());
            runningInCallback.add(watcher.isRunning());
            closed.countDown();
        });
        awaitListening();

        append("run-1", 1);

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(WatcherState.CLOSING), statesInCallback);
        assertEquals(List.of(true), runningInCallback);
        assertTrue(eventually(() -> watcher.state() == WatcherState.STOPPED));
        assertTrue(eventually(() -> !watcher.isRunning()));
        assertEquals(0, metrics.callbackFailures.get());
    }

    @Test
    void interruptedCloseLeavesWatcherClosing() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        watcher.watch("run-1", 0, record -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
        });
        awaitListening();
        append("run-1", 1);
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Thread.currentThread().interrupt();
        watcher.close();

        assertTrue(Thread.interrupted());
        assertEquals(WatcherState.CLOSING, watcher.state());
        assertTrue(watcher.isRunning());

        release.countDown();

        assertTrue(eventually(() -> watcher.state() == WatcherState.STOPPED));
        assertTrue(eventually(() -> !watcher.isRunning()));
    }

    @Test
    void concurrentFirstWatchesStartOneWorker() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        for (int i = 0; i < callers; i++) {
            String streamId = "run-" + i;
            pool.submit(() -> {
                start.await();
                watcher.watch(streamId, 0, record -> {});
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(1, liveWorkerThreads());
        assertEquals(callers, watcher.subscriptionCount());
        assertEquals(callers, metrics.activeStreams.get());
    }

    @Test
    void transportFailureStopsLoopWithoutReconnectPolicy() throws Exception {
        watcher.watch("run-1", 0, record -> {});
        awaitListening();

        source.fail(CHANNEL);

        assertTrue(eventually(() -> !watcher.isRunning()));
        assertEquals(WatcherState.RUNNING, watcher.state());
        watcher.close();
        assertEquals(WatcherState.STOPPED, watcher.state());
    }

    @Test
    void reconnectPolicyResumesDeliveryAfterTransportFailure() throws Exception {
        watcher.close();
        watcher = newWatcher(new ExponentialBackoffReconnectPolicy(10, 20, 3));
        CountDownLatch latch = new CountDownLatch(1);
        watcher.watch("run-1", 0, record -> latch.countDown());
        awaitListening();

        source.fail(CHANNEL);
        assertTrue(eventually(() -> metrics.reconnects.get() == 1));
        assertTrue(eventually(() -> source.listenerCount(CHANNEL) == 1));

        append("run-1", 4);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertTrue(watcher.isRunning());
    }

    @Test
    void builderRequiresSourceAndFetcher() {
        assertThrows(NullPointerException.class, () -> EventWatcher.builder().recordFetcher(fetcher).build());
        assertThrows(NullPointerException.class, () -> EventWatcher.builder().notificationSource(source).build());
        assertThrows(IllegalArgumentException.class, () -> EventWatcher.builder()
                .notificationSource(source).recordFetcher(fetcher).channel("").build());
    }

    private EventWatcher newWatcher(ExponentialBackoffReconnectPolicy reconnectPolicy) {
        return EventWatcher.builder()
                .notificationSource(source)
                .recordFetcher(fetcher)
                .channel(CHANNEL)
                .metrics(metrics)
                .reconnectPolicy(reconnectPolicy)
                .threadNamePrefix(threadPrefix)
                .build();
    }

    private void awaitListening() throws InterruptedException {
        assertTrue(watcher.awaitListening(5, TimeUnit.SECONDS), "watcher never started listening");
    }

    private void append(String streamId, long position) {
        fetcher.append(streamId, position);
        source.publish(CHANNEL, NotificationPayloads.format(streamId, position));
    }

    private long liveWorkerThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.getName().startsWith(threadPrefix) && t.isAlive())
                .count();
    }

    private static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
