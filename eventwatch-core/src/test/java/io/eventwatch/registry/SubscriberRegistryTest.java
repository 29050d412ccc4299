package io.eventwatch.registry;

import io.eventwatch.WatchCallback;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubscriberRegistryTest {

  private final SubscriberRegistry registry = new SubscriberRegistry();

  @Test
  void unknownStreamHasNoSubscriptions() {
    assertFalse(registry.has("run-1"));
    assertTrue(registry.snapshot("run-1").isEmpty());
  }

  @Test
  void snapshotKeepsRegistrationOrder() {
    WatchCallback first = record -> {};
    WatchCallback second = record -> {};

    registry.add("run-1", 10, first);
    registry.add("run-1", 0, second);

    List<Subscription> snapshot = registry.snapshot("run-1");
    assertEquals(2, snapshot.size());
    assertSame(first, snapshot.get(0).callback());
    assertEquals(10, snapshot.get(0).cursor());
    assertSame(second, snapshot.get(1).callback());
  }

  @Test
  void removeDropsEveryRegistrationOfCallback() {
    WatchCallback callback = record -> {};
    WatchCallback other = record -> {};
    registry.add("run-1", 0, callback);
    registry.add("run-1", 5, other);
    registry.add("run-1", 7, callback);

    assertEquals(2, registry.remove("run-1", callback));

    List<Subscription> snapshot = registry.snapshot("run-1");
    assertEquals(1, snapshot.size());
    assertSame(other, snapshot.get(0).callback());
  }

  @Test
  void removingLastSubscriptionDropsStream() {
    WatchCallback callback = record -> {};
    registry.add("run-1", 0, callback);

    registry.remove("run-1", callback);

    assertFalse(registry.has("run-1"));
    assertEquals(0, registry.streamCount());
  }

  @Test
  void removeIsNoOpForUnknownStreamOrCallback() {
    WatchCallback callback = record -> {};
    registry.add("run-1", 0, callback);

    assertEquals(0, registry.remove("run-2", callback));
    assertEquals(0, registry.remove("run-1", record -> {}));
    assertEquals(1, registry.remove("run-1", callback));
    assertEquals(0, registry.remove("run-1", callback));
  }

  @Test
  void removeOnlyAffectsNamedStream() {
    WatchCallback callback = record -> {};
    registry.add("run-1", 0, callback);
    registry.add("run-2", 0, callback);

    registry.remove("run-1", callback);

    assertFalse(registry.has("run-1"));
    assertTrue(registry.has("run-2"));
  }

  @Test
  void snapshotIsDetachedFromLaterChanges() {
    WatchCallback callback = record -> {};
    registry.add("run-1", 0, callback);
    List<Subscription> snapshot = registry.snapshot("run-1");

    registry.add("run-1", 3, record -> {});
    registry.remove("run-1", callback);

    assertEquals(1, snapshot.size());
    assertSame(callback, snapshot.get(0).callback());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(new Subscription(0, callback)));
  }

  @Test
  void subscriptionAdmitsPositionsAtOrAfterCursor() {
    Subscription subscription = new Subscription(5, record -> {});

    assertFalse(subscription.admits(4));
    assertTrue(subscription.admits(5));
    assertTrue(subscription.admits(6));
  }

  @Test
  void concurrentAddsAreAllRecorded() throws Exception {
    int threads = 8;
    int perThread = 200;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<WatchCallback> callbacks = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      WatchCallback callback = record -> {};
      callbacks.add(callback);
      pool.submit(() -> {
        start.await();
        for (int i = 0; i < perThread; i++) {
          registry.add("run-" + (i % 4), i, callback);
        }
        return null;
      });
    }
    start.countDown();
    pool.shutdown();
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(threads * perThread, registry.subscriptionCount());
    assertEquals(4, registry.streamCount());

    for (WatchCallback callback : callbacks) {
      for (int s = 0; s < 4; s++) {
        registry.remove("run-" + s, callback);
      }
    }
    assertEquals(0, registry.streamCount());
  }
}
