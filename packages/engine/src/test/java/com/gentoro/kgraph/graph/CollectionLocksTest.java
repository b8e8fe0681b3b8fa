package com.gentoro.kgraph.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CollectionLocksTest {

  @Test
  @DisplayName("a writer may read the same collection while holding its write lock")
  void reentrantRead() {
    CollectionLocks locks = new CollectionLocks();

    String seen =
        locks.write(
            "kg1",
            () -> {
              assertTrue(locks.isWriteLockedByCurrentThread("kg1"));
              return locks.read("kg1", () -> "inside");
            });

    assertEquals("inside", seen);
    assertFalse(locks.isWriteLockedByCurrentThread("kg1"));
  }

  @Test
  @DisplayName("a held write lock blocks only its own collection and is reusable after release")
  void collectionsAreIndependent() throws Exception {
    CollectionLocks locks = new CollectionLocks();
    locks.write("kg1", () -> {});
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      Future<?> writer =
          pool.submit(
              () ->
                  locks.write(
                      "kg1",
                      () -> {
                        held.countDown();
                        await(release);
                      }));
      assertTrue(held.await(5, TimeUnit.SECONDS));

      Future<String> other = pool.submit(() -> locks.read("kg2", () -> "free"));
      assertEquals("free", other.get(5, TimeUnit.SECONDS));
      assertFalse(locks.isWriteLockedByCurrentThread("kg1"));

      release.countDown();
      writer.get(5, TimeUnit.SECONDS);
      assertEquals("again", locks.read("kg1", () -> "again"));
    } finally {
      pool.shutdownNow();
    }
  }

  private static void await(CountDownLatch latch) {
    try {
      assertTrue(latch.await(5, TimeUnit.SECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      fail(e);
    }
  }
}
