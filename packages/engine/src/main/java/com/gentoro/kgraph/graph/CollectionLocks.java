package com.gentoro.kgraph.graph;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One {@link ReentrantReadWriteLock} per collection. Reads share the lock, mutations hold it
 * exclusively; different collections never contend.
 *
 * <p>The locks are reentrant, so a writer may call read helpers while it holds the write lock.
 *
 * <p>A lock is created on first use of a collection name and kept for the life of the instance,
 * even after the collection is cleared. Memory therefore grows with the number of distinct names
 * ever touched, one small lock object each.
 */
public final class CollectionLocks {
  private final Map<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

  public <T> T read(String collection, Supplier<T> action) {
    return withLock(lockFor(collection).readLock(), action);
  }

  public <T> T write(String collection, Supplier<T> action) {
    return withLock(lockFor(collection).writeLock(), action);
  }

  public void write(String collection, Runnable action) {
    write(
        collection,
        () -> {
          action.run();
          return null;
        });
  }

  /** True when the current thread holds the collection's write lock. */
  public boolean isWriteLockedByCurrentThread(String collection) {
    return lockFor(collection).isWriteLockedByCurrentThread();
  }

  private ReentrantReadWriteLock lockFor(String collection) {
    return locks.computeIfAbsent(collection, c -> new ReentrantReadWriteLock());
  }

  private static <T> T withLock(Lock lock, Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
