/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.ingest.materialize;

import org.apache.calcite.adapter.ingest.StorageWriteException;
import org.apache.calcite.adapter.ingest.storage.TableKey;
import org.apache.calcite.adapter.ingest.storage.TableStore;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One writer lock per table. A writer that cannot obtain the lock within the
 * timeout fails with a contention {@link StorageWriteException}.
 *
 * <p>Locks obtained through {@link #forStore} are shared by every writer of
 * the same store location in this JVM. Locks are reentrant, so a thread that
 * holds a table's lease may acquire it again.
 */
public class CollectionLocks {
  private static final ConcurrentMap<String, ConcurrentMap<TableKey, ReentrantLock>>
      BY_LOCATION = new ConcurrentHashMap<>();

  private final ConcurrentMap<TableKey, ReentrantLock> locks;
  private final long timeoutMs;

  /** Creates a private set of locks. */
  public CollectionLocks(long timeoutMs) {
    this(new ConcurrentHashMap<TableKey, ReentrantLock>(), timeoutMs);
  }

  private CollectionLocks(ConcurrentMap<TableKey, ReentrantLock> locks,
      long timeoutMs) {
    this.locks = locks;
    this.timeoutMs = timeoutMs;
  }

  /** Returns the locks shared by all writers of a store. */
  public static CollectionLocks forStore(TableStore store, long timeoutMs) {
    return new CollectionLocks(
        BY_LOCATION.computeIfAbsent(store.getLocation(),
            k -> new ConcurrentHashMap<TableKey, ReentrantLock>()),
        timeoutMs);
  }

  /** Held lock; closing it releases the lock. */
  public static class Lease implements AutoCloseable {
    private final ReentrantLock lock;

    Lease(ReentrantLock lock) {
      this.lock = lock;
    }

    @Override public void close() {
      lock.unlock();
    }
  }

  public Lease acquire(TableKey key) throws StorageWriteException {
    ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
    boolean acquired;
    try {
      acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StorageWriteException("Interrupted waiting for " + key, false,
          e);
    }
    if (!acquired) {
      throw StorageWriteException.contention(key.toString(), timeoutMs);
    }
    return new Lease(lock);
  }

  /** Whether some thread currently holds the lock of a table. */
  public boolean isLocked(TableKey key) {
    ReentrantLock lock = locks.get(key);
    return lock != null && lock.isLocked();
  }
}
