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
import org.apache.calcite.adapter.ingest.format.Column;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;
import org.apache.calcite.adapter.ingest.storage.InMemoryTableStore;
import org.apache.calcite.adapter.ingest.storage.RetryingWriter;
import org.apache.calcite.adapter.ingest.storage.TableKey;
import org.apache.calcite.adapter.ingest.storage.TableVersion;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Materializer} and {@link CollectionLocks}.
 */
@Tag("unit")
public class MaterializerTest {

  private static final TableKey KEY = new TableKey("wf", "metrics");

  private static TableData rows(Object... values) {
    return TableData.of(
        ImmutableList.of(
            new Column("n", ColumnType.LONG,
                new ArrayList<Object>(Arrays.asList(values)))));
  }

  private static Materializer materializer(InMemoryTableStore store,
      long lockTimeoutMs) {
    return new Materializer(new RetryingWriter(store, 1, 1, 1),
        new CollectionLocks(lockTimeoutMs));
  }

  @Test void testWritesSuccessiveVersions() throws Exception {
    InMemoryTableStore store = new InMemoryTableStore();
    Materializer materializer = materializer(store, 1000);
    TableVersion v0 = materializer.materialize(KEY, rows(1L, 2L));
    TableVersion v1 = materializer.materialize(KEY, rows(3L));
    assertNotNull(v0);
    assertNotNull(v1);
    assertEquals(v0.getVersion() + 1, v1.getVersion());
    assertEquals(1, v1.getRowCount());
    assertEquals(2, store.history(KEY).size());
    assertFalse(materializer.getLocks().isLocked(KEY));
  }

  @Test void testEmptyTableIsNotWritten() throws Exception {
    InMemoryTableStore store = new InMemoryTableStore();
    assertNull(materializer(store, 1000).materialize(KEY, rows()));
    assertNull(store.latestVersion(KEY));
  }

  @Test void testContendedTableTimesOut() throws Exception {
    InMemoryTableStore store = new InMemoryTableStore();
    Materializer materializer = materializer(store, 50);
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<?> holder = executor.submit(() -> {
        try (CollectionLocks.Lease ignored =
                 materializer.getLocks().acquire(KEY)) {
          held.countDown();
          release.await(10, TimeUnit.SECONDS);
        }
        return null;
      });
      assertTrue(held.await(10, TimeUnit.SECONDS));
      assertTrue(materializer.getLocks().isLocked(KEY));

      StorageWriteException e =
          assertThrows(StorageWriteException.class,
              () -> materializer.materialize(KEY, rows(1L)));
      assertTrue(e.isContention());
      assertNull(store.latestVersion(KEY));

      release.countDown();
      holder.get(10, TimeUnit.SECONDS);
      assertNotNull(materializer.materialize(KEY, rows(1L)));
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }
}
