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
package org.apache.calcite.adapter.ingest.storage;

import org.apache.calcite.adapter.ingest.StorageWriteException;
import org.apache.calcite.adapter.ingest.format.Column;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link RetryingWriter}.
 */
@Tag("unit")
public class RetryingWriterTest {

  private static final TableKey KEY = new TableKey("wf", "t");

  private static final TableData DATA = TableData.of(
      ImmutableList.of(
          new Column("n", ColumnType.LONG,
              new ArrayList<Object>(Arrays.asList(1L, 2L)))));

  /** Store whose first writes fail. */
  private static class FlakyStore implements TableStore {
    final InMemoryTableStore delegate = new InMemoryTableStore();
    int failures;
    boolean fatal;
    int attempts;

    FlakyStore(int failures, boolean fatal) {
      this.failures = failures;
      this.fatal = fatal;
    }

    @Override public @Nullable TableVersion latestVersion(TableKey key) {
      return delegate.latestVersion(key);
    }

    @Override public TableVersion write(TableKey key, TableData data)
        throws IOException {
      attempts++;
      if (failures > 0) {
        failures--;
        if (fatal) {
          throw new IllegalStateException("schema rejected");
        }
        throw new IOException("connection reset");
      }
      return delegate.write(key, data);
    }

    @Override public @Nullable StoredTable read(TableKey key,
        @Nullable Long version) {
      return delegate.read(key, version);
    }

    @Override public List<TableVersion> history(TableKey key) {
      return delegate.history(key);
    }

    @Override public List<TableKey> listTables() {
      return delegate.listTables();
    }

    @Override public void close() {
    }
  }

  @Test void testRetriesTransientFailures() throws Exception {
    FlakyStore store = new FlakyStore(2, false);
    TableVersion version = new RetryingWriter(store, 3, 1, 2).write(KEY, DATA);
    assertEquals(0, version.getVersion());
    assertEquals(3, store.attempts);
  }

  @Test void testGivesUpAfterMaxAttempts() {
    FlakyStore store = new FlakyStore(5, false);
    StorageWriteException e =
        assertThrows(StorageWriteException.class,
            () -> new RetryingWriter(store, 3, 1, 2).write(KEY, DATA));
    assertEquals(3, store.attempts);
    assertFalse(e.isContention());
    assertNull(store.latestVersion(KEY));
  }

  @Test void testDoesNotRetryOtherFailures() {
    FlakyStore store = new FlakyStore(1, true);
    assertThrows(StorageWriteException.class,
        () -> new RetryingWriter(store, 3, 1, 2).write(KEY, DATA));
    assertEquals(1, store.attempts);
  }

  @Test void testBackoffIsCapped() {
    RetryingWriter writer = new RetryingWriter(new InMemoryTableStore(), 10, 100, 1000);
    assertEquals(100, writer.backoff(1));
    assertEquals(200, writer.backoff(2));
    assertEquals(800, writer.backoff(4));
    assertEquals(1000, writer.backoff(5));
    assertEquals(1000, writer.backoff(40));
  }
}
