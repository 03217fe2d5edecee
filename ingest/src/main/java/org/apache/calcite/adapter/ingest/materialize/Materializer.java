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
import org.apache.calcite.adapter.ingest.format.TableData;
import org.apache.calcite.adapter.ingest.storage.RetryingWriter;
import org.apache.calcite.adapter.ingest.storage.TableKey;
import org.apache.calcite.adapter.ingest.storage.TableVersion;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes aggregated tables as new versions, one writer per table.
 */
public class Materializer {
  private static final Logger LOGGER = LoggerFactory.getLogger(Materializer.class);

  private final RetryingWriter writer;
  private final CollectionLocks locks;

  public Materializer(RetryingWriter writer, CollectionLocks locks) {
    this.writer = writer;
    this.locks = locks;
  }

  public CollectionLocks getLocks() {
    return locks;
  }

  /**
   * Writes {@code data} as the next version of a table.
   *
   * @return the new version, or null if {@code data} has no rows (nothing is
   *     written)
   * @throws StorageWriteException if another writer holds the table, or the
   *     write failed; the latest version is then unchanged
   */
  public @Nullable TableVersion materialize(TableKey key, TableData data)
      throws StorageWriteException {
    if (data.getRowCount() == 0) {
      LOGGER.warn("Not materializing {}: no rows", key);
      return null;
    }
    try (CollectionLocks.Lease ignored = locks.acquire(key)) {
      TableVersion version = writer.write(key, data);
      LOGGER.info("Materialized {} version {} ({} rows)", key,
          version.getVersion(), version.getRowCount());
      return version;
    }
  }
}
