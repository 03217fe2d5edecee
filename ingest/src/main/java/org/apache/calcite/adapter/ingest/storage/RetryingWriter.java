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
import org.apache.calcite.adapter.ingest.format.TableData;

import org.apache.iceberg.exceptions.CommitFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Writes table versions, retrying transient failures with bounded exponential
 * backoff.
 *
 * <p>I/O errors and optimistic commit conflicts are transient. Any other
 * failure, or a transient one that outlives {@code maxAttempts}, is raised as a
 * non-transient {@link StorageWriteException}; the table's latest version is
 * then unchanged.
 */
public class RetryingWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(RetryingWriter.class);

  private final TableStore store;
  private final int maxAttempts;
  private final long initialBackoffMs;
  private final long maxBackoffMs;

  public RetryingWriter(TableStore store, int maxAttempts, long initialBackoffMs,
      long maxBackoffMs) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.store = store;
    this.maxAttempts = maxAttempts;
    this.initialBackoffMs = initialBackoffMs;
    this.maxBackoffMs = maxBackoffMs;
  }

  public TableStore getStore() {
    return store;
  }

  public TableVersion write(TableKey key, TableData data)
      throws StorageWriteException {
    for (int attempt = 1;; attempt++) {
      try {
        return store.write(key, data);
      } catch (IOException | UncheckedIOException | CommitFailedException e) {
        if (attempt >= maxAttempts) {
          throw new StorageWriteException("Writing " + key + " failed after "
              + attempt + " attempt(s): " + e.getMessage(), false, e);
        }
        long delay = backoff(attempt);
        LOGGER.warn("Transient failure writing {} (attempt {}/{}), retrying in {} ms: {}",
            key, attempt, maxAttempts, delay, e.getMessage());
        try {
          Thread.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new StorageWriteException("Interrupted while retrying " + key,
              false, e);
        }
      } catch (RuntimeException e) {
        throw new StorageWriteException("Writing " + key + " failed: " + e,
            false, e);
      }
    }
  }

  /** Returns the delay after a failed attempt (1-based). */
  long backoff(int attempt) {
    long delay = initialBackoffMs * (1L << Math.min(attempt - 1, 30));
    return Math.min(delay, maxBackoffMs);
  }
}
