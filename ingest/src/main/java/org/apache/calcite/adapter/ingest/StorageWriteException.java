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
package org.apache.calcite.adapter.ingest;

/**
 * Thrown when a table version cannot be written.
 *
 * <p>A transient failure may be retried; a non-transient one is final, either
 * because the retry budget is exhausted or because another writer holds the
 * data collection ({@link #isContention()}).
 */
public class StorageWriteException extends IngestException {
  private static final long serialVersionUID = 1L;

  private final boolean transientFailure;
  private final boolean contention;

  public StorageWriteException(String message, boolean transientFailure,
      Throwable cause) {
    super(ErrorKind.STORAGE_WRITE, message, cause);
    this.transientFailure = transientFailure;
    this.contention = false;
  }

  private StorageWriteException(String message) {
    super(ErrorKind.STORAGE_WRITE, message);
    this.transientFailure = false;
    this.contention = true;
  }

  /** Creates the exception reported when another writer holds the lock. */
  public static StorageWriteException contention(String key, long waitedMs) {
    return new StorageWriteException("Materialization of " + key
        + " already in progress (waited " + waitedMs + " ms)");
  }

  public boolean isTransient() {
    return transientFailure;
  }

  public boolean isContention() {
    return contention;
  }
}
