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
 * Classification of problems raised while ingesting pipeline runs.
 *
 * <p>Each kind determines how far a failure propagates: configuration and
 * join-graph errors abort a scan before any I/O, file level errors only
 * exclude the offending file, and catalog errors abort a single data
 * collection.
 */
public enum ErrorKind {
  /** Project configuration is invalid; fatal, raised before discovery. */
  CONFIG_VALIDATION(true),
  /** Join graph is inconsistent (cycle, unknown target). */
  JOIN_RESOLUTION(true),
  /** A run directory or expected file could not be visited. */
  RUN_DISCOVERY(false),
  /** A matched path did not yield every declared wildcard group. */
  WILDCARD_EXTRACTION(false),
  /** File content or a join input does not fit the declared schema. */
  SCHEMA_MISMATCH(false),
  /** Writing a table version failed. */
  STORAGE_WRITE(false),
  /** Catalog could not be read or updated for a data collection. */
  CATALOG_SYNC(false),
  /** A column is present in some fragments and absent in others. */
  PARTIAL_COLUMN(false);

  private final boolean fatal;

  ErrorKind(boolean fatal) {
    this.fatal = fatal;
  }

  /** Returns whether an error of this kind aborts the whole scan. */
  public boolean isFatal() {
    return fatal;
  }
}
