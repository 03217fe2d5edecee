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
package org.apache.calcite.adapter.ingest.catalog;

import org.apache.calcite.adapter.ingest.CatalogSyncException;
import org.apache.calcite.adapter.ingest.Diagnostic;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Persistent record of discovered runs, matched files and the diagnostics of
 * the latest scan of each workflow.
 *
 * <p>Implementations must be safe for use from several threads.
 */
public interface Catalog extends AutoCloseable {

  /** Returns the runs of a workflow, ordered by run id. */
  List<RunRecord> runs(String workflow) throws CatalogSyncException;

  /** Inserts or replaces a run record. */
  void upsertRun(RunRecord run) throws CatalogSyncException;

  /** Returns the files of a data collection, ordered by run and location. */
  List<FileRecord> files(String workflow, String dataCollection)
      throws CatalogSyncException;

  /** Returns the record of a file, or null if it was never matched. */
  @Nullable FileRecord file(FileKey key) throws CatalogSyncException;

  /** Inserts or replaces a file record. */
  void upsertFile(FileRecord file) throws CatalogSyncException;

  /** Replaces the diagnostics recorded for a workflow. */
  void saveDiagnostics(String workflow, Instant scannedAt,
      List<Diagnostic> diagnostics) throws CatalogSyncException;

  /** Returns the diagnostics recorded by the latest scan of a workflow. */
  List<Diagnostic> lastDiagnostics(String workflow) throws CatalogSyncException;

  @Override void close() throws CatalogSyncException;
}
