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
package org.apache.calcite.adapter.ingest.pipeline;

import org.apache.calcite.adapter.ingest.CatalogSyncException;
import org.apache.calcite.adapter.ingest.Diagnostic;
import org.apache.calcite.adapter.ingest.catalog.Catalog;
import org.apache.calcite.adapter.ingest.catalog.FileRecord;
import org.apache.calcite.adapter.ingest.catalog.RunRecord;
import org.apache.calcite.adapter.ingest.storage.StoredTable;
import org.apache.calcite.adapter.ingest.storage.TableKey;
import org.apache.calcite.adapter.ingest.storage.TableStore;
import org.apache.calcite.adapter.ingest.storage.TableVersion;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to materialized tables and to the catalog.
 */
public class IngestQueryService {
  private final Catalog catalog;
  private final TableStore store;

  public IngestQueryService(Catalog catalog, TableStore store) {
    this.catalog = catalog;
    this.store = store;
  }

  /**
   * Reads a materialized table.
   *
   * @param workflow Workflow name
   * @param table Data collection tag, or {@code joined_<tag>} for a joined
   *     result
   * @param version Version to read, or null for the latest
   * @return the table, or null if it (or the version) does not exist
   */
  public @Nullable StoredTable readTable(String workflow, String table,
      @Nullable Long version) throws IOException {
    return store.read(new TableKey(workflow, table), version);
  }

  /** Returns the versions of a table, oldest first. */
  public List<TableVersion> tableHistory(String workflow, String table)
      throws IOException {
    return store.history(new TableKey(workflow, table));
  }

  public List<TableKey> listTables() throws IOException {
    return store.listTables();
  }

  public CollectionStatus collectionStatus(String workflow,
      String dataCollection) throws CatalogSyncException, IOException {
    Map<RunRecord.Status, Integer> runs = new EnumMap<>(RunRecord.Status.class);
    for (RunRecord run : catalog.runs(workflow)) {
      runs.merge(run.getStatus(), 1, Integer::sum);
    }
    Map<FileRecord.Status, Integer> files = new EnumMap<>(FileRecord.Status.class);
    for (FileRecord file : catalog.files(workflow, dataCollection)) {
      files.merge(file.getStatus(), 1, Integer::sum);
    }
    return new CollectionStatus(workflow, dataCollection, runs, files,
        store.latestVersion(new TableKey(workflow, dataCollection)));
  }

  /** Returns the problems recorded by the latest scan of a workflow. */
  public List<Diagnostic> lastReport(String workflow)
      throws CatalogSyncException {
    return catalog.lastDiagnostics(workflow);
  }
}
