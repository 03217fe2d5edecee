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

import org.apache.calcite.adapter.ingest.Diagnostic;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog held in memory. Used in tests and for one-shot runs.
 */
public class InMemoryCatalog implements Catalog {
  private static final Comparator<FileRecord> FILE_ORDER =
      Comparator.comparing((FileRecord f) -> f.getKey().getRunId())
          .thenComparing(f -> f.getKey().getLocation());

  private final Map<String, Map<String, RunRecord>> runs = new HashMap<>();
  private final Map<FileKey, FileRecord> files = new HashMap<>();
  private final Map<String, List<Diagnostic>> diagnostics = new HashMap<>();

  @Override public synchronized List<RunRecord> runs(String workflow) {
    Map<String, RunRecord> byId = runs.get(workflow);
    if (byId == null) {
      return ImmutableList.of();
    }
    List<RunRecord> list = new ArrayList<>(byId.values());
    list.sort(Comparator.comparing(RunRecord::getRunId));
    return list;
  }

  @Override public synchronized void upsertRun(RunRecord run) {
    runs.computeIfAbsent(run.getWorkflow(), k -> new HashMap<>())
        .put(run.getRunId(), run);
  }

  @Override public synchronized List<FileRecord> files(String workflow,
      String dataCollection) {
    List<FileRecord> list = new ArrayList<>();
    for (FileRecord f : files.values()) {
      if (f.getKey().getWorkflow().equals(workflow)
          && f.getKey().getDataCollection().equals(dataCollection)) {
        list.add(f);
      }
    }
    list.sort(FILE_ORDER);
    return list;
  }

  @Override public synchronized @Nullable FileRecord file(FileKey key) {
    return files.get(key);
  }

  @Override public synchronized void upsertFile(FileRecord file) {
    files.put(file.getKey(), file);
  }

  @Override public synchronized void saveDiagnostics(String workflow,
      Instant scannedAt, List<Diagnostic> list) {
    diagnostics.put(workflow, ImmutableList.copyOf(list));
  }

  @Override public synchronized List<Diagnostic> lastDiagnostics(
      String workflow) {
    List<Diagnostic> list = diagnostics.get(workflow);
    return list == null ? ImmutableList.of() : list;
  }

  @Override public void close() {
  }
}
