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

import org.apache.calcite.adapter.ingest.Diagnostic;
import org.apache.calcite.adapter.ingest.DiagnosticsReport;
import org.apache.calcite.adapter.ingest.ErrorKind;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@code scan} or {@code process} call over a project.
 */
public class ScanReport {
  private final Instant startedAt;
  private @Nullable Instant finishedAt;
  private boolean cancelled;
  private final Map<String, CollectionReport> collections = new LinkedHashMap<>();
  private final Map<String, DiagnosticsReport> diagnostics = new LinkedHashMap<>();

  ScanReport(Instant startedAt) {
    this.startedAt = startedAt;
  }

  CollectionReport collection(String workflow, String dataCollection) {
    return collections.computeIfAbsent(workflow + "/" + dataCollection,
        k -> new CollectionReport(workflow, dataCollection));
  }

  void addDiagnostics(String workflow, DiagnosticsReport report) {
    diagnostics.put(workflow, report);
  }

  void finish(Instant finished, boolean wasCancelled) {
    this.finishedAt = finished;
    this.cancelled = wasCancelled;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public @Nullable Instant getFinishedAt() {
    return finishedAt;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public List<CollectionReport> getCollections() {
    return ImmutableList.copyOf(collections.values());
  }

  /** Returns the report of a collection, or null if the scan did not reach it. */
  public @Nullable CollectionReport getCollection(String workflow,
      String dataCollection) {
    return collections.get(workflow + "/" + dataCollection);
  }

  public List<Diagnostic> getDiagnostics() {
    List<Diagnostic> list = new ArrayList<>();
    for (DiagnosticsReport report : diagnostics.values()) {
      list.addAll(report.getDiagnostics());
    }
    return list;
  }

  public List<Diagnostic> getDiagnostics(ErrorKind kind) {
    List<Diagnostic> list = new ArrayList<>();
    for (DiagnosticsReport report : diagnostics.values()) {
      list.addAll(report.ofKind(kind));
    }
    return list;
  }

  public Map<ErrorKind, Integer> countsByKind() {
    Map<ErrorKind, Integer> counts = new EnumMap<>(ErrorKind.class);
    for (DiagnosticsReport report : diagnostics.values()) {
      for (Map.Entry<ErrorKind, Integer> e : report.countsByKind().entrySet()) {
        counts.merge(e.getKey(), e.getValue(), Integer::sum);
      }
    }
    return counts;
  }

  /** Whether any collection wrote a new table version. */
  public boolean wroteAnything() {
    for (CollectionReport c : collections.values()) {
      if (c.isWritten()) {
        return true;
      }
    }
    return false;
  }

  /** Returns a human-readable multi-line summary for operators. */
  public String summary() {
    StringBuilder sb = new StringBuilder();
    sb.append("Scan ").append(cancelled ? "cancelled" : "finished");
    if (finishedAt != null) {
      sb.append(" in ").append(Duration.between(startedAt, finishedAt).toMillis())
          .append(" ms");
    }
    sb.append('\n');
    for (CollectionReport c : collections.values()) {
      sb.append("  ").append(c).append('\n');
    }
    Map<ErrorKind, Integer> counts = countsByKind();
    if (counts.isEmpty()) {
      sb.append("  no problems");
    } else {
      sb.append("  problems: ").append(counts);
    }
    return sb.toString();
  }

  @Override public String toString() {
    return summary();
  }
}
