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
import org.apache.calcite.adapter.ingest.DiagnosticsReport;
import org.apache.calcite.adapter.ingest.ErrorKind;
import org.apache.calcite.adapter.ingest.config.IngestSettings;
import org.apache.calcite.adapter.ingest.discovery.MatchedFile;
import org.apache.calcite.adapter.ingest.discovery.RunCandidate;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles what a scan sees on disk with the catalog.
 *
 * <p>Unchanged runs and files are never written, so a scan of an unchanged
 * tree leaves the catalog exactly as it was. Stale marking is only done when
 * the caller reports that discovery ran to completion.
 */
public class CatalogSynchronizer {
  private static final Logger LOGGER = LoggerFactory.getLogger(CatalogSynchronizer.class);

  private final Catalog catalog;
  private final IngestSettings.FingerprintMode fingerprintMode;
  private final DiagnosticsReport diagnostics;
  private final Clock clock;

  public CatalogSynchronizer(Catalog catalog, IngestSettings settings,
      DiagnosticsReport diagnostics, Clock clock) {
    this.catalog = catalog;
    this.fingerprintMode = settings.getFingerprintMode();
    this.diagnostics = diagnostics;
    this.clock = clock;
  }

  public Catalog getCatalog() {
    return catalog;
  }

  /** Outcome of {@link #syncRuns}. */
  public static class RunSync {
    private final List<String> added;
    private final List<String> restored;
    private final List<String> stale;

    RunSync(List<String> added, List<String> restored, List<String> stale) {
      this.added = ImmutableList.copyOf(added);
      this.restored = ImmutableList.copyOf(restored);
      this.stale = ImmutableList.copyOf(stale);
    }

    public List<String> getAdded() {
      return added;
    }

    public List<String> getRestored() {
      return restored;
    }

    public List<String> getStale() {
      return stale;
    }
  }

  /**
   * Records the runs discovered for a workflow.
   *
   * @param workflow Workflow name
   * @param discovered Runs found by this scan
   * @param complete Whether discovery finished; runs that were not seen are
   *     only marked stale when it did
   */
  public RunSync syncRuns(String workflow, List<RunCandidate> discovered,
      boolean complete) throws CatalogSyncException {
    Map<String, RunRecord> existing = new HashMap<>();
    for (RunRecord run : catalog.runs(workflow)) {
      existing.put(run.getRunId(), run);
    }
    List<String> added = new ArrayList<>();
    List<String> restored = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (RunCandidate candidate : discovered) {
      seen.add(candidate.getRunId());
      String location = candidate.getRoot().toAbsolutePath().normalize().toString();
      RunRecord previous = existing.get(candidate.getRunId());
      if (previous == null) {
        catalog.upsertRun(
            new RunRecord(workflow, candidate.getRunId(), location,
                RunRecord.Status.ACTIVE, clock.instant()));
        added.add(candidate.getRunId());
      } else if (previous.getStatus() == RunRecord.Status.STALE) {
        catalog.upsertRun(previous.withStatus(RunRecord.Status.ACTIVE));
        restored.add(candidate.getRunId());
      }
    }
    List<String> stale = new ArrayList<>();
    if (complete) {
      for (RunRecord run : existing.values()) {
        if (run.getStatus() == RunRecord.Status.ACTIVE
            && !seen.contains(run.getRunId())) {
          catalog.upsertRun(run.withStatus(RunRecord.Status.STALE));
          stale.add(run.getRunId());
        }
      }
    }
    if (!added.isEmpty() || !restored.isEmpty() || !stale.isEmpty()) {
      LOGGER.info("Workflow {}: {} new run(s), {} restored, {} stale",
          workflow, added.size(), restored.size(), stale.size());
    }
    return new RunSync(added, restored, stale);
  }

  /**
   * Classifies the files matched for a data collection against the catalog.
   * Nothing is written.
   *
   * @param workflow Workflow name
   * @param dataCollection Data collection tag
   * @param matched Files matched by this scan, rejected ones included
   * @param complete Whether discovery finished; only then are unseen records
   *     reported stale
   */
  public CollectionDiff diff(String workflow, String dataCollection,
      List<MatchedFile> matched, boolean complete) throws CatalogSyncException {
    Map<FileKey, FileRecord> existing = new HashMap<>();
    for (FileRecord record : catalog.files(workflow, dataCollection)) {
      existing.put(record.getKey(), record);
    }
    List<CollectionDiff.Entry> entries = new ArrayList<>();
    Set<FileKey> seen = new HashSet<>();
    for (MatchedFile file : matched) {
      FileKey key = keyOf(workflow, file);
      if (!seen.add(key)) {
        continue;
      }
      Fingerprint fingerprint;
      try {
        fingerprint = Fingerprint.of(file.getPath(), fingerprintMode);
      } catch (IOException e) {
        diagnostics.add(workflow, dataCollection, file.getRun().getRunId(),
            file.getLocation(), ErrorKind.SCHEMA_MISMATCH,
            "Cannot read file: " + e.getMessage());
        continue;
      }
      FileRecord previous = existing.get(key);
      entries.add(
          new CollectionDiff.Entry(file, key, fingerprint,
              classify(file, fingerprint, previous), previous));
    }
    List<FileRecord> stale = new ArrayList<>();
    if (complete) {
      for (FileRecord record : existing.values()) {
        if (record.getStatus() != FileRecord.Status.STALE
            && !seen.contains(record.getKey())) {
          stale.add(record);
        }
      }
    }
    CollectionDiff diff =
        new CollectionDiff(workflow, dataCollection, entries, stale);
    LOGGER.debug("{}", diff);
    return diff;
  }

  private static CollectionDiff.Change classify(MatchedFile file,
      Fingerprint fingerprint, @Nullable FileRecord previous) {
    if (previous == null) {
      return CollectionDiff.Change.NEW;
    }
    if (previous.getStatus() == FileRecord.Status.STALE) {
      return CollectionDiff.Change.RESTORED;
    }
    if (!previous.getFingerprint().equals(fingerprint)) {
      return CollectionDiff.Change.CHANGED;
    }
    if (previous.getStatus() == FileRecord.Status.REJECTED) {
      return CollectionDiff.Change.UNCHANGED_REJECTED;
    }
    if (file.isRejected() || !previous.getWildcards().equals(file.getWildcards())) {
      return CollectionDiff.Change.CHANGED;
    }
    return CollectionDiff.Change.UNCHANGED;
  }

  /**
   * Persists the outcome of processing one entry: {@code REGISTERED} when its
   * fragment was produced, otherwise {@code REJECTED} with the error.
   */
  public FileRecord register(CollectionDiff.Entry entry, @Nullable String error)
      throws CatalogSyncException {
    FileRecord record =
        new FileRecord(entry.getKey(), entry.getFile().getWildcards(),
            entry.getFingerprint(),
            error == null ? FileRecord.Status.REGISTERED
                : FileRecord.Status.REJECTED,
            clock.instant(), error);
    catalog.upsertFile(record);
    return record;
  }

  /** Marks the stale records of a diff. */
  public void markStale(CollectionDiff diff) throws CatalogSyncException {
    for (FileRecord record : diff.getStale()) {
      catalog.upsertFile(record.withStatus(FileRecord.Status.STALE));
    }
    if (!diff.getStale().isEmpty()) {
      LOGGER.info("{}/{}: marked {} file(s) stale", diff.getWorkflow(),
          diff.getDataCollection(), diff.getStale().size());
    }
  }

  /** Returns the files of a collection that currently contribute rows. */
  public List<FileRecord> registered(String workflow, String dataCollection)
      throws CatalogSyncException {
    List<FileRecord> list = new ArrayList<>();
    for (FileRecord record : catalog.files(workflow, dataCollection)) {
      if (record.getStatus() == FileRecord.Status.REGISTERED) {
        list.add(record);
      }
    }
    return list;
  }

  static FileKey keyOf(String workflow, MatchedFile file) {
    return new FileKey(workflow, file.getDataCollection(),
        file.getRun().getRunId(), file.getLocation());
  }
}
