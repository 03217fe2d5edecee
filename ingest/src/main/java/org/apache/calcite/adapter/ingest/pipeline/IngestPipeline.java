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
import org.apache.calcite.adapter.ingest.ConfigValidationException;
import org.apache.calcite.adapter.ingest.DiagnosticsReport;
import org.apache.calcite.adapter.ingest.ErrorKind;
import org.apache.calcite.adapter.ingest.IngestException;
import org.apache.calcite.adapter.ingest.JoinResolutionException;
import org.apache.calcite.adapter.ingest.SchemaMismatchException;
import org.apache.calcite.adapter.ingest.StorageWriteException;
import org.apache.calcite.adapter.ingest.catalog.Catalog;
import org.apache.calcite.adapter.ingest.catalog.CatalogSynchronizer;
import org.apache.calcite.adapter.ingest.catalog.CollectionDiff;
import org.apache.calcite.adapter.ingest.catalog.FileKey;
import org.apache.calcite.adapter.ingest.catalog.FileRecord;
import org.apache.calcite.adapter.ingest.config.DataCollectionConfig;
import org.apache.calcite.adapter.ingest.config.IngestSettings;
import org.apache.calcite.adapter.ingest.config.JoinConfig;
import org.apache.calcite.adapter.ingest.config.ProjectConfig;
import org.apache.calcite.adapter.ingest.config.ProjectValidator;
import org.apache.calcite.adapter.ingest.config.WorkflowConfig;
import org.apache.calcite.adapter.ingest.discovery.FileMatcher;
import org.apache.calcite.adapter.ingest.discovery.MatchedFile;
import org.apache.calcite.adapter.ingest.discovery.RunCandidate;
import org.apache.calcite.adapter.ingest.discovery.RunDiscovery;
import org.apache.calcite.adapter.ingest.format.FragmentReader;
import org.apache.calcite.adapter.ingest.format.TableData;
import org.apache.calcite.adapter.ingest.join.JoinGraph;
import org.apache.calcite.adapter.ingest.join.JoinResolver;
import org.apache.calcite.adapter.ingest.materialize.Aggregator;
import org.apache.calcite.adapter.ingest.materialize.CollectionLocks;
import org.apache.calcite.adapter.ingest.materialize.Fragment;
import org.apache.calcite.adapter.ingest.materialize.Materializer;
import org.apache.calcite.adapter.ingest.storage.RetryingWriter;
import org.apache.calcite.adapter.ingest.storage.StoredTable;
import org.apache.calcite.adapter.ingest.storage.TableKey;
import org.apache.calcite.adapter.ingest.storage.TableStore;
import org.apache.calcite.adapter.ingest.storage.TableVersion;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Drives discovery, registration and materialization of a project.
 *
 * <p>For each workflow a scan goes through four phases:
 *
 * <ol>
 *   <li>Runs are discovered lazily and each run is matched against every
 *   data collection on the worker pool.
 *   <li>Runs and matched files are compared with the catalog.
 *   <li>New, changed and restored files are parsed on the worker pool and
 *   recorded as registered or rejected; unseen files are marked stale.
 *   <li>({@link #process} only) Collections with files registered or
 *   rejected since their latest version are aggregated and written under the
 *   table's writer lease, targets before sources, followed by the joined
 *   table of each collection that declares a join.
 * </ol>
 *
 * <p>Problems scoped to a file, a run or a collection are collected in the
 * {@link ScanReport}; the scan carries on with the rest. Both operations are
 * idempotent: on an unchanged tree they write no catalog record and no table
 * version.
 */
public class IngestPipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(IngestPipeline.class);

  private final Catalog catalog;
  private final TableStore store;
  private final IngestSettings settings;
  private final Materializer materializer;
  private final FragmentReader reader;
  private final Clock clock = Clock.systemUTC();
  private ProgressListener listener = ProgressListener.NONE;

  public IngestPipeline(Catalog catalog, TableStore store,
      IngestSettings settings) {
    this.catalog = catalog;
    this.store = store;
    this.settings = settings;
    this.materializer =
        new Materializer(
            new RetryingWriter(store, settings.getMaxAttempts(),
                settings.getInitialBackoffMs(), settings.getMaxBackoffMs()),
            CollectionLocks.forStore(store, settings.getLockTimeoutMs()));
    this.reader = new FragmentReader(settings);
  }

  /** Creates a pipeline using the settings declared in a project. */
  public static IngestPipeline forProject(ProjectConfig project,
      Catalog catalog, TableStore store) {
    return new IngestPipeline(catalog, store, project.getSettings());
  }

  public void setProgressListener(ProgressListener listener) {
    this.listener = listener;
  }

  public Catalog getCatalog() {
    return catalog;
  }

  public TableStore getStore() {
    return store;
  }

  public Materializer getMaterializer() {
    return materializer;
  }

  /** Discovers runs and registers files; writes no table. */
  public ScanReport scan(ProjectConfig project)
      throws ConfigValidationException, JoinResolutionException {
    return scan(project, new ScanCancellation());
  }

  public ScanReport scan(ProjectConfig project, ScanCancellation cancellation)
      throws ConfigValidationException, JoinResolutionException {
    return run(project, false, cancellation);
  }

  /** Scans, then materializes every collection whose data changed. */
  public ScanReport process(ProjectConfig project)
      throws ConfigValidationException, JoinResolutionException {
    return process(project, new ScanCancellation());
  }

  public ScanReport process(ProjectConfig project,
      ScanCancellation cancellation)
      throws ConfigValidationException, JoinResolutionException {
    return run(project, true, cancellation);
  }

  /**
   * Rebuilds a collection's table from its registered files, whether or not
   * they changed, and rewrites the joined tables that depend on it. Files
   * marked stale no longer contribute rows.
   *
   * @return the new version, or null if the collection has no rows
   * @throws IllegalArgumentException if the workflow or the table collection
   *     does not exist
   */
  public @Nullable TableVersion rematerialize(ProjectConfig project,
      String workflowName, String dataCollection) throws IngestException {
    ProjectValidator.validate(project);
    WorkflowConfig workflow = project.getWorkflow(workflowName);
    if (workflow == null) {
      throw new IllegalArgumentException("Unknown workflow: " + workflowName);
    }
    DataCollectionConfig dc = workflow.getDataCollection(dataCollection);
    if (dc == null || !dc.getType().isTabular()) {
      throw new IllegalArgumentException("Unknown table collection: "
          + workflowName + "/" + dataCollection);
    }
    ExecutorService executor = Executors.newFixedThreadPool(settings.getParallelism());
    try {
      WorkflowScan scan =
          new WorkflowScan(workflow, new ScanReport(clock.instant()),
              new ScanCancellation(), executor);
      TableVersion version = scan.materializeCollection(dc, true);
      JoinGraph graph = JoinGraph.of(workflow);
      List<String> dependents = new ArrayList<>();
      dependents.add(dataCollection);
      dependents.addAll(graph.sourcesOf(dataCollection));
      for (String tag : dependents) {
        DataCollectionConfig source = workflow.getDataCollection(tag);
        if (source != null && source.getJoin() != null) {
          scan.materializeJoin(source);
        }
      }
      return version;
    } finally {
      executor.shutdownNow();
    }
  }

  private ScanReport run(ProjectConfig project, boolean materialize,
      ScanCancellation cancellation)
      throws ConfigValidationException, JoinResolutionException {
    ProjectValidator.validate(project);
    ScanReport report = new ScanReport(clock.instant());
    ExecutorService executor = Executors.newFixedThreadPool(settings.getParallelism());
    try {
      for (WorkflowConfig workflow : project.getWorkflows()) {
        if (cancellation.isCancelled()) {
          break;
        }
        new WorkflowScan(workflow, report, cancellation, executor)
            .run(materialize);
      }
    } finally {
      executor.shutdownNow();
    }
    report.finish(clock.instant(), cancellation.isCancelled());
    LOGGER.info("{}", report.summary());
    return report;
  }

  /** Result of parsing one file on the worker pool. */
  private static class Outcome {
    final DataCollectionConfig dataCollection;
    final CollectionDiff.Entry entry;
    final @Nullable TableData data;
    final @Nullable String error;

    Outcome(DataCollectionConfig dataCollection, CollectionDiff.Entry entry,
        @Nullable TableData data, @Nullable String error) {
      this.dataCollection = dataCollection;
      this.entry = entry;
      this.data = data;
      this.error = error;
    }
  }

  /** State of one workflow during one scan. */
  private class WorkflowScan {
    private final WorkflowConfig workflow;
    private final String name;
    private final ScanReport report;
    private final ScanCancellation cancellation;
    private final ExecutorService executor;
    private final DiagnosticsReport diagnostics = new DiagnosticsReport();
    private final CatalogSynchronizer sync;
    private final Aggregator aggregator;
    private final Map<FileKey, TableData> parsed = new ConcurrentHashMap<>();
    private final Set<String> changed = new HashSet<>();
    private final Set<String> rewritten = new HashSet<>();
    private final Map<String, TableData> aggregates = new HashMap<>();
    private final List<RunCandidate> runs = new ArrayList<>();
    private boolean complete = true;

    WorkflowScan(WorkflowConfig workflow, ScanReport report,
        ScanCancellation cancellation, ExecutorService executor) {
      this.workflow = workflow;
      this.name = workflow.getName();
      this.report = report;
      this.cancellation = cancellation;
      this.executor = executor;
      this.sync = new CatalogSynchronizer(catalog, settings, diagnostics, clock);
      this.aggregator =
          new Aggregator(settings.getAggregationTimeColumn(), diagnostics, clock);
    }

    void run(boolean materialize) {
      report.addDiagnostics(name, diagnostics);
      for (DataCollectionConfig dc : workflow.getDataCollections()) {
        report.collection(name, dc.getTag());
      }
      Map<String, List<MatchedFile>> matched = discover();
      try {
        sync.syncRuns(name, runs, complete);
      } catch (CatalogSyncException e) {
        diagnostics.add(name, null, null, null, e);
        for (DataCollectionConfig dc : workflow.getDataCollections()) {
          report.collection(name, dc.getTag()).degraded = true;
        }
        saveDiagnostics();
        return;
      }
      register(matched);
      if (materialize && !cancellation.isCancelled()) {
        materialize();
      }
      saveDiagnostics();
    }

    /** Phase 1: discovers runs and matches their files. */
    private Map<String, List<MatchedFile>> discover() {
      List<FileMatcher> shared = new ArrayList<>();
      List<FileMatcher> standalone = new ArrayList<>();
      for (DataCollectionConfig dc : workflow.getDataCollections()) {
        FileMatcher matcher = new FileMatcher(name, dc, diagnostics);
        (matcher.isStandalone() ? standalone : shared).add(matcher);
      }

      List<RunCandidate> submitted = new ArrayList<>();
      List<CompletableFuture<List<MatchedFile>>> futures = new ArrayList<>();
      if (!shared.isEmpty()) {
        try (RunDiscovery.RunIterator it =
                 new RunDiscovery(workflow, diagnostics).iterator()) {
          while (it.hasNext()) {
            if (cancellation.isCancelled()) {
              complete = false;
              break;
            }
            final RunCandidate run = it.next();
            listener.runDiscovered(run);
            submitted.add(run);
            futures.add(
                CompletableFuture.supplyAsync(() -> matchRun(run, shared),
                    executor));
          }
        }
      }
      for (FileMatcher matcher : standalone) {
        if (cancellation.isCancelled()) {
          complete = false;
          break;
        }
        final RunCandidate run = matcher.standaloneRun();
        submitted.add(run);
        futures.add(
            CompletableFuture.supplyAsync(
                () -> matchRun(run, ImmutableList.of(matcher)), executor));
      }

      if (cancellation.isCancelled()) {
        complete = false;
      }

      Map<String, List<MatchedFile>> matched = new LinkedHashMap<>();
      for (DataCollectionConfig dc : workflow.getDataCollections()) {
        matched.put(dc.getTag(), new ArrayList<MatchedFile>());
      }
      for (int i = 0; i < futures.size(); i++) {
        RunCandidate run = submitted.get(i);
        try {
          for (MatchedFile file : futures.get(i).join()) {
            matched.get(file.getDataCollection()).add(file);
          }
          runs.add(run);
        } catch (CompletionException e) {
          complete = false;
          diagnostics.add(name, null, run.getRunId(), null,
              ErrorKind.RUN_DISCOVERY,
              "Matching files failed: " + e.getCause());
        }
      }
      return matched;
    }

    private List<MatchedFile> matchRun(RunCandidate run,
        List<FileMatcher> matchers) {
      Set<String> claimed = new HashSet<>();
      List<MatchedFile> files = new ArrayList<>();
      for (FileMatcher matcher : matchers) {
        Iterator<MatchedFile> it = matcher.match(run);
        while (it.hasNext()) {
          MatchedFile file = it.next();
          if (settings.getOverlapPolicy() == IngestSettings.OverlapPolicy.FIRST_DECLARED
              && !claimed.add(file.getLocation())) {
            LOGGER.debug("{} already claimed by an earlier collection; not "
                + "matched into {}", file.getLocation(), file.getDataCollection());
            continue;
          }
          files.add(file);
        }
      }
      LOGGER.debug("Run {}: {} file(s) matched", run.getRunId(), files.size());
      return files;
    }

    /** Phases 2 and 3: diffs against the catalog, parses and records. */
    private void register(Map<String, List<MatchedFile>> matched) {
      Map<String, CollectionDiff> diffs = new LinkedHashMap<>();
      List<CompletableFuture<Outcome>> futures = new ArrayList<>();
      for (DataCollectionConfig dc : workflow.getDataCollections()) {
        CollectionReport cr = report.collection(name, dc.getTag());
        List<MatchedFile> files = matched.get(dc.getTag());
        cr.matched = files.size();
        CollectionDiff diff;
        try {
          diff = sync.diff(name, dc.getTag(), files, complete);
        } catch (CatalogSyncException e) {
          diagnostics.add(name, dc.getTag(), null, null, e);
          cr.degraded = true;
          continue;
        }
        diffs.put(dc.getTag(), diff);
        cr.added = diff.count(CollectionDiff.Change.NEW)
            + diff.count(CollectionDiff.Change.RESTORED);
        cr.changed = diff.count(CollectionDiff.Change.CHANGED);
        cr.unchanged = diff.count(CollectionDiff.Change.UNCHANGED)
            + diff.count(CollectionDiff.Change.UNCHANGED_REJECTED);
        cr.rejected = diff.count(CollectionDiff.Change.UNCHANGED_REJECTED);
        for (CollectionDiff.Entry entry : diff.toProcess()) {
          futures.add(
              CompletableFuture.supplyAsync(() -> parse(dc, entry), executor));
        }
      }

      for (CompletableFuture<Outcome> future : futures) {
        Outcome outcome = future.join();
        String tag = outcome.dataCollection.getTag();
        CollectionReport cr = report.collection(name, tag);
        FileRecord record;
        try {
          record = sync.register(outcome.entry, outcome.error);
        } catch (CatalogSyncException e) {
          diagnostics.add(name, tag, outcome.entry.getKey().getRunId(),
              outcome.entry.getKey().getLocation(), e);
          cr.degraded = true;
          continue;
        }
        listener.fileRecorded(record);
        boolean tabular = outcome.dataCollection.getType().isTabular();
        if (outcome.error != null) {
          cr.rejected++;
          if (tabular && outcome.entry.wasRegistered()) {
            changed.add(tag);
          }
        } else if (tabular) {
          cr.parsed++;
          if (outcome.data != null) {
            parsed.put(outcome.entry.getKey(), outcome.data);
          }
          changed.add(tag);
        }
      }

      if (!complete || cancellation.isCancelled()) {
        LOGGER.info("Workflow {}: discovery incomplete; nothing marked stale",
            name);
        return;
      }
      for (CollectionDiff diff : diffs.values()) {
        try {
          sync.markStale(diff);
          report.collection(name, diff.getDataCollection()).stale =
              diff.getStale().size();
        } catch (CatalogSyncException e) {
          diagnostics.add(name, diff.getDataCollection(), null, null, e);
          report.collection(name, diff.getDataCollection()).degraded = true;
        }
      }
    }

    private Outcome parse(DataCollectionConfig dc, CollectionDiff.Entry entry) {
      MatchedFile file = entry.getFile();
      if (file.isRejected()) {
        return new Outcome(dc, entry, null,
            String.valueOf(file.getRejection().getMessage()));
      }
      if (!dc.getType().isTabular()) {
        return new Outcome(dc, entry, null, null);
      }
      try {
        return new Outcome(dc, entry, reader.read(file, dc), null);
      } catch (SchemaMismatchException e) {
        diagnostics.add(name, dc.getTag(), file.getRun().getRunId(),
            file.getLocation(), e);
        return new Outcome(dc, entry, null, e.getMessage());
      } catch (RuntimeException e) {
        diagnostics.add(name, dc.getTag(), file.getRun().getRunId(),
            file.getLocation(), ErrorKind.SCHEMA_MISMATCH,
            "Cannot parse file: " + e);
        return new Outcome(dc, entry, null, String.valueOf(e));
      }
    }

    /** Phase 4: materializes changed collections in join order. */
    private void materialize() {
      JoinGraph graph;
      try {
        graph = JoinGraph.of(workflow);
      } catch (JoinResolutionException e) {
        diagnostics.add(name, null, null, null, e);
        return;
      }
      for (DataCollectionConfig dc : graph.executionOrder()) {
        if (!dc.getType().isTabular()) {
          continue;
        }
        String tag = dc.getTag();
        try {
          materializeCollection(dc, changed.contains(tag));
        } catch (IngestException e) {
          diagnostics.add(name, tag, null, null, e);
          report.collection(name, tag).degraded = true;
        }
        if (dc.getJoin() != null) {
          try {
            materializeJoin(dc);
          } catch (IngestException e) {
            diagnostics.add(name, tag, null, null, e);
            report.collection(name, tag).degraded = true;
          }
        }
      }
    }

    @Nullable TableVersion materializeCollection(DataCollectionConfig dc,
        boolean force) throws StorageWriteException, CatalogSyncException {
      String tag = dc.getTag();
      CollectionReport cr = report.collection(name, tag);
      TableKey key = new TableKey(name, tag);
      // the lease spans the change check, the aggregation and the write
      try (CollectionLocks.Lease ignored = materializer.getLocks().acquire(key)) {
        TableVersion latest = latestVersion(key);
        if (!force && latest != null
            && !recordedSince(catalog.files(name, tag), latest)) {
          cr.version = latest.getVersion();
          return null;
        }
        List<FileRecord> registered = sync.registered(name, tag);
        List<Fragment> fragments = readFragments(dc, registered);
        TableVersion version = null;
        if (!fragments.isEmpty()) {
          TableData data = aggregator.aggregate(name, tag, fragments);
          version = materializer.materialize(key, data);
          if (version != null) {
            aggregates.put(tag, data);
          }
        }
        if (version == null) {
          LOGGER.warn("{}/{}: no rows from {} registered file(s); no version written",
              name, tag, registered.size());
          cr.degraded = true;
          cr.version = latest == null ? null : latest.getVersion();
          return null;
        }
        rewritten.add(tag);
        cr.version = version.getVersion();
        cr.written = true;
        listener.tableMaterialized(version);
        return version;
      }
    }

    void materializeJoin(DataCollectionConfig dc)
        throws StorageWriteException, JoinResolutionException,
        SchemaMismatchException {
      String tag = dc.getTag();
      JoinConfig join = dc.getJoin();
      if (join == null) {
        return;
      }
      CollectionReport cr = report.collection(name, tag);
      TableKey key = new TableKey(name, JoinResolver.joinedTableName(tag));
      try (CollectionLocks.Lease ignored = materializer.getLocks().acquire(key)) {
        TableVersion latest = latestVersion(key);
        boolean inputsChanged = rewritten.contains(tag);
        for (String target : join.getWithDc()) {
          inputsChanged |= rewritten.contains(target);
        }
        if (!inputsChanged && latest != null) {
          cr.joinedVersion = latest.getVersion();
          return;
        }
        TableData source = lookup(tag);
        if (source == null) {
          LOGGER.debug("{}/{}: no table yet; join skipped", name, tag);
          return;
        }
        TableData joined =
            new JoinResolver(workflow).resolve(dc, source, this::lookup);
        TableVersion version = materializer.materialize(key, joined);
        if (version == null) {
          cr.joinedVersion = latest == null ? null : latest.getVersion();
          return;
        }
        cr.joinedVersion = version.getVersion();
        listener.tableMaterialized(version);
      }
    }

    private @Nullable TableData lookup(String tag)
        throws SchemaMismatchException {
      TableData data = aggregates.get(tag);
      if (data != null) {
        return data;
      }
      StoredTable stored;
      try {
        stored = store.read(new TableKey(name, tag), null);
      } catch (IOException e) {
        throw new SchemaMismatchException("Cannot read table " + name + "/"
            + tag + ": " + e.getMessage(), e);
      }
      if (stored == null) {
        return null;
      }
      aggregates.put(tag, stored.getData());
      return stored.getData();
    }

    private @Nullable TableVersion latestVersion(TableKey key)
        throws StorageWriteException {
      try {
        return store.latestVersion(key);
      } catch (IOException e) {
        throw new StorageWriteException("Cannot read versions of " + key
            + ": " + e.getMessage(), false, e);
      }
    }

    private List<Fragment> readFragments(DataCollectionConfig dc,
        List<FileRecord> registered) {
      List<Fragment> fragments = new ArrayList<>();
      List<CompletableFuture<@Nullable Fragment>> futures = new ArrayList<>();
      for (FileRecord record : registered) {
        FileKey key = record.getKey();
        TableData data = parsed.get(key);
        if (data != null) {
          fragments.add(new Fragment(key.getRunId(), key.getLocation(), data));
        } else {
          futures.add(
              CompletableFuture.supplyAsync(() -> reread(dc, record),
                  executor));
        }
      }
      for (CompletableFuture<@Nullable Fragment> future : futures) {
        Fragment fragment = future.join();
        if (fragment != null) {
          fragments.add(fragment);
        }
      }
      return fragments;
    }

    private @Nullable Fragment reread(DataCollectionConfig dc,
        FileRecord record) {
      FileKey key = record.getKey();
      Path path = Paths.get(key.getLocation());
      Path parent = path.getParent();
      RunCandidate run =
          new RunCandidate(name, key.getRunId(), parent == null ? path : parent);
      MatchedFile file =
          new MatchedFile(dc.getTag(), run, path,
              String.valueOf(path.getFileName()), record.getWildcards(), null);
      try {
        return new Fragment(key.getRunId(), key.getLocation(),
            reader.read(file, dc));
      } catch (SchemaMismatchException e) {
        diagnostics.add(name, dc.getTag(), key.getRunId(), key.getLocation(), e);
        return null;
      } catch (RuntimeException e) {
        diagnostics.add(name, dc.getTag(), key.getRunId(), key.getLocation(),
            ErrorKind.SCHEMA_MISMATCH, "Cannot parse file: " + e);
        return null;
      }
    }

    /**
     * Whether a registered or rejected file was recorded after the latest
     * version; a newly rejected file must drop out of the table too.
     */
    private boolean recordedSince(List<FileRecord> records,
        TableVersion latest) {
      for (FileRecord record : records) {
        if (record.getStatus() == FileRecord.Status.STALE) {
          continue;
        }
        // snapshot timestamps have millisecond precision
        if (record.getRegisteredAt().toEpochMilli()
            > latest.getCreatedAt().toEpochMilli()) {
          return true;
        }
      }
      return false;
    }

    private void saveDiagnostics() {
      try {
        catalog.saveDiagnostics(name, clock.instant(),
            diagnostics.getDiagnostics());
      } catch (CatalogSyncException e) {
        LOGGER.error("Failed to record diagnostics of {}: {}", name,
            e.getMessage());
        diagnostics.add(name, null, null, null, e);
      }
    }
  }
}
