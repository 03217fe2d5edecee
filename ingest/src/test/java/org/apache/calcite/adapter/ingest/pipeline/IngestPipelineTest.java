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

import org.apache.calcite.adapter.ingest.ErrorKind;
import org.apache.calcite.adapter.ingest.catalog.DuckDBCatalog;
import org.apache.calcite.adapter.ingest.catalog.FileRecord;
import org.apache.calcite.adapter.ingest.catalog.InMemoryCatalog;
import org.apache.calcite.adapter.ingest.catalog.RunRecord;
import org.apache.calcite.adapter.ingest.config.ProjectConfig;
import org.apache.calcite.adapter.ingest.config.ProjectConfigLoader;
import org.apache.calcite.adapter.ingest.discovery.RunCandidate;
import org.apache.calcite.adapter.ingest.format.TableData;
import org.apache.calcite.adapter.ingest.materialize.CollectionLocks;
import org.apache.calcite.adapter.ingest.storage.IcebergTableStore;
import org.apache.calcite.adapter.ingest.storage.InMemoryTableStore;
import org.apache.calcite.adapter.ingest.storage.StoredTable;
import org.apache.calcite.adapter.ingest.storage.TableKey;
import org.apache.calcite.adapter.ingest.storage.TableStore;
import org.apache.calcite.adapter.ingest.storage.TableVersion;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests for {@link IngestPipeline} over a directory tree of runs.
 */
@Tag("unit")
public class IngestPipelineTest {

  @TempDir
  Path tempDir;

  private Path runs;
  private InMemoryCatalog catalog;
  private InMemoryTableStore store;

  private static final String SAMPLES =
      "      - data_collection_tag: samples\n"
      + "        config:\n"
      + "          type: Table\n"
      + "          metatype: Aggregate\n"
      + "          scan:\n"
      + "            mode: recursive\n"
      + "            scan_parameters:\n"
      + "              regex_config:\n"
      + "                pattern: '.*/sample\\.csv'\n"
      + "          dc_specific_properties:\n"
      + "            format: CSV\n";

  @BeforeEach
  void setUp() throws Exception {
    runs = Files.createDirectories(tempDir.resolve("rnaseq"));
    catalog = new InMemoryCatalog();
    store = new InMemoryTableStore();
  }

  private ProjectConfig project(String settings, String collections)
      throws Exception {
    String yaml = settings
        + "name: demo\n"
        + "workflows:\n"
        + "  - name: rnaseq\n"
        + "    data_location:\n"
        + "      structure: sequencing-runs\n"
        + "      runs_regex: 'run\\d+'\n"
        + "      locations:\n"
        + "        - '{DATA_ROOT}/rnaseq'\n"
        + "    data_collections:\n"
        + collections;
    return new ProjectConfigLoader(
        ImmutableMap.of("DATA_ROOT", tempDir.toString())::get).parse(yaml);
  }

  private void write(String relative, String content) throws Exception {
    Path file = tempDir.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
  }

  private IngestPipeline pipeline(ProjectConfig project) {
    return IngestPipeline.forProject(project, catalog, store);
  }

  private TableData latest(TableStore tables, String table) throws Exception {
    StoredTable stored = tables.read(new TableKey("rnaseq", table), null);
    assertNotNull(stored, table);
    return stored.getData();
  }

  private static List<Object> sorted(TableData data, String column) {
    List<Object> values = new ArrayList<Object>(data.getColumn(column).getValues());
    values.sort(null);
    return values;
  }

  private void twoRuns() throws Exception {
    write("rnaseq/run1/sample.csv", "sample,reads\nS1,10\nS2,20\n");
    write("rnaseq/run2/sample.csv", "sample,reads\nS3,30\n");
    write("rnaseq/notes/sample.csv", "sample,reads\nX,0\n");
  }

  @Test void testAggregatesRunsWithProvenance() throws Exception {
    twoRuns();
    ScanReport report = pipeline(project("", SAMPLES)).process(project("", SAMPLES));

    CollectionReport samples = report.getCollection("rnaseq", "samples");
    assertNotNull(samples);
    assertEquals(2, samples.getMatched());
    assertEquals(2, samples.getNew());
    assertEquals(Long.valueOf(0), samples.getVersion());
    assertTrue(samples.isWritten());
    assertFalse(report.isCancelled());

    TableData table = latest(store, "samples");
    assertEquals(3, table.getRowCount());
    assertEquals(Arrays.<Object>asList("S1", "S2", "S3"), sorted(table, "sample"));
    assertEquals(Arrays.<Object>asList("run1", "run1", "run2"),
        sorted(table, "run_id"));
    assertTrue(table.hasColumn("aggregation_time"));
    assertEquals(1, new HashSet<Object>(
        table.getColumn("aggregation_time").getValues()).size());
  }

  @Test void testSecondProcessIsIdempotent() throws Exception {
    twoRuns();
    ProjectConfig project = project("", SAMPLES);
    pipeline(project).process(project);
    List<FileRecord> files = catalog.files("rnaseq", "samples");
    List<RunRecord> runRecords = catalog.runs("rnaseq");

    ScanReport again = pipeline(project).process(project);
    assertFalse(again.wroteAnything());
    CollectionReport samples = again.getCollection("rnaseq", "samples");
    assertEquals(2, samples.getUnchanged());
    assertEquals(0, samples.getNew());
    assertEquals(Long.valueOf(0), samples.getVersion());
    assertEquals(1, store.history(new TableKey("rnaseq", "samples")).size());
    assertEquals(files, catalog.files("rnaseq", "samples"));
    assertEquals(runRecords, catalog.runs("rnaseq"));
  }

  @Test void testChangedFileWritesNewVersion() throws Exception {
    twoRuns();
    ProjectConfig project = project("", SAMPLES);
    pipeline(project).process(project);
    write("rnaseq/run2/sample.csv", "sample,reads\nS3,30\nS4,40\n");

    ScanReport report = pipeline(project).process(project);
    CollectionReport samples = report.getCollection("rnaseq", "samples");
    assertEquals(1, samples.getChanged());
    assertEquals(Long.valueOf(1), samples.getVersion());
    assertEquals(4, latest(store, "samples").getRowCount());
  }

  @Test void testScanRegistersWithoutWriting() throws Exception {
    twoRuns();
    ProjectConfig project = project("", SAMPLES);
    ScanReport scan = pipeline(project).scan(project);
    assertFalse(scan.wroteAnything());
    assertTrue(store.listTables().isEmpty());
    assertEquals(2, catalog.files("rnaseq", "samples").size());

    ScanReport process = pipeline(project).process(project);
    CollectionReport samples = process.getCollection("rnaseq", "samples");
    assertEquals(2, samples.getUnchanged());
    assertTrue(samples.isWritten());
    assertEquals(3, latest(store, "samples").getRowCount());
  }

  @Test void testInnerJoinWritesJoinedTable() throws Exception {
    write("rnaseq/run1/counts.csv", "sample,reads\nS1,10\nS2,20\n");
    write("rnaseq/run2/counts.csv", "sample,reads\nS3,30\n");
    Path demographics = tempDir.resolve("meta/demographics.csv");
    write("meta/demographics.csv", "sample,age\nS1,34\nS2,51\n");
    String collections =
        "      - data_collection_tag: counts\n"
        + "        config:\n"
        + "          type: Table\n"
        + "          scan:\n"
        + "            mode: recursive\n"
        + "            scan_parameters:\n"
        + "              regex_config:\n"
        + "                pattern: '.*/counts\\.csv'\n"
        + "          dc_specific_properties:\n"
        + "            format: CSV\n"
        + "          join:\n"
        + "            on_columns: [sample]\n"
        + "            how: inner\n"
        + "            with_dc: [demographics]\n"
        + "      - data_collection_tag: demographics\n"
        + "        config:\n"
        + "          type: Table\n"
        + "          scan:\n"
        + "            mode: single\n"
        + "            scan_parameters:\n"
        + "              filename: '" + demographics + "'\n"
        + "          dc_specific_properties:\n"
        + "            format: CSV\n";
    ProjectConfig project = project("", collections);

    ScanReport report = pipeline(project).process(project);
    assertEquals(Long.valueOf(0),
        report.getCollection("rnaseq", "counts").getJoinedVersion());
    TableData joined = latest(store, "joined_counts");
    assertEquals(2, joined.getRowCount());
    assertEquals(Arrays.<Object>asList(34L, 51L), sorted(joined, "age"));
    assertEquals(Arrays.<Object>asList("run1", "run1"), sorted(joined, "run_id"));
    assertEquals(3, latest(store, "counts").getRowCount());

    write("meta/demographics.csv", "sample,age\nS1,34\nS2,51\nS3,29\n");
    ScanReport second = pipeline(project).process(project);
    CollectionReport counts = second.getCollection("rnaseq", "counts");
    assertFalse(counts.isWritten());
    assertEquals(Long.valueOf(0), counts.getVersion());
    assertEquals(Long.valueOf(1), counts.getJoinedVersion());
    assertEquals(3, latest(store, "joined_counts").getRowCount());

    ScanReport third = pipeline(project).process(project);
    assertFalse(third.wroteAnything());
    assertEquals(2, store.history(new TableKey("rnaseq", "joined_counts")).size());
  }

  @Test void testEmptyWildcardRejectsOnlyThatFile() throws Exception {
    write("rnaseq/run1/S1_metrics.csv", "depth\n10\n");
    write("rnaseq/run1/S2_metrics.csv", "depth\n20\n");
    write("rnaseq/run1/_metrics.csv", "depth\n99\n");
    write("rnaseq/run1/S3_metrics.csv", "depth\n30,31\n");
    String collections =
        "      - data_collection_tag: metrics\n"
        + "        config:\n"
        + "          type: Table\n"
        + "          scan:\n"
        + "            mode: recursive\n"
        + "            scan_parameters:\n"
        + "              regex_config:\n"
        + "                pattern: '(?P<sample>[^/]*)_metrics\\.csv'\n"
        + "          dc_specific_properties:\n"
        + "            format: CSV\n";
    ProjectConfig project = project("", collections);

    ScanReport report = pipeline(project).process(project);
    CollectionReport metrics = report.getCollection("rnaseq", "metrics");
    assertEquals(4, metrics.getMatched());
    assertEquals(2, metrics.getRejected());
    assertEquals(2, metrics.getParsed());
    assertEquals(1, report.getDiagnostics(ErrorKind.WILDCARD_EXTRACTION).size());
    assertEquals(1, report.getDiagnostics(ErrorKind.SCHEMA_MISMATCH).size());

    TableData table = latest(store, "metrics");
    assertEquals(Arrays.<Object>asList("S1", "S2"), sorted(table, "sample"));

    int rejected = 0;
    for (FileRecord record : catalog.files("rnaseq", "metrics")) {
      if (record.getStatus() == FileRecord.Status.REJECTED) {
        rejected++;
        assertNotNull(record.getError());
      }
    }
    assertEquals(2, rejected);
    assertEquals(2,
        new IngestQueryService(catalog, store).lastReport("rnaseq").size());
  }

  @Test void testFileRejectedByScanLeavesTableOnProcess() throws Exception {
    twoRuns();
    ProjectConfig project = project("", SAMPLES);
    pipeline(project).process(project);
    // registration times are compared with version times in milliseconds
    Thread.sleep(20);
    write("rnaseq/run2/sample.csv", "sample,reads\nS3,30,99\n");

    ScanReport scan = pipeline(project).scan(project);
    assertEquals(1, scan.getCollection("rnaseq", "samples").getRejected());
    assertEquals(3, latest(store, "samples").getRowCount());

    ScanReport process = pipeline(project).process(project);
    CollectionReport samples = process.getCollection("rnaseq", "samples");
    assertTrue(samples.isWritten());
    assertEquals(Long.valueOf(1), samples.getVersion());
    assertEquals(Arrays.<Object>asList("S1", "S2"),
        sorted(latest(store, "samples"), "sample"));

    assertFalse(pipeline(project).process(project).wroteAnything());
  }

  @Test void testAllFilesRejectedKeepsPreviousVersion() throws Exception {
    twoRuns();
    ProjectConfig project = project("", SAMPLES);
    pipeline(project).process(project);
    write("rnaseq/run1/sample.csv", "sample,reads\nS1,10,1\n");
    write("rnaseq/run2/sample.csv", "sample,reads\nS3\n");

    ScanReport report = pipeline(project).process(project);
    CollectionReport samples = report.getCollection("rnaseq", "samples");
    assertEquals(2, samples.getRejected());
    assertEquals(0, samples.getParsed());
    assertTrue(samples.isDegraded());
    assertFalse(samples.isWritten());
    assertEquals(Long.valueOf(0), samples.getVersion());
    assertEquals(2, report.getDiagnostics(ErrorKind.SCHEMA_MISMATCH).size());
    assertEquals(1, store.history(new TableKey("rnaseq", "samples")).size());
    assertEquals(3, latest(store, "samples").getRowCount());
  }

  @Test void testWritersOfOneStoreShareTheTableLease() throws Exception {
    twoRuns();
    ProjectConfig project = project("ingest:\n  lock_timeout_ms: 50\n", SAMPLES);
    IngestPipeline first = pipeline(project);
    IngestPipeline second = pipeline(project);
    TableKey key = new TableKey("rnaseq", "samples");
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<?> holder = executor.submit(() -> {
        try (CollectionLocks.Lease ignored =
                 first.getMaterializer().getLocks().acquire(key)) {
          held.countDown();
          release.await(10, TimeUnit.SECONDS);
        }
        return null;
      });
      assertTrue(held.await(10, TimeUnit.SECONDS));
      assertTrue(second.getMaterializer().getLocks().isLocked(key));

      ScanReport blocked = second.process(project);
      CollectionReport samples = blocked.getCollection("rnaseq", "samples");
      assertTrue(samples.isDegraded());
      assertFalse(samples.isWritten());
      assertTrue(store.history(key).isEmpty());
      assertEquals(1, blocked.getDiagnostics(ErrorKind.STORAGE_WRITE).size());

      release.countDown();
      holder.get(10, TimeUnit.SECONDS);
      ScanReport retried = second.process(project);
      assertTrue(retried.getCollection("rnaseq", "samples").isWritten());
      assertEquals(1, store.history(key).size());
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }

  @Test void testDeletedRunBecomesStale() throws Exception {
    twoRuns();
    ProjectConfig project = project("", SAMPLES);
    IngestPipeline pipeline = pipeline(project);
    pipeline.process(project);
    MoreFiles.deleteRecursively(runs.resolve("run2"),
        RecursiveDeleteOption.ALLOW_INSECURE);

    ScanReport report = pipeline.process(project);
    CollectionReport samples = report.getCollection("rnaseq", "samples");
    assertEquals(1, samples.getStale());
    assertFalse(report.wroteAnything());
    assertEquals(Long.valueOf(0), samples.getVersion());
    assertEquals(3, latest(store, "samples").getRowCount());

    CollectionStatus status =
        new IngestQueryService(catalog, store).collectionStatus("rnaseq", "samples");
    assertEquals(1, status.getRunCount(RunRecord.Status.STALE));
    assertEquals(1, status.getRunCount(RunRecord.Status.ACTIVE));
    assertEquals(1, status.getFileCount(FileRecord.Status.STALE));
    assertEquals(1, status.getFileCount(FileRecord.Status.REGISTERED));

    TableVersion rebuilt = pipeline.rematerialize(project, "rnaseq", "samples");
    assertNotNull(rebuilt);
    assertEquals(1, rebuilt.getVersion());
    assertEquals(Arrays.<Object>asList("run1", "run1"),
        sorted(latest(store, "samples"), "run_id"));

    assertThrows(IllegalArgumentException.class,
        () -> pipeline.rematerialize(project, "rnaseq", "absent"));
  }

  @Test void testOverlapPolicy() throws Exception {
    write("rnaseq/run1/sample.csv", "sample,reads\nS1,10\n");
    write("rnaseq/run1/other.csv", "lane,yield\nL1,5\n");
    String collections = SAMPLES
        + "      - data_collection_tag: everything\n"
        + "        config:\n"
        + "          type: Table\n"
        + "          scan:\n"
        + "            mode: recursive\n"
        + "            scan_parameters:\n"
        + "              regex_config:\n"
        + "                pattern: '.*\\.csv'\n"
        + "          dc_specific_properties:\n"
        + "            format: CSV\n";

    ProjectConfig all = project("", collections);
    ScanReport shared = pipeline(all).scan(all);
    assertEquals(1, shared.getCollection("rnaseq", "samples").getMatched());
    assertEquals(2, shared.getCollection("rnaseq", "everything").getMatched());

    catalog = new InMemoryCatalog();
    ProjectConfig first =
        project("ingest:\n  overlap_policy: first_declared\n", collections);
    ScanReport exclusive = pipeline(first).scan(first);
    assertEquals(1, exclusive.getCollection("rnaseq", "samples").getMatched());
    assertEquals(1, exclusive.getCollection("rnaseq", "everything").getMatched());
  }

  @Test void testCancelledScanMarksNothingStale() throws Exception {
    twoRuns();
    ProjectConfig project = project("ingest:\n  parallelism: 1\n", SAMPLES);
    pipeline(project).process(project);
    MoreFiles.deleteRecursively(runs.resolve("run2"),
        RecursiveDeleteOption.ALLOW_INSECURE);
    write("rnaseq/run1/sample.csv", "sample,reads\nS1,11\nS2,22\n");

    final ScanCancellation cancellation = new ScanCancellation();
    IngestPipeline pipeline = pipeline(project);
    pipeline.setProgressListener(new ProgressListener() {
      @Override public void runDiscovered(RunCandidate run) {
        cancellation.cancel();
      }
    });
    ScanReport report = pipeline.process(project, cancellation);
    assertTrue(report.isCancelled());
    assertFalse(report.wroteAnything());
    assertEquals(1, store.history(new TableKey("rnaseq", "samples")).size());
    for (RunRecord run : catalog.runs("rnaseq")) {
      assertEquals(RunRecord.Status.ACTIVE, run.getStatus());
    }
    for (FileRecord file : catalog.files("rnaseq", "samples")) {
      assertFalse(file.getStatus() == FileRecord.Status.STALE, file.toString());
    }
  }

  @Test void testQueryService() throws Exception {
    twoRuns();
    ProjectConfig project = project("", SAMPLES);
    pipeline(project).process(project);
    write("rnaseq/run1/sample.csv", "sample,reads\nS1,11\n");
    pipeline(project).process(project);

    IngestQueryService service = new IngestQueryService(catalog, store);
    assertEquals(Arrays.asList(new TableKey("rnaseq", "samples")),
        service.listTables());
    List<TableVersion> history = service.tableHistory("rnaseq", "samples");
    assertEquals(2, history.size());
    StoredTable first = service.readTable("rnaseq", "samples", 0L);
    assertNotNull(first);
    assertEquals(3, first.getData().getRowCount());
    StoredTable current = service.readTable("rnaseq", "samples", null);
    assertNotNull(current);
    assertEquals(2, current.getData().getRowCount());
    assertNull(service.readTable("rnaseq", "samples", 5L));
    TableVersion latest =
        service.collectionStatus("rnaseq", "samples").getLatestVersion();
    assertNotNull(latest);
    assertEquals(1, latest.getVersion());
    assertTrue(service.lastReport("rnaseq").isEmpty());
  }

  @Tag("integration")
  @Test void testDurableCatalogAndWarehouse() throws Exception {
    twoRuns();
    ProjectConfig project = project("", SAMPLES);
    Path warehouse = tempDir.resolve("warehouse");
    Path db = tempDir.resolve("catalog.duckdb");
    try (DuckDBCatalog durable = DuckDBCatalog.open(db);
         IcebergTableStore tables = new IcebergTableStore(warehouse.toString())) {
      ScanReport report =
          IngestPipeline.forProject(project, durable, tables).process(project);
      assertEquals(Long.valueOf(0),
          report.getCollection("rnaseq", "samples").getVersion());
    }
    try (DuckDBCatalog durable = DuckDBCatalog.open(db);
         IcebergTableStore tables = new IcebergTableStore(warehouse.toString())) {
      ScanReport again =
          IngestPipeline.forProject(project, durable, tables).process(project);
      assertFalse(again.wroteAnything());
      assertEquals(2, durable.files("rnaseq", "samples").size());
      assertEquals(3, latest(tables, "samples").getRowCount());
    }
  }
}
