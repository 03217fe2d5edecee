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
import org.apache.calcite.adapter.ingest.ErrorKind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DuckDBCatalog}.
 */
@Tag("integration")
public class DuckDBCatalogTest {

  @TempDir
  Path tempDir;

  private static final Instant T0 = Instant.parse("2024-06-01T08:00:00.123Z");

  private static FileRecord file(String run, String location,
      FileRecord.Status status, String error) {
    return new FileRecord(new FileKey("wf", "metrics", run, location),
        ImmutableMap.of("sample", "S1", "lane", "L001"),
        new Fingerprint("abc123", 42L, T0), status, T0, error);
  }

  @Test void testRecordsSurviveReopen() throws Exception {
    Path db = tempDir.resolve("state/catalog.duckdb");
    RunRecord run = new RunRecord("wf", "run1", "/data/run1",
        RunRecord.Status.ACTIVE, T0);
    FileRecord registered = file("run1", "/data/run1/a.csv",
        FileRecord.Status.REGISTERED, null);
    FileRecord rejected = file("run1", "/data/run1/b.csv",
        FileRecord.Status.REJECTED, "wildcard 'sample' is empty");
    Diagnostic diagnostic = new Diagnostic("wf", "metrics", "run1",
        "/data/run1/b.csv", ErrorKind.WILDCARD_EXTRACTION,
        "wildcard 'sample' is empty");

    try (DuckDBCatalog catalog = DuckDBCatalog.open(db)) {
      catalog.upsertRun(run);
      catalog.upsertFile(registered);
      catalog.upsertFile(rejected);
      catalog.saveDiagnostics("wf", T0, ImmutableList.of(diagnostic));
    }

    try (DuckDBCatalog catalog = DuckDBCatalog.open(db)) {
      assertEquals(ImmutableList.of(run), catalog.runs("wf"));
      assertEquals(ImmutableList.of(registered, rejected),
          catalog.files("wf", "metrics"));
      assertEquals(rejected, catalog.file(rejected.getKey()));
      assertEquals(ImmutableList.of(diagnostic), catalog.lastDiagnostics("wf"));
      assertTrue(catalog.runs("other").isEmpty());
      assertTrue(catalog.files("wf", "other").isEmpty());
      assertNull(catalog.file(new FileKey("wf", "metrics", "run9", "/x")));
    }
  }

  @Test void testUpsertsReplace() throws Exception {
    try (DuckDBCatalog catalog = DuckDBCatalog.open(tempDir.resolve("c.duckdb"))) {
      RunRecord run = new RunRecord("wf", "run1", "/data/run1",
          RunRecord.Status.ACTIVE, T0);
      catalog.upsertRun(run);
      catalog.upsertRun(run.withStatus(RunRecord.Status.STALE));
      List<RunRecord> runs = catalog.runs("wf");
      assertEquals(1, runs.size());
      assertEquals(RunRecord.Status.STALE, runs.get(0).getStatus());
      assertEquals(T0, runs.get(0).getFirstSeen());

      FileRecord record = file("run1", "/data/run1/a.csv",
          FileRecord.Status.REGISTERED, null);
      catalog.upsertFile(record);
      catalog.upsertFile(record.withStatus(FileRecord.Status.STALE));
      assertEquals(FileRecord.Status.STALE,
          catalog.files("wf", "metrics").get(0).getStatus());

      catalog.saveDiagnostics("wf", T0, ImmutableList.of(
          new Diagnostic("wf", null, null, null, ErrorKind.RUN_DISCOVERY, "m")));
      catalog.saveDiagnostics("wf", T0, ImmutableList.<Diagnostic>of());
      assertTrue(catalog.lastDiagnostics("wf").isEmpty());
    }
  }
}
