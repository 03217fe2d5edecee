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
package org.apache.calcite.adapter.ingest.discovery;

import org.apache.calcite.adapter.ingest.DiagnosticsReport;
import org.apache.calcite.adapter.ingest.ErrorKind;
import org.apache.calcite.adapter.ingest.config.DataCollectionConfig;
import org.apache.calcite.adapter.ingest.config.RegexConfig;
import org.apache.calcite.adapter.ingest.config.ScanConfig;
import org.apache.calcite.adapter.ingest.config.TableFormat;
import org.apache.calcite.adapter.ingest.config.TableProperties;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FileMatcher}.
 */
@Tag("unit")
public class FileMatcherTest {

  @TempDir
  Path tempDir;

  private RunCandidate run;
  private DiagnosticsReport diagnostics;

  @BeforeEach
  void setUp() throws IOException {
    Path root = Files.createDirectories(tempDir.resolve("run1"));
    touch(root.resolve("summary.csv"));
    touch(root.resolve("S1/counts.csv"));
    touch(root.resolve("S1/counts.csv.idx"));
    touch(root.resolve("S2/counts.csv"));
    touch(root.resolve("S2/deep/nested/counts.csv"));
    touch(root.resolve("tmp/S9/counts.csv"));
    touch(root.resolve("_/counts.csv"));
    run = new RunCandidate("wf", "run1", root);
    diagnostics = new DiagnosticsReport();
  }

  private static void touch(Path file) throws IOException {
    Files.createDirectories(file.getParent());
    Files.write(file, "a\n1\n".getBytes());
  }

  private static DataCollectionConfig collection(ScanConfig scan,
      String indexExtension) {
    return DataCollectionConfig.builder("counts")
        .scan(scan)
        .properties(
            TableProperties.builder(TableFormat.CSV)
                .indexExtension(indexExtension)
                .build())
        .build();
  }

  private List<MatchedFile> matchAll(FileMatcher matcher) {
    List<MatchedFile> files = new ArrayList<>();
    Iterator<MatchedFile> it = matcher.match(run);
    while (it.hasNext()) {
      files.add(it.next());
    }
    return files;
  }

  @Test void testRecursiveMatchExtractsWildcards() {
    FileMatcher matcher =
        new FileMatcher("wf",
            collection(
                ScanConfig.recursive(
                    RegexConfig.of("(?P<sample>S\\d+)/counts\\.csv")),
                null),
            diagnostics);
    List<MatchedFile> files = matchAll(matcher);
    assertEquals(2, files.size());
    assertEquals("S1/counts.csv", files.get(0).getRelativePath());
    assertEquals("S1", files.get(0).getWildcards().get("sample"));
    assertEquals("S2", files.get(1).getWildcards().get("sample"));
    assertTrue(diagnostics.isEmpty());
  }

  @Test void testPatternMayIncludeRunDirectory() {
    FileMatcher matcher =
        new FileMatcher("wf",
            collection(ScanConfig.recursive(RegexConfig.of("run1/summary\\.csv")),
                null),
            diagnostics);
    assertEquals(1, matchAll(matcher).size());
  }

  @Test void testSidecarIsAttachedNotMatched() {
    FileMatcher matcher =
        new FileMatcher("wf",
            collection(ScanConfig.recursive(RegexConfig.of(".*counts\\.csv.*")),
                "idx"),
            diagnostics);
    for (MatchedFile file : matchAll(matcher)) {
      assertFalse(file.getRelativePath().endsWith(".idx"));
      if (file.getRelativePath().equals("S1/counts.csv")) {
        assertNotNull(file.getSidecar());
      } else {
        assertNull(file.getSidecar());
      }
    }
  }

  @Test void testMaxDepthAndIgnore() {
    FileMatcher shallow =
        new FileMatcher("wf",
            collection(
                ScanConfig.recursive(RegexConfig.of(".*counts\\.csv"), 2,
                    ImmutableList.of("tmp")),
                null),
            diagnostics);
    List<String> paths = new ArrayList<>();
    for (MatchedFile file : matchAll(shallow)) {
      paths.add(file.getRelativePath());
    }
    assertEquals(ImmutableList.of("S1/counts.csv", "S2/counts.csv", "_/counts.csv"),
        paths);
  }

  @Test void testEmptyWildcardRejectsOnlyThatFile() throws IOException {
    touch(run.getRoot().resolve("S/counts.csv"));
    FileMatcher matcher =
        new FileMatcher("wf",
            collection(
                ScanConfig.recursive(
                    RegexConfig.of("S(?P<sample>\\d*)/counts\\.csv")),
                null),
            diagnostics);
    List<MatchedFile> files = matchAll(matcher);
    int rejected = 0;
    for (MatchedFile file : files) {
      if (file.isRejected()) {
        rejected++;
        assertEquals("S/counts.csv", file.getRelativePath());
      }
    }
    assertEquals(1, rejected);
    assertEquals(3, files.size());
    assertEquals(1, diagnostics.ofKind(ErrorKind.WILDCARD_EXTRACTION).size());
  }

  @Test void testSingleMode() {
    FileMatcher matcher =
        new FileMatcher("wf", collection(ScanConfig.single("summary.csv"), null),
            diagnostics);
    assertFalse(matcher.isStandalone());
    assertEquals(1, matchAll(matcher).size());

    FileMatcher missing =
        new FileMatcher("wf", collection(ScanConfig.single("absent.csv"), null),
            diagnostics);
    assertTrue(matchAll(missing).isEmpty());
    assertEquals(1, diagnostics.ofKind(ErrorKind.RUN_DISCOVERY).size());
  }

  @Test void testAbsoluteSingleFileIsStandalone() {
    Path file = run.getRoot().resolve("summary.csv").toAbsolutePath();
    FileMatcher matcher =
        new FileMatcher("wf", collection(ScanConfig.single(file.toString()), null),
            diagnostics);
    assertTrue(matcher.isStandalone());
    RunCandidate pseudo = matcher.standaloneRun();
    assertEquals("counts" + RunCandidate.SINGLE_FILE_SUFFIX, pseudo.getRunId());
    Iterator<MatchedFile> it = matcher.match(pseudo);
    assertTrue(it.hasNext());
    assertEquals(file.normalize().toString(), it.next().getLocation());
  }
}
