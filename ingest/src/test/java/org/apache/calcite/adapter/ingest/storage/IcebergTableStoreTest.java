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
package org.apache.calcite.adapter.ingest.storage;

import org.apache.calcite.adapter.ingest.format.Column;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link IcebergTableStore} against a local warehouse.
 */
@Tag("integration")
public class IcebergTableStoreTest {

  @TempDir
  Path tempDir;

  private static final TableKey METRICS = new TableKey("rnaseq", "metrics");

  private static Column column(String name, ColumnType type, Object... values) {
    return new Column(name, type, new ArrayList<Object>(Arrays.asList(values)));
  }

  private static TableData first() {
    return TableData.of(
        ImmutableList.of(column("sample", ColumnType.STRING, "S1", "S2"),
            column("reads", ColumnType.LONG, 10L, null)));
  }

  private static TableData second() {
    return TableData.of(
        ImmutableList.of(column("sample", ColumnType.STRING, "S1", "S2", "S3"),
            column("reads", ColumnType.LONG, 10L, 20L, 30L),
            column("ratio", ColumnType.DOUBLE, 0.5, null, 1.0),
            column("passed", ColumnType.BOOLEAN, true, false, true),
            column("aggregation_time", ColumnType.TIMESTAMP,
                LocalDateTime.of(2024, 5, 1, 10, 0),
                LocalDateTime.of(2024, 5, 1, 10, 0),
                LocalDateTime.of(2024, 5, 1, 10, 0))));
  }

  @Test void testVersionsHistoryAndTimeTravel() throws Exception {
    IcebergTableStore store = new IcebergTableStore(tempDir.toString());
    assertNull(store.latestVersion(METRICS));
    assertTrue(store.listTables().isEmpty());

    TableVersion v0 = store.write(METRICS, first());
    TableVersion v1 = store.write(METRICS, second());
    assertEquals(0, v0.getVersion());
    assertEquals(1, v1.getVersion());
    assertEquals(3, v1.getRowCount());
    assertEquals(Arrays.asList("sample", "reads", "ratio", "passed",
        "aggregation_time"), new ArrayList<>(v1.getSchema().keySet()));

    List<TableVersion> history = store.history(METRICS);
    assertEquals(2, history.size());
    assertEquals(0, history.get(0).getVersion());
    assertEquals(2, history.get(0).getRowCount());

    StoredTable old = store.read(METRICS, 0L);
    assertNotNull(old);
    assertEquals(Arrays.asList("sample", "reads"), old.getData().getColumnNames());
    assertEquals(2, old.getData().getRowCount());
    assertNull(old.getData().getColumn("reads").get(1));

    StoredTable latest = store.read(METRICS, null);
    assertNotNull(latest);
    assertEquals(1, latest.getVersion().getVersion());
    TableData data = latest.getData();
    assertEquals(3, data.getRowCount());
    List<Object> samples = new ArrayList<Object>(data.getColumn("sample").getValues());
    samples.sort(null);
    assertEquals(Arrays.<Object>asList("S1", "S2", "S3"), samples);
    assertEquals(LocalDateTime.of(2024, 5, 1, 10, 0),
        data.getColumn("aggregation_time").get(0));
    assertEquals(ColumnType.BOOLEAN, data.getColumn("passed").getType());

    assertNull(store.read(METRICS, 7L));
    assertNull(store.read(new TableKey("rnaseq", "absent"), null));
  }

  @Test void testTablesSurviveReopen() throws Exception {
    try (IcebergTableStore store = new IcebergTableStore(tempDir.toString())) {
      store.write(METRICS, first());
      store.write(new TableKey("rnaseq", "joined_metrics"), first());
      store.write(new TableKey("atac", "peaks"), first());
    }
    try (IcebergTableStore reopened = new IcebergTableStore(tempDir.toString())) {
      assertEquals(
          Arrays.asList(new TableKey("atac", "peaks"),
              new TableKey("rnaseq", "joined_metrics"), METRICS),
          reopened.listTables());
      TableVersion latest = reopened.latestVersion(METRICS);
      assertNotNull(latest);
      assertEquals(0, latest.getVersion());
      assertEquals(1, reopened.write(METRICS, second()).getVersion());
    }
  }
}
