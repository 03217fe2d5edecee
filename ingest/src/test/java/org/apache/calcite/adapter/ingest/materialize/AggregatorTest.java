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
package org.apache.calcite.adapter.ingest.materialize;

import org.apache.calcite.adapter.ingest.DiagnosticsReport;
import org.apache.calcite.adapter.ingest.ErrorKind;
import org.apache.calcite.adapter.ingest.format.Column;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Aggregator}.
 */
@Tag("unit")
public class AggregatorTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T10:15:30.123456Z"), ZoneOffset.UTC);

  private static Column column(String name, ColumnType type, Object... values) {
    return new Column(name, type, new ArrayList<Object>(Arrays.asList(values)));
  }

  private static Fragment fragment(String run, String location,
      Column... columns) {
    return new Fragment(run, location, TableData.of(Arrays.asList(columns)));
  }

  @Test void testUnionSchemaWithWideningAndNullFill() {
    DiagnosticsReport diagnostics = new DiagnosticsReport();
    List<Fragment> fragments = ImmutableList.of(
        fragment("r2", "/d/r2/a.csv",
            column("sample", ColumnType.STRING, "S3"),
            column("value", ColumnType.LONG, 3L)),
        fragment("r1", "/d/r1/b.csv",
            column("sample", ColumnType.STRING, "S1"),
            column("value", ColumnType.DOUBLE, 1.5),
            column("extra", ColumnType.STRING, "x")),
        fragment("r1", "/d/r1/a.csv",
            column("sample", ColumnType.STRING, "S2"),
            column("value", ColumnType.LONG, 2L)));

    TableData table = new Aggregator("aggregation_time", diagnostics, CLOCK)
        .aggregate("wf", "metrics", fragments);

    assertEquals(3, table.getRowCount());
    assertEquals(Arrays.asList("sample", "value", "extra", "aggregation_time"),
        table.getColumnNames());
    assertEquals(Arrays.<Object>asList("S2", "S1", "S3"),
        table.getColumn("sample").getValues());
    assertEquals(ColumnType.DOUBLE, table.getColumn("value").getType());
    assertEquals(Arrays.<Object>asList(2.0, 1.5, 3.0),
        table.getColumn("value").getValues());
    assertEquals(Arrays.<Object>asList(null, "x", null),
        table.getColumn("extra").getValues());

    assertEquals(ColumnType.TIMESTAMP,
        table.getColumn("aggregation_time").getType());
    LocalDateTime expected = LocalDateTime.of(2024, 5, 1, 10, 15, 30, 123_000_000);
    for (Object v : table.getColumn("aggregation_time").getValues()) {
      assertEquals(expected, v);
    }

    assertEquals(1, diagnostics.ofKind(ErrorKind.PARTIAL_COLUMN).size());
    assertTrue(diagnostics.ofKind(ErrorKind.PARTIAL_COLUMN).get(0).getMessage()
        .contains("extra"));
  }

  @Test void testConflictingTypesWidenToString() {
    DiagnosticsReport diagnostics = new DiagnosticsReport();
    TableData table = new Aggregator("aggregation_time", diagnostics, CLOCK)
        .aggregate("wf", "metrics",
            ImmutableList.of(
                fragment("r1", "a", column("flag", ColumnType.BOOLEAN, true)),
                fragment("r2", "a", column("flag", ColumnType.LONG, 7L))));
    assertEquals(ColumnType.STRING, table.getColumn("flag").getType());
    assertEquals(Arrays.<Object>asList("true", "7"),
        table.getColumn("flag").getValues());
    assertTrue(diagnostics.isEmpty());
  }

  @Test void testSourceAggregationTimeIsReplaced() {
    DiagnosticsReport diagnostics = new DiagnosticsReport();
    TableData table = new Aggregator("aggregation_time", diagnostics, CLOCK)
        .aggregate("wf", "metrics",
            ImmutableList.of(
                fragment("r1", "a",
                    column("aggregation_time", ColumnType.STRING, "old"),
                    column("n", ColumnType.LONG, 1L))));
    assertEquals(Arrays.asList("n", "aggregation_time"), table.getColumnNames());
    assertEquals(ColumnType.TIMESTAMP,
        table.getColumn("aggregation_time").getType());
  }
}
