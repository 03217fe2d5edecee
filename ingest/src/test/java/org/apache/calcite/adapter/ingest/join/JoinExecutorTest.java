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
package org.apache.calcite.adapter.ingest.join;

import org.apache.calcite.adapter.ingest.SchemaMismatchException;
import org.apache.calcite.adapter.ingest.config.JoinType;
import org.apache.calcite.adapter.ingest.format.Column;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;

import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link JoinExecutor}.
 */
@Tag("unit")
public class JoinExecutorTest {

  private static Column column(String name, ColumnType type, Object... values) {
    return new Column(name, type, new ArrayList<Object>(Arrays.asList(values)));
  }

  /** Samples S1, S2, S3 (null for the third row) with read counts. */
  private static TableData reads() {
    return TableData.of(
        ImmutableList.of(
            column("sample", ColumnType.STRING, "S1", "S2", null, "S4"),
            column("reads", ColumnType.LONG, 10L, 20L, 30L, 40L),
            column("run_id", ColumnType.STRING, "r1", "r1", "r1", "r1")));
  }

  /** Demographics for S1 (twice), S2 and S9. */
  private static TableData demographics() {
    return TableData.of(
        ImmutableList.of(
            column("sample", ColumnType.STRING, "S1", "S1", "S2", "S9"),
            column("age", ColumnType.LONG, 31L, 32L, 40L, 50L),
            column("run_id", ColumnType.STRING, "x", "x", "x", "x")));
  }

  private static List<Object> values(TableData table, String column) {
    return new ArrayList<Object>(table.getColumn(column).getValues());
  }

  @Test void testInnerJoinFansOutAndDropsNullKeys() throws Exception {
    TableData joined = JoinExecutor.join(reads(), demographics(),
        ImmutableList.of("sample"), JoinType.INNER);
    assertEquals(Arrays.asList("sample", "reads", "run_id", "age"),
        joined.getColumnNames());
    assertEquals(3, joined.getRowCount());
    assertEquals(Arrays.<Object>asList("S1", "S1", "S2"), values(joined, "sample"));
    assertEquals(Arrays.<Object>asList(31L, 32L, 40L), values(joined, "age"));
    assertEquals(Arrays.<Object>asList("r1", "r1", "r1"), values(joined, "run_id"));
  }

  @Test void testLeftJoinKeepsUnmatched() throws Exception {
    TableData joined = JoinExecutor.join(reads(), demographics(),
        ImmutableList.of("sample"), JoinType.LEFT);
    assertEquals(5, joined.getRowCount());
    assertEquals(Arrays.<Object>asList(31L, 32L, 40L, null, null),
        values(joined, "age"));
  }

  @Test void testRightAndOuterJoins() throws Exception {
    TableData right = JoinExecutor.join(reads(), demographics(),
        ImmutableList.of("sample"), JoinType.RIGHT);
    assertEquals(4, right.getRowCount());
    assertEquals("S9", right.getColumn("sample").get(3));
    assertEquals(null, right.getColumn("reads").get(3));

    TableData outer = JoinExecutor.join(reads(), demographics(),
        ImmutableList.of("sample"), JoinType.OUTER);
    assertEquals(6, outer.getRowCount());
  }

  @Test void testKeyTypeMismatchComparesAsStrings() throws Exception {
    TableData left = TableData.of(
        ImmutableList.of(column("id", ColumnType.LONG, 1L, 2L),
            column("a", ColumnType.STRING, "x", "y")));
    TableData right = TableData.of(
        ImmutableList.of(column("id", ColumnType.STRING, "2", "3"),
            column("b", ColumnType.STRING, "p", "q")));
    TableData joined = JoinExecutor.join(left, right, ImmutableList.of("id"),
        JoinType.INNER);
    assertEquals(ColumnType.STRING, joined.getColumn("id").getType());
    assertEquals(1, joined.getRowCount());
    assertEquals("p", joined.getColumn("b").get(0));
    assertEquals("y", joined.getColumn("a").get(0));
  }

  @Test void testMissingKey() {
    assertThrows(SchemaMismatchException.class,
        () -> JoinExecutor.join(reads(), demographics(),
            ImmutableList.of("patient"), JoinType.INNER));
  }
}
