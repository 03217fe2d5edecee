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
import org.apache.calcite.adapter.ingest.config.AggregationFunction;
import org.apache.calcite.adapter.ingest.config.DataCollectionConfig;
import org.apache.calcite.adapter.ingest.config.DataLocationConfig;
import org.apache.calcite.adapter.ingest.config.GranularityConfig;
import org.apache.calcite.adapter.ingest.config.JoinConfig;
import org.apache.calcite.adapter.ingest.config.JoinType;
import org.apache.calcite.adapter.ingest.config.ScanConfig;
import org.apache.calcite.adapter.ingest.config.TableFormat;
import org.apache.calcite.adapter.ingest.config.TableProperties;
import org.apache.calcite.adapter.ingest.config.WorkflowConfig;
import org.apache.calcite.adapter.ingest.format.Column;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link GranularityAggregator} and its use by {@link JoinResolver}.
 */
@Tag("unit")
public class GranularityAggregatorTest {

  private static Column column(String name, ColumnType type, Object... values) {
    return new Column(name, type, new ArrayList<Object>(Arrays.asList(values)));
  }

  private static List<Object> values(TableData table, String column) {
    return new ArrayList<Object>(table.getColumn(column).getValues());
  }

  /** Three cells of S1, two of S2 and one of S3. */
  private static TableData cells() {
    return TableData.of(
        ImmutableList.of(
            column("sample", ColumnType.STRING, "S1", "S1", "S2", "S1", "S2", "S3"),
            column("genes", ColumnType.LONG, 10L, 20L, 5L, 60L, null, 7L),
            column("score", ColumnType.DOUBLE, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0),
            column("cluster", ColumnType.STRING, "a", "b", "c", "d", "e", null)));
  }

  private static TableData samples() {
    return TableData.of(
        ImmutableList.of(
            column("sample", ColumnType.STRING, "S1", "S2", "S3"),
            column("age", ColumnType.LONG, 30L, 40L, 50L)));
  }

  @Test void testDefaultsAverageNumbersAndTakeFirstValue() throws Exception {
    TableData out = GranularityAggregator.aggregate(cells(),
        ImmutableList.of("sample"), GranularityConfig.of("sample"));
    assertEquals(3, out.getRowCount());
    assertEquals(Arrays.<Object>asList("S1", "S2", "S3"), values(out, "sample"));
    assertEquals(ColumnType.DOUBLE, out.getColumn("genes").getType());
    assertEquals(Arrays.<Object>asList(30.0, 5.0, 7.0), values(out, "genes"));
    assertEquals(Arrays.<Object>asList(7.0 / 3, 4.0, 6.0), values(out, "score"));
    assertEquals(Arrays.<Object>asList("a", "c", null), values(out, "cluster"));
  }

  @Test void testOverridesWinOverDefaults() throws Exception {
    GranularityConfig granularity = new GranularityConfig("sample",
        AggregationFunction.SUM, AggregationFunction.LAST,
        ImmutableMap.of("score", AggregationFunction.MEDIAN,
            "cluster", AggregationFunction.COUNT));
    TableData out = GranularityAggregator.aggregate(cells(),
        ImmutableList.of("sample"), granularity);
    assertEquals(ColumnType.LONG, out.getColumn("genes").getType());
    assertEquals(Arrays.<Object>asList(90L, 5L, 7L), values(out, "genes"));
    assertEquals(Arrays.<Object>asList(2.0, 4.0, 6.0), values(out, "score"));
    assertEquals(ColumnType.LONG, out.getColumn("cluster").getType());
    assertEquals(Arrays.<Object>asList(3L, 2L, 0L), values(out, "cluster"));
  }

  @Test void testMinMaxKeepTypeAndNumericOnlyFunctionsRejectStrings()
      throws Exception {
    GranularityConfig granularity = new GranularityConfig("sample",
        AggregationFunction.MAX, AggregationFunction.MIN,
        ImmutableMap.<String, AggregationFunction>of());
    TableData out = GranularityAggregator.aggregate(cells(),
        ImmutableList.of("sample"), granularity);
    assertEquals(Arrays.<Object>asList(60L, 5L, 7L), values(out, "genes"));
    assertEquals(Arrays.<Object>asList("a", "c", null), values(out, "cluster"));

    GranularityConfig meanOfStrings = new GranularityConfig("sample",
        AggregationFunction.MEAN, AggregationFunction.FIRST,
        ImmutableMap.of("cluster", AggregationFunction.MEAN));
    assertThrows(SchemaMismatchException.class,
        () -> GranularityAggregator.aggregate(cells(),
            ImmutableList.of("sample"), meanOfStrings));
  }

  @Test void testAverageRowsPerKey() throws Exception {
    assertEquals(2.0, GranularityAggregator.averageRowsPerKey(cells(),
        ImmutableList.of("sample")));
    assertEquals(1.0, GranularityAggregator.averageRowsPerKey(samples(),
        ImmutableList.of("sample")));
    assertEquals(0.0, GranularityAggregator.averageRowsPerKey(TableData.empty(),
        ImmutableList.of("sample")));
  }

  @Test void testResolverAggregatesTheFinerSide() throws Exception {
    DataCollectionConfig cellsDc = DataCollectionConfig.builder("cells")
        .scan(ScanConfig.single("cells.csv"))
        .properties(TableProperties.builder(TableFormat.CSV).build())
        .join(
            new JoinConfig(ImmutableList.of("sample"), JoinType.INNER,
                ImmutableList.of("samples"), GranularityConfig.of("sample")))
        .build();
    DataCollectionConfig samplesDc = DataCollectionConfig.builder("samples")
        .scan(ScanConfig.single("samples.csv"))
        .properties(TableProperties.builder(TableFormat.CSV).build())
        .build();
    WorkflowConfig wf = new WorkflowConfig("wf", null,
        DataLocationConfig.of(DataLocationConfig.Structure.FLAT, null,
            ImmutableList.of("/data")),
        ImmutableList.of(cellsDc, samplesDc));

    TableData joined = new JoinResolver(wf).resolve(cellsDc, cells(),
        dataCollection -> samples());
    assertEquals(3, joined.getRowCount());
    assertEquals(Arrays.<Object>asList(30.0, 5.0, 7.0), values(joined, "genes"));
    assertEquals(Arrays.<Object>asList(30L, 40L, 50L), values(joined, "age"));

    // the source is the coarser side here, so only the target is reduced
    TableData fromSamples = new JoinResolver(wf).resolve(cellsDc, samples(),
        dataCollection -> cells());
    assertEquals(3, fromSamples.getRowCount());
    assertEquals(Arrays.<Object>asList(30L, 40L, 50L),
        values(fromSamples, "age"));
    assertEquals(Arrays.<Object>asList("a", "c", null),
        values(fromSamples, "cluster"));

    // without a granularity the finer side fans out
    DataCollectionConfig plain = DataCollectionConfig.builder("cells")
        .scan(ScanConfig.single("cells.csv"))
        .properties(TableProperties.builder(TableFormat.CSV).build())
        .join(
            new JoinConfig(ImmutableList.of("sample"), JoinType.INNER,
                ImmutableList.of("samples")))
        .build();
    assertEquals(6, new JoinResolver(wf).resolve(plain, cells(),
        dataCollection -> samples()).getRowCount());
  }
}
