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

import org.apache.calcite.adapter.ingest.JoinResolutionException;
import org.apache.calcite.adapter.ingest.config.DataCollectionConfig;
import org.apache.calcite.adapter.ingest.config.DataLocationConfig;
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

import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link JoinGraph} and {@link JoinResolver}.
 */
@Tag("unit")
public class JoinGraphTest {

  private static DataCollectionConfig dc(String tag, @Nullable JoinConfig join) {
    return DataCollectionConfig.builder(tag)
        .scan(ScanConfig.single(tag + ".csv"))
        .properties(TableProperties.builder(TableFormat.CSV).build())
        .join(join)
        .build();
  }

  private static JoinConfig joinWith(String... targets) {
    return new JoinConfig(ImmutableList.of("sample"), JoinType.INNER,
        Arrays.asList(targets));
  }

  private static WorkflowConfig workflow(DataCollectionConfig... dcs) {
    return new WorkflowConfig("wf", null,
        DataLocationConfig.of(DataLocationConfig.Structure.FLAT, null,
            ImmutableList.of("/data")),
        Arrays.asList(dcs));
  }

  private static List<String> tags(JoinGraph graph) {
    List<String> tags = new ArrayList<String>();
    for (DataCollectionConfig dc : graph.executionOrder()) {
      tags.add(dc.getTag());
    }
    return tags;
  }

  @Test void testTargetsComeBeforeSources() throws Exception {
    JoinGraph graph = JoinGraph.of(
        workflow(dc("counts", joinWith("demographics", "batches")),
            dc("demographics", joinWith("batches")),
            dc("batches", null),
            dc("notes", null)));
    assertEquals(Arrays.asList("batches", "demographics", "counts", "notes"),
        tags(graph));
    assertEquals(Arrays.asList("counts", "demographics"),
        graph.sourcesOf("batches"));
    assertTrue(graph.sourcesOf("notes").isEmpty());
  }

  @Test void testCycleAndUnknownTarget() {
    JoinResolutionException cycle =
        assertThrows(JoinResolutionException.class,
            () -> JoinGraph.of(
                workflow(dc("a", joinWith("b")), dc("b", joinWith("a")))));
    assertTrue(cycle.getMessage().contains("cycle"), cycle.getMessage());
    assertThrows(JoinResolutionException.class,
        () -> JoinGraph.of(workflow(dc("a", joinWith("missing")))));
    assertThrows(JoinResolutionException.class,
        () -> JoinGraph.of(workflow(dc("a", joinWith("a")))));
  }

  @Test void testResolverJoinsTargetsInOrder() throws Exception {
    DataCollectionConfig counts = dc("counts", joinWith("demographics"));
    WorkflowConfig wf = workflow(counts, dc("demographics", null));
    final TableData target = TableData.of(
        ImmutableList.of(
            new Column("sample", ColumnType.STRING,
                new ArrayList<Object>(Arrays.asList("S1", "S2"))),
            new Column("age", ColumnType.LONG,
                new ArrayList<Object>(Arrays.asList(30L, 40L)))));
    TableData source = TableData.of(
        ImmutableList.of(
            new Column("sample", ColumnType.STRING,
                new ArrayList<Object>(Arrays.asList("S2", "S3")))));
    TableData joined = new JoinResolver(wf).resolve(counts, source,
        dataCollection -> "demographics".equals(dataCollection) ? target : null);
    assertEquals(1, joined.getRowCount());
    assertEquals(40L, joined.getColumn("age").get(0));
    assertEquals("joined_counts", JoinResolver.joinedTableName("counts"));

    assertThrows(JoinResolutionException.class,
        () -> new JoinResolver(wf).resolve(counts, source, dataCollection -> null));
  }
}
