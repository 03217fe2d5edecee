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
import org.apache.calcite.adapter.ingest.SchemaMismatchException;
import org.apache.calcite.adapter.ingest.config.DataCollectionConfig;
import org.apache.calcite.adapter.ingest.config.GranularityConfig;
import org.apache.calcite.adapter.ingest.config.JoinConfig;
import org.apache.calcite.adapter.ingest.config.WorkflowConfig;
import org.apache.calcite.adapter.ingest.format.TableData;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes the join declared by a data collection against the aggregated
 * tables of its targets.
 */
public class JoinResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(JoinResolver.class);

  /** Prefix of the table holding a collection's joined result. */
  public static final String JOINED_PREFIX = "joined_";

  /** Supplies the aggregated table of a join target. */
  public interface TargetLookup {
    /** Returns the latest aggregate of a collection, or null if it has none. */
    @Nullable TableData lookup(String dataCollection)
        throws SchemaMismatchException;
  }

  private final WorkflowConfig workflow;

  public JoinResolver(WorkflowConfig workflow) {
    this.workflow = workflow;
  }

  /** Returns the name of the table storing the joined result of a collection. */
  public static String joinedTableName(String dataCollection) {
    return JOINED_PREFIX + dataCollection;
  }

  /**
   * Joins a source collection's table with each of its targets in declaration
   * order. With a granularity, the side with more rows per key is aggregated
   * first; sides of equal granularity are joined as they are.
   *
   * @throws JoinResolutionException if a target is not part of the workflow
   *     or has no aggregated table
   * @throws SchemaMismatchException if a join key is missing on either side
   */
  public TableData resolve(DataCollectionConfig source, TableData sourceTable,
      TargetLookup targets)
      throws JoinResolutionException, SchemaMismatchException {
    JoinConfig join = source.getJoin();
    if (join == null) {
      return sourceTable;
    }
    TableData result = sourceTable;
    for (String target : join.getWithDc()) {
      if (workflow.getDataCollection(target) == null) {
        throw new JoinResolutionException("Join target '" + target + "' of '"
            + source.getTag() + "' does not exist in workflow '"
            + workflow.getName() + "'");
      }
      TableData targetTable = targets.lookup(target);
      if (targetTable == null) {
        throw new JoinResolutionException("Join target '" + target + "' of '"
            + source.getTag() + "' has no materialized table");
      }
      GranularityConfig granularity = join.getGranularity();
      if (granularity != null) {
        double left =
            GranularityAggregator.averageRowsPerKey(result, join.getOnColumns());
        double right = GranularityAggregator.averageRowsPerKey(targetTable,
            join.getOnColumns());
        if (left > right) {
          result = GranularityAggregator.aggregate(result, join.getOnColumns(),
              granularity);
        } else if (right > left) {
          targetTable = GranularityAggregator.aggregate(targetTable,
              join.getOnColumns(), granularity);
        }
      }
      int before = result.getRowCount();
      result = JoinExecutor.join(result, targetTable, join.getOnColumns(),
          join.getHow());
      LOGGER.info("Joined {} ({} rows) {} {} ({} rows) on {}: {} rows",
          source.getTag(), before, join.getHow(), target,
          targetTable.getRowCount(), join.getOnColumns(), result.getRowCount());
    }
    return result;
  }
}
