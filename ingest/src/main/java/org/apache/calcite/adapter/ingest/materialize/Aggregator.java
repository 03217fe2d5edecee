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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Concatenates the fragments of a data collection into one table.
 *
 * <p>The result has the union of the fragments' columns, in first-seen order.
 * A column missing from a fragment is null in that fragment's rows; a column
 * whose type differs between fragments is widened. Rows are never dropped.
 * Every row gets the same aggregation timestamp.
 */
public class Aggregator {
  private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

  private final String aggregationTimeColumn;
  private final DiagnosticsReport diagnostics;
  private final Clock clock;

  public Aggregator(String aggregationTimeColumn, DiagnosticsReport diagnostics,
      Clock clock) {
    this.aggregationTimeColumn = aggregationTimeColumn;
    this.diagnostics = diagnostics;
    this.clock = clock;
  }

  public TableData aggregate(String workflow, String dataCollection,
      List<Fragment> fragments) {
    List<Fragment> sorted = new ArrayList<>(fragments);
    sorted.sort(null);

    Map<String, ColumnType> schema = new LinkedHashMap<>();
    Map<String, Integer> presence = new LinkedHashMap<>();
    int rowCount = 0;
    for (Fragment fragment : sorted) {
      rowCount += fragment.getData().getRowCount();
      for (Column column : fragment.getData().getColumns()) {
        if (column.getName().equals(aggregationTimeColumn)) {
          continue;
        }
        ColumnType previous = schema.get(column.getName());
        schema.put(column.getName(),
            previous == null ? column.getType() : previous.widen(column.getType()));
        presence.merge(column.getName(), 1, Integer::sum);
      }
    }

    for (Map.Entry<String, Integer> e : presence.entrySet()) {
      if (e.getValue() < sorted.size()) {
        diagnostics.add(workflow, dataCollection, null, null,
            ErrorKind.PARTIAL_COLUMN, "Column " + e.getKey() + " present in "
                + e.getValue() + " of " + sorted.size()
                + " files; missing values are null");
      }
    }

    List<Column> columns = new ArrayList<>();
    for (Map.Entry<String, ColumnType> e : schema.entrySet()) {
      List<Object> values = new ArrayList<>(rowCount);
      for (Fragment fragment : sorted) {
        TableData data = fragment.getData();
        Column column = data.getColumn(e.getKey());
        if (column == null) {
          for (int r = 0; r < data.getRowCount(); r++) {
            values.add(null);
          }
        } else {
          values.addAll(column.cast(e.getValue()).getValues());
        }
      }
      columns.add(new Column(e.getKey(), e.getValue(), values));
    }
    LocalDateTime now =
        LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
    columns.add(
        Column.constant(aggregationTimeColumn, ColumnType.TIMESTAMP, now,
            rowCount));

    LOGGER.debug("Aggregated {} fragment(s) of {}/{} into {} rows, {} columns",
        sorted.size(), workflow, dataCollection, rowCount, columns.size());
    return TableData.of(columns, rowCount);
  }
}
