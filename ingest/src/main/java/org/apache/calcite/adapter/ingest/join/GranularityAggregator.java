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
import org.apache.calcite.adapter.ingest.config.GranularityConfig;
import org.apache.calcite.adapter.ingest.format.Column;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reduces a table to one row per join key so that it can be joined with a
 * coarser table without fanning out.
 *
 * <p>Groups keep the order in which their key first appears. A key containing
 * nulls forms a group of its own. Key columns are kept as they are; every other
 * column is reduced with the function {@link GranularityConfig#functionFor}
 * picks for it. Nulls are ignored by every function except {@code first} and
 * {@code last}, which take the value at that position.
 */
public final class GranularityAggregator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(GranularityAggregator.class);

  private GranularityAggregator() {
  }

  /** Returns the average number of rows sharing a key; 0 for an empty table. */
  public static double averageRowsPerKey(TableData table, List<String> keys)
      throws SchemaMismatchException {
    if (table.getRowCount() == 0) {
      return 0D;
    }
    return (double) table.getRowCount() / groups(table, keys).size();
  }

  /**
   * Aggregates a table to one row per distinct key.
   *
   * @throws SchemaMismatchException if a key is missing, or a numeric-only
   *     function is assigned to a non-numeric column
   */
  public static TableData aggregate(TableData table, List<String> keys,
      GranularityConfig granularity) throws SchemaMismatchException {
    Map<List<@Nullable Object>, List<Integer>> groups = groups(table, keys);
    List<Column> columns = new ArrayList<Column>();
    for (Column c : table.getColumns()) {
      List<@Nullable Object> values =
          new ArrayList<@Nullable Object>(groups.size());
      if (keys.contains(c.getName())) {
        for (List<Integer> rows : groups.values()) {
          values.add(c.get(rows.get(0)));
        }
        columns.add(new Column(c.getName(), c.getType(), values));
        continue;
      }
      boolean numeric = isNumeric(c.getType());
      AggregationFunction f = granularity.functionFor(c.getName(), numeric);
      if (f.isNumericOnly() && !numeric) {
        throw new SchemaMismatchException("cannot apply '"
            + f.name().toLowerCase(Locale.ROOT) + "' to column '"
            + c.getName() + "' of type " + c.getType());
      }
      for (List<Integer> rows : groups.values()) {
        values.add(reduce(f, c, rows));
      }
      columns.add(new Column(c.getName(), resultType(f, c.getType()), values));
    }
    TableData result = TableData.of(columns, groups.size());
    LOGGER.info("Aggregated to {} on {}: {} rows -> {} rows",
        granularity.getAggregateTo(), keys, table.getRowCount(),
        result.getRowCount());
    return result;
  }

  private static Map<List<@Nullable Object>, List<Integer>> groups(
      TableData table, List<String> keys) throws SchemaMismatchException {
    List<Column> keyColumns = new ArrayList<Column>(keys.size());
    for (String key : keys) {
      Column c = table.getColumn(key);
      if (c == null) {
        throw new SchemaMismatchException("join key '" + key
            + "' is absent from " + table.getColumnNames());
      }
      keyColumns.add(c);
    }
    Map<List<@Nullable Object>, List<Integer>> groups =
        new LinkedHashMap<List<@Nullable Object>, List<Integer>>();
    for (int r = 0; r < table.getRowCount(); r++) {
      @Nullable Object[] key = new Object[keyColumns.size()];
      for (int k = 0; k < key.length; k++) {
        key[k] = keyColumns.get(k).get(r);
      }
      List<@Nullable Object> k = Arrays.asList(key);
      List<Integer> rows = groups.get(k);
      if (rows == null) {
        rows = new ArrayList<Integer>();
        groups.put(k, rows);
      }
      rows.add(r);
    }
    return groups;
  }

  private static boolean isNumeric(ColumnType type) {
    return type == ColumnType.LONG || type == ColumnType.DOUBLE;
  }

  private static ColumnType resultType(AggregationFunction f, ColumnType type) {
    switch (f) {
    case MEAN:
    case MEDIAN:
      return ColumnType.DOUBLE;
    case COUNT:
      return ColumnType.LONG;
    default:
      return type;
    }
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static @Nullable Object reduce(AggregationFunction f, Column column,
      List<Integer> rows) {
    switch (f) {
    case FIRST:
      return column.get(rows.get(0));
    case LAST:
      return column.get(rows.get(rows.size() - 1));
    default:
      break;
    }
    List<Object> present = new ArrayList<Object>(rows.size());
    for (int r : rows) {
      Object v = column.get(r);
      if (v != null) {
        present.add(v);
      }
    }
    switch (f) {
    case COUNT:
      return (long) present.size();
    case SUM:
      if (column.getType() == ColumnType.LONG) {
        long sum = 0L;
        for (Object v : present) {
          sum += ((Number) v).longValue();
        }
        return sum;
      }
      double total = 0D;
      for (Object v : present) {
        total += ((Number) v).doubleValue();
      }
      return total;
    case MEAN:
      if (present.isEmpty()) {
        return null;
      }
      double s = 0D;
      for (Object v : present) {
        s += ((Number) v).doubleValue();
      }
      return s / present.size();
    case MEDIAN:
      if (present.isEmpty()) {
        return null;
      }
      List<Double> sorted = new ArrayList<Double>(present.size());
      for (Object v : present) {
        sorted.add(((Number) v).doubleValue());
      }
      Collections.sort(sorted);
      int mid = sorted.size() / 2;
      return sorted.size() % 2 == 1 ? sorted.get(mid)
          : (sorted.get(mid - 1) + sorted.get(mid)) / 2D;
    case MIN:
    case MAX:
      Comparable best = null;
      for (Object v : present) {
        Comparable c = (Comparable) v;
        if (best == null
            || (f == AggregationFunction.MIN ? c.compareTo(best) < 0
                : c.compareTo(best) > 0)) {
          best = c;
        }
      }
      return best;
    default:
      throw new AssertionError(f);
    }
  }
}
