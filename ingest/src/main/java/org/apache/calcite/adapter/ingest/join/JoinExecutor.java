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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash equi-join of two tables.
 *
 * <p>Semantics follow SQL: rows whose key contains a null never match, and a
 * key that occurs several times on either side fans out into one output row
 * per matching pair. Key columns whose types differ between the sides are
 * compared as strings. Non-key columns of the right side that also exist on
 * the left are dropped, so the left value wins.
 *
 * <p>Output columns are the left columns followed by the remaining right
 * columns. Output rows are the left rows in order, each followed by its
 * matches in right order, then (for right and outer joins) the unmatched right
 * rows; for those, key columns take the right-hand values.
 */
public final class JoinExecutor {
  private JoinExecutor() {
  }

  public static TableData join(TableData left, TableData right,
      List<String> keys, JoinType how) throws SchemaMismatchException {
    for (String key : keys) {
      if (!left.hasColumn(key)) {
        throw new SchemaMismatchException("join key '" + key
            + "' is absent from the left side " + left.getColumnNames());
      }
      if (!right.hasColumn(key)) {
        throw new SchemaMismatchException("join key '" + key
            + "' is absent from the right side " + right.getColumnNames());
      }
    }
    TableData l = left;
    TableData r = right;
    for (String key : keys) {
      ColumnType lt = columnOf(l, key).getType();
      ColumnType rt = columnOf(r, key).getType();
      if (lt != rt) {
        l = l.withColumn(columnOf(l, key).cast(ColumnType.STRING));
        r = r.withColumn(columnOf(r, key).cast(ColumnType.STRING));
      }
    }

    List<Column> rightColumns = new ArrayList<Column>();
    for (Column c : r.getColumns()) {
      if (!l.hasColumn(c.getName())) {
        rightColumns.add(c);
      }
    }

    Map<List<Object>, List<Integer>> index =
        new HashMap<List<Object>, List<Integer>>();
    for (int i = 0; i < r.getRowCount(); i++) {
      List<Object> k = key(r, keys, i);
      if (k == null) {
        continue;
      }
      List<Integer> rows = index.get(k);
      if (rows == null) {
        rows = new ArrayList<Integer>(1);
        index.put(k, rows);
      }
      rows.add(i);
    }

    Map<String, ColumnType> schema = new LinkedHashMap<String, ColumnType>();
    for (Column c : l.getColumns()) {
      schema.put(c.getName(), c.getType());
    }
    for (Column c : rightColumns) {
      schema.put(c.getName(), c.getType());
    }
    TableData.Builder out = new TableData.Builder(schema);
    int leftWidth = l.getColumns().size();
    boolean[] rightMatched = new boolean[r.getRowCount()];

    for (int i = 0; i < l.getRowCount(); i++) {
      List<Object> k = key(l, keys, i);
      List<Integer> matches = k == null ? null : index.get(k);
      if (matches == null || matches.isEmpty()) {
        if (how.keepsLeft()) {
          out.add(Arrays.copyOf(l.row(i), schema.size()));
        }
        continue;
      }
      for (int j : matches) {
        rightMatched[j] = true;
        Object[] row = Arrays.copyOf(l.row(i), schema.size());
        for (int c = 0; c < rightColumns.size(); c++) {
          row[leftWidth + c] = rightColumns.get(c).get(j);
        }
        out.add(row);
      }
    }

    if (how.keepsRight()) {
      for (int j = 0; j < r.getRowCount(); j++) {
        if (rightMatched[j]) {
          continue;
        }
        Object[] row = new Object[schema.size()];
        for (String key : keys) {
          row[l.getColumnNames().indexOf(key)] = columnOf(r, key).get(j);
        }
        for (int c = 0; c < rightColumns.size(); c++) {
          row[leftWidth + c] = rightColumns.get(c).get(j);
        }
        out.add(row);
      }
    }
    return out.build();
  }

  private static @Nullable List<Object> key(TableData table, List<String> keys,
      int row) {
    Object[] values = new Object[keys.size()];
    for (int k = 0; k < keys.size(); k++) {
      Object v = columnOf(table, keys.get(k)).get(row);
      if (v == null) {
        return null;
      }
      values[k] = v;
    }
    return Arrays.asList(values);
  }

  private static Column columnOf(TableData table, String name) {
    Column column = table.getColumn(name);
    if (column == null) {
      throw new IllegalStateException("no column " + name);
    }
    return column;
  }
}
