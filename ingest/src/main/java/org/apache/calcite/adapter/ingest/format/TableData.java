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
package org.apache.calcite.adapter.ingest.format;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable columnar table: the per-file fragment produced by a parser, and
 * also the result of joins and aggregation.
 */
public final class TableData {
  private static final TableData EMPTY =
      new TableData(ImmutableList.<Column>of(), 0);

  private final List<Column> columns;
  private final Map<String, Integer> index;
  private final int rowCount;

  private TableData(List<Column> columns, int rowCount) {
    this.columns = ImmutableList.copyOf(columns);
    this.rowCount = rowCount;
    this.index = new LinkedHashMap<String, Integer>();
    for (int i = 0; i < columns.size(); i++) {
      Column c = columns.get(i);
      if (index.put(c.getName(), i) != null) {
        throw new IllegalArgumentException("duplicate column " + c.getName());
      }
      if (c.size() != rowCount) {
        throw new IllegalArgumentException("column " + c.getName() + " has "
            + c.size() + " values, expected " + rowCount);
      }
    }
  }

  public static TableData empty() {
    return EMPTY;
  }

  /**
   * Creates a table from columns of equal length.
   *
   * @throws IllegalArgumentException if names repeat or lengths differ
   */
  public static TableData of(List<Column> columns) {
    return new TableData(columns, columns.isEmpty() ? 0 : columns.get(0).size());
  }

  /** Creates a table with columns but possibly no rows. */
  public static TableData of(List<Column> columns, int rowCount) {
    return new TableData(columns, rowCount);
  }

  public int getRowCount() {
    return rowCount;
  }

  public List<Column> getColumns() {
    return columns;
  }

  public List<String> getColumnNames() {
    return ImmutableList.copyOf(index.keySet());
  }

  public boolean hasColumn(String name) {
    return index.containsKey(name);
  }

  public @Nullable Column getColumn(String name) {
    Integer i = index.get(name);
    return i == null ? null : columns.get(i);
  }

  /** Returns column name to type, in column order. */
  public Map<String, ColumnType> getSchema() {
    Map<String, ColumnType> schema = new LinkedHashMap<String, ColumnType>();
    for (Column c : columns) {
      schema.put(c.getName(), c.getType());
    }
    return schema;
  }

  /** Returns one row as an array in column order. */
  public @Nullable Object[] row(int r) {
    Object[] row = new Object[columns.size()];
    for (int c = 0; c < columns.size(); c++) {
      row[c] = columns.get(c).get(r);
    }
    return row;
  }

  /** Returns every row as a list of arrays in column order. */
  public List<@Nullable Object[]> rows() {
    List<@Nullable Object[]> rows = new ArrayList<@Nullable Object[]>(rowCount);
    for (int r = 0; r < rowCount; r++) {
      rows.add(row(r));
    }
    return rows;
  }

  /**
   * Returns this table with a column appended, or replaced if a column of the
   * same name exists.
   */
  public TableData withColumn(Column column) {
    List<Column> list = new ArrayList<Column>(columns);
    Integer i = index.get(column.getName());
    if (i == null) {
      list.add(column);
    } else {
      list.set(i, column);
    }
    return new TableData(list, rowCount);
  }

  /** Returns the named columns that exist, in this table's column order. */
  public TableData select(Collection<String> names) {
    Set<String> wanted = new HashSet<String>(names);
    List<Column> list = new ArrayList<Column>();
    for (Column c : columns) {
      if (wanted.contains(c.getName())) {
        list.add(c);
      }
    }
    return new TableData(list, rowCount);
  }

  @Override public String toString() {
    return "TableData" + getSchema() + " rows=" + rowCount;
  }

  /**
   * Builds a table row by row.
   */
  public static class Builder {
    private final List<String> names;
    private final List<ColumnType> types;
    private final List<List<@Nullable Object>> values;

    public Builder(Map<String, ColumnType> schema) {
      this.names = new ArrayList<String>(schema.keySet());
      this.types = new ArrayList<ColumnType>(schema.values());
      this.values = new ArrayList<List<@Nullable Object>>();
      for (int i = 0; i < names.size(); i++) {
        values.add(new ArrayList<@Nullable Object>());
      }
    }

    /** Adds a row whose values are in schema order. */
    public Builder add(@Nullable Object[] row) {
      if (row.length != names.size()) {
        throw new IllegalArgumentException("row has " + row.length
            + " values, expected " + names.size());
      }
      for (int i = 0; i < row.length; i++) {
        values.get(i).add(row[i]);
      }
      return this;
    }

    public int size() {
      return values.isEmpty() ? 0 : values.get(0).size();
    }

    public TableData build() {
      List<Column> columns = new ArrayList<Column>(names.size());
      for (int i = 0; i < names.size(); i++) {
        columns.add(new Column(names.get(i), types.get(i), values.get(i)));
      }
      return new TableData(columns, names.isEmpty() ? 0 : values.get(0).size());
    }
  }
}
