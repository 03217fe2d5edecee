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
package org.apache.calcite.adapter.ingest;

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;
import org.apache.calcite.adapter.ingest.storage.StoredTable;
import org.apache.calcite.adapter.ingest.storage.TableKey;
import org.apache.calcite.adapter.ingest.storage.TableStore;
import org.apache.calcite.adapter.ingest.storage.TableVersion;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.Statistic;
import org.apache.calcite.schema.Statistics;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Latest version of a materialized table, exposed to SQL.
 *
 * <p>The row type is fixed when the table is first planned; each scan reads
 * the version that is latest at that moment.
 */
public class MaterializedTable extends AbstractTable implements ScannableTable {
  private final TableStore store;
  private final TableKey key;
  private @Nullable RelDataType rowType;

  public MaterializedTable(TableStore store, TableKey key) {
    this.store = store;
    this.key = key;
  }

  @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    if (rowType == null) {
      TableVersion latest = latest();
      final List<String> names = new ArrayList<>();
      final List<RelDataType> types = new ArrayList<>();
      if (latest != null) {
        for (Map.Entry<String, ColumnType> e : latest.getSchema().entrySet()) {
          names.add(e.getKey());
          types.add(
              typeFactory.createTypeWithNullability(
                  typeFactory.createSqlType(toSqlType(e.getValue())), true));
        }
      }
      rowType = typeFactory.createStructType(types, names);
    }
    return rowType;
  }

  @Override public Statistic getStatistic() {
    TableVersion latest = latest();
    return latest == null
        ? Statistics.UNKNOWN
        : Statistics.of(latest.getRowCount(), ImmutableList.of());
  }

  @Override public Enumerable<@Nullable Object[]> scan(DataContext root) {
    StoredTable stored;
    try {
      stored = store.read(key, null);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + key, e);
    }
    if (stored == null) {
      return Linq4j.emptyEnumerable();
    }
    TableData data = stored.getData();
    List<String> names = rowType == null
        ? data.getColumnNames()
        : rowType.getFieldNames();
    List<@Nullable Object[]> rows = new ArrayList<>(data.getRowCount());
    for (int r = 0; r < data.getRowCount(); r++) {
      Object[] row = new Object[names.size()];
      for (int c = 0; c < names.size(); c++) {
        row[c] = data.hasColumn(names.get(c))
            ? toSqlValue(data.getColumn(names.get(c)).get(r))
            : null;
      }
      rows.add(row);
    }
    return Linq4j.asEnumerable(rows);
  }

  private @Nullable TableVersion latest() {
    try {
      return store.latestVersion(key);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read versions of " + key, e);
    }
  }

  static SqlTypeName toSqlType(ColumnType type) {
    switch (type) {
    case BOOLEAN:
      return SqlTypeName.BOOLEAN;
    case LONG:
      return SqlTypeName.BIGINT;
    case DOUBLE:
      return SqlTypeName.DOUBLE;
    case TIMESTAMP:
      return SqlTypeName.TIMESTAMP;
    case STRING:
      return SqlTypeName.VARCHAR;
    default:
      throw new AssertionError(type);
    }
  }

  /** Converts a value to the representation Calcite's enumerable runtime uses. */
  private static @Nullable Object toSqlValue(@Nullable Object value) {
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC).toEpochMilli();
    }
    return value;
  }
}
