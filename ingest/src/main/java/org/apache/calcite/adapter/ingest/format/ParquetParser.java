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

import org.apache.calcite.adapter.ingest.SchemaMismatchException;
import org.apache.calcite.adapter.ingest.config.TableProperties;

import org.apache.avro.LogicalType;
import org.apache.avro.LogicalTypes;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.io.InputFile;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses Parquet files through the Avro binding of parquet-mr.
 *
 * <p>Primitive Avro types map onto {@link ColumnType}; timestamps and dates
 * become {@link ColumnType#TIMESTAMP} in UTC; nested and binary values are
 * kept as their string form.
 */
public class ParquetParser implements FragmentParser {
  private final Configuration hadoopConf;

  public ParquetParser() {
    this(new Configuration());
  }

  public ParquetParser(Configuration hadoopConf) {
    this.hadoopConf = hadoopConf;
  }

  @Override public TableData parse(Path file, TableProperties properties)
      throws SchemaMismatchException {
    Map<String, ColumnType> schema = null;
    List<List<@Nullable Object>> values = new ArrayList<List<@Nullable Object>>();
    try {
      InputFile inputFile = HadoopInputFile.fromPath(
          new org.apache.hadoop.fs.Path(file.toUri()), hadoopConf);
      try (ParquetReader<GenericRecord> reader =
               AvroParquetReader.<GenericRecord>builder(inputFile).build()) {
        GenericRecord record;
        while ((record = reader.read()) != null) {
          if (schema == null) {
            schema = toColumnTypes(record.getSchema());
            for (int i = 0; i < schema.size(); i++) {
              values.add(new ArrayList<@Nullable Object>());
            }
          }
          int c = 0;
          for (Schema.Field field : record.getSchema().getFields()) {
            values.get(c++).add(convert(record.get(field.pos()), field.schema()));
          }
        }
      }
    } catch (IOException | RuntimeException e) {
      throw new SchemaMismatchException(file + ": cannot read Parquet: " + e, e);
    }
    if (schema == null) {
      return TableData.empty();
    }
    List<Column> columns = new ArrayList<Column>();
    int c = 0;
    for (Map.Entry<String, ColumnType> e : schema.entrySet()) {
      ColumnType override = properties.getSchemaOverrides().get(e.getKey());
      Column column = new Column(e.getKey(), e.getValue(), values.get(c++));
      if (override != null && override != e.getValue()) {
        try {
          column = column.cast(override);
        } catch (IllegalArgumentException ex) {
          throw new SchemaMismatchException(file + ": column '" + e.getKey()
              + "' cannot be read as " + override, ex);
        }
      }
      columns.add(column);
    }
    return TableData.of(columns);
  }

  private static Map<String, ColumnType> toColumnTypes(Schema schema) {
    Map<String, ColumnType> types = new LinkedHashMap<String, ColumnType>();
    for (Schema.Field field : schema.getFields()) {
      types.put(field.name(), toColumnType(unwrap(field.schema())));
    }
    return types;
  }

  private static Schema unwrap(Schema schema) {
    if (schema.getType() == Schema.Type.UNION) {
      for (Schema branch : schema.getTypes()) {
        if (branch.getType() != Schema.Type.NULL) {
          return branch;
        }
      }
    }
    return schema;
  }

  private static ColumnType toColumnType(Schema schema) {
    LogicalType logical = schema.getLogicalType();
    if (logical instanceof LogicalTypes.TimestampMillis
        || logical instanceof LogicalTypes.TimestampMicros
        || logical instanceof LogicalTypes.LocalTimestampMillis
        || logical instanceof LogicalTypes.LocalTimestampMicros
        || logical instanceof LogicalTypes.Date) {
      return ColumnType.TIMESTAMP;
    }
    switch (schema.getType()) {
    case BOOLEAN:
      return ColumnType.BOOLEAN;
    case INT:
    case LONG:
      return ColumnType.LONG;
    case FLOAT:
    case DOUBLE:
      return ColumnType.DOUBLE;
    default:
      return ColumnType.STRING;
    }
  }

  private static @Nullable Object convert(@Nullable Object value,
      Schema fieldSchema) {
    if (value == null) {
      return null;
    }
    Schema schema = unwrap(fieldSchema);
    LogicalType logical = schema.getLogicalType();
    if (logical instanceof LogicalTypes.Date) {
      return LocalDate.ofEpochDay(((Number) value).longValue()).atStartOfDay();
    }
    if (logical instanceof LogicalTypes.TimestampMillis
        || logical instanceof LogicalTypes.LocalTimestampMillis) {
      return LocalDateTime.ofInstant(
          Instant.ofEpochMilli(((Number) value).longValue()), ZoneOffset.UTC);
    }
    if (logical instanceof LogicalTypes.TimestampMicros
        || logical instanceof LogicalTypes.LocalTimestampMicros) {
      long micros = ((Number) value).longValue();
      return LocalDateTime.ofEpochSecond(Math.floorDiv(micros, 1_000_000L),
          (int) Math.floorMod(micros, 1_000_000L) * 1000, ZoneOffset.UTC);
    }
    switch (schema.getType()) {
    case BOOLEAN:
      return value;
    case INT:
    case LONG:
      return ((Number) value).longValue();
    case FLOAT:
    case DOUBLE:
      return ((Number) value).doubleValue();
    default:
      return value.toString();
    }
  }
}
