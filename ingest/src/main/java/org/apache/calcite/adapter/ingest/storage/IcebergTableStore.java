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
package org.apache.calcite.adapter.ingest.storage;

import org.apache.calcite.adapter.ingest.format.Column;
import org.apache.calcite.adapter.ingest.format.ColumnType;
import org.apache.calcite.adapter.ingest.format.TableData;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.iceberg.DataFile;
import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Schema;
import org.apache.iceberg.Snapshot;
import org.apache.iceberg.Table;
import org.apache.iceberg.TableProperties;
import org.apache.iceberg.Transaction;
import org.apache.iceberg.data.GenericRecord;
import org.apache.iceberg.data.IcebergGenerics;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.data.parquet.GenericParquetWriter;
import org.apache.iceberg.hadoop.HadoopTables;
import org.apache.iceberg.io.CloseableIterable;
import org.apache.iceberg.io.DataWriter;
import org.apache.iceberg.io.OutputFile;
import org.apache.iceberg.parquet.Parquet;
import org.apache.iceberg.types.Type;
import org.apache.iceberg.types.Types;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Table store backed by Apache Iceberg tables on a Hadoop-compatible file
 * system, one table per key at {@code <warehouse>/<workflow>/<table>}.
 *
 * <p>Each version is one snapshot produced by a replace-table transaction, so
 * the schema may change from one version to the next while older snapshots
 * (and their schemas) stay readable. The version number is recorded in the
 * snapshot summary under {@value #VERSION_PROPERTY}.
 */
public class IcebergTableStore implements TableStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(IcebergTableStore.class);

  /** Snapshot summary property holding the version number. */
  public static final String VERSION_PROPERTY = "ingest.version";

  private final String warehouse;
  private final Configuration hadoopConf;
  private final HadoopTables tables;

  public IcebergTableStore(String warehouse) {
    this(warehouse, new Configuration());
  }

  public IcebergTableStore(String warehouse, Configuration hadoopConf) {
    this.warehouse = warehouse.endsWith("/")
        ? warehouse.substring(0, warehouse.length() - 1)
        : warehouse;
    this.hadoopConf = hadoopConf;
    this.tables = new HadoopTables(hadoopConf);
  }

  public String getWarehouse() {
    return warehouse;
  }

  @Override public String getLocation() {
    return new org.apache.hadoop.fs.Path(warehouse).toUri().normalize().toString();
  }

  String location(TableKey key) {
    return warehouse + "/" + key.getWorkflow() + "/" + key.getTable();
  }

  private @Nullable Table load(TableKey key) {
    String location = location(key);
    return tables.exists(location) ? tables.load(location) : null;
  }

  @Override public @Nullable TableVersion latestVersion(TableKey key) {
    Table table = load(key);
    if (table == null || table.currentSnapshot() == null) {
      return null;
    }
    return toVersion(key, table, table.currentSnapshot());
  }

  @Override public TableVersion write(TableKey key, TableData data)
      throws IOException {
    TableVersion latest = latestVersion(key);
    long next = latest == null ? 0 : latest.getVersion() + 1;

    Map<String, String> props = new HashMap<String, String>();
    props.put(TableProperties.FORMAT_VERSION, "2");
    // a conflicting commit fails instead of re-applying with a stale version
    props.put(TableProperties.COMMIT_NUM_RETRIES, "0");
    Transaction tx = tables.newReplaceTableTransaction(location(key),
        toSchema(data), PartitionSpec.unpartitioned(), props, true);
    Table table = tx.table();
    DataFile file = writeDataFile(table, data);
    tx.newAppend()
        .appendFile(file)
        .set(VERSION_PROPERTY, String.valueOf(next))
        .commit();
    tx.commitTransaction();

    TableVersion version = latestVersion(key);
    if (version == null || version.getVersion() != next) {
      throw new IOException("Commit of " + key + " version " + next
          + " is not visible");
    }
    LOGGER.info("Published {} at {}", version, location(key));
    return version;
  }

  private static DataFile writeDataFile(Table table, TableData data)
      throws IOException {
    Schema schema = table.schema();
    OutputFile out = table.io().newOutputFile(
        table.locationProvider().newDataLocation(UUID.randomUUID() + ".parquet"));
    DataWriter<Record> writer = Parquet.writeData(out)
        .schema(schema)
        .createWriterFunc(GenericParquetWriter::buildWriter)
        .overwrite()
        .withSpec(PartitionSpec.unpartitioned())
        .build();
    try {
      List<Column> columns = data.getColumns();
      for (int r = 0; r < data.getRowCount(); r++) {
        GenericRecord record = GenericRecord.create(schema);
        for (Column c : columns) {
          record.setField(c.getName(), c.get(r));
        }
        writer.write(record);
      }
    } finally {
      writer.close();
    }
    return writer.toDataFile();
  }

  @Override public @Nullable StoredTable read(TableKey key,
      @Nullable Long version) throws IOException {
    Table table = load(key);
    if (table == null) {
      return null;
    }
    Snapshot snapshot = version == null
        ? table.currentSnapshot()
        : findSnapshot(table, version);
    if (snapshot == null) {
      return null;
    }
    TableVersion tv = toVersion(key, table, snapshot);
    Schema schema = schemaOf(table, snapshot);
    Map<String, ColumnType> types = toColumnTypes(schema);
    TableData.Builder builder = new TableData.Builder(types);
    try (CloseableIterable<Record> records =
             IcebergGenerics.read(table).useSnapshot(snapshot.snapshotId()).build()) {
      for (Record record : records) {
        Object[] row = new Object[types.size()];
        int i = 0;
        for (String name : types.keySet()) {
          row[i++] = fromIceberg(record.getField(name));
        }
        builder.add(row);
      }
    }
    return new StoredTable(tv, builder.build());
  }

  @Override public List<TableVersion> history(TableKey key) {
    List<TableVersion> versions = new ArrayList<TableVersion>();
    Table table = load(key);
    if (table == null) {
      return versions;
    }
    for (Snapshot snapshot : table.snapshots()) {
      if (snapshot.summary().containsKey(VERSION_PROPERTY)) {
        versions.add(toVersion(key, table, snapshot));
      }
    }
    versions.sort((a, b) -> Long.compare(a.getVersion(), b.getVersion()));
    return versions;
  }

  @Override public List<TableKey> listTables() throws IOException {
    List<TableKey> keys = new ArrayList<TableKey>();
    org.apache.hadoop.fs.Path root = new org.apache.hadoop.fs.Path(warehouse);
    FileSystem fs = root.getFileSystem(hadoopConf);
    if (!fs.exists(root)) {
      return keys;
    }
    for (FileStatus workflowDir : fs.listStatus(root)) {
      if (!workflowDir.isDirectory()) {
        continue;
      }
      for (FileStatus tableDir : fs.listStatus(workflowDir.getPath())) {
        TableKey key = new TableKey(workflowDir.getPath().getName(),
            tableDir.getPath().getName());
        if (tableDir.isDirectory() && tables.exists(location(key))) {
          keys.add(key);
        }
      }
    }
    keys.sort(null);
    return keys;
  }

  @Override public void close() {
  }

  private static @Nullable Snapshot findSnapshot(Table table, long version) {
    for (Snapshot snapshot : table.snapshots()) {
      String v = snapshot.summary().get(VERSION_PROPERTY);
      if (v != null && Long.parseLong(v) == version) {
        return snapshot;
      }
    }
    return null;
  }

  private static Schema schemaOf(Table table, Snapshot snapshot) {
    Integer schemaId = snapshot.schemaId();
    Schema schema = schemaId == null ? null : table.schemas().get(schemaId);
    return schema == null ? table.schema() : schema;
  }

  private static TableVersion toVersion(TableKey key, Table table,
      Snapshot snapshot) {
    String v = snapshot.summary().get(VERSION_PROPERTY);
    String rows = snapshot.summary().get("total-records");
    return new TableVersion(key, v == null ? -1 : Long.parseLong(v),
        rows == null ? 0 : Long.parseLong(rows),
        Instant.ofEpochMilli(snapshot.timestampMillis()),
        toColumnTypes(schemaOf(table, snapshot)));
  }

  static Schema toSchema(TableData data) {
    List<Types.NestedField> fields = new ArrayList<Types.NestedField>();
    int id = 1;
    for (Column c : data.getColumns()) {
      fields.add(Types.NestedField.optional(id++, c.getName(), toIceberg(c.getType())));
    }
    return new Schema(fields);
  }

  private static Type toIceberg(ColumnType type) {
    switch (type) {
    case BOOLEAN:
      return Types.BooleanType.get();
    case LONG:
      return Types.LongType.get();
    case DOUBLE:
      return Types.DoubleType.get();
    case TIMESTAMP:
      return Types.TimestampType.withoutZone();
    case STRING:
      return Types.StringType.get();
    default:
      throw new AssertionError(type);
    }
  }

  private static Map<String, ColumnType> toColumnTypes(Schema schema) {
    Map<String, ColumnType> types = new LinkedHashMap<String, ColumnType>();
    for (Types.NestedField field : schema.columns()) {
      types.put(field.name(), fromIceberg(field.type()));
    }
    return types;
  }

  private static ColumnType fromIceberg(Type type) {
    switch (type.typeId()) {
    case BOOLEAN:
      return ColumnType.BOOLEAN;
    case INTEGER:
    case LONG:
      return ColumnType.LONG;
    case FLOAT:
    case DOUBLE:
    case DECIMAL:
      return ColumnType.DOUBLE;
    case TIMESTAMP:
      return ColumnType.TIMESTAMP;
    default:
      return ColumnType.STRING;
    }
  }

  private static @Nullable Object fromIceberg(@Nullable Object value) {
    if (value instanceof Integer) {
      return ((Integer) value).longValue();
    }
    if (value instanceof CharSequence) {
      return value.toString();
    }
    return value;
  }
}
