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

import org.apache.calcite.adapter.ingest.format.ColumnType;

import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.Map;

/**
 * Metadata of one immutable version of a materialized table.
 */
public class TableVersion {
  private final TableKey key;
  private final long version;
  private final long rowCount;
  private final Instant createdAt;
  private final Map<String, ColumnType> schema;

  public TableVersion(TableKey key, long version, long rowCount,
      Instant createdAt, Map<String, ColumnType> schema) {
    this.key = key;
    this.version = version;
    this.rowCount = rowCount;
    this.createdAt = createdAt;
    this.schema = ImmutableMap.copyOf(schema);
  }

  public TableKey getKey() {
    return key;
  }

  /** Returns the version number; the first version is 0. */
  public long getVersion() {
    return version;
  }

  public long getRowCount() {
    return rowCount;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Map<String, ColumnType> getSchema() {
    return schema;
  }

  @Override public String toString() {
    return key + "@v" + version + " (" + rowCount + " rows)";
  }
}
