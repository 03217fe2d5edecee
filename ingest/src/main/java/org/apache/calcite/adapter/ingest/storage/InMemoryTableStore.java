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

import org.apache.calcite.adapter.ingest.format.TableData;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Table store holding every version in memory. For tests and embedded use.
 */
public class InMemoryTableStore implements TableStore {
  private final Map<TableKey, List<StoredTable>> tables =
      new TreeMap<TableKey, List<StoredTable>>();

  @Override public synchronized @Nullable TableVersion latestVersion(TableKey key) {
    List<StoredTable> versions = tables.get(key);
    return versions == null || versions.isEmpty()
        ? null
        : versions.get(versions.size() - 1).getVersion();
  }

  @Override public synchronized TableVersion write(TableKey key, TableData data) {
    List<StoredTable> versions = tables.get(key);
    if (versions == null) {
      versions = new ArrayList<StoredTable>();
      tables.put(key, versions);
    }
    TableVersion version = new TableVersion(key, versions.size(),
        data.getRowCount(), Instant.now(), data.getSchema());
    versions.add(new StoredTable(version, data));
    return version;
  }

  @Override public synchronized @Nullable StoredTable read(TableKey key,
      @Nullable Long version) {
    List<StoredTable> versions = tables.get(key);
    if (versions == null || versions.isEmpty()) {
      return null;
    }
    if (version == null) {
      return versions.get(versions.size() - 1);
    }
    if (version < 0 || version >= versions.size()) {
      return null;
    }
    return versions.get(version.intValue());
  }

  @Override public synchronized List<TableVersion> history(TableKey key) {
    List<TableVersion> result = new ArrayList<TableVersion>();
    List<StoredTable> versions = tables.get(key);
    if (versions != null) {
      for (StoredTable t : versions) {
        result.add(t.getVersion());
      }
    }
    return result;
  }

  @Override public synchronized List<TableKey> listTables() {
    return ImmutableList.copyOf(tables.keySet());
  }

  @Override public void close() {
  }
}
