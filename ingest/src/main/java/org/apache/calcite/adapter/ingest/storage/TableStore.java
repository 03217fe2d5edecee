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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.List;

/**
 * Versioned table storage.
 *
 * <p>Every {@link #write} publishes a new immutable version atomically:
 * readers observe either the previous latest version or the new one, never a
 * partial write. Version numbers start at 0 and increase by one per write.
 * Callers serialize writers of one key, see {@link #getLocation()}.
 */
public interface TableStore extends AutoCloseable {

  /** Returns the latest version of a table, or null if it was never written. */
  @Nullable TableVersion latestVersion(TableKey key) throws IOException;

  /** Publishes {@code data} as the next version of a table. */
  TableVersion write(TableKey key, TableData data) throws IOException;

  /**
   * Reads a version of a table.
   *
   * @param version version number, or null for the latest version
   * @return the table, or null if the table or version does not exist
   */
  @Nullable StoredTable read(TableKey key, @Nullable Long version)
      throws IOException;

  /** Returns every version of a table, oldest first. */
  List<TableVersion> history(TableKey key) throws IOException;

  /** Returns the keys of all tables with at least one version. */
  List<TableKey> listTables() throws IOException;

  /**
   * Identifies where the store keeps its tables; stores with the same
   * location share writer locks.
   */
  default String getLocation() {
    return getClass().getName() + "@"
        + Integer.toHexString(System.identityHashCode(this));
  }

  @Override void close() throws IOException;
}
