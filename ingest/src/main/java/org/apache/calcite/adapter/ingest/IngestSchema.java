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

import org.apache.calcite.adapter.ingest.storage.TableKey;
import org.apache.calcite.adapter.ingest.storage.TableStore;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema over the materialized tables of a warehouse.
 *
 * <p>Without a workflow, every workflow is a sub-schema; with one, that
 * workflow's tables (collections and {@code joined_*} results) are direct
 * children.
 */
public class IngestSchema extends AbstractSchema {
  private final TableStore store;
  private final @Nullable String workflow;

  public IngestSchema(TableStore store, @Nullable String workflow) {
    this.store = store;
    this.workflow = workflow;
  }

  public TableStore getStore() {
    return store;
  }

  @Override protected Map<String, Table> getTableMap() {
    if (workflow == null) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, Table> builder = ImmutableMap.builder();
    for (TableKey key : tables()) {
      if (key.getWorkflow().equals(workflow)) {
        builder.put(key.getTable(), new MaterializedTable(store, key));
      }
    }
    return builder.build();
  }

  @Override protected Map<String, Schema> getSubSchemaMap() {
    if (workflow != null) {
      return ImmutableMap.of();
    }
    Map<String, Schema> schemas = new LinkedHashMap<>();
    for (TableKey key : tables()) {
      if (!schemas.containsKey(key.getWorkflow())) {
        schemas.put(key.getWorkflow(), new IngestSchema(store, key.getWorkflow()));
      }
    }
    return schemas;
  }

  private Iterable<TableKey> tables() {
    try {
      return store.listTables();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list tables", e);
    }
  }
}
