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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Identifies a materialized table: the workflow it belongs to and its name
 * (a data collection tag, or the joined table of a collection).
 */
public final class TableKey implements Comparable<TableKey> {
  private final String workflow;
  private final String table;

  public TableKey(String workflow, String table) {
    this.workflow = Objects.requireNonNull(workflow, "workflow");
    this.table = Objects.requireNonNull(table, "table");
  }

  public String getWorkflow() {
    return workflow;
  }

  public String getTable() {
    return table;
  }

  @Override public int compareTo(TableKey o) {
    int c = workflow.compareTo(o.workflow);
    return c != 0 ? c : table.compareTo(o.table);
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof TableKey
        && workflow.equals(((TableKey) o).workflow)
        && table.equals(((TableKey) o).table);
  }

  @Override public int hashCode() {
    return Objects.hash(workflow, table);
  }

  @Override public String toString() {
    return workflow + "." + table;
  }
}
