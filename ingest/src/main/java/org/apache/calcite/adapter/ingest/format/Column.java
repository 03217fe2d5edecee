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
import java.util.Collections;
import java.util.List;

/**
 * A named, typed column of values. Null entries are missing values.
 */
public final class Column {
  private final String name;
  private final ColumnType type;
  private final List<@Nullable Object> values;

  public Column(String name, ColumnType type, List<@Nullable Object> values) {
    this.name = name;
    this.type = type;
    this.values = Collections.unmodifiableList(new ArrayList<@Nullable Object>(values));
  }

  /** Creates a column repeating one value. */
  public static Column constant(String name, ColumnType type,
      @Nullable Object value, int rowCount) {
    return new Column(name, type,
        Collections.<@Nullable Object>nCopies(rowCount, value));
  }

  public String getName() {
    return name;
  }

  public ColumnType getType() {
    return type;
  }

  public List<@Nullable Object> getValues() {
    return values;
  }

  public @Nullable Object get(int row) {
    return values.get(row);
  }

  public int size() {
    return values.size();
  }

  /** Returns this column converted to a wider type. */
  public Column cast(ColumnType target) {
    if (target == type) {
      return this;
    }
    List<@Nullable Object> converted = new ArrayList<@Nullable Object>(values.size());
    for (Object v : values) {
      converted.add(target.coerce(v));
    }
    return new Column(name, target, converted);
  }

  public Column rename(String newName) {
    return new Column(newName, type, values);
  }

  @Override public String toString() {
    return name + " " + type + " " + ImmutableList.copyOf(values.subList(0,
        Math.min(5, values.size()))) + (values.size() > 5 ? "..." : "");
  }
}
