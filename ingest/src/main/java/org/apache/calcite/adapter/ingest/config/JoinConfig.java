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
package org.apache.calcite.adapter.ingest.config;

import org.apache.calcite.adapter.ingest.ConfigValidationException;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Join declared by a data collection: the collection is joined with each
 * target in {@code with_dc}, in order, on {@code on_columns}. With a
 * {@link GranularityConfig}, the finer-grained side of each join is first
 * reduced to one row per key.
 */
public class JoinConfig {
  private final List<String> onColumns;
  private final JoinType how;
  private final List<String> withDc;
  private final @Nullable GranularityConfig granularity;

  public JoinConfig(List<String> onColumns, JoinType how, List<String> withDc) {
    this(onColumns, how, withDc, null);
  }

  public JoinConfig(List<String> onColumns, JoinType how, List<String> withDc,
      @Nullable GranularityConfig granularity) {
    this.onColumns = ImmutableList.copyOf(onColumns);
    this.how = how;
    this.withDc = ImmutableList.copyOf(withDc);
    this.granularity = granularity;
  }

  public List<String> getOnColumns() {
    return onColumns;
  }

  public JoinType getHow() {
    return how;
  }

  public List<String> getWithDc() {
    return withDc;
  }

  /** Returns how tables of different granularity are reconciled, if set. */
  public @Nullable GranularityConfig getGranularity() {
    return granularity;
  }

  static JoinConfig fromMap(Map<String, Object> map, String path)
      throws ConfigValidationException {
    List<String> on = ConfigMaps.stringList(map, "on_columns", path);
    String how = ConfigMaps.optionalString(map, "how");
    List<String> with = ConfigMaps.stringList(map, "with_dc", path);
    if (with.isEmpty()) {
      throw new ConfigValidationException(path + ".with_dc",
          "at least one target data collection is required");
    }
    GranularityConfig granularity = null;
    if (map.get("granularity") != null) {
      granularity = GranularityConfig.fromMap(
          ConfigMaps.requireMap(map, "granularity", path),
          path + ".granularity", on);
    }
    return new JoinConfig(on,
        how == null ? JoinType.INNER : JoinType.fromValue(how, path + ".how"),
        with, granularity);
  }
}
