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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * How to reconcile tables of different granularity before a join.
 *
 * <pre>{@code
 * join:
 *   on_columns: [sample]
 *   with_dc: [cells]
 *   granularity:
 *     aggregate_to: sample
 *     numeric_default: mean
 *     categorical_default: first
 *     column_overrides:
 *       - column: n_genes
 *         function: max
 * }</pre>
 *
 * <p>The side with more rows per join key is reduced to one row per key:
 * numeric columns with {@code numeric_default}, other columns with
 * {@code categorical_default}, unless a column has an override.
 */
public class GranularityConfig {
  private final String aggregateTo;
  private final AggregationFunction numericDefault;
  private final AggregationFunction categoricalDefault;
  private final Map<String, AggregationFunction> columnOverrides;

  public GranularityConfig(String aggregateTo,
      AggregationFunction numericDefault,
      AggregationFunction categoricalDefault,
      Map<String, AggregationFunction> columnOverrides) {
    this.aggregateTo = aggregateTo;
    this.numericDefault = numericDefault;
    this.categoricalDefault = categoricalDefault;
    this.columnOverrides = ImmutableMap.copyOf(columnOverrides);
  }

  /** Creates a configuration with the default functions, mean and first. */
  public static GranularityConfig of(String aggregateTo) {
    return new GranularityConfig(aggregateTo, AggregationFunction.MEAN,
        AggregationFunction.FIRST, ImmutableMap.<String, AggregationFunction>of());
  }

  /** Returns the join column that defines the target granularity. */
  public String getAggregateTo() {
    return aggregateTo;
  }

  public AggregationFunction getNumericDefault() {
    return numericDefault;
  }

  public AggregationFunction getCategoricalDefault() {
    return categoricalDefault;
  }

  public Map<String, AggregationFunction> getColumnOverrides() {
    return columnOverrides;
  }

  /** Returns the function that aggregates a column. */
  public AggregationFunction functionFor(String column, boolean numeric) {
    AggregationFunction f = columnOverrides.get(column);
    if (f != null) {
      return f;
    }
    return numeric ? numericDefault : categoricalDefault;
  }

  static GranularityConfig fromMap(Map<String, Object> map, String path,
      List<String> onColumns) throws ConfigValidationException {
    String aggregateTo = ConfigMaps.requireString(map, "aggregate_to", path);
    if (!onColumns.contains(aggregateTo)) {
      throw new ConfigValidationException(path + ".aggregate_to",
          "'" + aggregateTo + "' is not one of the join columns " + onColumns);
    }
    AggregationFunction numeric =
        function(ConfigMaps.optionalString(map, "numeric_default"),
            AggregationFunction.MEAN, path + ".numeric_default");
    AggregationFunction categorical =
        function(ConfigMaps.optionalString(map, "categorical_default"),
            AggregationFunction.FIRST, path + ".categorical_default");
    if (categorical.isNumericOnly()) {
      throw new ConfigValidationException(path + ".categorical_default",
          "'" + categorical.name().toLowerCase(Locale.ROOT)
              + "' does not apply to non-numeric columns");
    }
    ImmutableMap.Builder<String, AggregationFunction> overrides =
        ImmutableMap.builder();
    List<Map<String, Object>> list =
        ConfigMaps.mapList(map, "column_overrides", path);
    for (int i = 0; i < list.size(); i++) {
      String itemPath = path + ".column_overrides[" + i + "]";
      String column = ConfigMaps.requireString(list.get(i), "column", itemPath);
      overrides.put(column,
          AggregationFunction.fromValue(
              ConfigMaps.requireString(list.get(i), "function", itemPath),
              itemPath + ".function"));
    }
    try {
      return new GranularityConfig(aggregateTo, numeric, categorical,
          overrides.build());
    } catch (IllegalArgumentException e) {
      throw new ConfigValidationException(path + ".column_overrides",
          "a column is overridden twice", e);
    }
  }

  private static AggregationFunction function(@Nullable String value,
      AggregationFunction defaultValue, String path)
      throws ConfigValidationException {
    return value == null ? defaultValue
        : AggregationFunction.fromValue(value, path);
  }
}
