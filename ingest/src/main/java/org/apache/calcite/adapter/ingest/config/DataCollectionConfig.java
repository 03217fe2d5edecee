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
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named group of files within a workflow sharing one matching and parsing
 * schema.
 *
 * <pre>{@code
 * - data_collection_tag: mosdepth
 *   config:
 *     type: Table
 *     metatype: Aggregate
 *     scan:
 *       mode: recursive
 *       scan_parameters:
 *         regex_config:
 *           pattern: "(?<sample>[^/]+)/mosdepth\\.summary\\.txt"
 *     dc_specific_properties:
 *       format: TSV
 *     keep_columns: [chrom, mean]
 *     join:
 *       on_columns: [sample]
 *       how: inner
 *       with_dc: [samples]
 * }</pre>
 */
public class DataCollectionConfig {
  private final String tag;
  private final @Nullable String description;
  private final DataCollectionType type;
  private final @Nullable String metatype;
  private final ScanConfig scan;
  private final DataCollectionProperties properties;
  private final List<String> keepColumns;
  private final Map<String, String> columnsDescription;
  private final @Nullable JoinConfig join;

  private DataCollectionConfig(Builder builder) {
    this.tag = builder.tag;
    this.description = builder.description;
    this.type = builder.properties.getType();
    this.metatype = builder.metatype;
    this.scan = builder.scan;
    this.properties = builder.properties;
    this.keepColumns = ImmutableList.copyOf(builder.keepColumns);
    this.columnsDescription = ImmutableMap.copyOf(builder.columnsDescription);
    this.join = builder.join;
  }

  public String getTag() {
    return tag;
  }

  public @Nullable String getDescription() {
    return description;
  }

  public DataCollectionType getType() {
    return type;
  }

  /** Returns the metatype ({@code Aggregate} or {@code Metadata}), if declared. */
  public @Nullable String getMetatype() {
    return metatype;
  }

  public ScanConfig getScan() {
    return scan;
  }

  public DataCollectionProperties getProperties() {
    return properties;
  }

  /**
   * Returns the table properties.
   *
   * @throws IllegalStateException if this is not a {@code Table} collection
   */
  public TableProperties getTableProperties() {
    if (!(properties instanceof TableProperties)) {
      throw new IllegalStateException(tag + " is not a Table data collection");
    }
    return (TableProperties) properties;
  }

  /** Returns the column allow-list; empty means keep every column. */
  public List<String> getKeepColumns() {
    return keepColumns;
  }

  public Map<String, String> getColumnsDescription() {
    return columnsDescription;
  }

  public @Nullable JoinConfig getJoin() {
    return join;
  }

  public static Builder builder(String tag) {
    return new Builder(tag);
  }

  static DataCollectionConfig fromMap(Map<String, Object> map, String path)
      throws ConfigValidationException {
    Builder builder = builder(
        ConfigMaps.requireString(map, "data_collection_tag", path));
    builder.description(ConfigMaps.optionalString(map, "description"));

    Map<String, Object> config = ConfigMaps.requireMap(map, "config", path);
    String configPath = path + ".config";
    DataCollectionType type = DataCollectionType.fromValue(
        ConfigMaps.requireString(config, "type", configPath),
        configPath + ".type");
    builder.metatype(ConfigMaps.optionalString(config, "metatype"));
    builder.scan(
        ScanConfig.fromMap(ConfigMaps.requireMap(config, "scan", configPath),
            configPath + ".scan"));

    Map<String, Object> props =
        ConfigMaps.optionalMap(config, "dc_specific_properties", configPath);
    String propsPath = configPath + ".dc_specific_properties";
    if (type == DataCollectionType.TABLE) {
      builder.properties(TableProperties.fromMap(props, propsPath));
    } else {
      builder.properties(GenericProperties.fromMap(type, props));
    }

    List<String> keep = ConfigMaps.stringList(config, "keep_columns", configPath);
    if (keep.isEmpty()) {
      keep = ConfigMaps.stringList(props, "keep_columns", propsPath);
    }
    builder.keepColumns(keep);

    Map<String, Object> descriptions =
        ConfigMaps.optionalMap(config, "columns_description", configPath);
    if (descriptions.isEmpty()) {
      descriptions = ConfigMaps.optionalMap(props, "columns_description", propsPath);
    }
    for (Map.Entry<String, Object> e : descriptions.entrySet()) {
      builder.columnDescription(e.getKey(), String.valueOf(e.getValue()));
    }

    if (config.get("join") != null) {
      builder.join(
          JoinConfig.fromMap(ConfigMaps.requireMap(config, "join", configPath),
              configPath + ".join"));
    } else if (map.get("join") != null) {
      builder.join(
          JoinConfig.fromMap(ConfigMaps.requireMap(map, "join", path),
              path + ".join"));
    }
    return builder.build();
  }

  @Override public String toString() {
    return tag + "(" + type + ")";
  }

  /**
   * Builder for DataCollectionConfig.
   */
  public static class Builder {
    private final String tag;
    private @Nullable String description;
    private @Nullable String metatype;
    private @Nullable ScanConfig scan;
    private @Nullable DataCollectionProperties properties;
    private List<String> keepColumns = ImmutableList.of();
    private final Map<String, String> columnsDescription =
        new LinkedHashMap<String, String>();
    private @Nullable JoinConfig join;

    Builder(String tag) {
      this.tag = tag;
    }

    public Builder description(@Nullable String description) {
      this.description = description;
      return this;
    }

    public Builder metatype(@Nullable String metatype) {
      this.metatype = metatype;
      return this;
    }

    public Builder scan(ScanConfig scan) {
      this.scan = scan;
      return this;
    }

    public Builder properties(DataCollectionProperties properties) {
      this.properties = properties;
      return this;
    }

    public Builder keepColumns(List<String> keepColumns) {
      this.keepColumns = keepColumns;
      return this;
    }

    public Builder columnDescription(String column, String description) {
      this.columnsDescription.put(column, description);
      return this;
    }

    public Builder join(@Nullable JoinConfig join) {
      this.join = join;
      return this;
    }

    public DataCollectionConfig build() {
      if (scan == null) {
        throw new IllegalStateException("scan is required for " + tag);
      }
      if (properties == null) {
        throw new IllegalStateException("properties are required for " + tag);
      }
      return new DataCollectionConfig(this);
    }
  }
}
