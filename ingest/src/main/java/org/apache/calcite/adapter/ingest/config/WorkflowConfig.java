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
import java.util.function.Function;

/**
 * A workflow: the engine that produced its runs, where the runs live, and the
 * data collections extracted from each run.
 */
public class WorkflowConfig {
  private final String name;
  private final @Nullable EngineConfig engine;
  private final DataLocationConfig dataLocation;
  private final List<DataCollectionConfig> dataCollections;

  public WorkflowConfig(String name, @Nullable EngineConfig engine,
      DataLocationConfig dataLocation,
      List<DataCollectionConfig> dataCollections) {
    this.name = name;
    this.engine = engine;
    this.dataLocation = dataLocation;
    this.dataCollections = ImmutableList.copyOf(dataCollections);
  }

  public String getName() {
    return name;
  }

  public @Nullable EngineConfig getEngine() {
    return engine;
  }

  public DataLocationConfig getDataLocation() {
    return dataLocation;
  }

  /** Returns the data collections in declaration order. */
  public List<DataCollectionConfig> getDataCollections() {
    return dataCollections;
  }

  /** Returns the data collection with the given tag, or null. */
  public @Nullable DataCollectionConfig getDataCollection(String tag) {
    for (DataCollectionConfig dc : dataCollections) {
      if (dc.getTag().equals(tag)) {
        return dc;
      }
    }
    return null;
  }

  static WorkflowConfig fromMap(Map<String, Object> map, String path,
      Function<String, @Nullable String> env)
      throws ConfigValidationException {
    String name = ConfigMaps.requireString(map, "name", path);
    EngineConfig engine = null;
    if (map.get("engine") != null) {
      engine = EngineConfig.fromMap(ConfigMaps.requireMap(map, "engine", path),
          path + ".engine");
    }
    DataLocationConfig location = DataLocationConfig.fromMap(
        ConfigMaps.requireMap(map, "data_location", path),
        path + ".data_location", env);
    ImmutableList.Builder<DataCollectionConfig> dcs = ImmutableList.builder();
    List<Map<String, Object>> list =
        ConfigMaps.mapList(map, "data_collections", path);
    for (int i = 0; i < list.size(); i++) {
      dcs.add(DataCollectionConfig.fromMap(list.get(i),
          path + ".data_collections[" + i + "]"));
    }
    return new WorkflowConfig(name, engine, location, dcs.build());
  }
}
