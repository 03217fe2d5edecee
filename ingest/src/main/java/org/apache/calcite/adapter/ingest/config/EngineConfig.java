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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Workflow engine that produced the runs, for example {@code nextflow 24.04}.
 */
public class EngineConfig {
  private final String name;
  private final @Nullable String version;

  public EngineConfig(String name, @Nullable String version) {
    this.name = name;
    this.version = version;
  }

  public String getName() {
    return name;
  }

  public @Nullable String getVersion() {
    return version;
  }

  static EngineConfig fromMap(Map<String, Object> map, String path)
      throws ConfigValidationException {
    return new EngineConfig(ConfigMaps.requireString(map, "name", path),
        ConfigMaps.optionalString(map, "version"));
  }

  @Override public String toString() {
    return version == null ? name : name + " " + version;
  }
}
