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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Properties of a non-tabular data collection. The raw map is kept for the
 * collaborators that render these collections.
 */
public class GenericProperties implements DataCollectionProperties {
  private final DataCollectionType type;
  private final @Nullable String indexExtension;
  private final Map<String, Object> raw;

  public GenericProperties(DataCollectionType type,
      @Nullable String indexExtension, Map<String, Object> raw) {
    this.type = type;
    this.indexExtension = indexExtension;
    this.raw = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(raw));
  }

  @Override public DataCollectionType getType() {
    return type;
  }

  @Override public @Nullable String getIndexExtension() {
    return indexExtension;
  }

  public Map<String, Object> getRaw() {
    return raw;
  }

  static GenericProperties fromMap(DataCollectionType type,
      Map<String, Object> map) {
    return new GenericProperties(type,
        ConfigMaps.optionalString(map, "index_extension"), map);
  }
}
