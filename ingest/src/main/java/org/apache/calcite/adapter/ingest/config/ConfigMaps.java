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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed accessors over the untyped maps produced by the YAML reader. Every
 * failure names the field path it was reading.
 */
final class ConfigMaps {
  private ConfigMaps() {
  }

  static String requireString(Map<String, Object> map, String key, String path)
      throws ConfigValidationException {
    String value = optionalString(map, key);
    if (value == null || value.trim().isEmpty()) {
      throw new ConfigValidationException(path + "." + key, "is required");
    }
    return value;
  }

  static @Nullable String optionalString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    return value == null ? null : value.toString();
  }

  static boolean optionalBoolean(Map<String, Object> map, String key,
      boolean defaultValue, String path) throws ConfigValidationException {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    String s = value.toString().trim();
    if (s.equalsIgnoreCase("true")) {
      return true;
    }
    if (s.equalsIgnoreCase("false")) {
      return false;
    }
    throw new ConfigValidationException(path + "." + key,
        "expected a boolean but got '" + value + "'");
  }

  static long optionalLong(Map<String, Object> map, String key,
      long defaultValue, String path) throws ConfigValidationException {
    Object value = map.get(key);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new ConfigValidationException(path + "." + key,
          "expected a number but got '" + value + "'", e);
    }
  }

  static int optionalInt(Map<String, Object> map, String key,
      int defaultValue, String path) throws ConfigValidationException {
    long value = optionalLong(map, key, defaultValue, path);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new ConfigValidationException(path + "." + key, "out of range");
    }
    return (int) value;
  }

  /** Returns a list of strings; a scalar is read as a singleton list. */
  static List<String> stringList(Map<String, Object> map, String key,
      String path) throws ConfigValidationException {
    Object value = map.get(key);
    if (value == null) {
      return Collections.emptyList();
    }
    if (!(value instanceof List)) {
      if (value instanceof Map) {
        throw new ConfigValidationException(path + "." + key,
            "expected a list of strings");
      }
      return Collections.singletonList(value.toString());
    }
    List<String> result = new ArrayList<String>();
    int i = 0;
    for (Object o : (List<?>) value) {
      if (o == null || o instanceof Map || o instanceof List) {
        throw new ConfigValidationException(path + "." + key + "[" + i + "]",
            "expected a string");
      }
      result.add(o.toString());
      i++;
    }
    return result;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> optionalMap(Map<String, Object> map, String key,
      String path) throws ConfigValidationException {
    Object value = map.get(key);
    if (value == null) {
      return Collections.emptyMap();
    }
    if (!(value instanceof Map)) {
      throw new ConfigValidationException(path + "." + key,
          "expected a mapping");
    }
    return new LinkedHashMap<String, Object>((Map<String, Object>) value);
  }

  static Map<String, Object> requireMap(Map<String, Object> map, String key,
      String path) throws ConfigValidationException {
    if (map.get(key) == null) {
      throw new ConfigValidationException(path + "." + key, "is required");
    }
    return optionalMap(map, key, path);
  }

  @SuppressWarnings("unchecked")
  static List<Map<String, Object>> mapList(Map<String, Object> map, String key,
      String path) throws ConfigValidationException {
    Object value = map.get(key);
    if (value == null) {
      return Collections.emptyList();
    }
    if (!(value instanceof List)) {
      throw new ConfigValidationException(path + "." + key, "expected a list");
    }
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
    int i = 0;
    for (Object o : (List<?>) value) {
      if (!(o instanceof Map)) {
        throw new ConfigValidationException(path + "." + key + "[" + i + "]",
            "expected a mapping");
      }
      result.add((Map<String, Object>) o);
      i++;
    }
    return result;
  }
}
