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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Logical type of a column in a fragment or a materialized table.
 *
 * <p>Values are held as {@link Boolean}, {@link Long}, {@link Double},
 * {@link String} and {@link LocalDateTime} respectively; {@code null} is the
 * missing-value marker for every type.
 */
public enum ColumnType {
  BOOLEAN,
  LONG,
  DOUBLE,
  STRING,
  TIMESTAMP;

  /** Formatter used when a timestamp is widened to a string. */
  public static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  /**
   * Returns the narrowest type able to hold values of both this type and
   * {@code other}. Numeric types widen to {@link #DOUBLE}; any other conflict
   * widens to {@link #STRING}.
   */
  public ColumnType widen(ColumnType other) {
    if (this == other) {
      return this;
    }
    if ((this == LONG && other == DOUBLE) || (this == DOUBLE && other == LONG)) {
      return DOUBLE;
    }
    return STRING;
  }

  /**
   * Converts a value of another column type into this type.
   *
   * @throws IllegalArgumentException if the value cannot be represented
   */
  public @Nullable Object coerce(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    switch (this) {
    case STRING:
      if (value instanceof LocalDateTime) {
        return TIMESTAMP_FORMAT.format((LocalDateTime) value);
      }
      return value.toString();
    case DOUBLE:
      if (value instanceof Number) {
        return ((Number) value).doubleValue();
      }
      return Double.parseDouble(value.toString().trim());
    case LONG:
      if (value instanceof Long) {
        return value;
      }
      if (value instanceof Number) {
        return ((Number) value).longValue();
      }
      return Long.parseLong(value.toString().trim());
    case BOOLEAN:
      if (value instanceof Boolean) {
        return value;
      }
      Boolean b = parseBoolean(value.toString());
      if (b == null) {
        throw new IllegalArgumentException("Not a boolean: " + value);
      }
      return b;
    case TIMESTAMP:
      if (value instanceof LocalDateTime) {
        return value;
      }
      LocalDateTime ts = parseTimestamp(value.toString());
      if (ts == null) {
        throw new IllegalArgumentException("Not a timestamp: " + value);
      }
      return ts;
    default:
      throw new AssertionError(this);
    }
  }

  /**
   * Resolves a type name as written in configuration. Accepts the engine
   * style names ({@code Int64}, {@code Float64}, {@code Utf8}) as well as SQL
   * style ones ({@code BIGINT}, {@code DOUBLE}, {@code VARCHAR}).
   */
  public static ColumnType fromName(String name) {
    switch (name.trim().toLowerCase(Locale.ROOT)) {
    case "bool":
    case "boolean":
      return BOOLEAN;
    case "int":
    case "int8":
    case "int16":
    case "int32":
    case "int64":
    case "integer":
    case "long":
    case "bigint":
      return LONG;
    case "float":
    case "float32":
    case "float64":
    case "double":
    case "decimal":
      return DOUBLE;
    case "str":
    case "string":
    case "utf8":
    case "varchar":
    case "text":
    case "categorical":
      return STRING;
    case "date":
    case "datetime":
    case "timestamp":
      return TIMESTAMP;
    default:
      throw new IllegalArgumentException("Unknown column type '" + name + "'");
    }
  }

  static @Nullable Boolean parseBoolean(String text) {
    String t = text.trim();
    if (t.equalsIgnoreCase("true")) {
      return Boolean.TRUE;
    }
    if (t.equalsIgnoreCase("false")) {
      return Boolean.FALSE;
    }
    return null;
  }

  static @Nullable LocalDateTime parseTimestamp(String text) {
    String t = text.trim();
    try {
      if (t.length() == 10) {
        return LocalDate.parse(t).atStartOfDay();
      }
      if (t.length() > 10 && t.charAt(10) == ' ') {
        return LocalDateTime.parse(t, TIMESTAMP_FORMAT);
      }
      return LocalDateTime.parse(t);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
