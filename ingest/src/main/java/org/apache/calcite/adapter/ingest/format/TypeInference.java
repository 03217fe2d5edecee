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

import java.time.LocalDateTime;
import java.util.List;

/**
 * Infers column types from textual values.
 */
final class TypeInference {
  private TypeInference() {
  }

  /**
   * Returns the narrowest of {@link ColumnType#LONG}, {@link ColumnType#DOUBLE}
   * and {@link ColumnType#BOOLEAN} that fits every non-null value, or
   * {@link ColumnType#STRING}. An all-null column is a string column.
   */
  static ColumnType infer(List<@Nullable String> values) {
    boolean allLong = true;
    boolean allDouble = true;
    boolean allBoolean = true;
    boolean any = false;
    for (String v : values) {
      if (v == null) {
        continue;
      }
      any = true;
      String t = v.trim();
      if (allLong && !isLong(t)) {
        allLong = false;
      }
      if (allDouble && !isDouble(t)) {
        allDouble = false;
      }
      if (allBoolean && ColumnType.parseBoolean(t) == null) {
        allBoolean = false;
      }
      if (!allLong && !allDouble && !allBoolean) {
        return ColumnType.STRING;
      }
    }
    if (!any) {
      return ColumnType.STRING;
    }
    if (allLong) {
      return ColumnType.LONG;
    }
    if (allDouble) {
      return ColumnType.DOUBLE;
    }
    return allBoolean ? ColumnType.BOOLEAN : ColumnType.STRING;
  }

  /** Returns the type that holds both a value's type and the current one. */
  static @Nullable ColumnType merge(@Nullable ColumnType current,
      @Nullable Object value) {
    ColumnType valueType = typeOf(value);
    if (valueType == null) {
      return current;
    }
    return current == null ? valueType : current.widen(valueType);
  }

  static @Nullable ColumnType typeOf(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Boolean) {
      return ColumnType.BOOLEAN;
    }
    if (value instanceof Long || value instanceof Integer
        || value instanceof Short || value instanceof Byte) {
      return ColumnType.LONG;
    }
    if (value instanceof Number) {
      return ColumnType.DOUBLE;
    }
    if (value instanceof LocalDateTime) {
      return ColumnType.TIMESTAMP;
    }
    return ColumnType.STRING;
  }

  private static boolean isLong(String s) {
    if (s.isEmpty()) {
      return false;
    }
    int start = s.charAt(0) == '-' || s.charAt(0) == '+' ? 1 : 0;
    if (start == s.length() || s.length() - start > 18) {
      return false;
    }
    for (int i = start; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isDouble(String s) {
    if (s.isEmpty()) {
      return false;
    }
    char last = s.charAt(s.length() - 1);
    if (!Character.isDigit(last) && last != '.') {
      // rejects suffixes Java accepts, such as "1d" and "2f"
      return false;
    }
    try {
      Double.parseDouble(s);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
