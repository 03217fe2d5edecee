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

import java.util.Locale;

/** Relational join kind declared by {@code join.how}. */
public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  OUTER;

  /** Whether unmatched rows of the left (source) side are kept. */
  public boolean keepsLeft() {
    return this == LEFT || this == OUTER;
  }

  /** Whether unmatched rows of the right (target) side are kept. */
  public boolean keepsRight() {
    return this == RIGHT || this == OUTER;
  }

  static JoinType fromValue(String value, String path)
      throws ConfigValidationException {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
    case "inner":
      return INNER;
    case "left":
      return LEFT;
    case "right":
      return RIGHT;
    case "outer":
    case "full":
      return OUTER;
    default:
      throw new ConfigValidationException(path,
          "unknown join type '" + value + "' (expected inner, left, right or outer)");
    }
  }
}
