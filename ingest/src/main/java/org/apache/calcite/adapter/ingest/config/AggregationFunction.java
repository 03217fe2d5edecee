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

/** Function that reduces the rows sharing a join key to one value. */
public enum AggregationFunction {
  MEAN,
  SUM,
  MIN,
  MAX,
  FIRST,
  LAST,
  COUNT,
  MEDIAN;

  /** Whether the function only applies to numeric columns. */
  public boolean isNumericOnly() {
    return this == MEAN || this == SUM || this == MEDIAN;
  }

  static AggregationFunction fromValue(String value, String path)
      throws ConfigValidationException {
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigValidationException(path,
          "unknown aggregation function '" + value
              + "' (expected mean, sum, min, max, first, last, count or median)", e);
    }
  }
}
