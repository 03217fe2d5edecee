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

/**
 * Kind of data collection. Only {@link #TABLE} collections are parsed and
 * materialized; other kinds are matched and registered in the catalog.
 */
public enum DataCollectionType {
  TABLE,
  JBROWSE2,
  MULTIQC;

  public boolean isTabular() {
    return this == TABLE;
  }

  static DataCollectionType fromValue(String value, String path)
      throws ConfigValidationException {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
    case "table":
      return TABLE;
    case "jbrowse2":
      return JBROWSE2;
    case "multiqc":
      return MULTIQC;
    default:
      throw new ConfigValidationException(path,
          "unknown data collection type '" + value + "'");
    }
  }
}
