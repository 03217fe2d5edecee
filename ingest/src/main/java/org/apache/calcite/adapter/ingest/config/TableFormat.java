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
 * Tabular file formats a {@code Table} data collection may declare.
 */
public enum TableFormat {
  CSV(','),
  TSV('\t'),
  TXT('\t'),
  PARQUET((char) 0),
  XLSX((char) 0),
  XLS((char) 0);

  private final char defaultDelimiter;

  TableFormat(char defaultDelimiter) {
    this.defaultDelimiter = defaultDelimiter;
  }

  /** Returns whether files of this format are delimited text. */
  public boolean isDelimited() {
    return defaultDelimiter != 0;
  }

  public char getDefaultDelimiter() {
    return defaultDelimiter;
  }

  public boolean isSpreadsheet() {
    return this == XLSX || this == XLS;
  }

  static TableFormat fromValue(String value, String path)
      throws ConfigValidationException {
    String v = value.trim().toLowerCase(Locale.ROOT);
    if (v.startsWith(".")) {
      v = v.substring(1);
    }
    switch (v) {
    case "csv":
      return CSV;
    case "tsv":
      return TSV;
    case "txt":
      return TXT;
    case "parquet":
      return PARQUET;
    case "xlsx":
      return XLSX;
    case "xls":
      return XLS;
    default:
      throw new ConfigValidationException(path,
          "unsupported format '" + value + "'");
    }
  }
}
