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

import org.apache.calcite.adapter.ingest.config.TableFormat;

/**
 * Chooses the parser for a table format.
 */
public final class FragmentParsers {
  private static final FragmentParser DELIMITED = new DelimitedParser();
  private static final FragmentParser PARQUET = new ParquetParser();
  private static final FragmentParser EXCEL = new ExcelParser();

  private FragmentParsers() {
  }

  public static FragmentParser forFormat(TableFormat format) {
    switch (format) {
    case CSV:
    case TSV:
    case TXT:
      return DELIMITED;
    case PARQUET:
      return PARQUET;
    case XLSX:
    case XLS:
      return EXCEL;
    default:
      throw new AssertionError(format);
    }
  }
}
