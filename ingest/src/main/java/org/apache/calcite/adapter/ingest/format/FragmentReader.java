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

import org.apache.calcite.adapter.ingest.SchemaMismatchException;
import org.apache.calcite.adapter.ingest.config.DataCollectionConfig;
import org.apache.calcite.adapter.ingest.config.IngestSettings;
import org.apache.calcite.adapter.ingest.config.JoinConfig;
import org.apache.calcite.adapter.ingest.config.TableProperties;
import org.apache.calcite.adapter.ingest.discovery.MatchedFile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns a matched file into the fragment that enters aggregation.
 *
 * <p>After parsing, the file's wildcard values are added as string columns (a
 * data column of the same name takes precedence), the required columns are
 * checked, the run id column is added, and finally the {@code keep_columns}
 * allow-list is applied. Join keys, wildcard columns and the run id column
 * always survive the allow-list.
 */
public class FragmentReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(FragmentReader.class);

  private final IngestSettings settings;

  public FragmentReader(IngestSettings settings) {
    this.settings = settings;
  }

  /**
   * Reads one file.
   *
   * @throws SchemaMismatchException if the file cannot be parsed or lacks a
   *     required column
   */
  public TableData read(MatchedFile file, DataCollectionConfig dataCollection)
      throws SchemaMismatchException {
    TableProperties properties = dataCollection.getTableProperties();
    TableData data = FragmentParsers.forFormat(properties.getFormat())
        .parse(file.getPath(), properties);

    for (Map.Entry<String, String> w : file.getWildcards().entrySet()) {
      if (data.hasColumn(w.getKey())) {
        LOGGER.debug("{}: data column '{}' shadows the wildcard of the same name",
            file, w.getKey());
        continue;
      }
      data = data.withColumn(
          Column.constant(w.getKey(), ColumnType.STRING, w.getValue(),
              data.getRowCount()));
    }

    Set<String> required = requiredColumns(dataCollection);
    for (String column : required) {
      if (!data.hasColumn(column)) {
        throw new SchemaMismatchException(file.getPath()
            + ": declared column '" + column + "' is absent (columns: "
            + data.getColumnNames() + ")");
      }
    }

    data = data.withColumn(
        Column.constant(settings.getRunIdColumn(), ColumnType.STRING,
            file.getRun().getRunId(), data.getRowCount()));

    if (!dataCollection.getKeepColumns().isEmpty()) {
      Set<String> keep = new LinkedHashSet<String>(required);
      keep.addAll(file.getWildcards().keySet());
      keep.add(settings.getRunIdColumn());
      data = data.select(keep);
    }
    return data;
  }

  /** Returns keep columns, join keys and declared required columns. */
  public static Set<String> requiredColumns(DataCollectionConfig dataCollection) {
    Set<String> required =
        new LinkedHashSet<String>(dataCollection.getKeepColumns());
    JoinConfig join = dataCollection.getJoin();
    if (join != null) {
      required.addAll(join.getOnColumns());
    }
    required.addAll(dataCollection.getTableProperties().getRequiredColumns());
    return required;
  }
}
