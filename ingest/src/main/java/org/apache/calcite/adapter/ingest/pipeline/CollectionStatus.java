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
package org.apache.calcite.adapter.ingest.pipeline;

import org.apache.calcite.adapter.ingest.catalog.FileRecord;
import org.apache.calcite.adapter.ingest.catalog.RunRecord;
import org.apache.calcite.adapter.ingest.storage.TableVersion;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

/**
 * Catalog and storage state of one data collection.
 */
public class CollectionStatus {
  private final String workflow;
  private final String dataCollection;
  private final Map<RunRecord.Status, Integer> runs;
  private final Map<FileRecord.Status, Integer> files;
  private final @Nullable TableVersion latestVersion;

  CollectionStatus(String workflow, String dataCollection,
      Map<RunRecord.Status, Integer> runs, Map<FileRecord.Status, Integer> files,
      @Nullable TableVersion latestVersion) {
    this.workflow = workflow;
    this.dataCollection = dataCollection;
    this.runs = ImmutableMap.copyOf(runs);
    this.files = ImmutableMap.copyOf(files);
    this.latestVersion = latestVersion;
  }

  public String getWorkflow() {
    return workflow;
  }

  public String getDataCollection() {
    return dataCollection;
  }

  /** Returns the number of runs of the workflow in a state. */
  public int getRunCount(RunRecord.Status status) {
    Integer n = runs.get(status);
    return n == null ? 0 : n;
  }

  /** Returns the number of files of the collection in a state. */
  public int getFileCount(FileRecord.Status status) {
    Integer n = files.get(status);
    return n == null ? 0 : n;
  }

  public @Nullable TableVersion getLatestVersion() {
    return latestVersion;
  }

  @Override public String toString() {
    return workflow + "/" + dataCollection + " runs=" + runs + " files=" + files
        + " latest=" + latestVersion;
  }
}
