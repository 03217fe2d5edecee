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
package org.apache.calcite.adapter.ingest.catalog;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * Identity of a file record: (workflow, data collection, run, file location).
 */
public final class FileKey {
  private final String workflow;
  private final String dataCollection;
  private final String runId;
  private final String location;

  public FileKey(String workflow, String dataCollection, String runId,
      String location) {
    this.workflow = workflow;
    this.dataCollection = dataCollection;
    this.runId = runId;
    this.location = location;
  }

  public String getWorkflow() {
    return workflow;
  }

  public String getDataCollection() {
    return dataCollection;
  }

  public String getRunId() {
    return runId;
  }

  public String getLocation() {
    return location;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FileKey)) {
      return false;
    }
    FileKey that = (FileKey) o;
    return workflow.equals(that.workflow)
        && dataCollection.equals(that.dataCollection)
        && runId.equals(that.runId)
        && location.equals(that.location);
  }

  @Override public int hashCode() {
    return Objects.hash(workflow, dataCollection, runId, location);
  }

  @Override public String toString() {
    return workflow + "/" + dataCollection + "/" + runId + ":" + location;
  }
}
