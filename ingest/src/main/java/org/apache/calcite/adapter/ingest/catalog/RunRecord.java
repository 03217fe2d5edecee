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

import java.time.Instant;
import java.util.Objects;

/**
 * Catalog entry of one discovered run.
 */
public class RunRecord {

  /** Whether the run directory was found by the latest complete scan. */
  public enum Status {
    ACTIVE,
    STALE
  }

  private final String workflow;
  private final String runId;
  private final String location;
  private final Status status;
  private final Instant firstSeen;

  public RunRecord(String workflow, String runId, String location,
      Status status, Instant firstSeen) {
    this.workflow = workflow;
    this.runId = runId;
    this.location = location;
    this.status = status;
    this.firstSeen = firstSeen;
  }

  public String getWorkflow() {
    return workflow;
  }

  public String getRunId() {
    return runId;
  }

  public String getLocation() {
    return location;
  }

  public Status getStatus() {
    return status;
  }

  public Instant getFirstSeen() {
    return firstSeen;
  }

  public RunRecord withStatus(Status newStatus) {
    return new RunRecord(workflow, runId, location, newStatus, firstSeen);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RunRecord)) {
      return false;
    }
    RunRecord that = (RunRecord) o;
    return workflow.equals(that.workflow)
        && runId.equals(that.runId)
        && location.equals(that.location)
        && status == that.status
        && firstSeen.equals(that.firstSeen);
  }

  @Override public int hashCode() {
    return Objects.hash(workflow, runId, location, status);
  }

  @Override public String toString() {
    return workflow + "/" + runId + " " + status;
  }
}
