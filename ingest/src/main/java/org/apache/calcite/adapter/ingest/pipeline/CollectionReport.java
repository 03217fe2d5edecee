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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What one scan did to one data collection.
 */
public class CollectionReport {
  private final String workflow;
  private final String dataCollection;
  int matched;
  int parsed;
  int rejected;
  int added;
  int changed;
  int unchanged;
  int stale;
  @Nullable Long version;
  @Nullable Long joinedVersion;
  boolean written;
  boolean degraded;

  CollectionReport(String workflow, String dataCollection) {
    this.workflow = workflow;
    this.dataCollection = dataCollection;
  }

  public String getWorkflow() {
    return workflow;
  }

  public String getDataCollection() {
    return dataCollection;
  }

  /** Files matched by the pattern in this scan, rejected ones included. */
  public int getMatched() {
    return matched;
  }

  /** Files parsed successfully in this scan. */
  public int getParsed() {
    return parsed;
  }

  /** Matched files whose record is rejected after this scan. */
  public int getRejected() {
    return rejected;
  }

  public int getNew() {
    return added;
  }

  public int getChanged() {
    return changed;
  }

  public int getUnchanged() {
    return unchanged;
  }

  public int getStale() {
    return stale;
  }

  /** Latest version of the collection's table, or null if there is none. */
  public @Nullable Long getVersion() {
    return version;
  }

  /** Latest version of the collection's joined table, if it declares a join. */
  public @Nullable Long getJoinedVersion() {
    return joinedVersion;
  }

  /** Whether this scan wrote a new version of the collection's table. */
  public boolean isWritten() {
    return written;
  }

  /** Whether the collection could not be materialized. */
  public boolean isDegraded() {
    return degraded;
  }

  @Override public String toString() {
    return workflow + "/" + dataCollection
        + ": matched=" + matched
        + ", parsed=" + parsed
        + ", rejected=" + rejected
        + ", new=" + added
        + ", changed=" + changed
        + ", unchanged=" + unchanged
        + ", stale=" + stale
        + (version == null ? "" : ", version=" + version)
        + (joinedVersion == null ? "" : ", joined=" + joinedVersion)
        + (degraded ? " [degraded]" : "");
  }
}
