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
package org.apache.calcite.adapter.ingest.materialize;

import org.apache.calcite.adapter.ingest.format.TableData;

/**
 * Rows read from one registered file, ready to be aggregated.
 */
public class Fragment implements Comparable<Fragment> {
  private final String runId;
  private final String location;
  private final TableData data;

  public Fragment(String runId, String location, TableData data) {
    this.runId = runId;
    this.location = location;
    this.data = data;
  }

  public String getRunId() {
    return runId;
  }

  public String getLocation() {
    return location;
  }

  public TableData getData() {
    return data;
  }

  @Override public int compareTo(Fragment o) {
    int c = runId.compareTo(o.runId);
    return c != 0 ? c : location.compareTo(o.location);
  }

  @Override public String toString() {
    return runId + ":" + location + " (" + data.getRowCount() + " rows)";
  }
}
