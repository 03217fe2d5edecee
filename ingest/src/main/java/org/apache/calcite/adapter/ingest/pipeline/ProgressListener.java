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
import org.apache.calcite.adapter.ingest.discovery.RunCandidate;
import org.apache.calcite.adapter.ingest.storage.TableVersion;

/**
 * Callbacks fired while a scan progresses. All callbacks run on the thread
 * that called the pipeline.
 */
public interface ProgressListener {
  /** Listener that ignores every event. */
  ProgressListener NONE = new ProgressListener() {
  };

  default void runDiscovered(RunCandidate run) {
  }

  default void fileRecorded(FileRecord record) {
  }

  default void tableMaterialized(TableVersion version) {
  }
}
