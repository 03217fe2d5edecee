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
package org.apache.calcite.adapter.ingest.discovery;

import java.nio.file.Path;

/**
 * A run directory found under a workflow location, with the run id captured
 * from its name.
 */
public class RunCandidate {
  /** Suffix of the pseudo-run used for single-file collections with an absolute path. */
  public static final String SINGLE_FILE_SUFFIX = "-single-file-scan";

  private final String workflow;
  private final String runId;
  private final Path root;

  public RunCandidate(String workflow, String runId, Path root) {
    this.workflow = workflow;
    this.runId = runId;
    this.root = root;
  }

  /** Creates the pseudo-run holding the standalone file of a collection. */
  public static RunCandidate singleFile(String workflow, String dataCollection,
      Path file) {
    Path parent = file.toAbsolutePath().getParent();
    return new RunCandidate(workflow, dataCollection + SINGLE_FILE_SUFFIX,
        parent == null ? file.toAbsolutePath() : parent);
  }

  public String getWorkflow() {
    return workflow;
  }

  public String getRunId() {
    return runId;
  }

  public Path getRoot() {
    return root;
  }

  /** Returns the name of the run directory. */
  public String getDirectoryName() {
    Path name = root.getFileName();
    return name == null ? root.toString() : name.toString();
  }

  @Override public String toString() {
    return workflow + "/" + runId + " (" + root + ")";
  }
}
