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

import org.apache.calcite.adapter.ingest.DiagnosticsReport;
import org.apache.calcite.adapter.ingest.ErrorKind;
import org.apache.calcite.adapter.ingest.config.DataLocationConfig;
import org.apache.calcite.adapter.ingest.config.WorkflowConfig;

import com.google.common.collect.AbstractIterator;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the runs of a workflow.
 *
 * <p>Each call to {@link #iterator()} starts a fresh, lazy walk of the
 * workflow's locations; one directory listing is held open at a time. In the
 * {@code sequencing-runs} layout every child directory whose name matches
 * {@code runs_regex} (anchored at the start) is a run, identified by the
 * {@code run_id} named group if the expression declares one, otherwise by the
 * directory name. In the {@code flat} layout each location is itself a run.
 *
 * <p>Non-matching entries are skipped silently. Missing locations, unreadable
 * run directories and duplicate run ids are reported as
 * {@link ErrorKind#RUN_DISCOVERY} warnings and excluded. The order of runs is
 * not part of the contract.
 */
public class RunDiscovery implements Iterable<RunCandidate> {
  private static final Logger LOGGER = LoggerFactory.getLogger(RunDiscovery.class);
  private static final String RUN_ID_GROUP = "run_id";

  private final WorkflowConfig workflow;
  private final DiagnosticsReport diagnostics;

  public RunDiscovery(WorkflowConfig workflow, DiagnosticsReport diagnostics) {
    this.workflow = workflow;
    this.diagnostics = diagnostics;
  }

  @Override public RunIterator iterator() {
    return new RunIterator();
  }

  /**
   * Iterator over run candidates; close it when abandoning a walk early.
   */
  public class RunIterator extends AbstractIterator<RunCandidate>
      implements Closeable {
    private final Iterator<String> locations =
        workflow.getDataLocation().getLocations().iterator();
    private final Set<String> seen = new HashSet<String>();
    private @Nullable DirectoryStream<Path> stream;
    private @Nullable Iterator<Path> children;

    @Override protected @Nullable RunCandidate computeNext() {
      while (true) {
        if (children != null && children.hasNext()) {
          RunCandidate run = toRun(children.next());
          if (run != null && register(run)) {
            return run;
          }
          continue;
        }
        closeStream();
        if (!locations.hasNext()) {
          return endOfData();
        }
        Path location = Paths.get(locations.next());
        if (!Files.isDirectory(location)) {
          warn(location.toString(), "Location does not exist or is not a directory");
          continue;
        }
        if (workflow.getDataLocation().getStructure()
            == DataLocationConfig.Structure.FLAT) {
          RunCandidate run = flatRun(location);
          if (run != null && register(run)) {
            return run;
          }
          continue;
        }
        try {
          stream = Files.newDirectoryStream(location);
          children = stream.iterator();
        } catch (IOException e) {
          warn(location.toString(), "Cannot list location: " + e);
        }
      }
    }

    private boolean register(RunCandidate run) {
      if (!seen.add(run.getRunId())) {
        warn(run.getRunId(), "Duplicate run id at " + run.getRoot()
            + "; keeping the first occurrence");
        return false;
      }
      LOGGER.debug("Discovered run {}", run);
      return true;
    }

    private void closeStream() {
      if (stream != null) {
        try {
          stream.close();
        } catch (IOException e) {
          LOGGER.debug("Failed to close directory stream: {}", e.getMessage());
        }
        stream = null;
        children = null;
      }
    }

    @Override public void close() {
      closeStream();
    }
  }

  private @Nullable RunCandidate toRun(Path dir) {
    WildcardPattern regex = workflow.getDataLocation().getRunsRegex();
    Path fileName = dir.getFileName();
    if (regex == null || fileName == null || !Files.isDirectory(dir)) {
      return null;
    }
    String name = fileName.toString();
    Map<String, @Nullable String> groups = regex.lookingAt(name);
    if (groups == null) {
      return null;
    }
    if (!Files.isReadable(dir) || !Files.isExecutable(dir)) {
      warn(name, "Run directory " + dir + " is not readable");
      return null;
    }
    String runId = name;
    String captured = groups.get(RUN_ID_GROUP);
    if (captured != null && !captured.isEmpty()) {
      runId = captured;
    }
    return new RunCandidate(workflow.getName(), runId, dir);
  }

  private @Nullable RunCandidate flatRun(Path location) {
    Path abs = location.toAbsolutePath().normalize();
    Path fileName = abs.getFileName();
    String runId = fileName == null ? abs.toString() : fileName.toString();
    if (!Files.isReadable(abs) || !Files.isExecutable(abs)) {
      warn(runId, "Run directory " + abs + " is not readable");
      return null;
    }
    return new RunCandidate(workflow.getName(), runId, abs);
  }

  private void warn(String run, String message) {
    diagnostics.add(workflow.getName(), null, run, null,
        ErrorKind.RUN_DISCOVERY, message);
  }
}
