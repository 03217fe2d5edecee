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
package org.apache.calcite.adapter.ingest;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thread-safe collector of the per-run and per-file problems of a scan.
 * Sibling work continues after a problem is recorded.
 */
public class DiagnosticsReport {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DiagnosticsReport.class);

  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  public void add(Diagnostic diagnostic) {
    if (diagnostic.getKind() == ErrorKind.PARTIAL_COLUMN) {
      LOGGER.info("{}", diagnostic);
    } else {
      LOGGER.warn("{}", diagnostic);
    }
    synchronized (diagnostics) {
      diagnostics.add(diagnostic);
    }
  }

  public void add(String workflow, @Nullable String dataCollection,
      @Nullable String run, @Nullable String file, ErrorKind kind,
      String message) {
    add(new Diagnostic(workflow, dataCollection, run, file, kind, message));
  }

  /** Records an exception against a file. */
  public void add(String workflow, @Nullable String dataCollection,
      @Nullable String run, @Nullable String file, IngestException e) {
    add(workflow, dataCollection, run, file, e.getKind(),
        String.valueOf(e.getMessage()));
  }

  public List<Diagnostic> getDiagnostics() {
    synchronized (diagnostics) {
      return ImmutableList.copyOf(diagnostics);
    }
  }

  /** Returns the problems recorded for one data collection of a workflow. */
  public List<Diagnostic> forCollection(String workflow, String dataCollection) {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d : getDiagnostics()) {
      if (d.getWorkflow().equals(workflow)
          && Objects.equals(d.getDataCollection(), dataCollection)) {
        result.add(d);
      }
    }
    return result;
  }

  public List<Diagnostic> ofKind(ErrorKind kind) {
    List<Diagnostic> result = new ArrayList<Diagnostic>();
    for (Diagnostic d : getDiagnostics()) {
      if (d.getKind() == kind) {
        result.add(d);
      }
    }
    return result;
  }

  /** Returns the number of problems per kind; kinds never seen are absent. */
  public Map<ErrorKind, Integer> countsByKind() {
    Map<ErrorKind, Integer> counts = new EnumMap<ErrorKind, Integer>(ErrorKind.class);
    for (Diagnostic d : getDiagnostics()) {
      Integer n = counts.get(d.getKind());
      counts.put(d.getKind(), n == null ? 1 : n + 1);
    }
    return counts;
  }

  public boolean isEmpty() {
    synchronized (diagnostics) {
      return diagnostics.isEmpty();
    }
  }

  @Override public String toString() {
    return "DiagnosticsReport" + countsByKind();
  }
}
