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

import org.apache.calcite.adapter.ingest.WildcardExtractionException;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.util.Map;

/**
 * A file accepted by a data collection pattern within one run, with the
 * wildcard values extracted from its path.
 *
 * <p>A file whose path matched but did not yield every wildcard is still
 * described, flagged with the {@link #getRejection() rejection}, so that the
 * catalog can record it.
 */
public class MatchedFile {
  private final String dataCollection;
  private final RunCandidate run;
  private final Path path;
  private final String relativePath;
  private final Map<String, String> wildcards;
  private final @Nullable Path sidecar;
  private final @Nullable WildcardExtractionException rejection;

  public MatchedFile(String dataCollection, RunCandidate run, Path path,
      String relativePath, Map<String, String> wildcards,
      @Nullable Path sidecar) {
    this(dataCollection, run, path, relativePath, wildcards, sidecar, null);
  }

  private MatchedFile(String dataCollection, RunCandidate run, Path path,
      String relativePath, Map<String, String> wildcards,
      @Nullable Path sidecar, @Nullable WildcardExtractionException rejection) {
    this.dataCollection = dataCollection;
    this.run = run;
    this.path = path;
    this.relativePath = relativePath;
    this.wildcards = ImmutableMap.copyOf(wildcards);
    this.sidecar = sidecar;
    this.rejection = rejection;
  }

  static MatchedFile rejected(String dataCollection, RunCandidate run,
      Path path, String relativePath, WildcardExtractionException rejection) {
    return new MatchedFile(dataCollection, run, path, relativePath,
        ImmutableMap.<String, String>of(), null, rejection);
  }

  public String getDataCollection() {
    return dataCollection;
  }

  public RunCandidate getRun() {
    return run;
  }

  public Path getPath() {
    return path;
  }

  /** Returns the path relative to the run root, with {@code /} separators. */
  public String getRelativePath() {
    return relativePath;
  }

  /** Returns the wildcard values in declaration order. */
  public Map<String, String> getWildcards() {
    return wildcards;
  }

  /** Returns the index/sidecar file accompanying this file, if any. */
  public @Nullable Path getSidecar() {
    return sidecar;
  }

  public @Nullable WildcardExtractionException getRejection() {
    return rejection;
  }

  public boolean isRejected() {
    return rejection != null;
  }

  /** Returns the catalog location of this file. */
  public String getLocation() {
    return path.toAbsolutePath().normalize().toString();
  }

  @Override public String toString() {
    return dataCollection + ":" + run.getRunId() + "/" + relativePath
        + (wildcards.isEmpty() ? "" : " " + wildcards);
  }
}
