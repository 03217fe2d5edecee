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
package org.apache.calcite.adapter.ingest.config;

import org.apache.calcite.adapter.ingest.ConfigValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Runtime settings of the ingestion pipeline, read from the optional
 * {@code ingest} section of a project file.
 *
 * <pre>{@code
 * ingest:
 *   parallelism: 4
 *   overlap_policy: all_matching
 *   fingerprint: metadata
 *   lock_timeout_ms: 30000
 *   retry:
 *     max_attempts: 4
 *     initial_backoff_ms: 200
 *     max_backoff_ms: 5000
 *   provenance:
 *     run_id_column: run_id
 *     aggregation_time_column: aggregation_time
 * }</pre>
 */
public class IngestSettings {

  /** How a file accepted by several data collection patterns is assigned. */
  public enum OverlapPolicy {
    /** The file is registered into every collection whose pattern accepts it. */
    ALL_MATCHING,
    /** The file belongs only to the first declared collection that accepts it. */
    FIRST_DECLARED
  }

  /** What a file fingerprint is computed from. */
  public enum FingerprintMode {
    /** File name, size and modification time. */
    METADATA,
    /** SHA-256 of the file content. */
    CONTENT
  }

  private final int parallelism;
  private final int maxAttempts;
  private final long initialBackoffMs;
  private final long maxBackoffMs;
  private final long lockTimeoutMs;
  private final OverlapPolicy overlapPolicy;
  private final FingerprintMode fingerprintMode;
  private final String runIdColumn;
  private final String aggregationTimeColumn;
  private final @Nullable String warehouse;

  private IngestSettings(Builder builder) {
    this.parallelism = builder.parallelism;
    this.maxAttempts = builder.maxAttempts;
    this.initialBackoffMs = builder.initialBackoffMs;
    this.maxBackoffMs = builder.maxBackoffMs;
    this.lockTimeoutMs = builder.lockTimeoutMs;
    this.overlapPolicy = builder.overlapPolicy;
    this.fingerprintMode = builder.fingerprintMode;
    this.runIdColumn = builder.runIdColumn;
    this.aggregationTimeColumn = builder.aggregationTimeColumn;
    this.warehouse = builder.warehouse;
  }

  public static IngestSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the size of the worker pool used for matching and parsing. */
  public int getParallelism() {
    return parallelism;
  }

  /** Returns the total number of attempts for a transient storage failure. */
  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getInitialBackoffMs() {
    return initialBackoffMs;
  }

  public long getMaxBackoffMs() {
    return maxBackoffMs;
  }

  /** Returns how long a writer waits for the per-collection lock. */
  public long getLockTimeoutMs() {
    return lockTimeoutMs;
  }

  public OverlapPolicy getOverlapPolicy() {
    return overlapPolicy;
  }

  public FingerprintMode getFingerprintMode() {
    return fingerprintMode;
  }

  public String getRunIdColumn() {
    return runIdColumn;
  }

  public String getAggregationTimeColumn() {
    return aggregationTimeColumn;
  }

  /** Returns the table warehouse location, if configured in the project file. */
  public @Nullable String getWarehouse() {
    return warehouse;
  }

  static IngestSettings fromMap(Map<String, Object> map, String path)
      throws ConfigValidationException {
    Builder builder = builder();
    builder.parallelism(ConfigMaps.optionalInt(map, "parallelism",
        builder.parallelism, path));
    builder.lockTimeoutMs(ConfigMaps.optionalLong(map, "lock_timeout_ms",
        builder.lockTimeoutMs, path));

    String overlap = ConfigMaps.optionalString(map, "overlap_policy");
    if (overlap != null) {
      try {
        builder.overlapPolicy(
            OverlapPolicy.valueOf(overlap.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new ConfigValidationException(path + ".overlap_policy",
            "unknown policy '" + overlap + "'", e);
      }
    }
    String fingerprint = ConfigMaps.optionalString(map, "fingerprint");
    if (fingerprint != null) {
      try {
        builder.fingerprintMode(
            FingerprintMode.valueOf(fingerprint.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new ConfigValidationException(path + ".fingerprint",
            "unknown fingerprint mode '" + fingerprint + "'", e);
      }
    }

    Map<String, Object> retry = ConfigMaps.optionalMap(map, "retry", path);
    String retryPath = path + ".retry";
    builder.maxAttempts(ConfigMaps.optionalInt(retry, "max_attempts",
        builder.maxAttempts, retryPath));
    builder.initialBackoffMs(ConfigMaps.optionalLong(retry,
        "initial_backoff_ms", builder.initialBackoffMs, retryPath));
    builder.maxBackoffMs(ConfigMaps.optionalLong(retry, "max_backoff_ms",
        builder.maxBackoffMs, retryPath));

    Map<String, Object> provenance =
        ConfigMaps.optionalMap(map, "provenance", path);
    String runId = ConfigMaps.optionalString(provenance, "run_id_column");
    if (runId != null) {
      builder.runIdColumn(runId);
    }
    String aggTime =
        ConfigMaps.optionalString(provenance, "aggregation_time_column");
    if (aggTime != null) {
      builder.aggregationTimeColumn(aggTime);
    }
    builder.warehouse(ConfigMaps.optionalString(map, "warehouse"));

    IngestSettings settings = builder.build();
    if (settings.parallelism < 1) {
      throw new ConfigValidationException(path + ".parallelism",
          "must be at least 1");
    }
    if (settings.maxAttempts < 1) {
      throw new ConfigValidationException(retryPath + ".max_attempts",
          "must be at least 1");
    }
    if (settings.runIdColumn.equals(settings.aggregationTimeColumn)) {
      throw new ConfigValidationException(path + ".provenance",
          "provenance columns must have distinct names");
    }
    return settings;
  }

  /**
   * Builder for IngestSettings.
   */
  public static class Builder {
    private int parallelism =
        Math.min(8, Runtime.getRuntime().availableProcessors());
    private int maxAttempts = 4;
    private long initialBackoffMs = 200;
    private long maxBackoffMs = 5000;
    private long lockTimeoutMs = 30000;
    private OverlapPolicy overlapPolicy = OverlapPolicy.ALL_MATCHING;
    private FingerprintMode fingerprintMode = FingerprintMode.METADATA;
    private String runIdColumn = "run_id";
    private String aggregationTimeColumn = "aggregation_time";
    private @Nullable String warehouse;

    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder initialBackoffMs(long initialBackoffMs) {
      this.initialBackoffMs = initialBackoffMs;
      return this;
    }

    public Builder maxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
      return this;
    }

    public Builder lockTimeoutMs(long lockTimeoutMs) {
      this.lockTimeoutMs = lockTimeoutMs;
      return this;
    }

    public Builder overlapPolicy(OverlapPolicy overlapPolicy) {
      this.overlapPolicy = overlapPolicy;
      return this;
    }

    public Builder fingerprintMode(FingerprintMode fingerprintMode) {
      this.fingerprintMode = fingerprintMode;
      return this;
    }

    public Builder runIdColumn(String runIdColumn) {
      this.runIdColumn = runIdColumn;
      return this;
    }

    public Builder aggregationTimeColumn(String aggregationTimeColumn) {
      this.aggregationTimeColumn = aggregationTimeColumn;
      return this;
    }

    public Builder warehouse(@Nullable String warehouse) {
      this.warehouse = warehouse;
      return this;
    }

    public IngestSettings build() {
      return new IngestSettings(this);
    }
  }
}
