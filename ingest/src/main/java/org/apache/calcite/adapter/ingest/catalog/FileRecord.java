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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog entry of one matched file.
 */
public class FileRecord {

  /** Registration state of a file. */
  public enum Status {
    /** Parsed successfully; contributes rows to its collection. */
    REGISTERED,
    /** Matched but failed wildcard extraction or parsing; see the error. */
    REJECTED,
    /** No longer found by the latest complete scan. */
    STALE
  }

  private final FileKey key;
  private final Map<String, String> wildcards;
  private final Fingerprint fingerprint;
  private final Status status;
  private final Instant registeredAt;
  private final @Nullable String error;

  public FileRecord(FileKey key, Map<String, String> wildcards,
      Fingerprint fingerprint, Status status, Instant registeredAt,
      @Nullable String error) {
    this.key = key;
    this.wildcards = ImmutableMap.copyOf(wildcards);
    this.fingerprint = fingerprint;
    this.status = status;
    this.registeredAt = registeredAt;
    this.error = error;
  }

  public FileKey getKey() {
    return key;
  }

  public Map<String, String> getWildcards() {
    return wildcards;
  }

  public Fingerprint getFingerprint() {
    return fingerprint;
  }

  public Status getStatus() {
    return status;
  }

  public Instant getRegisteredAt() {
    return registeredAt;
  }

  /** Returns the last error, for rejected files. */
  public @Nullable String getError() {
    return error;
  }

  public FileRecord withStatus(Status newStatus) {
    return new FileRecord(key, wildcards, fingerprint, newStatus, registeredAt,
        error);
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FileRecord)) {
      return false;
    }
    FileRecord that = (FileRecord) o;
    return key.equals(that.key)
        && wildcards.equals(that.wildcards)
        && fingerprint.equals(that.fingerprint)
        && status == that.status
        && registeredAt.equals(that.registeredAt)
        && Objects.equals(error, that.error);
  }

  @Override public int hashCode() {
    return Objects.hash(key, fingerprint, status);
  }

  @Override public String toString() {
    return key + " " + status + (error == null ? "" : " (" + error + ")");
  }
}
