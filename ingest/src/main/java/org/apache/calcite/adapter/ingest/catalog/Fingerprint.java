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

import org.apache.calcite.adapter.ingest.config.IngestSettings;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.Objects;

/**
 * Change detector of a file: a SHA-256 digest plus the size and modification
 * time it was computed at.
 */
public final class Fingerprint {
  private final String hash;
  private final long size;
  private final Instant modifiedAt;

  public Fingerprint(String hash, long size, Instant modifiedAt) {
    this.hash = hash;
    this.size = size;
    this.modifiedAt = modifiedAt;
  }

  /**
   * Computes the fingerprint of a file. In {@code METADATA} mode the digest
   * covers the file name, size and modification time; in {@code CONTENT} mode
   * it covers the bytes.
   */
  public static Fingerprint of(Path file, IngestSettings.FingerprintMode mode)
      throws IOException {
    BasicFileAttributes attrs =
        Files.readAttributes(file, BasicFileAttributes.class);
    long size = attrs.size();
    Instant modified = attrs.lastModifiedTime().toInstant();
    HashCode hash;
    switch (mode) {
    case CONTENT:
      hash = MoreFiles.asByteSource(file).hash(Hashing.sha256());
      break;
    case METADATA:
      hash = Hashing.sha256().newHasher()
          .putString(String.valueOf(file.getFileName()), StandardCharsets.UTF_8)
          .putLong(size)
          .putLong(modified.toEpochMilli())
          .hash();
      break;
    default:
      throw new AssertionError(mode);
    }
    return new Fingerprint(hash.toString(), size, modified);
  }

  public String getHash() {
    return hash;
  }

  public long getSize() {
    return size;
  }

  public Instant getModifiedAt() {
    return modifiedAt;
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof Fingerprint
        && hash.equals(((Fingerprint) o).hash)
        && size == ((Fingerprint) o).size;
  }

  @Override public int hashCode() {
    return Objects.hash(hash, size);
  }

  @Override public String toString() {
    return hash.substring(0, Math.min(12, hash.length())) + "/" + size;
  }
}
