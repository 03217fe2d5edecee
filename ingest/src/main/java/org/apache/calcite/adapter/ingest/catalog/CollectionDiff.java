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

import org.apache.calcite.adapter.ingest.discovery.MatchedFile;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Classification of the files matched for one data collection against the
 * catalog records of the previous scans.
 */
public class CollectionDiff {

  /** How a matched file relates to its catalog record. */
  public enum Change {
    /** No record yet. */
    NEW,
    /** Fingerprint or wildcard values differ from the record. */
    CHANGED,
    /** Registered and identical to the record. */
    UNCHANGED,
    /** Rejected earlier and identical; not retried. */
    UNCHANGED_REJECTED,
    /** Record was stale; the file is back. */
    RESTORED;

    /** Whether a file with this change must be parsed (or rejected) again. */
    public boolean needsProcessing() {
      return this == NEW || this == CHANGED || this == RESTORED;
    }
  }

  /** One matched file with its classification. */
  public static class Entry {
    private final MatchedFile file;
    private final FileKey key;
    private final Fingerprint fingerprint;
    private final Change change;
    private final @Nullable FileRecord previous;

    Entry(MatchedFile file, FileKey key, Fingerprint fingerprint,
        Change change, @Nullable FileRecord previous) {
      this.file = file;
      this.key = key;
      this.fingerprint = fingerprint;
      this.change = change;
      this.previous = previous;
    }

    public MatchedFile getFile() {
      return file;
    }

    public FileKey getKey() {
      return key;
    }

    public Fingerprint getFingerprint() {
      return fingerprint;
    }

    public Change getChange() {
      return change;
    }

    public @Nullable FileRecord getPrevious() {
      return previous;
    }

    /** Whether the previous record contributed rows to the collection. */
    public boolean wasRegistered() {
      return previous != null
          && previous.getStatus() == FileRecord.Status.REGISTERED;
    }

    @Override public String toString() {
      return key + " " + change;
    }
  }

  private final String workflow;
  private final String dataCollection;
  private final List<Entry> entries;
  private final List<FileRecord> stale;

  CollectionDiff(String workflow, String dataCollection, List<Entry> entries,
      List<FileRecord> stale) {
    this.workflow = workflow;
    this.dataCollection = dataCollection;
    this.entries = ImmutableList.copyOf(entries);
    this.stale = ImmutableList.copyOf(stale);
  }

  public String getWorkflow() {
    return workflow;
  }

  public String getDataCollection() {
    return dataCollection;
  }

  public List<Entry> getEntries() {
    return entries;
  }

  /** Returns records that were live but whose files were not seen. */
  public List<FileRecord> getStale() {
    return stale;
  }

  /** Returns the entries that must be parsed or rejected in this scan. */
  public List<Entry> toProcess() {
    List<Entry> list = new ArrayList<>();
    for (Entry entry : entries) {
      if (entry.getChange().needsProcessing()) {
        list.add(entry);
      }
    }
    return list;
  }

  public int count(Change change) {
    int n = 0;
    for (Entry entry : entries) {
      if (entry.getChange() == change) {
        n++;
      }
    }
    return n;
  }

  @Override public String toString() {
    return workflow + "/" + dataCollection + ": new=" + count(Change.NEW)
        + ", changed=" + count(Change.CHANGED)
        + ", restored=" + count(Change.RESTORED)
        + ", unchanged=" + (count(Change.UNCHANGED)
            + count(Change.UNCHANGED_REJECTED))
        + ", stale=" + stale.size();
  }
}
