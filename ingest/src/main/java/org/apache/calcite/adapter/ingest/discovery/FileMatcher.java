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
import org.apache.calcite.adapter.ingest.WildcardExtractionException;
import org.apache.calcite.adapter.ingest.config.DataCollectionConfig;
import org.apache.calcite.adapter.ingest.config.RegexConfig;
import org.apache.calcite.adapter.ingest.config.ScanConfig;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Finds the files of one data collection inside a run.
 *
 * <p>In single mode the collection expects one file at a fixed path relative
 * to the run; its absence is a {@link ErrorKind#RUN_DISCOVERY} warning. In
 * recursive mode the run directory is walked lazily, one directory listing at
 * a time, honoring {@code max_depth} and the ignored directory names. A file
 * is accepted when the pattern matches the whole of one of, in order: its
 * path relative to the run, that path prefixed by the run directory name, or
 * its file name. Wildcards are extracted from the first accepted form.
 *
 * <p>Files ending with {@code .<index_extension>} are index/sidecar files: they
 * are never yielded as primary matches, but are attached to the file they
 * accompany.
 */
public class FileMatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(FileMatcher.class);

  private final String workflow;
  private final DataCollectionConfig dataCollection;
  private final DiagnosticsReport diagnostics;
  private final @Nullable WildcardPattern pattern;
  private final @Nullable String sidecarSuffix;

  public FileMatcher(String workflow, DataCollectionConfig dataCollection,
      DiagnosticsReport diagnostics) {
    this.workflow = workflow;
    this.dataCollection = dataCollection;
    this.diagnostics = diagnostics;
    RegexConfig regex = dataCollection.getScan().getRegex();
    this.pattern = regex == null ? null : WildcardPattern.compile(regex);
    String ext = dataCollection.getProperties().getIndexExtension();
    this.sidecarSuffix = ext == null || ext.isEmpty()
        ? null
        : (ext.startsWith(".") ? ext : "." + ext);
  }

  public DataCollectionConfig getDataCollection() {
    return dataCollection;
  }

  /**
   * Returns whether this collection reads one file at an absolute path,
   * independent of the discovered runs.
   */
  public boolean isStandalone() {
    String filename = dataCollection.getScan().getFilename();
    return dataCollection.getScan().getMode() == ScanConfig.Mode.SINGLE
        && filename != null && Paths.get(filename).isAbsolute();
  }

  /** Returns the pseudo-run of a standalone collection. */
  public RunCandidate standaloneRun() {
    String filename = dataCollection.getScan().getFilename();
    if (!isStandalone() || filename == null) {
      throw new IllegalStateException(dataCollection.getTag()
          + " is not a standalone single-file collection");
    }
    return RunCandidate.singleFile(workflow, dataCollection.getTag(),
        Paths.get(filename));
  }

  /** Returns whether a file name denotes an index/sidecar file. */
  public boolean isSidecar(String fileName) {
    return sidecarSuffix != null && fileName.endsWith(sidecarSuffix);
  }

  /** Returns a lazy sequence of the files of this collection in a run. */
  public Iterator<MatchedFile> match(RunCandidate run) {
    switch (dataCollection.getScan().getMode()) {
    case SINGLE:
      MatchedFile single = matchSingle(run);
      return single == null
          ? Collections.<MatchedFile>emptyIterator()
          : Iterators.singletonIterator(single);
    case RECURSIVE:
      return new RecursiveIterator(run);
    default:
      throw new AssertionError(dataCollection.getScan().getMode());
    }
  }

  private @Nullable MatchedFile matchSingle(RunCandidate run) {
    String filename = dataCollection.getScan().getFilename();
    Path file = Paths.get(String.valueOf(filename));
    if (!file.isAbsolute()) {
      file = run.getRoot().resolve(file);
    }
    if (!Files.isRegularFile(file)) {
      diagnostics.add(workflow, dataCollection.getTag(), run.getRunId(),
          file.toString(), ErrorKind.RUN_DISCOVERY,
          "Expected file " + filename + " not found");
      return null;
    }
    return new MatchedFile(dataCollection.getTag(), run, file,
        relativize(run.getRoot(), file), ImmutableMap.<String, String>of(),
        sidecarOf(file));
  }

  /** Tests one file of a run against the pattern; null if not accepted. */
  @Nullable MatchedFile accept(RunCandidate run, Path file) {
    Path fileNamePath = file.getFileName();
    if (pattern == null || fileNamePath == null) {
      return null;
    }
    String fileName = fileNamePath.toString();
    if (isSidecar(fileName)) {
      return null;
    }
    String relative = relativize(run.getRoot(), file);
    String candidate = null;
    List<String> forms = new ArrayList<String>(3);
    forms.add(relative);
    forms.add(run.getDirectoryName() + "/" + relative);
    forms.add(fileName);
    for (String form : forms) {
      if (pattern.matches(form)) {
        candidate = form;
        break;
      }
    }
    if (candidate == null) {
      return null;
    }
    try {
      return new MatchedFile(dataCollection.getTag(), run, file, relative,
          pattern.extract(candidate), sidecarOf(file));
    } catch (WildcardExtractionException e) {
      diagnostics.add(workflow, dataCollection.getTag(), run.getRunId(),
          relative, e);
      return MatchedFile.rejected(dataCollection.getTag(), run, file, relative, e);
    }
  }

  private @Nullable Path sidecarOf(Path file) {
    if (sidecarSuffix == null) {
      return null;
    }
    Path sidecar = file.resolveSibling(file.getFileName() + sidecarSuffix);
    return Files.isRegularFile(sidecar) ? sidecar : null;
  }

  static String relativize(Path root, Path file) {
    return root.relativize(file).toString().replace('\\', '/');
  }

  /** Depth-first walk holding at most one directory listing in memory. */
  private class RecursiveIterator extends AbstractIterator<MatchedFile> {
    private final RunCandidate run;
    private final Deque<Path> directories = new ArrayDeque<Path>();
    private final Set<String> ignore;
    private final int maxDepth;
    private Iterator<Path> files = Collections.<Path>emptyIterator();

    RecursiveIterator(RunCandidate run) {
      this.run = run;
      this.ignore = new HashSet<String>(dataCollection.getScan().getIgnore());
      this.maxDepth = dataCollection.getScan().getMaxDepth();
      directories.push(run.getRoot());
    }

    @Override protected @Nullable MatchedFile computeNext() {
      while (true) {
        while (files.hasNext()) {
          MatchedFile match = accept(run, files.next());
          if (match != null) {
            return match;
          }
        }
        if (directories.isEmpty()) {
          return endOfData();
        }
        files = list(directories.pop());
      }
    }

    private Iterator<Path> list(Path dir) {
      int depth = run.getRoot().relativize(dir).getNameCount();
      if (dir.equals(run.getRoot())) {
        depth = 0;
      }
      List<Path> entries = new ArrayList<Path>();
      try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
        for (Path entry : stream) {
          entries.add(entry);
        }
      } catch (IOException e) {
        diagnostics.add(workflow, dataCollection.getTag(), run.getRunId(),
            relativize(run.getRoot(), dir), ErrorKind.RUN_DISCOVERY,
            "Cannot list directory: " + e);
        return Collections.<Path>emptyIterator();
      }
      Collections.sort(entries);
      List<Path> regular = new ArrayList<Path>();
      List<Path> subdirs = new ArrayList<Path>();
      for (Path entry : entries) {
        Path name = entry.getFileName();
        if (Files.isDirectory(entry)) {
          if (depth + 2 <= maxDepth && name != null
              && !ignore.contains(name.toString())) {
            subdirs.add(entry);
          }
        } else if (Files.isRegularFile(entry) && depth + 1 <= maxDepth) {
          regular.add(entry);
        }
      }
      for (int i = subdirs.size() - 1; i >= 0; i--) {
        directories.push(subdirs.get(i));
      }
      LOGGER.trace("Listed {}: {} file(s), {} subdirectories", dir,
          regular.size(), subdirs.size());
      return regular.iterator();
    }
  }
}
