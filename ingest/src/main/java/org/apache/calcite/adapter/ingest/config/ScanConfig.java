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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * How the files of a data collection are found inside a run
 * ({@code config.scan}).
 */
public class ScanConfig {

  /** Scan mode. */
  public enum Mode {
    /** One file at a fixed path relative to each run. */
    SINGLE,
    /** Every file under the run directory is tested against a pattern. */
    RECURSIVE
  }

  private final Mode mode;
  private final @Nullable String filename;
  private final @Nullable RegexConfig regex;
  private final int maxDepth;
  private final List<String> ignore;

  private ScanConfig(Mode mode, @Nullable String filename,
      @Nullable RegexConfig regex, int maxDepth, List<String> ignore) {
    this.mode = mode;
    this.filename = filename;
    this.regex = regex;
    this.maxDepth = maxDepth;
    this.ignore = ImmutableList.copyOf(ignore);
  }

  public static ScanConfig single(String filename) {
    return new ScanConfig(Mode.SINGLE, filename, null, Integer.MAX_VALUE,
        ImmutableList.<String>of());
  }

  public static ScanConfig recursive(RegexConfig regex) {
    return recursive(regex, Integer.MAX_VALUE, ImmutableList.<String>of());
  }

  public static ScanConfig recursive(RegexConfig regex, int maxDepth,
      List<String> ignore) {
    return new ScanConfig(Mode.RECURSIVE, null, regex, maxDepth, ignore);
  }

  public Mode getMode() {
    return mode;
  }

  /** Returns the expected file path in {@link Mode#SINGLE} mode. */
  public @Nullable String getFilename() {
    return filename;
  }

  /** Returns the match pattern in {@link Mode#RECURSIVE} mode. */
  public @Nullable RegexConfig getRegex() {
    return regex;
  }

  /** Returns the maximum directory depth below the run root that is walked. */
  public int getMaxDepth() {
    return maxDepth;
  }

  /** Returns directory names skipped while walking. */
  public List<String> getIgnore() {
    return ignore;
  }

  static ScanConfig fromMap(Map<String, Object> map, String path)
      throws ConfigValidationException {
    String modeValue = ConfigMaps.requireString(map, "mode", path);
    Map<String, Object> params =
        ConfigMaps.requireMap(map, "scan_parameters", path);
    String paramsPath = path + ".scan_parameters";
    switch (modeValue.trim().toLowerCase(Locale.ROOT)) {
    case "single":
      return single(ConfigMaps.requireString(params, "filename", paramsPath));
    case "recursive":
      RegexConfig regex = RegexConfig.fromMap(
          ConfigMaps.requireMap(params, "regex_config", paramsPath),
          paramsPath + ".regex_config");
      int maxDepth = ConfigMaps.optionalInt(params, "max_depth",
          Integer.MAX_VALUE, paramsPath);
      if (maxDepth < 1) {
        throw new ConfigValidationException(paramsPath + ".max_depth",
            "must be at least 1");
      }
      return recursive(regex, maxDepth,
          ConfigMaps.stringList(params, "ignore", paramsPath));
    default:
      throw new ConfigValidationException(path + ".mode",
          "unknown scan mode '" + modeValue + "' (expected single or recursive)");
    }
  }
}
