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
import org.apache.calcite.adapter.ingest.discovery.WildcardPattern;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Where the runs of a workflow live and how run directories are recognized.
 *
 * <pre>{@code
 * data_location:
 *   structure: sequencing-runs
 *   runs_regex: "run_(?P<run_id>\\d+)"
 *   locations:
 *     - "{DATA_ROOT}/project_a"
 * }</pre>
 *
 * <p>{@code runs_regex} accepts Java {@code (?<name>...)} and Python
 * {@code (?P<name>...)} group spellings; group names may contain underscores.
 *
 * <p>{@code {NAME}} references to upper-case environment variables in a
 * location are expanded while loading.
 */
public class DataLocationConfig {
  private static final Pattern ENV_REFERENCE = Pattern.compile("\\{([A-Z0-9_]+)\\}");

  /** Directory layout of a data location. */
  public enum Structure {
    /** Each child directory matching {@code runs_regex} is one run. */
    SEQUENCING_RUNS,
    /** The location itself is a single run. */
    FLAT;

    static Structure fromValue(String value, String path)
        throws ConfigValidationException {
      switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "sequencing-runs":
      case "sequencing_runs":
        return SEQUENCING_RUNS;
      case "flat":
      case "direct-folder":
        return FLAT;
      default:
        throw new ConfigValidationException(path,
            "unknown structure '" + value
                + "' (expected sequencing-runs or flat)");
      }
    }
  }

  private final Structure structure;
  private final @Nullable WildcardPattern runsRegex;
  private final List<String> locations;

  private DataLocationConfig(Structure structure, @Nullable WildcardPattern runsRegex,
      List<String> locations) {
    this.structure = structure;
    this.runsRegex = runsRegex;
    this.locations = ImmutableList.copyOf(locations);
  }

  public static DataLocationConfig of(Structure structure,
      @Nullable String runsRegex, List<String> locations) {
    return new DataLocationConfig(structure,
        runsRegex == null ? null : WildcardPattern.compile(runsRegex), locations);
  }

  public Structure getStructure() {
    return structure;
  }

  /** Returns the run directory pattern; null for {@link Structure#FLAT}. */
  public @Nullable WildcardPattern getRunsRegex() {
    return runsRegex;
  }

  public List<String> getLocations() {
    return locations;
  }

  static DataLocationConfig fromMap(Map<String, Object> map, String path,
      Function<String, @Nullable String> env)
      throws ConfigValidationException {
    String structureValue = ConfigMaps.optionalString(map, "structure");
    Structure structure = structureValue == null
        ? Structure.SEQUENCING_RUNS
        : Structure.fromValue(structureValue, path + ".structure");

    WildcardPattern runsRegex = null;
    String regex = ConfigMaps.optionalString(map, "runs_regex");
    if (regex != null) {
      try {
        runsRegex = WildcardPattern.compile(regex);
      } catch (PatternSyntaxException e) {
        throw new ConfigValidationException(path + ".runs_regex",
            "invalid regular expression: " + e.getDescription(), e);
      } catch (IllegalArgumentException e) {
        throw new ConfigValidationException(path + ".runs_regex",
            "invalid regular expression: " + e.getMessage(), e);
      }
    } else if (structure == Structure.SEQUENCING_RUNS) {
      throw new ConfigValidationException(path + ".runs_regex",
          "is required when structure is sequencing-runs");
    }

    List<String> raw = ConfigMaps.stringList(map, "locations", path);
    if (raw.isEmpty()) {
      throw new ConfigValidationException(path + ".locations",
          "at least one location is required");
    }
    ImmutableList.Builder<String> locations = ImmutableList.builder();
    for (int i = 0; i < raw.size(); i++) {
      locations.add(expand(raw.get(i), path + ".locations[" + i + "]", env));
    }
    return new DataLocationConfig(structure, runsRegex, locations.build());
  }

  static String expand(String location, String path,
      Function<String, @Nullable String> env) throws ConfigValidationException {
    Matcher m = ENV_REFERENCE.matcher(location);
    StringBuilder sb = new StringBuilder();
    int last = 0;
    while (m.find()) {
      String value = env.apply(m.group(1));
      if (value == null) {
        throw new ConfigValidationException(path,
            "environment variable " + m.group(1) + " is not set");
      }
      sb.append(location, last, m.start()).append(value);
      last = m.end();
    }
    sb.append(location.substring(last));
    return sb.toString();
  }
}
