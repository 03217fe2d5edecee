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

import java.util.List;
import java.util.Map;

/**
 * File match pattern with its wildcard definitions.
 *
 * <p>Wildcards are either inline named groups, {@code (?<sample>[^/]+)}, or
 * {@code {sample}} placeholders whose regular expression is declared in
 * {@code wildcards}:
 *
 * <pre>{@code
 * regex_config:
 *   pattern: "{sample}/stats\\.tsv"
 *   wildcards:
 *     - name: sample
 *       wildcard_regex: "S\\d+"
 * }</pre>
 */
public class RegexConfig {
  private final String pattern;
  private final List<Wildcard> wildcards;

  public RegexConfig(String pattern, List<Wildcard> wildcards) {
    this.pattern = pattern;
    this.wildcards = ImmutableList.copyOf(wildcards);
  }

  public static RegexConfig of(String pattern) {
    return new RegexConfig(pattern, ImmutableList.<Wildcard>of());
  }

  public String getPattern() {
    return pattern;
  }

  public List<Wildcard> getWildcards() {
    return wildcards;
  }

  static RegexConfig fromMap(Map<String, Object> map, String path)
      throws ConfigValidationException {
    String pattern = ConfigMaps.requireString(map, "pattern", path);
    ImmutableList.Builder<Wildcard> wildcards = ImmutableList.builder();
    List<Map<String, Object>> list = ConfigMaps.mapList(map, "wildcards", path);
    for (int i = 0; i < list.size(); i++) {
      String wPath = path + ".wildcards[" + i + "]";
      wildcards.add(
          new Wildcard(ConfigMaps.requireString(list.get(i), "name", wPath),
              ConfigMaps.requireString(list.get(i), "wildcard_regex", wPath)));
    }
    return new RegexConfig(pattern, wildcards.build());
  }

  /** Definition of a {@code {name}} placeholder. */
  public static class Wildcard {
    private final String name;
    private final String regex;

    public Wildcard(String name, String regex) {
      this.name = name;
      this.regex = regex;
    }

    public String getName() {
      return name;
    }

    public String getRegex() {
      return regex;
    }
  }
}
