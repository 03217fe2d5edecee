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
import org.apache.calcite.adapter.ingest.config.RegexConfig;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File match pattern compiled from a {@link RegexConfig}.
 *
 * <p>Three spellings of a wildcard group are accepted: Java named groups
 * {@code (?<sample>...)}, Python named groups {@code (?P<sample>...)} and
 * {@code {sample}} placeholders resolved against the declared wildcards. All
 * of them are rewritten to generated Java group names, so wildcard names are
 * free to contain underscores. A placeholder repeated in the pattern becomes a
 * back-reference to its first occurrence.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class WildcardPattern {
  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final String source;
  private final Pattern pattern;
  /** Wildcard name to generated Java group name, in declaration order. */
  private final Map<String, String> groups;

  private WildcardPattern(String source, Pattern pattern,
      Map<String, String> groups) {
    this.source = source;
    this.pattern = pattern;
    this.groups = groups;
  }

  /**
   * Compiles a pattern.
   *
   * @throws IllegalArgumentException if the pattern is not a valid regular
   *     expression, declares a group twice, or references a placeholder that
   *     has no wildcard definition
   */
  public static WildcardPattern compile(RegexConfig config) {
    Map<String, String> definitions = new LinkedHashMap<String, String>();
    for (RegexConfig.Wildcard w : config.getWildcards()) {
      if (!IDENTIFIER.matcher(w.getName()).matches()) {
        throw new IllegalArgumentException(
            "invalid wildcard name '" + w.getName() + "'");
      }
      if (definitions.put(w.getName(), w.getRegex()) != null) {
        throw new IllegalArgumentException(
            "wildcard '" + w.getName() + "' is defined twice");
      }
      Pattern.compile(w.getRegex());
    }

    String src = config.getPattern();
    Map<String, String> groups = new LinkedHashMap<String, String>();
    StringBuilder out = new StringBuilder();
    boolean inClass = false;
    int i = 0;
    while (i < src.length()) {
      char c = src.charAt(i);
      if (c == '\\' && i + 1 < src.length()) {
        out.append(c).append(src.charAt(i + 1));
        i += 2;
        continue;
      }
      if (inClass) {
        if (c == ']') {
          inClass = false;
        }
        out.append(c);
        i++;
        continue;
      }
      if (c == '[') {
        inClass = true;
        out.append(c);
        i++;
        continue;
      }
      if (src.startsWith("(?P=", i)) {
        int end = src.indexOf(')', i);
        String name = end < 0 ? "" : src.substring(i + 4, end);
        String group = groups.get(name);
        if (group == null) {
          throw new IllegalArgumentException(
              "back-reference to unknown group '" + name + "'");
        }
        out.append("\\k<").append(group).append('>');
        i = end + 1;
        continue;
      }
      if (src.startsWith("(?<", i) || src.startsWith("(?P<", i)) {
        int nameStart = src.indexOf('<', i) + 1;
        char next = nameStart < src.length() ? src.charAt(nameStart) : 0;
        if (next != '=' && next != '!') {
          int nameEnd = src.indexOf('>', nameStart);
          if (nameEnd < 0) {
            throw new IllegalArgumentException(
                "unterminated group name at index " + i);
          }
          String name = src.substring(nameStart, nameEnd);
          out.append("(?<").append(declare(groups, name)).append('>');
          i = nameEnd + 1;
          continue;
        }
      }
      if (c == '{') {
        int end = src.indexOf('}', i);
        if (end > 0) {
          String name = src.substring(i + 1, end);
          if (IDENTIFIER.matcher(name).matches()) {
            String existing = groups.get(name);
            if (existing != null) {
              out.append("\\k<").append(existing).append('>');
            } else {
              String regex = definitions.get(name);
              if (regex == null) {
                throw new IllegalArgumentException("placeholder {" + name
                    + "} has no wildcard definition");
              }
              out.append("(?<").append(declare(groups, name)).append('>')
                  .append(regex).append(')');
            }
            i = end + 1;
            continue;
          }
        }
      }
      out.append(c);
      i++;
    }
    for (String name : definitions.keySet()) {
      if (!groups.containsKey(name)) {
        throw new IllegalArgumentException("wildcard '" + name
            + "' is defined but not used in the pattern");
      }
    }
    return new WildcardPattern(src, Pattern.compile(out.toString()), groups);
  }

  /** Compiles a pattern that uses named groups only, no placeholders. */
  public static WildcardPattern compile(String pattern) {
    return compile(RegexConfig.of(pattern));
  }

  private static String declare(Map<String, String> groups, String name) {
    if (!IDENTIFIER.matcher(name).matches()) {
      throw new IllegalArgumentException("invalid group name '" + name + "'");
    }
    if (groups.containsKey(name)) {
      throw new IllegalArgumentException("group '" + name + "' declared twice");
    }
    String generated = "w" + groups.size();
    groups.put(name, generated);
    return generated;
  }

  /** Returns the pattern as written in configuration. */
  public String getSource() {
    return source;
  }

  /** Returns the wildcard names in declaration order. */
  public List<String> getWildcardNames() {
    return ImmutableList.copyOf(groups.keySet());
  }

  /** Returns whether the whole of {@code path} matches this pattern. */
  public boolean matches(String path) {
    return pattern.matcher(path).matches();
  }

  /**
   * Matches a prefix of {@code input}, as {@link Matcher#lookingAt()} does.
   *
   * @return the captured text of each named group, null for a group that did
   *     not participate; or null if the input does not match
   */
  public @Nullable Map<String, @Nullable String> lookingAt(String input) {
    Matcher m = pattern.matcher(input);
    if (!m.lookingAt()) {
      return null;
    }
    Map<String, @Nullable String> values = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : groups.entrySet()) {
      values.put(e.getKey(), m.group(e.getValue()));
    }
    return values;
  }

  /**
   * Extracts the wildcard values of a path that matches this pattern.
   *
   * @throws WildcardExtractionException if a declared group captured nothing
   * @throws IllegalArgumentException if the path does not match
   */
  public Map<String, String> extract(String path)
      throws WildcardExtractionException {
    Matcher m = matcher(path);
    Map<String, String> values = new LinkedHashMap<String, String>();
    for (Map.Entry<String, String> e : groups.entrySet()) {
      String value = m.group(e.getValue());
      if (value == null || value.isEmpty()) {
        throw new WildcardExtractionException(path, e.getKey());
      }
      values.put(e.getKey(), value);
    }
    return values;
  }

  /**
   * Derives the path template of a matching path: each wildcard capture is
   * replaced by its {@code {name}} placeholder. Rendering the template with
   * the extracted values yields the path again.
   */
  public String toTemplate(String path) {
    Matcher m = matcher(path);
    StringBuilder sb = new StringBuilder();
    int last = 0;
    for (int g = 0; g < groups.size(); g++) {
      String name = nameOfGroup(g);
      int start = m.start("w" + g);
      if (start < last) {
        continue;
      }
      sb.append(path, last, start).append('{').append(name).append('}');
      last = m.end("w" + g);
    }
    sb.append(path.substring(last));
    return sb.toString();
  }

  /** Substitutes {@code {name}} placeholders of a template. */
  public static String render(String template, Map<String, String> values) {
    String result = template;
    for (Map.Entry<String, String> e : values.entrySet()) {
      result = result.replace("{" + e.getKey() + "}", e.getValue());
    }
    return result;
  }

  private Matcher matcher(String path) {
    Matcher m = pattern.matcher(path);
    if (!m.matches()) {
      throw new IllegalArgumentException(
          "path '" + path + "' does not match " + source);
    }
    return m;
  }

  private @Nullable String nameOfGroup(int index) {
    String generated = "w" + index;
    for (Map.Entry<String, String> e : groups.entrySet()) {
      if (e.getValue().equals(generated)) {
        return e.getKey();
      }
    }
    return null;
  }

  @Override public String toString() {
    return source;
  }
}
