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
import org.apache.calcite.adapter.ingest.JoinResolutionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads a project file (YAML or JSON) into a validated {@link ProjectConfig}.
 *
 * <p>Loading is all-or-nothing: either every check passes or a
 * {@link ConfigValidationException} / {@link JoinResolutionException} is
 * thrown, before any run directory is touched.
 */
public class ProjectConfigLoader {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ProjectConfigLoader.class);
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(new YAMLFactory());

  private final Function<String, @Nullable String> env;

  /** Creates a loader that expands locations against the process environment. */
  public ProjectConfigLoader() {
    this(System::getenv);
  }

  public ProjectConfigLoader(Function<String, @Nullable String> env) {
    this.env = env;
  }

  /** Loads and validates a project file. */
  public ProjectConfig load(Path file)
      throws IOException, ConfigValidationException, JoinResolutionException {
    LOGGER.info("Loading project configuration from {}", file);
    try (InputStream in = Files.newInputStream(file)) {
      return load(in);
    }
  }

  /** Loads and validates a project document from a stream. */
  public ProjectConfig load(InputStream in)
      throws IOException, ConfigValidationException, JoinResolutionException {
    Object doc;
    try {
      doc = YAML_MAPPER.readValue(in, Object.class);
    } catch (JsonProcessingException e) {
      throw new ConfigValidationException("<document>",
          "not a valid YAML or JSON document: " + e.getOriginalMessage(), e);
    }
    return fromDocument(doc);
  }

  /** Parses and validates a project document held in a string. */
  public ProjectConfig parse(String text)
      throws ConfigValidationException, JoinResolutionException {
    Object doc;
    try {
      doc = YAML_MAPPER.readValue(text, Object.class);
    } catch (JsonProcessingException e) {
      throw new ConfigValidationException("<document>",
          "not a valid YAML or JSON document: " + e.getOriginalMessage(), e);
    }
    return fromDocument(doc);
  }

  @SuppressWarnings("unchecked")
  private ProjectConfig fromDocument(@Nullable Object doc)
      throws ConfigValidationException, JoinResolutionException {
    if (!(doc instanceof Map)) {
      throw new ConfigValidationException("<document>",
          "expected a mapping at the top level");
    }
    return fromMap((Map<String, Object>) doc);
  }

  /** Builds and validates a project from an already parsed document. */
  public ProjectConfig fromMap(Map<String, Object> map)
      throws ConfigValidationException, JoinResolutionException {
    String name = ConfigMaps.requireString(map, "name", "project");
    IngestSettings settings = IngestSettings.fromMap(
        ConfigMaps.optionalMap(map, "ingest", "project"), "ingest");

    List<Map<String, Object>> list = ConfigMaps.mapList(map, "workflows", "project");
    WorkflowConfig[] workflows = new WorkflowConfig[list.size()];
    for (int i = 0; i < list.size(); i++) {
      workflows[i] = WorkflowConfig.fromMap(list.get(i),
          "workflows[" + i + "]", env);
    }
    ProjectConfig project =
        new ProjectConfig(name, Arrays.asList(workflows), settings);
    ProjectValidator.validate(project);
    LOGGER.debug("Project '{}' validated: {} workflow(s)", name,
        workflows.length);
    return project;
  }
}
