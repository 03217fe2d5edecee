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
import org.apache.calcite.adapter.ingest.discovery.WildcardPattern;
import org.apache.calcite.adapter.ingest.join.JoinGraph;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Static checks over a whole project that cannot be made while reading a
 * single field: uniqueness, pattern well-formedness, wildcard naming and join
 * graph consistency. Performs no I/O.
 */
public final class ProjectValidator {
  private ProjectValidator() {
  }

  /**
   * Validates a project.
   *
   * @throws ConfigValidationException naming the first offending field
   * @throws JoinResolutionException if a workflow's joins form a cycle
   */
  public static void validate(ProjectConfig project)
      throws ConfigValidationException, JoinResolutionException {
    if (project.getName() == null || project.getName().trim().isEmpty()) {
      throw new ConfigValidationException("name", "is required");
    }
    if (project.getWorkflows().isEmpty()) {
      throw new ConfigValidationException("workflows",
          "at least one workflow is required");
    }
    IngestSettings settings = project.getSettings();
    Set<String> workflowNames = new HashSet<String>();
    for (int w = 0; w < project.getWorkflows().size(); w++) {
      WorkflowConfig workflow = project.getWorkflows().get(w);
      String path = "workflows[" + w + "]";
      if (!workflowNames.add(workflow.getName())) {
        throw new ConfigValidationException(path + ".name",
            "duplicate workflow name '" + workflow.getName() + "'");
      }
      validateWorkflow(workflow, path, settings);
      JoinGraph.of(workflow);
    }
  }

  private static void validateWorkflow(WorkflowConfig workflow, String path,
      IngestSettings settings) throws ConfigValidationException {
    List<DataCollectionConfig> dcs = workflow.getDataCollections();
    if (dcs.isEmpty()) {
      throw new ConfigValidationException(path + ".data_collections",
          "at least one data collection is required");
    }
    Set<String> tags = new HashSet<String>();
    for (int i = 0; i < dcs.size(); i++) {
      DataCollectionConfig dc = dcs.get(i);
      String dcPath = path + ".data_collections[" + i + "]";
      if (!tags.add(dc.getTag())) {
        throw new ConfigValidationException(dcPath + ".data_collection_tag",
            "duplicate data collection tag '" + dc.getTag() + "'");
      }
      validateScan(dc.getScan(), dcPath + ".config.scan", settings);
    }
    for (int i = 0; i < dcs.size(); i++) {
      DataCollectionConfig dc = dcs.get(i);
      JoinConfig join = dc.getJoin();
      if (join != null) {
        validateJoin(workflow, dc, join,
            path + ".data_collections[" + i + "].config.join");
      }
    }
  }

  private static void validateScan(ScanConfig scan, String path,
      IngestSettings settings) throws ConfigValidationException {
    String paramsPath = path + ".scan_parameters";
    switch (scan.getMode()) {
    case SINGLE:
      String filename = scan.getFilename();
      if (filename == null || filename.trim().isEmpty()) {
        throw new ConfigValidationException(paramsPath + ".filename",
            "is required in single mode");
      }
      break;
    case RECURSIVE:
      RegexConfig regex = scan.getRegex();
      String patternPath = paramsPath + ".regex_config.pattern";
      if (regex == null) {
        throw new ConfigValidationException(patternPath,
            "is required in recursive mode");
      }
      WildcardPattern pattern;
      try {
        pattern = WildcardPattern.compile(regex);
      } catch (IllegalArgumentException e) {
        throw new ConfigValidationException(patternPath, e.getMessage(), e);
      }
      for (String name : pattern.getWildcardNames()) {
        if (name.equals(settings.getRunIdColumn())
            || name.equals(settings.getAggregationTimeColumn())) {
          throw new ConfigValidationException(patternPath, "wildcard '" + name
              + "' collides with a provenance column");
        }
      }
      break;
    default:
      throw new AssertionError(scan.getMode());
    }
  }

  private static void validateJoin(WorkflowConfig workflow,
      DataCollectionConfig dc, JoinConfig join, String path)
      throws ConfigValidationException {
    if (!dc.getType().isTabular()) {
      throw new ConfigValidationException(path,
          "only Table data collections can declare a join");
    }
    if (join.getOnColumns().isEmpty()) {
      throw new ConfigValidationException(path + ".on_columns",
          "at least one join column is required");
    }
    Set<String> seen = new HashSet<String>();
    for (String column : join.getOnColumns()) {
      if (!seen.add(column)) {
        throw new ConfigValidationException(path + ".on_columns",
            "duplicate join column '" + column + "'");
      }
    }
    for (int t = 0; t < join.getWithDc().size(); t++) {
      String target = join.getWithDc().get(t);
      DataCollectionConfig targetDc = workflow.getDataCollection(target);
      if (targetDc == null) {
        throw new ConfigValidationException(path + ".with_dc[" + t + "]",
            "unknown data collection '" + target + "'");
      }
      if (!targetDc.getType().isTabular()) {
        throw new ConfigValidationException(path + ".with_dc[" + t + "]",
            "data collection '" + target + "' is not a Table");
      }
    }
  }
}
