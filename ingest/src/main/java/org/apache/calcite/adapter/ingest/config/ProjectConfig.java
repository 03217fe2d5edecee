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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Validated project description: the root of the declarative schema.
 *
 * <p>Instances are produced by {@link ProjectConfigLoader}, which guarantees
 * that every invariant checked by {@link ProjectValidator} holds.
 */
public class ProjectConfig {
  private final String name;
  private final List<WorkflowConfig> workflows;
  private final IngestSettings settings;

  public ProjectConfig(String name, List<WorkflowConfig> workflows,
      IngestSettings settings) {
    this.name = name;
    this.workflows = ImmutableList.copyOf(workflows);
    this.settings = settings;
  }

  public String getName() {
    return name;
  }

  public List<WorkflowConfig> getWorkflows() {
    return workflows;
  }

  public IngestSettings getSettings() {
    return settings;
  }

  /** Returns the workflow with the given name, or null. */
  public @Nullable WorkflowConfig getWorkflow(String workflowName) {
    for (WorkflowConfig workflow : workflows) {
      if (workflow.getName().equals(workflowName)) {
        return workflow;
      }
    }
    return null;
  }

  /** Returns a copy of this project using different runtime settings. */
  public ProjectConfig withSettings(IngestSettings newSettings) {
    return new ProjectConfig(name, workflows, newSettings);
  }
}
