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
package org.apache.calcite.adapter.ingest.join;

import org.apache.calcite.adapter.ingest.JoinResolutionException;
import org.apache.calcite.adapter.ingest.config.DataCollectionConfig;
import org.apache.calcite.adapter.ingest.config.JoinConfig;
import org.apache.calcite.adapter.ingest.config.WorkflowConfig;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Directed graph of the joins declared in a workflow.
 *
 * <p>An edge runs from a join target to the collection that declares the
 * join, so that a topological order materializes every target before the
 * collections joined with it. Ties are broken by declaration order, which
 * makes the order deterministic.
 */
public final class JoinGraph {
  private final List<DataCollectionConfig> executionOrder;
  private final Map<String, List<String>> sourcesByTarget;

  private JoinGraph(List<DataCollectionConfig> executionOrder,
      Map<String, List<String>> sourcesByTarget) {
    this.executionOrder = ImmutableList.copyOf(executionOrder);
    this.sourcesByTarget = sourcesByTarget;
  }

  /**
   * Builds the join graph of a workflow.
   *
   * @throws JoinResolutionException if a join targets an unknown collection,
   *     the collection itself, or the joins form a cycle
   */
  public static JoinGraph of(WorkflowConfig workflow)
      throws JoinResolutionException {
    List<DataCollectionConfig> dcs = workflow.getDataCollections();
    Map<String, Integer> index = new HashMap<String, Integer>();
    for (int i = 0; i < dcs.size(); i++) {
      index.put(dcs.get(i).getTag(), i);
    }

    int[] inDegree = new int[dcs.size()];
    Map<String, List<String>> sourcesByTarget =
        new HashMap<String, List<String>>();
    for (int i = 0; i < dcs.size(); i++) {
      DataCollectionConfig dc = dcs.get(i);
      JoinConfig join = dc.getJoin();
      if (join == null) {
        continue;
      }
      for (String target : new LinkedHashSet<String>(join.getWithDc())) {
        if (target.equals(dc.getTag())) {
          throw new JoinResolutionException("Data collection '" + dc.getTag()
              + "' of workflow '" + workflow.getName() + "' joins itself");
        }
        if (!index.containsKey(target)) {
          throw new JoinResolutionException("Data collection '" + dc.getTag()
              + "' joins unknown data collection '" + target
              + "' in workflow '" + workflow.getName() + "'");
        }
        inDegree[i]++;
        List<String> sources = sourcesByTarget.get(target);
        if (sources == null) {
          sources = new ArrayList<String>();
          sourcesByTarget.put(target, sources);
        }
        sources.add(dc.getTag());
      }
    }

    PriorityQueue<Integer> ready = new PriorityQueue<Integer>();
    for (int i = 0; i < dcs.size(); i++) {
      if (inDegree[i] == 0) {
        ready.add(i);
      }
    }
    List<DataCollectionConfig> order = new ArrayList<DataCollectionConfig>();
    while (!ready.isEmpty()) {
      DataCollectionConfig dc = dcs.get(ready.poll());
      order.add(dc);
      List<String> sources = sourcesByTarget.get(dc.getTag());
      if (sources == null) {
        continue;
      }
      for (String source : sources) {
        int s = index.get(source);
        if (--inDegree[s] == 0) {
          ready.add(s);
        }
      }
    }
    if (order.size() < dcs.size()) {
      Set<String> cyclic = new LinkedHashSet<String>();
      for (int i = 0; i < dcs.size(); i++) {
        if (inDegree[i] > 0) {
          cyclic.add(dcs.get(i).getTag());
        }
      }
      throw new JoinResolutionException("Join cycle in workflow '"
          + workflow.getName() + "' involving " + cyclic);
    }
    return new JoinGraph(order, sourcesByTarget);
  }

  /** Returns the collections in the order they must be materialized. */
  public List<DataCollectionConfig> executionOrder() {
    return executionOrder;
  }

  /** Returns the tags of the collections that declare a join with {@code tag}. */
  public List<String> sourcesOf(String tag) {
    List<String> sources = sourcesByTarget.get(tag);
    return sources == null
        ? ImmutableList.<String>of()
        : ImmutableList.copyOf(sources);
  }
}
