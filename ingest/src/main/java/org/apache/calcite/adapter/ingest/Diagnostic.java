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
package org.apache.calcite.adapter.ingest;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * One problem observed during a scan, keyed by
 * (workflow, data collection, run, file). Coarser problems leave the finer
 * parts of the key null.
 */
public class Diagnostic {
  private final String workflow;
  private final @Nullable String dataCollection;
  private final @Nullable String run;
  private final @Nullable String file;
  private final ErrorKind kind;
  private final String message;

  public Diagnostic(String workflow, @Nullable String dataCollection,
      @Nullable String run, @Nullable String file, ErrorKind kind,
      String message) {
    this.workflow = workflow;
    this.dataCollection = dataCollection;
    this.run = run;
    this.file = file;
    this.kind = kind;
    this.message = message;
  }

  public String getWorkflow() {
    return workflow;
  }

  public @Nullable String getDataCollection() {
    return dataCollection;
  }

  public @Nullable String getRun() {
    return run;
  }

  public @Nullable String getFile() {
    return file;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  @Override public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Diagnostic)) {
      return false;
    }
    Diagnostic that = (Diagnostic) o;
    return workflow.equals(that.workflow)
        && Objects.equals(dataCollection, that.dataCollection)
        && Objects.equals(run, that.run)
        && Objects.equals(file, that.file)
        && kind == that.kind
        && message.equals(that.message);
  }

  @Override public int hashCode() {
    return Objects.hash(workflow, dataCollection, run, file, kind, message);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind).append(" [").append(workflow);
    if (dataCollection != null) {
      sb.append('/').append(dataCollection);
    }
    if (run != null) {
      sb.append('/').append(run);
    }
    if (file != null) {
      sb.append('/').append(file);
    }
    return sb.append("] ").append(message).toString();
  }
}
