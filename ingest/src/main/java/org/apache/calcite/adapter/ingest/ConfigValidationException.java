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

/**
 * Thrown when a project configuration cannot be turned into a valid
 * project description. Carries the path of the offending field, for example
 * {@code workflows[0].data_collections[2].config.scan.mode}.
 */
public class ConfigValidationException extends IngestException {
  private static final long serialVersionUID = 1L;

  private final String fieldPath;

  public ConfigValidationException(String fieldPath, String message) {
    super(ErrorKind.CONFIG_VALIDATION, fieldPath + ": " + message);
    this.fieldPath = fieldPath;
  }

  public ConfigValidationException(String fieldPath, String message,
      Throwable cause) {
    super(ErrorKind.CONFIG_VALIDATION, fieldPath + ": " + message, cause);
    this.fieldPath = fieldPath;
  }

  public String getFieldPath() {
    return fieldPath;
  }
}
