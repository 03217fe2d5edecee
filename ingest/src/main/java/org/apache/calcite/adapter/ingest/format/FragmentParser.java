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
package org.apache.calcite.adapter.ingest.format;

import org.apache.calcite.adapter.ingest.SchemaMismatchException;
import org.apache.calcite.adapter.ingest.config.TableProperties;

import java.nio.file.Path;

/**
 * Converts one file into a typed {@link TableData} fragment.
 *
 * <p>Implementations are stateless and may be shared between threads.
 */
public interface FragmentParser {

  /**
   * Parses a file.
   *
   * @param file file to read
   * @param properties parse options of the data collection
   * @return parsed fragment; may have zero rows
   * @throws SchemaMismatchException if the file cannot be read or its
   *     content does not fit the options
   */
  TableData parse(Path file, TableProperties properties)
      throws SchemaMismatchException;
}
