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

import org.apache.calcite.adapter.ingest.storage.IcebergTableStore;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Factory for {@link IngestSchema}, for use in a Calcite model:
 *
 * <blockquote><pre>
 * {
 *   "name": "ingest",
 *   "type": "custom",
 *   "factory": "org.apache.calcite.adapter.ingest.IngestSchemaFactory",
 *   "operand": { "warehouse": "/data/warehouse", "workflow": "rnaseq" }
 * }</pre></blockquote>
 *
 * <p>{@code warehouse} is required; {@code workflow} is optional.
 */
public class IngestSchemaFactory implements SchemaFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(IngestSchemaFactory.class);

  /** Public singleton, per factory contract. */
  public static final IngestSchemaFactory INSTANCE = new IngestSchemaFactory();

  @Override public Schema create(SchemaPlus parentSchema, String name,
      Map<String, Object> operand) {
    String warehouse = (String) operand.get("warehouse");
    if (warehouse == null) {
      throw new IllegalArgumentException("warehouse parameter is required");
    }
    String workflow = (String) operand.get("workflow");
    LOGGER.debug("Creating schema {} over warehouse {} (workflow {})", name,
        warehouse, workflow);
    return new IngestSchema(new IcebergTableStore(warehouse), workflow);
  }
}
