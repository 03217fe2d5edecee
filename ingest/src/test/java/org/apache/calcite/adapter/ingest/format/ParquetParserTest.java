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
import org.apache.calcite.adapter.ingest.config.TableFormat;
import org.apache.calcite.adapter.ingest.config.TableProperties;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link ParquetParser}.
 */
@Tag("unit")
public class ParquetParserTest {

  @TempDir
  Path tempDir;

  private static final String SCHEMA = "{\"type\": \"record\", \"name\": \"Sample\", \"fields\": ["
      + "  {\"name\": \"id\", \"type\": \"int\"},"
      + "  {\"name\": \"score\", \"type\": [\"null\", \"double\"], \"default\": null},"
      + "  {\"name\": \"label\", \"type\": \"string\"},"
      + "  {\"name\": \"seen\", \"type\": {\"type\": \"long\", \"logicalType\": \"timestamp-millis\"}}"
      + "]}";

  private static final LocalDateTime SEEN = LocalDateTime.of(2024, 3, 1, 12, 30);

  @SuppressWarnings("deprecation")
  private Path writeSample(int rows) throws Exception {
    Schema avroSchema = new Schema.Parser().parse(SCHEMA);
    Path file = tempDir.resolve("sample.parquet");
    try (ParquetWriter<GenericRecord> writer =
             AvroParquetWriter
                 .<GenericRecord>builder(
                     new org.apache.hadoop.fs.Path(file.toAbsolutePath().toString()))
                 .withSchema(avroSchema)
                 .withCompressionCodec(CompressionCodecName.UNCOMPRESSED)
                 .build()) {
      for (int i = 0; i < rows; i++) {
        GenericRecord record = new GenericData.Record(avroSchema);
        record.put("id", i + 1);
        record.put("score", i == 1 ? null : i * 0.5);
        record.put("label", "L" + i);
        record.put("seen", SEEN.toInstant(ZoneOffset.UTC).toEpochMilli());
        writer.write(record);
      }
    }
    return file;
  }

  @Test void testReadsTypedColumns() throws Exception {
    Path file = writeSample(3);
    TableData data = new ParquetParser().parse(file,
        TableProperties.builder(TableFormat.PARQUET).build());
    assertEquals(3, data.getRowCount());
    assertEquals(Arrays.asList("id", "score", "label", "seen"),
        data.getColumnNames());
    assertEquals(ColumnType.LONG, data.getColumn("id").getType());
    assertEquals(ColumnType.DOUBLE, data.getColumn("score").getType());
    assertEquals(ColumnType.STRING, data.getColumn("label").getType());
    assertEquals(ColumnType.TIMESTAMP, data.getColumn("seen").getType());
    assertEquals(3L, data.getColumn("id").get(2));
    assertNull(data.getColumn("score").get(1));
    assertEquals("L2", data.getColumn("label").get(2));
    assertEquals(SEEN, data.getColumn("seen").get(0));
  }

  @Test void testOverrideCastsColumn() throws Exception {
    Path file = writeSample(2);
    TableData data = new ParquetParser().parse(file,
        TableProperties.builder(TableFormat.PARQUET)
            .schemaOverride("id", ColumnType.STRING).build());
    assertEquals(ColumnType.STRING, data.getColumn("id").getType());
    assertEquals("1", data.getColumn("id").get(0));
  }

  @Test void testCorruptFile() throws Exception {
    Path file = tempDir.resolve("broken.parquet");
    Files.write(file, "not parquet at all".getBytes());
    assertThrows(SchemaMismatchException.class,
        () -> new ParquetParser().parse(file,
            TableProperties.builder(TableFormat.PARQUET).build()));
  }
}
