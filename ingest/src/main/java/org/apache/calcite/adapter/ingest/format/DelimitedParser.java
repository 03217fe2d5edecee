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

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PushbackReader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses CSV, TSV and other delimited text files.
 *
 * <p>Every record must have as many fields as the header unless
 * {@code truncate_ragged_lines} is set, in which case long records are cut and
 * short ones padded with nulls. Blank lines are skipped, as are lines whose
 * first field starts with the comment prefix. Empty fields and the declared
 * null values read as null. Without a header, columns are named
 * {@code column_1}, {@code column_2}, and so on.
 */
public class DelimitedParser implements FragmentParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(DelimitedParser.class);

  @Override public TableData parse(Path file, TableProperties properties)
      throws SchemaMismatchException {
    List<String> header = null;
    List<String[]> records = new ArrayList<String[]>();
    long line = properties.getSkipRows();
    try (CSVReader reader = open(file, properties)) {
      String[] record;
      while ((record = reader.readNext()) != null) {
        line = reader.getLinesRead();
        if (isBlank(record) || isComment(record, properties.getCommentPrefix())) {
          continue;
        }
        if (header == null) {
          if (properties.hasHeader()) {
            header = checkHeader(file, record);
            continue;
          }
          header = new ArrayList<String>();
          for (int i = 1; i <= record.length; i++) {
            header.add("column_" + i);
          }
        }
        records.add(fit(file, record, header.size(), line, properties));
      }
    } catch (CharacterCodingException e) {
      throw new SchemaMismatchException(file + ": content is not valid "
          + properties.getEncoding().name() + " near line " + (line + 1), e);
    } catch (CsvValidationException e) {
      throw new SchemaMismatchException(file + ": malformed record near line "
          + (line + 1) + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new SchemaMismatchException(file + ": cannot read: " + e, e);
    }
    if (header == null) {
      if (properties.hasHeader()) {
        throw new SchemaMismatchException(file + ": missing header (file is empty)");
      }
      return TableData.empty();
    }
    LOGGER.debug("Read {} record(s) with {} column(s) from {}", records.size(),
        header.size(), file);
    return toTable(file, header, records, properties);
  }

  private static CSVReader open(Path file, TableProperties properties)
      throws IOException {
    CharsetDecoder decoder = properties.getEncoding().newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    InputStream in = Files.newInputStream(file);
    PushbackReader reader = new PushbackReader(new InputStreamReader(in, decoder));
    try {
      // a leading byte order mark is not part of the first field
      int first = reader.read();
      if (first != -1 && first != '\uFEFF') {
        reader.unread(first);
      }
    } catch (IOException e) {
      reader.close();
      throw e;
    }
    return new CSVReaderBuilder(reader)
        .withSkipLines(properties.getSkipRows())
        .withCSVParser(new CSVParserBuilder()
            .withSeparator(properties.getDelimiter())
            .withQuoteChar(properties.getQuoteChar())
            .withEscapeChar('\0')
            .build())
        .build();
  }

  private static List<String> checkHeader(Path file, String[] record)
      throws SchemaMismatchException {
    List<String> header = new ArrayList<String>(record.length);
    Set<String> seen = new HashSet<String>();
    for (int i = 0; i < record.length; i++) {
      String name = record[i].trim();
      if (name.isEmpty()) {
        throw new SchemaMismatchException(file + ": header field "
            + (i + 1) + " is empty");
      }
      if (!seen.add(name)) {
        throw new SchemaMismatchException(file + ": duplicate column '"
            + name + "' in header");
      }
      header.add(name);
    }
    return header;
  }

  private static String[] fit(Path file, String[] record, int width, long line,
      TableProperties properties) throws SchemaMismatchException {
    if (record.length == width) {
      return record;
    }
    if (!properties.isTruncateRaggedLines()) {
      throw new SchemaMismatchException(file + ": line " + line + " has "
          + record.length + " field(s), expected " + width);
    }
    String[] fitted = new String[width];
    System.arraycopy(record, 0, fitted, 0, Math.min(width, record.length));
    return fitted;
  }

  private static boolean isBlank(String[] record) {
    return record.length == 0
        || (record.length == 1 && record[0].trim().isEmpty());
  }

  private static boolean isComment(String[] record, @Nullable String prefix) {
    return prefix != null && !prefix.isEmpty() && record.length > 0
        && record[0].startsWith(prefix);
  }

  private static TableData toTable(Path file, List<String> header,
      List<String[]> records, TableProperties properties)
      throws SchemaMismatchException {
    Set<String> nullValues = new HashSet<String>(properties.getNullValues());
    Map<String, ColumnType> overrides = properties.getSchemaOverrides();
    List<Column> columns = new ArrayList<Column>(header.size());
    for (int c = 0; c < header.size(); c++) {
      String name = header.get(c);
      List<@Nullable String> raw = new ArrayList<@Nullable String>(records.size());
      for (String[] record : records) {
        String v = record[c];
        raw.add(v == null || v.isEmpty() || nullValues.contains(v) ? null : v);
      }
      ColumnType type = overrides.get(name);
      if (type == null) {
        type = properties.isInferSchema()
            ? TypeInference.infer(raw)
            : ColumnType.STRING;
      }
      List<@Nullable Object> values = new ArrayList<@Nullable Object>(raw.size());
      for (int r = 0; r < raw.size(); r++) {
        try {
          values.add(type.coerce(raw.get(r)));
        } catch (IllegalArgumentException e) {
          throw new SchemaMismatchException(file + ": value '" + raw.get(r)
              + "' in column '" + name + "' (record " + (r + 1)
              + ") is not a " + type, e);
        }
      }
      columns.add(new Column(name, type, values));
    }
    return TableData.of(columns, records.size());
  }
}
