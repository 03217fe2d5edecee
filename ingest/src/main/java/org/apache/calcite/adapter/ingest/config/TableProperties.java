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
import org.apache.calcite.adapter.ingest.format.ColumnType;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parse options of a {@code Table} data collection.
 *
 * <p>Options may be written directly under {@code dc_specific_properties} or
 * inside its {@code polars_kwargs} block; the latter wins when both are
 * present.
 *
 * <pre>{@code
 * dc_specific_properties:
 *   format: TSV
 *   polars_kwargs:
 *     separator: "\t"
 *     has_header: true
 *     null_values: ["NA", "."]
 *     schema_overrides: {depth: Float64}
 * }</pre>
 */
public class TableProperties implements DataCollectionProperties {
  private final TableFormat format;
  private final char delimiter;
  private final boolean hasHeader;
  private final Charset encoding;
  private final int skipRows;
  private final List<String> nullValues;
  private final @Nullable String commentPrefix;
  private final char quoteChar;
  private final boolean truncateRaggedLines;
  private final boolean inferSchema;
  private final Map<String, ColumnType> schemaOverrides;
  private final @Nullable String sheetName;
  private final List<String> requiredColumns;
  private final @Nullable String indexExtension;

  private TableProperties(Builder builder) {
    this.format = builder.format;
    this.delimiter = builder.delimiter != null
        ? builder.delimiter
        : builder.format.getDefaultDelimiter();
    this.hasHeader = builder.hasHeader;
    this.encoding = builder.encoding;
    this.skipRows = builder.skipRows;
    this.nullValues = ImmutableList.copyOf(builder.nullValues);
    this.commentPrefix = builder.commentPrefix;
    this.quoteChar = builder.quoteChar;
    this.truncateRaggedLines = builder.truncateRaggedLines;
    this.inferSchema = builder.inferSchema;
    this.schemaOverrides = ImmutableMap.copyOf(builder.schemaOverrides);
    this.sheetName = builder.sheetName;
    this.requiredColumns = ImmutableList.copyOf(builder.requiredColumns);
    this.indexExtension = builder.indexExtension;
  }

  @Override public DataCollectionType getType() {
    return DataCollectionType.TABLE;
  }

  @Override public @Nullable String getIndexExtension() {
    return indexExtension;
  }

  public TableFormat getFormat() {
    return format;
  }

  public char getDelimiter() {
    return delimiter;
  }

  public boolean hasHeader() {
    return hasHeader;
  }

  public Charset getEncoding() {
    return encoding;
  }

  public int getSkipRows() {
    return skipRows;
  }

  /** Returns the field values read as null, in addition to empty fields. */
  public List<String> getNullValues() {
    return nullValues;
  }

  public @Nullable String getCommentPrefix() {
    return commentPrefix;
  }

  public char getQuoteChar() {
    return quoteChar;
  }

  /** Returns whether rows longer than the header are truncated instead of rejected. */
  public boolean isTruncateRaggedLines() {
    return truncateRaggedLines;
  }

  /** Returns whether column types are inferred; if false every column is a string. */
  public boolean isInferSchema() {
    return inferSchema;
  }

  public Map<String, ColumnType> getSchemaOverrides() {
    return schemaOverrides;
  }

  public @Nullable String getSheetName() {
    return sheetName;
  }

  /** Returns columns that must be present in every file, beyond keep and join columns. */
  public List<String> getRequiredColumns() {
    return requiredColumns;
  }

  public static Builder builder(TableFormat format) {
    return new Builder(format);
  }

  @SuppressWarnings("unchecked")
  static TableProperties fromMap(Map<String, Object> raw, String path)
      throws ConfigValidationException {
    Map<String, Object> map = new LinkedHashMap<String, Object>(raw);
    Object kwargs = map.remove("polars_kwargs");
    if (kwargs instanceof Map) {
      map.putAll((Map<String, Object>) kwargs);
    } else if (kwargs != null) {
      throw new ConfigValidationException(path + ".polars_kwargs",
          "expected a mapping");
    }

    String formatValue = ConfigMaps.optionalString(map, "format");
    TableFormat format = formatValue == null
        ? TableFormat.CSV
        : TableFormat.fromValue(formatValue, path + ".format");
    Builder builder = builder(format);

    String sep = ConfigMaps.optionalString(map, "separator");
    if (sep == null) {
      sep = ConfigMaps.optionalString(map, "delimiter");
    }
    if (sep != null) {
      builder.delimiter(singleChar(sep, path + ".separator"));
    }
    builder.hasHeader(ConfigMaps.optionalBoolean(map, "has_header", true, path));
    String encoding = ConfigMaps.optionalString(map, "encoding");
    if (encoding != null) {
      builder.encoding(charset(encoding, path + ".encoding"));
    }
    builder.skipRows(ConfigMaps.optionalInt(map, "skip_rows", 0, path));
    builder.nullValues(ConfigMaps.stringList(map, "null_values", path));
    builder.commentPrefix(ConfigMaps.optionalString(map, "comment_prefix"));
    String quote = ConfigMaps.optionalString(map, "quote_char");
    if (quote != null) {
      builder.quoteChar(singleChar(quote, path + ".quote_char"));
    }
    builder.truncateRaggedLines(
        ConfigMaps.optionalBoolean(map, "truncate_ragged_lines", false, path));
    boolean infer = ConfigMaps.optionalBoolean(map, "infer_schema", true, path);
    if (map.containsKey("infer_schema_length")
        && ConfigMaps.optionalLong(map, "infer_schema_length", 1, path) == 0) {
      infer = false;
    }
    builder.inferSchema(infer);

    Map<String, Object> overrides =
        ConfigMaps.optionalMap(map, "schema_overrides", path);
    if (overrides.isEmpty()) {
      overrides = ConfigMaps.optionalMap(map, "dtypes", path);
    }
    for (Map.Entry<String, Object> e : overrides.entrySet()) {
      try {
        builder.schemaOverride(e.getKey(),
            ColumnType.fromName(String.valueOf(e.getValue())));
      } catch (IllegalArgumentException ex) {
        throw new ConfigValidationException(
            path + ".schema_overrides." + e.getKey(), ex.getMessage(), ex);
      }
    }
    builder.sheetName(ConfigMaps.optionalString(map, "sheet_name"));
    builder.requiredColumns(ConfigMaps.stringList(map, "required_columns", path));
    builder.indexExtension(ConfigMaps.optionalString(map, "index_extension"));
    return builder.build();
  }

  private static char singleChar(String value, String path)
      throws ConfigValidationException {
    String v = value;
    if (v.equals("\\t")) {
      v = "\t";
    }
    if (v.length() != 1) {
      throw new ConfigValidationException(path,
          "expected a single character but got '" + value + "'");
    }
    return v.charAt(0);
  }

  private static Charset charset(String value, String path)
      throws ConfigValidationException {
    String v = value.trim().toLowerCase(Locale.ROOT);
    if (v.equals("utf8") || v.equals("utf8-lossy")) {
      return StandardCharsets.UTF_8;
    }
    try {
      return Charset.forName(value.trim());
    } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
      throw new ConfigValidationException(path,
          "unsupported encoding '" + value + "'", e);
    }
  }

  /**
   * Builder for TableProperties.
   */
  public static class Builder {
    private final TableFormat format;
    private @Nullable Character delimiter;
    private boolean hasHeader = true;
    private Charset encoding = StandardCharsets.UTF_8;
    private int skipRows;
    private List<String> nullValues = ImmutableList.of();
    private @Nullable String commentPrefix;
    private char quoteChar = '"';
    private boolean truncateRaggedLines;
    private boolean inferSchema = true;
    private final Map<String, ColumnType> schemaOverrides =
        new LinkedHashMap<String, ColumnType>();
    private @Nullable String sheetName;
    private List<String> requiredColumns = ImmutableList.of();
    private @Nullable String indexExtension;

    Builder(TableFormat format) {
      this.format = format;
    }

    public Builder delimiter(char delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public Builder hasHeader(boolean hasHeader) {
      this.hasHeader = hasHeader;
      return this;
    }

    public Builder encoding(Charset encoding) {
      this.encoding = encoding;
      return this;
    }

    public Builder skipRows(int skipRows) {
      this.skipRows = skipRows;
      return this;
    }

    public Builder nullValues(List<String> nullValues) {
      this.nullValues = nullValues;
      return this;
    }

    public Builder commentPrefix(@Nullable String commentPrefix) {
      this.commentPrefix = commentPrefix;
      return this;
    }

    public Builder quoteChar(char quoteChar) {
      this.quoteChar = quoteChar;
      return this;
    }

    public Builder truncateRaggedLines(boolean truncateRaggedLines) {
      this.truncateRaggedLines = truncateRaggedLines;
      return this;
    }

    public Builder inferSchema(boolean inferSchema) {
      this.inferSchema = inferSchema;
      return this;
    }

    public Builder schemaOverride(String column, ColumnType type) {
      this.schemaOverrides.put(column, type);
      return this;
    }

    public Builder sheetName(@Nullable String sheetName) {
      this.sheetName = sheetName;
      return this;
    }

    public Builder requiredColumns(List<String> requiredColumns) {
      this.requiredColumns = requiredColumns;
      return this;
    }

    public Builder indexExtension(@Nullable String indexExtension) {
      this.indexExtension = indexExtension;
      return this;
    }

    public TableProperties build() {
      return new TableProperties(this);
    }
  }
}
