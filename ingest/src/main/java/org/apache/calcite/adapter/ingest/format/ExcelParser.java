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

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the first sheet (or the sheet named by {@code sheet_name}) of an
 * {@code .xlsx} or {@code .xls} workbook. Column types are derived from the
 * cell types, widening on conflict.
 */
public class ExcelParser implements FragmentParser {
  private final DataFormatter formatter = new DataFormatter();

  @Override public TableData parse(Path file, TableProperties properties)
      throws SchemaMismatchException {
    try (InputStream in = Files.newInputStream(file);
         Workbook workbook = WorkbookFactory.create(in)) {
      String sheetName = properties.getSheetName();
      Sheet sheet = sheetName != null && !sheetName.isEmpty()
          ? workbook.getSheet(sheetName)
          : workbook.getSheetAt(0);
      if (sheet == null) {
        throw new SchemaMismatchException(file + ": sheet '" + sheetName
            + "' not found");
      }
      return read(file, sheet, properties);
    } catch (IOException | RuntimeException e) {
      throw new SchemaMismatchException(file + ": cannot read workbook: " + e, e);
    }
  }

  private TableData read(Path file, Sheet sheet, TableProperties properties)
      throws SchemaMismatchException {
    int first = sheet.getFirstRowNum() + properties.getSkipRows();
    int last = sheet.getLastRowNum();
    List<String> header = new ArrayList<String>();
    int dataStart = first;
    if (properties.hasHeader()) {
      Row headerRow = first <= last ? sheet.getRow(first) : null;
      if (headerRow == null) {
        throw new SchemaMismatchException(file + ": missing header row");
      }
      Set<String> seen = new HashSet<String>();
      for (int c = 0; c < headerRow.getLastCellNum(); c++) {
        Cell cell = headerRow.getCell(c);
        String name = cell == null ? "" : formatter.formatCellValue(cell).trim();
        if (name.isEmpty()) {
          throw new SchemaMismatchException(file + ": header cell "
              + (c + 1) + " is empty");
        }
        if (!seen.add(name)) {
          throw new SchemaMismatchException(file + ": duplicate column '"
              + name + "' in header");
        }
        header.add(name);
      }
      dataStart = first + 1;
    }

    List<@Nullable Object[]> rows = new ArrayList<@Nullable Object[]>();
    int width = header.size();
    for (int r = dataStart; r <= last; r++) {
      Row row = sheet.getRow(r);
      if (row == null) {
        continue;
      }
      if (!properties.hasHeader()) {
        width = Math.max(width, row.getLastCellNum());
      }
      Object[] values = new Object[Math.max(width, 0)];
      boolean any = false;
      for (int c = 0; c < values.length; c++) {
        values[c] = cellValue(row.getCell(c));
        any |= values[c] != null;
      }
      if (properties.hasHeader() && row.getLastCellNum() > width
          && !properties.isTruncateRaggedLines()
          && cellValue(row.getCell(row.getLastCellNum() - 1)) != null) {
        throw new SchemaMismatchException(file + ": row " + (r + 1)
            + " has values beyond the header");
      }
      if (any) {
        rows.add(values);
      }
    }
    if (!properties.hasHeader()) {
      for (int c = 1; c <= width; c++) {
        header.add("column_" + c);
      }
    }

    List<Column> columns = new ArrayList<Column>(header.size());
    for (int c = 0; c < header.size(); c++) {
      String name = header.get(c);
      ColumnType type = properties.getSchemaOverrides().get(name);
      if (type == null) {
        for (Object[] row : rows) {
          Object v = c < row.length ? row[c] : null;
          type = TypeInference.merge(type, v);
        }
        if (type == null) {
          type = ColumnType.STRING;
        }
      }
      List<@Nullable Object> values = new ArrayList<@Nullable Object>(rows.size());
      for (Object[] row : rows) {
        Object v = c < row.length ? row[c] : null;
        try {
          values.add(type.coerce(v));
        } catch (IllegalArgumentException e) {
          throw new SchemaMismatchException(file + ": value '" + v
              + "' in column '" + name + "' is not a " + type, e);
        }
      }
      columns.add(new Column(name, type, values));
    }
    return TableData.of(columns, rows.size());
  }

  private @Nullable Object cellValue(@Nullable Cell cell) {
    if (cell == null) {
      return null;
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    switch (type) {
    case STRING:
      String s = cell.getStringCellValue();
      return s.isEmpty() ? null : s;
    case NUMERIC:
      if (DateUtil.isCellDateFormatted(cell)) {
        return cell.getLocalDateTimeCellValue();
      }
      double num = cell.getNumericCellValue();
      if (num == Math.floor(num) && !Double.isInfinite(num)
          && Math.abs(num) < 1e15) {
        return (long) num;
      }
      return num;
    case BOOLEAN:
      return cell.getBooleanCellValue();
    default:
      return null;
    }
  }
}
