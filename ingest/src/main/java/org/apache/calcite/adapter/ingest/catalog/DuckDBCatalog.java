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
package org.apache.calcite.adapter.ingest.catalog;

import org.apache.calcite.adapter.ingest.CatalogSyncException;
import org.apache.calcite.adapter.ingest.Diagnostic;
import org.apache.calcite.adapter.ingest.ErrorKind;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DuckDB-based catalog. One database file holds the runs, files and scan
 * diagnostics of every workflow of a project.
 */
public class DuckDBCatalog implements Catalog {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBCatalog.class);

  /** SQL resource path prefix. */
  private static final String SQL_RESOURCE_PATH =
      "org/apache/calcite/adapter/ingest/catalog/";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final TypeReference<Map<String, String>> STRING_MAP =
      new TypeReference<Map<String, String>>() { };

  private static final TypeReference<List<Map<String, String>>> MAP_LIST =
      new TypeReference<List<Map<String, String>>>() { };

  /** Path to the DuckDB database file. */
  private final String dbPath;

  private @Nullable Connection connection;

  /** Guards the connection; DuckDB statements on one connection are serialized. */
  private final Object connectionLock = new Object();

  private DuckDBCatalog(String dbPath) {
    this.dbPath = dbPath;
  }

  /**
   * Opens (creating if necessary) the catalog stored in the given file.
   *
   * @param dbFile DuckDB database file
   * @return Catalog
   * @throws CatalogSyncException if the database cannot be opened or its
   *     tables cannot be created
   */
  public static DuckDBCatalog open(Path dbFile) throws CatalogSyncException {
    Path abs = dbFile.toAbsolutePath();
    Path parent = abs.getParent();
    try {
      if (parent != null) {
        Files.createDirectories(parent);
      }
    } catch (IOException e) {
      throw new CatalogSyncException("Failed to create directory for catalog "
          + abs, e);
    }
    DuckDBCatalog catalog = new DuckDBCatalog(abs.toString());
    try {
      catalog.executeSqlResource("create_catalog.sql");
    } catch (SQLException e) {
      throw new CatalogSyncException("Failed to initialize catalog at "
          + abs + ": " + e.getMessage(), e);
    }
    LOGGER.info("Initialized DuckDB catalog at {}", abs);
    return catalog;
  }

  private Connection getConnection() throws SQLException {
    synchronized (connectionLock) {
      if (connection == null || connection.isClosed()) {
        String jdbcUrl = "jdbc:duckdb:" + dbPath;
        connection = DriverManager.getConnection(jdbcUrl);
        LOGGER.debug("Opened DuckDB connection to {}", dbPath);
      }
      return connection;
    }
  }

  /**
   * Executes SQL, retrying while the database is busy.
   */
  private void executeWithRetry(String sql) throws SQLException {
    int maxRetries = 3;
    int retryDelayMs = 100;

    for (int attempt = 1; attempt <= maxRetries; attempt++) {
      try {
        synchronized (connectionLock) {
          try (Statement stmt = getConnection().createStatement()) {
            stmt.execute(sql);
          }
        }
        return;
      } catch (SQLException e) {
        if (attempt == maxRetries) {
          throw e;
        }
        LOGGER.debug("Database busy, retrying ({}/{}): {}", attempt, maxRetries,
            e.getMessage());
        try {
          Thread.sleep((long) retryDelayMs * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }

  private String loadSqlResource(String resourceName) throws SQLException {
    String resourcePath = SQL_RESOURCE_PATH + resourceName;
    try (InputStream is = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
      if (is == null) {
        throw new SQLException("SQL resource not found: " + resourcePath);
      }
      try (BufferedReader reader = new BufferedReader(
          new InputStreamReader(is, StandardCharsets.UTF_8))) {
        StringBuilder sb = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
          sb.append(line).append("\n");
        }
        return sb.toString();
      }
    } catch (IOException e) {
      throw new SQLException("Failed to load SQL resource: " + resourcePath, e);
    }
  }

  private void executeSqlResource(String resourceName) throws SQLException {
    String sql = loadSqlResource(resourceName);
    LOGGER.debug("Executing SQL resource {}", resourceName);
    for (String statement : sql.split(";")) {
      StringBuilder sqlBuilder = new StringBuilder();
      for (String line : statement.trim().split("\n")) {
        String trimmedLine = line.trim();
        if (!trimmedLine.isEmpty() && !trimmedLine.startsWith("--")) {
          sqlBuilder.append(line).append("\n");
        }
      }
      String cleanSql = sqlBuilder.toString().trim();
      if (!cleanSql.isEmpty()) {
        executeWithRetry(cleanSql);
      }
    }
  }

  // ===== Runs =====

  @Override public List<RunRecord> runs(String workflow)
      throws CatalogSyncException {
    String sql = "SELECT run_id, location, status, first_seen FROM ingest_run "
        + "WHERE workflow = ? ORDER BY run_id";
    List<RunRecord> result = new ArrayList<>();
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, workflow);
        try (ResultSet rs = stmt.executeQuery()) {
          while (rs.next()) {
            result.add(
                new RunRecord(workflow, rs.getString("run_id"),
                    rs.getString("location"),
                    RunRecord.Status.valueOf(rs.getString("status")),
                    Instant.ofEpochMilli(rs.getLong("first_seen"))));
          }
        }
      } catch (SQLException e) {
        throw new CatalogSyncException("Error reading runs of " + workflow
            + ": " + e.getMessage(), e);
      }
    }
    return result;
  }

  @Override public void upsertRun(RunRecord run) throws CatalogSyncException {
    String sql = "INSERT INTO ingest_run "
        + "(workflow, run_id, location, status, first_seen) "
        + "VALUES (?, ?, ?, ?, ?) "
        + "ON CONFLICT (workflow, run_id) DO UPDATE SET "
        + "location = EXCLUDED.location, "
        + "status = EXCLUDED.status, "
        + "first_seen = EXCLUDED.first_seen";
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, run.getWorkflow());
        stmt.setString(2, run.getRunId());
        stmt.setString(3, run.getLocation());
        stmt.setString(4, run.getStatus().name());
        stmt.setLong(5, run.getFirstSeen().toEpochMilli());
        stmt.executeUpdate();
      } catch (SQLException e) {
        throw new CatalogSyncException("Error recording run " + run + ": "
            + e.getMessage(), e);
      }
    }
    LOGGER.debug("Recorded run {}", run);
  }

  // ===== Files =====

  @Override public List<FileRecord> files(String workflow,
      String dataCollection) throws CatalogSyncException {
    String sql = "SELECT * FROM ingest_file "
        + "WHERE workflow = ? AND data_collection = ? "
        + "ORDER BY run_id, location";
    List<FileRecord> result = new ArrayList<>();
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, workflow);
        stmt.setString(2, dataCollection);
        try (ResultSet rs = stmt.executeQuery()) {
          while (rs.next()) {
            result.add(toFileRecord(rs));
          }
        }
      } catch (SQLException e) {
        throw new CatalogSyncException("Error reading files of " + workflow
            + "/" + dataCollection + ": " + e.getMessage(), e);
      }
    }
    return result;
  }

  @Override public @Nullable FileRecord file(FileKey key)
      throws CatalogSyncException {
    String sql = "SELECT * FROM ingest_file WHERE workflow = ? "
        + "AND data_collection = ? AND run_id = ? AND location = ?";
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, key.getWorkflow());
        stmt.setString(2, key.getDataCollection());
        stmt.setString(3, key.getRunId());
        stmt.setString(4, key.getLocation());
        try (ResultSet rs = stmt.executeQuery()) {
          return rs.next() ? toFileRecord(rs) : null;
        }
      } catch (SQLException e) {
        throw new CatalogSyncException("Error reading file " + key + ": "
            + e.getMessage(), e);
      }
    }
  }

  @Override public void upsertFile(FileRecord file) throws CatalogSyncException {
    String sql = "INSERT INTO ingest_file "
        + "(workflow, data_collection, run_id, location, wildcards, fingerprint, "
        + "size, modified_at, status, registered_at, error) "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
        + "ON CONFLICT (workflow, data_collection, run_id, location) DO UPDATE SET "
        + "wildcards = EXCLUDED.wildcards, "
        + "fingerprint = EXCLUDED.fingerprint, "
        + "size = EXCLUDED.size, "
        + "modified_at = EXCLUDED.modified_at, "
        + "status = EXCLUDED.status, "
        + "registered_at = EXCLUDED.registered_at, "
        + "error = EXCLUDED.error";
    FileKey key = file.getKey();
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, key.getWorkflow());
        stmt.setString(2, key.getDataCollection());
        stmt.setString(3, key.getRunId());
        stmt.setString(4, key.getLocation());
        stmt.setString(5, toJson(file.getWildcards()));
        stmt.setString(6, file.getFingerprint().getHash());
        stmt.setLong(7, file.getFingerprint().getSize());
        stmt.setLong(8, file.getFingerprint().getModifiedAt().toEpochMilli());
        stmt.setString(9, file.getStatus().name());
        stmt.setLong(10, file.getRegisteredAt().toEpochMilli());
        stmt.setString(11, file.getError());
        stmt.executeUpdate();
      } catch (SQLException e) {
        throw new CatalogSyncException("Error recording file " + key + ": "
            + e.getMessage(), e);
      }
    }
    LOGGER.debug("Recorded file {}", file);
  }

  private static FileRecord toFileRecord(ResultSet rs)
      throws SQLException, CatalogSyncException {
    FileKey key =
        new FileKey(rs.getString("workflow"), rs.getString("data_collection"),
            rs.getString("run_id"), rs.getString("location"));
    Map<String, String> wildcards;
    try {
      wildcards = MAPPER.readValue(rs.getString("wildcards"), STRING_MAP);
    } catch (JsonProcessingException e) {
      throw new CatalogSyncException("Corrupt wildcards of " + key, e);
    }
    Fingerprint fingerprint =
        new Fingerprint(rs.getString("fingerprint"), rs.getLong("size"),
            Instant.ofEpochMilli(rs.getLong("modified_at")));
    return new FileRecord(key, wildcards, fingerprint,
        FileRecord.Status.valueOf(rs.getString("status")),
        Instant.ofEpochMilli(rs.getLong("registered_at")),
        rs.getString("error"));
  }

  // ===== Diagnostics =====

  @Override public void saveDiagnostics(String workflow, Instant scannedAt,
      List<Diagnostic> diagnostics) throws CatalogSyncException {
    List<Map<String, String>> list = new ArrayList<>();
    for (Diagnostic d : diagnostics) {
      Map<String, String> map = new LinkedHashMap<>();
      map.put("kind", d.getKind().name());
      map.put("message", d.getMessage());
      if (d.getDataCollection() != null) {
        map.put("data_collection", d.getDataCollection());
      }
      if (d.getRun() != null) {
        map.put("run", d.getRun());
      }
      if (d.getFile() != null) {
        map.put("file", d.getFile());
      }
      list.add(map);
    }
    String sql = "INSERT INTO ingest_scan (workflow, scanned_at, diagnostics) "
        + "VALUES (?, ?, ?) "
        + "ON CONFLICT (workflow) DO UPDATE SET "
        + "scanned_at = EXCLUDED.scanned_at, "
        + "diagnostics = EXCLUDED.diagnostics";
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, workflow);
        stmt.setLong(2, scannedAt.toEpochMilli());
        stmt.setString(3, toJson(list));
        stmt.executeUpdate();
      } catch (SQLException e) {
        throw new CatalogSyncException("Error recording diagnostics of "
            + workflow + ": " + e.getMessage(), e);
      }
    }
  }

  @Override public List<Diagnostic> lastDiagnostics(String workflow)
      throws CatalogSyncException {
    String sql = "SELECT diagnostics FROM ingest_scan WHERE workflow = ?";
    String json = null;
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, workflow);
        try (ResultSet rs = stmt.executeQuery()) {
          if (rs.next()) {
            json = rs.getString("diagnostics");
          }
        }
      } catch (SQLException e) {
        throw new CatalogSyncException("Error reading diagnostics of "
            + workflow + ": " + e.getMessage(), e);
      }
    }
    List<Diagnostic> result = new ArrayList<>();
    if (json == null) {
      return result;
    }
    try {
      for (Map<String, String> map : MAPPER.readValue(json, MAP_LIST)) {
        result.add(
            new Diagnostic(workflow, map.get("data_collection"), map.get("run"),
                map.get("file"), ErrorKind.valueOf(map.get("kind")),
                map.get("message")));
      }
    } catch (JsonProcessingException e) {
      throw new CatalogSyncException("Corrupt diagnostics of " + workflow, e);
    }
    return result;
  }

  private static String toJson(Object value) throws CatalogSyncException {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new CatalogSyncException("Failed to serialize " + value, e);
    }
  }

  @Override public void close() throws CatalogSyncException {
    synchronized (connectionLock) {
      if (connection != null) {
        try {
          connection.close();
          LOGGER.debug("Closed DuckDB connection to {}", dbPath);
        } catch (SQLException e) {
          throw new CatalogSyncException("Error closing catalog " + dbPath, e);
        } finally {
          connection = null;
        }
      }
    }
  }
}
