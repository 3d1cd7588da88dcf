package com.gentoro.agentops.tool.builtin;

import com.gentoro.agentops.exception.DataStoreException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * {@link DataStore} over plain JDBC. A connection is opened per call and opened read-only, so the
 * store can be shared between concurrent conversations.
 *
 * <p>DuckDB urls ({@code jdbc:duckdb:...}) are opened with {@code duckdb.read_only}; other drivers
 * get {@link Connection#setReadOnly(boolean)}.
 */
public class JdbcDataStore implements DataStore {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(JdbcDataStore.class);

  private static final String COLUMNS_SQL =
      "SELECT table_name, column_name, data_type FROM information_schema.columns "
          + "WHERE table_schema = ? ORDER BY table_name, ordinal_position";

  private final String url;
  private final String schemaName;
  private final int maxRows;

  public JdbcDataStore(String url, String schemaName, int maxRows) {
    this.url = url;
    this.schemaName = schemaName;
    this.maxRows = maxRows;
  }

  @Override
  public List<TableInfo> schema() {
    try (Connection conn = open()) {
      Map<String, List<ColumnInfo>> tables = new LinkedHashMap<>();
      try (PreparedStatement ps = conn.prepareStatement(COLUMNS_SQL)) {
        ps.setString(1, schemaName);
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            tables
                .computeIfAbsent(rs.getString(1), k -> new ArrayList<>())
                .add(new ColumnInfo(rs.getString(2), rs.getString(3)));
          }
        }
      }

      List<TableInfo> out = new ArrayList<>();
      for (Map.Entry<String, List<ColumnInfo>> e : tables.entrySet()) {
        out.add(new TableInfo(e.getKey(), e.getValue(), countRows(conn, e.getKey())));
      }
      log.debug("Read schema of {} table(s) from {}", out.size(), url);
      return out;
    } catch (SQLException e) {
      throw new DataStoreException("Failed to read database schema: " + e.getMessage(), e);
    }
  }

  @Override
  public QueryResult query(String sql) {
    try (Connection conn = open();
        Statement st = conn.createStatement()) {
      boolean hasResultSet = st.execute(sql);
      if (!hasResultSet) {
        return QueryResult.of(List.of(), List.of());
      }
      try (ResultSet rs = st.getResultSet()) {
        ResultSetMetaData md = rs.getMetaData();
        int cols = md.getColumnCount();
        List<String> columns = new ArrayList<>(cols);
        for (int i = 1; i <= cols; i++) {
          columns.add(md.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        long total = 0;
        while (rs.next()) {
          total++;
          if (rows.size() < maxRows) {
            List<Object> row = new ArrayList<>(cols);
            for (int i = 1; i <= cols; i++) {
              row.add(rs.getObject(i));
            }
            rows.add(Collections.unmodifiableList(row));
          }
        }
        return new QueryResult(columns, rows, total);
      }
    } catch (SQLException e) {
      throw new DataStoreException(e.getMessage(), e);
    }
  }

  private long countRows(Connection conn, String table) throws SQLException {
    String quoted = "\"" + table.replace("\"", "\"\"") + "\"";
    try (Statement st = conn.createStatement();
        ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + quoted)) {
      return rs.next() ? rs.getLong(1) : 0L;
    }
  }

  private Connection open() throws SQLException {
    if (url.startsWith("jdbc:duckdb:")) {
      Properties props = new Properties();
      props.setProperty("duckdb.read_only", "true");
      return DriverManager.getConnection(url, props);
    }
    Connection conn = DriverManager.getConnection(url);
    conn.setReadOnly(true);
    return conn;
  }
}
