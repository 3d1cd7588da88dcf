package com.gentoro.agentops.tool.builtin;

import java.util.List;

/** Read-only structured data store queried by the database tools. */
public interface DataStore {

  /** Every user table with its columns, in a stable order. */
  List<TableInfo> schema();

  /**
   * Run a statement and return its rows.
   *
   * @throws com.gentoro.agentops.exception.DataStoreException when the statement fails
   */
  QueryResult query(String sql);

  record ColumnInfo(String name, String type) {}

  record TableInfo(String name, List<ColumnInfo> columns, long rowCount) {
    public TableInfo {
      columns = List.copyOf(columns);
    }
  }

  /**
   * Rows of a query. {@code rows} may be a prefix of the full answer; {@code totalRows} is the
   * number of rows the statement produced.
   */
  record QueryResult(List<String> columns, List<List<Object>> rows, long totalRows) {
    public QueryResult {
      columns = List.copyOf(columns);
      rows = List.copyOf(rows);
    }

    public static QueryResult of(List<String> columns, List<List<Object>> rows) {
      return new QueryResult(columns, rows, rows.size());
    }
  }
}
