package com.gentoro.agentops.tool.builtin;

import com.gentoro.agentops.exception.DataStoreException;
import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolProperty;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** {@code get_database_schema} and {@code execute_sql_query} over a {@link DataStore}. */
public class DatabaseTools {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(DatabaseTools.class);

  public static final String SCHEMA_TOOL = "get_database_schema";
  public static final String QUERY_TOOL = "execute_sql_query";

  private final DataStore store;
  private final int displayRows;

  public DatabaseTools(DataStore store) {
    this(store, 50);
  }

  public DatabaseTools(DataStore store, int displayRows) {
    this.store = Objects.requireNonNull(store, "store");
    this.displayRows = displayRows;
  }

  /**
   * Descriptors for both tools. With a {@code remote} endpoint the local handlers become the
   * fallback for the remote ones.
   */
  public List<ToolDescriptor> descriptors(URI remote) {
    return List.of(
        ToolDescriptor.builder()
            .name(SCHEMA_TOOL)
            .description(
                "Get the database schema: every table with its columns, types and total row"
                    + " count. Call this first, before writing any SQL.")
            .schema(
                ToolProperty.object(
                    ToolProperty.string("table", "Optional table name to restrict the output", false)))
            .handler(this::schema)
            .remoteEndpoint(remote)
            .servedRemotely(true)
            .build(),
        ToolDescriptor.builder()
            .name(QUERY_TOOL)
            .description(
                "Execute a read-only SQL query and return the rows as a table (at most "
                    + displayRows
                    + " rows shown).")
            .schema(
                ToolProperty.object(
                    ToolProperty.string("sql", "SQL statement, e.g. SELECT COUNT(*) FROM customers", true)))
            .handler(this::executeQuery)
            .remoteEndpoint(remote)
            .servedRemotely(true)
            .build());
  }

  public ExecutionResult schema(Map<String, Object> arguments) {
    Object filter = arguments == null ? null : arguments.get("table");
    List<DataStore.TableInfo> tables;
    try {
      tables = store.schema();
    } catch (DataStoreException e) {
      log.warn("Schema lookup failed: {}", e.getMessage());
      return ExecutionResult.error(ErrorKind.APPLICATION, e.getMessage());
    }
    if (filter != null && !filter.toString().isBlank()) {
      String wanted = filter.toString().trim();
      tables = tables.stream().filter(t -> t.name().equalsIgnoreCase(wanted)).toList();
    }
    return ExecutionResult.ok(formatSchema(tables));
  }

  public ExecutionResult executeQuery(Map<String, Object> arguments) {
    Object sql = arguments == null ? null : arguments.get("sql");
    if (sql == null || sql.toString().isBlank()) {
      return ExecutionResult.error(ErrorKind.APPLICATION, "Missing 'sql' parameter");
    }
    try {
      return ExecutionResult.ok(formatRows(store.query(sql.toString())));
    } catch (DataStoreException e) {
      log.debug("Query failed: {}", e.getMessage());
      return ExecutionResult.error(ErrorKind.APPLICATION, "SQL Error: " + e.getMessage());
    }
  }

  static String formatSchema(List<DataStore.TableInfo> tables) {
    if (tables.isEmpty()) {
      return "No tables found";
    }
    List<String> lines = new ArrayList<>();
    for (DataStore.TableInfo table : tables) {
      if (!lines.isEmpty()) lines.add("");
      lines.add("-- Table: " + table.name());
      for (DataStore.ColumnInfo col : table.columns()) {
        lines.add("  %s (%s)".formatted(col.name(), col.type()));
      }
      lines.add("  -- Total rows: " + table.rowCount());
    }
    return String.join("\n", lines);
  }

  String formatRows(DataStore.QueryResult result) {
    if (result.rows().isEmpty()) {
      return "Query returned no results.";
    }
    String header = String.join(" | ", result.columns());
    List<String> lines = new ArrayList<>();
    lines.add(header);
    lines.add("-".repeat(header.length()));
    result.rows().stream()
        .limit(displayRows)
        .map(row -> row.stream().map(String::valueOf).collect(Collectors.joining(" | ")))
        .forEach(lines::add);
    if (result.totalRows() > displayRows) {
      lines.add("");
      lines.add("... (%d more rows)".formatted(result.totalRows() - displayRows));
    }
    return String.join("\n", lines);
  }
}
