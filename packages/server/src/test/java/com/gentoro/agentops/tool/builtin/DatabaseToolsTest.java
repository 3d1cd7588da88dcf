package com.gentoro.agentops.tool.builtin;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.exception.DataStoreException;
import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolDescriptor;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DatabaseToolsTest {

  @Test
  void schemaListsTablesColumnsAndRowCounts() {
    ExecutionResult result =
        new DatabaseTools(InMemoryDataStore.customers(200)).schema(Map.of());

    assertTrue(result.isOk());
    assertEquals(
        "-- Table: customers\n"
            + "  customer_id (INTEGER)\n"
            + "  name (VARCHAR)\n"
            + "  -- Total rows: 200",
        result.output());
  }

  @Test
  void schemaCanBeFilteredByTable() {
    InMemoryDataStore store =
        new InMemoryDataStore(
            List.of(
                new DataStore.TableInfo("orders", List.of(new DataStore.ColumnInfo("id", "INTEGER")), 3),
                new DataStore.TableInfo("products", List.of(), 0)));
    String out = new DatabaseTools(store).schema(Map.of("table", "ORDERS")).output();
    assertTrue(out.contains("orders"));
    assertFalse(out.contains("products"));
  }

  @Test
  void emptySchema() {
    assertEquals(
        "No tables found",
        new DatabaseTools(new InMemoryDataStore(List.of())).schema(null).output());
  }

  @Test
  void queryRendersTable() {
    ExecutionResult result =
        new DatabaseTools(InMemoryDataStore.customers(200))
            .executeQuery(Map.of("sql", "SELECT COUNT(*) FROM customers"));
    assertEquals("count_star()\n------------\n200", result.output());
  }

  @Test
  void queryTruncatesToDisplayRows() {
    List<List<Object>> rows = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      rows.add(List.of(i, "name" + i));
    }
    InMemoryDataStore store =
        new InMemoryDataStore(List.of())
            .answer("SELECT * FROM t", new DataStore.QueryResult(List.of("id", "name"), rows, 75));

    String out = new DatabaseTools(store, 2).executeQuery(Map.of("sql", "SELECT * FROM t")).output();

    assertTrue(out.startsWith("id | name\n---------\n0 | name0\n1 | name1"), out);
    assertFalse(out.contains("name2"));
    assertTrue(out.endsWith("... (73 more rows)"), out);
  }

  @Test
  void emptyResult() {
    InMemoryDataStore store =
        new InMemoryDataStore(List.of())
            .answer("SELECT 1 WHERE false", DataStore.QueryResult.of(List.of("x"), List.of()));
    assertEquals(
        "Query returned no results.",
        new DatabaseTools(store).executeQuery(Map.of("sql", "SELECT 1 WHERE false")).output());
  }

  @Test
  void sqlErrorsAreApplicationErrors() {
    ExecutionResult result =
        new DatabaseTools(InMemoryDataStore.customers(1)).executeQuery(Map.of("sql", "SELECT bogus"));
    assertEquals(ErrorKind.APPLICATION, result.errorKind());
    assertTrue(result.output().startsWith("SQL Error: Catalog Error"), result.output());
  }

  @Test
  void missingSqlIsRejected() {
    DatabaseTools tools = new DatabaseTools(InMemoryDataStore.customers(1));
    assertEquals("Missing 'sql' parameter", tools.executeQuery(Map.of()).output());
    assertEquals("Missing 'sql' parameter", tools.executeQuery(Map.of("sql", "  ")).output());
  }

  @Test
  void schemaFailureIsReported() {
    DataStore broken =
        new InMemoryDataStore(List.of()) {
          @Override
          public List<TableInfo> schema() {
            throw new DataStoreException("IO Error: database locked");
          }
        };
    ExecutionResult result = new DatabaseTools(broken).schema(Map.of());
    assertEquals(ErrorKind.APPLICATION, result.errorKind());
    assertEquals("IO Error: database locked", result.output());
  }

  @Test
  void descriptorsBindRemoteEndpointWithLocalFallback() {
    URI remote = URI.create("http://localhost:8080/mcp");
    List<ToolDescriptor> ds = new DatabaseTools(InMemoryDataStore.customers(1)).descriptors(remote);
    assertEquals(
        List.of(DatabaseTools.SCHEMA_TOOL, DatabaseTools.QUERY_TOOL),
        ds.stream().map(ToolDescriptor::name).toList());
    for (ToolDescriptor d : ds) {
      assertEquals(remote, d.remoteEndpoint().orElseThrow());
      assertTrue(d.handler().isPresent());
    }
    assertEquals(List.of("sql"), ds.get(1).schema().missingRequired(Map.of()));
  }
}
