package com.gentoro.agentops.tool.builtin;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.http.OkHttpFactory;
import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WebToolsTest {

  private MockWebServer server;
  private WebTools tools;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    tools =
        new WebTools(OkHttpFactory.create(Duration.ofSeconds(5)), server.url("/search").toString(), 40);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void searchFormatsSummaryAndRelatedResults() throws InterruptedException {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"AbstractText\":\"DuckDB is an in-process database.\","
                    + "\"RelatedTopics\":["
                    + "{\"Text\":\"DuckDB docs\",\"FirstURL\":\"https://duckdb.org/docs\"},"
                    + "{\"Name\":\"group without text\"},"
                    + "{\"Text\":\"SQL\"}]}"));

    ExecutionResult result = tools.search(Map.of("query", "duckdb"));

    assertEquals(
        "Summary: DuckDB is an in-process database.\n\n"
            + "Related Results:\n"
            + "1. DuckDB docs\n"
            + "   URL: https://duckdb.org/docs\n"
            + "3. SQL",
        result.output());
    RecordedRequest request = server.takeRequest();
    assertEquals("duckdb", request.getRequestUrl().queryParameter("q"));
    assertEquals("json", request.getRequestUrl().queryParameter("format"));
  }

  @Test
  void searchWithoutResults() {
    server.enqueue(new MockResponse().setBody("{\"AbstractText\":\"\",\"RelatedTopics\":[]}"));
    assertEquals("No results found for query: nothing", tools.search(Map.of("query", "nothing")).output());
  }

  @Test
  void searchFailureIsApplicationError() {
    server.enqueue(new MockResponse().setResponseCode(500));
    ExecutionResult result = tools.search(Map.of("query", "x"));
    assertEquals(ErrorKind.APPLICATION, result.errorKind());
    assertTrue(result.output().startsWith("Web search failed"), result.output());
  }

  @Test
  void searchRequiresQuery() {
    assertEquals(ErrorKind.APPLICATION, tools.search(Map.of()).errorKind());
  }

  @Test
  void scrapeReturnsVisibleTextTruncated() {
    server.enqueue(
        new MockResponse()
            .setBody(
                "<html><head><style>p{}</style><script>var x=1;</script></head>"
                    + "<body><p>Fish &amp; chips</p>\n<p>cost&#33;   a lot more than expected today</p></body></html>"));

    String out = tools.scrape(Map.of("url", server.url("/page").toString())).output();

    assertTrue(out.startsWith("Fish & chips cost! a lot"), out);
    assertTrue(out.endsWith("..."), out);
    assertFalse(out.contains("var x"));
  }

  @Test
  void scrapeRejectsBadUrl() {
    assertEquals(ErrorKind.APPLICATION, tools.scrape(Map.of("url", "not a url")).errorKind());
  }

  @Test
  void toTextStripsMarkup() {
    assertEquals("a b", WebTools.toText("<div>a</div><span>b</span>"));
    assertEquals("<x> \"y\"", WebTools.unescape("&lt;x&gt; &quot;y&quot;"));
  }
}
