package com.gentoro.agentops.tool.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolProperty;
import com.gentoro.agentops.utility.JacksonUtility;
import com.gentoro.agentops.utility.StringUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@code web_search} (DuckDuckGo instant answers) and {@code scrape_webpage} (plain text of a
 * page). Both are local tools; failures come back as application errors.
 */
public class WebTools {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(WebTools.class);

  public static final String SEARCH_TOOL = "web_search";
  public static final String SCRAPE_TOOL = "scrape_webpage";

  private static final int MAX_RELATED = 5;
  private static final int MAX_TITLE = 100;
  private static final String USER_AGENT = "Mozilla/5.0 (compatible; AgentOpsBot/1.0)";

  private static final Pattern SCRIPT = Pattern.compile("(?is)<script[^>]*>.*?</script>");
  private static final Pattern STYLE = Pattern.compile("(?is)<style[^>]*>.*?</style>");
  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(?:[xX]([0-9a-fA-F]{1,6})|([0-9]{1,7}));");

  private final OkHttpClient httpClient;
  private final String searchUrl;
  private final int maxChars;

  public WebTools(OkHttpClient httpClient, String searchUrl, int maxChars) {
    this.httpClient = httpClient;
    this.searchUrl = searchUrl;
    this.maxChars = maxChars;
  }

  public List<ToolDescriptor> descriptors() {
    return List.of(
        ToolDescriptor.builder()
            .name(SEARCH_TOOL)
            .description("Search the web and return a summary plus related results with URLs.")
            .schema(ToolProperty.object(ToolProperty.string("query", "Search terms", true)))
            .handler(this::search)
            .build(),
        ToolDescriptor.builder()
            .name(SCRAPE_TOOL)
            .description(
                "Fetch a web page and return its visible text (first " + maxChars + " characters).")
            .schema(ToolProperty.object(ToolProperty.string("url", "Absolute http(s) URL", true)))
            .handler(this::scrape)
            .build());
  }

  public ExecutionResult search(Map<String, Object> arguments) {
    Object query = arguments == null ? null : arguments.get("query");
    if (query == null || query.toString().isBlank()) {
      return ExecutionResult.error(ErrorKind.APPLICATION, "Missing 'query' parameter");
    }
    HttpUrl base = HttpUrl.parse(searchUrl);
    if (base == null) {
      return ExecutionResult.error(ErrorKind.EXECUTION, "Invalid search url: " + searchUrl);
    }
    HttpUrl url =
        base.newBuilder()
            .addQueryParameter("q", query.toString())
            .addQueryParameter("format", "json")
            .addQueryParameter("no_html", "1")
            .build();
    try {
      JsonNode data = JacksonUtility.getJsonMapper().readTree(fetch(url.toString()));
      List<String> lines = new ArrayList<>();
      String summary = data.path("AbstractText").asText("");
      if (!summary.isBlank()) {
        lines.add("Summary: " + summary);
        lines.add("");
      }
      List<JsonNode> related = new ArrayList<>();
      for (JsonNode topic : data.path("RelatedTopics")) {
        if (related.size() == MAX_RELATED) break;
        related.add(topic);
      }
      if (!related.isEmpty()) {
        lines.add("Related Results:");
        int i = 0;
        for (JsonNode topic : related) {
          i++;
          if (!topic.path("Text").isTextual()) continue;
          String title = topic.get("Text").asText();
          lines.add("%d. %s".formatted(i, title.length() > MAX_TITLE ? title.substring(0, MAX_TITLE) : title));
          String firstUrl = topic.path("FirstURL").asText("");
          if (!firstUrl.isBlank()) {
            lines.add("   URL: " + firstUrl);
          }
        }
      }
      if (lines.isEmpty()) {
        return ExecutionResult.ok("No results found for query: " + query);
      }
      return ExecutionResult.ok(String.join("\n", lines));
    } catch (IOException e) {
      log.warn("Web search for '{}' failed: {}", query, e.getMessage());
      return ExecutionResult.error(ErrorKind.APPLICATION, "Web search failed: " + e.getMessage());
    }
  }

  public ExecutionResult scrape(Map<String, Object> arguments) {
    Object url = arguments == null ? null : arguments.get("url");
    if (url == null || HttpUrl.parse(url.toString()) == null) {
      return ExecutionResult.error(ErrorKind.APPLICATION, "Missing or invalid 'url' parameter");
    }
    try {
      return ExecutionResult.ok(StringUtility.truncate(toText(fetch(url.toString())), maxChars));
    } catch (IOException e) {
      log.warn("Scraping {} failed: {}", url, e.getMessage());
      return ExecutionResult.error(
          ErrorKind.APPLICATION, "Failed to scrape webpage: " + e.getMessage());
    }
  }

  /** Visible text of an HTML document: scripts and styles removed, tags dropped, whitespace collapsed. */
  static String toText(String html) {
    String text = SCRIPT.matcher(html).replaceAll("");
    text = STYLE.matcher(text).replaceAll("");
    text = TAG.matcher(text).replaceAll(" ");
    text = unescape(text);
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  static String unescape(String text) {
    Matcher m = NUMERIC_ENTITY.matcher(text);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      int cp = m.group(1) != null ? Integer.parseInt(m.group(1), 16) : Integer.parseInt(m.group(2));
      String replacement = Character.isValidCodePoint(cp) ? new String(Character.toChars(cp)) : " ";
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString()
        .replace("&nbsp;", " ")
        .replace("&lt;", "<")
        .replace("&gt;", ">")
        .replace("&quot;", "\"")
        .replace("&#39;", "'")
        .replace("&apos;", "'")
        .replace("&amp;", "&");
  }

  private String fetch(String url) throws IOException {
    Request request = new Request.Builder().url(url).header("User-Agent", USER_AGENT).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new IOException("HTTP " + response.code() + " from " + url);
      }
      ResponseBody body = response.body();
      return body == null ? "" : body.string();
    }
  }
}
