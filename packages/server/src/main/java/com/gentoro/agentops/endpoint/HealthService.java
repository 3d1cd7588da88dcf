package com.gentoro.agentops.endpoint;

import com.gentoro.agentops.http.EmbeddedJettyServer;
import com.gentoro.agentops.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check at {@code /health}.
 *
 * <p>Response body: {@code {"status":"healthy", ...details}}, where the details come from the
 * supplier given at construction (e.g. the database location and the registered tools).
 */
public class HealthService {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(HealthService.class);

  public static final String PATH = "/health";

  private final EmbeddedJettyServer httpServer;
  private final Supplier<Map<String, Object>> details;

  public HealthService(EmbeddedJettyServer httpServer, Supplier<Map<String, Object>> details) {
    this.httpServer = httpServer;
    this.details = details == null ? Map::of : details;
  }

  public void register() {
    httpServer.getContextHandler().addServlet(new ServletHolder(new HealthServlet()), PATH);
    log.info("Health endpoint registered at {}", PATH);
  }

  Map<String, Object> payload() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("status", "healthy");
    details.get().forEach(payload::putIfAbsent);
    return payload;
  }

  private class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toJson(payload()));
      }
    }
  }
}
