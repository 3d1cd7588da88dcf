package com.gentoro.agentops.http;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.ConfigurationProvider;
import com.gentoro.agentops.exception.ConfigException;
import com.gentoro.agentops.exception.StateException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import okhttp3.Request;
import okhttp3.Response;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.junit.jupiter.api.Test;

class EmbeddedJettyServerTest {

  @Test
  void servesRegisteredServletsOnEphemeralPort() throws Exception {
    try (EmbeddedJettyServer server =
        new EmbeddedJettyServer(
            ConfigurationProvider.fromYaml("http:\n  port: 0\n  hostname: 127.0.0.1\n"))) {
      server.prepare();
      server
          .getContextHandler()
          .addServlet(
              new ServletHolder(
                  new HttpServlet() {
                    @Override
                    protected void doGet(HttpServletRequest req, HttpServletResponse resp)
                        throws IOException {
                      resp.setContentType("text/plain");
                      resp.getWriter().write("pong");
                    }
                  }),
              "/ping");
      server.start();
      assertTrue(server.isRunning());
      assertTrue(server.getPort() > 0);

      Request request =
          new Request.Builder().url("http://127.0.0.1:" + server.getPort() + "/ping").build();
      try (Response response = OkHttpFactory.create(Duration.ofSeconds(5)).newCall(request).execute()) {
        assertEquals(200, response.code());
        assertEquals("pong", response.body().string());
      }
    }
  }

  @Test
  void stopReleasesServer() {
    EmbeddedJettyServer server =
        new EmbeddedJettyServer(ConfigurationProvider.fromYaml("http:\n  port: 0\n"));
    server.start();
    assertTrue(server.isRunning());
    server.close();
    assertFalse(server.isRunning());
    assertThrows(StateException.class, server::getContextHandler);
  }

  @Test
  void blankHostnameIsRejected() {
    EmbeddedJettyServer server =
        new EmbeddedJettyServer(ConfigurationProvider.fromYaml("http:\n  hostname: ' '\n"));
    assertThrows(ConfigException.class, server::prepare);
  }
}
