package com.gentoro.agentops.tool.protocol;

import com.gentoro.agentops.exception.ToolProtocolException;
import com.gentoro.agentops.exception.ToolTransportException;
import com.gentoro.agentops.http.OkHttpFactory;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Posts tool envelopes to a remote endpoint over OkHttp.
 *
 * <p>Failure mapping: I/O problems and HTTP errors without an envelope raise {@link
 * ToolTransportException}; a readable body that is not a valid envelope raises {@link
 * ToolProtocolException}. An HTTP error status whose body is a valid error envelope is returned as
 * a normal response so the caller sees the application error.
 */
public class RemoteToolClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(RemoteToolClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final ToolProtocolCodec codec;

  public RemoteToolClient(Duration timeout) {
    this(OkHttpFactory.create(timeout), new ToolProtocolCodec());
  }

  public RemoteToolClient(OkHttpClient httpClient, ToolProtocolCodec codec) {
    this.httpClient = httpClient;
    this.codec = codec;
  }

  public ToolCallResponse call(URI endpoint, ToolCallRequest request) {
    String target = endpoint.toString();
    Request httpRequest =
        new Request.Builder()
            .url(target)
            .post(RequestBody.create(codec.encode(request), JSON))
            .header("Accept", "application/json")
            .build();

    try (Response response = httpClient.newCall(httpRequest).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        ToolCallResponse envelope = tryDecodeError(target, text, request.id());
        if (envelope != null) {
          return envelope;
        }
        throw new ToolTransportException(target, "HTTP " + response.code());
      }
      return codec.decodeResponse(target, text, request.id());
    } catch (IOException e) {
      throw new ToolTransportException(target, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
    } catch (IllegalArgumentException e) {
      // OkHttp rejects malformed URLs this way
      throw new ToolTransportException(target, e.getMessage(), e);
    }
  }

  /** {@code GET <endpoint-origin>/health}; true on any 2xx answer. */
  public boolean isHealthy(URI endpoint) {
    URI health = endpoint.resolve("/health");
    Request request = new Request.Builder().url(health.toString()).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      return response.isSuccessful();
    } catch (IOException | IllegalArgumentException e) {
      log.debug("Health probe of {} failed: {}", health, e.getMessage());
      return false;
    }
  }

  private ToolCallResponse tryDecodeError(String target, String body, long id) {
    try {
      ToolCallResponse envelope = codec.decodeResponse(target, body, id);
      return envelope.isError() ? envelope : null;
    } catch (ToolProtocolException e) {
      log.trace("HTTP error body from {} is not an envelope: {}", target, e.getMessage());
      return null;
    }
  }
}
