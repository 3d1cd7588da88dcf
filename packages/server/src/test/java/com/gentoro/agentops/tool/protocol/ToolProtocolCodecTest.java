package com.gentoro.agentops.tool.protocol;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.exception.ToolProtocolException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolProtocolCodecTest {

  private final ToolProtocolCodec codec = new ToolProtocolCodec();

  @Test
  void encodesRequestEnvelope() {
    String json =
        codec.encode(ToolCallRequest.toolsCall(7, "execute_sql_query", Map.of("sql", "SELECT 1")));
    assertTrue(json.contains("\"jsonrpc\":\"2.0\""), json);
    assertTrue(json.contains("\"id\":7"), json);
    assertTrue(json.contains("\"method\":\"tools/call\""), json);
    assertTrue(json.contains("\"arguments\":{\"sql\":\"SELECT 1\"}"), json);
  }

  @Test
  void decodesResultJoiningTextParts() {
    ToolCallResponse response =
        codec.decodeResponse(
            "test",
            "{\"id\":3,\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"a\"},"
                + "{\"type\":\"image\",\"text\":\"skip\"},{\"type\":\"text\",\"text\":\"b\"}]}}",
            3);
    assertFalse(response.isError());
    assertEquals("a\nb", response.result().text());
  }

  @Test
  void decodesErrorEnvelope() {
    ToolCallResponse response =
        codec.decodeResponse(
            "test", "{\"jsonrpc\":\"2.0\",\"id\":4,\"error\":{\"code\":-32602,\"message\":\"bad\"}}", 4);
    assertTrue(response.isError());
    assertEquals(-32602, response.error().code());
    assertEquals("bad", response.error().message());
  }

  @Test
  void rejectsMalformedResponses() {
    String[] bodies = {
      "",
      "[1,2]",
      "{not json",
      "{\"result\":{\"content\":[]}}",
      "{\"id\":\"1\",\"result\":{\"content\":[]}}",
      "{\"id\":2,\"result\":{\"content\":[]}}",
      "{\"id\":1}",
      "{\"id\":1,\"result\":{\"content\":[]},\"error\":{\"code\":1,\"message\":\"x\"}}",
      "{\"id\":1,\"result\":{\"text\":\"no content array\"}}",
      "{\"id\":1,\"error\":{\"code\":\"x\",\"message\":\"m\"}}"
    };
    for (String body : bodies) {
      assertThrows(
          ToolProtocolException.class, () -> codec.decodeResponse("test", body, 1), body);
    }
  }

  @Test
  void decodesRequestAndDefaultsArguments() {
    ToolCallRequest request =
        codec.decodeRequest(
            "{\"jsonrpc\":\"2.0\",\"id\":11,\"method\":\"tools/call\",\"params\":{\"name\":\"web_search\"}}");
    assertEquals(11, request.id());
    assertEquals("web_search", request.params().name());
    assertTrue(request.params().arguments().isEmpty());
  }

  @Test
  void requestErrorsCarryWireCodes() {
    assertWireCode(ToolCallResponse.PARSE_ERROR, null, "{oops");
    assertWireCode(ToolCallResponse.INVALID_REQUEST, null, "42");
    assertWireCode(ToolCallResponse.INVALID_REQUEST, null, "{\"method\":\"tools/call\"}");
    assertWireCode(ToolCallResponse.METHOD_NOT_FOUND, 5L, "{\"id\":5,\"method\":\"tools/list\"}");
    assertWireCode(
        ToolCallResponse.INVALID_PARAMS, 6L, "{\"id\":6,\"method\":\"tools/call\",\"params\":{}}");
    assertWireCode(
        ToolCallResponse.INVALID_PARAMS,
        8L,
        "{\"id\":8,\"method\":\"tools/call\",\"params\":{\"name\":\"x\",\"arguments\":[1]}}");
  }

  @Test
  void envelopeExceptionRendersFailureEnvelope() {
    EnvelopeException e =
        assertThrows(
            EnvelopeException.class, () -> codec.decodeRequest("{\"id\":9,\"method\":\"nope\"}"));
    String json = codec.encode(e.toResponse());
    assertTrue(json.contains("\"id\":9"), json);
    assertTrue(json.contains("\"code\":-32601"), json);
    assertFalse(json.contains("\"result\""), json);
  }

  private void assertWireCode(int code, Long id, String body) {
    EnvelopeException e = assertThrows(EnvelopeException.class, () -> codec.decodeRequest(body));
    assertEquals(code, e.getWireCode(), body);
    assertEquals(id, e.getRequestId(), body);
  }
}
