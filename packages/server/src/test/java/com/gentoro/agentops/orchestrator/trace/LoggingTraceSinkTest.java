package com.gentoro.agentops.orchestrator.trace;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentops.agent.ToolCall;
import com.gentoro.agentops.orchestrator.TerminationReason;
import com.gentoro.agentops.tool.ErrorKind;
import com.gentoro.agentops.tool.ExecutionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingTraceSinkTest {

  private final List<Map<String, Object>> events = new ArrayList<>();

  private final LoggingTraceSink sink =
      new LoggingTraceSink(LoggerFactory.getLogger("trace-test"), 10) {
        @Override
        void emit(Map<String, Object> payload) {
          events.add(payload);
          super.emit(payload);
        }
      };

  @Test
  void turnEventTruncatesContent() {
    sink.onTurn("c-1", 1, "sql_specialist", "Let me look at the schema first.", 1);

    Map<String, Object> e = events.get(0);
    assertEquals("turn", e.get("event"));
    assertEquals("c-1", e.get("conversationId"));
    assertEquals(1, e.get("round"));
    assertEquals("sql_specialist", e.get("agent"));
    assertEquals(1, e.get("toolCalls"));
    assertTrue(e.get("content").toString().length() <= 13, e.get("content").toString());
  }

  @Test
  void toolCallEventCarriesErrorKind() {
    ToolCall call = new ToolCall("call_3", "execute_sql_query", Map.of("sql", "SELECT 1"));
    sink.onToolCall(
        "c-1", 2, "sql_specialist", call, ExecutionResult.error(ErrorKind.TRANSPORT, "down"), 7L);

    Map<String, Object> e = events.get(0);
    assertEquals("tool_call", e.get("event"));
    assertEquals("execute_sql_query", e.get("tool"));
    assertEquals("call_3", e.get("callId"));
    assertEquals("ERROR", e.get("status"));
    assertEquals("TRANSPORT", e.get("errorKind"));
    assertEquals(7L, e.get("latencyMs"));
  }

  @Test
  void okToolCallHasNoErrorKind() {
    ToolCall call = new ToolCall("call_1", "get_database_schema", Map.of());
    sink.onToolCall("c-1", 1, "sql_specialist", call, ExecutionResult.ok("tables"), 3L);
    assertFalse(events.get(0).containsKey("errorKind"));
    assertEquals("OK", events.get(0).get("status"));
  }

  @Test
  void terminatedEvent() {
    sink.onTerminated("c-9", TerminationReason.MAX_ROUNDS, 10);
    Map<String, Object> e = events.get(0);
    assertEquals("terminated", e.get("event"));
    assertEquals("MAX_ROUNDS", e.get("reason"));
    assertEquals(10, e.get("rounds"));
  }
}
