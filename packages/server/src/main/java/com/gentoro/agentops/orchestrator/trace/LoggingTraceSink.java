package com.gentoro.agentops.orchestrator.trace;

import com.gentoro.agentops.agent.ToolCall;
import com.gentoro.agentops.orchestrator.TerminationReason;
import com.gentoro.agentops.tool.ExecutionResult;
import com.gentoro.agentops.utility.JacksonUtility;
import com.gentoro.agentops.utility.StringUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Emits one JSON line per event under {@code [conversation.trace]}:
 *
 * <pre>
 * {"event":"tool_call","conversationId":"...","round":1,"agent":"sql_specialist",
 *  "tool":"execute_sql_query","callId":"call_2","status":"OK","latencyMs":12,"output":"..."}
 * </pre>
 *
 * Content and tool output are cut to {@code previewChars} characters.
 */
public class LoggingTraceSink implements TraceSink {
  private static final int PROTOCOL_VERSION = 1;

  private final org.slf4j.Logger log;
  private final int previewChars;

  public LoggingTraceSink(org.slf4j.Logger logger, int previewChars) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.previewChars = previewChars;
  }

  @Override
  public void onTurn(String conversationId, int round, String agent, String content, int toolCalls) {
    Map<String, Object> payload = base("turn", conversationId);
    payload.put("round", round);
    payload.put("agent", agent);
    payload.put("toolCalls", toolCalls);
    payload.put("content", StringUtility.truncate(content, previewChars));
    emit(payload);
  }

  @Override
  public void onToolCall(
      String conversationId,
      int round,
      String agent,
      ToolCall call,
      ExecutionResult result,
      long latencyMs) {
    Map<String, Object> payload = base("tool_call", conversationId);
    payload.put("round", round);
    payload.put("agent", agent);
    payload.put("tool", call.name());
    payload.put("callId", call.id());
    payload.put("status", result.status().name());
    if (result.isError()) {
      payload.put("errorKind", result.errorKind().name());
    }
    payload.put("latencyMs", latencyMs);
    payload.put("output", StringUtility.truncate(result.output(), previewChars));
    emit(payload);
  }

  @Override
  public void onTerminated(String conversationId, TerminationReason reason, int rounds) {
    Map<String, Object> payload = base("terminated", conversationId);
    payload.put("reason", reason == null ? null : reason.name());
    payload.put("rounds", rounds);
    emit(payload);
  }

  private Map<String, Object> base(String event, String conversationId) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("event", event);
    payload.put("conversationId", conversationId);
    payload.put("protocolVersion", PROTOCOL_VERSION);
    return payload;
  }

  /** Extracted so tests can capture payloads. */
  void emit(Map<String, Object> payload) {
    log.info("[conversation.trace] {}", JacksonUtility.toJson(payload));
  }
}
