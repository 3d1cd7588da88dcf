package com.gentoro.agentops.model;

import com.gentoro.agentops.AgentOps;
import com.gentoro.agentops.exception.ExceptionUtil;
import com.gentoro.agentops.exception.LlmException;
import com.gentoro.agentops.utility.StdoutUtility;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link LlmClient} with the plumbing shared by every provider: timing, trace logging,
 * interactive progress lines and wrapping of provider failures into {@link LlmException}.
 *
 * <p>Subclasses implement {@link #runInference(List, InferenceEventListener)} against a concrete
 * HTTP API.
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(AbstractLlmClient.class);
  protected final Configuration configuration;
  private final AgentOps agentOps;

  public AbstractLlmClient(AgentOps agentOps, Configuration configuration) {
    this.agentOps = agentOps;
    this.configuration = configuration;
  }

  @Override
  public String chat(List<Message> messages, final InferenceEventListener _listener) {
    StdoutUtility.printRollingLine(
        agentOps, "(Inference): sending (%d) message(s) to LLM...".formatted(messages.size()));
    log.trace("chat() called with: messages = [{}]", messages);
    long start = System.currentTimeMillis();
    try {
      return runInference(
          messages,
          (type, data) -> {
            if (_listener != null) {
              _listener.on(type, data);
            }
          });
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          (ex) ->
              new LlmException(
                  "There was a problem while running the inference with the chosen model.", ex));
    } finally {
      log.trace("chat() took {} ms", System.currentTimeMillis() - start);
      StdoutUtility.printRollingLine(
          agentOps,
          "(Inference): completed in (%d)ms".formatted((System.currentTimeMillis() - start)));
    }
  }

  public abstract String runInference(List<Message> messages, InferenceEventListener listener);
}
