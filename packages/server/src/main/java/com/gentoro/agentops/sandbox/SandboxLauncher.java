package com.gentoro.agentops.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.agentops.exception.StateException;
import com.gentoro.agentops.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link SandboxJob} in a child JVM ({@link SandboxWorker}) with a capped heap.
 *
 * <p>The run time limit starts once the child reports it is ready, so JVM start-up does not count
 * against the snippet. When the limit passes the child is killed; nothing of the snippet outlives
 * the call.
 */
public class SandboxLauncher {
  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(SandboxLauncher.class);

  public static final int DEFAULT_MAX_HEAP_MB = 128;
  public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(30);

  private final int maxHeapMb;
  private final Duration startupTimeout;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public SandboxLauncher() {
    this(DEFAULT_MAX_HEAP_MB, DEFAULT_STARTUP_TIMEOUT);
  }

  public SandboxLauncher(int maxHeapMb, Duration startupTimeout) {
    if (maxHeapMb < 16) {
      throw new IllegalArgumentException("maxHeapMb must be at least 16");
    }
    this.maxHeapMb = maxHeapMb;
    this.startupTimeout = startupTimeout;
  }

  /**
   * @throws TimeoutException when the snippet runs past {@code timeout}; the child is already gone
   * @throws StateException when the child cannot be started or dies without a reply
   */
  SandboxReply run(SandboxJob job, Duration timeout)
      throws TimeoutException, InterruptedException {
    Process process;
    try {
      process = new ProcessBuilder(command()).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new StateException("Could not start the sandbox process", e);
    }

    CompletableFuture<Void> ready = new CompletableFuture<>();
    CompletableFuture<SandboxReply> reply = new CompletableFuture<>();
    Thread reader =
        new Thread(() -> pump(process, ready, reply), "sandbox-io-" + job.className());
    reader.setDaemon(true);
    reader.start();

    try {
      try (OutputStream stdin = process.getOutputStream()) {
        stdin.write(mapper.writeValueAsBytes(job));
      } catch (IOException e) {
        throw new StateException("Could not hand the snippet to the sandbox process", e);
      }

      try {
        ready.get(startupTimeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (TimeoutException e) {
        throw new StateException(
            "Sandbox process did not start within " + startupTimeout.toMillis() + " ms");
      }
      return reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof StateException se) throw se;
      throw new StateException("Sandbox process failed", cause);
    } finally {
      terminate(process, reader);
    }
  }

  private List<String> command() {
    List<String> cmd = new ArrayList<>();
    cmd.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
    cmd.add("-Xmx" + maxHeapMb + "m");
    cmd.add("-Xss1m");
    cmd.add("-XX:+UseSerialGC");
    cmd.add("-XX:TieredStopAtLevel=1");
    cmd.add("-Djava.awt.headless=true");
    cmd.add("-cp");
    cmd.add(System.getProperty("java.class.path"));
    cmd.add(SandboxWorker.class.getName());
    return cmd;
  }

  private void pump(
      Process process, CompletableFuture<Void> ready, CompletableFuture<SandboxReply> reply) {
    List<String> noise = new ArrayList<>();
    try (BufferedReader in =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = in.readLine()) != null) {
        if (line.equals(SandboxWorker.READY)) {
          ready.complete(null);
        } else if (line.startsWith(SandboxWorker.RESULT_PREFIX)) {
          reply.complete(
              mapper.readValue(
                  line.substring(SandboxWorker.RESULT_PREFIX.length()), SandboxReply.class));
        } else {
          log.trace("[sandbox] {}", line);
          if (noise.size() < 20) noise.add(line);
        }
      }
    } catch (IOException e) {
      log.debug("Sandbox process output closed: {}", e.getMessage());
    }

    if (!reply.isDone()) {
      String exit;
      try {
        exit = process.waitFor(5, TimeUnit.SECONDS) ? "code " + process.exitValue() : "unknown status";
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        exit = "unknown status";
      }
      StateException failure =
          new StateException(
              "Sandbox process exited with "
                  + exit
                  + (noise.isEmpty() ? "" : ": " + String.join(" | ", noise)));
      ready.completeExceptionally(failure);
      reply.completeExceptionally(failure);
    }
  }

  private static void terminate(Process process, Thread reader) {
    process.destroyForcibly();
    try {
      if (!process.waitFor(5, TimeUnit.SECONDS)) {
        log.warn("Sandbox process {} did not exit after being killed", process.pid());
      }
      reader.join(TimeUnit.SECONDS.toMillis(5));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
