package com.gentoro.agentops;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.gentoro.agentops.agent.Agent;
import com.gentoro.agentops.agent.AgentDefinition;
import com.gentoro.agentops.agent.AgentFactory;
import com.gentoro.agentops.endpoint.HealthService;
import com.gentoro.agentops.endpoint.QueryService;
import com.gentoro.agentops.endpoint.ToolEndpointServer;
import com.gentoro.agentops.exception.ConfigException;
import com.gentoro.agentops.exception.NetworkException;
import com.gentoro.agentops.exception.StateException;
import com.gentoro.agentops.http.EmbeddedJettyServer;
import com.gentoro.agentops.http.OkHttpFactory;
import com.gentoro.agentops.model.LlmClient;
import com.gentoro.agentops.model.LlmClientFactory;
import com.gentoro.agentops.orchestrator.InteractiveConsole;
import com.gentoro.agentops.orchestrator.LlmSpeakerDecisionFunction;
import com.gentoro.agentops.orchestrator.OrchestrationResult;
import com.gentoro.agentops.orchestrator.Orchestrator;
import com.gentoro.agentops.orchestrator.SpeakerSelector;
import com.gentoro.agentops.orchestrator.trace.LoggingTraceSink;
import com.gentoro.agentops.orchestrator.trace.NoOpTraceSink;
import com.gentoro.agentops.orchestrator.trace.TraceSink;
import com.gentoro.agentops.prompt.PromptRepository;
import com.gentoro.agentops.prompt.PromptRepositoryFactory;
import com.gentoro.agentops.sandbox.SandboxExecutor;
import com.gentoro.agentops.sandbox.SandboxLauncher;
import com.gentoro.agentops.sandbox.SandboxPolicy;
import com.gentoro.agentops.sandbox.SnippetCompiler;
import com.gentoro.agentops.tool.ToolDescriptor;
import com.gentoro.agentops.tool.ToolGateway;
import com.gentoro.agentops.tool.ToolRegistry;
import com.gentoro.agentops.tool.builtin.DatabaseTools;
import com.gentoro.agentops.tool.builtin.JdbcDataStore;
import com.gentoro.agentops.tool.builtin.WebTools;
import com.gentoro.agentops.tool.protocol.RemoteToolClient;
import com.gentoro.agentops.utility.JacksonUtility;
import java.io.File;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context. Owns the configuration and every long-lived component, wires them together
 * in {@link #initialize()} and releases them in {@link #shutdown()}.
 */
public class AgentOps {

  private static final org.slf4j.Logger log =
      com.gentoro.agentops.logging.LoggingService.getLogger(AgentOps.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private PromptRepository promptRepository;
  private EmbeddedJettyServer httpServer;
  private ToolRegistry toolRegistry;
  private ToolGateway toolGateway;
  private LlmClient llmClient;
  private Orchestrator orchestrator;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public AgentOps(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public boolean isInteractiveModeEnabled() {
    return "interactive".equalsIgnoreCase(startupParameters.mode());
  }

  public void initialize() {
    if ("help".equals(startupParameters.mode())) {
      System.out.println(StartupParameters.usage());
      return;
    }

    // Silence java.util.logging (Jetty and JDBC drivers may use it).
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.agentops.logging.LoggingService.applyConfiguration(configuration());
    this.promptRepository = PromptRepositoryFactory.create(configuration());

    this.toolRegistry = createToolRegistry(configuration());
    this.toolGateway =
        new ToolGateway(
            toolRegistry,
            new RemoteToolClient(
                Duration.ofSeconds(configuration().getLong("tools.gateway.timeout-seconds", 30))),
            configuration().getBoolean("tools.gateway.use-fallback", true));

    String mode = startupParameters.mode();
    if (!"server".equals(mode)) {
      this.llmClient = LlmClientFactory.createProvider(this, configuration());
      this.orchestrator = createOrchestrator();
    }

    startHttpServer();
    toolGateway
        .probeHealth()
        .forEach(
            (endpoint, healthy) -> {
              if (healthy) {
                log.info("Tool endpoint {} is healthy", endpoint);
              } else {
                log.warn("Tool endpoint {} is unreachable; using local fallbacks", endpoint);
              }
            });

    switch (mode) {
      case "server", "api" -> {
        if (httpServer == null) {
          log.warn("Mode '{}' with http.enabled=false serves nothing", mode);
        }
      }
      case "interactive" -> {
        configureFileOnlyLogging();
        try {
          new InteractiveConsole(this, orchestrator).run();
        } finally {
          shutdown();
        }
      }
      case "query" -> {
        try {
          String query = startupParameters.query().orElseThrow();
          OrchestrationResult result = orchestrator.execute(query);
          System.out.println(JacksonUtility.toPrettyJson(result));
        } finally {
          shutdown();
        }
      }
      default -> {
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + mode);
      }
    }
  }

  /**
   * Built-in tools: database tools (remote first when {@code tools.endpoint} is set, JDBC as the
   * fallback), web tools and the code interpreter.
   */
  static ToolRegistry createToolRegistry(Configuration cfg) {
    String dbUrl = cfg.getString("database.url", "jdbc:duckdb:data/ecommerce.db");
    JdbcDataStore store =
        new JdbcDataStore(
            dbUrl, cfg.getString("database.schema", "main"), cfg.getInt("database.max-rows", 1000));

    String endpoint = cfg.getString("tools.endpoint", "");
    URI remote;
    try {
      remote = endpoint == null || endpoint.isBlank() ? null : URI.create(endpoint.trim());
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid tools.endpoint: " + endpoint, e);
    }

    WebTools webTools =
        new WebTools(
            OkHttpFactory.create(Duration.ofSeconds(cfg.getLong("web.timeout-seconds", 10))),
            cfg.getString("web.search-url", "https://api.duckduckgo.com/"),
            cfg.getInt("web.max-chars", 2000));
    SandboxExecutor sandbox =
        new SandboxExecutor(
            SandboxPolicy.defaults(),
            new SnippetCompiler(),
            new SandboxLauncher(
                cfg.getInt("sandbox.max-heap-mb", SandboxLauncher.DEFAULT_MAX_HEAP_MB),
                Duration.ofMillis(
                    cfg.getLong(
                        "sandbox.startup-timeout-ms",
                        SandboxLauncher.DEFAULT_STARTUP_TIMEOUT.toMillis()))),
            Duration.ofMillis(cfg.getLong("sandbox.timeout-ms", 5000)),
            cfg.getInt("sandbox.max-output-chars", 20_000));

    ToolRegistry registry = new ToolRegistry();
    registry.registerAll(new DatabaseTools(store).descriptors(remote));
    registry.registerAll(webTools.descriptors());
    registry.register(sandbox.descriptor());
    return registry;
  }

  private Orchestrator createOrchestrator() {
    List<AgentDefinition> definitions = AgentDefinition.fromConfiguration(configuration());
    if (definitions.isEmpty()) {
      throw new ConfigException("No agents configured; add entries under 'agents'");
    }
    List<Agent> agents =
        new AgentFactory(toolGateway, llmClient, promptRepository).createAll(definitions);
    SpeakerSelector selector =
        new SpeakerSelector(
            new LlmSpeakerDecisionFunction(llmClient, promptRepository),
            configuration().getInt("orchestrator.max-consecutive-turns", 10));
    TraceSink traceSink =
        configuration().getBoolean("orchestrator.trace.enabled", true)
            ? new LoggingTraceSink(
                com.gentoro.agentops.logging.LoggingService.getLogger(LoggingTraceSink.class),
                configuration().getInt("orchestrator.trace.preview-chars", 500))
            : new NoOpTraceSink();
    return new Orchestrator(
        agents,
        selector,
        configuration().getInt("orchestrator.max-rounds", Orchestrator.DEFAULT_MAX_ROUNDS),
        traceSink);
  }

  private void startHttpServer() {
    if (!configuration().getBoolean("http.enabled", true)) {
      log.info("HTTP server disabled (http.enabled=false)");
      return;
    }
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ToolEndpointServer(
              httpServer,
              toolRegistry,
              configuration().getString("http.mcp.endpoint", ToolEndpointServer.DEFAULT_PATH))
          .register();
      new HealthService(httpServer, this::healthDetails).register();
      if (orchestrator != null && configuration().getBoolean("http.query.enabled", true)) {
        new QueryService(httpServer, orchestrator, toolGateway).register();
      }
      httpServer.start();
    } catch (Exception e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
  }

  private Map<String, Object> healthDetails() {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("database", configuration().getString("database.url", ""));
    details.put("read_only", true);
    details.put(
        "tools",
        toolRegistry.all().stream()
            .filter(ToolDescriptor::servedRemotely)
            .map(ToolDescriptor::name)
            .toList());
    details.put("query", orchestrator != null);
    return details;
  }

  /** Block until a shutdown signal (Ctrl+C, JVM termination or {@link #shutdown()}) arrives. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "agentops-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (httpServer != null) {
          httpServer.close();
        }
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("AgentOps not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public PromptRepository promptRepository() {
    return promptRepository;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public ToolRegistry toolRegistry() {
    return toolRegistry;
  }

  public ToolGateway toolGateway() {
    return toolGateway;
  }

  public LlmClient llmClient() {
    return llmClient;
  }

  public Orchestrator orchestrator() {
    return orchestrator;
  }

  /**
   * Detach console appenders and log to a rolling file instead, so the interactive console only
   * shows the conversation.
   */
  private void configureFileOnlyLogging() {
    LoggerContext context = (LoggerContext) org.slf4j.LoggerFactory.getILoggerFactory();
    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    for (java.util.Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders();
        it.hasNext(); ) {
      Appender<ILoggingEvent> app = it.next();
      if (app instanceof ConsoleAppender) {
        root.detachAppender(app);
      }
    }

    File logsDir = new File(configuration().getString("logging.dir", "logs"));
    if (!logsDir.exists() && !logsDir.mkdirs()) {
      log.warn("Could not create log directory {}", logsDir.getAbsolutePath());
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "agentops.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(
        new File(logsDir, "agentops.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info(
        "Interactive mode: console logging disabled; file logging enabled at {}",
        fileAppender.getFile());
  }
}
