package com.gentoro.factcheck;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.gentoro.factcheck.actuator.ActuatorService;
import com.gentoro.factcheck.chat.BackgroundChatDispatcher;
import com.gentoro.factcheck.chat.ChatHttpService;
import com.gentoro.factcheck.chat.ChatService;
import com.gentoro.factcheck.chat.ChatTitleService;
import com.gentoro.factcheck.chat.InteractiveConsole;
import com.gentoro.factcheck.exception.IoException;
import com.gentoro.factcheck.exception.StateException;
import com.gentoro.factcheck.history.FileSystemHistoryStore;
import com.gentoro.factcheck.history.HistoryStore;
import com.gentoro.factcheck.http.EmbeddedJettyServer;
import com.gentoro.factcheck.model.GenerationOptions;
import com.gentoro.factcheck.model.ModelClientFactories;
import com.gentoro.factcheck.model.ModelClientFactory;
import com.gentoro.factcheck.orchestrator.ConversationOrchestrator;
import com.gentoro.factcheck.orchestrator.progress.ChatDocumentProgressSink;
import com.gentoro.factcheck.orchestrator.progress.ChatDocumentStore;
import com.gentoro.factcheck.orchestrator.progress.NoOpProgressSink;
import com.gentoro.factcheck.orchestrator.progress.ProgressSink;
import com.gentoro.factcheck.prompt.PromptCatalog;
import com.gentoro.factcheck.prompt.PromptRepositoryFactory;
import com.gentoro.factcheck.tools.ClaimsIdentificationHandler;
import com.gentoro.factcheck.tools.ImpreciseLanguageHandler;
import com.gentoro.factcheck.tools.ToolCallDecoder;
import com.gentoro.factcheck.tools.ToolDispatcher;
import com.gentoro.factcheck.verification.GroundedTextStructurer;
import com.gentoro.factcheck.verification.RateLimiter;
import com.gentoro.factcheck.verification.VerificationWorkerPool;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/** Application context: loads configuration, wires the chat pipeline and runs the chosen mode. */
public class FactCheck {

  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(FactCheck.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private PromptCatalog promptCatalog;
  private ModelClientFactory modelClientFactory;
  private GenerationOptions generationOptions;
  private ConversationOrchestrator orchestrator;
  private ChatDocumentStore documentStore;
  private EmbeddedJettyServer httpServer;
  private BackgroundChatDispatcher backgroundDispatcher;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public FactCheck(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public boolean isInteractiveModeEnabled() {
    return "interactive".equalsIgnoreCase(startupParameters.mode());
  }

  public void initialize() {
    if ("help".equals(startupParameters.mode())) {
      System.out.println(StartupParameters.usage());
      shutdownLatch.countDown();
      return;
    }

    // Disable java.util.logging, Jetty and the SDK log through SLF4J.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.factcheck.logging.LoggingService.applyConfiguration(configuration());

    this.promptCatalog =
        new PromptCatalog(PromptRepositoryFactory.createSource(configuration().subset("prompts")));
    Configuration llmProfile = ModelClientFactories.activeProfile(configuration());
    this.modelClientFactory = ModelClientFactories.create(llmProfile);
    this.generationOptions =
        GenerationOptions.fromConfiguration(llmProfile, modelClientFactory.defaultModel());
    this.orchestrator = new ConversationOrchestrator(createHistoryStore(), createToolDispatcher());
    this.documentStore = new ChatDocumentStore();

    if (isInteractiveModeEnabled()) {
      configureFileOnlyLogging();
      runConsole(createChatService(new NoOpProgressSink()));
      return;
    }
    startServer();
  }

  private void startServer() {
    ChatService chatService =
        createChatService(
            new ChatDocumentProgressSink(
                documentStore,
                com.gentoro.factcheck.logging.LoggingService.getLogger(ChatService.class)));
    this.backgroundDispatcher =
        new BackgroundChatDispatcher(
            chatService, configuration().getInt("chat.dispatch-threads", 4));

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ActuatorService(httpServer).register();
      new ChatHttpService(
              httpServer,
              configuration().getString("http.chat.context-path", "/chat"),
              chatService,
              backgroundDispatcher,
              documentStore,
              new ChatTitleService(promptCatalog, modelClientFactory, generationOptions))
          .register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
  }

  private void runConsole(ChatService chatService) {
    try {
      new InteractiveConsole(chatService)
          .run(new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out);
    } catch (IOException e) {
      throw new IoException("Console input failed", e);
    } finally {
      shutdown();
    }
  }

  ChatService createChatService(ProgressSink progressSink) {
    return new ChatService(
        promptCatalog,
        modelClientFactory,
        generationOptions,
        orchestrator,
        progressSink,
        configuration().getString("workflow.engage-trigger", ChatService.DEFAULT_ENGAGE_TRIGGER));
  }

  private HistoryStore createHistoryStore() {
    String dir = configuration().getString("history.storage.dir", "data/history");
    log.info("Conversation histories stored under {}", Path.of(dir).toAbsolutePath());
    return new FileSystemHistoryStore(Path.of(dir));
  }

  private ToolDispatcher createToolDispatcher() {
    RateLimiter rateLimiter =
        new RateLimiter(
            configuration().getInt("verification.rate-limit.max-calls-per-window", 60),
            Duration.ofSeconds(
                configuration().getLong("verification.rate-limit.window-seconds", 60L)));
    VerificationWorkerPool workerPool =
        new VerificationWorkerPool(rateLimiter, configuration().getInt("verification.workers", 8));
    return new ToolDispatcher(
        new ToolCallDecoder(),
        new ClaimsIdentificationHandler(workerPool, new GroundedTextStructurer()),
        new ImpreciseLanguageHandler());
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "factcheck-shutdown-hook");
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
        closeLogged(httpServer, "HTTP server");
        closeLogged(backgroundDispatcher, "chat dispatcher");
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeLogged(AutoCloseable closeable, String name) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception e) {
      log.warn("Failed to close {}", name, e);
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("FactCheck not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public ChatDocumentStore documentStore() {
    return documentStore;
  }

  /** Move logging from the console to a rolling file so that the chat loop owns the terminal. */
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
    fileAppender.setFile(new File(logsDir, "factcheck.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(
        new File(logsDir, "factcheck.%d{yyyy-MM-dd}.log.gz").getPath());
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
        "Interactive mode: console logging disabled, file logging at {}", fileAppender.getFile());
  }
}
