package com.gentoro.factcheck.http;

import com.gentoro.factcheck.exception.ConfigException;
import com.gentoro.factcheck.exception.ExceptionUtil;
import com.gentoro.factcheck.exception.IoException;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server with a root {@link ServletContextHandler}.
 *
 * <p>Owns the Jetty lifecycle (start/stop/join) and exposes the context handler so that the chat
 * and actuator endpoints can register their servlets.
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(EmbeddedJettyServer.class);
  private static final String ANY_HOST = "0.0.0.0";

  private final Configuration configuration;
  private final Object lifecycleLock = new Object();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = configuration;
  }

  /** Prepare the Jetty Server and root ServletContextHandler without starting it. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }

      int port;
      try {
        port = configuration.getInt("http.port", 8080);
      } catch (Exception e) {
        throw new ConfigException("Failed to resolve http.port configuration", e);
      }

      String hostname;
      try {
        hostname = configuration.getString("http.hostname", ANY_HOST);
        if (Objects.isNull(hostname) || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        hostname = hostname.trim();
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e, (ex) -> new ConfigException("Failed to resolve http.hostname configuration", ex));
      }

      try {
        server = new Server();
        ServerConnector connector = new ServerConnector(server);
        if (!ANY_HOST.equals(hostname)) {
          connector.setHost(hostname);
        }
        connector.setPort(port);
        server.addConnector(connector);

        contextHandler = new ServletContextHandler();
        contextHandler.setContextPath("/");
        server.setHandler(contextHandler);
        log.trace("Prepared Jetty server for {}:{}", hostname, port);
      } catch (Exception e) {
        server = null;
        contextHandler = null;
        throw new IoException(
            "Could not initialize the HTTP server on %s:%d".formatted(hostname, port), e);
      }
    }
  }

  /** Start Jetty if not already started. Listens on {@code http.port} (default 8080). */
  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }

      try {
        server.start();
        log.info("Jetty listening on http://localhost:{}", getPort());
      } catch (Exception e) {
        throw ExceptionUtil.rethrowIfUnchecked(
            e,
            (ex) ->
                new IoException(
                    "Could not start the HTTP server. Check that the configured port and hostname"
                        + " are available.",
                    ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) {
        return;
      }
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
        }
      } catch (Exception e) {
        log.error("Error stopping Jetty server, continuing shutdown", e);
      } finally {
        server = null;
        contextHandler = null;
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return configuration.getInt("http.port", 8080);
    }
  }

  public ServletContextHandler getContextHandler() {
    synchronized (lifecycleLock) {
      if (contextHandler == null) {
        throw new IllegalStateException("HTTP server not prepared");
      }
      return contextHandler;
    }
  }

  @Override
  public void close() {
    stop();
  }
}
