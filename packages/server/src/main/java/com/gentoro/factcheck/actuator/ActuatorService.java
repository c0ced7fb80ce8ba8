package com.gentoro.factcheck.actuator;

import com.gentoro.factcheck.http.EmbeddedJettyServer;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check endpoint at {@code /actuator/health}.
 *
 * <p>Response body: {"status":"UP"}
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";

  private final EmbeddedJettyServer httpServer;

  public ActuatorService(EmbeddedJettyServer httpServer) {
    this.httpServer = httpServer;
  }

  public void register() {
    httpServer.getContextHandler().addServlet(new ServletHolder(new HealthServlet()), HEALTH_PATH);
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  static class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println("{\"status\": \"UP\"}");
      }
    }
  }
}
