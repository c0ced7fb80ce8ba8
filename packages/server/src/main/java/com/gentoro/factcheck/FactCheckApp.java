package com.gentoro.factcheck;

public class FactCheckApp {

  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(FactCheckApp.class);

  public static void main(String[] args) {
    FactCheck app;
    try {
      app = new FactCheck(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(StartupParameters.usage());
      System.exit(2);
      return;
    }
    try {
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      app.shutdown();
      System.exit(1);
    }
  }
}
