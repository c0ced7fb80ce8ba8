package com.gentoro.factcheck.orchestrator.progress;

/** No-op implementation used when progress reporting is disabled or not available. */
public class NoOpProgressSink implements ProgressSink {
  @Override
  public void update(ProgressUpdate update) {}
}
