package com.gentoro.factcheck.orchestrator.progress;

/**
 * Receives incremental and final results of a conversation so a client can display claims and
 * instances before the answer is ready.
 *
 * <p>Updates are idempotent upserts keyed by the identifiers carried in the results. A partial
 * update populates only some fields; the final update marks the chat as completed.
 * Implementations should be lightweight; callers treat them as fire-and-forget.
 */
public interface ProgressSink {
  void update(ProgressUpdate update);
}
