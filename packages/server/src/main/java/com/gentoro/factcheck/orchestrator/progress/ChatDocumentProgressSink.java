package com.gentoro.factcheck.orchestrator.progress;

import java.util.Objects;

/** Stores every update in the {@link ChatDocumentStore} and logs it. */
public class ChatDocumentProgressSink extends LoggingProgressSink {
  private final ChatDocumentStore store;

  public ChatDocumentProgressSink(ChatDocumentStore store, org.slf4j.Logger logger) {
    super(logger);
    this.store = Objects.requireNonNull(store, "store");
  }

  @Override
  public void update(ProgressUpdate update) {
    store.apply(update);
    super.update(update);
  }
}
