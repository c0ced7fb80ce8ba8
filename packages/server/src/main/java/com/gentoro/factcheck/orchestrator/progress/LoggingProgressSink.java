package com.gentoro.factcheck.orchestrator.progress;

import com.gentoro.factcheck.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Progress sink that emits structured JSON messages to the application logs.
 *
 * <p>Messages are emitted under category "chat.progress" via the provided logger. Each message
 * summarizes the update rather than repeating the full results:
 *
 * <pre>
 * {
 *   "userId": "u-1",
 *   "chatId": "c-1",
 *   "styleMode": "descriptive",
 *   "status": "processing|completed",
 *   "claims": 3,
 *   "instances": 2,
 *   "errors": 0,
 *   "hasOutput": false,
 *   "protocolVersion": 1
 * }
 * </pre>
 */
public class LoggingProgressSink implements ProgressSink {
  private static final int PROTOCOL_VERSION = 1;

  private final org.slf4j.Logger log;

  public LoggingProgressSink(org.slf4j.Logger logger) {
    this.log = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void update(ProgressUpdate update) {
    log.info("[chat.progress] {}", JacksonUtility.toJson(createPayload(update)));
  }

  /** Summary of one update as a flat map. */
  protected Map<String, Object> createPayload(ProgressUpdate update) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("userId", update.userId());
    payload.put("chatId", update.sessionId());
    payload.put("styleMode", update.styleMode());
    payload.put(
        "status",
        update.isFinal() ? ChatDocument.STATUS_COMPLETED : ChatDocument.STATUS_PROCESSING);
    payload.put("claims", update.processedClaims() == null ? 0 : update.processedClaims().size());
    payload.put(
        "instances", update.processedInstances() == null ? 0 : update.processedInstances().size());
    payload.put("errors", update.errors().size());
    payload.put("hasOutput", update.outputText() != null && !update.outputText().isEmpty());
    payload.put("protocolVersion", PROTOCOL_VERSION);
    return payload;
  }
}
