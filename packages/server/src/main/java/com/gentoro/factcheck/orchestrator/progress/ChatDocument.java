package com.gentoro.factcheck.orchestrator.progress;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client-facing state of one chat: status, answer messages and the claims and instances found so
 * far. Mutated only through {@link ChatDocumentStore}.
 */
public final class ChatDocument {
  public static final String STATUS_PROCESSING = "processing";
  public static final String STATUS_COMPLETED = "completed";

  private final String userId;
  private final String chatId;
  private String mode;
  private String status;
  private String lastMessage;
  private Instant updatedAt;
  private final List<Map<String, Object>> messages = new ArrayList<>();
  private final Map<String, Map<String, Object>> processedClaims = new LinkedHashMap<>();
  private final Map<String, Map<String, Object>> impreciseLanguageInstances =
      new LinkedHashMap<>();

  ChatDocument(String userId, String chatId) {
    this.userId = userId;
    this.chatId = chatId;
  }

  void touch(String mode, boolean isFinal, Instant now) {
    this.mode = mode;
    this.status = isFinal ? STATUS_COMPLETED : STATUS_PROCESSING;
    this.updatedAt = now;
  }

  void addAnswer(String id, String content, boolean isFinal, Instant now) {
    Map<String, Object> message = new LinkedHashMap<>();
    message.put("id", id);
    message.put("content", content);
    message.put("type", "answer");
    message.put("status", isFinal ? STATUS_COMPLETED : STATUS_PROCESSING);
    message.put("timestamp", now.toString());
    messages.add(message);
    this.lastMessage = content;
  }

  void upsertClaim(String id, Map<String, Object> data, String styleMode, Instant now) {
    upsert(processedClaims, id, "claim_data", data, styleMode, now);
  }

  void upsertInstance(String id, Map<String, Object> data, String styleMode, Instant now) {
    upsert(impreciseLanguageInstances, id, "instance_data", data, styleMode, now);
  }

  private static void upsert(
      Map<String, Map<String, Object>> collection,
      String id,
      String dataField,
      Map<String, Object> data,
      String styleMode,
      Instant now) {
    Map<String, Object> entry = collection.computeIfAbsent(id, k -> new LinkedHashMap<>());
    entry.put("id", id);
    entry.put(dataField, data);
    entry.put("style_mode", styleMode);
    entry.put("timestamp", now.toString());
  }

  /** Deep copy as plain maps and lists, suitable for JSON rendering. */
  Map<String, Object> snapshot() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("userId", userId);
    map.put("chatId", chatId);
    map.put("mode", mode);
    map.put("status", status);
    map.put("lastMessage", lastMessage);
    map.put("updatedAt", updatedAt == null ? null : updatedAt.toString());
    map.put("messages", copyAll(messages));
    map.put("processed_claims", copyAll(processedClaims.values()));
    map.put("imprecise_language_instances", copyAll(impreciseLanguageInstances.values()));
    return map;
  }

  private static List<Map<String, Object>> copyAll(Iterable<Map<String, Object>> source) {
    List<Map<String, Object>> copy = new ArrayList<>();
    source.forEach(m -> copy.add(new LinkedHashMap<>(m)));
    return copy;
  }
}
