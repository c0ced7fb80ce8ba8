package com.gentoro.factcheck.chat;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** A user message as received from a client. Both snake_case and camelCase keys are accepted. */
public record ChatRequest(
    @JsonProperty("user_id") @JsonAlias("userId") String userId,
    @JsonProperty("chat_id") @JsonAlias({"chatId", "chat_history_id"}) String chatId,
    @JsonProperty("message_id") @JsonAlias("messageId") String messageId,
    @JsonProperty("text") String text,
    @JsonProperty("style_mode") @JsonAlias("styleMode") String styleMode,
    @JsonProperty("attachments") @JsonAlias("uploaded_files") List<Attachment> attachments) {

  public ChatRequest {
    attachments = attachments == null ? List.of() : List.copyOf(attachments);
  }

  public ChatRequest withUserId(String userId) {
    return new ChatRequest(userId, chatId, messageId, text, styleMode, attachments);
  }

  public ChatRequest withChatId(String chatId) {
    return new ChatRequest(userId, chatId, messageId, text, styleMode, attachments);
  }
}
