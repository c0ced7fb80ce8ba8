package com.gentoro.factcheck.orchestrator;

import com.gentoro.factcheck.model.Part;
import com.gentoro.factcheck.prompt.PromptTemplate;
import java.util.List;
import java.util.Objects;

/**
 * Input of one orchestrated conversation turn.
 *
 * @param sessionId existing session to continue, or null to start a new one
 * @param prompt user message parts: attachments first, then the text
 * @param verificationPrompt template rendered once per claim with {@code input_claim}
 */
public record ConversationRequest(
    String userId,
    String sessionId,
    List<Part> prompt,
    boolean workflowEngaged,
    String styleMode,
    PromptTemplate verificationPrompt,
    boolean saveHistory) {

  public ConversationRequest {
    Objects.requireNonNull(userId, "userId");
    prompt = List.copyOf(prompt);
    if (prompt.isEmpty()) {
      throw new IllegalArgumentException("prompt must contain at least one part");
    }
    Objects.requireNonNull(verificationPrompt, "verificationPrompt");
  }
}
