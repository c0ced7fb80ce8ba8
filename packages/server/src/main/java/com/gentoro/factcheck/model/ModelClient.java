package com.gentoro.factcheck.model;

import java.util.List;

/**
 * A configured chat model instance. Implementations are stateless with respect to the
 * conversation: callers pass the prior history and receive the updated one.
 */
public interface ModelClient {

  /**
   * Send a user-role message on top of {@code history}.
   *
   * @param history prior turns, oldest first; never mutated
   * @param message parts of the new user-role turn (text, attachments or function responses)
   * @return the reply parts and the history extended with the message and the reply
   * @throws com.gentoro.factcheck.exception.LlmException on transport or provider failure
   */
  ModelResponse send(List<Turn> history, List<Part> message);

  ModelSettings settings();
}
