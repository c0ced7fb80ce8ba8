package com.gentoro.factcheck.model;

import com.gentoro.factcheck.exception.ExceptionUtil;
import com.gentoro.factcheck.exception.LlmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base {@link ModelClient} holding the history bookkeeping shared by providers.
 *
 * <p>Subclasses implement {@link #runInference(List)} to execute a single turn with a concrete
 * provider SDK. This class appends the outgoing message to a copy of the history, appends the
 * reply, times the call and wraps provider failures into {@link LlmException}.
 */
public abstract class AbstractModelClient implements ModelClient {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(AbstractModelClient.class);

  protected final ModelSettings settings;

  protected AbstractModelClient(ModelSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public ModelSettings settings() {
    return settings;
  }

  @Override
  public ModelResponse send(List<Turn> history, List<Part> message) {
    if (message == null || message.isEmpty()) {
      throw new LlmException("Cannot send an empty message to the model");
    }
    List<Turn> contents = new ArrayList<>(history == null ? List.of() : history);
    contents.add(Turn.user(message));
    log.trace(
        "send() called with {} prior turn(s), {} part(s), tool mode {}",
        contents.size() - 1,
        message.size(),
        settings.toolCallingMode().kind());

    long start = System.currentTimeMillis();
    Turn reply;
    try {
      reply = runInference(contents);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          (ex) ->
              new LlmException(
                  "There was a problem while running the inference with the chosen model.", ex));
    } finally {
      log.debug("Model call took {} ms", System.currentTimeMillis() - start);
    }

    if (reply == null || reply.parts().isEmpty()) {
      throw new LlmException("Model returned a response without content");
    }
    contents.add(reply);
    return new ModelResponse(reply.parts(), contents);
  }

  /**
   * Execute a single model turn.
   *
   * @param contents full history including the new user turn as its last element
   * @return the model-role reply
   */
  protected abstract Turn runInference(List<Turn> contents) throws Exception;
}
