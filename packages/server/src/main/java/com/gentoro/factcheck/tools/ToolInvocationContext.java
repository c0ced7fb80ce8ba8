package com.gentoro.factcheck.tools;

import com.gentoro.factcheck.exception.ErrorDetails;
import com.gentoro.factcheck.exception.ExceptionUtil;
import com.gentoro.factcheck.model.VerificationModelClient;
import com.gentoro.factcheck.orchestrator.progress.ProgressSink;
import com.gentoro.factcheck.orchestrator.progress.ProgressUpdate;
import com.gentoro.factcheck.prompt.PromptTemplate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Request-scoped state shared by the tool handlers of one conversation: who is asking, the
 * verification collaborators, where progress goes, and what the handlers produced so far.
 *
 * <p>Not thread-safe; a conversation runs its tool calls sequentially.
 */
public class ToolInvocationContext {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ToolInvocationContext.class);

  private final String userId;
  private final String sessionId;
  private final String styleMode;
  private final boolean workflowEngaged;
  private final VerificationModelClient verificationClient;
  private final PromptTemplate verificationPrompt;
  private final ProgressSink progressSink;

  private final List<ErrorDetails> errors = new ArrayList<>();
  private List<VerificationResult> processedClaims;
  private List<ImpreciseLanguageInstance> processedInstances;

  public ToolInvocationContext(
      String userId,
      String sessionId,
      String styleMode,
      boolean workflowEngaged,
      VerificationModelClient verificationClient,
      PromptTemplate verificationPrompt,
      ProgressSink progressSink) {
    this.userId = userId;
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.styleMode = styleMode;
    this.workflowEngaged = workflowEngaged;
    this.verificationClient = verificationClient;
    this.verificationPrompt = verificationPrompt;
    this.progressSink = Objects.requireNonNull(progressSink, "progressSink");
  }

  public String userId() {
    return userId;
  }

  public String sessionId() {
    return sessionId;
  }

  public String styleMode() {
    return styleMode;
  }

  public boolean workflowEngaged() {
    return workflowEngaged;
  }

  public VerificationModelClient verificationClient() {
    return verificationClient;
  }

  public PromptTemplate verificationPrompt() {
    return verificationPrompt;
  }

  /** Forward a progress update; a failing sink is logged and does not affect the conversation. */
  public void publish(ProgressUpdate update) {
    try {
      progressSink.update(update);
    } catch (RuntimeException e) {
      log.warn("Progress update for chat {} could not be stored", sessionId, e);
      recordError(e);
    }
  }

  public void recordError(Throwable t) {
    errors.add(ExceptionUtil.toErrorDetails(t));
  }

  public List<ErrorDetails> errors() {
    return Collections.unmodifiableList(errors);
  }

  void recordClaims(List<VerificationResult> claims) {
    this.processedClaims = List.copyOf(claims);
  }

  void recordInstances(List<ImpreciseLanguageInstance> instances) {
    this.processedInstances = List.copyOf(instances);
  }

  /** Claims from the latest claims round, or null when none ran successfully. */
  public List<VerificationResult> processedClaims() {
    return processedClaims;
  }

  /** Instances from the latest imprecise-language round, or null when none ran successfully. */
  public List<ImpreciseLanguageInstance> processedInstances() {
    return processedInstances;
  }
}
