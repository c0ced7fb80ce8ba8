package com.gentoro.factcheck.orchestrator.progress;

import com.gentoro.factcheck.exception.ErrorDetails;
import com.gentoro.factcheck.tools.ImpreciseLanguageInstance;
import com.gentoro.factcheck.tools.VerificationResult;
import java.util.List;
import java.util.Objects;

/**
 * One progress upsert for a chat. Absent fields ({@code null}) are left untouched by the sink.
 */
public record ProgressUpdate(
    String userId,
    String sessionId,
    String styleMode,
    String outputText,
    List<VerificationResult> processedClaims,
    List<ImpreciseLanguageInstance> processedInstances,
    List<ErrorDetails> errors,
    boolean isFinal) {

  public ProgressUpdate {
    Objects.requireNonNull(sessionId, "sessionId");
    processedClaims = processedClaims == null ? null : List.copyOf(processedClaims);
    processedInstances = processedInstances == null ? null : List.copyOf(processedInstances);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  public static Builder builder(String userId, String sessionId, String styleMode) {
    return new Builder(userId, sessionId, styleMode);
  }

  public static final class Builder {
    private final String userId;
    private final String sessionId;
    private final String styleMode;
    private String outputText;
    private List<VerificationResult> processedClaims;
    private List<ImpreciseLanguageInstance> processedInstances;
    private List<ErrorDetails> errors;
    private boolean isFinal;

    private Builder(String userId, String sessionId, String styleMode) {
      this.userId = userId;
      this.sessionId = sessionId;
      this.styleMode = styleMode;
    }

    public Builder outputText(String outputText) {
      this.outputText = outputText;
      return this;
    }

    public Builder processedClaims(List<VerificationResult> processedClaims) {
      this.processedClaims = processedClaims;
      return this;
    }

    public Builder processedInstances(List<ImpreciseLanguageInstance> processedInstances) {
      this.processedInstances = processedInstances;
      return this;
    }

    public Builder errors(List<ErrorDetails> errors) {
      this.errors = errors;
      return this;
    }

    public Builder finalUpdate() {
      this.isFinal = true;
      return this;
    }

    public ProgressUpdate build() {
      return new ProgressUpdate(
          userId,
          sessionId,
          styleMode,
          outputText,
          processedClaims,
          processedInstances,
          errors,
          isFinal);
    }
  }
}
