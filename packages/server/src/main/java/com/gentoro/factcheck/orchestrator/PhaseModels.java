package com.gentoro.factcheck.orchestrator;

import com.gentoro.factcheck.exception.StateException;
import com.gentoro.factcheck.model.ModelClient;
import com.gentoro.factcheck.model.ModelClientFactory;
import com.gentoro.factcheck.model.ModelSettings;
import com.gentoro.factcheck.model.ToolCallingMode;
import com.gentoro.factcheck.model.ToolDefinition;
import com.gentoro.factcheck.model.VerificationModelClient;
import java.util.List;
import java.util.Objects;

/**
 * The four model instances of one conversation.
 *
 * <p>The claims and imprecise-language models share the tool set. With the workflow engaged each
 * is forced to call its own tool; otherwise both choose freely. The terminal model has no tools,
 * and the verification model searches the web.
 */
public record PhaseModels(
    ModelClient claims,
    ModelClient impreciseLanguage,
    ModelClient terminal,
    VerificationModelClient verification) {

  public PhaseModels {
    Objects.requireNonNull(claims, "claims");
    Objects.requireNonNull(impreciseLanguage, "impreciseLanguage");
    Objects.requireNonNull(terminal, "terminal");
    Objects.requireNonNull(verification, "verification");
  }

  /**
   * @param tools tool set offered in the first two phases
   * @param claimsTool function forced in the claims phase when the workflow is engaged
   * @param impreciseLanguageTool function forced in the imprecise-language phase
   */
  public static PhaseModels create(
      ModelClientFactory factory,
      ModelSettings base,
      ModelSettings verificationSettings,
      List<ToolDefinition> tools,
      String claimsTool,
      String impreciseLanguageTool,
      boolean workflowEngaged) {
    ToolCallingMode claimsMode =
        workflowEngaged ? ToolCallingMode.forced(claimsTool) : ToolCallingMode.auto();
    ToolCallingMode impreciseMode =
        workflowEngaged ? ToolCallingMode.forced(impreciseLanguageTool) : ToolCallingMode.auto();
    return new PhaseModels(
        factory.createChatClient(base.withTools(tools, claimsMode)),
        factory.createChatClient(base.withTools(tools, impreciseMode)),
        factory.createChatClient(base.withoutTools()),
        factory.createVerificationClient(verificationSettings));
  }

  public ModelClient forPhase(Phase phase) {
    return switch (phase) {
      case CLAIMS_IDENTIFICATION -> claims;
      case IMPRECISE_LANGUAGE_IDENTIFICATION -> impreciseLanguage;
      case FREE_FORM -> terminal;
      case TERMINAL -> throw new StateException("No model serves the terminal phase");
    };
  }
}
