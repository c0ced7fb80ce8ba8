package com.gentoro.factcheck.orchestrator;

import com.gentoro.factcheck.exception.ErrorDetails;
import com.gentoro.factcheck.exception.FactCheckErrorCode;
import com.gentoro.factcheck.tools.ImpreciseLanguageInstance;
import com.gentoro.factcheck.tools.VerificationResult;
import java.util.List;

/**
 * Outcome of one orchestrated conversation.
 *
 * @param processedClaims claims of the last successful claims round, or null
 * @param processedInstances instances of the last successful imprecise-language round, or null
 * @param errors everything that went wrong without stopping the conversation, in order
 * @param rounds number of tool-response round trips completed
 */
public record ConversationResult(
    String outputText,
    String sessionId,
    List<VerificationResult> processedClaims,
    List<ImpreciseLanguageInstance> processedInstances,
    List<ErrorDetails> errors,
    int rounds) {

  public ConversationResult {
    processedClaims = processedClaims == null ? null : List.copyOf(processedClaims);
    processedInstances = processedInstances == null ? null : List.copyOf(processedInstances);
    errors = List.copyOf(errors);
  }

  /** Answer text followed by one line per failed tool call. */
  public String displayText() {
    StringBuilder sb = new StringBuilder(outputText == null ? "" : outputText);
    for (ErrorDetails error : errors) {
      if (error.code() == FactCheckErrorCode.TOOL_EXECUTION_ERROR) {
        sb.append('\n').append(error.message());
      }
    }
    return sb.toString();
  }
}
