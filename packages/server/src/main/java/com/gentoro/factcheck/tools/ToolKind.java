package com.gentoro.factcheck.tools;

import java.util.Arrays;
import java.util.Optional;

/** The closed set of tools the conversation models may call. */
public enum ToolKind {
  MEDICAL_CLAIMS_IDENTIFICATION(
      "medical_claims_identification",
      "identify_medical_claims_multi_function",
      "Error when Identifying Medical Claims",
      "Error occurred while identifying medical claims. Please try again.",
      "Now perform imprecise language identification analysis."),
  IMPRECISE_LANGUAGE_IDENTIFICATION(
      "imprecise_language_identification",
      "identify_imprecise_language_multi_function",
      "Error when Identifying Imprecise Language",
      "Error occurred while identifying imprecise language. Please try again.",
      "Respond that the input text has been processed and summarize the findings.  Ask if the"
          + " user needs help understanding the findings or would like to know more  about any"
          + " finding in particular.");

  /** Next-step instruction returned when the guided workflow is not engaged. */
  public static final String PROCEED_INSTRUCTION = "Proceed";

  private final String functionName;
  private final String promptKeyPrefix;
  private final String errorPrefix;
  private final String retryInstruction;
  private final String engagedInstruction;

  ToolKind(
      String functionName,
      String promptKeyPrefix,
      String errorPrefix,
      String retryInstruction,
      String engagedInstruction) {
    this.functionName = functionName;
    this.promptKeyPrefix = promptKeyPrefix;
    this.errorPrefix = errorPrefix;
    this.retryInstruction = retryInstruction;
    this.engagedInstruction = engagedInstruction;
  }

  public String functionName() {
    return functionName;
  }

  /** Prompt key holding the function description shown to the model. */
  public String descriptionKey() {
    return promptKeyPrefix + "_description";
  }

  /** Prompt key holding the JSON parameter schema. */
  public String parametersKey() {
    return promptKeyPrefix + "_parameters";
  }

  public String errorPrefix() {
    return errorPrefix;
  }

  public String retryInstruction() {
    return retryInstruction;
  }

  public String nextStepInstruction(boolean workflowEngaged) {
    return workflowEngaged ? engagedInstruction : PROCEED_INSTRUCTION;
  }

  public static Optional<ToolKind> fromFunctionName(String name) {
    return Arrays.stream(values()).filter(k -> k.functionName.equals(name)).findFirst();
  }
}
