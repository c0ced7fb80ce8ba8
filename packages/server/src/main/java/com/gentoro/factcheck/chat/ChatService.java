package com.gentoro.factcheck.chat;

import com.gentoro.factcheck.exception.ValidationException;
import com.gentoro.factcheck.model.GenerationOptions;
import com.gentoro.factcheck.model.ModelClientFactory;
import com.gentoro.factcheck.model.ModelSettings;
import com.gentoro.factcheck.model.Part;
import com.gentoro.factcheck.model.ToolDefinition;
import com.gentoro.factcheck.orchestrator.ConversationOrchestrator;
import com.gentoro.factcheck.orchestrator.ConversationRequest;
import com.gentoro.factcheck.orchestrator.ConversationResult;
import com.gentoro.factcheck.orchestrator.PhaseModels;
import com.gentoro.factcheck.orchestrator.progress.ProgressSink;
import com.gentoro.factcheck.orchestrator.progress.ProgressUpdate;
import com.gentoro.factcheck.prompt.PromptCatalog;
import com.gentoro.factcheck.prompt.PromptTemplate;
import com.gentoro.factcheck.tools.ImpreciseLanguageInstance;
import com.gentoro.factcheck.tools.ToolKind;
import com.gentoro.factcheck.tools.VerificationResult;
import com.gentoro.factcheck.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry point for a chat message: prepares prompts, tools and models, runs the conversation and
 * publishes the final result.
 */
public class ChatService {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ChatService.class);

  public static final String DEFAULT_STYLE_MODE = "descriptive";
  public static final String DEFAULT_ENGAGE_TRIGGER =
      "Please find all medical claims and instances of imprecise language. Be thorough and"
          + " complete.";

  private final PromptCatalog promptCatalog;
  private final ModelClientFactory modelClientFactory;
  private final GenerationOptions generationOptions;
  private final ConversationOrchestrator orchestrator;
  private final ProgressSink progressSink;
  private final String engageTrigger;

  public ChatService(
      PromptCatalog promptCatalog,
      ModelClientFactory modelClientFactory,
      GenerationOptions generationOptions,
      ConversationOrchestrator orchestrator,
      ProgressSink progressSink,
      String engageTrigger) {
    this.promptCatalog = promptCatalog;
    this.modelClientFactory = modelClientFactory;
    this.generationOptions = generationOptions;
    this.orchestrator = orchestrator;
    this.progressSink = progressSink;
    this.engageTrigger = engageTrigger;
  }

  /**
   * @throws com.gentoro.factcheck.exception.ConfigException when a prompt or tool definition is
   *     not configured
   * @throws ValidationException when the request carries neither text nor attachments
   */
  public ChatReply handle(ChatRequest request) {
    if (request.userId() == null || request.userId().isBlank()) {
      throw new ValidationException("Missing user id");
    }
    String text = StringUtility.collapseWhitespace(request.text());
    List<Part> prompt = new ArrayList<>();
    request.attachments().forEach(a -> prompt.add(a.toPart()));
    if (text != null && !text.isBlank()) {
      prompt.add(Part.text(text));
    }
    if (prompt.isEmpty()) {
      throw new ValidationException("A chat message needs text or attachments");
    }
    boolean workflowEngaged = text != null && text.contains(engageTrigger);
    String styleMode =
        request.styleMode() == null || request.styleMode().isBlank()
            ? DEFAULT_STYLE_MODE
            : request.styleMode();

    String rolePrompt = promptCatalog.prompt(PromptCatalog.ROLE_PROMPT);
    PromptTemplate verificationPrompt = promptCatalog.template(PromptCatalog.VERIFICATION_PROMPT);
    List<ToolDefinition> tools =
        List.of(
            toolDefinition(ToolKind.IMPRECISE_LANGUAGE_IDENTIFICATION),
            toolDefinition(ToolKind.MEDICAL_CLAIMS_IDENTIFICATION));

    ModelSettings base =
        ModelSettings.of(
            generationOptions.modelName(),
            rolePrompt,
            generationOptions.temperature(),
            generationOptions.maxOutputTokens());
    PhaseModels models =
        PhaseModels.create(
            modelClientFactory,
            base,
            base.withTemperature(generationOptions.verificationTemperature()),
            tools,
            ToolKind.MEDICAL_CLAIMS_IDENTIFICATION.functionName(),
            ToolKind.IMPRECISE_LANGUAGE_IDENTIFICATION.functionName(),
            workflowEngaged);

    log.info(
        "Handling message for chat {} (workflow engaged: {}, {} attachment(s))",
        request.chatId(),
        workflowEngaged,
        request.attachments().size());
    ConversationResult result =
        orchestrator.run(
            new ConversationRequest(
                request.userId(),
                request.chatId(),
                prompt,
                workflowEngaged,
                styleMode,
                verificationPrompt,
                true),
            models,
            progressSink);

    String outputText = result.displayText();
    publishFinal(request.userId(), styleMode, outputText, result);
    return new ChatReply(
        outputText,
        result.sessionId(),
        result.processedClaims() == null
            ? null
            : result.processedClaims().stream()
                .map(VerificationResult::toMap)
                .collect(Collectors.toList()),
        result.processedInstances() == null
            ? null
            : result.processedInstances().stream()
                .map(ImpreciseLanguageInstance::toMap)
                .collect(Collectors.toList()),
        result.errors());
  }

  private ToolDefinition toolDefinition(ToolKind kind) {
    return promptCatalog.toolDefinition(
        kind.functionName(), kind.descriptionKey(), kind.parametersKey());
  }

  private void publishFinal(
      String userId, String styleMode, String outputText, ConversationResult result) {
    try {
      progressSink.update(
          ProgressUpdate.builder(userId, result.sessionId(), styleMode)
              .outputText(outputText)
              .processedClaims(result.processedClaims())
              .processedInstances(result.processedInstances())
              .errors(result.errors())
              .finalUpdate()
              .build());
    } catch (RuntimeException e) {
      log.error("Final progress update for chat {} failed", result.sessionId(), e);
    }
  }
}
