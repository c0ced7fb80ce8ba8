package com.gentoro.factcheck.model;

import com.google.genai.Client;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HarmBlockThreshold;
import java.util.List;

/** Chat model backed by the Google Gen AI SDK. History is managed by the caller. */
public class GeminiModelClient extends AbstractModelClient {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(GeminiModelClient.class);

  private final Client geminiClient;
  private final GenerateContentConfig config;

  public GeminiModelClient(
      Client geminiClient, ModelSettings settings, HarmBlockThreshold.Known safetyThreshold) {
    super(settings);
    this.geminiClient = geminiClient;
    this.config = buildConfig(settings, safetyThreshold);
  }

  private static GenerateContentConfig buildConfig(
      ModelSettings settings, HarmBlockThreshold.Known safetyThreshold) {
    GenerateContentConfig.Builder builder =
        GenerateContentConfig.builder()
            .temperature(settings.temperature())
            .maxOutputTokens(settings.maxOutputTokens())
            .safetySettings(GeminiContentMapper.safetySettings(safetyThreshold));
    if (settings.systemInstruction() != null && !settings.systemInstruction().isBlank()) {
      builder.systemInstruction(
          GeminiContentMapper.systemInstruction(settings.systemInstruction()));
    }
    if (!settings.tools().isEmpty()) {
      builder
          .tools(List.of(GeminiContentMapper.functionTool(settings.tools())))
          .toolConfig(GeminiContentMapper.toolConfig(settings.toolCallingMode()));
    }
    return builder.build();
  }

  @Override
  protected Turn runInference(List<Turn> contents) {
    log.trace("Running inference with model: {}", settings.modelName());
    GenerateContentResponse response =
        geminiClient.models.generateContent(
            settings.modelName(), GeminiContentMapper.toContents(contents), config);

    log.trace(
        "Gemini reported a total of {} token(s).",
        response.usageMetadata().flatMap(u -> u.totalTokenCount()).orElse(0));

    Content content =
        response
            .candidates()
            .filter(candidates -> !candidates.isEmpty())
            .flatMap(candidates -> candidates.get(0).content())
            .orElse(null);
    if (content == null) {
      log.warn("Gemini returned no candidate content (finish reason: {})", response.finishReason());
      return Turn.model(List.of());
    }
    Turn turn = GeminiContentMapper.fromContent(content);
    return Turn.model(turn.parts());
  }
}
