package com.gentoro.factcheck.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.factcheck.exception.ExceptionUtil;
import com.gentoro.factcheck.exception.LlmException;
import com.gentoro.factcheck.utility.JacksonUtility;
import com.google.genai.Client;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.GoogleSearch;
import com.google.genai.types.HarmBlockThreshold;
import com.google.genai.types.Tool;
import java.util.List;

/** Verification model with the Google Search grounding tool enabled. */
public class GeminiVerificationClient implements VerificationModelClient {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(GeminiVerificationClient.class);

  private final Client geminiClient;
  private final ModelSettings settings;
  private final GenerateContentConfig config;

  public GeminiVerificationClient(
      Client geminiClient, ModelSettings settings, HarmBlockThreshold.Known safetyThreshold) {
    this.geminiClient = geminiClient;
    this.settings = settings;
    GenerateContentConfig.Builder builder =
        GenerateContentConfig.builder()
            .temperature(settings.temperature())
            .maxOutputTokens(settings.maxOutputTokens())
            .safetySettings(GeminiContentMapper.safetySettings(safetyThreshold))
            .tools(List.of(Tool.builder().googleSearch(GoogleSearch.builder().build()).build()));
    if (settings.systemInstruction() != null && !settings.systemInstruction().isBlank()) {
      builder.systemInstruction(
          GeminiContentMapper.systemInstruction(settings.systemInstruction()));
    }
    this.config = builder.build();
  }

  @Override
  public GroundedResult generate(String prompt) {
    long start = System.currentTimeMillis();
    try {
      GenerateContentResponse response =
          geminiClient.models.generateContent(
              settings.modelName(),
              List.of(
                  Content.builder()
                      .role(Role.USER.wireName())
                      .parts(List.of(com.google.genai.types.Part.fromText(prompt)))
                      .build()),
              config);
      JsonNode document = JacksonUtility.getJsonMapper().readTree(response.toJson());
      return GroundedResult.fromJson(document);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, (ex) -> new LlmException("Grounded verification request failed.", ex));
    } finally {
      log.debug("Grounded generation took {} ms", System.currentTimeMillis() - start);
    }
  }
}
