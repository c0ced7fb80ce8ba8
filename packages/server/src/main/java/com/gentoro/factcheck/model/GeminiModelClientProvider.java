package com.gentoro.factcheck.model;

import com.gentoro.factcheck.exception.ConfigException;
import com.google.genai.Client;
import com.google.genai.types.HarmBlockThreshold;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/**
 * SPI provider for Google Gemini. Uses the Gemini API when {@code apiKey} is set, otherwise Vertex
 * AI with {@code project} and {@code location}.
 */
public final class GeminiModelClientProvider implements ModelClientProvider {
  static final String DEFAULT_MODEL = "gemini-1.5-pro-002";

  @Override
  public String providerId() {
    return "gemini";
  }

  @Override
  public ModelClientFactory create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("apiKey");
    String project = subConfiguration.getString("project");
    Client client;
    if (apiKey != null && !apiKey.isBlank()) {
      client = Client.builder().apiKey(apiKey).build();
    } else if (project != null && !project.isBlank()) {
      client =
          Client.builder()
              .vertexAI(true)
              .project(project)
              .location(subConfiguration.getString("location", "us-central1"))
              .build();
    } else {
      throw new ConfigException(
          "Gemini requires either llm.<profile>.apiKey or llm.<profile>.project in configuration");
    }
    return new GeminiModelClientFactory(
        client,
        subConfiguration.getString("model", DEFAULT_MODEL),
        parseThreshold(subConfiguration.getString("options.safety-threshold", "BLOCK_NONE")));
  }

  static HarmBlockThreshold.Known parseThreshold(String value) {
    try {
      return HarmBlockThreshold.Known.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown safety threshold: " + value, e);
    }
  }
}
