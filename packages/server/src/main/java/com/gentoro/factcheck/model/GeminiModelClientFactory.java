package com.gentoro.factcheck.model;

import com.google.genai.Client;
import com.google.genai.types.HarmBlockThreshold;

/** Creates Gemini chat and verification clients sharing one SDK client. */
public class GeminiModelClientFactory implements ModelClientFactory {
  private final Client client;
  private final String defaultModel;
  private final HarmBlockThreshold.Known safetyThreshold;

  public GeminiModelClientFactory(
      Client client, String defaultModel, HarmBlockThreshold.Known safetyThreshold) {
    this.client = client;
    this.defaultModel = defaultModel;
    this.safetyThreshold = safetyThreshold;
  }

  @Override
  public String defaultModel() {
    return defaultModel;
  }

  @Override
  public ModelClient createChatClient(ModelSettings settings) {
    return new GeminiModelClient(client, settings, safetyThreshold);
  }

  @Override
  public VerificationModelClient createVerificationClient(ModelSettings settings) {
    return new GeminiVerificationClient(client, settings, safetyThreshold);
  }
}
