package com.gentoro.factcheck.model;

import org.apache.commons.configuration2.Configuration;

/** Generation parameters shared by the model instances of a conversation. */
public record GenerationOptions(
    String modelName, float temperature, float verificationTemperature, int maxOutputTokens) {

  public static final float DEFAULT_TEMPERATURE = 0.2f;
  public static final int DEFAULT_MAX_OUTPUT_TOKENS = 8192;

  /**
   * Read {@code model} and {@code options.*} from a provider profile subset.
   *
   * @param defaultModel model used when the profile names none
   */
  public static GenerationOptions fromConfiguration(Configuration profile, String defaultModel) {
    float temperature = profile.getFloat("options.temperature", DEFAULT_TEMPERATURE);
    return new GenerationOptions(
        profile.getString("model", defaultModel),
        temperature,
        profile.getFloat("options.verification-temperature", temperature),
        profile.getInt("options.max-output-tokens", DEFAULT_MAX_OUTPUT_TOKENS));
  }
}
