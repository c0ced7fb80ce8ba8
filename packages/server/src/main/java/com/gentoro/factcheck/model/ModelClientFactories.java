package com.gentoro.factcheck.model;

import com.gentoro.factcheck.exception.ConfigException;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Resolves the active {@link ModelClientFactory} from configuration.
 *
 * <pre>
 *   llm.active-profile = default
 *   llm.default.provider = gemini
 *   llm.default.apiKey = ${env:GEMINI_API_KEY}
 *   llm.default.model = gemini-1.5-pro-002
 * </pre>
 */
public final class ModelClientFactories {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(ModelClientFactories.class);

  private ModelClientFactories() {}

  public static ModelClientFactory fromConfiguration(Configuration configuration) {
    return create(activeProfile(configuration));
  }

  /** The {@code llm.<active-profile>} subset. */
  public static Configuration activeProfile(Configuration configuration) {
    String profile = configuration.getString("llm.active-profile", "default").trim();
    if (profile.isEmpty() || !configuration.getKeys("llm.%s".formatted(profile)).hasNext()) {
      throw new ConfigException("Missing llm.%s configuration".formatted(profile));
    }
    return configuration.subset("llm.%s".formatted(profile));
  }

  public static ModelClientFactory create(Configuration subConfig) {
    String provider = subConfig.getString("provider");
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.<profile>.provider in configuration");
    }
    String providerId = provider.trim().toLowerCase(Locale.ROOT);
    for (ModelClientProvider p : ServiceLoader.load(ModelClientProvider.class)) {
      if (providerId.equals(p.providerId())) {
        log.info("Using model provider '{}'", providerId);
        return p.create(subConfig);
      }
    }
    throw new ConfigException("Unknown model provider: " + providerId);
  }
}
