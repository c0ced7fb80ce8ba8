package com.gentoro.factcheck.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable model providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in {@code
 * META-INF/services/com.gentoro.factcheck.model.ModelClientProvider}.
 */
public interface ModelClientProvider {

  /** A stable, lowercase identifier for this provider (e.g. "gemini"). */
  String providerId();

  /**
   * @param subConfiguration provider-specific configuration subset (e.g. {@code llm.default.*})
   * @throws com.gentoro.factcheck.exception.ConfigException when required keys are missing
   */
  ModelClientFactory create(Configuration subConfiguration);
}
