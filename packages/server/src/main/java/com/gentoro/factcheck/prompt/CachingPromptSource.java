package com.gentoro.factcheck.prompt;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link PromptSource} backed by two Caffeine caches: the reference document, refreshed once it
 * is older than the time-to-live, and prompt texts, kept for the lifetime of the process.
 *
 * <p>A failed refresh keeps serving the previously loaded references; the next read retries.
 * Refreshes run on the reading thread.
 */
public class CachingPromptSource implements PromptSource {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(CachingPromptSource.class);
  private static final String DOCUMENT_KEY = "references";

  private final LoadingCache<String, Map<String, Map<String, PromptReference>>> references;
  private final Cache<String, String> texts;
  private final PromptRepository repository;

  public CachingPromptSource(
      PromptReferenceLoader loader, PromptRepository repository, Duration ttl) {
    this(loader, repository, ttl, Ticker.systemTicker());
  }

  public CachingPromptSource(
      PromptReferenceLoader loader, PromptRepository repository, Duration ttl, Ticker ticker) {
    Objects.requireNonNull(loader, "loader");
    this.repository = Objects.requireNonNull(repository, "repository");
    this.references =
        Caffeine.newBuilder()
            .refreshAfterWrite(Objects.requireNonNull(ttl, "ttl"))
            .ticker(Objects.requireNonNull(ticker, "ticker"))
            .executor(Runnable::run)
            .build(
                key -> {
                  Map<String, Map<String, PromptReference>> document = Map.copyOf(loader.load());
                  log.debug("Loaded prompt references for {} group(s)", document.size());
                  return document;
                });
    this.texts = Caffeine.newBuilder().build();
  }

  /**
   * @throws com.gentoro.factcheck.exception.ConfigException when the reference document cannot
   *     be loaded and no earlier copy is cached
   */
  @Override
  public Optional<PromptReference> get(String group, String key) {
    return Optional.ofNullable(references.get(DOCUMENT_KEY).getOrDefault(group, Map.of()).get(key));
  }

  @Override
  public String fetchText(PromptReference reference) {
    return texts.get(reference.fileName(), repository::read);
  }
}
