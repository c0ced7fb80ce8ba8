package com.gentoro.factcheck.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.factcheck.exception.ConfigException;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class CachingPromptSourceTest {

  /** Ticker moved by the test. */
  static final class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong();

    void advance(Duration d) {
      nanos.addAndGet(d.toNanos());
    }

    @Override
    public long read() {
      return nanos.get();
    }
  }

  private final FakeTicker ticker = new FakeTicker();
  private final AtomicInteger loads = new AtomicInteger();
  private final AtomicInteger reads = new AtomicInteger();
  private final AtomicReference<String> roleFile = new AtomicReference<>("role_v1.txt");

  private CachingPromptSource source(PromptReferenceLoader loader) {
    return new CachingPromptSource(
        loader,
        fileName -> {
          reads.incrementAndGet();
          return "text of " + fileName;
        },
        Duration.ofSeconds(3600),
        ticker);
  }

  private Map<String, Map<String, PromptReference>> document() {
    loads.incrementAndGet();
    return Map.of("Prompts", Map.of("role_prompt", PromptReference.of(roleFile.get())));
  }

  private String roleFileName(CachingPromptSource source) {
    return source.get("Prompts", "role_prompt").orElseThrow().fileName();
  }

  @Test
  void referencesAreReloadedOnlyAfterTheTtl() {
    CachingPromptSource source = source(this::document);

    assertEquals("role_v1.txt", roleFileName(source));
    roleFile.set("role_v2.txt");
    ticker.advance(Duration.ofMinutes(59));
    assertEquals("role_v1.txt", roleFileName(source));
    assertEquals(1, loads.get());

    ticker.advance(Duration.ofMinutes(2));
    // the first stale read triggers the reload
    source.get("Prompts", "role_prompt");
    assertEquals("role_v2.txt", roleFileName(source));
    assertEquals(2, loads.get());
  }

  @Test
  void promptTextIsReadOncePerFile() {
    CachingPromptSource source = source(this::document);
    PromptReference ref = source.get("Prompts", "role_prompt").orElseThrow();

    assertEquals("text of role_v1.txt", source.fetchText(ref));
    ticker.advance(Duration.ofDays(2));
    assertEquals("text of role_v1.txt", source.fetchText(ref));
    assertEquals(1, reads.get());
  }

  @Test
  void unknownKeyIsEmpty() {
    CachingPromptSource source = source(this::document);
    assertTrue(source.get("Prompts", "missing").isEmpty());
    assertTrue(source.get("Other", "role_prompt").isEmpty());
  }

  @Test
  void failedRefreshKeepsPreviousReferences() {
    AtomicBoolean fail = new AtomicBoolean();
    CachingPromptSource source =
        source(
            () -> {
              if (fail.get()) {
                throw new ConfigException("remote config unavailable");
              }
              return document();
            });
    assertEquals("role_v1.txt", roleFileName(source));

    fail.set(true);
    roleFile.set("role_v2.txt");
    ticker.advance(Duration.ofHours(2));

    assertEquals("role_v1.txt", roleFileName(source));
    assertEquals("role_v1.txt", roleFileName(source));

    fail.set(false);
    source.get("Prompts", "role_prompt");
    assertEquals("role_v2.txt", roleFileName(source));
  }

  @Test
  void firstLoadFailurePropagates() {
    CachingPromptSource source =
        source(
            () -> {
              throw new ConfigException("remote config unavailable");
            });
    assertThrows(ConfigException.class, () -> source.get("Prompts", "role_prompt"));
  }
}
