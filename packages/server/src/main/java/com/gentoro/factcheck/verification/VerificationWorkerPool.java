package com.gentoro.factcheck.verification;

import com.gentoro.factcheck.exception.StateException;
import com.gentoro.factcheck.model.GroundedResult;
import com.gentoro.factcheck.model.VerificationModelClient;
import com.gentoro.factcheck.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of verification prompts concurrently and returns their results in input order.
 *
 * <p>Each call passes through the shared {@link RateLimiter} first. A failing prompt yields an
 * empty slot and a warning; the rest of the batch is unaffected.
 */
public class VerificationWorkerPool {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(VerificationWorkerPool.class);

  private final RateLimiter rateLimiter;
  private final int defaultWidth;
  private final AtomicInteger batchCounter = new AtomicInteger();

  public VerificationWorkerPool(RateLimiter rateLimiter, int defaultWidth) {
    if (defaultWidth <= 0) {
      throw new IllegalArgumentException("defaultWidth must be positive");
    }
    this.rateLimiter = rateLimiter;
    this.defaultWidth = defaultWidth;
  }

  public int defaultWidth() {
    return defaultWidth;
  }

  public List<Optional<GroundedResult>> generateAll(
      VerificationModelClient client, List<String> prompts) {
    return generateAll(client, prompts, defaultWidth);
  }

  /**
   * @param width maximum number of concurrent calls
   * @return one entry per prompt, at the prompt's index; empty when that prompt failed
   */
  public List<Optional<GroundedResult>> generateAll(
      VerificationModelClient client, List<String> prompts, int width) {
    if (prompts.isEmpty()) {
      return List.of();
    }
    int threads = Math.max(1, Math.min(width, prompts.size()));
    int batch = batchCounter.incrementAndGet();
    log.debug("Verifying {} prompt(s) with {} worker(s), batch {}", prompts.size(), threads, batch);

    ExecutorService executor = Executors.newFixedThreadPool(threads, threadFactory(batch));
    try {
      List<Future<GroundedResult>> futures = new ArrayList<>(prompts.size());
      for (String prompt : prompts) {
        futures.add(
            executor.submit(
                () -> {
                  rateLimiter.acquire();
                  return client.generate(prompt);
                }));
      }

      List<Optional<GroundedResult>> results = new ArrayList<>(prompts.size());
      for (int i = 0; i < futures.size(); i++) {
        try {
          results.add(Optional.ofNullable(futures.get(i).get()));
        } catch (ExecutionException e) {
          log.warn(
              "Verification failed for prompt #{} '{}': {}",
              i,
              StringUtility.preview(prompts.get(i), 80),
              e.getCause() == null ? e.getMessage() : e.getCause().getMessage(),
              e.getCause());
          results.add(Optional.empty());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new StateException("Interrupted while waiting for verification results", e);
        }
        log.trace("Verification progress: {}/{}", i + 1, prompts.size());
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  private static ThreadFactory threadFactory(int batch) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "verify-" + batch + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
