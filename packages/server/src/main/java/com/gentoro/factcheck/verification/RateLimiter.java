package com.gentoro.factcheck.verification;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide cap on verification calls per window.
 *
 * <p>The limiter counts admitted calls. When the count reaches the cap, the admitting thread sleeps
 * for one full window while holding the lock, resets the count and is admitted. Every other worker
 * queues on the lock meanwhile, so the pause throttles the whole pool.
 */
public class RateLimiter {
  private static final org.slf4j.Logger log =
      com.gentoro.factcheck.logging.LoggingService.getLogger(RateLimiter.class);

  private final int maxCallsPerWindow;
  private final Duration window;
  private final Sleeper sleeper;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock(true);

  private int callCount;
  private long resets;
  private Instant windowStart;

  public RateLimiter(int maxCallsPerWindow, Duration window) {
    this(maxCallsPerWindow, window, Sleeper.SYSTEM, Clock.systemUTC());
  }

  public RateLimiter(int maxCallsPerWindow, Duration window, Sleeper sleeper, Clock clock) {
    if (maxCallsPerWindow <= 0) {
      throw new IllegalArgumentException("maxCallsPerWindow must be positive");
    }
    if (window == null || window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be a positive duration");
    }
    this.maxCallsPerWindow = maxCallsPerWindow;
    this.window = window;
    this.sleeper = sleeper;
    this.clock = clock;
    this.windowStart = clock.instant();
  }

  /** Block until a call may proceed, then count it. */
  public void acquire() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      if (callCount >= maxCallsPerWindow) {
        log.info(
            "Verification rate limit of {} call(s) reached after {} ms, pausing for {} s",
            maxCallsPerWindow,
            Duration.between(windowStart, clock.instant()).toMillis(),
            window.toSeconds());
        sleeper.sleep(window);
        callCount = 0;
        resets++;
        windowStart = clock.instant();
      }
      callCount++;
    } finally {
      lock.unlock();
    }
  }

  public int callCount() {
    lock.lock();
    try {
      return callCount;
    } finally {
      lock.unlock();
    }
  }

  /** Number of times the limiter paused and reset its window. */
  public long resets() {
    lock.lock();
    try {
      return resets;
    } finally {
      lock.unlock();
    }
  }

  public int maxCallsPerWindow() {
    return maxCallsPerWindow;
  }
}
