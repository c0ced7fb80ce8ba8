package com.gentoro.factcheck.verification;

import java.time.Duration;

/** Blocking pause, injectable so the rate limiter can be tested without waiting. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
