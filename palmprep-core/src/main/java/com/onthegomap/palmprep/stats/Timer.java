package com.onthegomap.palmprep.stats;

import java.time.Duration;

/**
 * Measures the wall-clock time a task takes.
 */
public class Timer {

  private final long startNanos;
  private long endNanos = -1;

  private Timer() {
    startNanos = System.nanoTime();
  }

  /** Returns a new timer that has already started. */
  public static Timer start() {
    return new Timer();
  }

  /** Stops the timer and returns it. */
  public Timer stop() {
    if (endNanos < 0) {
      endNanos = System.nanoTime();
    }
    return this;
  }

  public boolean running() {
    return endNanos < 0;
  }

  public Duration elapsed() {
    return Duration.ofNanos((running() ? System.nanoTime() : endNanos) - startNanos);
  }

  @Override
  public String toString() {
    Duration elapsed = elapsed();
    return elapsed.toSeconds() >= 1 ? (elapsed.toMillis() / 1000d) + "s" : elapsed.toMillis() + "ms";
  }
}
