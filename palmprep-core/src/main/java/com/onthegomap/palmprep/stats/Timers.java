package com.onthegomap.palmprep.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registry of pipeline stages that are being timed.
 */
public class Timers {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timers.class);
  private final Map<String, Timer> timers = Collections.synchronizedMap(new LinkedHashMap<>());

  public void printSummary() {
    int maxLength = all().keySet().stream().mapToInt(String::length).max().orElse(0);
    for (var entry : all().entrySet()) {
      LOGGER.info("\t{} {}", padRight(entry.getKey(), maxLength), entry.getValue());
    }
  }

  private static String padRight(String str, int size) {
    return str.length() >= size ? str : str + " ".repeat(size - str.length());
  }

  public Finishable startTimer(String name, boolean log) {
    Timer timer = Timer.start();
    timers.put(name, timer);
    if (log) {
      LOGGER.info("");
      LOGGER.info("Starting...");
    }
    return () -> {
      timer.stop();
      if (log) {
        LOGGER.info("Finished in {}", timer);
      }
    };
  }

  /** Returns a snapshot of all timers started so far. */
  public Map<String, Timer> all() {
    synchronized (timers) {
      return new LinkedHashMap<>(timers);
    }
  }

  /** A handle that callers can use to indicate a task has finished. */
  @FunctionalInterface
  public interface Finishable {

    void stop();
  }
}
