package com.onthegomap.palmprep.stats;

import com.onthegomap.palmprep.util.LogUtil;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects stage timings and data-error counts to report at the end of a run.
 * <p>
 * {@link #inMemory()} stores them in-memory and logs them through {@link #printSummary()}.
 */
public interface Stats {

  /** Returns a new stat collector that stores basic stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Logs how long each stage took and how many of each kind of data error were encountered. */
  default void printSummary() {
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    var errors = dataErrors();
    if (!errors.isEmpty()) {
      logger.info("-".repeat(40));
      errors.forEach((code, count) -> logger.info("\t{}\t{}", code, count));
    }
  }

  /**
   * Records that a long-running task with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Also sets the "stage" prefix that shows up in the logs to {@code name}.
   */
  default Timers.Finishable startStage(String name) {
    LogUtil.setStage(name);
    var timer = timers().startTimer(name, true);
    return () -> {
      timer.stop();
      LogUtil.clearStage();
    };
  }

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /**
   * Records that an input element was skipped or repaired where {@code errorCode} identifies the kind of failure.
   */
  void dataError(String errorCode);

  /** Returns the number of times each data error code was recorded, sorted by code. */
  Map<String, Long> dataErrors();

  /** A stat collector that stores top-level metrics in-memory to report through {@link #printSummary()}. */
  class InMemory implements Stats {

    private final Timers timers = new Timers();
    private final Map<String, AtomicLong> dataErrors = new ConcurrentSkipListMap<>();

    /** use {@link #inMemory()} */
    private InMemory() {}

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public void dataError(String errorCode) {
      dataErrors.computeIfAbsent(errorCode, c -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public Map<String, Long> dataErrors() {
      Map<String, Long> result = new TreeMap<>();
      dataErrors.forEach((code, count) -> result.put(code, count.get()));
      return result;
    }
  }
}
