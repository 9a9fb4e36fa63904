package com.onthegomap.palmprep.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {

  private Exceptions() {}

  /**
   * Re-throw a caught exception, handling interrupts and wrapping in a {@link FatalPalmPrepException} if checked.
   *
   * @param exception The original exception
   * @param <T>       Return type if caller requires it
   */
  public static <T> T throwFatalException(Throwable exception) {
    if (exception instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    if (exception instanceof RuntimeException runtimeException) {
      throw runtimeException;
    } else if (exception instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    } else if (exception instanceof Error error) {
      throw error;
    }
    throw new FatalPalmPrepException(exception);
  }

  /** A task that may throw a checked exception. */
  @FunctionalInterface
  public interface RunnableThatThrows {

    void run() throws Exception;
  }

  /** Fatal exception that ends the run early. */
  public static class FatalPalmPrepException extends RuntimeException {

    public FatalPalmPrepException(Throwable exception) {
      super(exception);
    }
  }
}
