package com.onthegomap.palmprep;

/**
 * Base class for fatal errors raised while preparing PALM inputs.
 */
public class PalmPrepException extends RuntimeException {

  public PalmPrepException(String message) {
    super(message);
  }

  public PalmPrepException(String message, Throwable cause) {
    super(message, cause);
  }
}
