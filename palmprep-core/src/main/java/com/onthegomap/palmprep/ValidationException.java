package com.onthegomap.palmprep;

/**
 * Thrown before any I/O happens when an input is malformed: a bad area of interest, a missing attribute column, an
 * undefined coordinate reference system or an unexpected geometry type.
 */
public class ValidationException extends PalmPrepException {

  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
