package com.onthegomap.palmprep;

/**
 * Thrown when a stage would hand an empty result to the next one, for example when no feature survives clipping or a
 * raster mosaic contains only nodata cells.
 */
public class EmptyResultException extends PalmPrepException {

  public EmptyResultException(String message) {
    super(message);
  }
}
