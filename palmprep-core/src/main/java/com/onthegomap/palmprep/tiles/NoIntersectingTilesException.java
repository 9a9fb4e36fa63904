package com.onthegomap.palmprep.tiles;

import com.onthegomap.palmprep.EmptyResultException;

/** Thrown when no tile of a grid intersects the area of interest. */
public class NoIntersectingTilesException extends EmptyResultException {

  public NoIntersectingTilesException(String message) {
    super(message);
  }
}
