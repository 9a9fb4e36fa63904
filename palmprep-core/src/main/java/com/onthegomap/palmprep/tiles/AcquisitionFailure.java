package com.onthegomap.palmprep.tiles;

/**
 * A tile could not be downloaded or read.
 * <p>
 * Checked so that bulk loops decide explicitly whether to skip the tile or give up.
 */
public class AcquisitionFailure extends Exception {

  private final String tile;

  public AcquisitionFailure(String tile, String message) {
    super(tile + ": " + message);
    this.tile = tile;
  }

  public AcquisitionFailure(String tile, String message, Throwable cause) {
    super(tile + ": " + message, cause);
    this.tile = tile;
  }

  public String tile() {
    return tile;
  }
}
