package com.onthegomap.palmprep.raster;

/**
 * Resampling kernels used when warping a raster onto another grid.
 */
public enum Resampling {
  /** Value of the source cell containing the target cell center, for categorical data. */
  NEAREST("near"),
  /** Weighted average of the surrounding source cells, for continuous data. */
  BILINEAR("bilinear");

  private final String gdalName;

  Resampling(String gdalName) {
    this.gdalName = gdalName;
  }

  /** Name of the kernel as passed to {@code gdalwarp -r}. */
  public String gdalName() {
    return gdalName;
  }
}
