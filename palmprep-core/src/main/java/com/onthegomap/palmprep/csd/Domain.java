package com.onthegomap.palmprep.csd;

import com.onthegomap.palmprep.raster.GridGeometry;

/**
 * The {@code domain_root} section: the rectangular PALM model domain.
 *
 * @param pixelSize   horizontal grid spacing in meters
 * @param originX     x coordinate of the lower-left corner, null when unknown
 * @param originY     y coordinate of the lower-left corner, null when unknown
 * @param nx          number of cells along x, null when unknown
 * @param ny          number of cells along y, null when unknown
 * @param dz          vertical grid spacing in meters
 * @param bridgeDepth bridge deck thickness in meters
 */
public record Domain(
  double pixelSize,
  Double originX,
  Double originY,
  Integer nx,
  Integer ny,
  double dz,
  double bridgeDepth,
  boolean buildings3d,
  boolean streetTrees,
  boolean overhangingTrees,
  boolean generateVegetationPatches
) {

  public static Domain defaults() {
    return new Domain(1.0, null, null, null, null, 1.0, 3.0, true, true, true, true);
  }

  /** Returns the default domain covering exactly {@code grid}. */
  public static Domain from(GridGeometry grid) {
    return new Domain(grid.resX(), grid.minX(), grid.minY(), grid.nx(), grid.ny(), 1.0, 3.0, true, true, true, true);
  }
}
