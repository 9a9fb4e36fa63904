package com.onthegomap.palmprep.raster;

import java.util.List;

/**
 * Reprojects and resamples rasters onto a target grid.
 */
@FunctionalInterface
public interface RasterWarper {

  /**
   * Returns {@code sources} resampled onto {@code target} with the nodata marker of the first source.
   * <p>
   * Where sources overlap, each cell takes its value from the first source in list order that has valid data there.
   * Cells no source covers are nodata.
   */
  RasterLayer warp(List<RasterLayer> sources, GridGeometry target, Resampling resampling);

  default RasterLayer warp(RasterLayer source, GridGeometry target, Resampling resampling) {
    return warp(List.of(source), target, resampling);
  }
}
