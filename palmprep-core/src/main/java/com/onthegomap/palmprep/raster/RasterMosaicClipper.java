package com.onthegomap.palmprep.raster;

import com.onthegomap.palmprep.EmptyResultException;
import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.aoi.AreaOfInterest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges raster tiles into one raster and clips it to an area of interest.
 */
public class RasterMosaicClipper {

  private static final Logger LOGGER = LoggerFactory.getLogger(RasterMosaicClipper.class);

  private final RasterWarper warper;

  public RasterMosaicClipper(RasterWarper warper) {
    this.warper = warper;
  }

  /**
   * Mosaics {@code tiles} in order ("first valid value wins"), crops to the bounding box of {@code aoi} and masks every
   * cell whose center lies outside it.
   *
   * @throws ValidationException  if the tiles do not share a CRS and resolution
   * @throws EmptyResultException if no valid cell remains
   */
  public RasterLayer mosaicAndClip(List<RasterLayer> tiles, AreaOfInterest aoi) {
    RasterLayer mosaic = warper.warp(tiles, RasterOps.mosaicGrid(tiles), Resampling.NEAREST);
    AreaOfInterest local = aoi.reproject(mosaic.grid().crs());
    RasterLayer cropped = RasterOps.crop(mosaic, local.envelope());
    RasterLayer masked = RasterOps.mask(cropped, local.geometry());
    long valid = masked.validCount();
    if (valid == 0) {
      throw new EmptyResultException("Raster mosaic of " + tiles.size() + " tiles is entirely nodata inside the AOI");
    }
    LOGGER.info("Mosaicked {} tiles into {}x{} raster with {} valid cells", tiles.size(), masked.grid().nx(),
      masked.grid().ny(), valid);
    return masked;
  }
}
