package com.onthegomap.palmprep.raster;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates land cover classes into PALM surface type codes.
 * <p>
 * Each PALM surface (vegetation, water, pavement) gets its own raster; land cover classes that do not belong to a
 * surface become nodata in it.
 */
public class LandCoverReclassifier {

  public static final double NODATA = 255;

  /** Land cover class to PALM vegetation type. */
  public static final Map<Integer, Integer> VEGETATION = Map.of(
    4, 3,
    5, 1,
    8, 1,
    9, 16,
    10, 17,
    11, 7
  );
  /** Land cover class to PALM water type. */
  public static final Map<Integer, Integer> WATER = Map.of(2, 1);
  /** Land cover class to PALM pavement type. */
  public static final Map<Integer, Integer> PAVEMENT = Map.of(
    12, 1,
    6, 13
  );

  private LandCoverReclassifier() {}

  /** Returns a raster with {@code table} applied to every cell, and {@link #NODATA} for every other class. */
  public static RasterLayer reclassify(RasterLayer landCover, Map<Integer, Integer> table) {
    return landCover.map(value -> {
      long rounded = Math.round(value);
      Integer result = rounded == value ? table.get((int) rounded) : null;
      return result == null ? NODATA : result;
    }, NODATA);
  }

  /** Returns the {@code vegetation_type}, {@code water_type} and {@code pavement_type} rasters for a land cover. */
  public static Map<String, RasterLayer> palmSurfaces(RasterLayer landCover) {
    Map<String, RasterLayer> result = new LinkedHashMap<>();
    result.put("vegetation_type", reclassify(landCover, VEGETATION));
    result.put("water_type", reclassify(landCover, WATER));
    result.put("pavement_type", reclassify(landCover, PAVEMENT));
    return result;
  }
}
