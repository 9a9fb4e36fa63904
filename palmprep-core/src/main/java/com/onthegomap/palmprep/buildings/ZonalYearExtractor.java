package com.onthegomap.palmprep.buildings;

import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.Reprojection;
import com.onthegomap.palmprep.raster.RasterLayer;
import com.onthegomap.palmprep.raster.RasterOps;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns every building the newest settlement year found under its footprint.
 * <p>
 * A cell counts when any part of it intersects the footprint, so small buildings still pick up the cell they sit in.
 */
public class ZonalYearExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(ZonalYearExtractor.class);
  public static final int NO_YEAR = 0;

  private final RasterLayer years;
  private final double[] values;

  public ZonalYearExtractor(RasterLayer years) {
    this.years = years;
    this.values = years.values();
  }

  /**
   * Returns the maximum valid cell value touching {@code footprint}, or {@link #NO_YEAR} if there is none.
   * <p>
   * {@code footprint} must already be in the raster CRS.
   */
  public int yearMax(Geometry footprint) {
    double[] max = {Double.NEGATIVE_INFINITY};
    RasterOps.forEachCellTouching(years.grid(), footprint, index -> {
      double value = values[index];
      if (!years.isNoData(value) && value > max[0]) {
        max[0] = value;
      }
    });
    return max[0] == Double.NEGATIVE_INFINITY ? NO_YEAR : (int) Math.round(max[0]);
  }

  /** Returns {@code buildings}, whose footprints are in {@code crs}, with {@link BuildingFeature#yearMax()} set. */
  public List<BuildingFeature> extract(List<BuildingFeature> buildings, Crs crs) {
    Reprojection toRaster = Reprojection.between(crs, years.grid().crs());
    List<BuildingFeature> result = new ArrayList<>(buildings.size());
    int missing = 0;
    for (BuildingFeature building : buildings) {
      int year = yearMax(toRaster.transform(building.footprint()));
      if (year == NO_YEAR) {
        missing++;
      }
      result.add(building.withYear(year));
    }
    LOGGER.info("Extracted settlement years for {} buildings, {} without any valid cell", result.size(), missing);
    return result;
  }
}
