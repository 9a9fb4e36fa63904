package com.onthegomap.palmprep.buildings;

import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.Reprojection;
import com.onthegomap.palmprep.raster.GridGeometry;
import com.onthegomap.palmprep.raster.RasterLayer;
import com.onthegomap.palmprep.raster.RasterOps;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Burns building and bridge attributes into rasters on a template grid.
 * <p>
 * Every cell touching a footprint receives the value, and where footprints overlap the largest value wins. Buildings
 * without a measured height leave the height raster untouched.
 */
public class BuildingRasterizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BuildingRasterizer.class);

  public static final double NODATA = -9999;
  public static final String BUILDING_TYPE = "building_type";
  public static final String BUILDING_ID = "building_id";
  public static final String BUILDING_HEIGHT = "building_height";
  public static final String BRIDGES_ID = "bridges_id";
  public static final String BRIDGES_HEIGHT = "bridges_height";

  private final GridGeometry template;

  public BuildingRasterizer(GridGeometry template) {
    this.template = template;
  }

  /** Returns the building type, ID and height rasters, plus the bridge ID and height rasters when there are bridges. */
  public Map<String, RasterLayer> rasterize(EnrichedBuildings buildings) {
    Map<String, RasterLayer> result = new LinkedHashMap<>();
    List<BuildingFeature> regular = buildings.buildings();
    for (BuildingFeature building : regular) {
      if (building.palmType() == BuildingFeature.UNCLASSIFIED) {
        throw new ValidationException("Building " + building.id() + " has not been classified");
      }
    }
    result.put(BUILDING_TYPE, rasterize(regular, buildings.crs(), BuildingFeature::palmType));
    result.put(BUILDING_ID, rasterize(regular, buildings.crs(), BuildingFeature::id));
    result.put(BUILDING_HEIGHT, rasterize(regular, buildings.crs(), BuildingRasterizer::height));
    if (!buildings.bridges().isEmpty()) {
      result.put(BRIDGES_ID, rasterize(buildings.bridges(), buildings.crs(), BuildingFeature::id));
      result.put(BRIDGES_HEIGHT, rasterize(buildings.bridges(), buildings.crs(), BuildingRasterizer::height));
    }
    LOGGER.info("Rasterized {} buildings and {} bridges onto {}x{} cells", regular.size(),
      buildings.bridges().size(), template.nx(), template.ny());
    return result;
  }

  private static double height(BuildingFeature building) {
    return building.measuredHeight() == null ? Double.NaN : building.measuredHeight();
  }

  /** Returns a raster holding the maximum of {@code field} over every footprint touching each cell. */
  public RasterLayer rasterize(List<BuildingFeature> features, Crs crs, ToDoubleFunction<BuildingFeature> field) {
    double[] values = new double[template.size()];
    Arrays.fill(values, NODATA);
    Reprojection toGrid = Reprojection.between(crs, template.crs());
    for (BuildingFeature feature : features) {
      double value = field.applyAsDouble(feature);
      if (Double.isNaN(value)) {
        continue;
      }
      Geometry footprint = toGrid.transform(feature.footprint());
      RasterOps.forEachCellTouching(template, footprint, index -> {
        if (values[index] == NODATA || value > values[index]) {
          values[index] = value;
        }
      });
    }
    return new RasterLayer(template, values, NODATA);
  }
}
