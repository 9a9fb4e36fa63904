package com.onthegomap.palmprep.buildings;

import com.onthegomap.palmprep.EmptyResultException;
import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.aoi.AreaOfInterest;
import com.onthegomap.palmprep.config.PalmPrepConfig;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.GeoUtils;
import com.onthegomap.palmprep.geo.GeometryException;
import com.onthegomap.palmprep.util.Parse;
import com.onthegomap.palmprep.vector.FeatureSet;
import com.onthegomap.palmprep.vector.VectorFeature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clips normalized building footprints to the area of interest, numbers them and splits off bridges.
 */
public class FeatureEnricher {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureEnricher.class);

  private final Crs workingCrs;
  private final String functionAttribute;
  private final String heightAttribute;
  private final String bridgeCode;

  public FeatureEnricher(Crs workingCrs, String functionAttribute, String heightAttribute, String bridgeCode) {
    this.workingCrs = workingCrs;
    this.functionAttribute = functionAttribute;
    this.heightAttribute = heightAttribute;
    this.bridgeCode = bridgeCode;
  }

  public static FeatureEnricher from(PalmPrepConfig config) {
    return new FeatureEnricher(Crs.ofEpsg(config.targetEpsg()), config.functionAttribute(),
      config.heightAttribute(), config.bridgeCode());
  }

  /**
   * Returns the parts of {@code features} inside {@code aoi} with IDs 1..N assigned in input order.
   *
   * @throws ValidationException  if no feature carries the function attribute
   * @throws EmptyResultException if nothing is left after clipping
   */
  public EnrichedBuildings enrich(FeatureSet features, AreaOfInterest aoi) {
    if (!features.columns().contains(functionAttribute)) {
      throw new ValidationException("Building features have no '" + functionAttribute + "' attribute, found " +
        features.columns());
    }
    FeatureSet projected = features.reproject(workingCrs);
    Geometry area = aoi.reproject(workingCrs).geometry();
    PreparedGeometry prepared = PreparedGeometryFactory.prepare(area);

    List<BuildingFeature> buildings = new ArrayList<>();
    List<BuildingFeature> bridges = new ArrayList<>();
    long id = 0;
    int dropped = 0;
    for (VectorFeature feature : projected.features()) {
      Geometry geometry = feature.geometry().geometry();
      if (geometry == null || geometry.isEmpty() || !prepared.intersects(geometry)) {
        dropped++;
        continue;
      }
      MultiPolygon clipped = clip(geometry, area);
      if (clipped.isEmpty()) {
        dropped++;
        continue;
      }
      String code = Parse.stringOrNull(feature.getTag(functionAttribute));
      Double height = Parse.parseDoubleOrNull(feature.getTag(heightAttribute));
      Map<String, Object> rest = new LinkedHashMap<>(feature.attributes());
      rest.remove(functionAttribute);
      rest.remove(heightAttribute);
      var building = new BuildingFeature(++id, code, height, 0, BuildingFeature.UNCLASSIFIED, clipped, rest);
      if (bridgeCode.equals(code)) {
        bridges.add(building);
      } else {
        buildings.add(building);
      }
    }
    if (id == 0) {
      throw new EmptyResultException("No LOD2 buildings intersect the AOI");
    }
    LOGGER.info("Kept {} buildings and {} bridges, dropped {} features outside the AOI", buildings.size(),
      bridges.size(), dropped);
    return new EnrichedBuildings(workingCrs, buildings, bridges);
  }

  private static MultiPolygon clip(Geometry geometry, Geometry area) {
    Geometry intersection;
    try {
      intersection = geometry.intersection(area);
    } catch (TopologyException e) {
      intersection = GeoUtils.fixPolygon(geometry).intersection(area);
    }
    try {
      return GeoUtils.toMultiPolygon(intersection);
    } catch (GeometryException e) {
      // boundary-only contact leaves lines and points behind
      return GeoUtils.createMultiPolygon(GeoUtils.polygons(intersection));
    }
  }
}
