package com.onthegomap.palmprep.aoi;

import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.GeoUtils;
import com.onthegomap.palmprep.geo.Reprojection;
import com.onthegomap.palmprep.vector.FeatureSet;
import com.onthegomap.palmprep.vector.VectorFeature;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;

/**
 * The polygon boundary of the processing domain together with its coordinate reference system.
 * <p>
 * Immutable: {@link #reproject(Crs)} derives a new instance.
 *
 * @param geometry polygon or multipolygon boundary
 * @param crs      coordinate reference system of {@code geometry}
 */
public record AreaOfInterest(Geometry geometry, Crs crs) {

  public AreaOfInterest {
    if (crs == null) {
      throw new ValidationException("Area of interest has no coordinate reference system");
    }
    if (geometry == null) {
      throw new ValidationException("Area of interest has no geometry");
    }
    if (!(geometry instanceof Polygonal)) {
      throw new ValidationException(
        "Area of interest must be a POLYGON or MULTIPOLYGON, got " + geometry.getGeometryType());
    }
    if (geometry.isEmpty()) {
      throw new ValidationException("Area of interest geometry is empty");
    }
  }

  /**
   * Returns the union of every feature in {@code features} as an area of interest.
   *
   * @throws ValidationException if a feature is missing its geometry or is not polygonal
   */
  public static AreaOfInterest fromFeatures(FeatureSet features) {
    if (features.isEmpty()) {
      throw new ValidationException("Area of interest file contains no features");
    }
    List<Polygon> polygons = new ArrayList<>();
    for (VectorFeature feature : features.features()) {
      Geometry geometry = feature.geometry().geometry();
      if (!(geometry instanceof Polygonal)) {
        throw new ValidationException("Area of interest must be a POLYGON or MULTIPOLYGON, got " +
          feature.geometry().kind());
      }
      polygons.addAll(GeoUtils.polygons(GeoUtils.force2D(geometry)));
    }
    Geometry union = polygons.size() == 1 ? polygons.get(0) : GeoUtils.unionOrCombine(polygons);
    return new AreaOfInterest(union, features.crs());
  }

  /** Returns a copy of this area in {@code target}. */
  public AreaOfInterest reproject(Crs target) {
    return crs.equals(target) ? this :
      new AreaOfInterest(Reprojection.between(crs, target).transform(geometry), target);
  }

  public Envelope envelope() {
    return geometry.getEnvelopeInternal();
  }
}
