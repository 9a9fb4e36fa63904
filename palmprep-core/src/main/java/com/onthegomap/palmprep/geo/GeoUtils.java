package com.onthegomap.palmprep.geo;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.TopologyException;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.geom.util.GeometryTransformer;
import org.locationtech.jts.geom.util.PolygonExtracter;
import org.locationtech.jts.operation.union.UnaryUnionOp;

/**
 * A collection of utilities for working with JTS data structures and footprint geometries.
 */
public class GeoUtils {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);
  public static final MultiPolygon EMPTY_MULTIPOLYGON = JTS_FACTORY.createMultiPolygon();

  private static final GeometryTransformer DROP_Z_AND_M = new GeometryTransformer() {
    @Override
    protected CoordinateSequence transformCoordinates(CoordinateSequence coords, Geometry parent) {
      CoordinateSequence copy = new PackedCoordinateSequence.Double(coords.size(), 2, 0);
      for (int i = 0; i < coords.size(); i++) {
        copy.setOrdinate(i, 0, coords.getX(i));
        copy.setOrdinate(i, 1, coords.getY(i));
      }
      return copy;
    }
  };

  // should not instantiate
  private GeoUtils() {}

  /** Returns a copy of {@code geometry} with only X and Y ordinates. */
  public static Geometry force2D(Geometry geometry) {
    return geometry == null ? null : DROP_Z_AND_M.transform(geometry);
  }

  /** Returns a rectangle polygon covering {@code envelope}. */
  public static Polygon rectangle(Envelope envelope) {
    return (Polygon) JTS_FACTORY.toGeometry(envelope);
  }

  /** Returns a rectangle polygon from {@code (minX, minY)} to {@code (maxX, maxY)}. */
  public static Polygon rectangle(double minX, double minY, double maxX, double maxY) {
    return rectangle(new Envelope(minX, maxX, minY, maxY));
  }

  public static MultiPolygon createMultiPolygon(Collection<Polygon> polygons) {
    return JTS_FACTORY.createMultiPolygon(polygons.toArray(Polygon[]::new));
  }

  /** Returns every polygon inside {@code geometry}, descending into collections. */
  @SuppressWarnings("unchecked")
  public static List<Polygon> polygons(Geometry geometry) {
    return geometry == null ? List.of() : new ArrayList<>(PolygonExtracter.getPolygons(geometry));
  }

  /**
   * Casts {@code geometry} to a {@link MultiPolygon} without changing its shape.
   * <p>
   * Polygons are wrapped, multipolygons returned as-is, and collections are accepted only when every member is a
   * polygon.
   *
   * @throws GeometryException if {@code geometry} has a non-polygonal part
   */
  public static MultiPolygon toMultiPolygon(Geometry geometry) throws GeometryException {
    if (geometry == null) {
      throw new GeometryException("cast_missing", "cannot cast a missing geometry to MultiPolygon");
    } else if (geometry instanceof MultiPolygon multiPolygon) {
      return multiPolygon;
    } else if (geometry instanceof Polygon polygon) {
      return polygon.isEmpty() ? EMPTY_MULTIPOLYGON : JTS_FACTORY.createMultiPolygon(new Polygon[]{polygon});
    } else if (geometry instanceof GeometryCollection collection) {
      List<Polygon> result = new ArrayList<>();
      for (int i = 0; i < collection.getNumGeometries(); i++) {
        Geometry part = collection.getGeometryN(i);
        if (part.isEmpty()) {
          continue;
        }
        if (!(part instanceof Polygonal)) {
          throw new GeometryException("cast_collection",
            "cannot cast collection with " + part.getGeometryType() + " part to MultiPolygon");
        }
        result.addAll(polygons(part));
      }
      return createMultiPolygon(result);
    }
    throw new GeometryException("cast_" + geometry.getGeometryType().toLowerCase(Locale.ROOT),
      "cannot cast " + geometry.getGeometryType() + " to MultiPolygon");
  }

  /** Returns a valid version of {@code geometry} using {@link GeometryFixer}. */
  public static Geometry fixPolygon(Geometry geometry) {
    return GeometryFixer.fix(geometry);
  }

  /**
   * Merges {@code polygons} into one geometry by union, or combines them without dissolving shared edges when the
   * union fails.
   */
  public static Geometry unionOrCombine(List<Polygon> polygons) {
    try {
      return UnaryUnionOp.union(polygons, JTS_FACTORY);
    } catch (TopologyException e) {
      return createMultiPolygon(polygons);
    }
  }
}
