package com.onthegomap.palmprep.geo;

import java.util.Locale;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.MultiPoint;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

/**
 * The geometry type tag a source reports for a feature.
 * <p>
 * Covers the tags JTS models directly plus the surface types that building models use and JTS does not.
 */
public enum GeometryKind {
  POINT,
  LINESTRING,
  POLYGON,
  MULTIPOINT,
  MULTILINESTRING,
  MULTIPOLYGON,
  GEOMETRYCOLLECTION,
  MULTISURFACE,
  POLYHEDRALSURFACE,
  TIN,
  UNKNOWN;

  /** Returns the WKT keyword for this type. */
  public String keyword() {
    return name();
  }

  /** Returns true for solid and triangulated surfaces that cannot be cast to a multipolygon directly. */
  public boolean isUnsupportedSurface() {
    return this == POLYHEDRALSURFACE || this == TIN;
  }

  /** Returns the kind for a WKT keyword, or {@link #UNKNOWN} if it is not recognized. */
  public static GeometryKind fromKeyword(String keyword) {
    if (keyword == null) {
      return UNKNOWN;
    }
    String upper = keyword.strip().toUpperCase(Locale.ROOT);
    if ("TRIANGLE".equals(upper)) {
      return POLYGON;
    }
    try {
      return valueOf(upper);
    } catch (IllegalArgumentException e) {
      return UNKNOWN;
    }
  }

  /** Returns the kind that matches a JTS geometry class. */
  public static GeometryKind of(Geometry geometry) {
    if (geometry instanceof Point) {
      return POINT;
    } else if (geometry instanceof Polygon) {
      return POLYGON;
    } else if (geometry instanceof LineString) {
      return LINESTRING;
    } else if (geometry instanceof MultiPolygon) {
      return MULTIPOLYGON;
    } else if (geometry instanceof MultiLineString) {
      return MULTILINESTRING;
    } else if (geometry instanceof MultiPoint) {
      return MULTIPOINT;
    } else if (geometry instanceof GeometryCollection) {
      return GEOMETRYCOLLECTION;
    }
    return UNKNOWN;
  }
}
