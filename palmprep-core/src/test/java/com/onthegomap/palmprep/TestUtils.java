package com.onthegomap.palmprep;

import static com.onthegomap.palmprep.geo.GeoUtils.JTS_FACTORY;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.onthegomap.palmprep.aoi.AreaOfInterest;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.raster.GridGeometry;
import com.onthegomap.palmprep.raster.RasterLayer;
import com.onthegomap.palmprep.vector.FeatureSet;
import com.onthegomap.palmprep.vector.VectorFeature;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

public class TestUtils {

  public static final Crs UTM32 = Crs.ofEpsg(25832);

  public static List<Coordinate> newCoordinateList(double... coords) {
    List<Coordinate> result = new ArrayList<>(coords.length / 2);
    for (int i = 0; i < coords.length; i += 2) {
      result.add(new Coordinate(coords[i], coords[i + 1]));
    }
    return result;
  }

  public static Polygon newPolygon(double... coords) {
    return JTS_FACTORY.createPolygon(newCoordinateList(coords).toArray(new Coordinate[0]));
  }

  public static Polygon rectangle(double minX, double minY, double maxX, double maxY) {
    return newPolygon(minX, minY, maxX, minY, maxX, maxY, minX, maxY, minX, minY);
  }

  public static Polygon rectangle(double min, double max) {
    return rectangle(min, min, max, max);
  }

  public static MultiPolygon newMultiPolygon(Polygon... polys) {
    return JTS_FACTORY.createMultiPolygon(polys);
  }

  public static LineString newLineString(double... coords) {
    return JTS_FACTORY.createLineString(newCoordinateList(coords).toArray(new Coordinate[0]));
  }

  public static Point newPoint(double x, double y) {
    return JTS_FACTORY.createPoint(new Coordinate(x, y));
  }

  public static GeometryCollection newGeometryCollection(Geometry... geoms) {
    return JTS_FACTORY.createGeometryCollection(geoms);
  }

  /** Returns an attribute map from alternating keys and values, keeping nulls. */
  public static Map<String, Object> attrs(Object... keyValues) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      result.put((String) keyValues[i], keyValues[i + 1]);
    }
    return result;
  }

  public static FeatureSet featureSet(Crs crs, VectorFeature... features) {
    return new FeatureSet(crs, Arrays.asList(features));
  }

  public static AreaOfInterest aoi(Geometry geometry) {
    return new AreaOfInterest(geometry, UTM32);
  }

  public static GridGeometry grid(double minX, double maxY, double res, int nx, int ny) {
    return new GridGeometry(UTM32, minX, maxY, res, res, nx, ny);
  }

  /** Returns a raster on {@code grid} with row-major {@code values}. */
  public static RasterLayer raster(GridGeometry grid, double nodata, double... values) {
    return new RasterLayer(grid, values, nodata);
  }

  /** Returns a raster on {@code grid} with every cell set to {@code value}. */
  public static RasterLayer constant(GridGeometry grid, double value) {
    double[] values = new double[grid.size()];
    Arrays.fill(values, value);
    return new RasterLayer(grid, values, Double.NaN);
  }

  public static void assertSameShape(Geometry expected, Geometry actual) {
    assertTrue(expected.equalsTopo(actual), () -> "expected " + expected + " but got " + actual);
  }
}
