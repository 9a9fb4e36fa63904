package com.onthegomap.palmprep.raster;

import com.onthegomap.palmprep.geo.Crs;
import java.util.Objects;
import org.locationtech.jts.geom.Envelope;

/**
 * The georeferencing of a north-up raster: its CRS, upper-left corner, pixel size and dimensions.
 *
 * @param crs  coordinate reference system of the cell coordinates
 * @param minX x of the left edge
 * @param maxY y of the top edge
 * @param resX pixel width
 * @param resY pixel height (positive, rows go south)
 * @param nx   number of columns
 * @param ny   number of rows
 */
public record GridGeometry(Crs crs, double minX, double maxY, double resX, double resY, int nx, int ny) {

  private static final double EPSILON = 1e-9;

  public GridGeometry {
    Objects.requireNonNull(crs, "crs");
    if (!(resX > 0) || !(resY > 0)) {
      throw new IllegalArgumentException("Resolution must be > 0, was " + resX + "x" + resY);
    }
    if (nx < 0 || ny < 0) {
      throw new IllegalArgumentException("Dimensions must be >= 0, was " + nx + "x" + ny);
    }
  }

  /** Returns the grid whose cells exactly tile {@code envelope}, which must be a multiple of the resolution. */
  public static GridGeometry covering(Crs crs, Envelope envelope, double resX, double resY) {
    int nx = (int) Math.round(envelope.getWidth() / resX);
    int ny = (int) Math.round(envelope.getHeight() / resY);
    return new GridGeometry(crs, envelope.getMinX(), envelope.getMaxY(), resX, resY, nx, ny);
  }

  /** Returns the grid for a GDAL geotransform {@code [minX, resX, 0, maxY, 0, -resY]}. */
  public static GridGeometry fromGeoTransform(Crs crs, double[] geoTransform, int nx, int ny) {
    if (geoTransform[2] != 0 || geoTransform[4] != 0) {
      throw new IllegalArgumentException("Rotated rasters are not supported");
    }
    return new GridGeometry(crs, geoTransform[0], geoTransform[3], geoTransform[1], Math.abs(geoTransform[5]), nx, ny);
  }

  public double[] geoTransform() {
    return new double[]{minX, resX, 0, maxY, 0, -resY};
  }

  public double maxX() {
    return minX + nx * resX;
  }

  public double minY() {
    return maxY - ny * resY;
  }

  public int size() {
    return nx * ny;
  }

  public Envelope envelope() {
    return new Envelope(minX, maxX(), minY(), maxY);
  }

  public double centerX(int col) {
    return minX + (col + 0.5) * resX;
  }

  public double centerY(int row) {
    return maxY - (row + 0.5) * resY;
  }

  /** Returns the envelope of the cell at {@code (col, row)}. */
  public Envelope cellEnvelope(int col, int row) {
    double x = minX + col * resX;
    double y = maxY - row * resY;
    return new Envelope(x, x + resX, y - resY, y);
  }

  /** Returns the fractional column of {@code x}, snapped to an integer when within floating-point noise of one. */
  public double column(double x) {
    return snap((x - minX) / resX);
  }

  /** Returns the fractional row of {@code y}, snapped to an integer when within floating-point noise of one. */
  public double row(double y) {
    return snap((maxY - y) / resY);
  }

  static double snap(double value) {
    double rounded = Math.rint(value);
    return Math.abs(value - rounded) < EPSILON ? rounded : value;
  }

  public boolean sameResolution(GridGeometry other) {
    return Math.abs(resX - other.resX) < EPSILON * resX && Math.abs(resY - other.resY) < EPSILON * resY;
  }

  public int index(int col, int row) {
    return row * nx + col;
  }
}
