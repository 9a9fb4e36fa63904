package com.onthegomap.palmprep.raster;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * An in-memory single-band raster: a {@link GridGeometry}, row-major cell values and a nodata marker.
 * <p>
 * NaN cells are always treated as nodata, whatever the marker is.
 */
public final class RasterLayer {

  private final GridGeometry grid;
  private final double[] values;
  private final double nodata;

  public RasterLayer(GridGeometry grid, double[] values, double nodata) {
    this.grid = Objects.requireNonNull(grid, "grid");
    this.values = Objects.requireNonNull(values, "values");
    this.nodata = nodata;
    if (values.length != grid.size()) {
      throw new IllegalArgumentException("Expected " + grid.size() + " values for " + grid.nx() + "x" + grid.ny() +
        " grid, got " + values.length);
    }
  }

  /** Returns a raster where every cell is nodata. */
  public static RasterLayer empty(GridGeometry grid, double nodata) {
    double[] values = new double[grid.size()];
    Arrays.fill(values, nodata);
    return new RasterLayer(grid, values, nodata);
  }

  public GridGeometry grid() {
    return grid;
  }

  public double nodata() {
    return nodata;
  }

  public double get(int col, int row) {
    return values[grid.index(col, row)];
  }

  public void set(int col, int row, double value) {
    values[grid.index(col, row)] = value;
  }

  public boolean isNoData(double value) {
    return Double.isNaN(value) || value == nodata;
  }

  public boolean isValid(int col, int row) {
    return !isNoData(get(col, row));
  }

  public long validCount() {
    long count = 0;
    for (double value : values) {
      if (!isNoData(value)) {
        count++;
      }
    }
    return count;
  }

  /** Returns a copy of the cell values, row by row from the top. */
  public double[] values() {
    return values.clone();
  }

  /** Returns a new raster on the same grid with {@code fn} applied to each valid cell. */
  public RasterLayer map(DoubleUnaryOperator fn, double newNodata) {
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = isNoData(values[i]) ? newNodata : fn.applyAsDouble(values[i]);
    }
    return new RasterLayer(grid, result, newNodata);
  }

  @Override
  public String toString() {
    return "RasterLayer{" + grid + ", nodata=" + nodata + "}";
  }
}
