package com.onthegomap.palmprep.raster;

import com.onthegomap.palmprep.geo.Reprojection;
import java.util.List;

/**
 * Warps rasters without GDAL by mapping each target cell center back into every source and sampling it.
 */
public class InMemoryRasterWarper implements RasterWarper {

  @Override
  public RasterLayer warp(List<RasterLayer> sources, GridGeometry target, Resampling resampling) {
    RasterLayer result = RasterLayer.empty(target, sources.get(0).nodata());
    for (RasterLayer source : sources) {
      Reprojection inverse = Reprojection.between(target.crs(), source.grid().crs());
      for (int row = 0; row < target.ny(); row++) {
        for (int col = 0; col < target.nx(); col++) {
          if (result.isValid(col, row)) {
            continue;
          }
          var point = inverse.transform(target.centerX(col), target.centerY(row));
          double value = resampling == Resampling.NEAREST ? nearest(source, point.x, point.y) :
            bilinear(source, point.x, point.y);
          if (!source.isNoData(value)) {
            result.set(col, row, value);
          }
        }
      }
    }
    return result;
  }

  static double nearest(RasterLayer source, double x, double y) {
    GridGeometry grid = source.grid();
    int col = (int) Math.floor(grid.column(x));
    int row = (int) Math.floor(grid.row(y));
    if (col < 0 || row < 0 || col >= grid.nx() || row >= grid.ny()) {
      return source.nodata();
    }
    return source.get(col, row);
  }

  // nodata neighbours are left out and the remaining weights renormalized
  static double bilinear(RasterLayer source, double x, double y) {
    GridGeometry grid = source.grid();
    double column = grid.column(x);
    double row = grid.row(y);
    if (column < 0 || row < 0 || column > grid.nx() || row > grid.ny()) {
      return source.nodata();
    }
    double px = column - 0.5;
    double py = row - 0.5;
    int c0 = (int) Math.floor(px);
    int r0 = (int) Math.floor(py);
    double fx = px - c0;
    double fy = py - r0;
    double sum = 0;
    double weights = 0;
    for (int dr = 0; dr <= 1; dr++) {
      for (int dc = 0; dc <= 1; dc++) {
        int c = c0 + dc;
        int r = r0 + dr;
        double weight = (dc == 0 ? 1 - fx : fx) * (dr == 0 ? 1 - fy : fy);
        if (weight > 0 && c >= 0 && r >= 0 && c < grid.nx() && r < grid.ny() && source.isValid(c, r)) {
          sum += weight * source.get(c, r);
          weights += weight;
        }
      }
    }
    return weights > 0 ? sum / weights : source.nodata();
  }
}
