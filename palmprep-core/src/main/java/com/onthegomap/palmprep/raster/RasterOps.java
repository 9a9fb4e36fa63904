package com.onthegomap.palmprep.raster;

import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.geo.GeoUtils;
import java.util.List;
import java.util.function.IntConsumer;
import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

/**
 * In-memory raster operations on a single grid: crop, mask, and finding the cells a polygon touches.
 */
public class RasterOps {

  private RasterOps() {}

  /**
   * Returns the grid that covers all of {@code tiles}, aligned to the cells of the first one.
   *
   * @throws ValidationException if the tiles are empty or do not share a CRS and resolution
   */
  public static GridGeometry mosaicGrid(List<RasterLayer> tiles) {
    if (tiles.isEmpty()) {
      throw new ValidationException("Cannot mosaic an empty list of rasters");
    }
    GridGeometry first = tiles.get(0).grid();
    Envelope extent = new Envelope();
    for (RasterLayer tile : tiles) {
      GridGeometry grid = tile.grid();
      if (!grid.crs().equals(first.crs())) {
        throw new ValidationException("Cannot mosaic rasters in " + first.crs() + " and " + grid.crs());
      }
      if (!grid.sameResolution(first)) {
        throw new ValidationException("Cannot mosaic rasters with resolution " + first.resX() + "x" + first.resY() +
          " and " + grid.resX() + "x" + grid.resY());
      }
      extent.expandToInclude(grid.envelope());
    }
    return GridGeometry.covering(first.crs(), extent, first.resX(), first.resY());
  }

  /**
   * Crops {@code raster} to the cells that overlap {@code envelope}, snapping the window outward to whole cells so the
   * result stays on the same grid.
   */
  public static RasterLayer crop(RasterLayer raster, Envelope envelope) {
    GridGeometry grid = raster.grid();
    int c0 = clamp((int) Math.floor(grid.column(envelope.getMinX())), grid.nx());
    int c1 = clamp((int) Math.ceil(grid.column(envelope.getMaxX())), grid.nx());
    int r0 = clamp((int) Math.floor(grid.row(envelope.getMaxY())), grid.ny());
    int r1 = clamp((int) Math.ceil(grid.row(envelope.getMinY())), grid.ny());
    int nx = Math.max(0, c1 - c0);
    int ny = Math.max(0, r1 - r0);
    if (c0 == 0 && r0 == 0 && nx == grid.nx() && ny == grid.ny()) {
      return raster;
    }
    GridGeometry cropped = new GridGeometry(grid.crs(), grid.minX() + c0 * grid.resX(),
      grid.maxY() - r0 * grid.resY(), grid.resX(), grid.resY(), nx, ny);
    RasterLayer result = RasterLayer.empty(cropped, raster.nodata());
    for (int row = 0; row < ny; row++) {
      for (int col = 0; col < nx; col++) {
        result.set(col, row, raster.get(col + c0, row + r0));
      }
    }
    return result;
  }

  private static int clamp(int value, int max) {
    return Math.max(0, Math.min(max, value));
  }

  /** Returns a copy of {@code raster} where every cell whose center lies outside {@code area} is nodata. */
  public static RasterLayer mask(RasterLayer raster, Geometry area) {
    GridGeometry grid = raster.grid();
    RasterLayer result = RasterLayer.empty(grid, raster.nodata());
    var locator = new IndexedPointInAreaLocator(area);
    Envelope areaEnvelope = area.getEnvelopeInternal();
    Coordinate center = new Coordinate();
    for (int row = 0; row < grid.ny(); row++) {
      center.y = grid.centerY(row);
      for (int col = 0; col < grid.nx(); col++) {
        center.x = grid.centerX(col);
        if (areaEnvelope.contains(center) && locator.locate(center) != Location.EXTERIOR) {
          result.set(col, row, raster.get(col, row));
        }
      }
    }
    return result;
  }

  /**
   * Calls {@code consumer} with the index of every cell of {@code grid} whose area intersects {@code geometry},
   * including cells that only touch its boundary.
   */
  public static void forEachCellTouching(GridGeometry grid, Geometry geometry, IntConsumer consumer) {
    if (geometry == null || geometry.isEmpty()) {
      return;
    }
    Envelope envelope = geometry.getEnvelopeInternal();
    int c0 = clamp((int) Math.floor(grid.column(envelope.getMinX())) - 1, grid.nx());
    int c1 = clamp((int) Math.ceil(grid.column(envelope.getMaxX())) + 1, grid.nx());
    int r0 = clamp((int) Math.floor(grid.row(envelope.getMaxY())) - 1, grid.ny());
    int r1 = clamp((int) Math.ceil(grid.row(envelope.getMinY())) + 1, grid.ny());
    PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
    for (int row = r0; row < r1; row++) {
      for (int col = c0; col < c1; col++) {
        Envelope cell = grid.cellEnvelope(col, row);
        if (cell.intersects(envelope) && prepared.intersects(GeoUtils.rectangle(cell))) {
          consumer.accept(grid.index(col, row));
        }
      }
    }
  }
}
