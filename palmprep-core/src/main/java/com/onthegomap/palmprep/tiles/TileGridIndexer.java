package com.onthegomap.palmprep.tiles;

import com.onthegomap.palmprep.aoi.AreaOfInterest;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the tiles of a {@link TileGrid} that intersect an area of interest.
 * <p>
 * Candidates come from the bounding box: the minimum edges are floored to a multiple of the spacing and the last origin
 * is the multiple below the maximum edges. Each candidate rectangle is then tested against the polygon itself, so
 * tiles in the concave parts of the bounding box are dropped. Tiles are returned column by column (x ascending, then
 * y ascending), which fixes the order mosaics use to break ties.
 */
public class TileGridIndexer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileGridIndexer.class);

  private TileGridIndexer() {}

  /** Returns the tiles of {@code grid} that intersect {@code aoi}, after reprojecting it into the grid CRS. */
  public static List<TileKey> index(AreaOfInterest aoi, TileGrid grid) {
    return index(aoi.reproject(grid.crs()).geometry(), grid);
  }

  /**
   * Returns the tiles of {@code grid} that intersect {@code aoi}, which must already be in the grid CRS.
   *
   * @throws NoIntersectingTilesException if none do
   */
  public static List<TileKey> index(Geometry aoi, TileGrid grid) {
    double spacing = grid.spacing();
    Envelope envelope = aoi.getEnvelopeInternal();
    List<TileKey> result = new ArrayList<>();
    if (!envelope.isNull()) {
      long minCol = (long) Math.floor(envelope.getMinX() / spacing);
      long maxCol = Math.max(minCol, (long) Math.ceil(envelope.getMaxX() / spacing) - 1);
      long minRow = (long) Math.floor(envelope.getMinY() / spacing);
      long maxRow = Math.max(minRow, (long) Math.ceil(envelope.getMaxY() / spacing) - 1);
      PreparedGeometry prepared = PreparedGeometryFactory.prepare(aoi);
      for (long col = minCol; col <= maxCol; col++) {
        for (long row = minRow; row <= maxRow; row++) {
          TileKey tile = grid.key(col * spacing, row * spacing);
          if (prepared.intersects(tile.rectangle())) {
            result.add(tile);
          }
        }
      }
      LOGGER.debug("{} of {} candidate {} tiles intersect the AOI", result.size(),
        (maxCol - minCol + 1) * (maxRow - minRow + 1), grid.id());
    }
    if (result.isEmpty()) {
      throw new NoIntersectingTilesException("No " + grid.id() + " tiles intersect AOI");
    }
    return result;
  }
}
