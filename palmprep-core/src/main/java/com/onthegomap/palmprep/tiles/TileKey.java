package com.onthegomap.palmprep.tiles;

import com.onthegomap.palmprep.geo.GeoUtils;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;

/**
 * A cell of a {@link TileGrid}, identified by its lower-left corner in the grid's native units.
 *
 * @param x       left edge
 * @param y       bottom edge
 * @param spacing tile width and height
 * @param name    file name of the tile at the source
 */
public record TileKey(double x, double y, double spacing, String name) {

  public Envelope envelope() {
    return new Envelope(x, x + spacing, y, y + spacing);
  }

  public Polygon rectangle() {
    return GeoUtils.rectangle(envelope());
  }
}
