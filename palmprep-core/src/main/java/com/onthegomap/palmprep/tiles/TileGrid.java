package com.onthegomap.palmprep.tiles;

import com.onthegomap.palmprep.geo.Crs;

/**
 * A regular grid of square source tiles whose origins are integer multiples of {@code spacing}.
 *
 * @param id      short name used in logs and errors
 * @param spacing tile size in units of {@code crs}
 * @param crs     native coordinate reference system of the grid
 * @param baseUrl URL that tile names are appended to
 * @param namer   derives the file name of a tile from its origin
 */
public record TileGrid(String id, double spacing, Crs crs, String baseUrl, TileNamer namer) {

  public static final double WSF_SPACING_DEGREES = 2;
  public static final double LOD2_SPACING_METERS = 2000;

  public TileGrid {
    if (!(spacing > 0)) {
      throw new IllegalArgumentException("Tile spacing must be > 0, was " + spacing);
    }
    if (!baseUrl.endsWith("/")) {
      baseUrl = baseUrl + "/";
    }
  }

  /** Settlement-year tiles: 2 degree WGS84 cells named {@code WSFevolution_v1_{lon}_{lat}.tif}. */
  public static TileGrid wsfEvolution(String baseUrl) {
    return new TileGrid("wsf", WSF_SPACING_DEGREES, Crs.WGS84, baseUrl,
      (x, y) -> "WSFevolution_v1_%d_%d.tif".formatted(Math.round(x), Math.round(y)));
  }

  /** LOD2 building tiles: 2 km cells named {@code {E}_{N}.gml} with easting and northing in kilometers. */
  public static TileGrid lod2(String baseUrl, Crs crs) {
    return new TileGrid("lod2", LOD2_SPACING_METERS, crs, baseUrl,
      (x, y) -> "%d_%d.gml".formatted(Math.floorDiv(Math.round(x), 1000), Math.floorDiv(Math.round(y), 1000)));
  }

  /** Returns the tile whose lower-left corner is {@code (x, y)}. */
  public TileKey key(double x, double y) {
    return new TileKey(x, y, spacing, namer.name(x, y));
  }

  public String url(TileKey tile) {
    return baseUrl + tile.name();
  }

  /** Derives the name of a tile from its lower-left corner. */
  @FunctionalInterface
  public interface TileNamer {

    String name(double x, double y);
  }
}
