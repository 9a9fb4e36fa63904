package com.onthegomap.palmprep.tiles;

import java.nio.file.Path;

/** Retrieves the payload of a tile into a local file. */
@FunctionalInterface
public interface TileFetcher {

  /**
   * Writes {@code tile} to {@code destination}.
   *
   * @throws AcquisitionFailure if the tile could not be retrieved, in which case {@code destination} does not exist
   */
  void fetch(TileKey tile, Path destination) throws AcquisitionFailure;
}
