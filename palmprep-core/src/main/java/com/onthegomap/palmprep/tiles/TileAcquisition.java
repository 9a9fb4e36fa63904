package com.onthegomap.palmprep.tiles;

import com.onthegomap.palmprep.EmptyResultException;
import com.onthegomap.palmprep.stats.Stats;
import com.onthegomap.palmprep.util.FileUtils;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential bulk acquisition of tiles that tolerates individual failures.
 * <p>
 * A tile that fails is logged and skipped; the run only fails when no tile at all could be loaded. Results keep the
 * order of the input tiles.
 */
public class TileAcquisition {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileAcquisition.class);

  private TileAcquisition() {}

  /**
   * Loads each tile with {@code loader}, skipping the ones that fail.
   *
   * @throws EmptyResultException if every tile failed
   */
  public static <T> List<T> loadAll(String what, List<TileKey> tiles, TileLoader<T> loader, Stats stats) {
    List<T> result = new ArrayList<>(tiles.size());
    for (TileKey tile : tiles) {
      try {
        result.add(loader.load(tile));
      } catch (AcquisitionFailure e) {
        stats.dataError(what + "_tile_unavailable");
        LOGGER.warn("Skipping {} tile {}", what, e.getMessage());
      }
    }
    if (result.isEmpty()) {
      throw new EmptyResultException("No " + what + " tiles could be downloaded or read");
    }
    LOGGER.info("Loaded {} of {} {} tiles", result.size(), tiles.size(), what);
    return result;
  }

  /**
   * Downloads each tile into {@code dir} named after the tile, reusing files that are already there.
   *
   * @throws EmptyResultException if every tile failed
   */
  public static List<Path> downloadAll(String what, List<TileKey> tiles, TileFetcher fetcher, Path dir,
    Stats stats) {
    return loadAll(what, tiles, tile -> {
      Path path = dir.resolve(tile.name());
      if (FileUtils.isNonEmptyFile(path)) {
        LOGGER.debug("Using existing {}", path);
      } else {
        fetcher.fetch(tile, path);
      }
      return path;
    }, stats);
  }

  /** Turns a tile into a usable result. */
  @FunctionalInterface
  public interface TileLoader<T> {

    T load(TileKey tile) throws AcquisitionFailure;
  }
}
