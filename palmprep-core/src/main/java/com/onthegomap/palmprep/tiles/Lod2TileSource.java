package com.onthegomap.palmprep.tiles;

import com.onthegomap.palmprep.util.FileUtils;
import com.onthegomap.palmprep.vector.FeatureCsv;
import com.onthegomap.palmprep.vector.FeatureSet;
import com.onthegomap.palmprep.vector.VectorReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads LOD2 building tiles, memoized on disk by tile name.
 * <p>
 * The raw tile is downloaded to {@code {cacheDir}/{name}} and the converted features to {@code {cacheDir}/{name}.csv},
 * written to a {@code .part} file first and moved into place once complete.
 * When the converted file exists the tile is neither fetched nor read again, so reruns are idempotent per tile.
 */
public class Lod2TileSource implements TileAcquisition.TileLoader<FeatureSet> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Lod2TileSource.class);

  private final TileGrid grid;
  private final TileFetcher fetcher;
  private final VectorReader reader;
  private final Path cacheDir;

  public Lod2TileSource(TileGrid grid, TileFetcher fetcher, VectorReader reader, Path cacheDir) {
    this.grid = grid;
    this.fetcher = fetcher;
    this.reader = reader;
    this.cacheDir = cacheDir;
  }

  /** Returns the file holding the converted features of {@code tile}. */
  public Path convertedPath(TileKey tile) {
    return cacheDir.resolve(tile.name() + ".csv");
  }

  @Override
  public FeatureSet load(TileKey tile) throws AcquisitionFailure {
    Path converted = convertedPath(tile);
    Path partial = converted.resolveSibling(converted.getFileName() + ".part");
    try {
      if (FileUtils.isNonEmptyFile(converted)) {
        LOGGER.debug("Using cached {}", converted);
        return FeatureCsv.read(converted, grid.crs());
      }
      Path raw = cacheDir.resolve(tile.name());
      if (!FileUtils.isNonEmptyFile(raw)) {
        fetcher.fetch(tile, raw);
      }
      FeatureSet features = reader.read(raw).reproject(grid.crs());
      FeatureCsv.write(features, partial);
      FileUtils.move(partial, converted);
      return features;
    } catch (IOException | UncheckedIOException e) {
      FileUtils.deleteFile(partial);
      throw new AcquisitionFailure(tile.name(), "unable to read tile: " + e.getMessage(), e);
    }
  }
}
