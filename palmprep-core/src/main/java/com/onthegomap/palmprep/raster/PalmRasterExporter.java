package com.onthegomap.palmprep.raster;

import com.onthegomap.palmprep.ValidationException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each named layer to {@code {prefix}_{layer}_{resolution}.tif} in an output directory.
 */
public class PalmRasterExporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(PalmRasterExporter.class);

  private final RasterWriter writer;
  private final Path outputDir;
  private final String prefix;

  public PalmRasterExporter(RasterWriter writer, Path outputDir, String prefix) {
    this.writer = writer;
    this.outputDir = outputDir;
    this.prefix = prefix;
  }

  /** Returns the file name for {@code layer}. */
  public String fileName(String layer, int resolution) {
    return "%s_%s_%d.tif".formatted(prefix, layer, resolution);
  }

  /**
   * Writes every layer and returns the written files by layer name.
   *
   * @param resolution resolution for the file names, or null to use the rounded pixel width of the first layer
   * @throws ValidationException if {@code layers} is empty
   */
  public Map<String, Path> export(Map<String, RasterLayer> layers, Integer resolution) throws IOException {
    if (layers.isEmpty()) {
      throw new ValidationException("No rasters to export");
    }
    int res = resolution != null ? resolution :
      (int) Math.round(layers.values().iterator().next().grid().resX());
    Map<String, Path> written = new LinkedHashMap<>();
    for (var entry : layers.entrySet()) {
      Path path = outputDir.resolve(fileName(entry.getKey(), res));
      writer.write(entry.getValue(), path);
      LOGGER.info("Wrote {}", path);
      written.put(entry.getKey(), path);
    }
    return written;
  }
}
