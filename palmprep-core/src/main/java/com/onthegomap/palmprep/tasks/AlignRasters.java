package com.onthegomap.palmprep.tasks;

import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.aoi.AreaOfInterest;
import com.onthegomap.palmprep.config.Arguments;
import com.onthegomap.palmprep.config.PalmPrepConfig;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.raster.AlignedRasters;
import com.onthegomap.palmprep.raster.GdalRasterIO;
import com.onthegomap.palmprep.raster.GdalRasterWarper;
import com.onthegomap.palmprep.raster.GridAligner;
import com.onthegomap.palmprep.raster.PalmRasterExporter;
import com.onthegomap.palmprep.raster.RasterLayer;
import com.onthegomap.palmprep.raster.RasterReader;
import com.onthegomap.palmprep.raster.RasterWarper;
import com.onthegomap.palmprep.raster.RasterWriter;
import com.onthegomap.palmprep.stats.Stats;
import com.onthegomap.palmprep.util.FileUtils;
import com.onthegomap.palmprep.vector.OgrVectorReader;
import com.onthegomap.palmprep.vector.VectorReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aligns a set of local rasters to the target grid for an area of interest and writes them as GeoTIFFs, without
 * touching any building data.
 * <p>
 * To run:
 *
 * <pre>{@code
 * java -cp palmprep.jar com.onthegomap.palmprep.tasks.AlignRasters aoi=aoi.gpkg rasters=DEM=dem.tif,LC=lc.tif
 * }</pre>
 */
public class AlignRasters {

  private final PalmPrepConfig config;
  private final RasterReader reader;
  private final RasterWriter writer;
  private final RasterWarper warper;
  private final VectorReader vectors;

  public AlignRasters(PalmPrepConfig config, RasterReader reader, RasterWriter writer, RasterWarper warper,
    VectorReader vectors) {
    this.config = config;
    this.reader = reader;
    this.writer = writer;
    this.warper = warper;
    this.vectors = vectors;
  }

  public static void main(String... args) throws IOException {
    var config = PalmPrepConfig.from(Arguments.fromArgsOrConfigFile(args));
    var gdal = new GdalRasterIO();
    new AlignRasters(config, gdal, gdal, new GdalRasterWarper(), new OgrVectorReader(Crs.ofEpsg(config.targetEpsg())))
      .run(Stats.inMemory());
  }

  /** Aligns and writes every configured raster and returns the written files by layer name. */
  public Map<String, Path> run(Stats stats) throws IOException {
    if (config.aoi() == null) {
      throw new ValidationException("Missing required argument: aoi");
    }
    if (config.rasters().isEmpty()) {
      throw new ValidationException("Missing required argument: rasters");
    }
    AlignedRasters aligned;
    var timer = stats.startStage("align");
    try {
      var aoi = AreaOfInterest.fromFeatures(vectors.read(config.aoi()));
      Map<String, RasterLayer> inputs = new LinkedHashMap<>();
      for (var entry : config.rasters().entrySet()) {
        inputs.put(entry.getKey(), reader.read(entry.getValue()));
      }
      aligned = GridAligner.from(config, warper).align(aoi, inputs);
    } finally {
      timer.stop();
    }
    timer = stats.startStage("export");
    try {
      FileUtils.createDirectory(config.output());
      return new PalmRasterExporter(writer, config.output(), config.prefix())
        .export(aligned.layers(), (int) Math.round(config.resolution()));
    } finally {
      timer.stop();
      stats.printSummary();
    }
  }
}
