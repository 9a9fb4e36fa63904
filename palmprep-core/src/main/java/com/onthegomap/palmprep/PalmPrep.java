package com.onthegomap.palmprep;

import com.onthegomap.palmprep.aoi.AreaOfInterest;
import com.onthegomap.palmprep.buildings.BuildingClassifier;
import com.onthegomap.palmprep.buildings.BuildingFeature;
import com.onthegomap.palmprep.buildings.BuildingRasterizer;
import com.onthegomap.palmprep.buildings.EnrichedBuildings;
import com.onthegomap.palmprep.buildings.FeatureEnricher;
import com.onthegomap.palmprep.buildings.GeometryNormalizer;
import com.onthegomap.palmprep.buildings.Ogr2OgrTranslator;
import com.onthegomap.palmprep.buildings.VectorTranslator;
import com.onthegomap.palmprep.buildings.ZonalYearExtractor;
import com.onthegomap.palmprep.config.Arguments;
import com.onthegomap.palmprep.config.PalmPrepConfig;
import com.onthegomap.palmprep.csd.CsdConfigWriter;
import com.onthegomap.palmprep.csd.CsdConfiguration;
import com.onthegomap.palmprep.csd.Domain;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.raster.AlignedRasters;
import com.onthegomap.palmprep.raster.GdalRasterIO;
import com.onthegomap.palmprep.raster.GdalRasterWarper;
import com.onthegomap.palmprep.raster.GridAligner;
import com.onthegomap.palmprep.raster.LandCoverReclassifier;
import com.onthegomap.palmprep.raster.PalmRasterExporter;
import com.onthegomap.palmprep.raster.RasterLayer;
import com.onthegomap.palmprep.raster.RasterMosaicClipper;
import com.onthegomap.palmprep.raster.RasterReader;
import com.onthegomap.palmprep.raster.RasterWarper;
import com.onthegomap.palmprep.raster.RasterWriter;
import com.onthegomap.palmprep.stats.Stats;
import com.onthegomap.palmprep.stats.Timers;
import com.onthegomap.palmprep.tiles.AcquisitionFailure;
import com.onthegomap.palmprep.tiles.HttpTileFetcher;
import com.onthegomap.palmprep.tiles.Lod2TileSource;
import com.onthegomap.palmprep.tiles.TileAcquisition;
import com.onthegomap.palmprep.tiles.TileFetcher;
import com.onthegomap.palmprep.tiles.TileGrid;
import com.onthegomap.palmprep.tiles.TileGridIndexer;
import com.onthegomap.palmprep.tiles.TileKey;
import com.onthegomap.palmprep.util.Exceptions;
import com.onthegomap.palmprep.util.FileUtils;
import com.onthegomap.palmprep.vector.FeatureSet;
import com.onthegomap.palmprep.vector.OgrVectorReader;
import com.onthegomap.palmprep.vector.VectorMosaicClipper;
import com.onthegomap.palmprep.vector.VectorReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * High-level API for preparing PALM static inputs for an area of interest.
 * <p>
 * Runs these stages in order:
 * <ol>
 * <li>{@code aoi}: read the area of interest polygon</li>
 * <li>{@code wsf}: download, mosaic and clip WSF Evolution settlement-year tiles</li>
 * <li>{@code buildings}: download, convert and merge LOD2 building tiles</li>
 * <li>{@code normalize}: repair building geometries into MultiPolygons</li>
 * <li>{@code enrich}: clip buildings to the area, assign IDs and split off bridges</li>
 * <li>{@code classify}: find each building's settlement year and PALM building type</li>
 * <li>{@code align}: put every input raster onto one target grid</li>
 * <li>{@code rasterize}: burn building attributes into rasters on that grid</li>
 * <li>{@code export}: write every raster as GeoTIFF</li>
 * <li>{@code csd}: write the create_static_driver configuration</li>
 * </ol>
 * For example:
 *
 * <pre>{@code
 * public static void main(String[] args) {
 *   PalmPrep.create(Arguments.fromArgsOrConfigFile(args)).run();
 * }
 * }</pre>
 * <p>
 * File formats and downloads go through GDAL, HTTP and ogr2ogr unless replaced with the {@code set...} methods.
 */
public class PalmPrep {

  private static final Logger LOGGER = LoggerFactory.getLogger(PalmPrep.class);
  /** Bavarian LOD2 tiles are published on an ETRS89 / UTM 32N grid. */
  public static final int LOD2_EPSG = 25832;
  public static final String WSF_LAYER = "WSF";
  public static final String LAND_COVER_LAYER = "LC";

  private final Arguments arguments;
  private final PalmPrepConfig config;
  private final Stats stats;
  private final Crs targetCrs;
  private final List<Stage> stages = new ArrayList<>();
  private RasterReader rasterReader;
  private RasterWriter rasterWriter;
  private RasterWarper rasterWarper;
  private VectorReader vectorReader;
  private VectorTranslator translator;
  private Function<TileGrid, TileFetcher> fetchers;
  private boolean ran = false;

  private AreaOfInterest aoi;
  private RasterLayer wsf;
  private FeatureSet lod2;
  private FeatureSet normalized;
  private EnrichedBuildings buildings;
  private AlignedRasters rasters;
  private Map<String, Path> exported = Map.of();
  private Path csdConfig;

  private PalmPrep(Arguments arguments) {
    this.arguments = arguments;
    this.config = PalmPrepConfig.from(arguments);
    this.stats = Stats.inMemory();
    this.targetCrs = Crs.ofEpsg(config.targetEpsg());
    addStage("aoi", "Read the area of interest from " + config.aoi(), this::readAoi);
    addStage("wsf", "Download and mosaic WSF Evolution tiles", this::loadWsf);
    addStage("buildings", "Download and merge LOD2 building tiles", this::loadBuildings);
    addStage("normalize", "Repair building geometries into MultiPolygons", this::normalizeBuildings);
    addStage("enrich", "Clip buildings to the area and split off bridges", this::enrichBuildings);
    addStage("classify", "Assign settlement years and PALM building types", this::classifyBuildings);
    addStage("align", "Align " + config.rasters().keySet() + " and WSF to a " + config.resolution() + " grid",
      this::alignRasters);
    addStage("rasterize", "Rasterize building and bridge attributes", this::rasterizeBuildings);
    addStage("export", "Write rasters to " + config.output(), this::exportRasters);
    addStage("csd", "Write the create_static_driver configuration", this::writeCsdConfig);
  }

  /** Returns a new runner that will get configuration from {@code arguments}. */
  public static PalmPrep create(Arguments arguments) {
    return new PalmPrep(arguments);
  }

  public static void main(String... args) {
    create(Arguments.fromArgsOrConfigFile(args)).run();
  }

  private void addStage(String name, String description, Exceptions.RunnableThatThrows task) {
    stages.add(new Stage(name, description, task));
  }

  public PalmPrep setRasterReader(RasterReader rasterReader) {
    this.rasterReader = rasterReader;
    return this;
  }

  public PalmPrep setRasterWriter(RasterWriter rasterWriter) {
    this.rasterWriter = rasterWriter;
    return this;
  }

  public PalmPrep setVectorReader(VectorReader vectorReader) {
    this.vectorReader = vectorReader;
    return this;
  }

  /** Sets the converter used when buildings cannot be repaired in-process, or null to fail instead. */
  public PalmPrep setRasterWarper(RasterWarper rasterWarper) {
    this.rasterWarper = rasterWarper;
    return this;
  }

  public PalmPrep setTranslator(VectorTranslator translator) {
    this.translator = translator;
    return this;
  }

  /** Sets the function that creates a fetcher for each tile grid. */
  public PalmPrep setFetchers(Function<TileGrid, TileFetcher> fetchers) {
    this.fetchers = fetchers;
    return this;
  }

  public PalmPrepConfig config() {
    return config;
  }

  public Stats stats() {
    return stats;
  }

  /**
   * Runs every stage and returns what they produced.
   *
   * @throws IllegalStateException if this runner already ran
   * @throws PalmPrepException     if a stage fails on bad or missing input
   */
  public Result run() {
    if (ran) {
      throw new IllegalStateException("Can only run once");
    }
    ran = true;
    if (config.aoi() == null) {
      throw new ValidationException("Missing required argument: aoi");
    }
    // GDAL loads its native library on first use, so only touch it when nothing else was provided
    if (rasterReader == null || rasterWriter == null) {
      GdalRasterIO gdal = new GdalRasterIO();
      rasterReader = rasterReader == null ? gdal : rasterReader;
      rasterWriter = rasterWriter == null ? gdal : rasterWriter;
    }
    if (rasterWarper == null) {
      rasterWarper = new GdalRasterWarper();
    }
    if (vectorReader == null) {
      vectorReader = new OgrVectorReader(targetCrs);
    }
    if (fetchers == null) {
      fetchers = grid -> HttpTileFetcher.create(grid, config);
    }

    LOGGER.info("Preparing PALM inputs for {} into {} in these phases:", config.aoi(), config.output());
    for (Stage stage : stages) {
      LOGGER.info("  {}: {}", stage.name, stage.description);
    }
    FileUtils.createDirectory(config.tmpDir());
    FileUtils.createDirectory(config.cacheDir());
    FileUtils.createDirectory(config.output());

    for (Stage stage : stages) {
      Timers.Finishable timer = stats.startStage(stage.name);
      try {
        stage.task.run();
      } catch (Exception e) {
        LOGGER.error("Stage {} failed: {}", stage.name, e.getMessage());
        Exceptions.throwFatalException(e);
      } finally {
        timer.stop();
      }
    }

    LOGGER.info("FINISHED!");
    stats.printSummary();
    return new Result(aoi, buildings, rasters, exported, csdConfig);
  }

  private void readAoi() throws IOException {
    FeatureSet features = vectorReader.read(config.aoi());
    aoi = AreaOfInterest.fromFeatures(features);
    LOGGER.info("Area of interest in {} covering {}", aoi.crs(), aoi.envelope());
  }

  private void loadWsf() {
    TileGrid grid = TileGrid.wsfEvolution(config.wsfBaseUrl());
    AreaOfInterest area = aoi.reproject(grid.crs());
    List<TileKey> tiles = TileGridIndexer.index(area, grid);
    TileFetcher fetcher = fetchers.apply(grid);
    Path dir = config.cacheDir().resolve(grid.id());
    FileUtils.createDirectory(dir);
    List<RasterLayer> layers = TileAcquisition.loadAll(grid.id(), tiles, tile -> {
      Path path = dir.resolve(tile.name());
      if (!FileUtils.isNonEmptyFile(path)) {
        fetcher.fetch(tile, path);
      }
      try {
        return rasterReader.read(path);
      } catch (IOException e) {
        throw new AcquisitionFailure(tile.name(), "unable to read raster: " + e.getMessage(), e);
      }
    }, stats);
    wsf = new RasterMosaicClipper(rasterWarper).mosaicAndClip(layers, area);
    LOGGER.info("Settlement-year mosaic {}", wsf);
  }

  private void loadBuildings() {
    TileGrid grid = TileGrid.lod2(config.lod2BaseUrl(), Crs.ofEpsg(LOD2_EPSG));
    List<TileKey> tiles = TileGridIndexer.index(aoi.reproject(grid.crs()), grid);
    Path dir = config.cacheDir().resolve(grid.id());
    FileUtils.createDirectory(dir);
    var source = new Lod2TileSource(grid, fetchers.apply(grid), vectorReader, dir);
    List<FeatureSet> loaded = TileAcquisition.loadAll(grid.id(), tiles, source, stats);
    lod2 = VectorMosaicClipper.merge(loaded, aoi, targetCrs);
  }

  private void normalizeBuildings() {
    VectorTranslator external = translator != null ? translator : new Ogr2OgrTranslator(config.ogr2ogr());
    var result = new GeometryNormalizer(external, config.tmpDir(), stats).normalize(lod2);
    LOGGER.info("Normalized via {}", result.states());
    normalized = result.features();
  }

  private void enrichBuildings() {
    buildings = FeatureEnricher.from(config).enrich(normalized, aoi);
  }

  private void classifyBuildings() {
    var years = new ZonalYearExtractor(wsf);
    var classifier = BuildingClassifier.from(config);
    List<BuildingFeature> withTypes = classifier.classifyAll(years.extract(buildings.buildings(), buildings.crs()));
    List<BuildingFeature> bridgesWithTypes =
      classifier.classifyAll(years.extract(buildings.bridges(), buildings.crs()));
    buildings = new EnrichedBuildings(buildings.crs(), withTypes, bridgesWithTypes);
  }

  private void alignRasters() throws IOException {
    Map<String, RasterLayer> inputs = new LinkedHashMap<>();
    for (var entry : config.rasters().entrySet()) {
      LOGGER.info("Reading {} from {}", entry.getKey(), entry.getValue());
      inputs.put(entry.getKey(), rasterReader.read(entry.getValue()));
    }
    inputs.putIfAbsent(WSF_LAYER, wsf);
    AlignedRasters aligned = GridAligner.from(config, rasterWarper).align(aoi, inputs);
    RasterLayer landCover = landCover(aligned.layers());
    if (landCover != null) {
      aligned = aligned.with(LandCoverReclassifier.palmSurfaces(landCover));
    }
    rasters = aligned;
  }

  private static RasterLayer landCover(Map<String, RasterLayer> layers) {
    for (var entry : layers.entrySet()) {
      if (entry.getKey().toUpperCase(Locale.ROOT).equals(LAND_COVER_LAYER)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private void rasterizeBuildings() {
    rasters = rasters.with(new BuildingRasterizer(rasters.grid()).rasterize(buildings));
  }

  private void exportRasters() throws IOException {
    var exporter = new PalmRasterExporter(rasterWriter, config.output(), config.prefix());
    exported = exporter.export(rasters.layers(), (int) Math.round(config.resolution()));
  }

  private void writeCsdConfig() throws IOException {
    var csd = CsdConfiguration.from(arguments, config.prefix(), config.output(), config.output(),
      config.targetEpsg(), Domain.from(rasters.grid()));
    csdConfig = new CsdConfigWriter().write(csd);
  }

  /**
   * Everything a run produced.
   *
   * @param aoi        area of interest as read
   * @param buildings  classified buildings and bridges in the target CRS
   * @param rasters    every raster on the reference grid
   * @param exported   GeoTIFF written for each raster, by layer name
   * @param csdConfig  create_static_driver configuration file
   */
  public record Result(
    AreaOfInterest aoi,
    EnrichedBuildings buildings,
    AlignedRasters rasters,
    Map<String, Path> exported,
    Path csdConfig
  ) {}

  private record Stage(String name, String description, Exceptions.RunnableThatThrows task) {}
}
