package com.onthegomap.palmprep;

import static com.onthegomap.palmprep.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.palmprep.aoi.AreaOfInterest;
import com.onthegomap.palmprep.buildings.BuildingFeature;
import com.onthegomap.palmprep.config.Arguments;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.TaggedWkt;
import com.onthegomap.palmprep.raster.GridGeometry;
import com.onthegomap.palmprep.raster.InMemoryRasterWarper;
import com.onthegomap.palmprep.raster.RasterLayer;
import com.onthegomap.palmprep.tiles.AcquisitionFailure;
import com.onthegomap.palmprep.vector.FeatureSet;
import com.onthegomap.palmprep.vector.VectorFeature;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Polygon;

class PalmPrepTest {

  private static final Polygon AOI = rectangle(690_100, 5_334_100, 690_300, 5_334_300);

  @TempDir
  Path tmpDir;
  private Path aoiPath;
  private Path ztPath;
  private Path lcPath;
  private final Map<Path, RasterLayer> written = new ConcurrentHashMap<>();
  private final Set<String> fetched = ConcurrentHashMap.newKeySet();

  @BeforeEach
  void setup() {
    aoiPath = tmpDir.resolve("aoi.gpkg");
    ztPath = tmpDir.resolve("zt.tif");
    lcPath = tmpDir.resolve("lc.tif");
  }

  private Arguments arguments(Object... overrides) {
    return Arguments.of(overrides).orElse(Arguments.of(
      "aoi", aoiPath.toString(),
      "output", tmpDir.resolve("out").toString(),
      "tmp_dir", tmpDir.resolve("tmp").toString(),
      "prefix", "test",
      "resolution", "10",
      "rasters", "zt=" + ztPath,
      "csd_acronym", "TST"
    ));
  }

  private static FeatureSet lod2Tile() {
    return featureSet(UTM32,
      VectorFeature.of(rectangle(690_150, 5_334_150, 690_170, 5_334_170),
        attrs("function", "31001_1000", "measuredHeight", 12.0)),
      new VectorFeature(TaggedWkt.parse("POLYHEDRALSURFACE Z (((690200 5334200 0, 690220 5334200 0, " +
        "690220 5334220 0, 690200 5334220 0, 690200 5334200 0)))"),
        attrs("function", "31001_2000", "measuredHeight", "8")),
      VectorFeature.of(rectangle(690_250, 5_334_200, 690_290, 5_334_210),
        attrs("function", "53001_1800", "measuredHeight", 6.5)),
      VectorFeature.of(rectangle(690_900, 5_334_900, 690_920, 5_334_920),
        attrs("function", "31001_1000", "measuredHeight", 4.0))
    );
  }

  /** Settlement-year raster in WGS84 that covers the area of interest with some margin. */
  private static RasterLayer wsfTile() {
    Envelope lonLat = new AreaOfInterest(AOI, UTM32).reproject(Crs.WGS84).envelope();
    double res = 0.0005;
    int nx = (int) Math.ceil((lonLat.getWidth() + 0.02) / res);
    int ny = (int) Math.ceil((lonLat.getHeight() + 0.02) / res);
    return constant(new GridGeometry(Crs.WGS84, lonLat.getMinX() - 0.01, lonLat.getMaxY() + 0.01, res, res, nx, ny),
      1990);
  }

  private PalmPrep palmPrep(Arguments arguments, boolean lod2Available) {
    return PalmPrep.create(arguments)
      .setVectorReader(path -> {
        if (path.equals(aoiPath)) {
          return featureSet(UTM32, VectorFeature.of(AOI, attrs("name", "test")));
        } else if (path.getFileName().toString().endsWith(".gml")) {
          return lod2Tile();
        }
        throw new IOException("unexpected " + path);
      })
      .setRasterReader(path -> {
        if (path.equals(ztPath)) {
          return constant(grid(690_000, 5_334_400, 5, 80, 80), 520);
        } else if (path.equals(lcPath)) {
          return constant(grid(690_000, 5_334_400, 20, 20, 20), 4);
        } else if (path.getFileName().toString().startsWith("WSFevolution_v1_")) {
          return wsfTile();
        }
        throw new IOException("unexpected " + path);
      })
      .setRasterWriter((raster, path) -> {
        Files.writeString(path, "tif");
        written.put(path, raster);
      })
      .setRasterWarper(new InMemoryRasterWarper())
      .setTranslator((in, out) -> fail("buildings should be repaired in-process"))
      .setFetchers(grid -> (tile, destination) -> {
        if ("lod2".equals(grid.id()) && !lod2Available) {
          throw new AcquisitionFailure(tile.name(), "HTTP 404");
        }
        try {
          Files.writeString(destination, grid.id());
        } catch (IOException e) {
          throw new AcquisitionFailure(tile.name(), "write failed", e);
        }
        fetched.add(tile.name());
      });
  }

  @Test
  void testPreparesEveryOutput() throws Exception {
    var palmPrep = palmPrep(arguments(), true);
    var result = palmPrep.run();

    assertEquals(UTM32, result.aoi().crs());
    assertEquals(Set.of("690_5334.gml", "WSFevolution_v1_10_48.tif"), fetched);

    var buildings = result.buildings();
    assertEquals(List.of(1L, 2L), buildings.buildings().stream().map(BuildingFeature::id).toList());
    assertEquals(List.of(2, 5), buildings.buildings().stream().map(BuildingFeature::palmType).toList());
    assertEquals(List.of(1990, 1990), buildings.buildings().stream().map(BuildingFeature::yearMax).toList());
    assertEquals(1, buildings.bridges().size());
    assertEquals(3L, buildings.bridges().get(0).id());
    assertEquals(7, buildings.bridges().get(0).palmType());

    var rasters = result.rasters();
    assertEquals(grid(690_100, 5_334_300, 10, 20, 20), rasters.grid());
    assertEquals(List.of("zt", "WSF", "building_type", "building_id", "building_height", "bridges_id",
      "bridges_height"), List.copyOf(rasters.layers().keySet()));
    assertEquals(520, rasters.get("zt").get(10, 10), 1e-9);
    assertEquals(1990, rasters.get("WSF").get(10, 10));
    assertEquals(1, rasters.get("building_id").get(6, 13));
    assertEquals(2, rasters.get("building_type").get(6, 13));
    assertEquals(12, rasters.get("building_height").get(6, 13));
    assertEquals(3, rasters.get("bridges_id").get(17, 9));

    Path out = tmpDir.resolve("out");
    assertEquals(out.resolve("test_building_id_10.tif"), result.exported().get("building_id"));
    assertEquals(7, written.size());
    assertSame(rasters.get("zt"), written.get(out.resolve("test_zt_10.tif")));

    assertEquals(out.resolve("test_csd_configuration.yml"), result.csdConfig());
    String csd = Files.readString(result.csdConfig());
    assertTrue(csd.contains("  file_zt: test_zt_10.tif\n"), csd);
    assertTrue(csd.contains("  file_buildings_2d: test_building_height_10.tif\n"), csd);
    assertTrue(csd.contains("  file_bridges_id: test_bridges_id_10.tif\n"), csd);
    assertTrue(csd.contains("  # file_vegetation_type: not found\n"), csd);
    assertTrue(csd.contains("  origin_x: 690100.0\n"), csd);
    assertTrue(csd.contains("  nx: 20\n"), csd);
    assertTrue(csd.contains("  acronym: TST\n"), csd);

    assertEquals(List.of("aoi", "wsf", "buildings", "normalize", "enrich", "classify", "align", "rasterize",
      "export", "csd"), List.copyOf(palmPrep.stats().timers().all().keySet()));
    assertEquals(1L, palmPrep.stats().dataErrors().get("normalize_surface"));
    assertTrue(Files.exists(tmpDir.resolve("tmp").resolve("tiles").resolve("lod2").resolve("690_5334.gml.csv")));
  }

  @Test
  void testLandCoverAddsSurfaceLayers() throws Exception {
    var result = palmPrep(arguments("rasters", "zt=" + ztPath + ",LC=" + lcPath), true).run();

    var layers = result.rasters().layers();
    assertEquals(List.of("zt", "LC", "WSF", "vegetation_type", "water_type", "pavement_type"),
      List.copyOf(layers.keySet()).subList(0, 6));
    assertEquals(3, layers.get("vegetation_type").get(10, 10));
    assertFalse(layers.get("water_type").isValid(10, 10));
    assertTrue(result.exported().containsKey("vegetation_type"));
    String csd = Files.readString(result.csdConfig());
    assertTrue(csd.contains("  file_vegetation_type: test_vegetation_type_10.tif\n"), csd);
  }

  @Test
  void testNoLod2TilesFailsRunWithoutOutput() throws IOException {
    assertThrows(EmptyResultException.class, () -> palmPrep(arguments(), false).run());

    assertEquals(Map.of(), written);
    Path out = tmpDir.resolve("out");
    if (Files.exists(out)) {
      try (var files = Files.list(out)) {
        assertEquals(List.of(), files
          .map(file -> file.getFileName().toString())
          .filter(name -> name.endsWith(".tif") || name.endsWith(".yml"))
          .toList());
      }
    }
  }

  @Test
  void testMissingAoi() {
    var palmPrep = PalmPrep.create(Arguments.of("output", tmpDir.resolve("out").toString()));
    assertThrows(ValidationException.class, palmPrep::run);
    assertThrows(IllegalStateException.class, palmPrep::run);
  }
}
