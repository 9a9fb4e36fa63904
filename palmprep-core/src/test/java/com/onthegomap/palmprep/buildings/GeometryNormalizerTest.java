package com.onthegomap.palmprep.buildings;

import static com.onthegomap.palmprep.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.palmprep.buildings.GeometryNormalizer.Repaired;
import com.onthegomap.palmprep.buildings.GeometryNormalizer.State;
import com.onthegomap.palmprep.buildings.GeometryNormalizer.Unrepaired;
import com.onthegomap.palmprep.geo.GeometryException;
import com.onthegomap.palmprep.geo.TaggedWkt;
import com.onthegomap.palmprep.stats.Stats;
import com.onthegomap.palmprep.vector.FeatureCsv;
import com.onthegomap.palmprep.vector.FeatureSet;
import com.onthegomap.palmprep.vector.VectorFeature;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.MultiPolygon;

class GeometryNormalizerTest {

  @TempDir
  Path tmpDir;
  private final Stats stats = Stats.inMemory();

  private static VectorFeature surface(String wkt, int id) {
    return new VectorFeature(TaggedWkt.parse(wkt), attrs("id", id));
  }

  private static final String SINGLE_FACE =
    "POLYHEDRALSURFACE Z (((0 0 5, 10 0 5, 10 10 5, 0 10 5, 0 0 5)))";
  private static final String TWO_ROOF_HALVES =
    "POLYHEDRALSURFACE Z (((0 0 5, 10 0 5, 10 10 8, 0 10 8, 0 0 5)), ((0 10 8, 10 10 8, 10 20 5, 0 20 5, 0 10 8)))";

  private static final String CLOSED_SOLID = "POLYHEDRALSURFACE Z ("
    + "((0 0 0, 0 10 0, 10 10 0, 10 0 0, 0 0 0)), "
    + "((0 0 5, 10 0 5, 10 10 5, 0 10 5, 0 0 5)), "
    + "((0 0 0, 10 0 0, 10 0 5, 0 0 5, 0 0 0)), "
    + "((10 0 0, 10 10 0, 10 10 5, 10 0 5, 10 0 0)), "
    + "((10 10 0, 0 10 0, 0 10 5, 10 10 5, 10 10 0)), "
    + "((0 10 0, 0 0 0, 0 0 5, 0 10 5, 0 10 0)))";

  private GeometryNormalizer normalizer(VectorTranslator translator) {
    return new GeometryNormalizer(translator, tmpDir, stats);
  }

  /** Replaces every geometry with a unit square so the output passes the type check. */
  private static final VectorTranslator SQUARES = (input, output) -> {
    FeatureSet read = FeatureCsv.read(input, UTM32);
    List<VectorFeature> squares = new ArrayList<>();
    for (VectorFeature feature : read.features()) {
      squares.add(feature.withGeometry(newMultiPolygon(rectangle(0, 1))));
    }
    FeatureCsv.write(new FeatureSet(UTM32, squares), output);
  };

  @Test
  void testPolygonalSetIsCastDirectly() {
    var input = featureSet(UTM32,
      VectorFeature.of(rectangle(0, 10), attrs("id", 1)),
      VectorFeature.of(newMultiPolygon(rectangle(20, 30), rectangle(40, 50)), attrs("id", 2))
    );

    var result = normalizer(null).normalize(input);

    assertEquals(List.of(State.RAW, State.DIM_REDUCED, State.TYPE_CHECK, State.DIRECT_CAST, State.NORMALIZED),
      result.states());
    assertEquals(2, result.features().size());
    for (VectorFeature feature : result.features().features()) {
      assertInstanceOf(MultiPolygon.class, feature.geometry().geometry());
    }
    assertEquals(1, result.features().get(0).getTag("id"));
    assertEquals(2, result.features().get(1).geometry().geometry().getNumGeometries());
    assertEquals(Map.of(), stats.dataErrors());
  }

  @Test
  void testDropsZ() {
    var polygon = newPolygon(0, 0, 1, 0, 1, 1, 0, 0);
    var withZ = polygon.getFactory().createPolygon(new Coordinate[]{
      new Coordinate(0, 0, 3), new Coordinate(1, 0, 3), new Coordinate(1, 1, 3), new Coordinate(0, 0, 3)
    });
    var result = normalizer(null).normalize(featureSet(UTM32, VectorFeature.of(withZ, attrs())));
    for (Coordinate coordinate : result.features().get(0).geometry().geometry().getCoordinates()) {
      assertTrue(Double.isNaN(coordinate.getZ()));
    }
    assertSameShape(polygon, result.features().get(0).geometry().geometry());
  }

  @Test
  void testSingleFaceSurfaceBecomesThatFace() {
    var result = normalizer(null).normalize(featureSet(UTM32,
      VectorFeature.of(rectangle(50, 60), attrs("id", 1)),
      surface(SINGLE_FACE, 2)
    ));

    assertEquals(List.of(State.RAW, State.DIM_REDUCED, State.TYPE_CHECK, State.PER_FEATURE_REPAIR, State.NORMALIZED),
      result.states());
    assertSameShape(rectangle(0, 10), result.features().get(1).geometry().geometry());
    assertEquals(2, result.features().get(1).getTag("id"));
    assertEquals(1L, stats.dataErrors().get("normalize_surface"));
  }

  @Test
  void testMultiFaceSurfaceIsDissolved() {
    var outcome = GeometryNormalizer.repairSurface(TaggedWkt.parse(TWO_ROOF_HALVES).geometry());
    var repaired = assertInstanceOf(Repaired.class, outcome);
    assertEquals(1, repaired.geometry().getNumGeometries());
    assertEquals(200, repaired.geometry().getArea(), 1e-6);
  }

  @Test
  void testClosedSolidWithWallsBecomesFootprint() {
    var outcome = GeometryNormalizer.repairSurface(TaggedWkt.parse(CLOSED_SOLID).geometry());
    var repaired = assertInstanceOf(Repaired.class, outcome);
    assertSameShape(rectangle(0, 10), repaired.geometry());
  }

  @Test
  void testClosedSolidRepairedWithoutTranslator() {
    var result = normalizer(null).normalize(featureSet(UTM32, surface(CLOSED_SOLID, 7)));

    assertEquals(List.of(State.RAW, State.DIM_REDUCED, State.TYPE_CHECK, State.PER_FEATURE_REPAIR, State.NORMALIZED),
      result.states());
    var geometry = result.features().get(0).geometry().geometry();
    assertInstanceOf(MultiPolygon.class, geometry);
    assertEquals(100, geometry.getArea(), 1e-6);
    assertEquals(7, result.features().get(0).getTag("id"));
  }

  @Test
  void testOnlyWallsIsUnrepaired() {
    var walls = "POLYHEDRALSURFACE Z (((0 0 0, 10 0 0, 10 0 5, 0 0 5, 0 0 0)), "
      + "((10 0 0, 10 10 0, 10 10 5, 10 0 5, 10 0 0)))";
    assertInstanceOf(Unrepaired.class, GeometryNormalizer.repairSurface(TaggedWkt.parse(walls).geometry()));
  }

  @Test
  void testSurfaceWithoutFacesIsUnrepaired() {
    var outcome = GeometryNormalizer.repairSurface(newGeometryCollection(newLineString(0, 0, 1, 1)));
    assertInstanceOf(Unrepaired.class, outcome);
  }

  @Test
  void testFailsWithoutTranslator() {
    var input = featureSet(UTM32,
      VectorFeature.of(rectangle(0, 10), attrs()),
      VectorFeature.of(newLineString(0, 0, 10, 10), attrs()),
      surface(SINGLE_FACE, 3)
    );

    var exception = assertThrows(GeometryRepairFailedException.class, () -> normalizer(null).normalize(input));

    assertEquals(List.of(1), exception.offendingIndices());
    assertTrue(exception.getMessage().contains("no external converter configured"), exception.getMessage());
    assertTrue(exception.getMessage().contains(GeometryRepairFailedException.REMEDIATION_COMMAND));
    assertEquals(1L, stats.dataErrors().get("normalize_unrepaired"));
  }

  @Test
  void testUnparsableGeometryIsUnrepaired() {
    var input = featureSet(UTM32, surface("CURVEPOLYGON (CIRCULARSTRING (0 0, 1 1, 2 0, 1 -1, 0 0))", 1));
    var exception = assertThrows(GeometryRepairFailedException.class, () -> normalizer(null).normalize(input));
    assertEquals(List.of(0), exception.offendingIndices());
  }

  @Test
  void testExternalConversionAsLastResort() {
    var input = featureSet(UTM32,
      VectorFeature.of(rectangle(0, 10), attrs("id", 1)),
      VectorFeature.of(newLineString(0, 0, 10, 10), attrs("id", 2))
    );

    var result = normalizer(SQUARES).normalize(input);

    assertEquals(List.of(State.RAW, State.DIM_REDUCED, State.TYPE_CHECK, State.PER_FEATURE_REPAIR,
      State.EXTERNAL_CONVERSION, State.NORMALIZED), result.states());
    assertSameShape(rectangle(0, 1), result.features().get(1).geometry().geometry());
    assertEquals(2, result.features().get(1).getTag("id"));
  }

  @Test
  void testExternalConversionLosingFeatures() {
    VectorTranslator dropsAll = (in, out) -> FeatureCsv.write(
      featureSet(UTM32, VectorFeature.of(rectangle(0, 1), attrs())), out);
    var input = featureSet(UTM32,
      VectorFeature.of(rectangle(0, 10), attrs()),
      VectorFeature.of(newPoint(1, 1), attrs())
    );

    var exception = assertThrows(GeometryRepairFailedException.class, () -> normalizer(dropsAll).normalize(input));

    var cause = assertInstanceOf(GeometryException.class, exception.getCause());
    assertEquals("external_count", cause.stat());
    assertEquals(List.of(1), exception.offendingIndices());
    assertEquals(1L, stats.dataErrors().get("normalize_external_count"));
  }

  @Test
  void testExternalConversionReturningLines() {
    VectorTranslator lines = (in, out) -> FeatureCsv.write(featureSet(UTM32,
      VectorFeature.of(rectangle(0, 1), attrs()),
      VectorFeature.of(newLineString(0, 0, 1, 1), attrs())
    ), out);
    var input = featureSet(UTM32,
      VectorFeature.of(rectangle(0, 10), attrs()),
      VectorFeature.of(newPoint(1, 1), attrs())
    );

    var exception = assertThrows(GeometryRepairFailedException.class, () -> normalizer(lines).normalize(input));

    assertEquals("external_type", assertInstanceOf(GeometryException.class, exception.getCause()).stat());
  }

  @Test
  void testExternalConversionCrashing() {
    VectorTranslator crashes = (in, out) -> {
      throw new IOException("ogr2ogr exited with code 1");
    };
    var input = featureSet(UTM32, VectorFeature.of(newPoint(1, 1), attrs()));

    var exception = assertThrows(GeometryRepairFailedException.class, () -> normalizer(crashes).normalize(input));

    assertTrue(exception.getMessage().contains("ogr2ogr exited with code 1"), exception.getMessage());
  }

  @Test
  void testMessageListsAtMostTenIndices() {
    var exception = new GeometryRepairFailedException(IntStream.range(0, 12).boxed().toList(), null, null);
    assertEquals(12, exception.offendingIndices().size());
    assertTrue(exception.getMessage().contains("(indices: 0, 1, 2, 3, 4, 5, 6, 7, 8, 9 ...)"),
      exception.getMessage());
    assertEquals(GeometryRepairFailedException.REMEDIATION_COMMAND, exception.remediationCommand());
  }
}
