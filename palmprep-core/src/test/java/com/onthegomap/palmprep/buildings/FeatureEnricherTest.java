package com.onthegomap.palmprep.buildings;

import static com.onthegomap.palmprep.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.palmprep.EmptyResultException;
import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.aoi.AreaOfInterest;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.vector.VectorFeature;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FeatureEnricherTest {

  private static final String BRIDGE = "53001_1800";
  private static final String HOUSE = "31001_1000";
  private final FeatureEnricher enricher = new FeatureEnricher(UTM32, "function", "measuredHeight", BRIDGE);
  private final AreaOfInterest aoi = aoi(rectangle(0, 0, 100, 100));

  @Test
  void testAssignsSequentialIdsAndSplitsBridges() {
    var input = featureSet(UTM32,
      VectorFeature.of(rectangle(10, 10, 20, 20), attrs("function", HOUSE, "measuredHeight", "12.5", "gml_id", "a")),
      VectorFeature.of(rectangle(500, 500, 510, 510), attrs("function", HOUSE, "measuredHeight", 3.0)),
      VectorFeature.of(rectangle(30, 30, 60, 40), attrs("function", BRIDGE, "measuredHeight", 6)),
      VectorFeature.of(rectangle(70, 70, 80, 80), attrs("function", "32001_1000", "measuredHeight", null))
    );

    var result = enricher.enrich(input, aoi);

    assertEquals(UTM32, result.crs());
    assertEquals(List.of(1L, 3L), result.buildings().stream().map(BuildingFeature::id).toList());
    assertEquals(List.of(2L), result.bridges().stream().map(BuildingFeature::id).toList());
    assertEquals(List.of(1L, 2L, 3L), result.all().stream().map(BuildingFeature::id).toList());

    BuildingFeature house = result.buildings().get(0);
    assertEquals(HOUSE, house.functionCode());
    assertEquals(12.5, house.measuredHeight());
    assertEquals(Map.of("gml_id", "a"), house.attributes());
    assertEquals(BuildingFeature.UNCLASSIFIED, house.palmType());
    assertEquals(0, house.yearMax());
    assertNull(result.buildings().get(1).measuredHeight());
    assertEquals(6.0, result.bridges().get(0).measuredHeight());
  }

  @Test
  void testClipsToAoi() {
    var input = featureSet(UTM32,
      VectorFeature.of(newMultiPolygon(rectangle(90, 90, 110, 110)), attrs("function", HOUSE))
    );
    var house = enricher.enrich(input, aoi).buildings().get(0);
    assertSameShape(rectangle(90, 90, 100, 100), house.footprint());
    assertEquals(100, house.footprint().getArea(), 1e-9);
  }

  @Test
  void testBoundaryContactOnlyIsDropped() {
    var input = featureSet(UTM32,
      VectorFeature.of(rectangle(100, 0, 110, 10), attrs("function", HOUSE)),
      VectorFeature.of(rectangle(10, 10, 20, 20), attrs("function", HOUSE))
    );
    var result = enricher.enrich(input, aoi);
    assertEquals(1, result.buildings().size());
    assertEquals(1L, result.buildings().get(0).id());
  }

  @Test
  void testReprojectsToWorkingCrs() {
    var lonLat = new AreaOfInterest(rectangle(11.5, 48.1, 11.6, 48.2), Crs.WGS84);
    var input = featureSet(UTM32, VectorFeature.of(rectangle(690_000, 5_335_000, 690_020, 5_335_020),
      attrs("function", HOUSE)));
    var result = enricher.enrich(input, lonLat);
    assertEquals(400, result.buildings().get(0).footprint().getArea(), 1e-6);
  }

  @Test
  void testMissingFunctionColumn() {
    var input = featureSet(UTM32, VectorFeature.of(rectangle(10, 20), attrs("usage", HOUSE)));
    assertThrows(ValidationException.class, () -> enricher.enrich(input, aoi));
  }

  @Test
  void testNothingInsideAoi() {
    var input = featureSet(UTM32, VectorFeature.of(rectangle(500, 600), attrs("function", HOUSE)));
    assertThrows(EmptyResultException.class, () -> enricher.enrich(input, aoi));
  }
}
