package com.onthegomap.palmprep.buildings;

import static com.onthegomap.palmprep.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.palmprep.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Polygon;

class BuildingRasterizerTest {

  private static final double N = BuildingRasterizer.NODATA;
  private final BuildingRasterizer rasterizer = new BuildingRasterizer(grid(0, 4, 1, 4, 4));

  private static BuildingFeature feature(long id, int type, Double height, Polygon footprint) {
    return new BuildingFeature(id, "31001_1000", height, 0, type, newMultiPolygon(footprint), attrs());
  }

  @Test
  void testBuildingAndBridgeLayers() {
    var buildings = new EnrichedBuildings(UTM32, List.of(
      feature(1, 1, 10.0, rectangle(0.2, 3.2, 0.8, 3.8)),
      feature(2, 4, null, rectangle(0.2, 2.2, 1.8, 2.8))
    ), List.of(
      feature(3, 7, 5.0, rectangle(2.2, 0.2, 3.8, 0.8))
    ));

    var layers = rasterizer.rasterize(buildings);

    assertEquals(List.of("building_type", "building_id", "building_height", "bridges_id", "bridges_height"),
      List.copyOf(layers.keySet()));
    assertArrayEquals(new double[]{
      1, N, N, N,
      4, 4, N, N,
      N, N, N, N,
      N, N, N, N
    }, layers.get(BuildingRasterizer.BUILDING_TYPE).values());
    assertArrayEquals(new double[]{
      1, N, N, N,
      2, 2, N, N,
      N, N, N, N,
      N, N, N, N
    }, layers.get(BuildingRasterizer.BUILDING_ID).values());
    assertArrayEquals(new double[]{
      10, N, N, N,
      N, N, N, N,
      N, N, N, N,
      N, N, N, N
    }, layers.get(BuildingRasterizer.BUILDING_HEIGHT).values());
    assertArrayEquals(new double[]{
      N, N, N, N,
      N, N, N, N,
      N, N, N, N,
      N, N, 3, 3
    }, layers.get(BuildingRasterizer.BRIDGES_ID).values());
    assertEquals(5, layers.get(BuildingRasterizer.BRIDGES_HEIGHT).get(3, 3));
    assertEquals(N, layers.get(BuildingRasterizer.BUILDING_ID).nodata());
  }

  @Test
  void testNoBridgeLayersWithoutBridges() {
    var buildings = new EnrichedBuildings(UTM32, List.of(feature(1, 1, 10.0, rectangle(0.2, 0.8))), List.of());
    assertEquals(List.of("building_type", "building_id", "building_height"),
      List.copyOf(rasterizer.rasterize(buildings).keySet()));
  }

  @Test
  void testLargestValueWinsWhereFootprintsShareACell() {
    var layer = rasterizer.rasterize(List.of(
      feature(1, 1, 10.0, rectangle(0.2, 3.2, 0.6, 3.8)),
      feature(2, 1, 25.0, rectangle(0.6, 3.2, 0.9, 3.8)),
      feature(3, 1, 5.0, rectangle(0.1, 3.1, 0.2, 3.2))
    ), UTM32, BuildingFeature::measuredHeight);
    assertEquals(25, layer.get(0, 0));
  }

  @Test
  void testUnclassifiedBuilding() {
    var buildings = new EnrichedBuildings(UTM32, List.of(feature(1, 0, 10.0, rectangle(0.2, 0.8))), List.of());
    assertThrows(ValidationException.class, () -> rasterizer.rasterize(buildings));
  }
}
