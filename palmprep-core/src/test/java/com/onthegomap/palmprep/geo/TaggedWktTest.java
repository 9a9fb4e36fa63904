package com.onthegomap.palmprep.geo;

import static com.onthegomap.palmprep.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.MultiPolygon;

class TaggedWktTest {

  @ParameterizedTest
  @CsvSource(delimiter = ';', value = {
    "POINT (1 2); POINT",
    "LINESTRING (0 0, 1 1); LINESTRING",
    "POLYGON ((0 0, 1 0, 1 1, 0 0)); POLYGON",
    "MULTIPOLYGON (((0 0, 1 0, 1 1, 0 0))); MULTIPOLYGON",
    "GEOMETRYCOLLECTION (POINT (1 2)); GEOMETRYCOLLECTION",
    "TRIANGLE ((0 0, 1 0, 1 1, 0 0)); POLYGON",
  })
  void testParseKind(String wkt, GeometryKind kind) {
    var parsed = TaggedWkt.parse(wkt);
    assertEquals(kind, parsed.kind());
    assertTrue(parsed.hasGeometry());
  }

  @Test
  void testPolyhedralSurfaceKeepsFaces() {
    var parsed = TaggedWkt.parse(
      "POLYHEDRALSURFACE Z (((0 0 0, 1 0 0, 1 1 0, 0 0 0)), ((0 0 0, 1 1 0, 0 1 5, 0 0 0)))");
    assertEquals(GeometryKind.POLYHEDRALSURFACE, parsed.kind());
    assertInstanceOf(GeometryCollection.class, parsed.geometry());
    assertFalse(parsed.geometry() instanceof MultiPolygon);
    assertEquals(2, parsed.geometry().getNumGeometries());
  }

  @Test
  void testTin() {
    var parsed = TaggedWkt.parse("TIN (((0 0, 1 0, 1 1, 0 0)))");
    assertEquals(GeometryKind.TIN, parsed.kind());
    assertEquals(1, parsed.geometry().getNumGeometries());
  }

  @Test
  void testMultiSurfaceParsedAsMultiPolygon() {
    var parsed = TaggedWkt.parse("MULTISURFACE (((0 0, 1 0, 1 1, 0 0)))");
    assertEquals(GeometryKind.MULTISURFACE, parsed.kind());
    assertInstanceOf(MultiPolygon.class, parsed.geometry());
  }

  @Test
  void testUnparsableKeepsRawText() {
    String wkt = "CURVEPOLYGON (CIRCULARSTRING (0 0, 1 1, 2 0, 1 -1, 0 0))";
    var parsed = TaggedWkt.parse(wkt);
    assertFalse(parsed.hasGeometry());
    assertEquals(GeometryKind.UNKNOWN, parsed.kind());
    assertEquals(wkt, parsed.rawWkt());
    assertEquals(wkt, TaggedWkt.write(parsed));
  }

  @Test
  void testEmptyInput() {
    assertEquals(GeometryKind.UNKNOWN, TaggedWkt.parse("").kind());
    assertEquals(GeometryKind.UNKNOWN, TaggedWkt.parse(null).kind());
  }

  @Test
  void testWriteRestoresSurfaceKeyword() {
    String wkt = "POLYHEDRALSURFACE (((0 0, 1 0, 1 1, 0 0)), ((0 0, 1 1, 0 1, 0 0)))";
    String written = TaggedWkt.write(TaggedWkt.parse(wkt));
    assertTrue(written.startsWith("POLYHEDRALSURFACE"), written);
    var reparsed = TaggedWkt.parse(written);
    assertEquals(GeometryKind.POLYHEDRALSURFACE, reparsed.kind());
    assertEquals(2, reparsed.geometry().getNumGeometries());
  }

  @Test
  void testWritePlainGeometry() {
    var source = SourceGeometry.of(rectangle(0, 1));
    assertSameShape(rectangle(0, 1), TaggedWkt.parse(TaggedWkt.write(source)).geometry());
  }
}
