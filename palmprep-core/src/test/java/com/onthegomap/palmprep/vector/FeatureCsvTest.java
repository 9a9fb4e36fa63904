package com.onthegomap.palmprep.vector;

import static com.onthegomap.palmprep.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.palmprep.geo.GeometryKind;
import com.onthegomap.palmprep.geo.SourceGeometry;
import com.onthegomap.palmprep.geo.TaggedWkt;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FeatureCsvTest {

  @TempDir
  Path tmpDir;

  @Test
  void testWritesGeometryColumnFirst() throws Exception {
    Path path = tmpDir.resolve("nested").resolve("features.csv");
    FeatureCsv.write(featureSet(UTM32,
      VectorFeature.of(rectangle(0, 1), attrs("function", "31001_1000", "height", 4.5))
    ), path);
    List<String> lines = Files.readAllLines(path);
    assertEquals(2, lines.size());
    assertEquals("WKT,function,height", lines.get(0));
  }

  @Test
  void testReadBackAttributesAsStrings() throws Exception {
    Path path = tmpDir.resolve("features.csv");
    FeatureCsv.write(featureSet(UTM32,
      VectorFeature.of(rectangle(0, 1), attrs("function", "31001_1000", "height", 4.5)),
      VectorFeature.of(rectangle(2, 3), attrs("function", null, "roof", "flat"))
    ), path);

    FeatureSet read = FeatureCsv.read(path, UTM32);

    assertEquals(UTM32, read.crs());
    assertEquals(2, read.size());
    assertEquals("4.5", read.get(0).getTag("height"));
    assertNull(read.get(0).getTag("roof"));
    assertNull(read.get(1).getTag("function"));
    assertEquals("flat", read.get(1).getTag("roof"));
    assertSameShape(rectangle(2, 3), read.get(1).geometry().geometry());
  }

  @Test
  void testKeepsSurfaceTag() throws Exception {
    Path path = tmpDir.resolve("surface.csv");
    SourceGeometry surface = TaggedWkt.parse("TIN Z (((0 0 1, 1 0 1, 1 1 1, 0 0 1)), ((0 0 1, 1 1 1, 0 1 1, 0 0 1)))");
    FeatureCsv.write(featureSet(UTM32, new VectorFeature(surface, attrs("id", 1))), path);

    VectorFeature read = FeatureCsv.read(path, UTM32).get(0);

    assertEquals(GeometryKind.TIN, read.geometry().kind());
    assertEquals(2, read.geometry().geometry().getNumGeometries());
  }

  @Test
  void testUnparsedGeometryKeepsRawText() throws Exception {
    Path path = tmpDir.resolve("raw.csv");
    String raw = "CURVEPOLYGON (CIRCULARSTRING (0 0, 1 1, 2 0, 1 -1, 0 0))";
    FeatureCsv.write(featureSet(UTM32, new VectorFeature(TaggedWkt.parse(raw), attrs("id", 7))), path);

    VectorFeature read = FeatureCsv.read(path, UTM32).get(0);

    assertFalse(read.geometry().hasGeometry());
    assertEquals(raw, read.geometry().rawWkt());
    assertEquals("7", read.getTag("id"));
  }
}
