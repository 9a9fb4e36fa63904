package com.onthegomap.palmprep.geo;

import static com.onthegomap.palmprep.geo.GeoUtils.JTS_FACTORY;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

/**
 * Reads and writes WKT while keeping the type tag of surface geometries that JTS cannot model.
 * <p>
 * {@code POLYHEDRALSURFACE}, {@code TIN} and simple {@code MULTISURFACE} bodies share the {@code MULTIPOLYGON} syntax,
 * so they are parsed as multipolygons and written back under their original keyword.
 */
public class TaggedWkt {

  private static final Pattern HEADER = Pattern.compile("^\\s*([A-Za-z]+)\\s*(ZM|Z|M)?\\s*(.*)$", Pattern.DOTALL);
  private static final String MULTIPOLYGON = GeometryKind.MULTIPOLYGON.keyword();

  private TaggedWkt() {}

  /** Parses {@code wkt}, returning an unparsed placeholder instead of failing when JTS cannot read it. */
  public static SourceGeometry parse(String wkt) {
    if (wkt == null || wkt.isBlank()) {
      return SourceGeometry.unparsed(GeometryKind.UNKNOWN, wkt);
    }
    var matcher = HEADER.matcher(wkt);
    if (!matcher.matches()) {
      return SourceGeometry.unparsed(GeometryKind.UNKNOWN, wkt);
    }
    GeometryKind kind = GeometryKind.fromKeyword(matcher.group(1));
    String dimension = matcher.group(2) == null ? "" : " " + matcher.group(2);
    String body = matcher.group(3);
    boolean surface = kind.isUnsupportedSurface() || kind == GeometryKind.MULTISURFACE;
    String toParse;
    if (surface) {
      toParse = MULTIPOLYGON + dimension + " " + body;
    } else if (kind == GeometryKind.POLYGON && !kind.keyword().equalsIgnoreCase(matcher.group(1))) {
      // triangles share the polygon body syntax
      toParse = kind.keyword() + dimension + " " + body;
    } else {
      toParse = wkt;
    }
    try {
      Geometry geometry = new WKTReader(JTS_FACTORY).read(toParse);
      if (kind.isUnsupportedSurface()) {
        geometry = faces(geometry);
      }
      return new SourceGeometry(kind, geometry, wkt);
    } catch (ParseException | IllegalArgumentException e) {
      return SourceGeometry.unparsed(kind, wkt);
    }
  }

  private static GeometryCollection faces(Geometry multipolygon) {
    List<Geometry> faces = new ArrayList<>(multipolygon.getNumGeometries());
    for (int i = 0; i < multipolygon.getNumGeometries(); i++) {
      faces.add(multipolygon.getGeometryN(i));
    }
    return JTS_FACTORY.createGeometryCollection(faces.toArray(Geometry[]::new));
  }

  /** Returns the WKT for {@code source}, keeping its surface keyword and falling back to the raw text. */
  public static String write(SourceGeometry source) {
    if (!source.hasGeometry()) {
      return source.rawWkt() == null ? "" : source.rawWkt();
    }
    Geometry geometry = source.geometry();
    GeometryKind kind = source.kind();
    WKTWriter writer = new WKTWriter(3);
    if ((kind.isUnsupportedSurface() || kind == GeometryKind.MULTISURFACE) && onlyPolygons(geometry)) {
      List<Polygon> polygons = new ArrayList<>();
      for (int i = 0; i < geometry.getNumGeometries(); i++) {
        polygons.add((Polygon) geometry.getGeometryN(i));
      }
      String text = writer.write(GeoUtils.createMultiPolygon(polygons));
      return kind.keyword() + text.substring(MULTIPOLYGON.length());
    }
    return writer.write(geometry);
  }

  private static boolean onlyPolygons(Geometry geometry) {
    for (int i = 0; i < geometry.getNumGeometries(); i++) {
      if (!(geometry.getGeometryN(i) instanceof Polygon)) {
        return false;
      }
    }
    return true;
  }
}
