package com.onthegomap.palmprep.geo;

import java.util.Objects;
import org.locationtech.jts.geom.Geometry;

/**
 * A feature geometry as the source reported it.
 * <p>
 * {@code geometry} is null when JTS cannot represent the input, in which case {@code rawWkt} holds the original text so
 * it can still be handed to an external converter. Polyhedral and triangulated surfaces are held as a
 * {@link org.locationtech.jts.geom.GeometryCollection} of their polygon faces.
 *
 * @param kind     type tag reported by the source
 * @param geometry parsed geometry or null
 * @param rawWkt   original WKT text or null
 */
public record SourceGeometry(GeometryKind kind, Geometry geometry, String rawWkt) {

  public SourceGeometry {
    Objects.requireNonNull(kind, "kind");
  }

  /** Returns a source geometry tagged with the JTS type of {@code geometry}. */
  public static SourceGeometry of(Geometry geometry) {
    return new SourceGeometry(GeometryKind.of(geometry), geometry, null);
  }

  /** Returns a placeholder for input that could not be parsed. */
  public static SourceGeometry unparsed(GeometryKind kind, String rawWkt) {
    return new SourceGeometry(kind, null, rawWkt);
  }

  public boolean hasGeometry() {
    return geometry != null;
  }

  /** Returns a copy with the same tag and {@code newGeometry}. */
  public SourceGeometry withGeometry(Geometry newGeometry) {
    return new SourceGeometry(kind, newGeometry, rawWkt);
  }
}
