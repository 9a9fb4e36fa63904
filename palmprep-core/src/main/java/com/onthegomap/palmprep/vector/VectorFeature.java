package com.onthegomap.palmprep.vector;

import com.onthegomap.palmprep.geo.SourceGeometry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.locationtech.jts.geom.Geometry;

/**
 * One input feature: its geometry and an ordered attribute row where values may be null.
 *
 * @param geometry   geometry and type tag as reported by the source
 * @param attributes attribute values by column name
 */
public record VectorFeature(SourceGeometry geometry, Map<String, Object> attributes) {

  public VectorFeature {
    Objects.requireNonNull(geometry, "geometry");
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public static VectorFeature of(Geometry geometry, Map<String, Object> attributes) {
    return new VectorFeature(SourceGeometry.of(geometry), attributes);
  }

  /** Returns a copy with {@code newGeometry} tagged with its own JTS type. */
  public VectorFeature withGeometry(Geometry newGeometry) {
    return new VectorFeature(SourceGeometry.of(newGeometry), attributes);
  }

  /** Returns a copy that keeps the source tag but holds {@code newGeometry}. */
  public VectorFeature withSameKind(Geometry newGeometry) {
    return new VectorFeature(geometry.withGeometry(newGeometry), attributes);
  }

  public Object getTag(String key) {
    return attributes.get(key);
  }
}
