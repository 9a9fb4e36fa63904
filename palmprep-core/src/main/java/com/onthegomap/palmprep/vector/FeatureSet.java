package com.onthegomap.palmprep.vector;

import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.GeometryKind;
import com.onthegomap.palmprep.geo.Reprojection;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered collection of features that all share one coordinate reference system.
 *
 * @param crs      coordinate reference system of every feature
 * @param features features in source order
 */
public record FeatureSet(Crs crs, List<VectorFeature> features) {

  public FeatureSet {
    Objects.requireNonNull(crs, "crs");
    features = List.copyOf(features);
  }

  public int size() {
    return features.size();
  }

  public boolean isEmpty() {
    return features.isEmpty();
  }

  public VectorFeature get(int index) {
    return features.get(index);
  }

  /** Returns the distinct geometry type tags present in this set. */
  public Set<GeometryKind> kinds() {
    Set<GeometryKind> result = EnumSet.noneOf(GeometryKind.class);
    for (VectorFeature feature : features) {
      result.add(feature.geometry().kind());
    }
    return result;
  }

  /** Returns every attribute column name in order of first appearance. */
  public Set<String> columns() {
    Set<String> result = new LinkedHashSet<>();
    for (VectorFeature feature : features) {
      result.addAll(feature.attributes().keySet());
    }
    return Collections.unmodifiableSet(result);
  }

  /** Returns this set with every geometry transformed to {@code target}. */
  public FeatureSet reproject(Crs target) {
    if (crs.equals(target)) {
      return this;
    }
    Reprojection reprojection = Reprojection.between(crs, target);
    List<VectorFeature> result = new ArrayList<>(features.size());
    for (VectorFeature feature : features) {
      result.add(feature.geometry().hasGeometry() ?
        feature.withSameKind(reprojection.transform(feature.geometry().geometry())) : feature);
    }
    return new FeatureSet(target, result);
  }
}
