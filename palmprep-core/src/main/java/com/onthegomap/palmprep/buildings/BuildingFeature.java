package com.onthegomap.palmprep.buildings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.locationtech.jts.geom.MultiPolygon;

/**
 * A clipped building or bridge footprint with the attributes the PALM rasters are built from.
 *
 * @param id             dense sequential ID starting at 1
 * @param functionCode   building function code, null when the source has none
 * @param measuredHeight building height in meters, null when unknown
 * @param yearMax        newest settlement year under the footprint, 0 when unknown and -1 for the pre-1986 marker
 * @param palmType       PALM building type code, 0 until classified
 * @param footprint      footprint in the working CRS
 * @param attributes     every other source attribute
 */
public record BuildingFeature(
  long id,
  String functionCode,
  Double measuredHeight,
  int yearMax,
  int palmType,
  MultiPolygon footprint,
  Map<String, Object> attributes
) {

  public static final int UNCLASSIFIED = 0;

  public BuildingFeature {
    Objects.requireNonNull(footprint, "footprint");
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }

  public BuildingFeature withYear(int newYearMax) {
    return new BuildingFeature(id, functionCode, measuredHeight, newYearMax, palmType, footprint, attributes);
  }

  public BuildingFeature withPalmType(int newPalmType) {
    return new BuildingFeature(id, functionCode, measuredHeight, yearMax, newPalmType, footprint, attributes);
  }
}
