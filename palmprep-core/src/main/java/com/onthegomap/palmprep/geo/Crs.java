package com.onthegomap.palmprep.geo;

import com.onthegomap.palmprep.ValidationException;
import java.util.Locale;
import java.util.Objects;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.proj.LongLatProjection;

/**
 * A coordinate reference system identified by an authority code like {@code EPSG:25832}.
 * <p>
 * Two instances are equal when their codes are equal, so rasters and feature sets can compare CRS cheaply.
 */
public final class Crs {

  private static final CRSFactory FACTORY = new CRSFactory();

  public static final Crs WGS84 = ofEpsg(4326);

  private final String code;
  private final CoordinateReferenceSystem definition;

  private Crs(String code, CoordinateReferenceSystem definition) {
    this.code = code;
    this.definition = definition;
  }

  /**
   * Returns the CRS for an EPSG code.
   *
   * @throws ValidationException if the code is unknown
   */
  public static Crs ofEpsg(int epsg) {
    return fromCode("EPSG:" + epsg);
  }

  /**
   * Returns the CRS for an authority code like {@code EPSG:25832} (case-insensitive).
   *
   * @throws ValidationException if the code is blank or unknown
   */
  public static Crs fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new ValidationException("Coordinate reference system is undefined");
    }
    String normalized = code.strip().toUpperCase(Locale.ROOT);
    try {
      return new Crs(normalized, FACTORY.createFromName(normalized));
    } catch (Proj4jException e) {
      throw new ValidationException("Unknown coordinate reference system: " + code, e);
    }
  }

  /**
   * Returns a CRS that has no authority code, built from a PROJ.4 parameter string.
   *
   * @throws ValidationException if the parameters cannot be parsed
   */
  public static Crs fromProj4(String name, String proj4) {
    try {
      return new Crs(name, FACTORY.createFromParameters(name, proj4));
    } catch (Proj4jException e) {
      throw new ValidationException("Unable to parse coordinate reference system " + name + ": " + proj4, e);
    }
  }

  public String code() {
    return code;
  }

  /** Returns the EPSG number, or null if this CRS is not identified by an EPSG code. */
  public Integer epsg() {
    if (code.startsWith("EPSG:")) {
      try {
        return Integer.parseInt(code.substring(5));
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  /** Returns true for longitude/latitude systems measured in degrees. */
  public boolean isGeographic() {
    return definition.getProjection() instanceof LongLatProjection;
  }

  public String proj4() {
    return definition.getParameterString();
  }

  CoordinateReferenceSystem definition() {
    return definition;
  }

  @Override
  public boolean equals(Object o) {
    return o == this || (o instanceof Crs other && code.equals(other.code));
  }

  @Override
  public int hashCode() {
    return Objects.hash(code);
  }

  @Override
  public String toString() {
    return code;
  }
}
