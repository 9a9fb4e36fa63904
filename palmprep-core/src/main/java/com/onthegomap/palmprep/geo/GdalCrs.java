package com.onthegomap.palmprep.geo;

import com.onthegomap.palmprep.ValidationException;
import org.gdal.osr.SpatialReference;

/**
 * Converts between GDAL/OGR spatial reference WKT and {@link Crs}.
 * <p>
 * Touching this class loads the native GDAL library.
 */
public class GdalCrs {

  private static final int OGRERR_NONE = 0;

  private GdalCrs() {}

  /**
   * Returns the {@link Crs} described by {@code wkt}, or {@code fallback} when {@code wkt} is empty.
   *
   * @throws ValidationException if there is no CRS and no fallback
   */
  public static Crs fromWkt(String wkt, Crs fallback, String source) {
    if (wkt == null || wkt.isBlank()) {
      if (fallback == null) {
        throw new ValidationException(source + " has no coordinate reference system");
      }
      return fallback;
    }
    SpatialReference srs = new SpatialReference(wkt);
    try {
      String code = epsgCode(srs);
      if (code != null) {
        return Crs.fromCode("EPSG:" + code);
      }
      String proj4 = srs.ExportToProj4();
      if (proj4 == null || proj4.isBlank()) {
        throw new ValidationException("Unable to identify the coordinate reference system of " + source);
      }
      return Crs.fromProj4(source, proj4);
    } finally {
      srs.delete();
    }
  }

  private static String epsgCode(SpatialReference srs) {
    for (String target : new String[]{null, "PROJCS", "GEOGCS"}) {
      if ("EPSG".equalsIgnoreCase(srs.GetAuthorityName(target)) && srs.GetAuthorityCode(target) != null) {
        return srs.GetAuthorityCode(target);
      }
    }
    if (srs.AutoIdentifyEPSG() == OGRERR_NONE && srs.GetAuthorityCode(null) != null) {
      return srs.GetAuthorityCode(null);
    }
    return null;
  }

  /** Returns the OGC WKT for {@code crs}. */
  public static String toWkt(Crs crs) {
    SpatialReference srs = new SpatialReference();
    try {
      Integer epsg = crs.epsg();
      int result = epsg != null ? srs.ImportFromEPSG(epsg) : srs.ImportFromProj4(crs.proj4());
      if (result != OGRERR_NONE) {
        throw new ValidationException("GDAL cannot describe coordinate reference system " + crs);
      }
      return srs.ExportToWkt();
    } finally {
      srs.delete();
    }
  }
}
