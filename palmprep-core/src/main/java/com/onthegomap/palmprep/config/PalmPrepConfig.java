package com.onthegomap.palmprep.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Holder for common parameters used by many components in the preparation pipeline.
 */
public record PalmPrepConfig(
  Arguments arguments,
  Path aoi,
  Path output,
  Path tmpDir,
  Path cacheDir,
  String prefix,
  int targetEpsg,
  double resolution,
  String wsfBaseUrl,
  String lod2BaseUrl,
  Duration httpTimeout,
  int httpRetries,
  Duration httpRetryWait,
  String httpUserAgent,
  String bridgeCode,
  String residentialCode,
  String functionAttribute,
  String heightAttribute,
  String categoricalPattern,
  String ogr2ogr,
  Map<String, Path> rasters
) {

  public static final String DEFAULT_WSF_BASE_URL = "https://download.geoservice.dlr.de/WSF_EVO/files/";
  public static final String DEFAULT_LOD2_BASE_URL = "https://download1.bayernwolke.de/a/lod2/citygml/";
  public static final String DEFAULT_BRIDGE_CODE = "53001_1800";
  public static final String DEFAULT_RESIDENTIAL_CODE = "31001_1000";

  public PalmPrepConfig {
    if (resolution <= 0) {
      throw new IllegalArgumentException("Resolution must be > 0, was " + resolution);
    }
    if (httpRetries < 0) {
      throw new IllegalArgumentException("HTTP Retries must be >= 0, was " + httpRetries);
    }
    if (httpTimeout.isNegative() || httpTimeout.isZero()) {
      throw new IllegalArgumentException("HTTP timeout must be positive, was " + httpTimeout);
    }
    if (prefix == null || prefix.isBlank()) {
      throw new IllegalArgumentException("Output prefix must not be blank");
    }
    try {
      Pattern.compile(categoricalPattern);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException("Invalid categorical layer pattern: " + categoricalPattern, e);
    }
    rasters = Collections.unmodifiableMap(new LinkedHashMap<>(rasters));
  }

  public static PalmPrepConfig defaults() {
    return from(Arguments.of());
  }

  public static PalmPrepConfig from(Arguments arguments) {
    Path tmpDir = arguments.file("tmp_dir", "temp directory for intermediate files", Path.of("data", "tmp"));
    return new PalmPrepConfig(
      arguments,
      arguments.file("aoi", "vector file holding the area of interest polygon", null),
      arguments.file("output", "output directory for rasters and the CSD configuration", Path.of("data", "output")),
      tmpDir,
      arguments.file("cache_dir", "directory for downloaded and converted tiles", tmpDir.resolve("tiles")),
      arguments.getString("prefix", "prefix for output file names", "palm"),
      arguments.getInteger("target_epsg", "EPSG code of the working and output coordinate system", 25832),
      arguments.getDouble("resolution", "output pixel size in units of the target CRS", 10),
      arguments.getString("wsf_base_url", "base URL for WSF Evolution tiles", DEFAULT_WSF_BASE_URL),
      arguments.getString("lod2_base_url", "base URL for LOD2 CityGML tiles", DEFAULT_LOD2_BASE_URL),
      arguments.getDuration("http_timeout", "Timeout to use when downloading tiles", "30s"),
      arguments.getInteger("http_retries", "Retries to use when downloading tiles", 2),
      arguments.getDuration("http_retry_wait", "How long to wait before retrying a tile download", "2s"),
      arguments.getString("http_user_agent", "User-Agent header to set when downloading tiles",
        "PalmPrep downloader"),
      arguments.getString("bridge_code", "building function code that marks bridges", DEFAULT_BRIDGE_CODE),
      arguments.getString("residential_code", "building function code that marks residential buildings",
        DEFAULT_RESIDENTIAL_CODE),
      arguments.getString("function_attribute", "attribute holding the building function code", "function"),
      arguments.getString("height_attribute", "attribute holding the measured building height", "measuredHeight"),
      arguments.getString("categorical_pattern",
        "case-insensitive regex for raster names to resample with nearest neighbour", "LC|WSF"),
      arguments.getString("ogr2ogr", "ogr2ogr executable used as a last-resort geometry repair", "ogr2ogr"),
      arguments.getNamedPaths("rasters", "additional rasters to align, as name=path pairs")
    );
  }
}
