package com.onthegomap.palmprep.csd;

import com.onthegomap.palmprep.config.Arguments;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values for a create_static_driver configuration file.
 *
 * @param prefix        file name prefix, the file is written to {@code {prefix}_csd_configuration.yml}
 * @param outputDir     directory the configuration file is written to
 * @param attributes    global attributes in {@link #ATTRIBUTE_KEYS} order, blank when not set
 * @param epsg          EPSG code of every input file
 * @param season        season used for vegetation parameters
 * @param outputPath    directory create_static_driver writes the static driver to
 * @param fileOut       static driver file name without extension
 * @param version       static driver version number
 * @param inputRoot     directory holding the input rasters
 * @param fileOverrides input file names to use instead of the discovered ones
 * @param domain        root domain definition
 */
public record CsdConfiguration(
  String prefix,
  Path outputDir,
  Map<String, String> attributes,
  int epsg,
  String season,
  String outputPath,
  String fileOut,
  int version,
  Path inputRoot,
  Map<InputFile, String> fileOverrides,
  Domain domain
) {

  public static final List<String> ATTRIBUTE_KEYS = List.of(
    "author", "contact_person", "acronym", "comment", "data_content", "location", "site", "institution",
    "palm_version", "references", "source", "origin_time"
  );

  public CsdConfiguration {
    Map<String, String> ordered = new LinkedHashMap<>();
    for (String key : ATTRIBUTE_KEYS) {
      String value = attributes.get(key);
      ordered.put(key, value == null ? "" : value);
    }
    attributes = Collections.unmodifiableMap(ordered);
    fileOverrides = fileOverrides.isEmpty() ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(fileOverrides));
  }

  /**
   * Reads attributes, settings, file overrides and domain values from {@code arguments}, falling back to
   * {@code domain} for anything not set.
   */
  public static CsdConfiguration from(Arguments arguments, String prefix, Path outputDir, Path inputRoot, int epsg,
    Domain domain) {
    Map<String, String> attributes = new LinkedHashMap<>();
    for (String key : ATTRIBUTE_KEYS) {
      attributes.put(key, arguments.getString("csd_" + key, "global attribute " + key, ""));
    }
    Map<InputFile, String> overrides = new EnumMap<>(InputFile.class);
    for (InputFile file : InputFile.values()) {
      String value = arguments.getString("csd_" + file.key(), "explicit name for " + file.key(), "");
      if (!value.isBlank()) {
        overrides.put(file, value);
      }
    }
    return new CsdConfiguration(
      prefix,
      outputDir,
      attributes,
      arguments.getInteger("csd_epsg", "EPSG code written to the settings section", epsg),
      arguments.getString("csd_season", "season for vegetation parameters", "summer"),
      arguments.getString("csd_output_path", "directory create_static_driver writes to", ""),
      arguments.getString("csd_file_out", "static driver file name", ""),
      arguments.getInteger("csd_version", "static driver version", 1),
      inputRoot,
      overrides,
      new Domain(
        arguments.getDouble("csd_pixel_size", "domain pixel size", domain.pixelSize()),
        domain.originX(),
        domain.originY(),
        domain.nx(),
        domain.ny(),
        arguments.getDouble("csd_dz", "vertical grid spacing", domain.dz()),
        arguments.getDouble("csd_bridge_depth", "bridge deck thickness", domain.bridgeDepth()),
        arguments.getBoolean("csd_buildings_3d", "use 3D buildings", domain.buildings3d()),
        arguments.getBoolean("csd_street_trees", "generate street trees", domain.streetTrees()),
        arguments.getBoolean("csd_overhanging_trees", "allow overhanging trees", domain.overhangingTrees()),
        arguments.getBoolean("csd_generate_vegetation_patches", "generate vegetation patches",
          domain.generateVegetationPatches())
      )
    );
  }
}
