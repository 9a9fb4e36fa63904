package com.onthegomap.palmprep.tasks;

import com.onthegomap.palmprep.config.Arguments;
import com.onthegomap.palmprep.config.PalmPrepConfig;
import com.onthegomap.palmprep.csd.CsdConfigWriter;
import com.onthegomap.palmprep.csd.CsdConfiguration;
import com.onthegomap.palmprep.csd.Domain;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a create_static_driver configuration for rasters that already exist in an input directory.
 * <p>
 * Domain values that are not passed as {@code csd_*} arguments are read from {@code origin_x}, {@code origin_y},
 * {@code nx} and {@code ny}.
 */
public class CsdConfig {

  private CsdConfig() {}

  public static void main(String... args) throws IOException {
    run(Arguments.fromArgsOrConfigFile(args));
  }

  /** Writes the configuration described by {@code arguments} and returns its path. */
  public static Path run(Arguments arguments) throws IOException {
    var config = PalmPrepConfig.from(arguments);
    Path input = arguments.file("input_dir", "directory holding the rasters to reference", config.output());
    Domain defaults = Domain.defaults();
    Domain domain = new Domain(
      arguments.getDouble("pixel_size", "domain pixel size", config.resolution()),
      nullableDouble(arguments, "origin_x", "x coordinate of the domain's lower-left corner"),
      nullableDouble(arguments, "origin_y", "y coordinate of the domain's lower-left corner"),
      nullableInteger(arguments, "nx", "number of cells along x"),
      nullableInteger(arguments, "ny", "number of cells along y"),
      defaults.dz(),
      defaults.bridgeDepth(),
      defaults.buildings3d(),
      defaults.streetTrees(),
      defaults.overhangingTrees(),
      defaults.generateVegetationPatches()
    );
    var csd = CsdConfiguration.from(arguments, config.prefix(), config.output(), input, config.targetEpsg(), domain);
    return new CsdConfigWriter().write(csd);
  }

  private static Double nullableDouble(Arguments arguments, String key, String description) {
    String value = arguments.getString(key, description, null);
    return value == null ? null : Double.valueOf(value);
  }

  private static Integer nullableInteger(Arguments arguments, String key, String description) {
    String value = arguments.getString(key, description, null);
    return value == null ? null : Integer.valueOf(value);
  }
}
