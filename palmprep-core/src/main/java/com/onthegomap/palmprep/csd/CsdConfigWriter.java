package com.onthegomap.palmprep.csd;

import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.util.FileUtils;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.common.ScalarStyle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the YAML configuration consumed by PALM's create_static_driver tool.
 * <p>
 * Input files that were neither given explicitly nor found in the input directory are written as commented-out
 * {@code # file_x: not found} lines so the tool falls back to its own defaults.
 */
public class CsdConfigWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsdConfigWriter.class);
  private static final String RULE = "#---------------------------------------------------------------------------#";

  private final Dump plain = new Dump(DumpSettings.builder().setSplitLines(false).build());
  private final Dump quoted = new Dump(DumpSettings.builder()
    .setSplitLines(false)
    .setDefaultScalarStyle(ScalarStyle.DOUBLE_QUOTED)
    .build());

  public static String fileName(String prefix) {
    return prefix + "_csd_configuration.yml";
  }

  /**
   * Returns the file name for every input, preferring explicit overrides, then the first matching name in sorted
   * order. Inputs with no file are left out.
   */
  public static Map<InputFile, String> discover(Path inputRoot, Map<InputFile, String> overrides) {
    List<String> names = FileUtils.listFilesSorted(inputRoot).stream()
      .map(path -> path.getFileName().toString())
      .toList();
    Map<InputFile, String> result = new EnumMap<>(InputFile.class);
    for (InputFile file : InputFile.values()) {
      String override = overrides.get(file);
      if (override != null && !override.isBlank()) {
        result.put(file, override);
      } else {
        names.stream().filter(file::matches).findFirst().ifPresent(name -> result.put(file, name));
      }
    }
    return result;
  }

  /**
   * Writes {@code config} to {@code {outputDir}/{prefix}_csd_configuration.yml} and returns its path.
   *
   * @throws ValidationException if the output or input directory does not exist
   * @throws IOException         if the file cannot be written
   */
  public Path write(CsdConfiguration config) throws IOException {
    if (config.outputDir() == null || !Files.isDirectory(config.outputDir())) {
      throw new ValidationException("Output directory does not exist: " + config.outputDir());
    }
    if (config.inputRoot() == null || !Files.isDirectory(config.inputRoot())) {
      throw new ValidationException("Input directory does not exist: " + config.inputRoot());
    }
    Map<InputFile, String> files = discover(config.inputRoot(), config.fileOverrides());
    Path path = config.outputDir().resolve(fileName(config.prefix()));
    Files.writeString(path, render(config, files));
    LOGGER.info("Wrote CSD configuration to {} with {} of {} input files", path, files.size(),
      InputFile.values().length);
    return path;
  }

  /** Returns the YAML text for {@code config} referencing {@code files}. */
  String render(CsdConfiguration config, Map<InputFile, String> files) {
    Domain domain = config.domain();
    StringBuilder out = new StringBuilder();
    out.append("# -*- coding: utf-8 -*-\n");
    out.append(RULE).append('\n');
    out.append("# PALM-4U static driver configuration for ").append(config.attributes().get("acronym"))
      .append(" (").append(number(domain.pixelSize())).append(" m resolution)\n");
    section(out, "Attributes section", "attributes");
    config.attributes().forEach((key, value) -> entry(out, key,
      "origin_time".equals(key) ? quoted(value) : string(value)));

    out.append('\n');
    section(out, "Settings section", "settings");
    entry(out, "epsg", Integer.toString(config.epsg()));
    entry(out, "season", string(config.season()));

    out.append('\n');
    section(out, "Output section", "output");
    entry(out, "path", string(config.outputPath()));
    entry(out, "file_out", string(config.fileOut()));
    entry(out, "version", Integer.toString(config.version()));

    out.append('\n');
    section(out, "Input section", "input_root");
    out.append("  # input directory\n");
    entry(out, "path", string(config.inputRoot().toString()));
    String group = null;
    for (InputFile file : InputFile.values()) {
      if (!file.group().equals(group)) {
        group = file.group();
        out.append("\n  # ").append(group).append('\n');
      }
      String name = files.get(file);
      if (name == null) {
        out.append("  # ").append(file.key()).append(": not found\n");
      } else {
        entry(out, file.key(), string(name));
      }
    }

    out.append('\n').append(RULE).append('\n');
    out.append("# Domain definition (root domain)\n");
    out.append("# NOTE:\n");
    out.append("# The here defined domain needs to be completely within the boundaries of the data.\n");
    out.append("# Palm-4U cannot handle non-rectangular domains\n");
    out.append(RULE).append('\n');
    out.append("domain_root:\n");
    entry(out, "pixel_size", number(domain.pixelSize()));
    entry(out, "origin_x", number(domain.originX()));
    entry(out, "origin_y", number(domain.originY()));
    entry(out, "nx", domain.nx() == null ? "null" : domain.nx().toString());
    entry(out, "ny", domain.ny() == null ? "null" : domain.ny().toString());
    entry(out, "dz", number(domain.dz()));
    entry(out, "bridge_depth", number(domain.bridgeDepth()));
    entry(out, "buildings_3d", Boolean.toString(domain.buildings3d()));
    entry(out, "street_trees", Boolean.toString(domain.streetTrees()));
    entry(out, "overhanging_trees", Boolean.toString(domain.overhangingTrees()));
    entry(out, "generate_vegetation_patches", Boolean.toString(domain.generateVegetationPatches()));
    return out.toString();
  }

  private static void section(StringBuilder out, String title, String key) {
    out.append(RULE).append('\n');
    out.append("# ").append(title).append('\n');
    out.append(RULE).append('\n');
    out.append(key).append(":\n");
  }

  private static void entry(StringBuilder out, String key, String value) {
    out.append("  ").append(key).append(": ").append(value).append('\n');
  }

  private String string(String value) {
    return plain.dumpToString(Objects.requireNonNullElse(value, "")).strip();
  }

  private String quoted(String value) {
    return quoted.dumpToString(Objects.requireNonNullElse(value, "")).strip();
  }

  private static String number(Double value) {
    if (value == null || value.isNaN()) {
      return "null";
    }
    String text = BigDecimal.valueOf(value).toPlainString();
    return text.contains(".") ? text : text + ".0";
  }
}
