package com.onthegomap.palmprep.buildings;

import com.onthegomap.palmprep.util.FileUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@code ogr2ogr} command line utility to force every geometry of a WKT CSV file to MultiPolygon.
 */
public class Ogr2OgrTranslator implements VectorTranslator {

  private static final Logger LOGGER = LoggerFactory.getLogger(Ogr2OgrTranslator.class);

  private final String executable;

  public Ogr2OgrTranslator(String executable) {
    this.executable = executable;
  }

  List<String> command(Path input, Path output) {
    return List.of(
      executable,
      "-f", "CSV",
      output.toString(),
      input.toString(),
      "-oo", "GEOM_POSSIBLE_NAMES=WKT",
      "-oo", "KEEP_GEOM_COLUMNS=NO",
      "-lco", "GEOMETRY=AS_WKT",
      "-nlt", "MULTIPOLYGON",
      "-dim", "XY",
      "-overwrite"
    );
  }

  @Override
  public void translate(Path input, Path output) throws IOException {
    FileUtils.deleteFile(output);
    List<String> command = command(input, output);
    LOGGER.info("Running {}", String.join(" ", command));
    Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
    String log = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
    int exitCode;
    try {
      exitCode = process.waitFor();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroy();
      throw new IOException("Interrupted waiting for " + executable, e);
    }
    if (exitCode != 0) {
      throw new IOException(executable + " exited with code " + exitCode + (log.isEmpty() ? "" : ": " + log));
    }
    if (!FileUtils.isNonEmptyFile(output)) {
      throw new IOException(executable + " did not produce " + output);
    }
    if (!log.isEmpty()) {
      LOGGER.debug("{} output: {}", executable, log);
    }
  }
}
