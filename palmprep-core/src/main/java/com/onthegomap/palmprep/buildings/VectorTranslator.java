package com.onthegomap.palmprep.buildings;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Converts a WKT CSV feature file into another WKT CSV file whose geometries are all forced to MultiPolygon.
 */
@FunctionalInterface
public interface VectorTranslator {

  void translate(Path input, Path output) throws IOException;
}
