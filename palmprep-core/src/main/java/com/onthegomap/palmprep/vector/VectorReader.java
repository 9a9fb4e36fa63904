package com.onthegomap.palmprep.vector;

import java.io.IOException;
import java.nio.file.Path;

/** Loads every feature of every layer in a vector file. */
@FunctionalInterface
public interface VectorReader {

  FeatureSet read(Path path) throws IOException;
}
