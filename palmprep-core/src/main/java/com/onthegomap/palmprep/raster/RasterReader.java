package com.onthegomap.palmprep.raster;

import java.io.IOException;
import java.nio.file.Path;

/** Loads the first band of a raster file into memory. */
@FunctionalInterface
public interface RasterReader {

  RasterLayer read(Path path) throws IOException;
}
