package com.onthegomap.palmprep.raster;

import java.io.IOException;
import java.nio.file.Path;

/** Writes a raster to a single-band file. */
@FunctionalInterface
public interface RasterWriter {

  void write(RasterLayer raster, Path path) throws IOException;
}
