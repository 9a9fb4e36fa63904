package com.onthegomap.palmprep.raster;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named rasters that all share one reference grid, so they can be composited cell by cell.
 *
 * @param grid   reference grid shared by every layer
 * @param layers layers by name, in insertion order
 */
public record AlignedRasters(GridGeometry grid, Map<String, RasterLayer> layers) {

  public AlignedRasters {
    for (var entry : layers.entrySet()) {
      if (!grid.equals(entry.getValue().grid())) {
        throw new IllegalStateException(
          "Layer " + entry.getKey() + " has grid " + entry.getValue().grid() + " but expected " + grid);
      }
    }
    layers = Collections.unmodifiableMap(new LinkedHashMap<>(layers));
  }

  public RasterLayer get(String name) {
    return layers.get(name);
  }

  /** Returns a new instance that also contains {@code more}, which must be on the same grid. */
  public AlignedRasters with(Map<String, RasterLayer> more) {
    Map<String, RasterLayer> combined = new LinkedHashMap<>(layers);
    combined.putAll(more);
    return new AlignedRasters(grid, combined);
  }
}
