package com.onthegomap.palmprep.vector;

import com.onthegomap.palmprep.EmptyResultException;
import com.onthegomap.palmprep.aoi.AreaOfInterest;
import com.onthegomap.palmprep.geo.Crs;
import java.util.ArrayList;
import java.util.List;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges per-tile feature sets into one set in the target CRS.
 * <p>
 * Features whose bounding box misses the area of interest are dropped here; exact clipping happens after geometry
 * repair, because intersecting unrepaired geometry is not reliable.
 */
public class VectorMosaicClipper {

  private static final Logger LOGGER = LoggerFactory.getLogger(VectorMosaicClipper.class);

  private VectorMosaicClipper() {}

  /**
   * Returns every feature of {@code tiles}, in tile order, whose bounding box intersects {@code aoi}. Features without a
   * parsed geometry are kept so later repair steps can deal with them.
   *
   * @throws EmptyResultException if no feature remains
   */
  public static FeatureSet merge(List<FeatureSet> tiles, AreaOfInterest aoi, Crs target) {
    Envelope aoiEnvelope = aoi.reproject(target).envelope();
    List<VectorFeature> merged = new ArrayList<>();
    int total = 0;
    for (FeatureSet tile : tiles) {
      FeatureSet local = tile.reproject(target);
      total += local.size();
      for (VectorFeature feature : local.features()) {
        var geometry = feature.geometry().geometry();
        if (geometry == null || geometry.getEnvelopeInternal().intersects(aoiEnvelope)) {
          merged.add(feature);
        }
      }
    }
    if (merged.isEmpty()) {
      throw new EmptyResultException("None of the " + total + " features in " + tiles.size() +
        " tiles are near the AOI");
    }
    LOGGER.info("Merged {} of {} features from {} tiles", merged.size(), total, tiles.size());
    return new FeatureSet(target, merged);
  }
}
