package com.onthegomap.palmprep.raster;

import com.onthegomap.palmprep.ValidationException;
import com.onthegomap.palmprep.aoi.AreaOfInterest;
import com.onthegomap.palmprep.config.PalmPrepConfig;
import com.onthegomap.palmprep.geo.Crs;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Puts any number of named rasters onto one target-aligned pixel grid covering an area of interest.
 * <p>
 * The reference grid is the AOI bounding box in the target CRS with every edge snapped outward to a multiple of the
 * resolution, so grids derived from different runs share cell edges. Layers whose name matches the categorical pattern
 * (land cover, settlement year) are sampled with {@link Resampling#NEAREST}, all others with
 * {@link Resampling#BILINEAR}. The pattern is a case-insensitive regular expression matched anywhere in the name, so
 * with {@code LC|WSF} a layer called {@code calc_dem} is categorical too; anchor it ({@code ^(LC|WSF)$}) to match whole
 * names only.
 */
public class GridAligner {

  private static final Logger LOGGER = LoggerFactory.getLogger(GridAligner.class);

  private final Crs targetCrs;
  private final double resolution;
  private final Pattern categorical;
  private final RasterWarper warper;

  public GridAligner(Crs targetCrs, double resolution, String categoricalPattern, RasterWarper warper) {
    if (!(resolution > 0)) {
      throw new ValidationException("Target resolution must be > 0, was " + resolution);
    }
    this.targetCrs = targetCrs;
    this.resolution = resolution;
    this.categorical = Pattern.compile(categoricalPattern, Pattern.CASE_INSENSITIVE);
    this.warper = warper;
  }

  public static GridAligner from(PalmPrepConfig config, RasterWarper warper) {
    return new GridAligner(Crs.ofEpsg(config.targetEpsg()), config.resolution(), config.categoricalPattern(), warper);
  }

  /**
   * Returns {@code envelope} with its minimum edges floored and maximum edges ceiled to multiples of
   * {@code resolution}.
   * <p>
   * Snapping an already-snapped envelope returns it unchanged.
   */
  public static Envelope snap(Envelope envelope, double resolution) {
    return new Envelope(
      Math.floor(GridGeometry.snap(envelope.getMinX() / resolution)) * resolution,
      Math.ceil(GridGeometry.snap(envelope.getMaxX() / resolution)) * resolution,
      Math.floor(GridGeometry.snap(envelope.getMinY() / resolution)) * resolution,
      Math.ceil(GridGeometry.snap(envelope.getMaxY() / resolution)) * resolution
    );
  }

  /** Returns the reference grid for {@code aoi}. */
  public GridGeometry referenceGrid(AreaOfInterest aoi) {
    Envelope snapped = snap(aoi.reproject(targetCrs).envelope(), resolution);
    return GridGeometry.covering(targetCrs, snapped, resolution, resolution);
  }

  /** Returns the kernel used for a layer called {@code name}. */
  public Resampling resamplingFor(String name) {
    return categorical.matcher(name).find() ? Resampling.NEAREST : Resampling.BILINEAR;
  }

  /**
   * Reprojects, resamples, crops and masks each raster in {@code rasters} onto the reference grid for {@code aoi}.
   *
   * @throws ValidationException   if there are no rasters or a layer name is blank
   * @throws IllegalStateException if a layer did not end up on the reference grid
   */
  public AlignedRasters align(AreaOfInterest aoi, Map<String, RasterLayer> rasters) {
    if (rasters.isEmpty()) {
      throw new ValidationException("No rasters to align");
    }
    AreaOfInterest target = aoi.reproject(targetCrs);
    GridGeometry reference = referenceGrid(aoi);
    LOGGER.info("Reference grid {}x{} at {} {} origin ({}, {})", reference.nx(), reference.ny(), resolution,
      targetCrs, reference.minX(), reference.maxY());
    Map<String, RasterLayer> aligned = new LinkedHashMap<>();
    for (var entry : rasters.entrySet()) {
      String name = entry.getKey();
      if (name == null || name.isBlank()) {
        throw new ValidationException("Raster layer names must not be blank");
      }
      Resampling resampling = resamplingFor(name);
      LOGGER.info("Aligning {} from {} using {} resampling", name, entry.getValue().grid().crs(), resampling);
      RasterLayer warped = warper.warp(entry.getValue(), reference, resampling);
      RasterLayer cropped = RasterOps.crop(warped, snap(target.envelope(), resolution));
      aligned.put(name, RasterOps.mask(cropped, target.geometry()));
    }
    for (var entry : aligned.entrySet()) {
      if (!reference.equals(entry.getValue().grid())) {
        throw new IllegalStateException("Layer " + entry.getKey() + " is not aligned to the reference grid");
      }
    }
    return new AlignedRasters(reference, aligned);
  }
}
