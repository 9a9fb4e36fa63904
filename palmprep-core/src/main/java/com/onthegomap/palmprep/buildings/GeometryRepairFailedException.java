package com.onthegomap.palmprep.buildings;

import com.onthegomap.palmprep.PalmPrepException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when neither casting, per-feature repair nor external conversion produced polygons for every feature.
 */
public class GeometryRepairFailedException extends PalmPrepException {

  /** Command that converts the source file outside the pipeline. */
  public static final String REMEDIATION_COMMAND = "ogr2ogr -f GPKG lod2_multipolygon.gpkg lod2.gpkg -nlt MULTIPOLYGON";
  private static final int MAX_LISTED = 10;

  private final List<Integer> offendingIndices;

  public GeometryRepairFailedException(List<Integer> offendingIndices, String detail, Throwable cause) {
    super(message(offendingIndices, detail), cause);
    this.offendingIndices = List.copyOf(offendingIndices);
  }

  private static String message(List<Integer> indices, String detail) {
    String listed = indices.stream().limit(MAX_LISTED).map(String::valueOf).collect(Collectors.joining(", "));
    if (indices.size() > MAX_LISTED) {
      listed += " ...";
    }
    return "Could not convert " + indices.size() + " features to polygons (indices: " + listed + ")" +
      (detail == null ? "" : ": " + detail) +
      ". Convert the source to MultiPolygon manually, for example: " + REMEDIATION_COMMAND;
  }

  /** Returns the indices of every feature that could not be repaired. */
  public List<Integer> offendingIndices() {
    return offendingIndices;
  }

  public String remediationCommand() {
    return REMEDIATION_COMMAND;
  }
}
