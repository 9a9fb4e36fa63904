package com.onthegomap.palmprep.buildings;

import com.onthegomap.palmprep.geo.GeoUtils;
import com.onthegomap.palmprep.geo.GeometryException;
import com.onthegomap.palmprep.geo.GeometryKind;
import com.onthegomap.palmprep.stats.Stats;
import com.onthegomap.palmprep.vector.FeatureCsv;
import com.onthegomap.palmprep.vector.FeatureSet;
import com.onthegomap.palmprep.vector.VectorFeature;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns building geometry of any type into MultiPolygons, or fails naming the features it could not fix.
 * <p>
 * The repair chain runs as a state machine:
 * <ol>
 * <li>{@link State#DIM_REDUCED}: drop Z and M ordinates</li>
 * <li>{@link State#TYPE_CHECK}: look at the distinct type tags</li>
 * <li>{@link State#DIRECT_CAST}: cast every feature when the set is polygonal or every cast succeeds</li>
 * <li>{@link State#PER_FEATURE_REPAIR}: rebuild surfaces from their faces and cast the rest one by one</li>
 * <li>{@link State#EXTERNAL_CONVERSION}: hand the whole set to a {@link VectorTranslator} if anything is left</li>
 * </ol>
 * Every successful path ends in {@link State#NORMALIZED} with only MultiPolygon geometries, and the last resort ends in
 * {@link State#FAILED} with a {@link GeometryRepairFailedException}.
 */
public class GeometryNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryNormalizer.class);
  private static final Set<GeometryKind> CONVERTED_KINDS =
    EnumSet.of(GeometryKind.POLYGON, GeometryKind.MULTIPOLYGON, GeometryKind.MULTISURFACE);

  private final VectorTranslator translator;
  private final Path workDir;
  private final Stats stats;

  /**
   * @param translator external converter used as the last resort, or null to fail without one
   * @param workDir    directory for the interchange files handed to {@code translator}
   * @param stats      receives a data error for every feature that needed repair
   */
  public GeometryNormalizer(VectorTranslator translator, Path workDir, Stats stats) {
    this.translator = translator;
    this.workDir = workDir;
    this.stats = stats;
  }

  public enum State {
    RAW,
    DIM_REDUCED,
    TYPE_CHECK,
    DIRECT_CAST,
    PER_FEATURE_REPAIR,
    EXTERNAL_CONVERSION,
    FAILED,
    NORMALIZED
  }

  /** Result of repairing one feature. */
  public sealed interface RepairOutcome {}

  /** The feature now has a MultiPolygon geometry. */
  public record Repaired(MultiPolygon geometry) implements RepairOutcome {}

  /** The feature keeps its original geometry because of {@code reason}. */
  public record Unrepaired(String reason) implements RepairOutcome {}

  /**
   * @param features normalized features, all with MultiPolygon geometry
   * @param states   states visited, starting with {@link State#RAW} and ending with {@link State#NORMALIZED}
   */
  public record Result(FeatureSet features, List<State> states) {}

  /**
   * Returns {@code input} with every geometry converted to a MultiPolygon.
   *
   * @throws GeometryRepairFailedException if some features could not be converted
   */
  public Result normalize(FeatureSet input) {
    List<State> states = new ArrayList<>(List.of(State.RAW));
    FeatureSet reduced = dropZ(input);
    states.add(State.DIM_REDUCED);

    states.add(State.TYPE_CHECK);
    Set<GeometryKind> kinds = reduced.kinds();
    LOGGER.info("Normalizing {} features with geometry types {}", reduced.size(), kinds);

    List<MultiPolygon> cast = castAll(reduced);
    if (cast != null) {
      states.add(State.DIRECT_CAST);
      return finish(reduced, cast, states);
    }

    states.add(State.PER_FEATURE_REPAIR);
    List<RepairOutcome> outcomes = new ArrayList<>(reduced.size());
    for (VectorFeature feature : reduced.features()) {
      outcomes.add(repair(feature));
    }
    List<Integer> unrepaired = new ArrayList<>();
    List<MultiPolygon> repaired = new ArrayList<>(outcomes.size());
    for (int i = 0; i < outcomes.size(); i++) {
      if (outcomes.get(i) instanceof Repaired done) {
        repaired.add(done.geometry());
      } else if (outcomes.get(i) instanceof Unrepaired failed) {
        unrepaired.add(i);
        stats.dataError("normalize_unrepaired");
        LOGGER.debug("Feature {} ({}) not repaired: {}", i, reduced.get(i).geometry().kind(), failed.reason());
      }
    }
    if (unrepaired.isEmpty()) {
      LOGGER.info("Repaired all {} features one by one", reduced.size());
      return finish(reduced, repaired, states);
    }
    LOGGER.warn("{} features could not be repaired one by one", unrepaired.size());

    if (translator != null) {
      states.add(State.EXTERNAL_CONVERSION);
      try {
        List<MultiPolygon> converted = convertExternally(reduced);
        LOGGER.info("External conversion produced polygons for all {} features", converted.size());
        return finish(reduced, converted, states);
      } catch (GeometryException e) {
        e.log(stats, "normalize", "External conversion failed");
        states.add(State.FAILED);
        throw new GeometryRepairFailedException(unrepaired, "external conversion failed: " + e.getMessage(), e);
      } catch (IOException e) {
        LOGGER.warn("External conversion failed: {}", e.getMessage());
        states.add(State.FAILED);
        throw new GeometryRepairFailedException(unrepaired, "external conversion failed: " + e.getMessage(), e);
      }
    }
    states.add(State.FAILED);
    throw new GeometryRepairFailedException(unrepaired, "no external converter configured", null);
  }

  private static FeatureSet dropZ(FeatureSet input) {
    List<VectorFeature> result = new ArrayList<>(input.size());
    for (VectorFeature feature : input.features()) {
      var geometry = feature.geometry();
      result.add(geometry.hasGeometry() ? feature.withSameKind(GeoUtils.force2D(geometry.geometry())) : feature);
    }
    return new FeatureSet(input.crs(), result);
  }

  private static Result finish(FeatureSet reduced, List<MultiPolygon> geometries, List<State> states) {
    List<VectorFeature> result = new ArrayList<>(reduced.size());
    for (int i = 0; i < reduced.size(); i++) {
      result.add(reduced.get(i).withGeometry(geometries.get(i)));
    }
    states.add(State.NORMALIZED);
    return new Result(new FeatureSet(reduced.crs(), result), List.copyOf(states));
  }

  /** Casts every feature to a MultiPolygon, or returns null if any one of them cannot be cast. */
  private static List<MultiPolygon> castAll(FeatureSet features) {
    List<MultiPolygon> result = new ArrayList<>(features.size());
    for (VectorFeature feature : features.features()) {
      var source = feature.geometry();
      // flattened surfaces have overlapping faces, so they never count as castable
      if (!source.hasGeometry() || source.kind().isUnsupportedSurface()) {
        return null;
      }
      try {
        result.add(GeoUtils.toMultiPolygon(source.geometry()));
      } catch (GeometryException e) {
        return null;
      }
    }
    return result;
  }

  private RepairOutcome repair(VectorFeature feature) {
    var source = feature.geometry();
    if (!source.hasGeometry()) {
      return new Unrepaired("unparsable " + source.kind() + " geometry");
    }
    if (source.kind().isUnsupportedSurface()) {
      stats.dataError("normalize_surface");
      return repairSurface(source.geometry());
    }
    try {
      return new Repaired(GeoUtils.toMultiPolygon(source.geometry()));
    } catch (GeometryException e) {
      return new Unrepaired(e.getMessage());
    }
  }

  /**
   * Rebuilds a polyhedral or triangulated surface: a single face is used as-is, otherwise the polygonal faces are
   * dissolved into a footprint.
   */
  static RepairOutcome repairSurface(Geometry surface) {
    if (surface.getNumGeometries() == 1 && surface.getGeometryN(0) instanceof Polygon face && face.getArea() > 0) {
      return new Repaired(GeoUtils.createMultiPolygon(List.of(face)));
    }
    List<Polygon> faces = new ArrayList<>();
    for (Polygon face : GeoUtils.polygons(surface)) {
      // vertical walls have no footprint
      if (face.getArea() > 0) {
        faces.addAll(face.isValid() ? List.of(face) : GeoUtils.polygons(GeoUtils.fixPolygon(face)));
      }
    }
    if (faces.isEmpty()) {
      return new Unrepaired("surface has no polygonal faces with area");
    }
    try {
      MultiPolygon merged = GeoUtils.toMultiPolygon(GeoUtils.unionOrCombine(faces));
      return merged.isEmpty() ? new Unrepaired("surface faces have no area") : new Repaired(merged);
    } catch (GeometryException e) {
      return new Unrepaired(e.getMessage());
    }
  }

  private List<MultiPolygon> convertExternally(FeatureSet reduced) throws IOException, GeometryException {
    Path input = workDir.resolve("normalize_input.csv");
    Path output = workDir.resolve("normalize_output.csv");
    FeatureCsv.write(reduced, input);
    translator.translate(input, output);
    FeatureSet converted = FeatureCsv.read(output, reduced.crs());
    if (converted.size() != reduced.size()) {
      throw new GeometryException("external_count",
        "expected " + reduced.size() + " features back but got " + converted.size());
    }
    List<MultiPolygon> result = new ArrayList<>(converted.size());
    for (int i = 0; i < converted.size(); i++) {
      var source = converted.get(i).geometry();
      if (!source.hasGeometry() || !CONVERTED_KINDS.contains(source.kind())) {
        throw new GeometryException("external_type", "feature " + i + " came back as " + source.kind());
      }
      result.add(GeoUtils.toMultiPolygon(source.geometry()));
    }
    return result;
  }
}
