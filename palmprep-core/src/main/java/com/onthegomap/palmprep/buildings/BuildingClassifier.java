package com.onthegomap.palmprep.buildings;

import static com.onthegomap.palmprep.buildings.PalmBuildingType.*;

import com.onthegomap.palmprep.config.PalmPrepConfig;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a building's function code and settlement year to a {@link PalmBuildingType}.
 * <p>
 * Rules are checked in order and the first match wins:
 *
 * <pre>
 * function == bridge code        -> 7
 * function == residential code:
 *   year is -1 or 1985           -> 1
 *   1986 &lt;= year &lt;= 2000        -> 2
 *   year &gt; 2000                  -> 3
 *   otherwise                    -> 1
 * any other function:
 *   year is -1 or 1985           -> 4
 *   1986 &lt;= year &lt;= 2000        -> 5
 *   year &gt; 2000                  -> 6
 *   otherwise                    -> 4
 * </pre>
 *
 * The -1 marker and 1985 deliberately land in the same pre-1986 bucket.
 */
public class BuildingClassifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(BuildingClassifier.class);

  /** Year that the settlement raster uses for everything built before 1986. */
  public static final int PRE_1986_MARKER = -1;
  private static final int LAST_OLD_YEAR = 1985;

  private record Rule(Matcher matcher, PalmBuildingType type) {}

  @FunctionalInterface
  private interface Matcher {
    boolean matches(String function, int year);
  }

  private final List<Rule> rules;

  public BuildingClassifier(String bridgeCode, String residentialCode) {
    Objects.requireNonNull(bridgeCode, "bridgeCode");
    Objects.requireNonNull(residentialCode, "residentialCode");
    this.rules = List.of(
      new Rule((f, y) -> bridgeCode.equals(f), BRIDGE),
      new Rule((f, y) -> residentialCode.equals(f) && isOld(y), RESIDENTIAL_BEFORE_1986),
      new Rule((f, y) -> residentialCode.equals(f) && isMiddle(y), RESIDENTIAL_1986_TO_2000),
      new Rule((f, y) -> residentialCode.equals(f) && y > 2000, RESIDENTIAL_AFTER_2000),
      new Rule((f, y) -> residentialCode.equals(f), RESIDENTIAL_BEFORE_1986),
      new Rule((f, y) -> isOld(y), NON_RESIDENTIAL_BEFORE_1986),
      new Rule((f, y) -> isMiddle(y), NON_RESIDENTIAL_1986_TO_2000),
      new Rule((f, y) -> y > 2000, NON_RESIDENTIAL_AFTER_2000),
      new Rule((f, y) -> true, NON_RESIDENTIAL_BEFORE_1986)
    );
  }

  public static BuildingClassifier from(PalmPrepConfig config) {
    return new BuildingClassifier(config.bridgeCode(), config.residentialCode());
  }

  private static boolean isOld(int year) {
    return year == PRE_1986_MARKER || year == LAST_OLD_YEAR;
  }

  private static boolean isMiddle(int year) {
    return year >= 1986 && year <= 2000;
  }

  /** Returns the type for a building with function {@code functionCode} last built in {@code year} (null means 0). */
  public PalmBuildingType classify(String functionCode, Integer year) {
    int y = year == null ? 0 : year;
    for (Rule rule : rules) {
      if (rule.matcher.matches(functionCode, y)) {
        return rule.type;
      }
    }
    throw new IllegalStateException("No rule matched " + functionCode + " / " + year);
  }

  /** Returns {@code buildings} with {@link BuildingFeature#palmType()} set. */
  public List<BuildingFeature> classifyAll(List<BuildingFeature> buildings) {
    List<BuildingFeature> result = new ArrayList<>(buildings.size());
    Map<PalmBuildingType, Integer> counts = new EnumMap<>(PalmBuildingType.class);
    for (BuildingFeature building : buildings) {
      PalmBuildingType type = classify(building.functionCode(), building.yearMax());
      counts.merge(type, 1, Integer::sum);
      result.add(building.withPalmType(type.code()));
    }
    LOGGER.info("Classified {} buildings: {}", result.size(), counts);
    return result;
  }
}
