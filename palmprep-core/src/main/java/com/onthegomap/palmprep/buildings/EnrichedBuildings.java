package com.onthegomap.palmprep.buildings;

import com.onthegomap.palmprep.geo.Crs;
import java.util.ArrayList;
import java.util.List;

/**
 * Clipped footprints split into buildings and bridges, sharing one ID sequence.
 *
 * @param crs       CRS of every footprint
 * @param buildings features whose function code is not the bridge code
 * @param bridges   features whose function code is the bridge code
 */
public record EnrichedBuildings(Crs crs, List<BuildingFeature> buildings, List<BuildingFeature> bridges) {

  public EnrichedBuildings {
    buildings = List.copyOf(buildings);
    bridges = List.copyOf(bridges);
  }

  /** Returns buildings and bridges ordered by ID. */
  public List<BuildingFeature> all() {
    List<BuildingFeature> result = new ArrayList<>(buildings.size() + bridges.size());
    result.addAll(buildings);
    result.addAll(bridges);
    result.sort((a, b) -> Long.compare(a.id(), b.id()));
    return result;
  }
}
