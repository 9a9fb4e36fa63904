package com.onthegomap.palmprep.csd;

import java.util.regex.Pattern;

/**
 * Static driver input files referenced from the {@code input_root} section, in the order they are written.
 * <p>
 * Each entry is found in the input directory by a case-insensitive match of {@link #pattern()} anywhere in the file
 * name.
 */
public enum InputFile {
  ZT("file_zt", "terrain", "terrain_height|zt"),
  BUILDINGS_2D("file_buildings_2d", "buildings LOD1", "building_height|buildings_2d"),
  BUILDING_ID("file_building_id", "buildings LOD1", "building_id"),
  BUILDING_TYPE("file_building_type", "buildings LOD1", "building_type"),
  BRIDGES_2D("file_bridges_2d", "bridges", "bridges_height|bridges_2d"),
  BRIDGES_ID("file_bridges_id", "bridges", "bridges_id"),
  VEGETATION_TYPE("file_vegetation_type", "vegetation", "vegetation_type"),
  VEGETATION_HEIGHT("file_vegetation_height", "vegetation", "vegetation_height"),
  TREE_HEIGHT("file_tree_height", "resolved vegetation (trees)", "tree_height"),
  TREE_CROWN_DIAMETER("file_tree_crown_diameter", "resolved vegetation (trees)", "tree_crown_diameter"),
  TREE_TRUNK_DIAMETER("file_tree_trunk_diameter", "resolved vegetation (trees)", "tree_trunk_diameter"),
  TREE_TYPE("file_tree_type", "resolved vegetation (trees)", "tree_type"),
  LAI("file_lai", "resolved vegetation (trees)", "lai|leaf_area_index"),
  WATER_TYPE("file_water_type", "water", "water_type"),
  PAVEMENT_TYPE("file_pavement_type", "pavement", "pavement_type"),
  SOIL_TYPE("file_soil_type", "pavement", "soil_type");

  private final String key;
  private final String group;
  private final Pattern pattern;

  InputFile(String key, String group, String pattern) {
    this.key = key;
    this.group = group;
    this.pattern = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
  }

  /** Key in the YAML file, also accepted as an explicit override argument. */
  public String key() {
    return key;
  }

  /** Comment line the entry is grouped under. */
  public String group() {
    return group;
  }

  public Pattern pattern() {
    return pattern;
  }

  public boolean matches(String fileName) {
    return pattern.matcher(fileName).find();
  }
}
