package com.onthegomap.palmprep.buildings;

/**
 * Building type codes understood by the PALM static driver.
 */
public enum PalmBuildingType {
  RESIDENTIAL_BEFORE_1986(1),
  RESIDENTIAL_1986_TO_2000(2),
  RESIDENTIAL_AFTER_2000(3),
  NON_RESIDENTIAL_BEFORE_1986(4),
  NON_RESIDENTIAL_1986_TO_2000(5),
  NON_RESIDENTIAL_AFTER_2000(6),
  BRIDGE(7);

  private final int code;

  PalmBuildingType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static PalmBuildingType fromCode(int code) {
    for (PalmBuildingType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown PALM building type: " + code);
  }
}
