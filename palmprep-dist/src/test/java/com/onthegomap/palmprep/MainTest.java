package com.onthegomap.palmprep;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Set;
import org.junit.jupiter.api.Test;

class MainTest {

  @Test
  void testEntryPoints() {
    assertEquals(Set.of("prepare", "align-rasters", "csd-config"), Main.ENTRY_POINTS.keySet());
  }
}
