package com.onthegomap.palmprep.util;

import java.text.NumberFormat;
import java.text.ParseException;
import java.util.Locale;

/**
 * Utilities to parse attribute values that may arrive as numbers or as strings.
 */
public class Parse {

  private static final NumberFormat PARSER = NumberFormat.getNumberInstance(Locale.ROOT);

  private Parse() {}

  /** Returns {@code value} as a double or null if missing or invalid. */
  public static Double parseDoubleOrNull(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    String string = value.toString().strip();
    if (string.isEmpty()) {
      return null;
    }
    try {
      return Double.parseDouble(string);
    } catch (NumberFormatException e) {
      try {
        return PARSER.parse(string).doubleValue();
      } catch (ParseException e2) {
        return null;
      }
    }
  }

  /** Returns {@code value} as a string, or null if it is missing or blank. */
  public static String stringOrNull(Object value) {
    if (value == null) {
      return null;
    }
    String string = value.toString();
    return string.isBlank() ? null : string;
  }
}
