package com.audience.segments.warehouse;

import java.util.regex.Pattern;

/**
 * Naming of the physical tables that hold segments.
 */
public final class SegmentTables {

  public static final String CATALOG_TABLE = "segment_catalog";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private SegmentTables() {
  }

  public static String outputTable(Long ruleId) {
    return "segment_output_" + ruleId;
  }

  public static String stagingTable(Long ruleId, String suffix) {
    return outputTable(ruleId) + "__staging_" + suffix.replaceAll("[^A-Za-z0-9]", "");
  }

  public static String segmentName(Long ruleId) {
    return "segment_" + ruleId;
  }

  public static boolean isSafeIdentifier(String name) {
    return name != null && IDENTIFIER.matcher(name).matches();
  }
}
