package de.mpii.fim.summary;

import java.util.Locale;

/**
 * Which frequent itemsets to report: all, maximal, or closed ones.
 */
public enum SummaryType {
  ALL, MAXIMAL, CLOSED;

  /**
   * Parses a summary type from its name or first letter (case-insensitive), e.g. "m" or "maximal".
   *
   * @throws IllegalArgumentException for any other value
   */
  public static SummaryType parse(String value) {
    String v = value.trim().toUpperCase(Locale.ROOT);
    for (SummaryType type : values()) {
      if (type.name().equals(v) || (v.length() == 1 && type.name().charAt(0) == v.charAt(0))) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown output type '" + value
        + "'; expected (a)ll, (m)aximal or (c)losed");
  }
}
