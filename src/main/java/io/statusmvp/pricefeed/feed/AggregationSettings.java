package io.statusmvp.pricefeed.feed;

import java.util.Locale;

public record AggregationSettings(Method method, int minSources, boolean requireMajority) {

  public enum Method {
    WEIGHTED_MEAN,
    WEIGHTED_MEDIAN;

    public static Method fromWireName(String raw) {
      if (raw == null || raw.isBlank()) return WEIGHTED_MEAN;
      String k = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
      for (Method m : values()) {
        if (m.name().equals(k)) return m;
      }
      return null;
    }
  }

  public static AggregationSettings defaults() {
    return new AggregationSettings(Method.WEIGHTED_MEAN, 1, false);
  }

  /** Successful observations needed for a feed configured with {@code configuredSources}. */
  public int requiredSuccesses(int configuredSources) {
    int majority = requireMajority ? configuredSources / 2 + 1 : 1;
    return Math.max(Math.max(1, minSources), majority);
  }
}
