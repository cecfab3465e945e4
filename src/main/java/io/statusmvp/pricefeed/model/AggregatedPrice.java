package io.statusmvp.pricefeed.model;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated value for one feed at one instant. {@code price} is fixed-point at {@code decimals};
 * {@code contributingSourceIds} keeps source declaration order.
 */
public record AggregatedPrice(
    String symbol, long price, int decimals, Instant timestamp, List<String> contributingSourceIds) {

  public AggregatedPrice {
    contributingSourceIds = contributingSourceIds == null ? List.of() : List.copyOf(contributingSourceIds);
  }
}
