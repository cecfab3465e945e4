package io.statusmvp.pricefeed.feed;

import java.time.Duration;
import java.util.List;

/**
 * One publishable symbol. {@code sources} holds source ids in declaration order. A null
 * {@code updateInterval} means the feed runs on every scheduler tick.
 */
public record FeedSpec(
    String id,
    String name,
    String pair,
    String base,
    String quote,
    DataType dataType,
    int decimals,
    List<String> sources,
    boolean enabled,
    Duration updateInterval) {

  public FeedSpec {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  public FeedSpec(
      String id,
      String name,
      String pair,
      String base,
      String quote,
      DataType dataType,
      int decimals,
      List<String> sources,
      boolean enabled) {
    this(id, name, pair, base, quote, dataType, decimals, sources, enabled, null);
  }
}
