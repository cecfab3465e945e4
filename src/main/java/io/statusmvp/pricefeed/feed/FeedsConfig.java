package io.statusmvp.pricefeed.feed;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Validated feed document. Immutable; built by {@link FeedConfigLoader}. */
public final class FeedsConfig {
  private final String version;
  private final List<SourceSpec> sources;
  private final List<FeedSpec> feeds;
  private final List<String> defaultSources;
  private final Duration updateInterval;
  private final PublishPolicy publishPolicy;
  private final AggregationSettings aggregation;
  private final Map<String, SourceSpec> sourcesById;
  private final Map<String, FeedSpec> feedsById;

  public FeedsConfig(
      String version,
      List<SourceSpec> sources,
      List<FeedSpec> feeds,
      List<String> defaultSources,
      Duration updateInterval,
      PublishPolicy publishPolicy,
      AggregationSettings aggregation) {
    this.version = version;
    this.sources = List.copyOf(sources);
    this.feeds = List.copyOf(feeds);
    this.defaultSources = List.copyOf(defaultSources);
    this.updateInterval = updateInterval;
    this.publishPolicy = publishPolicy;
    this.aggregation = aggregation;
    Map<String, SourceSpec> s = new LinkedHashMap<>();
    for (SourceSpec src : this.sources) s.put(src.id(), src);
    this.sourcesById = Map.copyOf(s);
    Map<String, FeedSpec> f = new LinkedHashMap<>();
    for (FeedSpec feed : this.feeds) f.put(feed.id(), feed);
    this.feedsById = Map.copyOf(f);
  }

  public String version() {
    return version;
  }

  public List<SourceSpec> sources() {
    return sources;
  }

  public List<FeedSpec> feeds() {
    return feeds;
  }

  public List<String> defaultSources() {
    return defaultSources;
  }

  public Duration updateInterval() {
    return updateInterval;
  }

  public PublishPolicy publishPolicy() {
    return publishPolicy;
  }

  public AggregationSettings aggregation() {
    return aggregation;
  }

  public Optional<SourceSpec> source(String id) {
    return Optional.ofNullable(id == null ? null : sourcesById.get(id));
  }

  /** Looks a feed up by id, accepting un-normalised spellings such as {@code btc/usd}. */
  public Optional<FeedSpec> feed(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(feedsById.get(PairSymbols.normalize(id)));
  }

  public List<FeedSpec> enabledFeeds() {
    return feeds.stream().filter(FeedSpec::enabled).toList();
  }

  /** The feed's sources in declaration order. */
  public List<SourceSpec> sourcesFor(FeedSpec feed) {
    return feed.sources().stream().map(sourcesById::get).toList();
  }
}
