package io.statusmvp.pricefeed.feed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.statusmvp.pricefeed.error.ConfigException;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.convert.DurationStyle;

/**
 * Parses and validates the feed document.
 *
 * <p>Applies defaults ({@code weight=1}, {@code timeout=10s}, {@code decimals=8},
 * {@code data_type=price}), derives base/quote from the feed id and checks every cross reference.
 * The first violation is reported as a {@link ConfigException} naming the field and index.
 */
public final class FeedConfigLoader {
  public static final Duration DEFAULT_SOURCE_TIMEOUT = Duration.ofSeconds(10);
  public static final Duration DEFAULT_UPDATE_INTERVAL = Duration.ofSeconds(1);
  public static final int DEFAULT_DECIMALS = 8;
  public static final int MAX_DECIMALS = 18;

  // YAML is a superset of JSON, so one parser covers both.
  private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

  public FeedsConfig load(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ConfigException("document", -1, "feed document is empty");
    }
    FeedsDocument.Root root;
    try {
      root = mapper.readValue(raw, FeedsDocument.Root.class);
    } catch (Exception e) {
      throw new ConfigException("document", -1, "unparseable feed document: " + e.getMessage(), e);
    }
    if (root == null) {
      throw new ConfigException("document", -1, "feed document is empty");
    }
    return validate(root);
  }

  FeedsConfig validate(FeedsDocument.Root root) {
    List<SourceSpec> sources = validateSources(root.sources());
    Set<String> sourceIds = new HashSet<>();
    sources.forEach(s -> sourceIds.add(s.id()));

    List<String> defaultSources = root.defaultSources() == null ? List.of() : root.defaultSources();
    for (int i = 0; i < defaultSources.size(); i++) {
      if (!sourceIds.contains(defaultSources.get(i))) {
        throw new ConfigException(
            "default_sources", i, "unknown source '" + defaultSources.get(i) + "'");
      }
    }

    List<FeedSpec> feeds = validateFeeds(root.feeds(), sourceIds, defaultSources);

    Duration updateInterval =
        parseDuration(root.updateInterval(), "update_interval", -1, DEFAULT_UPDATE_INTERVAL);
    if (updateInterval.isZero() || updateInterval.isNegative()) {
      throw new ConfigException("update_interval", -1, "must be positive");
    }

    return new FeedsConfig(
        root.version() == null ? "1.0" : root.version().trim(),
        sources,
        feeds,
        defaultSources,
        updateInterval,
        validatePolicy(root.publishPolicy()),
        validateAggregation(root.aggregation()));
  }

  private List<SourceSpec> validateSources(List<FeedsDocument.Source> raw) {
    if (raw == null || raw.isEmpty()) {
      throw new ConfigException("sources", -1, "at least one source required");
    }
    List<SourceSpec> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < raw.size(); i++) {
      FeedsDocument.Source s = raw.get(i);
      if (s == null) throw new ConfigException("sources", i, "empty entry");
      String id = trim(s.id());
      if (id.isEmpty()) throw new ConfigException("sources.id", i, "id required");
      if (!seen.add(id)) throw new ConfigException("sources.id", i, "duplicate source id '" + id + "'");
      String url = trim(s.url());
      if (url.isEmpty()) throw new ConfigException("sources.url", i, "url required");
      String path = trim(s.jsonPath());
      if (path.isEmpty()) throw new ConfigException("sources.json_path", i, "json_path required");

      int weight = s.weight() == null ? 1 : s.weight();
      if (weight < 1) throw new ConfigException("sources.weight", i, "weight must be >= 1");

      Duration timeout = parseDuration(s.timeout(), "sources.timeout", i, DEFAULT_SOURCE_TIMEOUT);
      if (timeout.isZero() || timeout.isNegative()) {
        throw new ConfigException("sources.timeout", i, "timeout must be positive");
      }

      Map<String, String> headers = new LinkedHashMap<>();
      if (s.headers() != null) {
        s.headers().forEach((k, v) -> {
          if (k != null && !k.isBlank()) headers.put(k.trim(), v == null ? "" : v);
        });
      }

      out.add(
          new SourceSpec(
              id,
              trim(s.name()).isEmpty() ? id : trim(s.name()),
              url,
              path,
              weight,
              timeout,
              headers,
              trim(s.pairTemplate()),
              trim(s.baseOverride()).toUpperCase(Locale.ROOT),
              trim(s.quoteOverride()).toUpperCase(Locale.ROOT)));
    }
    return out;
  }

  private List<FeedSpec> validateFeeds(
      List<FeedsDocument.Feed> raw, Set<String> sourceIds, List<String> defaultSources) {
    List<FeedSpec> out = new ArrayList<>();
    if (raw == null) return out;
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < raw.size(); i++) {
      FeedsDocument.Feed f = raw.get(i);
      if (f == null) throw new ConfigException("feeds", i, "empty entry");
      String id = PairSymbols.normalize(f.id());
      if (id.isEmpty()) throw new ConfigException("feeds.id", i, "id required");
      if (!seen.add(id)) throw new ConfigException("feeds.id", i, "duplicate feed id '" + id + "'");

      String base = trim(f.base()).toUpperCase(Locale.ROOT);
      String quote = trim(f.quote()).toUpperCase(Locale.ROOT);
      if (base.isEmpty() || quote.isEmpty()) {
        String[] parsed = PairSymbols.baseQuote(id);
        if (base.isEmpty()) base = parsed[0];
        if (quote.isEmpty()) quote = parsed[1];
      }

      DataType dataType = DataType.fromWireName(f.dataType());
      if (dataType == null) {
        throw new ConfigException("feeds.data_type", i, "unknown data_type '" + f.dataType() + "'");
      }

      int decimals = f.decimals() == null ? DEFAULT_DECIMALS : f.decimals();
      if (decimals <= 0) throw new ConfigException("feeds.decimals", i, "decimals must be > 0");
      if (decimals > MAX_DECIMALS) {
        throw new ConfigException("feeds.decimals", i, "decimals must be <= " + MAX_DECIMALS);
      }

      List<String> sources =
          f.sources() == null || f.sources().isEmpty() ? defaultSources : f.sources();
      if (sources.isEmpty()) {
        throw new ConfigException("feeds.sources", i, "no sources and no default_sources");
      }
      List<String> resolved = new ArrayList<>();
      for (String srcId : sources) {
        String sid = trim(srcId);
        if (!sourceIds.contains(sid)) {
          throw new ConfigException("feeds.sources", i, "unknown source '" + srcId + "'");
        }
        if (!resolved.contains(sid)) resolved.add(sid);
      }

      Duration interval = parseDuration(f.updateInterval(), "feeds.update_interval", i, null);
      if (interval != null && (interval.isZero() || interval.isNegative())) {
        throw new ConfigException("feeds.update_interval", i, "must be positive");
      }

      out.add(
          new FeedSpec(
              id,
              trim(f.name()).isEmpty() ? id : trim(f.name()),
              trim(f.pair()).toUpperCase(Locale.ROOT),
              base,
              quote,
              dataType,
              decimals,
              resolved,
              f.enabled() == null || f.enabled(),
              interval));
    }
    return out;
  }

  private PublishPolicy validatePolicy(FeedsDocument.Policy p) {
    if (p == null) return PublishPolicy.defaults();
    int threshold = p.thresholdBps() == null ? PublishPolicy.DEFAULT_THRESHOLD_BPS : p.thresholdBps();
    int hysteresis =
        p.hysteresisBps() == null ? PublishPolicy.DEFAULT_HYSTERESIS_BPS : p.hysteresisBps();
    int maxPerMinute =
        p.maxPerMinute() == null ? PublishPolicy.DEFAULT_MAX_PER_MINUTE : p.maxPerMinute();
    Duration minInterval =
        parseDuration(
            p.minInterval(), "publish_policy.min_interval", -1, PublishPolicy.DEFAULT_MIN_INTERVAL);

    if (threshold <= 0) {
      throw new ConfigException("publish_policy.threshold_bps", -1, "must be > 0");
    }
    if (hysteresis <= 0) {
      throw new ConfigException("publish_policy.hysteresis_bps", -1, "must be > 0");
    }
    if (hysteresis > threshold) {
      throw new ConfigException(
          "publish_policy.hysteresis_bps", -1, "must not exceed threshold_bps (" + threshold + ")");
    }
    if (maxPerMinute < 1) {
      throw new ConfigException("publish_policy.max_per_minute", -1, "must be >= 1");
    }
    if (minInterval.isNegative()) {
      throw new ConfigException("publish_policy.min_interval", -1, "must not be negative");
    }
    return new PublishPolicy(threshold, hysteresis, minInterval, maxPerMinute);
  }

  private AggregationSettings validateAggregation(FeedsDocument.Aggregation a) {
    if (a == null) return AggregationSettings.defaults();
    AggregationSettings.Method method = AggregationSettings.Method.fromWireName(a.method());
    if (method == null) {
      throw new ConfigException("aggregation.method", -1, "unknown method '" + a.method() + "'");
    }
    int minSources = a.minSources() == null ? 1 : a.minSources();
    if (minSources < 1) throw new ConfigException("aggregation.min_sources", -1, "must be >= 1");
    return new AggregationSettings(method, minSources, Boolean.TRUE.equals(a.requireMajority()));
  }

  /** Accepts {@code 500ms}, {@code 5s}, {@code 1m}, {@code PT5S}; a bare number means seconds. */
  static Duration parseDuration(String raw, String field, int index, Duration fallback) {
    if (raw == null || raw.isBlank()) return fallback;
    try {
      return DurationStyle.detectAndParse(raw.trim(), ChronoUnit.SECONDS);
    } catch (IllegalArgumentException e) {
      throw new ConfigException(field, index, "invalid duration '" + raw + "'", e);
    }
  }

  private static String trim(String v) {
    return v == null ? "" : v.trim();
  }
}
