package io.statusmvp.pricefeed.feed;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/** Raw, unvalidated shape of the feed document (YAML or JSON). */
public final class FeedsDocument {
  private FeedsDocument() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Root(
      @JsonProperty("version") String version,
      @JsonProperty("sources") List<Source> sources,
      @JsonProperty("feeds") List<Feed> feeds,
      @JsonProperty("default_sources") List<String> defaultSources,
      @JsonProperty("update_interval") String updateInterval,
      @JsonProperty("publish_policy") Policy publishPolicy,
      @JsonProperty("aggregation") Aggregation aggregation) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Source(
      @JsonProperty("id") String id,
      @JsonProperty("name") String name,
      @JsonProperty("url") @JsonAlias("url_template") String url,
      @JsonProperty("json_path") @JsonAlias("extraction_path") String jsonPath,
      @JsonProperty("weight") Integer weight,
      @JsonProperty("timeout") String timeout,
      @JsonProperty("headers") Map<String, String> headers,
      @JsonProperty("pair_template") String pairTemplate,
      @JsonProperty("base_override") String baseOverride,
      @JsonProperty("quote_override") String quoteOverride) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Feed(
      @JsonProperty("id") String id,
      @JsonProperty("name") String name,
      @JsonProperty("data_type") String dataType,
      @JsonProperty("pair") String pair,
      @JsonProperty("base") String base,
      @JsonProperty("quote") String quote,
      @JsonProperty("decimals") Integer decimals,
      @JsonProperty("sources") List<String> sources,
      @JsonProperty("update_interval") String updateInterval,
      @JsonProperty("enabled") Boolean enabled) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Policy(
      @JsonProperty("threshold_bps") Integer thresholdBps,
      @JsonProperty("hysteresis_bps") Integer hysteresisBps,
      @JsonProperty("min_interval") String minInterval,
      @JsonProperty("max_per_minute") Integer maxPerMinute) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Aggregation(
      @JsonProperty("method") String method,
      @JsonProperty("min_sources") Integer minSources,
      @JsonProperty("require_majority") Boolean requireMajority) {}
}
