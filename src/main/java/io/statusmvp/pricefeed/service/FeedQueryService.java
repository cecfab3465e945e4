package io.statusmvp.pricefeed.service;

import io.statusmvp.pricefeed.attestation.AttestationProvider;
import io.statusmvp.pricefeed.error.FeedNotFoundException;
import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.FeedsConfig;
import io.statusmvp.pricefeed.feed.PublishPolicy;
import io.statusmvp.pricefeed.gating.PublishGate;
import io.statusmvp.pricefeed.ledger.PriceLedger;
import io.statusmvp.pricefeed.model.AggregatedPrice;
import io.statusmvp.pricefeed.model.PolicySummary;
import io.statusmvp.pricefeed.model.PublishStateView;
import io.statusmvp.pricefeed.model.ServiceInfo;
import io.statusmvp.pricefeed.model.SourceSummary;
import io.statusmvp.pricefeed.util.Hashing;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Service;

/** Read side of the engine for the HTTP surface. */
@Service
public class FeedQueryService {
  private final FeedsConfig config;
  private final LatestPriceStore latestPrices;
  private final PublishGate gate;
  private final PriceLedger ledger;
  private final AttestationProvider attestation;
  private final FeedPipeline pipeline;

  public FeedQueryService(
      FeedsConfig config,
      LatestPriceStore latestPrices,
      PublishGate gate,
      PriceLedger ledger,
      AttestationProvider attestation,
      FeedPipeline pipeline) {
    this.config = config;
    this.latestPrices = latestPrices;
    this.gate = gate;
    this.ledger = ledger;
    this.attestation = attestation;
    this.pipeline = pipeline;
  }

  public ServiceInfo info() {
    return new ServiceInfo(
        "ok",
        config.version(),
        config.enabledFeeds().stream().map(FeedSpec::id).toList(),
        config.updateInterval().toMillis(),
        ledger.mode(),
        attestation.source().name().toLowerCase(Locale.ROOT),
        "0x" + Hashing.hex(attestation.hash()));
  }

  public List<FeedSpec> feeds() {
    return config.feeds();
  }

  public List<SourceSummary> sources() {
    return config.sources().stream()
        .map(s -> new SourceSummary(s.id(), s.name(), s.weight()))
        .toList();
  }

  public PolicySummary policy() {
    PublishPolicy p = gate.policy();
    return new PolicySummary(
        p.thresholdBps(),
        p.hysteresisBps(),
        p.minInterval().toMillis(),
        p.maxPerMinute(),
        config.aggregation().method().name().toLowerCase(Locale.ROOT),
        config.aggregation().minSources(),
        config.aggregation().requireMajority());
  }

  public List<AggregatedPrice> prices() {
    return latestPrices.all();
  }

  public AggregatedPrice price(String symbol) {
    FeedSpec feed = requireFeed(symbol);
    return latestPrices
        .get(feed.id())
        .orElseThrow(
            () -> new FeedNotFoundException(feed.id(), "no aggregated price yet for " + feed.id()));
  }

  /** Gate state for a configured feed; a feed the gate has not seen yet reports a blank state. */
  public PublishStateView state(String symbol) {
    FeedSpec feed = requireFeed(symbol);
    return gate.state(feed.id())
        .orElseGet(() -> new PublishStateView(feed.id(), 0L, 0L, null, null, 0));
  }

  public FeedEvaluation evaluate(String symbol) {
    return pipeline.evaluate(requireFeed(symbol));
  }

  private FeedSpec requireFeed(String symbol) {
    return config
        .feed(symbol)
        .orElseThrow(() -> new FeedNotFoundException(symbol, "unknown feed: " + symbol));
  }
}
