package io.statusmvp.pricefeed.service;

import io.statusmvp.pricefeed.aggregation.Aggregator;
import io.statusmvp.pricefeed.client.SourceFetcher;
import io.statusmvp.pricefeed.error.FeedNotFoundException;
import io.statusmvp.pricefeed.error.InsufficientSourcesException;
import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.FeedsConfig;
import io.statusmvp.pricefeed.feed.SourceSpec;
import io.statusmvp.pricefeed.gating.GateDecision;
import io.statusmvp.pricefeed.gating.PublishGate;
import io.statusmvp.pricefeed.model.AggregatedPrice;
import io.statusmvp.pricefeed.model.Observation;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One fetch, aggregate and gate pass for a feed. Blocks the calling thread for at most the
 * slowest source timeout plus the ledger calls, so callers run it off the event loop.
 */
@Service
public class FeedPipeline {
  private static final Logger log = LoggerFactory.getLogger(FeedPipeline.class);
  private static final Duration DEADLINE_GRACE = Duration.ofSeconds(2);

  private final FeedsConfig config;
  private final SourceFetcher fetcher;
  private final Aggregator aggregator;
  private final PublishGate gate;
  private final LatestPriceStore latestPrices;
  private final FeedMetrics metrics;

  public FeedPipeline(
      FeedsConfig config,
      SourceFetcher fetcher,
      Aggregator aggregator,
      PublishGate gate,
      LatestPriceStore latestPrices,
      FeedMetrics metrics) {
    this.config = config;
    this.fetcher = fetcher;
    this.aggregator = aggregator;
    this.gate = gate;
    this.latestPrices = latestPrices;
    this.metrics = metrics;
  }

  public FeedEvaluation evaluate(String symbol) {
    FeedSpec feed =
        config
            .feed(symbol)
            .orElseThrow(() -> new FeedNotFoundException(symbol, "unknown feed: " + symbol));
    return evaluate(feed);
  }

  public FeedEvaluation evaluate(FeedSpec feed) {
    if (!feed.dataType().isNumeric()) {
      return FeedEvaluation.skipped(
          feed.id(), "data type " + feed.dataType().wireName() + " is not aggregated");
    }

    List<SourceSpec> sources = config.sourcesFor(feed);
    List<Observation> observations;
    try {
      observations = fetcher.fetchAll(feed, sources).block(fetchDeadline(sources));
    } catch (IllegalStateException e) {
      metrics.insufficientSources(feed.id());
      log.warn("{} fetch did not finish in time, skipping tick", feed.id());
      return FeedEvaluation.insufficient(feed.id(), List.of(), "fetch deadline exceeded");
    }
    if (observations == null) observations = List.of();
    for (Observation o : observations) {
      if (!o.isSuccess()) metrics.fetchFailure(o.sourceId());
    }

    AggregatedPrice price;
    try {
      price = aggregator.aggregate(feed, sources, observations);
    } catch (InsufficientSourcesException e) {
      metrics.insufficientSources(feed.id());
      log.warn("{}, skipping tick", e.getMessage());
      return FeedEvaluation.insufficient(feed.id(), observations, e.getMessage());
    }

    latestPrices.record(price);
    GateDecision decision = gate.evaluate(price);
    metrics.gateDecision(decision);
    log.debug(
        "evaluated {} price={} outcome={} change={}bps",
        feed.id(),
        price.price(),
        decision.outcome(),
        decision.changeBps());
    return FeedEvaluation.evaluated(price, decision, observations);
  }

  /** Every fetch carries its own timeout; this only guards against one that never signals. */
  static Duration fetchDeadline(List<SourceSpec> sources) {
    Duration longest = Duration.ZERO;
    for (SourceSpec s : sources) {
      if (s.timeout().compareTo(longest) > 0) longest = s.timeout();
    }
    return longest.plus(DEADLINE_GRACE);
  }
}
