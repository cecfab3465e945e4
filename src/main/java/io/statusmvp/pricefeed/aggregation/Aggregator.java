package io.statusmvp.pricefeed.aggregation;

import io.statusmvp.pricefeed.error.InsufficientSourcesException;
import io.statusmvp.pricefeed.feed.AggregationSettings;
import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.SourceSpec;
import io.statusmvp.pricefeed.model.AggregatedPrice;
import io.statusmvp.pricefeed.model.Observation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Drops failed observations, enforces the quorum and combines the rest at the feed's fixed-point
 * precision. Never falls back to a stale value: a missed quorum is an {@link
 * InsufficientSourcesException}.
 */
public class Aggregator {
  private final PriceCombiner combiner;
  private final AggregationSettings settings;
  private final Clock clock;

  public Aggregator(PriceCombiner combiner, AggregationSettings settings, Clock clock) {
    this.combiner = combiner;
    this.settings = settings;
    this.clock = clock;
  }

  public AggregatedPrice aggregate(
      FeedSpec feed, List<SourceSpec> sources, List<Observation> observations) {
    Map<String, Observation> bySource = new HashMap<>();
    for (Observation o : observations) {
      if (o != null && o.isSuccess()) bySource.putIfAbsent(o.sourceId(), o);
    }

    // Walk the declared sources so contributing ids keep declaration order.
    List<WeightedValue> values = new ArrayList<>();
    List<String> contributing = new ArrayList<>();
    for (SourceSpec source : sources) {
      Observation o = bySource.get(source.id());
      if (o == null) continue;
      values.add(new WeightedValue(source.id(), o.value(), source.weight()));
      contributing.add(source.id());
    }

    int required = settings.requiredSuccesses(sources.size());
    if (values.size() < required || values.isEmpty()) {
      throw new InsufficientSourcesException(feed.id(), values.size(), Math.max(1, required));
    }

    BigDecimal combined = combiner.combine(values);
    long fixedPoint;
    try {
      fixedPoint =
          combined.movePointRight(feed.decimals()).setScale(0, RoundingMode.HALF_UP).longValueExact();
    } catch (ArithmeticException e) {
      throw new IllegalStateException(
          "aggregated value " + combined.toPlainString() + " overflows " + feed.decimals() + " decimals for " + feed.id(),
          e);
    }
    return new AggregatedPrice(feed.id(), fixedPoint, feed.decimals(), clock.instant(), contributing);
  }
}
