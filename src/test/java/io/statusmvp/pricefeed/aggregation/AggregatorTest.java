package io.statusmvp.pricefeed.aggregation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.statusmvp.pricefeed.error.InsufficientSourcesException;
import io.statusmvp.pricefeed.feed.AggregationSettings;
import io.statusmvp.pricefeed.feed.DataType;
import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.SourceSpec;
import io.statusmvp.pricefeed.model.AggregatedPrice;
import io.statusmvp.pricefeed.model.Observation;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AggregatorTest {
  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
  private static final FeedSpec BTC =
      new FeedSpec("BTC-USD", "Bitcoin", "", "BTC", "USD", DataType.PRICE, 8, List.of("a", "b", "c"), true);
  private static final List<SourceSpec> SOURCES = List.of(source("a", 1), source("b", 1), source("c", 2));

  @Test
  void weightedMeanAtFeedPrecision() {
    Aggregator aggregator = aggregator(AggregationSettings.defaults());

    AggregatedPrice price =
        aggregator.aggregate(BTC, SOURCES, List.of(ok("a", "100"), ok("b", "101"), ok("c", "102")));

    // (100 + 101 + 2 * 102) / 4 = 101.25
    assertEquals(10_125_000_000L, price.price());
    assertEquals(8, price.decimals());
    assertEquals(NOW, price.timestamp());
    assertEquals(List.of("a", "b", "c"), price.contributingSourceIds());
  }

  @Test
  void failedObservationsAreDroppedAndOrderFollowsDeclaration() {
    Aggregator aggregator = aggregator(AggregationSettings.defaults());

    AggregatedPrice price =
        aggregator.aggregate(
            BTC, SOURCES, List.of(ok("c", "3"), failed("b"), ok("a", "1")));

    // (1 + 2 * 3) / 3
    assertEquals(233_333_333L, price.price());
    assertEquals(List.of("a", "c"), price.contributingSourceIds());
  }

  @Test
  void roundsHalfUpAtDecimals() {
    FeedSpec twoDecimals =
        new FeedSpec("ETH-USD", "Ether", "", "ETH", "USD", DataType.PRICE, 2, List.of("a"), true);
    AggregatedPrice price =
        aggregator(AggregationSettings.defaults())
            .aggregate(twoDecimals, List.of(source("a", 1)), List.of(ok("a", "3012.345")));
    assertEquals(301_235L, price.price());
  }

  @Test
  void allSourcesFailingIsInsufficient() {
    InsufficientSourcesException e =
        assertThrows(
            InsufficientSourcesException.class,
            () ->
                aggregator(AggregationSettings.defaults())
                    .aggregate(BTC, SOURCES, List.of(failed("a"), failed("b"), failed("c"))));
    assertEquals(0, e.getSuccessful());
    assertEquals(1, e.getRequired());
    assertEquals("BTC-USD", e.getSymbol());
  }

  @Test
  void quorumHonoursMinSourcesAndMajority() {
    List<Observation> oneOk = List.of(ok("a", "100"), failed("b"), failed("c"));

    assertThrows(
        InsufficientSourcesException.class,
        () ->
            aggregator(new AggregationSettings(AggregationSettings.Method.WEIGHTED_MEAN, 2, false))
                .aggregate(BTC, SOURCES, oneOk));

    InsufficientSourcesException e =
        assertThrows(
            InsufficientSourcesException.class,
            () ->
                aggregator(new AggregationSettings(AggregationSettings.Method.WEIGHTED_MEAN, 1, true))
                    .aggregate(BTC, SOURCES, oneOk));
    assertEquals(2, e.getRequired());

    AggregatedPrice price =
        aggregator(new AggregationSettings(AggregationSettings.Method.WEIGHTED_MEAN, 1, true))
            .aggregate(BTC, SOURCES, List.of(ok("a", "100"), ok("b", "100"), failed("c")));
    assertEquals(10_000_000_000L, price.price());
  }

  @Test
  void observationsFromUndeclaredSourcesAreIgnored() {
    AggregatedPrice price =
        aggregator(AggregationSettings.defaults())
            .aggregate(BTC, SOURCES, List.of(ok("a", "100"), ok("rogue", "1")));
    assertEquals(List.of("a"), price.contributingSourceIds());
    assertEquals(10_000_000_000L, price.price());
  }

  @Test
  void medianCombinerIsSelectable() {
    Aggregator aggregator =
        aggregator(new AggregationSettings(AggregationSettings.Method.WEIGHTED_MEDIAN, 1, false));

    AggregatedPrice price =
        aggregator.aggregate(BTC, SOURCES, List.of(ok("a", "100"), ok("b", "500"), ok("c", "101")));

    // expanded: 100, 101, 101, 500 -> (101 + 101) / 2
    assertEquals(10_100_000_000L, price.price());
  }

  private static Aggregator aggregator(AggregationSettings settings) {
    return new Aggregator(PriceCombiner.forMethod(settings.method()), settings, CLOCK);
  }

  private static Observation ok(String source, String value) {
    return Observation.success(source, new BigDecimal(value), NOW);
  }

  private static Observation failed(String source) {
    return Observation.failed(source, "boom", NOW);
  }

  private static SourceSpec source(String id, int weight) {
    return new SourceSpec(
        id, id, "https://" + id + ".example/{pair}", "price", weight, Duration.ofSeconds(5), Map.of(), "", "", "");
  }
}
