package io.statusmvp.pricefeed.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.statusmvp.pricefeed.error.LedgerException;
import io.statusmvp.pricefeed.feed.DataType;
import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.PublishPolicy;
import io.statusmvp.pricefeed.gating.PublishGate;
import io.statusmvp.pricefeed.ledger.LedgerPublishAdapter;
import io.statusmvp.pricefeed.ledger.LedgerReader;
import io.statusmvp.pricefeed.model.LedgerRecord;
import io.statusmvp.pricefeed.model.PublishStateView;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FeedSchedulerTest {
  private static final FeedSpec BTC = feed("BTC-USD");
  private static final FeedSpec ETH = feed("ETH-USD");

  private FeedPipeline pipeline;
  private PublishGate gate;
  private Map<String, FeedSpec> feeds;

  @BeforeEach
  void setUp() {
    pipeline = mock(FeedPipeline.class);
    gate = mock(PublishGate.class);
    feeds = new LinkedHashMap<>();
    feeds.put(BTC.id(), BTC);
    feeds.put(ETH.id(), ETH);
  }

  @Test
  void hydrationFailureForOneSymbolDoesNotBlockOthers() {
    when(gate.hydrateFromLedger("BTC-USD")).thenThrow(new LedgerException("BTC-USD", "rpc down", null));
    when(gate.hydrateFromLedger("ETH-USD")).thenReturn(new LedgerRecord("ETH-USD", 3, 300_000L, null));

    int hydrated = scheduler(Runnable::run, true).hydrateAll();

    assertEquals(1, hydrated);
    verify(gate).hydrateFromLedger("ETH-USD");
  }

  @Test
  void failingFeedDoesNotStopSiblings() {
    when(pipeline.evaluate(BTC)).thenThrow(new IllegalStateException("boom"));

    scheduler(Runnable::run, true).tick();

    verify(pipeline).evaluate(BTC);
    verify(pipeline).evaluate(ETH);
  }

  @Test
  void busyFeedKeepsAtMostOneQueuedPass() {
    List<Runnable> queued = new ArrayList<>();
    FeedScheduler scheduler = scheduler(queued::add, true);

    scheduler.tick();
    scheduler.tick();
    scheduler.tick();
    assertEquals(4, queued.size());

    queued.forEach(Runnable::run);
    queued.clear();
    scheduler.tick();
    assertEquals(2, queued.size());
    verify(pipeline, times(2)).evaluate(BTC);
  }

  @Test
  void startHydratesAndStopHalts() {
    when(gate.hydrateFromLedger(any())).thenReturn(LedgerRecord.empty("X"));
    FeedScheduler scheduler = scheduler(Runnable::run, true);

    scheduler.start();
    try {
      assertTrue(scheduler.isRunning());
      verify(gate).hydrateFromLedger("BTC-USD");
      verify(gate).hydrateFromLedger("ETH-USD");
    } finally {
      scheduler.stop();
    }
    assertFalse(scheduler.isRunning());
  }

  @Test
  void symbolWithoutBaselineIsRetriedAndSkippedUntilHydrated() {
    when(gate.hydrateFromLedger("BTC-USD"))
        .thenThrow(new LedgerException("BTC-USD", "rpc down", null))
        .thenThrow(new LedgerException("BTC-USD", "rpc down", null))
        .thenReturn(new LedgerRecord("BTC-USD", 7, 10_000L, null));
    when(gate.hydrateFromLedger("ETH-USD")).thenReturn(new LedgerRecord("ETH-USD", 3, 300_000L, null));
    FeedScheduler scheduler = scheduler(Runnable::run, true);

    scheduler.hydrateAll();
    assertFalse(scheduler.isHydrated("BTC-USD"));

    scheduler.tick();
    verify(pipeline, never()).evaluate(BTC);
    verify(pipeline).evaluate(ETH);

    scheduler.tick();
    assertTrue(scheduler.isHydrated("BTC-USD"));
    verify(pipeline).evaluate(BTC);
    verify(gate, times(3)).hydrateFromLedger("BTC-USD");
    verify(gate, times(1)).hydrateFromLedger("ETH-USD");
  }

  @Test
  void lateHydrationSeedsTheLedgerBaseline() {
    LedgerReader reader = mock(LedgerReader.class);
    when(reader.getLatest("BTC-USD"))
        .thenThrow(new LedgerException("BTC-USD", "rpc down", null))
        .thenReturn(new LedgerRecord("BTC-USD", 7, 10_000L, Instant.parse("2025-01-01T00:00:00Z")));
    when(reader.getLatest("ETH-USD")).thenReturn(LedgerRecord.empty("ETH-USD"));
    PublishGate realGate =
        new PublishGate(
            PublishPolicy.defaults(), reader, mock(LedgerPublishAdapter.class), Clock.systemUTC());
    FeedScheduler scheduler =
        new FeedScheduler(feeds, Duration.ofHours(1), pipeline, realGate, Runnable::run, 4, true);

    scheduler.hydrateAll();
    assertTrue(realGate.state("BTC-USD").isEmpty());

    scheduler.tick();

    PublishStateView state = realGate.state("BTC-USD").orElseThrow();
    assertEquals(7, state.lastRoundId());
    assertEquals(10_000L, state.lastPublishedPrice());
    verify(pipeline).evaluate(BTC);
  }

  @Test
  void feedWithLongerIntervalRunsOnEveryNthTick() {
    FeedSpec slow =
        new FeedSpec(
            "SOL-USD", "SOL-USD", "", "", "", DataType.PRICE, 8, List.of("binance"), true, Duration.ofMinutes(150));
    feeds.put(slow.id(), slow);
    FeedScheduler scheduler = scheduler(Runnable::run, true);

    assertEquals(3, scheduler.ticksPerPass(slow));
    assertEquals(1, scheduler.ticksPerPass(BTC));
    for (int i = 0; i < 6; i++) scheduler.tick();

    verify(pipeline, times(2)).evaluate(slow);
    verify(pipeline, times(6)).evaluate(BTC);
  }

  @Test
  void ownedWorkerPoolRunsMoreFeedsThanThreads() throws Exception {
    feeds.clear();
    for (int i = 0; i < 20; i++) {
      FeedSpec f = feed("F" + i + "-USD");
      feeds.put(f.id(), f);
    }
    when(gate.hydrateFromLedger(any())).thenReturn(LedgerRecord.empty("X"));
    CountDownLatch done = new CountDownLatch(20);
    when(pipeline.evaluate(any(FeedSpec.class)))
        .thenAnswer(
            invocation -> {
              Thread.sleep(20);
              done.countDown();
              return null;
            });
    FeedScheduler scheduler =
        new FeedScheduler(feeds, Duration.ofHours(1), pipeline, gate, null, 2, true);

    scheduler.start();
    try {
      scheduler.tick();
      assertTrue(done.await(10, TimeUnit.SECONDS));
    } finally {
      scheduler.stop();
    }
  }

  @Test
  void disabledSchedulerDoesNothing() {
    FeedScheduler scheduler = scheduler(Runnable::run, false);

    scheduler.start();

    assertFalse(scheduler.isRunning());
    verify(gate, never()).hydrateFromLedger(any());
  }

  private FeedScheduler scheduler(java.util.concurrent.Executor workers, boolean enabled) {
    return new FeedScheduler(feeds, Duration.ofHours(1), pipeline, gate, workers, 4, enabled);
  }

  private static FeedSpec feed(String id) {
    return new FeedSpec(id, id, "", "", "", DataType.PRICE, 8, List.of("binance"), true);
  }
}
