package io.statusmvp.pricefeed.service;

import io.statusmvp.pricefeed.config.FeedProperties;
import io.statusmvp.pricefeed.feed.FeedSpec;
import io.statusmvp.pricefeed.feed.FeedsConfig;
import io.statusmvp.pricefeed.gating.PublishGate;
import io.statusmvp.pricefeed.model.LedgerRecord;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Periodic driver. On start it seeds every enabled feed's gate state from the ledger, then runs
 * one pipeline pass per feed on each tick. Feeds run independently; a failure in one never reaches
 * the others.
 *
 * <p>At most one pass per feed waits behind a running one. Further ticks for a feed that is still
 * busy are dropped. A feed with its own {@code update_interval} runs on every Nth tick, N being
 * that interval divided by the tick interval, rounded up.
 *
 * <p>A symbol whose hydration failed is not gated: each of its passes first retries the ledger
 * read and is skipped until one succeeds.
 */
@Component
public class FeedScheduler implements SmartLifecycle {
  private static final Logger log = LoggerFactory.getLogger(FeedScheduler.class);
  private static final int MAX_PASSES_PER_FEED = 2;

  private final Map<String, FeedSpec> feeds;
  private final Duration interval;
  private final FeedPipeline pipeline;
  private final PublishGate gate;
  private final int workerThreads;
  private final boolean enabled;
  private final ConcurrentMap<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
  private final Set<String> unhydrated = ConcurrentHashMap.newKeySet();
  private final AtomicLong ticks = new AtomicLong();

  private volatile Executor workers;
  private ExecutorService ownedWorkers;
  private ScheduledExecutorService ticker;
  private volatile boolean running;

  @Autowired
  public FeedScheduler(
      FeedsConfig config, FeedPipeline pipeline, PublishGate gate, FeedProperties properties) {
    this(
        byId(config.enabledFeeds()),
        config.updateInterval(),
        pipeline,
        gate,
        null,
        properties.getWorkerThreads(),
        properties.isSchedulerEnabled());
  }

  /** {@code workers} may be null, in which case {@link #start()} creates and owns a pool. */
  FeedScheduler(
      Map<String, FeedSpec> feeds,
      Duration interval,
      FeedPipeline pipeline,
      PublishGate gate,
      Executor workers,
      int workerThreads,
      boolean enabled) {
    this.feeds = Collections.unmodifiableMap(new LinkedHashMap<>(feeds));
    this.interval = interval;
    this.pipeline = pipeline;
    this.gate = gate;
    this.workers = workers;
    this.workerThreads = Math.max(1, workerThreads);
    this.enabled = enabled;
  }

  @Override
  public synchronized void start() {
    if (running) return;
    if (!enabled) {
      log.info("feed scheduler disabled (app.feeds.scheduler-enabled=false)");
      return;
    }
    if (workers == null) {
      AtomicInteger n = new AtomicInteger();
      ownedWorkers =
          Executors.newFixedThreadPool(
              Math.min(workerThreads, Math.max(1, feeds.size())),
              r -> daemon(r, "feed-worker-" + n.incrementAndGet()));
      workers = ownedWorkers;
    }
    hydrateAll();
    ticker = Executors.newSingleThreadScheduledExecutor(r -> daemon(r, "feed-scheduler"));
    long periodMs = Math.max(1, interval.toMillis());
    ticker.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
    running = true;
    log.info("feed scheduler started: {} feeds every {}", feeds.size(), interval);
  }

  @Override
  public synchronized void stop() {
    if (!running) return;
    running = false;
    shutdown(ticker);
    if (ownedWorkers != null) {
      shutdown(ownedWorkers);
      ownedWorkers = null;
      workers = null;
    }
    log.info("feed scheduler stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Seeds gate state for every feed. Returns how many feeds were hydrated. */
  int hydrateAll() {
    int hydrated = 0;
    for (String symbol : feeds.keySet()) {
      if (hydrate(symbol)) hydrated++;
    }
    log.info("hydrated {}/{} feeds from ledger", hydrated, feeds.size());
    return hydrated;
  }

  boolean isHydrated(String symbol) {
    return !unhydrated.contains(symbol);
  }

  /** Dispatches one pass per feed that is due on this tick. */
  void tick() {
    long tick = ticks.getAndIncrement();
    for (FeedSpec feed : feeds.values()) {
      if (tick % ticksPerPass(feed) != 0) continue;
      AtomicInteger count = inFlight.computeIfAbsent(feed.id(), id -> new AtomicInteger());
      if (count.incrementAndGet() > MAX_PASSES_PER_FEED) {
        count.decrementAndGet();
        log.debug("{} still busy, dropping tick", feed.id());
        continue;
      }
      try {
        workers.execute(() -> runFeed(feed, count));
      } catch (RuntimeException e) {
        count.decrementAndGet();
        log.error("could not dispatch {}", feed.id(), e);
      }
    }
  }

  long ticksPerPass(FeedSpec feed) {
    Duration own = feed.updateInterval();
    if (own == null || own.compareTo(interval) <= 0) return 1;
    long tickMs = Math.max(1, interval.toMillis());
    return (own.toMillis() + tickMs - 1) / tickMs;
  }

  private void runFeed(FeedSpec feed, AtomicInteger count) {
    try {
      if (unhydrated.contains(feed.id()) && !hydrate(feed.id())) {
        log.debug("{} has no ledger baseline yet, skipping pass", feed.id());
        return;
      }
      pipeline.evaluate(feed);
    } catch (Exception e) {
      log.error("pipeline failed for {}", feed.id(), e);
    } finally {
      count.decrementAndGet();
    }
  }

  private boolean hydrate(String symbol) {
    try {
      LedgerRecord record = gate.hydrateFromLedger(symbol);
      if (unhydrated.remove(symbol)) {
        log.info("hydrated {} after earlier failure, round={}", symbol, record.roundId());
      } else {
        log.debug("hydrated {} round={} price={}", symbol, record.roundId(), record.price());
      }
      return true;
    } catch (RuntimeException e) {
      if (unhydrated.add(symbol)) {
        log.warn("hydration failed for {}, not gating it until the ledger answers: {}", symbol, e.getMessage());
      }
      return false;
    }
  }

  private static void shutdown(ExecutorService executor) {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static Thread daemon(Runnable r, String name) {
    Thread t = new Thread(r, name);
    t.setDaemon(true);
    return t;
  }

  private static Map<String, FeedSpec> byId(List<FeedSpec> feeds) {
    Map<String, FeedSpec> out = new LinkedHashMap<>();
    for (FeedSpec f : feeds) out.put(f.id(), f);
    return out;
  }
}
