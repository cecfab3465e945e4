package io.statusmvp.pricefeed.gating;

import io.statusmvp.pricefeed.error.LedgerException;
import io.statusmvp.pricefeed.error.PublishException;
import io.statusmvp.pricefeed.feed.PublishPolicy;
import io.statusmvp.pricefeed.ledger.LedgerPublishAdapter;
import io.statusmvp.pricefeed.ledger.LedgerReader;
import io.statusmvp.pricefeed.model.AggregatedPrice;
import io.statusmvp.pricefeed.model.LedgerRecord;
import io.statusmvp.pricefeed.model.PublishStateView;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides per symbol whether an aggregated price is worth anchoring on the ledger.
 *
 * <h3>Per evaluation</h3>
 *
 * <ol>
 *   <li>Skip while {@code minInterval} has not elapsed since the last publish, or while the last
 *       60 seconds already hold {@code maxPerMinute} publishes.
 *   <li>{@code changeBps = |price - lastPublished| * 10000 / |lastPublished|}; before the first
 *       round (round id 0) the change is unbounded.
 *   <li>Without a pending marker, a change of at least {@code thresholdBps} sets the marker and
 *       publishes nothing. With a marker, the change (still measured against the last
 *       <em>published</em> price) must be at least {@code hysteresisBps}; otherwise the marker is
 *       dropped as noise.
 *   <li>A confirmed move publishes round {@code lastRound + 1}. A rejected publish triggers one
 *       resync of the round id from the ledger and exactly one retry.
 *   <li>State changes only after a confirmed publish. A failed publish leaves the state as it was
 *       before the evaluation, pending marker included.
 * </ol>
 *
 * <p>Each symbol's state is guarded by its own lock, held across the ledger calls; symbols never
 * contend with each other.
 */
public class PublishGate {
  private static final Logger log = LoggerFactory.getLogger(PublishGate.class);
  static final Duration RATE_WINDOW = Duration.ofSeconds(60);

  private final PublishPolicy policy;
  private final LedgerReader reader;
  private final LedgerPublishAdapter publisher;
  private final Clock clock;
  private final ConcurrentMap<String, PublishState> states = new ConcurrentHashMap<>();

  public PublishGate(
      PublishPolicy policy, LedgerReader reader, LedgerPublishAdapter publisher, Clock clock) {
    this.policy = policy;
    this.reader = reader;
    this.publisher = publisher;
    this.clock = clock;
  }

  public PublishPolicy policy() {
    return policy;
  }

  public GateDecision evaluate(AggregatedPrice price) {
    PublishState state = stateFor(price.symbol());
    state.lock().lock();
    try {
      return evaluateLocked(state, price);
    } finally {
      state.lock().unlock();
    }
  }

  private GateDecision evaluateLocked(PublishState state, AggregatedPrice price) {
    String symbol = state.symbol();
    Instant now = clock.instant();

    Instant last = state.lastPublishedAt();
    if (last != null && Duration.between(last, now).compareTo(policy.minInterval()) < 0) {
      return GateDecision.of(symbol, GateOutcome.SKIPPED_MIN_INTERVAL, 0);
    }
    if (state.pruneRecent(now.minus(RATE_WINDOW)) >= policy.maxPerMinute()) {
      return GateDecision.of(symbol, GateOutcome.SKIPPED_RATE_LIMIT, 0);
    }

    long bps =
        state.lastRoundId() == 0
            ? Long.MAX_VALUE
            : changeBps(state.lastPublishedPrice(), price.price());
    Instant pendingSince = state.pendingSince();
    if (pendingSince == null) {
      if (bps < policy.thresholdBps()) {
        return GateDecision.of(symbol, GateOutcome.BELOW_THRESHOLD, bps);
      }
      state.markPending(now);
      log.debug("{} crossed threshold ({} bps), awaiting confirmation", symbol, bps);
      return GateDecision.of(symbol, GateOutcome.PENDING, bps);
    }

    state.clearPending();
    if (bps < policy.hysteresisBps()) {
      log.debug("{} move receded to {} bps, treated as noise", symbol, bps);
      return GateDecision.of(symbol, GateOutcome.NOISE_CLEARED, bps);
    }

    try {
      GateDecision decision = publish(state, price, bps, now);
      if (!decision.outcome().isPublish()) state.markPending(pendingSince);
      return decision;
    } catch (RuntimeException e) {
      state.markPending(pendingSince);
      throw e;
    }
  }

  private GateDecision publish(PublishState state, AggregatedPrice price, long bps, Instant now) {
    String symbol = state.symbol();
    long round = Math.max(1, state.lastRoundId() + 1);
    try {
      String txId = publisher.publish(price, round);
      return committed(state, price, bps, now, round, txId, false);
    } catch (PublishException first) {
      log.warn("publish failed symbol={} round={}, resyncing from ledger: {}", symbol, round, first.getMessage());
    }

    long ledgerRound;
    try {
      ledgerRound = reader.getLatest(symbol).roundId();
    } catch (LedgerException e) {
      log.warn("resync read failed symbol={}, deferring to next tick", symbol, e);
      return new GateDecision(symbol, GateOutcome.PUBLISH_FAILED, bps, round, null, false);
    }

    long retryRound = Math.max(state.lastRoundId(), ledgerRound) + 1;
    try {
      String txId = publisher.publish(price, retryRound);
      return committed(state, price, bps, now, retryRound, txId, true);
    } catch (PublishException second) {
      log.warn(
          "publish retry failed symbol={} round={}, deferring to next tick: {}",
          symbol,
          retryRound,
          second.getMessage());
      return new GateDecision(symbol, GateOutcome.PUBLISH_FAILED, bps, retryRound, null, true);
    }
  }

  private GateDecision committed(
      PublishState state,
      AggregatedPrice price,
      long bps,
      Instant now,
      long round,
      String txId,
      boolean resynced) {
    state.commitPublish(round, price.price(), now);
    log.info(
        "published symbol={} round={} price={} decimals={} change={}bps tx={}",
        state.symbol(),
        round,
        price.price(),
        price.decimals(),
        bps == Long.MAX_VALUE ? "first" : String.valueOf(bps),
        txId);
    return new GateDecision(state.symbol(), GateOutcome.PUBLISHED, bps, round, txId, resynced);
  }

  /** Seeds a symbol's baseline from a ledger record. Idempotent for the same record. */
  public void hydrate(String symbol, LedgerRecord record) {
    PublishState state = stateFor(symbol);
    state.lock().lock();
    try {
      state.hydrate(record.roundId(), record.price(), record.timestamp());
    } finally {
      state.lock().unlock();
    }
  }

  /**
   * Reads the symbol's latest ledger record and seeds the state from it.
   *
   * @throws LedgerException when the ledger cannot be read; the state is left untouched
   */
  public LedgerRecord hydrateFromLedger(String symbol) {
    LedgerRecord record = reader.getLatest(symbol);
    hydrate(symbol, record);
    return record;
  }

  public Optional<PublishStateView> state(String symbol) {
    PublishState state = states.get(symbol);
    if (state == null) return Optional.empty();
    state.lock().lock();
    try {
      state.pruneRecent(clock.instant().minus(RATE_WINDOW));
      return Optional.of(state.view());
    } finally {
      state.lock().unlock();
    }
  }

  private PublishState stateFor(String symbol) {
    return states.computeIfAbsent(symbol, PublishState::new);
  }

  /**
   * Relative change in basis points against {@code |lastPublished|}, rounded down. Any move away
   * from a zero baseline is {@link Long#MAX_VALUE}.
   */
  static long changeBps(long lastPublished, long next) {
    BigInteger base = BigInteger.valueOf(lastPublished).abs();
    BigInteger diff = BigInteger.valueOf(next).subtract(BigInteger.valueOf(lastPublished)).abs();
    if (base.signum() == 0) return diff.signum() == 0 ? 0 : Long.MAX_VALUE;
    BigInteger bps = diff.multiply(BigInteger.valueOf(10_000)).divide(base);
    return bps.bitLength() < 63 ? bps.longValue() : Long.MAX_VALUE;
  }
}
