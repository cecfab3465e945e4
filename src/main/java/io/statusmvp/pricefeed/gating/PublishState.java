package io.statusmvp.pricefeed.gating;

import io.statusmvp.pricefeed.model.PublishStateView;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Gating state of one symbol. Every read-modify-write happens under {@link #lock()}; overlapping
 * ticks for the same symbol serialise on it.
 */
final class PublishState {
  private final String symbol;
  private final ReentrantLock lock = new ReentrantLock();

  private long lastRoundId;
  private long lastPublishedPrice;
  private Instant lastPublishedAt;
  private Instant pendingSince;
  private final Deque<Instant> recentPublishTimes = new ArrayDeque<>();

  PublishState(String symbol) {
    this.symbol = symbol;
  }

  ReentrantLock lock() {
    return lock;
  }

  String symbol() {
    return symbol;
  }

  long lastRoundId() {
    return lastRoundId;
  }

  long lastPublishedPrice() {
    return lastPublishedPrice;
  }

  Instant lastPublishedAt() {
    return lastPublishedAt;
  }

  Instant pendingSince() {
    return pendingSince;
  }

  void markPending(Instant since) {
    this.pendingSince = since;
  }

  void clearPending() {
    this.pendingSince = null;
  }

  /** Drops publish times at or before {@code cutoff}; returns how many remain. */
  int pruneRecent(Instant cutoff) {
    while (!recentPublishTimes.isEmpty() && !recentPublishTimes.peekFirst().isAfter(cutoff)) {
      recentPublishTimes.pollFirst();
    }
    return recentPublishTimes.size();
  }

  void commitPublish(long roundId, long price, Instant at) {
    this.lastRoundId = Math.max(lastRoundId, roundId);
    this.lastPublishedPrice = price;
    this.lastPublishedAt = at;
    this.pendingSince = null;
    this.recentPublishTimes.addLast(at);
  }

  /** Replaces the baseline with the ledger's view. Repeating it with the same input is a no-op. */
  void hydrate(long roundId, long price, Instant publishedAt) {
    this.lastRoundId = Math.max(0, roundId);
    this.lastPublishedPrice = roundId > 0 ? price : 0;
    this.lastPublishedAt = roundId > 0 ? publishedAt : null;
    this.pendingSince = null;
    this.recentPublishTimes.clear();
  }

  PublishStateView view() {
    return new PublishStateView(
        symbol,
        lastRoundId,
        lastPublishedPrice,
        lastPublishedAt,
        pendingSince,
        recentPublishTimes.size());
  }
}
