package io.statusmvp.pricefeed.feed;

import java.time.Duration;

/** Process-wide publish gating parameters; bps values are basis points (1 bps = 0.01%). */
public record PublishPolicy(
    int thresholdBps, int hysteresisBps, Duration minInterval, int maxPerMinute) {

  public static final int DEFAULT_THRESHOLD_BPS = 10;
  public static final int DEFAULT_HYSTERESIS_BPS = 8;
  public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(5);
  public static final int DEFAULT_MAX_PER_MINUTE = 30;

  public static PublishPolicy defaults() {
    return new PublishPolicy(
        DEFAULT_THRESHOLD_BPS, DEFAULT_HYSTERESIS_BPS, DEFAULT_MIN_INTERVAL, DEFAULT_MAX_PER_MINUTE);
  }
}
