package io.statusmvp.pricefeed.gating;

public enum GateOutcome {
  SKIPPED_MIN_INTERVAL,
  SKIPPED_RATE_LIMIT,
  BELOW_THRESHOLD,
  PENDING,
  NOISE_CLEARED,
  PUBLISHED,
  PUBLISH_FAILED;

  public boolean isPublish() {
    return this == PUBLISHED;
  }
}
