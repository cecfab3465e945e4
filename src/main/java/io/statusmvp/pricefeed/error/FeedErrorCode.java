package io.statusmvp.pricefeed.error;

public enum FeedErrorCode {
  CONFIG_INVALID,
  FETCH_FAILED,
  INSUFFICIENT_SOURCES,
  PUBLISH_FAILED,
  LEDGER_UNAVAILABLE,
  FEED_NOT_FOUND
}
