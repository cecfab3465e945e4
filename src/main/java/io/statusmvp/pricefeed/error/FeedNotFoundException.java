package io.statusmvp.pricefeed.error;

import java.util.Map;

public class FeedNotFoundException extends FeedException {
  public FeedNotFoundException(String symbol, String message) {
    super(FeedErrorCode.FEED_NOT_FOUND, message, 404, Map.of("symbol", symbol), null);
  }
}
