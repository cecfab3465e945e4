package io.statusmvp.pricefeed.error;

import java.util.Map;

public class PublishException extends FeedException {
  private final String symbol;
  private final long roundId;

  public PublishException(String symbol, long roundId, String message) {
    this(symbol, roundId, message, null);
  }

  public PublishException(String symbol, long roundId, String message, Throwable cause) {
    super(
        FeedErrorCode.PUBLISH_FAILED,
        message,
        502,
        Map.of("symbol", symbol, "roundId", roundId),
        cause);
    this.symbol = symbol;
    this.roundId = roundId;
  }

  public String getSymbol() {
    return symbol;
  }

  public long getRoundId() {
    return roundId;
  }
}
