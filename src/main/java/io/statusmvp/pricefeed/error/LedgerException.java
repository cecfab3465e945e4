package io.statusmvp.pricefeed.error;

import java.util.Map;

public class LedgerException extends FeedException {
  public LedgerException(String symbol, String message, Throwable cause) {
    super(FeedErrorCode.LEDGER_UNAVAILABLE, message, 503, Map.of("symbol", symbol), cause);
  }
}
