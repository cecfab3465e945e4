package io.statusmvp.pricefeed.error;

import java.util.Map;

public class InsufficientSourcesException extends FeedException {
  private final String symbol;
  private final int successful;
  private final int required;

  public InsufficientSourcesException(String symbol, int successful, int required) {
    super(
        FeedErrorCode.INSUFFICIENT_SOURCES,
        "insufficient sources for " + symbol + ": " + successful + " of " + required + " required",
        503,
        Map.of("symbol", symbol, "successful", successful, "required", required),
        null);
    this.symbol = symbol;
    this.successful = successful;
    this.required = required;
  }

  public String getSymbol() {
    return symbol;
  }

  public int getSuccessful() {
    return successful;
  }

  public int getRequired() {
    return required;
  }
}
