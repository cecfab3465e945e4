package io.statusmvp.pricefeed.error;

import java.util.Map;

public class FetchException extends FeedException {
  private final String sourceId;

  public FetchException(String sourceId, String message) {
    this(sourceId, message, null);
  }

  public FetchException(String sourceId, String message, Throwable cause) {
    super(FeedErrorCode.FETCH_FAILED, message, 502, Map.of("source", sourceId), cause);
    this.sourceId = sourceId;
  }

  public String getSourceId() {
    return sourceId;
  }
}
