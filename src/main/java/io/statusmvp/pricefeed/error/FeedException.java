package io.statusmvp.pricefeed.error;

import java.util.Map;

public class FeedException extends RuntimeException {
  private final FeedErrorCode code;
  private final int httpStatus;
  private final Map<String, Object> details;

  public FeedException(FeedErrorCode code, String message, int httpStatus) {
    this(code, message, httpStatus, Map.of(), null);
  }

  public FeedException(
      FeedErrorCode code,
      String message,
      int httpStatus,
      Map<String, Object> details,
      Throwable cause) {
    super(message, cause);
    this.code = code;
    this.httpStatus = httpStatus;
    this.details = details == null ? Map.of() : details;
  }

  public FeedErrorCode getCode() {
    return code;
  }

  public int getHttpStatus() {
    return httpStatus;
  }

  public Map<String, Object> getDetails() {
    return details;
  }
}
