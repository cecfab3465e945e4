package io.statusmvp.pricefeed.model;

import java.math.BigDecimal;
import java.time.Instant;

/** Result of one fetch from one source. Exactly one of {@code value} / {@code error} is set. */
public record Observation(String sourceId, BigDecimal value, Instant fetchedAt, String error) {

  public static Observation success(String sourceId, BigDecimal value, Instant fetchedAt) {
    return new Observation(sourceId, value, fetchedAt, null);
  }

  public static Observation failed(String sourceId, String error, Instant fetchedAt) {
    return new Observation(sourceId, null, fetchedAt, error == null ? "unknown error" : error);
  }

  public boolean isSuccess() {
    return error == null && value != null;
  }
}
