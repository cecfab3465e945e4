package io.statusmvp.pricefeed.service;

import io.statusmvp.pricefeed.gating.GateDecision;
import io.statusmvp.pricefeed.model.AggregatedPrice;
import io.statusmvp.pricefeed.model.Observation;
import java.util.List;

/** Outcome of one pipeline pass for one feed. */
public record FeedEvaluation(
    String symbol,
    Status status,
    AggregatedPrice price,
    GateDecision decision,
    List<Observation> observations,
    String message) {

  public enum Status {
    EVALUATED,
    INSUFFICIENT_SOURCES,
    SKIPPED
  }

  public FeedEvaluation {
    observations = observations == null ? List.of() : List.copyOf(observations);
  }

  static FeedEvaluation evaluated(
      AggregatedPrice price, GateDecision decision, List<Observation> observations) {
    return new FeedEvaluation(
        price.symbol(), Status.EVALUATED, price, decision, observations, null);
  }

  static FeedEvaluation insufficient(
      String symbol, List<Observation> observations, String message) {
    return new FeedEvaluation(
        symbol, Status.INSUFFICIENT_SOURCES, null, null, observations, message);
  }

  static FeedEvaluation skipped(String symbol, String message) {
    return new FeedEvaluation(symbol, Status.SKIPPED, null, null, List.of(), message);
  }
}
