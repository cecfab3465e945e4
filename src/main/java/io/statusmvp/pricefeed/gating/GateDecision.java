package io.statusmvp.pricefeed.gating;

/**
 * Result of one gate evaluation. {@code roundId} and {@code txId} are set for {@link
 * GateOutcome#PUBLISHED}; {@code roundId} is the last attempted round for {@link
 * GateOutcome#PUBLISH_FAILED}.
 */
public record GateDecision(
    String symbol, GateOutcome outcome, long changeBps, long roundId, String txId, boolean resynced) {

  static GateDecision of(String symbol, GateOutcome outcome, long changeBps) {
    return new GateDecision(symbol, outcome, changeBps, 0L, null, false);
  }
}
