package io.statusmvp.pricefeed.model;

import java.time.Instant;

/** Latest published record for a symbol as seen on the ledger. Round 0 means nothing published. */
public record LedgerRecord(String symbol, long roundId, long price, Instant timestamp) {

  public static LedgerRecord empty(String symbol) {
    return new LedgerRecord(symbol, 0L, 0L, null);
  }

  public boolean isEmpty() {
    return roundId <= 0;
  }
}
