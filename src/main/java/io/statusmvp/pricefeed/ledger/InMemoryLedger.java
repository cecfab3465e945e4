package io.statusmvp.pricefeed.ledger;

import io.statusmvp.pricefeed.error.PublishException;
import io.statusmvp.pricefeed.model.LedgerRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local ledger. Applies the same round rule as the on-chain contract, so duplicate or
 * skipped rounds are rejected. Used when no chain is configured and in tests.
 */
public class InMemoryLedger implements PriceLedger {

  public record Entry(LedgerRecord record, byte[] attestationHash, byte[] sourceSetId, String txId) {}

  private final Map<String, List<Entry>> entries = new HashMap<>();

  @Override
  public String mode() {
    return "memory";
  }

  @Override
  public synchronized LedgerRecord getLatest(String symbol) {
    List<Entry> list = entries.get(symbol);
    if (list == null || list.isEmpty()) return LedgerRecord.empty(symbol);
    return list.get(list.size() - 1).record();
  }

  @Override
  public synchronized String update(
      String symbol,
      long roundId,
      long price,
      Instant timestamp,
      byte[] attestationHash,
      byte[] sourceSetId) {
    long latest = getLatest(symbol).roundId();
    if (roundId != latest + 1) {
      throw new PublishException(
          symbol, roundId, "round conflict for " + symbol + ": got " + roundId + ", latest " + latest);
    }
    String txId = "mem-" + symbol + "-" + roundId;
    entries
        .computeIfAbsent(symbol, k -> new ArrayList<>())
        .add(
            new Entry(
                new LedgerRecord(symbol, roundId, price, timestamp),
                attestationHash == null ? new byte[0] : attestationHash.clone(),
                sourceSetId == null ? new byte[0] : sourceSetId.clone(),
                txId));
    return txId;
  }

  public synchronized List<Entry> history(String symbol) {
    return List.copyOf(entries.getOrDefault(symbol, List.of()));
  }
}
