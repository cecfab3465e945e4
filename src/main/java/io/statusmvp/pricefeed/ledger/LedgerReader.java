package io.statusmvp.pricefeed.ledger;

import io.statusmvp.pricefeed.error.LedgerException;
import io.statusmvp.pricefeed.model.LedgerRecord;

public interface LedgerReader {

  /**
   * Latest published record for {@code symbol}; {@link LedgerRecord#empty} when nothing was
   * published yet.
   *
   * @throws LedgerException when the ledger cannot be read
   */
  LedgerRecord getLatest(String symbol);
}
