package io.statusmvp.pricefeed.ledger;

import io.statusmvp.pricefeed.error.PublishException;
import java.time.Instant;

public interface LedgerWriter {

  /**
   * Submits one signed update. The ledger rejects a round that is not exactly one past its latest
   * round for the symbol.
   *
   * @return ledger transaction id
   * @throws PublishException on rejection or transport failure
   */
  String update(
      String symbol,
      long roundId,
      long price,
      Instant timestamp,
      byte[] attestationHash,
      byte[] sourceSetId);
}
