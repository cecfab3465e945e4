package io.statusmvp.pricefeed.ledger;

import io.statusmvp.pricefeed.attestation.AttestationProvider;
import io.statusmvp.pricefeed.model.AggregatedPrice;

/**
 * Turns a confirmed publish decision into a ledger update bound to this process's attestation
 * identity and to the contributing source set.
 */
public class LedgerPublishAdapter {
  private final LedgerWriter writer;
  private final byte[] attestationHash;

  public LedgerPublishAdapter(LedgerWriter writer, AttestationProvider attestation) {
    this.writer = writer;
    this.attestationHash = attestation.hash();
  }

  /** @return ledger transaction id */
  public String publish(AggregatedPrice price, long roundId) {
    return writer.update(
        price.symbol(),
        roundId,
        price.price(),
        price.timestamp(),
        attestationHash.clone(),
        SourceSetIds.of(price.contributingSourceIds()));
  }
}
