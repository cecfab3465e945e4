package io.statusmvp.pricefeed.ledger;

/** A ledger client that can both read and write; what the Spring context wires. */
public interface PriceLedger extends LedgerReader, LedgerWriter {

  /** Short name for diagnostics, e.g. {@code memory} or {@code web3}. */
  String mode();
}
