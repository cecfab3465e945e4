package io.statusmvp.pricefeed.ledger;

import io.statusmvp.pricefeed.util.Hashing;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Identifier of the source composition behind a price: SHA-256 over the sorted source ids joined
 * with {@code ","}. Independent of input order; raw source names never reach the ledger.
 */
public final class SourceSetIds {
  private SourceSetIds() {}

  public static byte[] of(Collection<String> sourceIds) {
    List<String> sorted = new ArrayList<>(sourceIds);
    sorted.sort(null);
    return Hashing.sha256(String.join(",", sorted));
  }
}
