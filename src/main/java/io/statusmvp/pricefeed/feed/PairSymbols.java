package io.statusmvp.pricefeed.feed;

import java.util.List;
import java.util.Locale;

/** Symbol normalisation for feed ids ({@code btc/usd} -> {@code BTC-USD}). */
public final class PairSymbols {
  private PairSymbols() {}

  // Longest first so "USDT" wins over "USD".
  private static final List<String> KNOWN_QUOTES = List.of("USDT", "USDC", "USD", "EUR", "BTC", "ETH");

  public static String normalize(String raw) {
    if (raw == null) return "";
    return raw.trim().toUpperCase(Locale.ROOT).replace('/', '-').replace('_', '-');
  }

  /** Splits a normalised id into {base, quote}; either part may be empty when undecidable. */
  public static String[] baseQuote(String normalized) {
    if (normalized == null || normalized.isBlank()) return new String[] {"", ""};
    int dash = normalized.indexOf('-');
    if (dash > 0) {
      return new String[] {normalized.substring(0, dash), normalized.substring(dash + 1)};
    }
    for (String q : KNOWN_QUOTES) {
      if (normalized.length() > q.length() && normalized.endsWith(q)) {
        return new String[] {normalized.substring(0, normalized.length() - q.length()), q};
      }
    }
    return new String[] {normalized, ""};
  }
}
